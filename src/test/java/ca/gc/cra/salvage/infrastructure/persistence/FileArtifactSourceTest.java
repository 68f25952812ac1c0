package ca.gc.cra.salvage.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.salvage.application.port.ArtifactRef;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.fixtures.ImageFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileArtifactSourceTest {
  @TempDir Path tempDir;

  @Test
  void directoryWalkUsesRelativeIdsAndTopLevelMethod() throws IOException {
    write(tempDir.resolve("photorec/recup_dir.1/f0001.jpg"), ImageFixtures.jpeg());
    write(tempDir.resolve("foremost/png/00000012.png"), ImageFixtures.png());
    write(tempDir.resolve("loose.jpg"), ImageFixtures.jpeg());
    write(tempDir.resolve(".cache/thumb.jpg"), ImageFixtures.jpeg());
    write(tempDir.resolve("photorec/.DS_Store"), new byte[] {1, 2, 3});

    List<ArtifactRef> refs = FileArtifactSource.forDirectory(tempDir).list();

    assertEquals(3, refs.size());
    assertEquals("foremost/png/00000012.png", refs.get(0).id());
    assertEquals("foremost", refs.get(0).recoveryMethod());
    assertEquals("loose.jpg", refs.get(1).id());
    assertEquals("unknown", refs.get(1).recoveryMethod());
    assertEquals("photorec/recup_dir.1/f0001.jpg", refs.get(2).id());
    assertEquals("photorec", refs.get(2).recoveryMethod());
  }

  @Test
  void readDetectsFormatFromContent() throws IOException {
    byte[] png = ImageFixtures.png();
    Path file = write(tempDir.resolve("scalpel/misnamed.jpg"), png);
    FileArtifactSource source = FileArtifactSource.forDirectory(tempDir);

    ImageArtifact artifact = source.read(source.list().get(0));

    assertEquals("scalpel/misnamed.jpg", artifact.id());
    assertEquals(ImageFormat.PNG, artifact.format());
    assertEquals("scalpel", artifact.recoveryMethod());
    assertEquals(file.toString(), artifact.sourcePath());
    assertArrayEquals(png, artifact.content());
  }

  @Test
  void readFallsBackToDeclaredFormatWhenContentIsUnrecognised() throws IOException {
    Path file = write(tempDir.resolve("blob.bin"), "no magic here".getBytes(StandardCharsets.US_ASCII));
    ArtifactRef ref = new ArtifactRef("blob", file, "photorec", Optional.of(ImageFormat.JPEG));

    ImageArtifact artifact = FileArtifactSource.forRecordedPaths().read(ref);

    assertEquals(ImageFormat.JPEG, artifact.format());
  }

  @Test
  void catalogAcceptsAlternateKeysAndResolvesRelativePaths() throws IOException {
    write(tempDir.resolve("consolidated/a.jpg"), ImageFixtures.jpeg());
    write(tempDir.resolve("consolidated/b.png"), ImageFixtures.png());
    Path catalog = tempDir.resolve("catalog.json");
    Files.writeString(catalog, """
        {"files": [
          {"filename": "b.png", "consolidated_path": "consolidated/b.png",
           "recovery_method": "foremost", "extension": ".png"},
          {"id": "a", "path": "consolidated/a.jpg", "recoveryMethod": "photorec", "format": "jpeg"}
        ]}
        """);

    List<ArtifactRef> refs = FileArtifactSource.forCatalog(catalog).list();

    assertEquals(2, refs.size());
    ArtifactRef first = refs.get(0);
    assertEquals("a", first.id());
    assertEquals("photorec", first.recoveryMethod());
    assertEquals(Optional.of(ImageFormat.JPEG), first.declaredFormat());
    assertEquals(tempDir.resolve("consolidated/a.jpg").toAbsolutePath().normalize(), first.path());
    ArtifactRef second = refs.get(1);
    assertEquals("b.png", second.id());
    assertEquals("foremost", second.recoveryMethod());
    assertEquals(Optional.of(ImageFormat.PNG), second.declaredFormat());
  }

  @Test
  void catalogEntryWithoutMethodDefaultsToUnknown() throws IOException {
    Path catalog = tempDir.resolve("catalog.json");
    Files.writeString(catalog, "{\"files\":[{\"path\":\"x/y.jpg\"}]}");

    ArtifactRef ref = FileArtifactSource.forCatalog(catalog).list().get(0);

    assertEquals("x/y.jpg", ref.id());
    assertEquals("unknown", ref.recoveryMethod());
    assertTrue(ref.declaredFormat().isEmpty());
  }

  @Test
  void catalogRejectsDuplicateIdsAndMissingPaths() throws IOException {
    Path duplicate = tempDir.resolve("dup.json");
    Files.writeString(duplicate, "{\"files\":[{\"id\":\"a\",\"path\":\"1.jpg\"},{\"id\":\"a\",\"path\":\"2.jpg\"}]}");
    IOException dup = assertThrows(IOException.class, () -> FileArtifactSource.forCatalog(duplicate).list());
    assertTrue(dup.getMessage().contains("more than once"));

    Path missing = tempDir.resolve("missing.json");
    Files.writeString(missing, "{\"files\":[{\"id\":\"a\"}]}");
    IOException noPath = assertThrows(IOException.class, () -> FileArtifactSource.forCatalog(missing).list());
    assertTrue(noPath.getMessage().contains("has no path"));
  }

  @Test
  void catalogWithoutFilesArrayIsRejected() throws IOException {
    Path catalog = tempDir.resolve("catalog.json");
    Files.writeString(catalog, "{\"artifacts\":[]}");

    assertThrows(IOException.class, () -> FileArtifactSource.forCatalog(catalog).list());
  }

  @Test
  void recordedPathSourceCannotList() {
    assertThrows(IOException.class, () -> FileArtifactSource.forRecordedPaths().list());
  }

  private static Path write(Path file, byte[] bytes) throws IOException {
    Files.createDirectories(file.getParent());
    Files.write(file, bytes);
    return file;
  }
}
