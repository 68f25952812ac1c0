package ca.gc.cra.salvage.infrastructure.persistence;

import ca.gc.cra.salvage.application.port.ArtifactRef;
import ca.gc.cra.salvage.application.port.ArtifactSourcePort;
import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.infrastructure.report.JsonSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArtifactSourcePort} over recovered files on disk.
 * <p><strong>Why:</strong> Recovery tools leave either a directory tree (one subdirectory per recovery method) or a
 * consolidation catalog describing where each file went.</p>
 * <p><strong>Thread-safety:</strong> {@link #read(ArtifactRef)} may be called concurrently; files are opened read-only
 * and never written.</p>
 *
 * @since 0.1.0
 */
public final class FileArtifactSource implements ArtifactSourcePort {
  private static final Logger log = LoggerFactory.getLogger(FileArtifactSource.class);

  private final Path root;
  private final Optional<Path> catalog;

  private FileArtifactSource(Path root, Optional<Path> catalog) {
    this.root = root;
    this.catalog = catalog;
  }

  /**
   * Walks {@code root} recursively. Ids are paths relative to {@code root} using {@code /}; the recovery method is the
   * first path element when the file sits in a subdirectory.
   *
   * @param root evidence directory
   * @return source over the directory
   */
  public static FileArtifactSource forDirectory(Path root) {
    return new FileArtifactSource(Objects.requireNonNull(root, "root"), Optional.empty());
  }

  /**
   * Reads a catalog of the form {@code {"files":[{"id","path","recoveryMethod","format"}]}}. Relative paths resolve
   * against the catalog's directory.
   *
   * @param catalogFile catalog JSON document
   * @return source over the catalogued files
   */
  public static FileArtifactSource forCatalog(Path catalogFile) {
    Objects.requireNonNull(catalogFile, "catalogFile");
    Path base = catalogFile.toAbsolutePath().getParent();
    return new FileArtifactSource(base, Optional.of(catalogFile));
  }

  /**
   * Reads artifacts only through the paths already recorded in a validation report; {@link #list()} is not
   * supported.
   *
   * @return source for re-reading previously classified artifacts
   */
  public static FileArtifactSource forRecordedPaths() {
    return new FileArtifactSource(null, Optional.empty());
  }

  @Override
  public List<ArtifactRef> list() throws IOException {
    if (root == null) {
      throw new IOException("no evidence location configured; artifacts are read from recorded paths only");
    }
    List<ArtifactRef> refs = catalog.isPresent() ? listCatalog(catalog.get()) : listDirectory();
    log.info("Found {} artifacts under {}", refs.size(), catalog.orElse(root));
    return refs;
  }

  @Override
  public ImageArtifact read(ArtifactRef ref) throws IOException {
    Objects.requireNonNull(ref, "ref");
    byte[] bytes = Files.readAllBytes(ref.path());
    ImageFormat detected = ImageFormat.detect(bytes, ref.path().getFileName().toString());
    ImageFormat format = detected == ImageFormat.UNKNOWN ? ref.declaredFormat().orElse(detected) : detected;
    return new ImageArtifact(ref.id(), bytes, ref.path().toString(), ref.recoveryMethod(), format);
  }

  private List<ArtifactRef> listDirectory() throws IOException {
    List<ArtifactRef> refs = new ArrayList<>();
    try (Stream<Path> files = Files.walk(root)) {
      files.filter(Files::isRegularFile)
          .filter(path -> !isHidden(root.relativize(path)))
          .sorted()
          .forEach(path -> refs.add(toRef(root.relativize(path), path)));
    }
    refs.sort(Comparator.comparing(ArtifactRef::id));
    return refs;
  }

  private static ArtifactRef toRef(Path relative, Path absolute) {
    String id = relative.toString().replace('\\', '/');
    String method = relative.getNameCount() > 1 ? relative.getName(0).toString() : "unknown";
    return new ArtifactRef(id, absolute, method, Optional.empty());
  }

  private static boolean isHidden(Path relative) {
    for (Path element : relative) {
      if (element.toString().startsWith(".")) {
        return true;
      }
    }
    return false;
  }

  private List<ArtifactRef> listCatalog(Path catalogFile) throws IOException {
    Object parsed;
    try {
      parsed = new JsonSupport().parse(catalogFile);
    } catch (IllegalArgumentException ex) {
      throw new IOException("catalog " + catalogFile + " is not valid JSON: " + ex.getMessage(), ex);
    }
    if (!(parsed instanceof Map<?, ?> document) || !(document.get("files") instanceof List<?> files)) {
      throw new IOException("catalog " + catalogFile + " has no \"files\" array");
    }
    List<ArtifactRef> refs = new ArrayList<>(files.size());
    Set<String> seen = new HashSet<>();
    int index = 0;
    for (Object item : files) {
      index++;
      if (!(item instanceof Map<?, ?> entry)) {
        throw new IOException("catalog entry " + index + " is not an object");
      }
      String rawPath = firstString(entry, "path", "consolidated_path", "consolidatedPath");
      if (rawPath == null) {
        throw new IOException("catalog entry " + index + " has no path");
      }
      Path path = root.resolve(rawPath).normalize();
      String id = Objects.requireNonNullElse(firstString(entry, "id", "filename"), rawPath.replace('\\', '/'));
      if (!seen.add(id)) {
        throw new IOException("catalog lists id " + id + " more than once");
      }
      String method = firstString(entry, "recoveryMethod", "recovery_method");
      String format = firstString(entry, "format", "extension");
      Optional<ImageFormat> declared = format == null
          ? Optional.empty()
          : Optional.of(ImageFormat.fromReportName(format.startsWith(".") ? format.substring(1) : format))
              .filter(f -> f != ImageFormat.UNKNOWN);
      refs.add(new ArtifactRef(id, path, method, declared));
    }
    refs.sort(Comparator.comparing(ArtifactRef::id));
    return refs;
  }

  private static String firstString(Map<?, ?> entry, String... keys) {
    for (String key : keys) {
      Object value = entry.get(key);
      if (value != null && !value.toString().isBlank()) {
        return value.toString().trim();
      }
    }
    return null;
  }
}
