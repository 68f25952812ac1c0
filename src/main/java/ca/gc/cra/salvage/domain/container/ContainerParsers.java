package ca.gc.cra.salvage.domain.container;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Static registry selecting the parser for an artifact's format.
 *
 * @since 0.1.0
 */
public final class ContainerParsers {
  private static final ContainerParser JPEG = new JpegSegmentParser();
  private static final ContainerParser PNG = new PngChunkParser();

  private ContainerParsers() {}

  /**
   * Returns the parser for {@code format}.
   *
   * @param format container format
   * @return parser, or empty for {@link ImageFormat#UNKNOWN}
   */
  public static Optional<ContainerParser> forFormat(ImageFormat format) {
    return switch (Objects.requireNonNull(format, "format")) {
      case JPEG -> Optional.of(JPEG);
      case PNG -> Optional.of(PNG);
      case UNKNOWN -> Optional.empty();
    };
  }

  /**
   * Parses an artifact with the parser for its format.
   *
   * @param artifact artifact to walk
   * @return structural facts
   * @throws MalformedContainerException when the format is unknown or no start marker exists
   */
  public static ContainerStructure parse(ImageArtifact artifact) throws MalformedContainerException {
    Objects.requireNonNull(artifact, "artifact");
    Optional<ContainerParser> parser = forFormat(artifact.format());
    if (parser.isEmpty()) {
      throw new MalformedContainerException(ImageFormat.UNKNOWN, 0, "no supported container signature");
    }
    return parser.get().parse(artifact.content());
  }
}
