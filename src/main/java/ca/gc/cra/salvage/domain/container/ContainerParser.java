package ca.gc.cra.salvage.domain.container;

import ca.gc.cra.salvage.domain.artifact.ImageFormat;

/**
 * Walks a binary image container into its structural units without touching pixel data.
 *
 * <p>Implementations are pure byte inspection: no external tools, no decode libraries, no I/O.</p>
 *
 * @since 0.1.0
 */
public interface ContainerParser {
  /**
   * Format handled by this parser.
   *
   * @return format
   */
  ImageFormat format();

  /**
   * Parses {@code data} into a {@link ContainerStructure}.
   *
   * @param data raw bytes; never {@code null}
   * @return structural facts, including truncation and inconsistencies
   * @throws MalformedContainerException when no start marker exists anywhere in the stream
   */
  ContainerStructure parse(byte[] data) throws MalformedContainerException;
}
