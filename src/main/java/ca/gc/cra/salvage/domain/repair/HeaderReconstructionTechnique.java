package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.JpegMarkers;
import ca.gc.cra.salvage.domain.container.Segment;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Rebuilds the start of a container whose start marker is not at offset zero.
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>If the start marker lies within the search window, discard the bytes before it.</li>
 *   <li>Otherwise, or if that still fails the self-check, synthesize a header once. JPEG: start marker, a
 *       standard JFIF APP0, the consistent table and frame segments found before the scan, then everything from
 *       the scan header on. PNG: signature followed by everything from the first IHDR on.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 */
public final class HeaderReconstructionTechnique implements TechniqueHandler {
  private final int searchWindow;

  /**
   * Creates the technique.
   *
   * @param searchWindow how far into the stream a start marker may sit for the prefix to be discarded
   */
  public HeaderReconstructionTechnique(int searchWindow) {
    if (searchWindow < 0) {
      throw new IllegalArgumentException("searchWindow must be non-negative");
    }
    this.searchWindow = searchWindow;
  }

  @Override
  public RepairTechnique technique() {
    return RepairTechnique.HEADER_RECONSTRUCTION;
  }

  @Override
  public List<TechniqueResult> apply(ImageArtifact artifact, ContainerStructure structure) {
    ImageFormat format = artifact.format();
    byte[] data = artifact.content();
    List<TechniqueResult> steps = new ArrayList<>(2);

    int start = structure.startOffset();
    if (start > 0 && start <= searchWindow) {
      byte[] stripped = Arrays.copyOfRange(data, start, data.length);
      if (SelfCheck.isSound(format, stripped)) {
        steps.add(TechniqueResult.produced(stripped, "discarded " + start + " leading bytes"));
        return steps;
      }
      steps.add(TechniqueResult.failed("discarded " + start + " leading bytes but container is still unsound"));
    }

    Optional<byte[]> synthesized = format == ImageFormat.PNG
        ? synthesizePng(data, structure)
        : synthesizeJpeg(data, structure);
    if (synthesized.isEmpty()) {
      steps.add(TechniqueResult.failed("no image data to attach a synthesized header to"));
    } else if (SelfCheck.isSound(format, synthesized.get())) {
      steps.add(TechniqueResult.produced(synthesized.get(), "synthesized header"));
    } else {
      steps.add(TechniqueResult.failed("synthesized header but container is still unsound"));
    }
    return steps;
  }

  private static Optional<byte[]> synthesizeJpeg(byte[] data, ContainerStructure structure) {
    Optional<Segment> scan = structure.first("SOS");
    if (scan.isEmpty()) {
      return Optional.empty();
    }
    int scanOffset = scan.get().offset();
    ByteArrayOutputStream out = new ByteArrayOutputStream(data.length + JpegMarkers.JFIF_APP0.length);
    out.writeBytes(JpegMarkers.SOI_BYTES);
    out.writeBytes(JpegMarkers.JFIF_APP0);
    for (Segment segment : structure.segments()) {
      if (segment.offset() >= scanOffset) {
        break;
      }
      if (segment.consistent() && JpegMarkers.isHeaderTable(segment.kind())) {
        out.write(data, segment.offset(), segment.length());
      }
    }
    out.write(data, scanOffset, data.length - scanOffset);
    return Optional.of(out.toByteArray());
  }

  private static Optional<byte[]> synthesizePng(byte[] data, ContainerStructure structure) {
    Optional<Segment> header = structure.first("IHDR");
    if (header.isEmpty()) {
      return Optional.empty();
    }
    int from = header.get().offset();
    return Optional.of(SelfCheck.concat(ImageFormat.PNG.signature(), Arrays.copyOfRange(data, from, data.length)));
  }
}
