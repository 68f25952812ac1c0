package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.JpegMarkers;
import ca.gc.cra.salvage.domain.container.PngChunkParser;
import ca.gc.cra.salvage.domain.container.Segment;
import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Re-emits the container without its inconsistent units.
 *
 * <p>Consistent units are copied in order. Units on the critical allow-list are copied even when inconsistent, so a
 * damaged table or image chunk leaves the result unsound rather than silently dropping image data. Skipped bytes
 * ({@link Segment#UNPARSED}) are never copied.</p>
 */
public final class SegmentStrippingTechnique implements TechniqueHandler {

  @Override
  public RepairTechnique technique() {
    return RepairTechnique.SEGMENT_STRIPPING;
  }

  @Override
  public List<TechniqueResult> apply(ImageArtifact artifact, ContainerStructure structure) {
    ImageFormat format = artifact.format();
    List<Segment> segments = structure.segments();
    long dropped = segments.stream().filter(segment -> !kept(format, segment)).count();
    if (dropped == 0) {
      return List.of(TechniqueResult.failed("no removable inconsistent units"));
    }
    byte[] candidate = keptBytes(format, artifact.content(), segments);
    if (!SelfCheck.isSound(format, candidate)) {
      return List.of(TechniqueResult.failed(
          "removed " + dropped + " units but a critical unit is still inconsistent"));
    }
    return List.of(TechniqueResult.produced(candidate, "removed " + dropped + " inconsistent units"));
  }

  /**
   * Concatenates the kept units. A unit whose declared length runs past the start of the next unit is cut there,
   * so no byte is copied twice.
   */
  static byte[] keptBytes(ImageFormat format, byte[] data, List<Segment> segments) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      if (!kept(format, segment) || segment.offset() >= data.length) {
        continue;
      }
      int end = Math.min(segment.end(), data.length);
      if (i + 1 < segments.size()) {
        end = Math.min(end, Math.max(segment.offset(), segments.get(i + 1).offset()));
      }
      out.write(data, segment.offset(), end - segment.offset());
    }
    return out.toByteArray();
  }

  private static boolean kept(ImageFormat format, Segment segment) {
    return !segment.kind().equals(Segment.UNPARSED)
        && (segment.consistent() || isCritical(format, segment.kind()));
  }

  private static boolean isCritical(ImageFormat format, String kind) {
    return format == ImageFormat.PNG ? PngChunkParser.isCritical(kind) : JpegMarkers.isCritical(kind);
  }
}
