package ca.gc.cra.salvage.domain.repair;

import ca.gc.cra.salvage.domain.artifact.ImageArtifact;
import ca.gc.cra.salvage.domain.artifact.ImageFormat;
import ca.gc.cra.salvage.domain.classify.RepairTechnique;
import ca.gc.cra.salvage.domain.container.ContainerStructure;
import ca.gc.cra.salvage.domain.container.JpegMarkers;
import ca.gc.cra.salvage.domain.container.PngChunkParser;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Restores a missing end marker.
 *
 * <p>JPEG: a lone trailing {@code 0xFF} is completed to {@code FF D9}, otherwise {@code FF D9} is appended. PNG: an
 * empty IEND chunk is appended. When the result still fails the structural self-check, the stream is cut back to
 * the last complete unit and the end marker is appended there.</p>
 */
public final class FooterAppendTechnique implements TechniqueHandler {

  @Override
  public RepairTechnique technique() {
    return RepairTechnique.FOOTER_APPEND;
  }

  @Override
  public List<TechniqueResult> apply(ImageArtifact artifact, ContainerStructure structure) {
    ImageFormat format = artifact.format();
    byte[] data = artifact.content();
    List<TechniqueResult> steps = new ArrayList<>(2);

    byte[] appended = appendEndMarker(format, data, structure.trailingPartialMarker());
    if (SelfCheck.isSound(format, appended)) {
      steps.add(TechniqueResult.produced(appended, "appended end marker"));
      return steps;
    }
    steps.add(TechniqueResult.failed("appended end marker but container is still incomplete"));

    int boundary = structure.lastMarkerBoundary();
    if (boundary <= 0 || boundary > data.length) {
      steps.add(TechniqueResult.failed("no complete unit to cut back to"));
      return steps;
    }
    byte[] truncated = appendEndMarker(format, Arrays.copyOf(data, boundary), false);
    if (SelfCheck.isSound(format, truncated)) {
      steps.add(TechniqueResult.produced(
          truncated, "cut back to offset " + boundary + " and appended end marker"));
    } else {
      steps.add(TechniqueResult.failed("cut back to offset " + boundary + " but container is still unsound"));
    }
    return steps;
  }

  private static byte[] appendEndMarker(ImageFormat format, byte[] data, boolean trailingPartialMarker) {
    if (format == ImageFormat.PNG) {
      return SelfCheck.concat(data, PngChunkParser.IEND_CHUNK);
    }
    if (trailingPartialMarker && data.length > 0 && (data[data.length - 1] & 0xFF) == 0xFF) {
      byte[] completed = Arrays.copyOf(data, data.length + 1);
      completed[data.length] = (byte) JpegMarkers.EOI;
      return completed;
    }
    return SelfCheck.concat(data, JpegMarkers.EOI_BYTES);
  }
}
