package ca.gc.cra.salvage.application.port;

import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads reports written by an earlier stage so stages can run as separate commands.
 *
 * @since 0.1.0
 */
public interface ReportReaderPort {
  ClassificationReport readValidation(Path file) throws IOException;

  BatchDecision readDecision(Path file) throws IOException;
}
