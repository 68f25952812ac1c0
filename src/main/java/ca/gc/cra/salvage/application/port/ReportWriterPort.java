package ca.gc.cra.salvage.application.port;

import ca.gc.cra.salvage.application.report.ClassificationReport;
import ca.gc.cra.salvage.application.report.RepairReport;
import ca.gc.cra.salvage.domain.decision.BatchDecision;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the three report documents.
 *
 * @since 0.1.0
 */
public interface ReportWriterPort {
  Path writeValidation(ClassificationReport report) throws IOException;

  Path writeDecision(BatchDecision decision, long decidedAtMillis) throws IOException;

  Path writeRepair(RepairReport report) throws IOException;
}
