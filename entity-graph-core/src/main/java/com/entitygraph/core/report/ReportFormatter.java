package com.entitygraph.core.report;

import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.RepairResult;

/**
 * Interface for formatters that turn integrity, drift and repair results into text.
 *
 * <p>Formatters are discovered via Java Service Provider Interface (SPI); see
 * {@link ReportFormatters} for lookup by id.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.entitygraph.core.report.ReportFormatter}
 */
public interface ReportFormatter {

    /**
     * Returns unique identifier for this formatter.
     *
     * <p>Used by the {@code --format} option of the command-line tool. Should be lowercase
     * (e.g., "text", "json").
     *
     * @return unique formatter identifier
     */
    String getId();

    String format(IntegrityReport report);

    String format(DriftResult drift);

    String format(RepairResult result);
}
