package com.entitygraph.core.report.impl;

import com.entitygraph.core.model.AppliedRepair;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.IntegrityViolation;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.model.Severity;
import com.entitygraph.core.model.ViolationStats;
import com.entitygraph.core.report.ReportFormatter;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human readable summaries. Integrity violations are grouped by severity, most severe first.
 *
 * <p><b>Example output:</b>
 * <pre>
 * Integrity: INVALID
 * Entities: posts=2, users=1 (3 total) checked in 0.42 ms
 * Violations: 1 (1 errors, 0 warnings, 0 info)
 *
 * ERROR
 *   [referential] posts/p1 author: Missing referenced users with ID "u9" (repair: delete)
 * </pre>
 */
public class TextReportFormatter implements ReportFormatter {

    private static final String INDENT = "  ";

    @Override
    public String getId() {
        return "text";
    }

    @Override
    public String format(IntegrityReport report) {
        StringBuilder out = new StringBuilder();
        ViolationStats stats = report.stats();
        int total = report.entityCounts().values().stream().mapToInt(Integer::intValue).sum();

        out.append("Integrity: ").append(report.valid() ? "VALID" : "INVALID").append('\n');
        out.append("Entities: ").append(counts(report.entityCounts()))
            .append(" (").append(total).append(" total)")
            .append(String.format(Locale.ROOT, " checked in %.2f ms", report.duration()))
            .append('\n');
        out.append("Violations: ").append(stats.total())
            .append(" (").append(stats.errors()).append(" errors, ")
            .append(stats.warnings()).append(" warnings, ")
            .append(stats.info()).append(" info)")
            .append('\n');

        for (Severity severity : Severity.values()) {
            List<IntegrityViolation> group = report.violationsWithSeverity(severity);
            if (group.isEmpty()) {
                continue;
            }
            out.append('\n').append(severity.name()).append('\n');
            group.forEach(violation -> out.append(INDENT).append(line(violation)).append('\n'));
        }
        return out.toString();
    }

    @Override
    public String format(DriftResult drift) {
        StringBuilder out = new StringBuilder();
        out.append("Drift: ").append(drift.hasDrift() ? "DETECTED" : "NONE").append('\n');
        out.append("Baseline: ").append(counts(drift.snapshots().source().entityCounts())).append('\n');
        out.append("Current: ").append(counts(drift.snapshots().target().entityCounts())).append('\n');
        out.append("Total changes: ").append(drift.totalChanges()).append('\n');
        drift.changes().added().forEach((type, count) ->
            out.append(INDENT).append("+ ").append(type).append(": ").append(count).append('\n'));
        drift.changes().removed().forEach((type, count) ->
            out.append(INDENT).append("- ").append(type).append(": ").append(count).append('\n'));
        drift.changes().modified().forEach((type, count) ->
            out.append(INDENT).append("~ ").append(type).append(": ").append(count).append('\n'));
        if (drift.hasDrift() && drift.totalChanges() == 0) {
            out.append(INDENT).append("ids changed, counts unchanged").append('\n');
        }
        return out.toString();
    }

    @Override
    public String format(RepairResult result) {
        StringBuilder out = new StringBuilder();
        long failed = result.repairs().stream().filter(repair -> !repair.success()).count();
        out.append("Repairs: ").append(result.repairs().size())
            .append(" (").append(failed).append(" failed)").append('\n');
        for (AppliedRepair repair : result.repairs()) {
            out.append(INDENT).append(repair.success() ? "ok     " : "failed ")
                .append(repair.action()).append(' ')
                .append(target(repair.violation())).append('\n');
        }
        out.append("Remaining: ").append(result.remaining().size()).append('\n');
        result.remaining().forEach(violation -> out.append(INDENT).append(line(violation)).append('\n'));
        return out.toString();
    }

    private static String line(IntegrityViolation violation) {
        StringBuilder line = new StringBuilder()
            .append('[').append(violation.type().name().toLowerCase(Locale.ROOT)).append("] ")
            .append(target(violation));
        if (violation.field() != null) {
            line.append(' ').append(violation.field());
        }
        line.append(": ").append(violation.message());
        if (violation.repair() != null) {
            line.append(" (repair: ").append(violation.repair().action().wireName()).append(')');
        }
        return line.toString();
    }

    private static String target(IntegrityViolation violation) {
        return violation.entityId().isEmpty()
            ? violation.entityType()
            : violation.entityType() + "/" + violation.entityId();
    }

    private static String counts(Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return "none";
        }
        StringBuilder joined = new StringBuilder();
        counts.forEach((type, count) -> {
            if (joined.length() > 0) {
                joined.append(", ");
            }
            joined.append(type).append('=').append(count);
        });
        return joined.toString();
    }
}
