package com.entitygraph.core.report.impl;

import com.entitygraph.core.model.AppliedRepair;
import com.entitygraph.core.model.DriftChanges;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.EntityRef;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.IntegrityViolation;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.model.RepairSuggestion;
import com.entitygraph.core.model.Severity;
import com.entitygraph.core.model.StateSnapshot;
import com.entitygraph.core.model.ViolationType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TextReportFormatter}.
 */
class TextReportFormatterTest {

    private static final IntegrityViolation DANGLING = new IntegrityViolation(ViolationType.REFERENTIAL,
        Severity.ERROR, "posts", "p1", "Missing referenced users with ID \"u9\"", "author",
        new EntityRef("users", "u9"), RepairSuggestion.delete());
    private static final IntegrityViolation DUPLICATE = new IntegrityViolation(ViolationType.ANOMALY,
        Severity.WARNING, "posts", "p2", "[duplicate-posts] Duplicate detected", null, null, null);

    private final TextReportFormatter formatter = new TextReportFormatter();

    @Test
    void getId_returnsText() {
        assertThat(formatter.getId()).isEqualTo("text");
    }

    @Test
    void format_report_groupsViolationsBySeverity() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("users", 1);
        counts.put("posts", 2);
        IntegrityReport report = IntegrityReport.of(0L, 1.5, counts, List.of(DUPLICATE, DANGLING));

        String text = formatter.format(report);

        assertThat(text).startsWith("""
            Integrity: INVALID
            Entities: users=1, posts=2 (3 total) checked in 1.50 ms
            Violations: 2 (1 errors, 1 warnings, 0 info)
            """);
        assertThat(text).contains("  [referential] posts/p1 author: Missing referenced users with ID \"u9\" (repair: delete)");
        assertThat(text.indexOf("ERROR")).isLessThan(text.indexOf("WARNING"));
        assertThat(text).contains("  [anomaly] posts/p2: [duplicate-posts] Duplicate detected\n");
    }

    @Test
    void format_validReport_hasNoGroups() {
        String text = formatter.format(IntegrityReport.of(0L, 0.0, Map.of(), List.of()));

        assertThat(text).isEqualTo("""
            Integrity: VALID
            Entities: none (0 total) checked in 0.00 ms
            Violations: 0 (0 errors, 0 warnings, 0 info)
            """);
    }

    @Test
    void format_drift_listsChanges() {
        StateSnapshot source = new StateSnapshot("a", 0L, Map.of("users", 3), "h1", null, "baseline");
        StateSnapshot target = new StateSnapshot("b", 1L, Map.of("users", 2), "h2", null, null);
        DriftResult drift = new DriftResult(true, source, target,
            new DriftChanges(Map.of(), Map.of("users", 1), Map.of()), 1);

        assertThat(formatter.format(drift)).isEqualTo("""
            Drift: DETECTED
            Baseline: users=3
            Current: users=2
            Total changes: 1
              - users: 1
            """);
    }

    @Test
    void format_repair_listsOutcomes() {
        RepairResult result = new RepairResult(NormalizedEntities.empty(),
            List.of(new AppliedRepair(DANGLING, "delete", true)), List.of(DUPLICATE));

        assertThat(formatter.format(result)).isEqualTo("""
            Repairs: 1 (0 failed)
              ok     delete posts/p1
            Remaining: 1
              [anomaly] posts/p2: [duplicate-posts] Duplicate detected
            """);
    }
}
