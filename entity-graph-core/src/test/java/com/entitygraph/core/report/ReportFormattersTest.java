package com.entitygraph.core.report;

import com.entitygraph.core.report.impl.JsonReportFormatter;
import com.entitygraph.core.report.impl.TextReportFormatter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ReportFormatters}.
 */
class ReportFormattersTest {

    @Test
    void available_includesBuiltInFormatters() {
        assertThat(ReportFormatters.available())
            .extracting(ReportFormatter::getId)
            .contains("text", "json");
    }

    @Test
    void find_isCaseInsensitive() {
        assertThat(ReportFormatters.find("JSON")).get().isInstanceOf(JsonReportFormatter.class);
        assertThat(ReportFormatters.find("text")).get().isInstanceOf(TextReportFormatter.class);
    }

    @Test
    void find_unknownOrNull_isEmpty() {
        assertThat(ReportFormatters.find("xml")).isEmpty();
        assertThat(ReportFormatters.find(null)).isEmpty();
    }
}
