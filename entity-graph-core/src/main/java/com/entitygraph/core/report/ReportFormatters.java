package com.entitygraph.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of {@link ReportFormatter} implementations registered through {@link ServiceLoader}.
 */
public final class ReportFormatters {

    private static final Logger log = LoggerFactory.getLogger(ReportFormatters.class);

    private ReportFormatters() {
        // Utility class
    }

    /**
     * @return every registered formatter, in service file order
     */
    public static List<ReportFormatter> available() {
        log.debug("Discovering report formatters via ServiceLoader");
        List<ReportFormatter> formatters = new ArrayList<>();
        ServiceLoader.load(ReportFormatter.class).forEach(formatters::add);
        return formatters;
    }

    /**
     * @param id formatter id, case insensitive
     * @return matching formatter, if registered
     */
    public static Optional<ReportFormatter> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return available().stream()
            .filter(formatter -> formatter.getId().equalsIgnoreCase(id))
            .findFirst();
    }
}
