package com.entitygraph.cli;

import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.IntegrityCheckerConfig;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.monitor.ConsistencyMonitor;
import com.entitygraph.core.monitor.ConsistencyMonitorConfig;
import com.entitygraph.core.report.ReportFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to compare a store against a baseline for CI/CD integration.
 *
 * <p>Exits with 1 when the set of ids differs, so a pipeline can fail on unexpected drift.
 */
@Command(
    name = "diff",
    description = "Compare a store against a baseline store",
    mixinStandardHelpOptions = true
)
public class DiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DiffCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Baseline store file (JSON)")
    private Path baselineFile;

    @Parameters(index = "1", description = "Current store file (JSON)")
    private Path currentFile;

    @Option(names = {"-f", "--format"}, description = "Output format: text or json (default: text)")
    private String format = "text";

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ReportFormatter formatter = CliSupport.formatter(format);
            NormalizedEntities baseline = CliSupport.readStore(baselineFile);
            NormalizedEntities current = CliSupport.readStore(currentFile);

            IntegrityChecker checker = IntegrityChecker.create(IntegrityCheckerConfig.builder().build());
            ConsistencyMonitor monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).build());
            try {
                log.info("Diff - baseline: {}, current: {}", baselineFile, currentFile);
                monitor.createSnapshot(baseline, baselineFile.getFileName().toString());
                DriftResult drift = monitor.detectDrift(current)
                    .orElseThrow(() -> new IllegalStateException("Baseline snapshot missing"));
                out.print(formatter.format(drift));
                return drift.hasDrift() ? CliSupport.EXIT_FAILED : CliSupport.EXIT_OK;
            } finally {
                monitor.dispose();
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("Diff failed", e);
            err.println("✗ Diff failed: " + e.getMessage());
            return CliSupport.EXIT_ERROR;
        }
    }
}
