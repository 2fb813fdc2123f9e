package com.entitygraph.cli;

import com.entitygraph.core.config.ConfigLoader;
import com.entitygraph.core.config.EntityGraphConfig;
import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.RepairOptions;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.monitor.ConsistencyMonitor;
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
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to check a store's integrity and optionally repair it.
 *
 * <p>Types to check, relations and rules come from the configuration file. When the
 * configuration names no types, every type in the store is checked.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Check, exit code 1 if the store is invalid
 * entitygraph check store.json -c entitygraph.yaml
 *
 * # Preview repairs without writing anything
 * entitygraph check store.json --repair --dry-run
 *
 * # Repair errors only and write the repaired store
 * entitygraph check store.json --repair --errors-only -o repaired.json
 * }</pre>
 */
@Command(
    name = "check",
    description = "Check a store's referential integrity, constraints and anomalies",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Store file (JSON)")
    private Path storeFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: entitygraph.yaml)")
    private Path configFile = Paths.get("entitygraph.yaml");

    @Option(names = {"-f", "--format"}, description = "Output format: text or json (default: text)")
    private String format = "text";

    @Option(names = {"--repair"}, description = "Apply suggested repairs")
    private boolean repair;

    @Option(names = {"--dry-run"}, description = "Report repairs without applying them")
    private boolean dryRun;

    @Option(names = {"--errors-only"}, description = "Repair error-severity violations only")
    private boolean errorsOnly;

    @Option(names = {"-o", "--output"}, description = "Write the repaired store to this file")
    private Path outputFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ReportFormatter formatter = CliSupport.formatter(format);
            NormalizedEntities store = CliSupport.readStore(storeFile);
            EntityGraphConfig config = ConfigLoader.load(configFile);

            IntegrityChecker checker = IntegrityChecker.create(
                config.integrity().withDefaultEntities(store.typeNames()).toCheckerConfig());
            ConsistencyMonitor monitor = ConsistencyMonitor.create(
                config.monitor().toMonitorConfig(checker).autoRepair(false).build());

            try {
                log.info("Checking store: {}", storeFile);
                IntegrityReport report = monitor.check(store);
                out.print(formatter.format(report));

                if (!repair) {
                    return report.valid() ? CliSupport.EXIT_OK : CliSupport.EXIT_FAILED;
                }

                RepairOptions options = RepairOptions.builder()
                    .dryRun(dryRun)
                    .errorsOnly(errorsOnly)
                    .build();
                RepairResult result = monitor.repair(store, options);
                out.println();
                out.print(formatter.format(result));

                if (dryRun) {
                    return report.valid() ? CliSupport.EXIT_OK : CliSupport.EXIT_FAILED;
                }
                if (outputFile != null) {
                    CliSupport.writeJson(result.entities(), outputFile);
                    log.info("Wrote repaired store to: {}", outputFile);
                }
                IntegrityReport after = checker.check(result.entities());
                out.println();
                out.println("After repair: " + (after.valid() ? "VALID" : "INVALID"));
                return after.valid() ? CliSupport.EXIT_OK : CliSupport.EXIT_FAILED;
            } finally {
                monitor.dispose();
            }
        } catch (IOException | IllegalArgumentException e) {
            log.error("Check failed", e);
            err.println("✗ Check failed: " + e.getMessage());
            return CliSupport.EXIT_ERROR;
        }
    }
}
