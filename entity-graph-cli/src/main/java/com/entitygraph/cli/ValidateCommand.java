package com.entitygraph.cli;

import com.entitygraph.core.config.SchemaLoader;
import com.entitygraph.core.schema.SchemaRegistry;
import com.entitygraph.core.schema.SchemaValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a schema file: every relation must resolve to a defined entity schema.
 */
@Command(
    name = "validate",
    description = "Validate a schema file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Schema file to validate (YAML or JSON)")
    private Path schemaFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            log.info("Validating schemas: {}", schemaFile);
            SchemaRegistry registry = SchemaLoader.load(schemaFile);
            SchemaValidationResult result = registry.validate();

            result.errors().forEach(issue -> out.println("✗ " + issue.schema() + ": " + issue.message()));
            result.warnings().forEach(issue -> out.println("! " + issue.schema() + ": " + issue.message()));

            if (result.valid()) {
                out.println("✓ " + registry.getNames().size() + " schema(s) valid");
                return CliSupport.EXIT_OK;
            }
            out.println("✗ " + result.errors().size() + " error(s) found");
            return CliSupport.EXIT_FAILED;
        } catch (IOException e) {
            log.error("Validate failed", e);
            err.println("✗ Validate failed: " + e.getMessage());
            return CliSupport.EXIT_ERROR;
        }
    }
}
