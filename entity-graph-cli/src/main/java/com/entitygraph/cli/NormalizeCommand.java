package com.entitygraph.cli;

import com.entitygraph.core.config.SchemaLoader;
import com.entitygraph.core.model.NormalizationResult;
import com.entitygraph.core.normalize.NormalizationException;
import com.entitygraph.core.normalize.Normalizer;
import com.entitygraph.core.schema.Schema;
import com.entitygraph.core.schema.SchemaRegistry;
import com.entitygraph.core.schema.SchemaRegistryException;
import com.entitygraph.core.schema.Schemas;
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
 * Command to flatten a nested JSON document into a store.
 *
 * <p>Without {@code --output} the normalization result (skeleton and entities) is printed.
 * With it, the entities are written as a store file and only the skeleton is printed.
 */
@Command(
    name = "normalize",
    description = "Normalize a nested JSON document into a flat entity store",
    mixinStandardHelpOptions = true
)
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(NormalizeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Input document (JSON)")
    private Path inputFile;

    @Option(names = {"-s", "--schemas"}, description = "Schema file (YAML or JSON)", required = true)
    private Path schemaFile;

    @Option(names = {"-r", "--root"}, description = "Schema of the document root", required = true)
    private String rootSchema;

    @Option(names = {"--array"}, description = "The document is a list of root entities")
    private boolean array;

    @Option(names = {"-o", "--output"}, description = "Write the entities to this store file")
    private Path outputFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SchemaRegistry registry = SchemaLoader.load(schemaFile);
            Schema root = registry.get(rootSchema);
            Schema schema = array ? Schemas.array(root) : root;

            NormalizationResult result = Normalizer.normalize(CliSupport.readDocument(inputFile), schema);
            log.info("Normalized {} entities of {} type(s)",
                result.entities().totalCount(), result.entities().typeNames().size());

            if (outputFile == null) {
                out.println(CliSupport.toJson(result));
                return CliSupport.EXIT_OK;
            }
            CliSupport.writeJson(result.entities(), outputFile);
            out.println(CliSupport.toJson(result.result()));
            out.println("✓ Wrote " + result.entities().totalCount() + " entities to " + outputFile);
            return CliSupport.EXIT_OK;
        } catch (NormalizationException e) {
            log.debug("Normalization failed", e);
            err.println("✗ Normalization failed: " + e.getMessage());
            return CliSupport.EXIT_FAILED;
        } catch (IOException | SchemaRegistryException e) {
            log.error("Normalize failed", e);
            err.println("✗ Normalize failed: " + e.getMessage());
            return CliSupport.EXIT_ERROR;
        }
    }
}
