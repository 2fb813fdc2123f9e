package com.entitygraph.cli;

import com.entitygraph.core.config.ConfigLoader;
import com.entitygraph.core.config.EntityGraphConfig;
import com.entitygraph.core.config.SchemaLoader;
import com.entitygraph.core.denormalize.CachingDenormalizer;
import com.entitygraph.core.denormalize.DenormalizeOptions;
import com.entitygraph.core.model.CircularBehavior;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.schema.EntitySchema;
import com.entitygraph.core.schema.SchemaRegistry;
import com.entitygraph.core.schema.SchemaRegistryException;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to rebuild nested views of stored entities.
 *
 * <p>Options on the command line override the {@code denormalize} section of the
 * configuration file. Ids with no stored entity are reported and skipped; the exit code
 * is 1 when any was missing.
 */
@Command(
    name = "denormalize",
    description = "Rebuild nested views of entities from a store",
    mixinStandardHelpOptions = true
)
public class DenormalizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DenormalizeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Store file (JSON)")
    private Path storeFile;

    @Option(names = {"-s", "--schemas"}, description = "Schema file (YAML or JSON)", required = true)
    private Path schemaFile;

    @Option(names = {"-r", "--root"}, description = "Entity schema of the requested ids", required = true)
    private String rootSchema;

    @Option(names = {"--id"}, description = "Entity id (repeatable)", required = true, arity = "1..*")
    private List<String> ids;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: entitygraph.yaml)")
    private Path configFile = Paths.get("entitygraph.yaml");

    @Option(names = {"--max-depth"}, description = "Maximum nesting depth, negative for unbounded")
    private Integer maxDepth;

    @Option(names = {"--circular"}, description = "Cycle handling: skip, id-only or shallow")
    private String circular;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SchemaRegistry registry = SchemaLoader.load(schemaFile);
            EntitySchema schema = registry.getEntity(rootSchema);
            NormalizedEntities store = CliSupport.readStore(storeFile);
            EntityGraphConfig config = ConfigLoader.load(configFile);
            DenormalizeOptions options = options(config);
            CachingDenormalizer denormalizer = config.denormalize().toCachingDenormalizer(schema);

            List<Object> views = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            for (String id : ids) {
                if (store.contains(schema.name(), id)) {
                    views.add(denormalizer.denormalize(id, store, options));
                } else {
                    missing.add(id);
                }
            }
            missing.forEach(id -> err.println("✗ No " + schema.name() + " with id " + id));
            log.info("Denormalized {} of {} requested '{}' entities", views.size(), ids.size(), schema.name());

            out.println(CliSupport.toJson(views.size() == 1 && ids.size() == 1 ? views.get(0) : views));
            return missing.isEmpty() ? CliSupport.EXIT_OK : CliSupport.EXIT_FAILED;
        } catch (IOException | SchemaRegistryException | IllegalArgumentException e) {
            log.error("Denormalize failed", e);
            err.println("✗ Denormalize failed: " + e.getMessage());
            return CliSupport.EXIT_ERROR;
        }
    }

    private DenormalizeOptions options(EntityGraphConfig config) {
        DenormalizeOptions.Builder builder = config.denormalize().toOptions().toBuilder();
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (circular != null) {
            builder.circularBehavior(circularBehavior(circular));
        }
        return builder.build();
    }

    private static CircularBehavior circularBehavior(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "skip" -> CircularBehavior.SKIP;
            case "id-only" -> CircularBehavior.ID_ONLY;
            case "shallow" -> CircularBehavior.SHALLOW;
            default -> throw new IllegalArgumentException(
                "Unknown circular behavior '" + value + "'. Expected skip, id-only or shallow");
        };
    }
}
