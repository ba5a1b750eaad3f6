package com.dataflowscope.cli;

import com.dataflowscope.core.config.ConfigLoader;
import com.dataflowscope.core.config.OperatorConfig;
import com.dataflowscope.core.model.NodeTypeConfig;
import com.dataflowscope.core.operator.OperatorRegistry;
import com.dataflowscope.core.pipeline.VisualizationMetadata;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list the operator catalogue or the node types.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List operators known to the registry
 * dataflow-scope list operators
 *
 * # List operators after applying a configuration file
 * dataflow-scope list operators -c dataflowscope.yaml
 *
 * # List node types and their palette index
 * dataflow-scope list node-types
 * }</pre>
 */
@Command(
    name = "list",
    description = "List operators or node types",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: operators or node-types"
    )
    private String type;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file overriding the built-in operator lists"
    )
    private Path configPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase(Locale.ROOT)) {
            case "operators", "operator" -> listOperators(out);
            case "node-types", "node-type", "nodetypes" -> listNodeTypes(out);
            default -> {
                log.error("Unknown type: {}. Use: operators or node-types", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: operators or node-types");
                yield 2;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listOperators(PrintWriter out) {
        OperatorRegistry registry = configPath == null
            ? OperatorRegistry.withDefaults()
            : new OperatorRegistry(ConfigLoader.load(configPath).operators());
        OperatorConfig config = registry.config();

        printSection(out, "Networking Operators", config.networkingOperators(), registry);
        printSection(out, "Core Dataflow Operators", config.coreDataflowOperators(), registry);
        printSection(out, "Sink Operators", config.sinkOperators(), registry);

        out.println("Collection Types:");
        config.collectionTypes().forEach(collection -> out.printf("  • %s%n", collection));
        return 0;
    }

    private static void printSection(PrintWriter out, String title, List<String> operators, OperatorRegistry registry) {
        out.printf("%s (%d):%n", title, operators.size());
        for (String operator : operators) {
            out.printf("  • %-32s %s%n", operator, registry.inferNodeType(operator).label());
        }
        out.println();
    }

    private int listNodeTypes(PrintWriter out) {
        NodeTypeConfig nodeTypes = VisualizationMetadata.nodeTypeConfig();
        out.println("Node Types:");
        for (NodeTypeConfig.TypeStyle style : nodeTypes.types()) {
            String marker = style.id().equals(nodeTypes.defaultType()) ? " (default)" : "";
            out.printf("  • %-12s color %d%s%n", style.label(), style.colorIndex(), marker);
        }
        return 0;
    }
}
