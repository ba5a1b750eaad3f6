package com.dataflowscope.cli;

import com.dataflowscope.core.graph.GraphValidator;
import com.dataflowscope.core.model.DataflowGraph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate a dataflow graph JSON file.
 *
 * <p>Exits with 0 when the graph is well-formed and 1 when it has issues or cannot be read.
 */
@Command(
    name = "validate",
    description = "Validate a dataflow graph JSON file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Graph JSON file to validate")
    private Path graphFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(graphFile)) {
            log.error("Graph file not found: {}", graphFile);
            err.println("✗ Graph file not found: " + graphFile);
            return 1;
        }

        DataflowGraph graph;
        try {
            graph = JsonFiles.read(graphFile, DataflowGraph.class);
        } catch (IOException e) {
            log.error("Failed to read graph file: {}", graphFile, e);
            err.println("✗ Cannot read graph: " + e.getMessage());
            return 1;
        }

        log.info("Validating graph: {}", graphFile);
        List<String> issues = new GraphValidator().validate(graph);
        if (issues.isEmpty()) {
            out.printf("✓ Graph is valid (%d nodes, %d edges, %d hierarchies)%n",
                graph.nodes().size(), graph.edges().size(), graph.hierarchyChoices().size());
            out.flush();
            return 0;
        }

        out.printf("✗ Found %d issue(s):%n", issues.size());
        issues.forEach(issue -> out.println("  - " + issue));
        out.flush();
        return 1;
    }
}
