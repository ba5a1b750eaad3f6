package com.dataflowscope.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void list_operators_printsEverySection() {
        CliTestSupport.Result result = CliTestSupport.run("list", "operators");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("Networking Operators (15):")
            .contains("Core Dataflow Operators")
            .contains("Sink Operators (5):")
            .contains("Collection Types:")
            .contains("send_bincode")
            .contains("KeyedSingleton<");
    }

    @Test
    void list_operatorsWithConfig_usesConfiguredLists() throws IOException {
        Path config = tempDir.resolve("dataflowscope.yaml");
        Files.writeString(config, """
            operators:
              networkingOperators: [send_custom]
            """);

        CliTestSupport.Result result = CliTestSupport.run("list", "operators", "-c", config.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("Networking Operators (1):")
            .contains("send_custom")
            .doesNotContain("recv_bincode");
    }

    @Test
    void list_nodeTypes_marksDefault() {
        CliTestSupport.Result result = CliTestSupport.run("list", "node-types");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("Node Types:")
            .contains("Aggregation")
            .containsPattern("Transform\\s+color 6 \\(default\\)");
    }

    @Test
    void list_unknownType_returnsUsageError() {
        CliTestSupport.Result result = CliTestSupport.run("list", "widgets");

        assertThat(result.exitCode()).isEqualTo(2);
        assertThat(result.err()).contains("Unknown type: widgets");
    }
}
