package com.dataflowscope.core.operator;

import com.dataflowscope.core.config.OperatorConfig;
import com.dataflowscope.core.model.NodeType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OperatorRegistry}.
 */
class OperatorRegistryTest {

    private final OperatorRegistry registry = OperatorRegistry.withDefaults();

    @Test
    void isValidDataflowOperator_noType_usesNameMembership() {
        assertThat(registry.isValidDataflowOperator("map", null)).isTrue();
        assertThat(registry.isValidDataflowOperator("send_bincode", "")).isTrue();
        assertThat(registry.isValidDataflowOperator("clone_into", null)).isFalse();
    }

    @Test
    void isValidDataflowOperator_collectionReturnType_acceptsUnknownName() {
        assertThat(registry.isValidDataflowOperator("custom_op", "Stream<T, Process<'a, Leader>, Unbounded>"))
            .isTrue();
    }

    @Test
    void isValidDataflowOperator_unitReturnType_accepts() {
        assertThat(registry.isValidDataflowOperator("for_each", "()")).isTrue();
        assertThat(registry.isValidDataflowOperator("anything", "()")).isTrue();
    }

    @Test
    void isValidDataflowOperator_typeMentioningUnit_acceptsSinksOnly() {
        assertThat(registry.isValidDataflowOperator("dest_sink", "Result<(), Error>")).isTrue();
        assertThat(registry.isValidDataflowOperator("println", "Result<(), Error>")).isFalse();
    }

    @Test
    void isValidDataflowOperator_implIntoCollection_accepts() {
        assertThat(registry.isValidDataflowOperator("custom", "impl Into<Stream>")).isTrue();
    }

    @Test
    void isValidDataflowOperator_networkingWithLocationType_accepts() {
        assertThat(registry.isValidDataflowOperator("send_bincode", "Cluster<'a, Worker>")).isTrue();
    }

    @Test
    void isValidDataflowOperator_locationReturnType_rejectsEvenKnownNames() {
        assertThat(registry.isValidDataflowOperator("tick", "Tick<Process<'a, Leader>>")).isFalse();
        assertThat(registry.isValidDataflowOperator("atomic", "Atomic<Process<'a, Leader>>")).isFalse();
    }

    @Test
    void isValidDataflowOperator_otherType_fallsBackToMembership() {
        assertThat(registry.isValidDataflowOperator("map", "Vec<u8>")).isTrue();
        assertThat(registry.isValidDataflowOperator("len", "usize")).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        "source_iter, SOURCE",
        "recv_bincode, SOURCE",
        "for_each, SINK",
        "inspect, SINK",
        "join, JOIN",
        "cross_product, JOIN",
        "send_bincode, NETWORK",
        "fold_keyed, AGGREGATION",
        "sort, AGGREGATION",
        "tee, TEE",
        "persist, TEE",
        "map, TRANSFORM",
        "unknown_op, TRANSFORM"
    })
    void inferNodeType_mapsCategories(String operator, NodeType expected) {
        assertThat(registry.inferNodeType(operator)).isEqualTo(expected);
    }

    @Test
    void inferDefaultLocation_localEndpoints_defaultToProcess() {
        assertThat(registry.inferDefaultLocation("source_iter")).contains("Process");
        assertThat(registry.inferDefaultLocation("for_each")).contains("Process");
        assertThat(registry.inferDefaultLocation("send_bincode")).isEmpty();
        assertThat(registry.inferDefaultLocation("map")).isEmpty();
    }

    @Test
    void getLocationType_returnsConstructor() {
        assertThat(registry.getLocationType("Tick<Cluster<Worker>>")).contains("Cluster");
        assertThat(registry.getLocationType("Vec<u8>")).isEmpty();
    }

    @Test
    void constructor_customConfig_replacesConfiguredLists() {
        OperatorRegistry custom = new OperatorRegistry(
            new OperatorConfig(List.of("ship"), null, null, null));

        assertThat(custom.isNetworkingOperator("ship")).isTrue();
        assertThat(custom.isNetworkingOperator("send_bincode")).isFalse();
        assertThat(custom.isKnownDataflowOperator("map")).isTrue();
        assertThat(custom.isSinkOperator("for_each")).isTrue();
    }

    @Test
    void constructor_nullConfig_usesDefaults() {
        OperatorRegistry fromNull = new OperatorRegistry(null);

        assertThat(fromNull.config()).isEqualTo(OperatorConfig.DEFAULTS);
    }
}
