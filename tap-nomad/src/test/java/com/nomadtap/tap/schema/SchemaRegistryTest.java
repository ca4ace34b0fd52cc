package com.nomadtap.tap.schema;

import com.nomadtap.tap.error.UnknownStreamException;
import com.nomadtap.tap.model.ReplicationMethod;
import com.nomadtap.tap.model.StreamDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaRegistryTest {

    private final SchemaRegistry registry = NomadStreams.registry();

    @Test
    void looksUpDefinitionsByName() {
        StreamDefinition nodes = registry.getDefinition("nodes");

        assertThat(nodes.replicationMethod()).isEqualTo(ReplicationMethod.FULL_TABLE);
        assertThat(nodes.path()).isEqualTo("/v1/nodes");
        assertThat(nodes.primaryKeys()).containsExactly("ID");
    }

    @Test
    void unknownStreamFails() {
        assertThatThrownBy(() -> registry.getDefinition("evaluations"))
                .isInstanceOf(UnknownStreamException.class)
                .satisfies(e -> assertThat(((UnknownStreamException) e).getStreamName()).isEqualTo("evaluations"));
    }

    @Test
    void definitionsKeepDiscoveryOrder() {
        assertThat(registry.definitions()).extracting(StreamDefinition::name)
                .containsExactly("jobs", "allocations", "nodes", "deployments");
    }

    @Test
    void incrementalStreamsUseModifyIndex() {
        assertThat(registry.definitions()).filteredOn(StreamDefinition::isIncremental)
                .extracting(StreamDefinition::replicationKey)
                .containsOnly(NomadStreams.MODIFY_INDEX);
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> new SchemaRegistry(List.of(NomadStreams.JOBS, NomadStreams.JOBS)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jobs");
    }
}
