package io.opgraph.server.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opgraph.core.OpgraphEnvironment;
import io.opgraph.core.OpgraphFactory;
import io.opgraph.core.workflow.node.Node;
import io.opgraph.core.workflow.node.NodeType;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ServerConfigurationTest {

    private final ServerConfiguration configuration = new ServerConfiguration();

    @Test
    void shouldProduceMapperWithNodeWireFormat() throws Exception {
        ObjectMapper mapper = configuration.objectMapper();
        Node node =
                Node.builder()
                        .workflowId("wf-1")
                        .uuid("n-1")
                        .position(1)
                        .alias("open_inbox")
                        .type(NodeType.ACTION)
                        .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                        .build();

        String json = mapper.writeValueAsString(node);

        assertThat(mapper.readTree(json).get("type").asText()).isEqualTo("action");
        assertThat(mapper.readTree(json).get("createdAt").asText())
                .isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void shouldExposeGraphServiceOfEnvironment() {
        try (OpgraphEnvironment env = OpgraphFactory.createEnvironment()) {
            assertThat(configuration.workflowGraphService(env)).isSameAs(env.getGraphService());
        }
    }
}
