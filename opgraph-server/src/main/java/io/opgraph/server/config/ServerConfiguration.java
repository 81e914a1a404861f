package io.opgraph.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opgraph.core.OpgraphEnvironment;
import io.opgraph.core.WorkflowGraphService;
import io.opgraph.serialization.GraphSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// The engine itself is produced by {@link OpgraphEnvironmentProducer}. This class exposes
/// the pieces resources inject directly and the JSON mapper REST responses are written with.
@ApplicationScoped
public class ServerConfiguration {

    /// Mapper used by the REST layer; knows the node and tree wire formats.
    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return GraphSerializer.createMapper();
    }

    /// @param env the initialized environment, not null
    /// @return the graph service, never null
    @Produces
    @Singleton
    public WorkflowGraphService workflowGraphService(OpgraphEnvironment env) {
        return env.getGraphService();
    }
}
