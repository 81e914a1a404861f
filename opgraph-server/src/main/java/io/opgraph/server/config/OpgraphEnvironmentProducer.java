package io.opgraph.server.config;

import io.opgraph.core.OpgraphConfig;
import io.opgraph.core.OpgraphEnvironment;
import io.opgraph.core.OpgraphFactory;
import io.opgraph.core.execution.NodeActionExecutor;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.time.Duration;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the opgraph runtime environment.
///
/// Wires the engine through {@link OpgraphFactory}. Settings are read from MicroProfile
/// Config, so each key can be overridden by an environment variable (`OPGRAPH_HISTORY_CAPACITY`
/// for `opgraph.history.capacity`).
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `opgraph.history.capacity` | int | `1000` | Mutation history entries kept per workflow |
/// | `opgraph.history.read-limit` | int | `50` | Entries returned when no limit is given |
/// | `opgraph.iteration.parallelism` | int | `1` | Loop iterations run concurrently |
/// | `opgraph.retry.attempts` | int | `1` | Driver attempts per body node |
/// | `opgraph.retry.backoff` | Duration | `PT0.2S` | Delay before the first retry |
/// | `opgraph.retry.multiplier` | double | `2.0` | Backoff growth per retry |
/// | `opgraph.renumber.update-attempts` | int | `3` | Store write attempts during renumbering |
///
/// A CDI bean implementing {@link NodeActionExecutor} replaces the logging-only driver.
///
/// @implNote Application-scoped singleton. The environment's thread pool is shut down when
/// the container stops.
@ApplicationScoped
public class OpgraphEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(OpgraphEnvironmentProducer.class);

    private OpgraphEnvironment environment;

    @Inject Config config;

    @Inject Instance<NodeActionExecutor> actionExecutors;

    /// Produces the engine environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public OpgraphEnvironment opgraphEnvironment() {
        OpgraphConfig engineConfig = readConfig(config);
        OpgraphFactory.Builder builder = OpgraphFactory.builder().config(engineConfig);

        if (actionExecutors.isResolvable()) {
            builder.actionExecutor(actionExecutors.get());
            LOG.info("Using CDI-provided NodeActionExecutor");
        } else {
            LOG.info("No NodeActionExecutor bean found; loop bodies are logged only");
        }

        environment = builder.build();
        LOG.infov(
                "Configured OpgraphEnvironment: parallelism={0}, retryAttempts={1}",
                engineConfig.getIterationParallelism(),
                engineConfig.getRetryAttempts());
        return environment;
    }

    @PreDestroy
    void shutdown() {
        if (environment != null) {
            environment.close();
        }
    }

    /// Maps `opgraph.*` keys onto the engine configuration, keeping defaults for absent keys.
    ///
    /// @param config MicroProfile config source, not null
    /// @return engine configuration, never null
    static OpgraphConfig readConfig(Config config) {
        OpgraphConfig defaults = new OpgraphConfig();
        return OpgraphConfig.builder()
                .historyCapacity(
                        config.getOptionalValue("opgraph.history.capacity", Integer.class)
                                .orElse(defaults.getHistoryCapacity()))
                .historyReadLimit(
                        config.getOptionalValue("opgraph.history.read-limit", Integer.class)
                                .orElse(defaults.getHistoryReadLimit()))
                .iterationParallelism(
                        config.getOptionalValue("opgraph.iteration.parallelism", Integer.class)
                                .orElse(defaults.getIterationParallelism()))
                .retryAttempts(
                        config.getOptionalValue("opgraph.retry.attempts", Integer.class)
                                .orElse(defaults.getRetryAttempts()))
                .retryBackoff(
                        config.getOptionalValue("opgraph.retry.backoff", Duration.class)
                                .orElse(defaults.getRetryBackoff()))
                .retryMultiplier(
                        config.getOptionalValue("opgraph.retry.multiplier", Double.class)
                                .orElse(defaults.getRetryMultiplier()))
                .renumberUpdateAttempts(
                        config.getOptionalValue("opgraph.renumber.update-attempts", Integer.class)
                                .orElse(defaults.getRenumberUpdateAttempts()))
                .build();
    }
}
