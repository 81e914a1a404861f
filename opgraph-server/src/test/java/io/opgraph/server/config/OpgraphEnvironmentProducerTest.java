package io.opgraph.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.opgraph.core.OpgraphConfig;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpgraphEnvironmentProducerTest {

    private Config config;

    @BeforeEach
    void setUp() {
        config = mock(Config.class);
        when(config.getOptionalValue(anyString(), any())).thenReturn(Optional.empty());
    }

    @Test
    void shouldKeepDefaultsWhenNothingIsConfigured() {
        OpgraphConfig result = OpgraphEnvironmentProducer.readConfig(config);
        OpgraphConfig defaults = new OpgraphConfig();

        assertThat(result.getHistoryCapacity()).isEqualTo(defaults.getHistoryCapacity());
        assertThat(result.getHistoryReadLimit()).isEqualTo(defaults.getHistoryReadLimit());
        assertThat(result.getIterationParallelism()).isEqualTo(1);
        assertThat(result.getRetryBackoff()).isEqualTo(Duration.ofMillis(200));
        assertThat(result.getRenumberUpdateAttempts()).isEqualTo(3);
    }

    @Test
    void shouldReadConfiguredKeys() {
        when(config.getOptionalValue("opgraph.iteration.parallelism", Integer.class))
                .thenReturn(Optional.of(4));
        when(config.getOptionalValue("opgraph.retry.attempts", Integer.class))
                .thenReturn(Optional.of(3));
        when(config.getOptionalValue("opgraph.retry.backoff", Duration.class))
                .thenReturn(Optional.of(Duration.ofSeconds(1)));
        when(config.getOptionalValue("opgraph.retry.multiplier", Double.class))
                .thenReturn(Optional.of(1.5));
        when(config.getOptionalValue("opgraph.history.read-limit", Integer.class))
                .thenReturn(Optional.of(10));

        OpgraphConfig result = OpgraphEnvironmentProducer.readConfig(config);

        assertThat(result.getIterationParallelism()).isEqualTo(4);
        assertThat(result.getRetryAttempts()).isEqualTo(3);
        assertThat(result.getRetryBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(result.getRetryMultiplier()).isEqualTo(1.5);
        assertThat(result.getHistoryReadLimit()).isEqualTo(10);
    }
}
