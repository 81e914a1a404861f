package io.opgraph.core.execution;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/// Bounded retry with exponential backoff for a single unit of work.
///
/// @param maxAttempts total attempts including the first, at least 1
/// @param initialBackoff pause before the second attempt, not null
/// @param multiplier growth factor applied to the pause after each failed attempt, at least 1
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {

    private static final Logger logger = Logger.getLogger(RetryPolicy.class.getName());

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
    }

    /// Single attempt, no backoff.
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0);
    }

    public static RetryPolicy of(int maxAttempts, Duration initialBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, 2.0);
    }

    /// Runs the action until it succeeds or attempts run out.
    ///
    /// @param description what is being attempted, for log messages
    /// @param action work to run, not null
    /// @return the action's result
    /// @throws Exception the last failure once attempts are exhausted
    public <T> T call(String description, Callable<T> action) throws Exception {
        long backoffMillis = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                logger.warning(
                        description
                                + " failed (attempt "
                                + attempt
                                + "/"
                                + maxAttempts
                                + "): "
                                + e.getMessage()
                                + ", retrying in "
                                + backoffMillis
                                + "ms");
                if (backoffMillis > 0) {
                    Thread.sleep(backoffMillis);
                }
                backoffMillis = (long) (backoffMillis * multiplier);
            }
        }
    }

    /// Like {@link #call} for actions that only throw unchecked exceptions.
    public <T> T callUnchecked(String description, Callable<T> action) {
        try {
            return call(description, action);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            throw new IllegalStateException(description + " interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException(description + " failed", e);
        }
    }
}
