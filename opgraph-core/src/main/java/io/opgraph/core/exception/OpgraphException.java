package io.opgraph.core.exception;

import java.io.Serial;

/// Base type for all errors raised by the graph engine.
///
/// Every subtype carries enough context (node reference, position, branch name) for an
/// operator-facing diagnostic; messages are never truncated.
public abstract class OpgraphException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4107731276958302811L;

    protected OpgraphException(String message) {
        super(message);
    }

    protected OpgraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
