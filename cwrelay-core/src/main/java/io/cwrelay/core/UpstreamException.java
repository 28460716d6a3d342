package io.cwrelay.core;

/**
 * The metrics provider failed to list descriptors or return statistics.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
