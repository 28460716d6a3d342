package io.cwrelay.core;

/**
 * Records could not be delivered to the sink.
 */
public class SinkException extends RuntimeException {

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
