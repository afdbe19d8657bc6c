package com.dexarb.infra.relay;

/**
 * A relay failure that may succeed on retry or on another relay (5xx, 429, dropped connection).
 */
public class TransientRelayException extends RelayException {

    public TransientRelayException(String message, int code) {
        super(message, code);
    }

    public TransientRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
