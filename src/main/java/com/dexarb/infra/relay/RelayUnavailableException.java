package com.dexarb.infra.relay;

/**
 * The relay could not be reached at all: connection refused or timed out.
 */
public class RelayUnavailableException extends TransientRelayException {

    public RelayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
