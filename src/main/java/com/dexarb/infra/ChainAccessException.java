package com.dexarb.infra;

/**
 * An RPC call to the chain node failed or returned an error.
 */
public class ChainAccessException extends RuntimeException {

    public ChainAccessException(String message) {
        super(message);
    }

    public ChainAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
