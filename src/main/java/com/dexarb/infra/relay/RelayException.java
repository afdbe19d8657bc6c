package com.dexarb.infra.relay;

/**
 * The relay answered, but with a JSON-RPC error or an unexpected HTTP status.
 */
public class RelayException extends RuntimeException {

    private final int code;

    public RelayException(String message) {
        this(message, 0);
    }

    public RelayException(String message, int code) {
        super(message);
        this.code = code;
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
        this.code = 0;
    }

    /** JSON-RPC or HTTP error code, 0 when unknown. */
    public int getCode() {
        return code;
    }
}
