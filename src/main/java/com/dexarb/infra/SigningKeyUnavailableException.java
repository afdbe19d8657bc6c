package com.dexarb.infra;

/**
 * A configured signing key could not be loaded or used. The engine cannot make progress without
 * it, so this is treated as fatal by the orchestrator.
 */
public class SigningKeyUnavailableException extends RuntimeException {

    public SigningKeyUnavailableException(String message) {
        super(message);
    }

    public SigningKeyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
