package io.simmy.core.provider;

/**
 * Backend failure: the model call did not produce a usable response.
 */
public class LlmException extends Exception {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
