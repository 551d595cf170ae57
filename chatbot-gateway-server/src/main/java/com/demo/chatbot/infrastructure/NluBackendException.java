package com.demo.chatbot.infrastructure;

/**
 * The NLU backend answered with something other than a usable fragment list, or not at all.
 */
public class NluBackendException extends RuntimeException {

    public NluBackendException(String message) {
        super(message);
    }

    public NluBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
