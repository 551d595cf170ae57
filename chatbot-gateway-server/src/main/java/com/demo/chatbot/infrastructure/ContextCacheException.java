package com.demo.chatbot.infrastructure;

public class ContextCacheException extends RuntimeException {

    public ContextCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
