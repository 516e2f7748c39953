package com.jumbo.companion.service.llm.openai;

/**
 * Failure talking to the chat completion endpoint. {@link #status()} is the HTTP status the endpoint
 * answered with, or 0 when no response arrived.
 */
public class OpenAiChatException extends RuntimeException {

    private final int status;

    public OpenAiChatException(String message) {
        this(message, 0, null);
    }

    public OpenAiChatException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public OpenAiChatException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean noResponse() {
        return status == 0;
    }
}
