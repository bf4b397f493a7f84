package org.example.pdfchat.common.exception;

public class EmbeddingServiceUnavailableException extends ServiceUnavailableException {

    public EmbeddingServiceUnavailableException(String message) {
        super("embedding", message);
    }

    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super("embedding", message, cause);
    }
}
