package org.example.pdfchat.common.exception;

public class NotFoundException extends RagException {

    public NotFoundException(String message) {
        super(ErrorType.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorType.NOT_FOUND, message, cause);
    }
}
