package org.example.pdfchat.common.exception;

public class InvalidInputException extends RagException {

    public InvalidInputException(String message) {
        super(ErrorType.INVALID_INPUT, message);
    }
}
