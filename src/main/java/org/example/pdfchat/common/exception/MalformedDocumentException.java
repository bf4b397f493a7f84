package org.example.pdfchat.common.exception;

public class MalformedDocumentException extends RagException {

    public MalformedDocumentException(String message, Throwable cause) {
        super(ErrorType.MALFORMED_DOCUMENT, message, cause);
    }
}
