package org.example.pdfchat.common.exception;

import lombok.Getter;

/**
 * 业务异常基类，所有可分类的错误都从这里派生
 */
@Getter
public class RagException extends RuntimeException {

    private final ErrorType errorType;

    public RagException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public RagException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
