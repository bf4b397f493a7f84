package org.example.pdfchat.common.exception;

/**
 * 队列消息体不符合约定的结构，不可重试，直接进入死信队列
 */
public class InvalidJobPayloadException extends RagException {

    public InvalidJobPayloadException(String message) {
        super(ErrorType.INVALID_INPUT, message);
    }

    public InvalidJobPayloadException(String message, Throwable cause) {
        super(ErrorType.INVALID_INPUT, message, cause);
    }
}
