package org.example.pdfchat.common.exception;

import lombok.Getter;
import org.example.pdfchat.common.ResultCode;
import org.springframework.http.HttpStatus;

/**
 * 错误分类
 * retryable 只表示"稍后重试可能成功"，是否真正重试由调用方决定，
 * 队列消费端不会依赖重新投递来做重试。
 */
@Getter
public enum ErrorType {

    NOT_FOUND(false, HttpStatus.NOT_FOUND, ResultCode.NOT_FOUND),
    INVALID_INPUT(false, HttpStatus.BAD_REQUEST, ResultCode.VALIDATE_FAILED),
    UNAVAILABLE(true, HttpStatus.SERVICE_UNAVAILABLE, ResultCode.SERVICE_UNAVAILABLE),
    MALFORMED_DOCUMENT(false, HttpStatus.UNPROCESSABLE_ENTITY, ResultCode.UNPROCESSABLE),
    INTERNAL(false, HttpStatus.INTERNAL_SERVER_ERROR, ResultCode.FAILED);

    private final boolean retryable;
    private final HttpStatus httpStatus;
    private final ResultCode resultCode;

    ErrorType(boolean retryable, HttpStatus httpStatus, ResultCode resultCode) {
        this.retryable = retryable;
        this.httpStatus = httpStatus;
        this.resultCode = resultCode;
    }
}
