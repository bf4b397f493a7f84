package org.example.pdfchat.common;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.ErrorType;
import org.example.pdfchat.common.exception.RagException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * 统一异常处理，响应体固定为 JSON，流式接口在打开事件流之前出错也返回 JSON
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 业务异常：4xx 原样返回提示，5xx 只返回通用提示，细节只留在日志里
     */
    @ExceptionHandler(RagException.class)
    public ResponseEntity<Result<Void>> handleRagException(RagException e) {
        ErrorType type = e.getErrorType();
        if (type.getHttpStatus().is5xxServerError()) {
            log.error("服务异常 [{}]: ", type, e);
            return json(type.getHttpStatus(), Result.failed(type.getResultCode()));
        }
        log.warn("请求失败 [{}]: {}", type, e.getMessage());
        return json(type.getHttpStatus(), Result.failed(type.getResultCode(), e.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Result<Void>> handleMissingParameter(Exception e) {
        log.warn("参数错误: {}", e.getMessage());
        return json(HttpStatus.BAD_REQUEST, Result.failed(ResultCode.VALIDATE_FAILED, "参数错误: " + e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        return json(HttpStatus.BAD_REQUEST, Result.failed(ResultCode.VALIDATE_FAILED, "请求体格式错误"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Result<Void>> handleMaxUploadSize(MaxUploadSizeExceededException e) {
        log.warn("上传文件过大: {}", e.getMessage());
        return json(HttpStatus.BAD_REQUEST, Result.failed(ResultCode.VALIDATE_FAILED, "上传文件超过大小限制"));
    }

    @ExceptionHandler(Exception.class) // 拦截所有未知的 Exception
    public ResponseEntity<Result<Void>> handleException(Exception e) {
        log.error("系统异常: ", e);
        // 无论系统出什么错，前端收到的永远是标准的 Result 对象，且不带内部细节
        return json(HttpStatus.INTERNAL_SERVER_ERROR, Result.failed(ResultCode.FAILED));
    }

    private static ResponseEntity<Result<Void>> json(HttpStatusCode status, Result<Void> body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
