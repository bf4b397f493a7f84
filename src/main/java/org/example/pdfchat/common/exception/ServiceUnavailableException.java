package org.example.pdfchat.common.exception;

import lombok.Getter;

/**
 * 下游依赖（对象存储、向量服务、大模型、消息队列、数据库）暂时不可用
 */
@Getter
public class ServiceUnavailableException extends RagException {

    private final String dependency;

    public ServiceUnavailableException(String dependency, String message) {
        super(ErrorType.UNAVAILABLE, message);
        this.dependency = dependency;
    }

    public ServiceUnavailableException(String dependency, String message, Throwable cause) {
        super(ErrorType.UNAVAILABLE, message, cause);
        this.dependency = dependency;
    }
}
