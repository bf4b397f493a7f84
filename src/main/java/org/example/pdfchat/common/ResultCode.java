package org.example.pdfchat.common;


import lombok.Getter;

@Getter
public enum ResultCode {

    SUCCESS(200, "操作成功"),
    ACCEPTED(202, "请求已受理"),
    FAILED(500, "操作失败"),
    VALIDATE_FAILED(400, "参数检验失败"),
    NOT_FOUND(404, "资源不存在"),
    UNPROCESSABLE(422, "文档无法解析"),
    SERVICE_UNAVAILABLE(503, "依赖服务暂不可用");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
}
