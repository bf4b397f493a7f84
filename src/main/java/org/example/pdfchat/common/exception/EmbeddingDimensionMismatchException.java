package org.example.pdfchat.common.exception;

import lombok.Getter;

/**
 * 向量维度与配置不一致，属于配置错误，重试没有意义
 */
@Getter
public class EmbeddingDimensionMismatchException extends RagException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super(ErrorType.INTERNAL, "向量维度不匹配，期望 " + expected + "，实际 " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
