package org.example.pdfchat.model;

/**
 * 文档处理阶段，严格按声明顺序执行
 */
public enum ProcessingStage {
    FETCH,
    EXTRACT,
    CHUNK,
    EMBED,
    PERSIST,
    FINALIZE;

    /**
     * 当前阶段完成后的进度
     */
    public double progressAfter() {
        return (ordinal() + 1) / (double) values().length;
    }
}
