package org.example.pdfchat.service.embedding;

import java.util.List;

/**
 * 文本向量化
 */
public interface EmbeddingClient {

    /**
     * 批量向量化，返回结果与输入等长且顺序一致
     * @throws org.example.pdfchat.common.exception.EmbeddingServiceUnavailableException 向量服务不可用或超时
     * @throws org.example.pdfchat.common.exception.EmbeddingDimensionMismatchException 返回的向量维度与配置不一致
     */
    List<float[]> embed(List<String> texts);

    default float[] embedOne(String text) {
        return embed(List.of(text)).get(0);
    }

    int dimension();
}
