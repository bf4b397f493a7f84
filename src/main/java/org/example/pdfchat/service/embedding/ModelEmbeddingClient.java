package org.example.pdfchat.service.embedding;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.EmbeddingServiceUnavailableException;
import org.example.pdfchat.config.AppProperties;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * 通过 Spring AI 的 EmbeddingModel 向量化，模型维度需与 app.embedding.dimension 一致
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.embedding", name = "provider", havingValue = "model")
public class ModelEmbeddingClient extends AbstractEmbeddingClient {

    private final EmbeddingModel embeddingModel;

    public ModelEmbeddingClient(EmbeddingModel embeddingModel,
                                AppProperties appProperties,
                                @Qualifier("embeddingTaskExecutor") Executor executor) {
        super(appProperties.getEmbedding().getDimension(),
                appProperties.getEmbedding().getBatchSize(),
                appProperties.getEmbedding().getParallelism(),
                executor,
                appProperties.getEmbedding().getMaxRetries(),
                appProperties.getEmbedding().getRetryBackoff());
        this.embeddingModel = embeddingModel;
    }

    @Override
    protected List<float[]> embedBatch(List<String> batch) {
        try {
            return embeddingModel.embed(batch);
        } catch (RuntimeException e) {
            log.error("EmbeddingModel 调用失败，批次大小: {}", batch.size(), e);
            throw new EmbeddingServiceUnavailableException("向量模型调用失败: " + e.getMessage(), e);
        }
    }
}
