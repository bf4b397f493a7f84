package org.example.pdfchat.service.embedding;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.EmbeddingServiceUnavailableException;
import org.example.pdfchat.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * 调用外部向量服务：POST /embed {"texts":[...]} -> {"embeddings":[[...], ...]}
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.embedding", name = "provider", havingValue = "remote", matchIfMissing = true)
public class RemoteEmbeddingClient extends AbstractEmbeddingClient {

    private final RestClient restClient;

    public RemoteEmbeddingClient(@Qualifier("embeddingRestClient") RestClient restClient,
                                 AppProperties appProperties,
                                 @Qualifier("embeddingTaskExecutor") Executor executor) {
        super(appProperties.getEmbedding().getDimension(),
                appProperties.getEmbedding().getBatchSize(),
                appProperties.getEmbedding().getParallelism(),
                executor,
                appProperties.getEmbedding().getMaxRetries(),
                appProperties.getEmbedding().getRetryBackoff());
        this.restClient = restClient;
    }

    @Override
    protected List<float[]> embedBatch(List<String> batch) {
        EmbedResponse response;
        try {
            response = restClient.post()
                    .uri("/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new EmbedRequest(batch))
                    .retrieve()
                    .body(EmbedResponse.class);
        } catch (RestClientException e) {
            log.error("调用向量服务失败，批次大小: {}", batch.size(), e);
            throw new EmbeddingServiceUnavailableException("向量服务调用失败: " + e.getMessage(), e);
        }
        if (response == null || response.getEmbeddings() == null) {
            throw new EmbeddingServiceUnavailableException("向量服务返回为空");
        }
        List<float[]> vectors = new ArrayList<>(response.getEmbeddings().size());
        for (List<Float> values : response.getEmbeddings()) {
            vectors.add(toArray(values));
        }
        return vectors;
    }

    private static float[] toArray(List<Float> values) {
        if (values == null) {
            return null;
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
        }
        return vector;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class EmbedRequest {
        private List<String> texts;
    }

    @Data
    @NoArgsConstructor
    static class EmbedResponse {
        private List<List<Float>> embeddings;
    }
}
