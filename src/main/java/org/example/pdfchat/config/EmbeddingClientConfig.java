package org.example.pdfchat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class EmbeddingClientConfig {

    /**
     * 外部向量服务的 HTTP 客户端，连接和读取都有超时，避免工作线程被无限挂起
     */
    @Bean
    public RestClient embeddingRestClient(RestClient.Builder builder, AppProperties appProperties) {
        AppProperties.Embedding embedding = appProperties.getEmbedding();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) embedding.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) embedding.getTimeout().toMillis());
        return builder
                .baseUrl(embedding.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
