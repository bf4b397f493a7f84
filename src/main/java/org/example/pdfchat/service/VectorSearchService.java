package org.example.pdfchat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.model.RetrievedChunk;
import org.example.pdfchat.service.embedding.EmbeddingClient;
import org.example.pdfchat.utils.PgVectors;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 向量检索服务
 * 1. 将问题转换为向量（同一问题的向量缓存在 Redis）
 * 2. 在项目范围内按余弦相似度检索最相关的切片
 * 检索不到结果是正常情况，返回空列表。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorSearchService {
    private static final String CACHE_MODULE = "pdfchat:query-embedding";

    private final EmbeddingClient embeddingClient;
    private final ChunkStore chunkStore;
    private final CacheManager cacheManager;
    private final AppProperties appProperties;

    public List<RetrievedChunk> search(String projectId, String query) {
        AppProperties.Retrieval retrieval = appProperties.getRetrieval();
        log.info("开始向量检索，项目: {}, 问题长度: {}", projectId, query.length());

        float[] queryVector = embedQuery(query, retrieval);
        List<RetrievedChunk> chunks = chunkStore.similaritySearch(
                projectId, queryVector, retrieval.getTopK(), retrieval.getMinSimilarity());

        log.info("向量检索完成，项目: {}, 找到{}个相关片段", projectId, chunks.size());
        return chunks;
    }

    private float[] embedQuery(String query, AppProperties.Retrieval retrieval) {
        // 缓存值用 pgvector 文本格式，避免序列化 float[] 时带上类型信息
        String cacheKey = cacheManager.generateKey(CACHE_MODULE,
                String.valueOf(embeddingClient.dimension()), DigestUtils.sha256Hex(query));
        String literal = cacheManager.getOrLoad(cacheKey,
                () -> PgVectors.toLiteral(embeddingClient.embedOne(query)),
                retrieval.getQueryCacheTtl());
        return PgVectors.fromLiteral(literal);
    }
}
