package org.example.pdfchat.service.Impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.model.ChunkRecord;
import org.example.pdfchat.model.RetrievedChunk;
import org.example.pdfchat.model.TextChunk;
import org.example.pdfchat.service.ChunkStore;
import org.example.pdfchat.utils.PgVectors;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * 基于 PostgreSQL + pgvector 的切片存储
 * PostgreSQL 向量操作符：
 * - <=>: 余弦距离，越小越相似，相似度 = 1 - 距离
 * - <->: 欧几里得距离
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PgVectorChunkStore implements ChunkStore {

    private static final String INSERT_SQL = """
            INSERT INTO chunks (id, project_id, file_id, content, embedding, chunk_index,
                                page_number, char_start, char_end, metadata)
            VALUES (:id, :projectId, :fileId, :content, :embedding::vector, :chunkIndex,
                    :pageNumber, :charStart, :charEnd, :metadata::jsonb)
            """;

    private static final String SEARCH_SQL = """
            SELECT c.id, c.file_id, f.filename, c.content, c.chunk_index, c.page_number,
                   1 - (c.embedding <=> :embedding::vector) AS similarity
            FROM chunks c
            JOIN files f ON f.id = c.file_id
            WHERE c.project_id = :projectId
              AND 1 - (c.embedding <=> :embedding::vector) >= :minSimilarity
            ORDER BY c.embedding <=> :embedding::vector, c.chunk_index
            LIMIT :topK
            """;

    private final JdbcClient jdbcClient;
    //事务模版，保证同一文件的切片整体替换
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public int replaceChunks(String projectId, String fileId, List<ChunkRecord> chunks) {
        Integer written = transactionTemplate.execute(status -> {
            //清洗旧数据
            int deleted = jdbcClient.sql("DELETE FROM chunks WHERE project_id = :projectId AND file_id = :fileId")
                    .param("projectId", projectId)
                    .param("fileId", fileId)
                    .update();
            if (deleted > 0) {
                log.info("删除旧切片，项目: {}, 文件: {}, 数量: {}", projectId, fileId, deleted);
            }
            for (ChunkRecord record : chunks) {
                TextChunk chunk = record.getChunk();
                jdbcClient.sql(INSERT_SQL)
                        .param("id", record.getId())
                        .param("projectId", projectId)
                        .param("fileId", fileId)
                        .param("content", chunk.getContent())
                        .param("embedding", PgVectors.toLiteral(record.getEmbedding()))
                        .param("chunkIndex", chunk.getChunkIndex())
                        .param("pageNumber", chunk.getPageNumber())
                        .param("charStart", chunk.getCharStart())
                        .param("charEnd", chunk.getCharEnd())
                        .param("metadata", toJson(chunk))
                        .update();
            }
            return chunks.size();
        });
        return written == null ? 0 : written;
    }

    @Override
    public int deleteByProject(String projectId) {
        return jdbcClient.sql("DELETE FROM chunks WHERE project_id = :projectId")
                .param("projectId", projectId)
                .update();
    }

    @Override
    public long countByProject(String projectId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM chunks WHERE project_id = :projectId")
                .param("projectId", projectId)
                .query(Long.class)
                .single();
    }

    @Override
    public long countByFile(String projectId, String fileId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM chunks WHERE project_id = :projectId AND file_id = :fileId")
                .param("projectId", projectId)
                .param("fileId", fileId)
                .query(Long.class)
                .single();
    }

    @Override
    public List<RetrievedChunk> similaritySearch(String projectId, float[] queryVector, int topK, double minSimilarity) {
        List<RetrievedChunk> results = jdbcClient.sql(SEARCH_SQL)
                .param("embedding", PgVectors.toLiteral(queryVector))
                .param("projectId", projectId)
                .param("minSimilarity", minSimilarity)
                .param("topK", topK)
                .query((rs, rowNum) -> RetrievedChunk.builder()
                        .id(rs.getString("id"))
                        .fileId(rs.getString("file_id"))
                        .filename(rs.getString("filename"))
                        .content(rs.getString("content"))
                        .chunkIndex(rs.getInt("chunk_index"))
                        .pageNumber(rs.getObject("page_number", Integer.class))
                        .similarity(rs.getDouble("similarity"))
                        .build())
                .list();
        log.debug("向量检索完成，项目: {}, 命中: {}", projectId, results.size());
        return results;
    }

    private String toJson(TextChunk chunk) {
        try {
            return objectMapper.writeValueAsString(chunk.getMetadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("切片元数据序列化失败: " + e.getMessage(), e);
        }
    }
}
