package org.example.pdfchat.service;

import org.example.pdfchat.model.ChunkRecord;
import org.example.pdfchat.model.RetrievedChunk;

import java.util.List;

/**
 * 切片存储，按 (projectId, fileId) 分区写入，按 projectId 检索
 */
public interface ChunkStore {

    /**
     * 在一个事务里先删除该文件已有的切片再写入新切片，要么全部可见要么全部不可见
     * @return 写入的切片数
     */
    int replaceChunks(String projectId, String fileId, List<ChunkRecord> chunks);

    /**
     * 删除项目下所有切片，重复调用无副作用
     */
    int deleteByProject(String projectId);

    long countByProject(String projectId);

    long countByFile(String projectId, String fileId);

    /**
     * 余弦相似度检索，结果按相似度降序，相同距离按 chunkIndex 升序
     */
    List<RetrievedChunk> similaritySearch(String projectId, float[] queryVector, int topK, double minSimilarity);
}
