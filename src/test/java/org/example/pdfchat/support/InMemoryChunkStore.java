package org.example.pdfchat.support;

import org.example.pdfchat.model.ChunkRecord;
import org.example.pdfchat.model.RetrievedChunk;
import org.example.pdfchat.service.ChunkStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存版切片存储，整体替换在写完之前对外不可见，可以模拟写到第 N 条时失败
 */
public class InMemoryChunkStore implements ChunkStore {

    private final Map<String, List<ChunkRecord>> byFile = new ConcurrentHashMap<>();
    // 写入第几条时抛异常，从 1 开始，0 表示不失败
    private volatile int failAtInsert;

    public void failAtInsert(int n) {
        this.failAtInsert = n;
    }

    public List<ChunkRecord> chunksOf(String projectId, String fileId) {
        return byFile.getOrDefault(key(projectId, fileId), List.of());
    }

    @Override
    public synchronized int replaceChunks(String projectId, String fileId, List<ChunkRecord> chunks) {
        List<ChunkRecord> staged = new ArrayList<>();
        for (ChunkRecord record : chunks) {
            if (failAtInsert > 0 && staged.size() + 1 == failAtInsert) {
                // 事务回滚，已有数据保持不变
                throw new IllegalStateException("模拟写入失败，第 " + failAtInsert + " 条");
            }
            staged.add(record);
        }
        byFile.put(key(projectId, fileId), staged);
        return staged.size();
    }

    @Override
    public synchronized int deleteByProject(String projectId) {
        int deleted = 0;
        for (String key : new ArrayList<>(byFile.keySet())) {
            if (key.startsWith(projectId + "/")) {
                deleted += byFile.remove(key).size();
            }
        }
        return deleted;
    }

    @Override
    public long countByProject(String projectId) {
        return byFile.entrySet().stream()
                .filter(e -> e.getKey().startsWith(projectId + "/"))
                .mapToLong(e -> e.getValue().size())
                .sum();
    }

    @Override
    public long countByFile(String projectId, String fileId) {
        return chunksOf(projectId, fileId).size();
    }

    @Override
    public List<RetrievedChunk> similaritySearch(String projectId, float[] queryVector, int topK, double minSimilarity) {
        return List.of();
    }

    private static String key(String projectId, String fileId) {
        return projectId + "/" + fileId;
    }
}
