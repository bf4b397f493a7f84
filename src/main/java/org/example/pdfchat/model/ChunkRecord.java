package org.example.pdfchat.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 待入库的切片：文本 + 向量
 */
@Data
@AllArgsConstructor
public class ChunkRecord {
    private String id;
    private String projectId;
    private String fileId;
    private TextChunk chunk;
    private float[] embedding;
}
