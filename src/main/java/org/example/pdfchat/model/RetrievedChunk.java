package org.example.pdfchat.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class RetrievedChunk {
    private String id;
    private String fileId;
    private String filename;
    private String content;
    private int chunkIndex;
    private Integer pageNumber;
    // 1 - 余弦距离
    private double similarity;
}
