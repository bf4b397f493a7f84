package org.example.pdfchat.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 切分后的文本片段，还没有向量
 */
@Data
@Builder
@AllArgsConstructor
public class TextChunk {
    // 文件内的序号，从 0 开始
    private int chunkIndex;
    private String content;
    private Integer pageNumber;
    // 在所属页文本中的字符区间 [charStart, charEnd)，定位不到时为 null
    private Integer charStart;
    private Integer charEnd;
    private Map<String, Object> metadata;
}
