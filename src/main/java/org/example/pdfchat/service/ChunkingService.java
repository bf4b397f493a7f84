package org.example.pdfchat.service;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.model.ExtractedDocument;
import org.example.pdfchat.model.ExtractedPage;
import org.example.pdfchat.model.TextChunk;
import org.springframework.ai.document.Document;
import org.springframework.ai.transformer.splitter.TokenTextSplitter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 文本切分，同样的输入和配置总是得到同样的切片
 */
@Slf4j
@Service
public class ChunkingService {

    private final TokenTextSplitter splitter;

    public ChunkingService(AppProperties appProperties) {
        AppProperties.Chunking chunking = appProperties.getChunking();
        this.splitter = new TokenTextSplitter(
                chunking.getChunkSize(),
                chunking.getMinChunkSizeChars(),
                chunking.getMinChunkLengthToEmbed(),
                chunking.getMaxNumChunks(),
                true);
    }

    /**
     * 按页切分，chunkIndex 在整个文件内连续编号
     */
    public List<TextChunk> chunk(ExtractedDocument document, String filename) {
        List<TextChunk> result = new ArrayList<>();
        for (ExtractedPage page : document.getPages()) {
            String pageText = page.getText();
            if (pageText == null || pageText.isBlank()) {
                continue;
            }
            int searchFrom = 0;
            for (Document piece : splitter.split(new Document(pageText))) {
                String content = piece.getText();
                if (content == null || content.isBlank()) {
                    continue;
                }
                Integer charStart = null;
                Integer charEnd = null;
                int found = pageText.indexOf(content, searchFrom);
                if (found >= 0) {
                    charStart = found;
                    charEnd = found + content.length();
                    searchFrom = found + 1;
                }
                int chunkIndex = result.size();
                result.add(TextChunk.builder()
                        .chunkIndex(chunkIndex)
                        .content(content)
                        .pageNumber(page.getPageNumber())
                        .charStart(charStart)
                        .charEnd(charEnd)
                        .metadata(buildMetadata(filename, page.getPageNumber(), chunkIndex, content))
                        .build());
            }
        }
        log.debug("切分完成，文件: {}, 切片数: {}", filename, result.size());
        return result;
    }

    private Map<String, Object> buildMetadata(String filename, Integer pageNumber, int chunkIndex, String content) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("filename", filename);
        metadata.put("page_number", pageNumber);
        metadata.put("chunk_index", chunkIndex);
        metadata.put("char_count", content.length());
        metadata.put("source", "rabbitmq");
        return metadata;
    }
}
