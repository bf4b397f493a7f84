package org.example.pdfchat.entity.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.pdfchat.common.exception.InvalidJobPayloadException;

import java.io.Serializable;

/**
 * 队列中的任务描述：
 * {jobId, documentId, fileId, storageKey, metadata:{originalName, mimeType, size}}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessingJobMessage implements Serializable {
    private String jobId;
    @JsonAlias("projectId")
    private String documentId;
    private String fileId;
    @JsonAlias("minioPath")
    private String storageKey;
    private FileMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FileMetadata implements Serializable {
        private String originalName;
        private String mimeType;
        private Long size;
    }

    /**
     * 消费时校验结构，不合法的消息不会进入处理流程
     */
    public void validate() {
        requireText(jobId, "jobId");
        requireText(documentId, "documentId");
        requireText(fileId, "fileId");
        requireText(storageKey, "storageKey");
        if (metadata != null && metadata.getSize() != null && metadata.getSize() < 0) {
            throw new InvalidJobPayloadException("metadata.size 不能为负数");
        }
    }

    public String originalName() {
        return metadata == null ? null : metadata.getOriginalName();
    }

    public String mimeType() {
        return metadata == null ? null : metadata.getMimeType();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidJobPayloadException("任务消息缺少字段: " + field);
        }
    }
}
