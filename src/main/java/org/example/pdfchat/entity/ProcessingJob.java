package org.example.pdfchat.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 处理任务记录，id 由投递方生成，用于幂等和状态查询。
 * 只引用文件，不拥有文件。
 */
@Data
@Entity
@Table(name = "processing_jobs")
public class ProcessingJob {

    @Id
    private String id;

    @Column(name = "file_id", nullable = false)
    private String fileId;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    // 错误信息，格式：阶段: 原因
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // 非错误的提示，例如没有提取到文本
    @Column(length = 100)
    private String warning;

    @Column(nullable = false)
    private double progress;

    @Column(name = "chunk_count")
    private Integer chunkCount;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) status = JobStatus.PENDING;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
