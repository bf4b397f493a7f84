package org.example.pdfchat.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.example.pdfchat.entity.JobStatus;

/**
 * 一次任务处理的终态，消费端据此 ack
 */
@Data
@AllArgsConstructor
public class ProcessingOutcome {
    private String jobId;
    private JobStatus status;
    private int chunkCount;
    // 提取不到文本时为 true，属于成功但需要提示
    private boolean emptyContent;
    private ProcessingStage failedStage;
    private String errorMessage;
    // 该任务之前已经完成，本次直接跳过
    private boolean skipped;

    public static ProcessingOutcome completed(String jobId, int chunkCount) {
        return new ProcessingOutcome(jobId, JobStatus.COMPLETED, chunkCount, chunkCount == 0, null, null, false);
    }

    public static ProcessingOutcome failed(String jobId, ProcessingStage stage, String errorMessage) {
        return new ProcessingOutcome(jobId, JobStatus.FAILED, 0, false, stage, errorMessage, false);
    }

    public static ProcessingOutcome alreadyCompleted(String jobId, int chunkCount) {
        return new ProcessingOutcome(jobId, JobStatus.COMPLETED, chunkCount, chunkCount == 0, null, null, true);
    }

    public boolean isSuccess() {
        return status == JobStatus.COMPLETED;
    }
}
