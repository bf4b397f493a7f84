package org.example.pdfchat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.RagException;
import org.example.pdfchat.common.exception.ServiceUnavailableException;
import org.example.pdfchat.entity.JobStatus;
import org.example.pdfchat.entity.ProcessingJob;
import org.example.pdfchat.entity.ProjectFile;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.example.pdfchat.model.ChunkRecord;
import org.example.pdfchat.model.ExtractedDocument;
import org.example.pdfchat.model.ProcessingOutcome;
import org.example.pdfchat.model.ProcessingStage;
import org.example.pdfchat.model.TextChunk;
import org.example.pdfchat.service.embedding.EmbeddingClient;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 文档处理流水线：FETCH -> EXTRACT -> CHUNK -> EMBED -> PERSIST -> FINALIZE
 * 任一阶段失败，任务、文件、项目都记为失败并返回结果，不向外抛出；
 * 只有失败状态本身写不进去时才抛出，由消费端决定重新投递。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentProcessor {
    public static final String NO_TEXT_EXTRACTED = "NO_TEXT_EXTRACTED";
    private static final int MAX_ERROR_LENGTH = 1000;

    private final ProcessingStatusService statusService;
    private final StorageService storageService;
    private final DocumentTextExtractor textExtractor;
    private final ChunkingService chunkingService;
    private final EmbeddingClient embeddingClient;
    private final ChunkStore chunkStore;

    public ProcessingOutcome process(ProcessingJobMessage message) {
        String jobId = message.getJobId();
        ProcessingJob job = statusService.prepare(message);
        if (job.getStatus() == JobStatus.COMPLETED) {
            int chunkCount = job.getChunkCount() == null ? 0 : job.getChunkCount();
            log.info("任务已完成，跳过重复投递，jobId: {}", jobId);
            return ProcessingOutcome.alreadyCompleted(jobId, chunkCount);
        }

        ProcessingStage stage = ProcessingStage.FETCH;
        Path tempFile = null;
        try {
            ProjectFile file = statusService.start(message);
            String filename = file.getFilename() != null ? file.getFilename() : message.originalName();
            String mimeType = file.getMimeType() != null ? file.getMimeType() : message.mimeType();
            log.info("开始处理任务，jobId: {}, 项目: {}, 文件: {}", jobId, message.getDocumentId(), filename);

            tempFile = fetch(message.getStorageKey());
            stageDone(jobId, stage);

            stage = ProcessingStage.EXTRACT;
            ExtractedDocument document;
            try (InputStream in = Files.newInputStream(tempFile)) {
                document = textExtractor.extract(in, filename, mimeType);
            }
            stageDone(jobId, stage);

            stage = ProcessingStage.CHUNK;
            List<TextChunk> chunks = chunkingService.chunk(document, filename);
            if (chunks.isEmpty()) {
                log.warn("没有提取到文本，jobId: {}, 文件: {}", jobId, filename);
            }
            stageDone(jobId, stage);

            stage = ProcessingStage.EMBED;
            List<ChunkRecord> records = embed(message, chunks);
            stageDone(jobId, stage);

            stage = ProcessingStage.PERSIST;
            int written = chunkStore.replaceChunks(message.getDocumentId(), message.getFileId(), records);
            stageDone(jobId, stage);

            stage = ProcessingStage.FINALIZE;
            statusService.markCompleted(jobId, message.getFileId(), message.getDocumentId(), written,
                    written == 0 ? NO_TEXT_EXTRACTED : null);
            log.info("任务处理完成，jobId: {}, 切片数: {}", jobId, written);
            return ProcessingOutcome.completed(jobId, written);
        } catch (Exception e) {
            return fail(message, stage, e);
        } finally {
            deleteTempFile(tempFile);
        }
    }

    private Path fetch(String storageKey) throws IOException {
        Path tempFile = Files.createTempFile("pdfchat-", ".tmp");
        try (InputStream in = storageService.getFileStream(storageKey)) {
            Files.copy(in, tempFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteTempFile(tempFile);
            throw new ServiceUnavailableException("object-store", "下载文件失败: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteTempFile(tempFile);
            throw e;
        }
        return tempFile;
    }

    private List<ChunkRecord> embed(ProcessingJobMessage message, List<TextChunk> chunks) {
        if (chunks.isEmpty()) {
            return List.of();
        }
        List<String> texts = chunks.stream().map(TextChunk::getContent).collect(Collectors.toList());
        List<float[]> vectors = embeddingClient.embed(texts);
        List<ChunkRecord> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            records.add(new ChunkRecord(UUID.randomUUID().toString(),
                    message.getDocumentId(), message.getFileId(), chunks.get(i), vectors.get(i)));
        }
        return records;
    }

    private void stageDone(String jobId, ProcessingStage stage) {
        statusService.updateProgress(jobId, stage.progressAfter());
        log.debug("阶段完成，jobId: {}, 阶段: {}", jobId, stage);
    }

    private ProcessingOutcome fail(ProcessingJobMessage message, ProcessingStage stage, Exception e) {
        String errorMessage = truncate(stage.name() + ": " + describe(e));
        if (e instanceof RagException && ((RagException) e).isRetryable()) {
            log.error("任务处理失败（依赖暂时不可用），jobId: {}, {}", message.getJobId(), errorMessage, e);
        } else {
            log.error("任务处理失败，jobId: {}, {}", message.getJobId(), errorMessage, e);
        }
        statusService.markFailed(message.getJobId(), message.getFileId(), message.getDocumentId(), errorMessage);
        return ProcessingOutcome.failed(message.getJobId(), stage, errorMessage);
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }

    // 截取错误信息防止爆字段
    private static String truncate(String msg) {
        return msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }

    private static void deleteTempFile(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("删除临时文件失败: {}, 原因: {}", tempFile, e.getMessage());
        }
    }
}
