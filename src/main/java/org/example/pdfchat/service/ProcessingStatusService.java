package org.example.pdfchat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.NotFoundException;
import org.example.pdfchat.entity.FileProcessingStatus;
import org.example.pdfchat.entity.JobStatus;
import org.example.pdfchat.entity.ProcessingJob;
import org.example.pdfchat.entity.Project;
import org.example.pdfchat.entity.ProjectFile;
import org.example.pdfchat.entity.ProjectStatus;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.example.pdfchat.repository.ProcessingJobRepository;
import org.example.pdfchat.repository.ProjectFileRepository;
import org.example.pdfchat.repository.ProjectRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * 任务、文件、项目三者的状态流转，每个方法一个独立事务
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcessingStatusService {

    private final ProcessingJobRepository jobRepository;
    private final ProjectFileRepository fileRepository;
    private final ProjectRepository projectRepository;

    /**
     * 取出任务记录，投递方没有落库时按消息内容补一条
     */
    @Transactional
    public ProcessingJob prepare(ProcessingJobMessage message) {
        return jobRepository.findById(message.getJobId()).orElseGet(() -> {
            log.warn("任务记录不存在，按消息补建，jobId: {}", message.getJobId());
            ProcessingJob job = new ProcessingJob();
            job.setId(message.getJobId());
            job.setFileId(message.getFileId());
            job.setProjectId(message.getDocumentId());
            job.setStatus(JobStatus.PENDING);
            return jobRepository.save(job);
        });
    }

    /**
     * 进入处理中，项目或文件不存在时抛 NotFoundException。
     * 失败过的项目再次处理时视为重新提交，项目回到 CREATING。
     */
    @Transactional
    public ProjectFile start(ProcessingJobMessage message) {
        Project project = projectRepository.findById(message.getDocumentId())
                .orElseThrow(() -> new NotFoundException("项目不存在: " + message.getDocumentId()));
        ProjectFile file = fileRepository.findById(message.getFileId())
                .filter(f -> message.getDocumentId().equals(f.getProjectId()))
                .orElseThrow(() -> new NotFoundException("文件不存在: " + message.getFileId()));

        ProcessingJob job = requireJob(message.getJobId());
        job.setStatus(JobStatus.PROCESSING);
        job.setAttempts(job.getAttempts() + 1);
        job.setStartedAt(LocalDateTime.now());
        job.setCompletedAt(null);
        job.setProgress(0);
        job.setErrorMessage(null);
        job.setWarning(null);
        job.setChunkCount(null);
        jobRepository.save(job);

        if (project.getStatus() == ProjectStatus.FAILED) {
            log.info("失败项目重新处理，项目: {}, jobId: {}", project.getId(), message.getJobId());
            transition(project, ProjectStatus.CREATING);
        }

        file.setProcessingStatus(FileProcessingStatus.PROCESSING);
        return fileRepository.save(file);
    }

    @Transactional
    public void updateProgress(String jobId, double progress) {
        ProcessingJob job = requireJob(jobId);
        job.setProgress(progress);
        jobRepository.save(job);
    }

    /**
     * 成功终态：任务完成，文件 DONE，项目下所有文件都 DONE 时项目变为 CREATED
     */
    @Transactional
    public void markCompleted(String jobId, String fileId, String projectId, int chunkCount, String warning) {
        ProcessingJob job = requireJob(jobId);
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(1.0);
        job.setChunkCount(chunkCount);
        job.setWarning(warning);
        job.setErrorMessage(null);
        job.setCompletedAt(LocalDateTime.now());
        jobRepository.save(job);

        fileRepository.findById(fileId).ifPresent(file -> {
            file.setProcessingStatus(FileProcessingStatus.DONE);
            fileRepository.save(file);
        });

        long unfinished = fileRepository.countByProjectIdAndProcessingStatusNot(projectId, FileProcessingStatus.DONE);
        if (unfinished == 0) {
            projectRepository.findById(projectId).ifPresent(project -> transition(project, ProjectStatus.CREATED));
        } else {
            log.info("项目还有{}个文件未完成，项目: {}", unfinished, projectId);
        }
    }

    /**
     * 失败终态：任务、文件、项目都标记为失败，记录不存在的跳过。
     * 任务已经 COMPLETED 时不覆盖，并发的重复处理中后失败的一方不改动任何状态。
     */
    @Transactional
    public void markFailed(String jobId, String fileId, String projectId, String errorMessage) {
        ProcessingJob job = jobRepository.findById(jobId).orElse(null);
        if (job != null && job.getStatus() == JobStatus.COMPLETED) {
            log.warn("任务已完成，忽略失败状态，jobId: {}, 原因: {}", jobId, errorMessage);
            return;
        }
        if (job != null) {
            job.setStatus(JobStatus.FAILED);
            job.setErrorMessage(errorMessage);
            job.setCompletedAt(LocalDateTime.now());
            jobRepository.save(job);
        }
        fileRepository.findById(fileId).ifPresent(file -> {
            file.setProcessingStatus(FileProcessingStatus.FAILED);
            fileRepository.save(file);
        });
        projectRepository.findById(projectId).ifPresent(project -> transition(project, ProjectStatus.FAILED));
    }

    private void transition(Project project, ProjectStatus target) {
        if (!project.getStatus().canTransitionTo(target)) {
            log.warn("忽略非法的项目状态变更，项目: {}, {} -> {}", project.getId(), project.getStatus(), target);
            return;
        }
        project.setStatus(target);
        projectRepository.save(project);
    }

    private ProcessingJob requireJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("任务不存在: " + jobId));
    }
}
