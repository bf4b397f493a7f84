package org.example.pdfchat.service.Impl;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.InvalidInputException;
import org.example.pdfchat.common.exception.NotFoundException;
import org.example.pdfchat.common.exception.RagException;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.entity.FileProcessingStatus;
import org.example.pdfchat.entity.JobStatus;
import org.example.pdfchat.entity.ProcessingJob;
import org.example.pdfchat.entity.Project;
import org.example.pdfchat.entity.ProjectFile;
import org.example.pdfchat.entity.ProjectStatus;
import org.example.pdfchat.entity.dto.PageResponse;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.example.pdfchat.entity.dto.ProjectCreatedResponse;
import org.example.pdfchat.entity.dto.ProjectDetailResponse;
import org.example.pdfchat.mq.ProcessingJobPublisher;
import org.example.pdfchat.repository.ProcessingJobRepository;
import org.example.pdfchat.repository.ProjectFileRepository;
import org.example.pdfchat.repository.ProjectRepository;
import org.example.pdfchat.service.ChunkStore;
import org.example.pdfchat.service.ProcessingStatusService;
import org.example.pdfchat.service.ProjectService;
import org.example.pdfchat.service.StorageService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectServiceImpl implements ProjectService {
    private static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_DESCRIPTION_LENGTH = 500;
    private static final int MAX_PAGE_SIZE = 100;

    private final ProjectRepository projectRepository;
    private final ProjectFileRepository fileRepository;
    private final ProcessingJobRepository jobRepository;
    private final ChunkStore chunkStore;
    private final StorageService storageService;
    private final ProcessingJobPublisher jobPublisher;
    private final ProcessingStatusService statusService;
    private final TransactionTemplate transactionTemplate;
    private final AppProperties appProperties;

    @Override
    public ProjectCreatedResponse createProject(String title, String description, MultipartFile file) {
        //先校验，任何副作用之前
        String cleanTitle = requireLength(title, "标题", MAX_TITLE_LENGTH);
        String cleanDescription = requireLength(description, "描述", MAX_DESCRIPTION_LENGTH);
        String contentType = validateFile(file);

        String projectId = UUID.randomUUID().toString();
        String originalName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.pdf";
        String storageKey = "uploads/" + System.currentTimeMillis() + "_" + projectId + "." + extension(originalName);

        //文件上传到对象存储
        try (InputStream in = file.getInputStream()) {
            storageService.upload(storageKey, in, file.getSize(), contentType);
        } catch (IOException e) {
            throw new InvalidInputException("读取上传文件失败: " + e.getMessage());
        }

        //数据库登记，失败时清理已上传的对象
        Submission submission;
        try {
            submission = transactionTemplate.execute(status -> {
                Project project = new Project();
                project.setId(projectId);
                project.setTitle(cleanTitle);
                project.setDescription(cleanDescription);
                project.setStatus(ProjectStatus.CREATING);
                project = projectRepository.save(project);

                ProjectFile projectFile = new ProjectFile();
                projectFile.setId(UUID.randomUUID().toString());
                projectFile.setProjectId(project.getId());
                projectFile.setFilename(originalName);
                projectFile.setStorageKey(storageKey);
                projectFile.setMimeType(contentType);
                projectFile.setFileSize(file.getSize());
                projectFile.setProcessingStatus(FileProcessingStatus.PENDING);
                projectFile = fileRepository.save(projectFile);

                return new Submission(projectFile, newJob(projectFile));
            });
        } catch (RuntimeException e) {
            log.error("项目登记失败，清理已上传文件: {}", storageKey, e);
            deleteObjectQuietly(storageKey);
            throw e;
        }

        publishOrMarkFailed(submission);
        log.info("项目创建成功，项目: {}, 文件: {}, 任务: {}", projectId, submission.getFile().getId(), submission.getJob().getId());
        return new ProjectCreatedResponse(projectId, submission.getFile().getId(), submission.getJob().getId(), ProjectStatus.CREATING);
    }

    @Override
    public PageResponse<Project> listProjects(int page, int limit) {
        if (page < 1) {
            throw new InvalidInputException("page 必须从 1 开始");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidInputException("limit 必须在 1 到 " + MAX_PAGE_SIZE + " 之间");
        }
        Page<Project> result = projectRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(page - 1, limit));
        return new PageResponse<>(result.getContent(), page, limit, result.getTotalElements());
    }

    @Override
    public ProjectDetailResponse getProject(String projectId) {
        Project project = requireProject(projectId);
        List<ProjectFile> files = fileRepository.findByProjectId(projectId);
        return new ProjectDetailResponse(project, files, chunkStore.countByProject(projectId));
    }

    @Override
    public void deleteProject(String projectId) {
        List<ProjectFile> files = fileRepository.findByProjectId(projectId);
        Integer chunksDeleted = transactionTemplate.execute(status -> {
            // 1. 先删切片和任务
            int deleted = chunkStore.deleteByProject(projectId);
            jobRepository.deleteByProjectId(projectId);
            // 2. 再删文件和项目
            fileRepository.deleteAll(files);
            projectRepository.findById(projectId).ifPresent(projectRepository::delete);
            return deleted;
        });
        for (ProjectFile file : files) {
            deleteObjectQuietly(file.getStorageKey());
        }
        log.info("项目删除完成：项目ID={}, 文件数={}, 关联切片数={}", projectId, files.size(), chunksDeleted);
    }

    @Override
    public List<String> reprocess(String projectId) {
        Project project = requireProject(projectId);
        if (project.getStatus() != ProjectStatus.FAILED) {
            throw new InvalidInputException("只有处理失败的项目可以重新处理，当前状态: " + project.getStatus());
        }
        List<Submission> submissions = transactionTemplate.execute(status -> {
            project.setStatus(ProjectStatus.CREATING);
            projectRepository.save(project);
            List<Submission> result = new ArrayList<>();
            for (ProjectFile file : fileRepository.findByProjectId(projectId)) {
                file.setProcessingStatus(FileProcessingStatus.PENDING);
                result.add(new Submission(fileRepository.save(file), newJob(file)));
            }
            return result;
        });
        List<String> jobIds = new ArrayList<>();
        for (Submission submission : submissions) {
            publishOrMarkFailed(submission);
            jobIds.add(submission.getJob().getId());
        }
        log.info("项目重新提交处理，项目: {}, 任务数: {}", projectId, jobIds.size());
        return jobIds;
    }

    @Override
    public String enqueue(String fileId) {
        ProjectFile file = fileRepository.findById(fileId)
                .orElseThrow(() -> new NotFoundException("文件不存在: " + fileId));
        Project project = requireProject(file.getProjectId());
        if (!project.getStatus().canTransitionTo(ProjectStatus.CREATING)) {
            throw new InvalidInputException("项目已处理完成，不能重新投递: " + project.getId());
        }
        Submission submission = transactionTemplate.execute(status -> {
            project.setStatus(ProjectStatus.CREATING);
            projectRepository.save(project);
            file.setProcessingStatus(FileProcessingStatus.PENDING);
            return new Submission(fileRepository.save(file), newJob(file));
        });
        publishOrMarkFailed(submission);
        return submission.getJob().getId();
    }

    @Override
    public ProcessingJob getJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("任务不存在: " + jobId));
    }

    private ProcessingJob newJob(ProjectFile file) {
        ProcessingJob job = new ProcessingJob();
        job.setId(UUID.randomUUID().toString());
        job.setFileId(file.getId());
        job.setProjectId(file.getProjectId());
        job.setStatus(JobStatus.PENDING);
        return jobRepository.save(job);
    }

    /**
     * 投递失败时任务、文件、项目标记为失败，再把异常抛给调用方
     */
    private void publishOrMarkFailed(Submission submission) {
        ProjectFile file = submission.getFile();
        ProcessingJob job = submission.getJob();
        ProcessingJobMessage message = ProcessingJobMessage.builder()
                .jobId(job.getId())
                .documentId(file.getProjectId())
                .fileId(file.getId())
                .storageKey(file.getStorageKey())
                .metadata(new ProcessingJobMessage.FileMetadata(file.getFilename(), file.getMimeType(), file.getFileSize()))
                .build();
        try {
            jobPublisher.publish(message);
        } catch (RagException e) {
            statusService.markFailed(job.getId(), file.getId(), file.getProjectId(), "QUEUE: " + e.getMessage());
            throw e;
        }
    }

    private String validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("文件不能为空");
        }
        AppProperties.Upload upload = appProperties.getUpload();
        if (file.getSize() > upload.getMaxFileSize().toBytes()) {
            throw new InvalidInputException("文件大小超过限制: " + upload.getMaxFileSize().toMegabytes() + "MB");
        }
        String contentType = file.getContentType();
        if (contentType == null || "application/octet-stream".equals(contentType)) {
            // 浏览器没有给出类型时按扩展名判断
            String name = file.getOriginalFilename();
            contentType = name != null && name.toLowerCase(Locale.ROOT).endsWith(".pdf") ? "application/pdf" : contentType;
        }
        if (contentType == null || !upload.getAllowedMimeTypes().contains(contentType)) {
            throw new InvalidInputException("不支持的文件类型: " + contentType);
        }
        return contentType;
    }

    private static String requireLength(String value, String field, int max) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidInputException(field + "不能为空");
        }
        if (trimmed.length() > max) {
            throw new InvalidInputException(field + "长度不能超过" + max + "个字符");
        }
        return trimmed;
    }

    private static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "pdf";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private Project requireProject(String projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("项目不存在: " + projectId));
    }

    private void deleteObjectQuietly(String storageKey) {
        try {
            storageService.delete(storageKey);
        } catch (RagException e) {
            log.warn("删除存储对象失败，需人工清理: {}, 原因: {}", storageKey, e.getMessage());
        }
    }

    @Getter
    @AllArgsConstructor
    private static class Submission {
        private final ProjectFile file;
        private final ProcessingJob job;
    }
}
