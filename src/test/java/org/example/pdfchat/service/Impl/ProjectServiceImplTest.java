package org.example.pdfchat.service.Impl;

import org.example.pdfchat.common.exception.InvalidInputException;
import org.example.pdfchat.common.exception.NotFoundException;
import org.example.pdfchat.common.exception.ServiceUnavailableException;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.entity.FileProcessingStatus;
import org.example.pdfchat.entity.JobStatus;
import org.example.pdfchat.entity.Project;
import org.example.pdfchat.entity.ProjectFile;
import org.example.pdfchat.entity.ProjectStatus;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.example.pdfchat.entity.dto.ProjectCreatedResponse;
import org.example.pdfchat.mq.ProcessingJobPublisher;
import org.example.pdfchat.service.ProcessingStatusService;
import org.example.pdfchat.service.StorageService;
import org.example.pdfchat.support.InMemoryChunkStore;
import org.example.pdfchat.support.InMemoryRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.unit.DataSize;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ProjectServiceImplTest {

    private InMemoryRepositories repos;
    private StorageService storageService;
    private ProcessingJobPublisher publisher;
    private AppProperties appProperties;
    private ProjectServiceImpl service;

    @BeforeEach
    void setUp() {
        repos = new InMemoryRepositories();
        storageService = mock(StorageService.class);
        publisher = mock(ProcessingJobPublisher.class);
        appProperties = new AppProperties();
        ProcessingStatusService statusService = new ProcessingStatusService(
                repos.jobRepository, repos.fileRepository, repos.projectRepository);
        service = new ProjectServiceImpl(repos.projectRepository, repos.fileRepository, repos.jobRepository,
                new InMemoryChunkStore(), storageService, publisher, statusService,
                new TransactionTemplate(mock(PlatformTransactionManager.class)), appProperties);
    }

    @Test
    void createStoresFileRegistersRowsAndPublishesJob() {
        ProjectCreatedResponse response = service.createProject(" 年度报告 ", "财务数据", pdf("report.pdf"));

        assertThat(response.getStatus()).isEqualTo(ProjectStatus.CREATING);
        Project project = repos.projects.get(response.getProjectId());
        assertThat(project.getTitle()).isEqualTo("年度报告");
        ProjectFile file = repos.files.get(response.getFileId());
        assertThat(file.getStorageKey()).startsWith("uploads/").endsWith("_" + response.getProjectId() + ".pdf");
        assertThat(repos.jobs.get(response.getJobId()).getStatus()).isEqualTo(JobStatus.PENDING);

        verify(storageService).upload(eq(file.getStorageKey()), any(), eq(8L), eq("application/pdf"));
        ArgumentCaptor<ProcessingJobMessage> captor = ArgumentCaptor.forClass(ProcessingJobMessage.class);
        verify(publisher).publish(captor.capture());
        assertThat(captor.getValue().getJobId()).isEqualTo(response.getJobId());
        assertThat(captor.getValue().getDocumentId()).isEqualTo(response.getProjectId());
        assertThat(captor.getValue().originalName()).isEqualTo("report.pdf");
    }

    @Test
    void invalidInputIsRejectedBeforeAnySideEffect() {
        assertThatThrownBy(() -> service.createProject("", "描述", pdf("a.pdf")))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.createProject("t".repeat(101), "描述", pdf("a.pdf")))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.createProject("标题", "d".repeat(501), pdf("a.pdf")))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.createProject("标题", "描述",
                new MockMultipartFile("file", "a.docx", "application/msword", new byte[]{1, 2, 3})))
                .isInstanceOf(InvalidInputException.class);

        appProperties.getUpload().setMaxFileSize(DataSize.ofBytes(4));
        assertThatThrownBy(() -> service.createProject("标题", "描述", pdf("big.pdf")))
                .isInstanceOf(InvalidInputException.class);

        verifyNoInteractions(storageService, publisher);
        assertThat(repos.projects).isEmpty();
    }

    @Test
    void publishFailureMarksEverythingFailedAndSurfacesUnavailable() {
        doThrow(new ServiceUnavailableException("queue", "broker down")).when(publisher).publish(any());

        assertThatThrownBy(() -> service.createProject("标题", "描述", pdf("a.pdf")))
                .isInstanceOf(ServiceUnavailableException.class);

        Project project = repos.projects.values().iterator().next();
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.FAILED);
        assertThat(repos.files.values()).allSatisfy(f ->
                assertThat(f.getProcessingStatus()).isEqualTo(FileProcessingStatus.FAILED));
        assertThat(repos.jobs.values()).allSatisfy(j -> {
            assertThat(j.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(j.getErrorMessage()).startsWith("QUEUE: ");
        });
    }

    @Test
    void reprocessOnlyFromFailed() {
        Project project = project("p-1", ProjectStatus.CREATED);
        assertThatThrownBy(() -> service.reprocess("p-1")).isInstanceOf(InvalidInputException.class);

        project.setStatus(ProjectStatus.FAILED);
        addFile("f-1", "p-1", FileProcessingStatus.FAILED);
        List<String> jobIds = service.reprocess("p-1");

        assertThat(jobIds).hasSize(1);
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.CREATING);
        assertThat(repos.files.get("f-1").getProcessingStatus()).isEqualTo(FileProcessingStatus.PENDING);
        verify(publisher).publish(any());
    }

    @Test
    void enqueueUnknownFileIsNotFound() {
        assertThatThrownBy(() -> service.enqueue("missing")).isInstanceOf(NotFoundException.class);
        verify(publisher, never()).publish(any());
    }

    @Test
    void deleteIsIdempotent() {
        project("p-1", ProjectStatus.CREATED);
        addFile("f-1", "p-1", FileProcessingStatus.DONE);

        service.deleteProject("p-1");
        service.deleteProject("p-1");

        verify(repos.projectRepository).delete(any(Project.class));
        verify(storageService).delete("uploads/f-1.pdf");
        assertThat(repos.projects).isEmpty();
        assertThat(repos.files).isEmpty();
    }

    @Test
    void storageFailureDuringUploadDoesNotTouchDatabase() {
        doThrow(new ServiceUnavailableException("object-store", "timeout"))
                .when(storageService).upload(anyString(), any(), anyLong(), anyString());

        assertThatThrownBy(() -> service.createProject("标题", "描述", pdf("a.pdf")))
                .isInstanceOf(ServiceUnavailableException.class);
        assertThat(repos.projects).isEmpty();
        verifyNoInteractions(publisher);
    }

    private Project project(String id, ProjectStatus status) {
        Project project = new Project();
        project.setId(id);
        project.setTitle("标题");
        project.setDescription("描述");
        project.setStatus(status);
        repos.projects.put(id, project);
        return project;
    }

    private void addFile(String id, String projectId, FileProcessingStatus status) {
        ProjectFile file = new ProjectFile();
        file.setId(id);
        file.setProjectId(projectId);
        file.setFilename(id + ".pdf");
        file.setStorageKey("uploads/" + id + ".pdf");
        file.setMimeType("application/pdf");
        file.setProcessingStatus(status);
        repos.files.put(id, file);
    }

    private static MockMultipartFile pdf(String name) {
        return new MockMultipartFile("file", name, "application/pdf", "%PDF-1.4".getBytes());
    }
}
