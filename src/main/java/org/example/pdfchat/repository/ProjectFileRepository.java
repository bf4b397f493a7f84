package org.example.pdfchat.repository;

import org.example.pdfchat.entity.FileProcessingStatus;
import org.example.pdfchat.entity.ProjectFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProjectFileRepository extends JpaRepository<ProjectFile, String> {
    List<ProjectFile> findByProjectId(String projectId);

    // 项目下还有多少文件没有处理完成
    long countByProjectIdAndProcessingStatusNot(String projectId, FileProcessingStatus status);
}
