package org.example.pdfchat.repository;

import org.example.pdfchat.entity.ProcessingJob;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProcessingJobRepository extends JpaRepository<ProcessingJob, String> {
    List<ProcessingJob> findByFileIdOrderByCreatedAtDesc(String fileId);

    void deleteByProjectId(String projectId);
}
