package org.example.pdfchat.repository;

import org.example.pdfchat.entity.Project;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, String> {
    Page<Project> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
