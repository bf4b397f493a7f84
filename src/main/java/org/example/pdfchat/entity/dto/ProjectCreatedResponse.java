package org.example.pdfchat.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.example.pdfchat.entity.ProjectStatus;

@Data
@AllArgsConstructor
public class ProjectCreatedResponse {
    private String projectId;
    private String fileId;
    private String jobId;
    private ProjectStatus status;
}
