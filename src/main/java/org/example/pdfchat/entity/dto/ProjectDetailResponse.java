package org.example.pdfchat.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.example.pdfchat.entity.Project;
import org.example.pdfchat.entity.ProjectFile;

import java.util.List;

@Data
@AllArgsConstructor
public class ProjectDetailResponse {
    private Project project;
    private List<ProjectFile> files;
    private long chunkCount;
}
