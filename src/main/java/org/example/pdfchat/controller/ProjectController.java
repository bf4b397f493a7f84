package org.example.pdfchat.controller;

import lombok.RequiredArgsConstructor;
import org.example.pdfchat.common.Result;
import org.example.pdfchat.entity.Project;
import org.example.pdfchat.entity.dto.PageResponse;
import org.example.pdfchat.entity.dto.ProjectCreatedResponse;
import org.example.pdfchat.entity.dto.ProjectDetailResponse;
import org.example.pdfchat.service.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Result<ProjectCreatedResponse>> createProject(@RequestParam("title") String title,
                                                                        @RequestParam("description") String description,
                                                                        @RequestParam("file") MultipartFile file) {
        ProjectCreatedResponse response = projectService.createProject(title, description, file);
        return ResponseEntity.status(HttpStatus.CREATED).body(Result.success(response, "项目创建成功，正在后台处理"));
    }

    @GetMapping
    public Result<PageResponse<Project>> listProjects(@RequestParam(value = "page", defaultValue = "1") int page,
                                                      @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return Result.success(projectService.listProjects(page, limit));
    }

    @GetMapping("/{id}")
    public Result<ProjectDetailResponse> getProject(@PathVariable("id") String projectId) {
        return Result.success(projectService.getProject(projectId));
    }

    @DeleteMapping("/{id}")
    public Result<String> deleteProject(@PathVariable("id") String projectId) {
        projectService.deleteProject(projectId);
        return Result.success("删除成功");
    }

    @PostMapping("/{id}/reprocess")
    public ResponseEntity<Result<Map<String, List<String>>>> reprocess(@PathVariable("id") String projectId) {
        List<String> jobIds = projectService.reprocess(projectId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.accepted(Map.of("jobIds", jobIds), "已重新提交处理"));
    }
}
