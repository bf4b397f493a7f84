package org.example.pdfchat.controller;

import lombok.RequiredArgsConstructor;
import org.example.pdfchat.common.Result;
import org.example.pdfchat.common.exception.InvalidInputException;
import org.example.pdfchat.entity.ProcessingJob;
import org.example.pdfchat.entity.dto.EnqueueJobRequest;
import org.example.pdfchat.service.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final ProjectService projectService;

    @PostMapping
    public ResponseEntity<Result<Map<String, String>>> enqueue(@RequestBody EnqueueJobRequest request) {
        //校验参数
        if (request == null || request.getFileId() == null || request.getFileId().isBlank()) {
            throw new InvalidInputException("fileId 不能为空");
        }
        String jobId = projectService.enqueue(request.getFileId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.accepted(Map.of("jobId", jobId), "任务已提交"));
    }

    @GetMapping("/{jobId}")
    public Result<ProcessingJob> getJob(@PathVariable("jobId") String jobId) {
        return Result.success(projectService.getJob(jobId));
    }
}
