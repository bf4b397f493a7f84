package org.example.pdfchat.service;

import org.example.pdfchat.entity.ProcessingJob;
import org.example.pdfchat.entity.Project;
import org.example.pdfchat.entity.dto.PageResponse;
import org.example.pdfchat.entity.dto.ProjectCreatedResponse;
import org.example.pdfchat.entity.dto.ProjectDetailResponse;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * 项目管理服务接口
 */
public interface ProjectService {
    /**
     * 创建项目并上传文件，文件入库后投递处理任务
     * @param title 标题，1 到 100 个字符
     * @param description 描述，1 到 500 个字符
     * @param file 上传的文件
     */
    ProjectCreatedResponse createProject(String title, String description, MultipartFile file);

    /**
     * 分页查询，按创建时间倒序
     * @param page 从 1 开始
     */
    PageResponse<Project> listProjects(int page, int limit);

    ProjectDetailResponse getProject(String projectId);

    /**
     * 删除项目及其文件、切片、任务和存储对象，重复删除不报错
     */
    void deleteProject(String projectId);

    /**
     * 失败的项目重新处理，每个文件生成新的任务
     * @return 新任务的 id
     */
    List<String> reprocess(String projectId);

    /**
     * 为已有文件投递处理任务
     * @return 新任务的 id
     */
    String enqueue(String fileId);

    ProcessingJob getJob(String jobId);
}
