package org.example.pdfchat.service.Impl;

import com.aliyun.oss.ClientException;
import com.aliyun.oss.OSS;
import com.aliyun.oss.OSSErrorCode;
import com.aliyun.oss.OSSException;
import com.aliyun.oss.model.OSSObject;
import com.aliyun.oss.model.ObjectMetadata;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.NotFoundException;
import org.example.pdfchat.common.exception.ServiceUnavailableException;
import org.example.pdfchat.service.StorageService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.InputStream;

@Service
@Slf4j
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "oss", matchIfMissing = true)
public class AliyunOssStorageService implements StorageService {
    private static final String DEPENDENCY = "object-store";

    private final OSS ossClient;
    private final String bucketName;

    public AliyunOssStorageService(OSS ossClient, @Value("${aliyun.oss.bucket-name}") String bucketName) {
        this.ossClient = ossClient;
        this.bucketName = bucketName;
    }

    /**
     * 启动时确认 bucket 存在，不存在则创建
     */
    @PostConstruct
    public void ensureBucket() {
        try {
            if (!ossClient.doesBucketExist(bucketName)) {
                ossClient.createBucket(bucketName);
                log.info("bucket 不存在，已创建: {}", bucketName);
            }
        } catch (Exception e) {
            // 存储暂时不可用不阻止启动，实际读写时再报错
            log.warn("检查 bucket 失败: {}, 原因: {}", bucketName, e.getMessage());
        }
    }

    @Override
    public String upload(String objectName, InputStream inputStream, long size, String contentType) {
        try {
            ObjectMetadata metadata = new ObjectMetadata();
            metadata.setContentLength(size);
            if (contentType != null) {
                metadata.setContentType(contentType);
            }
            ossClient.putObject(bucketName, objectName, inputStream, metadata);
            log.info("文件上传成功，objectName: {}, size: {}", objectName, size);
            return objectName;
        } catch (OSSException | ClientException e) {
            log.error("文件上传失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "文件上传失败: " + e.getMessage(), e);
        }
    }

    @Override
    public InputStream getFileStream(String objectName) {
        try {
            OSSObject ossObject = ossClient.getObject(bucketName, objectName);
            return ossObject.getObjectContent();
        } catch (OSSException e) {
            if (OSSErrorCode.NO_SUCH_KEY.equals(e.getErrorCode())) {
                throw new NotFoundException("对象不存在: " + objectName, e);
            }
            log.error("获取文件流失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "获取文件流失败: " + e.getErrorCode(), e);
        } catch (ClientException e) {
            log.error("获取文件流失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "获取文件流失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String objectName) {
        try {
            ossClient.deleteObject(bucketName, objectName);
            log.info("文件删除成功，objectName: {}", objectName);
        } catch (OSSException | ClientException e) {
            log.error("删除文件失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "删除文件失败: " + e.getMessage(), e);
        }
    }
}
