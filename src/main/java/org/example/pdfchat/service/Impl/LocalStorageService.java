package org.example.pdfchat.service.Impl;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.InvalidInputException;
import org.example.pdfchat.common.exception.NotFoundException;
import org.example.pdfchat.common.exception.ServiceUnavailableException;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.service.StorageService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * 本地磁盘存储，开发环境使用
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "local")
public class LocalStorageService implements StorageService {
    private static final String DEPENDENCY = "object-store";

    private final Path root;

    public LocalStorageService(AppProperties appProperties) {
        this(Paths.get(appProperties.getStorage().getLocalDir()));
    }

    public LocalStorageService(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String upload(String objectName, InputStream inputStream, long size, String contentType) {
        Path target = resolve(objectName);
        try {
            Files.createDirectories(target.getParent());
            long written = Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
            if (size >= 0 && written != size) {
                log.warn("写入字节数与声明不一致，objectName: {}, 声明: {}, 实际: {}", objectName, size, written);
            }
            log.info("文件保存成功，objectName: {}, size: {}", objectName, written);
            return objectName;
        } catch (IOException e) {
            log.error("文件保存失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "文件保存失败: " + e.getMessage(), e);
        }
    }

    @Override
    public InputStream getFileStream(String objectName) {
        Path target = resolve(objectName);
        try {
            return Files.newInputStream(target);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("对象不存在: " + objectName, e);
        } catch (IOException e) {
            log.error("读取文件失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "读取文件失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String objectName) {
        try {
            if (Files.deleteIfExists(resolve(objectName))) {
                log.info("文件删除成功，objectName: {}", objectName);
            }
        } catch (IOException e) {
            log.error("删除文件失败，objectName: {}", objectName, e);
            throw new ServiceUnavailableException(DEPENDENCY, "删除文件失败: " + e.getMessage(), e);
        }
    }

    private Path resolve(String objectName) {
        Path target = root.resolve(objectName).normalize();
        // 防止 ../ 越过存储根目录
        if (!target.startsWith(root)) {
            throw new InvalidInputException("非法的对象 key: " + objectName);
        }
        return target;
    }
}
