package org.example.pdfchat.service;

import java.io.InputStream;

/**
 * 存储服务接口，key 对调用方是不透明的字符串
 */
public interface StorageService {
    /**
     * 上传文件
     * @param objectName 对象 key
     * @param inputStream 文件流，由调用方关闭
     * @param size 声明的字节数
     * @param contentType MIME 类型
     * @return 对象 key
     */
    String upload(String objectName, InputStream inputStream, long size, String contentType);

    /**
     * 获取文件流
     * @param objectName 对象 key
     * @return 文件流，由调用方关闭
     * @throws org.example.pdfchat.common.exception.NotFoundException key 不存在
     * @throws org.example.pdfchat.common.exception.ServiceUnavailableException 存储服务不可用
     */
    InputStream getFileStream(String objectName);

    /**
     * 删除文件，key 不存在时视为成功
     * @param objectName 对象 key
     */
    void delete(String objectName);
}
