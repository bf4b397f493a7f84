package org.example.pdfchat.config;

import com.aliyun.oss.OSS;
import com.aliyun.oss.OSSClientBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "oss", matchIfMissing = true)
public class StorageConfig {

    /**
     * 进程内共享一个 OSS 客户端，启动时创建，容器关闭时 shutdown
     */
    @Bean(destroyMethod = "shutdown")
    public OSS ossClient(@Value("${aliyun.oss.endpoint}") String endpoint,
                         @Value("${aliyun.oss.access-key-id}") String accessKeyId,
                         @Value("${aliyun.oss.access-key-secret}") String accessKeySecret) {
        return new OSSClientBuilder().build(endpoint, accessKeyId, accessKeySecret);
    }
}
