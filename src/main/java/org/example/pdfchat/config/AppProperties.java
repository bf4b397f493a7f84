package org.example.pdfchat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 应用自定义配置，对应 application.yml 中的 app.*
 */
@Data
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Storage storage = new Storage();
    private Upload upload = new Upload();
    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private Chat chat = new Chat();

    @Data
    public static class Queue {
        // 等待 broker 确认的最长时间
        private Duration confirmTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Worker {
        private String concurrency = "5-10";
        // 处理中锁的过期时间，需大于单个任务的最长处理时间
        private Duration lockTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Storage {
        // oss 或 local
        private String type = "oss";
        private String localDir = "./uploads";
    }

    @Data
    public static class Upload {
        private DataSize maxFileSize = DataSize.ofMegabytes(50);
        private List<String> allowedMimeTypes = new ArrayList<>(List.of("application/pdf"));
    }

    @Data
    public static class Chunking {
        private int chunkSize = 800;
        private int minChunkSizeChars = 350;
        private int minChunkLengthToEmbed = 5;
        private int maxNumChunks = 10000;
    }

    @Data
    public static class Embedding {
        // remote: 外部向量服务；model: Spring AI EmbeddingModel
        private String provider = "remote";
        private String baseUrl = "http://localhost:8000";
        private int dimension = 384;
        private int batchSize = 32;
        private int parallelism = 1;
        private Duration timeout = Duration.ofSeconds(30);
        // 服务不可用时每个批次的重试次数，0 表示不重试
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Retrieval {
        private int topK = 5;
        private double minSimilarity = 0.3;
        private int maxContextLength = 4000;
        private Duration queryCacheTtl = Duration.ofHours(1);
    }

    @Data
    public static class Chat {
        private int maxMessageLength = 10000;
        private int maxHistoryTurns = 20;
        // 两个 token 之间的最长等待时间
        private Duration llmTimeout = Duration.ofSeconds(60);
        private Duration streamTimeout = Duration.ofMinutes(5);
        private int executorThreads = 16;
    }
}
