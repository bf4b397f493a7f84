package org.example.pdfchat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 流式对话编排线程池：检索和向量化在这里执行，不占用 Servlet 请求线程
     */
    @Bean(name = "chatTaskExecutor")
    public ThreadPoolTaskExecutor chatTaskExecutor(AppProperties appProperties) {
        int threads = appProperties.getChat().getExecutorThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 4);
        executor.setThreadNamePrefix("chat-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * 向量批次并行调用线程池，parallelism 为 1 时基本不会用到
     */
    @Bean(name = "embeddingTaskExecutor")
    public ThreadPoolTaskExecutor embeddingTaskExecutor(AppProperties appProperties) {
        int threads = Math.max(1, appProperties.getEmbedding().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("embedding-");
        executor.initialize();
        return executor;
    }
}
