package org.example.pdfchat.service.embedding;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.EmbeddingDimensionMismatchException;
import org.example.pdfchat.common.exception.EmbeddingServiceUnavailableException;
import org.example.pdfchat.common.exception.RagException;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 分批、可选并行、按批次序号重新拼装，并校验数量和维度。
 * 单个批次在服务不可用时按指数退避重试，维度不匹配属于配置错误，不重试。
 * 子类只需要实现单个批次的调用。
 */
@Slf4j
public abstract class AbstractEmbeddingClient implements EmbeddingClient {

    private final int dimension;
    private final int batchSize;
    private final int parallelism;
    private final Executor executor;
    private final int maxRetries;
    private final Duration retryBackoff;

    protected AbstractEmbeddingClient(int dimension, int batchSize, int parallelism, Executor executor) {
        this(dimension, batchSize, parallelism, executor, 0, Duration.ZERO);
    }

    protected AbstractEmbeddingClient(int dimension, int batchSize, int parallelism, Executor executor,
                                      int maxRetries, Duration retryBackoff) {
        if (dimension <= 0 || batchSize <= 0) {
            throw new IllegalArgumentException("dimension 和 batchSize 必须为正数");
        }
        this.dimension = dimension;
        this.batchSize = batchSize;
        this.parallelism = Math.max(1, parallelism);
        this.executor = executor;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoff = retryBackoff == null ? Duration.ZERO : retryBackoff;
    }

    /**
     * 单个批次的调用，返回值与 batch 一一对应
     */
    protected abstract List<float[]> embedBatch(List<String> batch);

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < texts.size(); i += batchSize) {
            batches.add(texts.subList(i, Math.min(i + batchSize, texts.size())));
        }
        log.debug("开始向量化，文本数: {}, 批次数: {}", texts.size(), batches.size());

        List<List<float[]>> results;
        if (parallelism == 1 || batches.size() == 1 || executor == null) {
            results = new ArrayList<>(batches.size());
            for (List<String> batch : batches) {
                results.add(callWithRetry(batch));
            }
        } else {
            results = runParallel(batches);
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        results.forEach(vectors::addAll);
        return vectors;
    }

    private List<List<float[]>> runParallel(List<List<String>> batches) {
        List<CompletableFuture<List<float[]>>> futures = new ArrayList<>(batches.size());
        for (List<String> batch : batches) {
            futures.add(CompletableFuture.supplyAsync(() -> callWithRetry(batch), executor));
        }
        List<List<float[]>> results = new ArrayList<>(batches.size());
        try {
            // 按提交顺序取结果，保证和输入顺序一致
            for (CompletableFuture<List<float[]>> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RagException) {
                throw (RagException) e.getCause();
            }
            throw new EmbeddingServiceUnavailableException("向量化批次执行失败: " + e.getMessage(), e.getCause());
        }
        return results;
    }

    private List<float[]> callWithRetry(List<String> batch) {
        if (maxRetries == 0) {
            return callBatch(batch);
        }
        return Mono.fromCallable(() -> callBatch(batch))
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                        .filter(EmbeddingServiceUnavailableException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("向量服务调用失败，第{}次重试，批次大小: {}, 原因: {}",
                                signal.totalRetries() + 1, batch.size(), signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .block();
    }

    private List<float[]> callBatch(List<String> batch) {
        List<float[]> vectors = embedBatch(batch);
        if (vectors == null || vectors.size() != batch.size()) {
            throw new EmbeddingServiceUnavailableException(
                    "向量数量与输入不一致，输入 " + batch.size() + "，返回 " + (vectors == null ? 0 : vectors.size()));
        }
        for (float[] vector : vectors) {
            if (vector == null || vector.length != dimension) {
                throw new EmbeddingDimensionMismatchException(dimension, vector == null ? 0 : vector.length);
            }
        }
        return vectors;
    }
}
