package org.example.pdfchat.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 缓存管理器。
 * Redis 读写失败只记日志，不影响主流程，缓存不可用时退化为每次都加载。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheManager {
    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * 获取缓存值
     * @param key 缓存键
     * @return 缓存值，如果不存在或读取失败则返回 null
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        try {
            Object value = redisTemplate.opsForValue().get(key);
            if (value != null) {
                log.debug("缓存命中，key: {}", key);
                return (T) value;
            }
            log.debug("缓存未命中，key: {}", key);
            return null;
        } catch (Exception e) {
            log.warn("获取缓存失败，key: {}, 原因: {}", key, e.getMessage());
            return null;
        }
    }

    /**
     * 设置缓存值，null 不写入
     */
    public void put(String key, Object value, Duration expire) {
        if (value == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, value, expire);
            log.debug("缓存设置成功，key: {}", key);
        } catch (Exception e) {
            log.warn("设置缓存失败，key: {}, 原因: {}", key, e.getMessage());
        }
    }

    /**
     * 获取缓存，如果不存在则加载并写入。
     * 加载器抛出的异常原样向上抛，调用方据此判断错误类型。
     *
     * @param key 缓存键
     * @param loader 数据加载器（当缓存不存在时调用）
     * @param expire 过期时间
     */
    public <T> T getOrLoad(String key, Supplier<T> loader, Duration expire) {
        T cachedValue = get(key);
        if (cachedValue != null) {
            return cachedValue;
        }
        log.debug("缓存加载，key={}", key);
        T loadedValue = loader.get();
        put(key, loadedValue, expire);
        return loadedValue;
    }

    public String generateKey(String module, String identifier, String... params) {
        StringBuilder key = new StringBuilder(module).append(":").append(identifier);
        for (String param : params) {
            key.append(":").append(param);
        }
        return key.toString();
    }
}
