package org.example.pdfchat.mq;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.config.AppProperties;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * 任务处理中锁，同一个 jobId 同一时间只有一个消费者在处理。
 * 锁的值是持有者令牌，只有持有者能释放；被重新投递接管后，原持有者释放时不会删掉新锁。
 * Redis 不可用时放行，重复处理由切片整体替换和已完成任务不再标记失败兜底。
 */
@Slf4j
@Component
public class JobLockManager {
    private static final String KEY_PREFIX = "pdfchat:job:";

    // 值相等才删除
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration lockTtl;

    public JobLockManager(RedisTemplate<String, Object> redisTemplate, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.lockTtl = appProperties.getWorker().getLockTtl();
    }

    /**
     * @param takeover 为 true 时覆盖已有的锁，用于 broker 重新投递（原消费者的连接已经断开）
     * @return 持有者令牌，没拿到锁时返回 null
     */
    public String tryAcquire(String jobId, boolean takeover) {
        String key = KEY_PREFIX + jobId;
        String token = UUID.randomUUID().toString();
        try {
            if (takeover) {
                Object previous = redisTemplate.opsForValue().getAndSet(key, token);
                redisTemplate.expire(key, lockTtl);
                if (previous != null) {
                    log.warn("重新投递接管任务锁，jobId: {}, 原持有者: {}", jobId, previous);
                }
                return token;
            }
            Boolean absent = redisTemplate.opsForValue().setIfAbsent(key, token, lockTtl);
            return Boolean.FALSE.equals(absent) ? null : token;
        } catch (Exception e) {
            log.warn("获取任务锁失败，按未加锁处理，jobId: {}, 原因: {}", jobId, e.getMessage());
            return token;
        }
    }

    public void release(String jobId, String token) {
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(KEY_PREFIX + jobId), token);
            if (deleted == null || deleted == 0) {
                log.info("任务锁已被接管或已过期，不释放，jobId: {}", jobId);
            }
        } catch (Exception e) {
            log.warn("释放任务锁失败，等待过期，jobId: {}, 原因: {}", jobId, e.getMessage());
        }
    }
}
