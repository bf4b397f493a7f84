package org.example.pdfchat.mq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.InvalidJobPayloadException;
import org.example.pdfchat.config.RabbitConfig;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.example.pdfchat.model.ProcessingOutcome;
import org.example.pdfchat.service.DocumentProcessor;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 文档处理任务消费者，手动 ACK：
 * - 消息体不合法：拒绝且不重回队列，进入死信队列
 * - 同一任务正在被其他消费者处理：直接 ACK 丢弃
 * - 处理成功或失败状态已记录：ACK
 * - 失败状态没能记录（如数据库不可用）：NACK 重回队列
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessingJobConsumer {
    private final ObjectMapper objectMapper; // Spring Boot 自动注入
    private final DocumentProcessor documentProcessor;
    private final JobLockManager jobLockManager;

    @RabbitListener(queues = RabbitConfig.PDF_JOB_QUEUE, concurrency = "${app.worker.concurrency:5-10}")
    public void onMessage(Message message, Channel channel, @Header(AmqpHeaders.DELIVERY_TAG) long tag) throws IOException {
        ProcessingJobMessage job;
        try {
            job = objectMapper.readValue(message.getBody(), ProcessingJobMessage.class);
            job.validate();
        } catch (IOException | InvalidJobPayloadException e) {
            log.error("任务消息不合法，转入死信队列，原因: {}, 消息体: {}", e.getMessage(), preview(message.getBody()));
            //拒绝消息并且不重回队列
            channel.basicReject(tag, false);
            return;
        }

        String jobId = job.getJobId();
        boolean redelivered = Boolean.TRUE.equals(message.getMessageProperties().isRedelivered());
        log.info("收到MQ消息，jobId: {}, 文件: {}, 重新投递: {}", jobId, job.getFileId(), redelivered);
        String lockToken = jobLockManager.tryAcquire(jobId, redelivered);
        if (lockToken == null) {
            log.warn("检测到重复投递，任务正在处理中，jobId: {}", jobId);
            channel.basicAck(tag, false);
            return;
        }

        try {
            ProcessingOutcome outcome = documentProcessor.process(job);
            channel.basicAck(tag, false);
            log.info("任务结束，jobId: {}, 状态: {}, 切片数: {}", jobId, outcome.getStatus(), outcome.getChunkCount());
        } catch (Exception e) {
            log.error("任务终态记录失败，消息重回队列，jobId: {}", jobId, e);
            channel.basicNack(tag, false, true);
        } finally {
            jobLockManager.release(jobId, lockToken);
        }
    }

    private static String preview(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
