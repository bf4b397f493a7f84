package org.example.pdfchat.mq;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.ServiceUnavailableException;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.config.RabbitConfig;
import org.example.pdfchat.entity.dto.ProcessingJobMessage;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * 投递文档处理任务。返回即表示 broker 已确认收到持久化消息。
 */
@Slf4j
@Component
public class ProcessingJobPublisher {
    private final RabbitTemplate rabbitTemplate;
    private final long confirmTimeoutMillis;

    public ProcessingJobPublisher(RabbitTemplate rabbitTemplate, AppProperties appProperties) {
        this.rabbitTemplate = rabbitTemplate;
        this.confirmTimeoutMillis = appProperties.getQueue().getConfirmTimeout().toMillis();
    }

    public void publish(ProcessingJobMessage job) {
        try {
            rabbitTemplate.invoke(ops -> {
                ops.convertAndSend(RabbitConfig.PDF_JOB_EXCHANGE, RabbitConfig.PDF_JOB_ROUTING_KEY, job);
                ops.waitForConfirmsOrDie(confirmTimeoutMillis);
                return null;
            });
            log.info("任务已投递，jobId: {}, 文件: {}", job.getJobId(), job.getFileId());
        } catch (AmqpException e) {
            log.error("任务投递失败，jobId: {}", job.getJobId(), e);
            throw new ServiceUnavailableException("queue", "任务投递失败: " + e.getMessage(), e);
        }
    }
}
