package org.example.pdfchat.mq;

import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.config.RabbitConfig;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.support.AmqpHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
public class DeadLetterConsumer {
    private static final int MAX_PREVIEW = 1000;

    @RabbitListener(queues = RabbitConfig.PDF_JOB_DL_QUEUE)
    public void onDeadLetter(Message message, Channel channel, @Header(AmqpHeaders.DELIVERY_TAG) long tag) throws IOException {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        if (body.length() > MAX_PREVIEW) {
            body = body.substring(0, MAX_PREVIEW) + "...";
        }
        log.error("收到死信队列消息，请检查消息格式，messageId: {}, 消息体: {}",
                message.getMessageProperties().getMessageId(), body);
        // 死信只记录不处理
        channel.basicAck(tag, false);
    }
}
