package org.example.pdfchat.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;


@Configuration
public class RabbitConfig {
    //队列名称
    public static final String PDF_JOB_QUEUE = "pdf_jobs";
    //交换机名称
    public static final String PDF_JOB_EXCHANGE = "pdf.jobs.exchange";
    //路由键
    public static final String PDF_JOB_ROUTING_KEY = "pdf.jobs";
    //死信队列
    public static final String PDF_JOB_DL_QUEUE = "pdf_jobs.dlq";
    //死信交换机
    public static final String PDF_JOB_DL_EXCHANGE = "pdf.jobs.dlx";
    //死信路由键
    public static final String PDF_JOB_DL_ROUTING_KEY = "pdf.jobs.dead";

    /**
     * 定义死信交换机
     */
    @Bean
    public DirectExchange deadLetterExchange() {
        return new DirectExchange(PDF_JOB_DL_EXCHANGE, true, false);
    }

    /**
     * 定义死信队列
     */
    @Bean
    public Queue deadLetterQueue() {
        return new Queue(PDF_JOB_DL_QUEUE, true);
    }

    /**
     * 死信队列绑定交换机
     */
    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with(PDF_JOB_DL_ROUTING_KEY);
    }

    /**
     * 定义业务交换机
     */
    @Bean
    public DirectExchange jobExchange() {
        return new DirectExchange(PDF_JOB_EXCHANGE, true, false);
    }

    /**
     * 定义业务队列，broker 重启后队列与持久化消息都保留
     */
    @Bean
    public Queue jobQueue() {
        Map<String, Object> args = new HashMap<>();
        //被拒绝且不重回队列的消息进入死信交换机
        args.put("x-dead-letter-exchange", PDF_JOB_DL_EXCHANGE);
        args.put("x-dead-letter-routing-key", PDF_JOB_DL_ROUTING_KEY);
        return new Queue(PDF_JOB_QUEUE, true, false, false, args);
    }

    /**
     * 业务队列绑定交换机
     */
    @Bean
    public Binding jobBinding() {
        return BindingBuilder.bind(jobQueue())
                .to(jobExchange())
                .with(PDF_JOB_ROUTING_KEY);
    }

    //发送时自动把对象转成 JSON
    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
