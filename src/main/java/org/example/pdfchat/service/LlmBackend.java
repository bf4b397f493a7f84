package org.example.pdfchat.service;

import org.springframework.ai.chat.messages.Message;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * 大模型流式调用，取消订阅即中止生成
 */
public interface LlmBackend {

    Flux<String> stream(List<Message> messages);
}
