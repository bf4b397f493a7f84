package org.example.pdfchat.service.Impl;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.ServiceUnavailableException;
import org.example.pdfchat.service.LlmBackend;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

@Slf4j
@Component
public class SpringAiLlmBackend implements LlmBackend {

    private final ChatClient chatClient;

    public SpringAiLlmBackend(ChatClient.Builder chatClientBuilder) {
        this.chatClient = chatClientBuilder.build();
    }

    @Override
    public Flux<String> stream(List<Message> messages) {
        return chatClient.prompt(new Prompt(messages))
                .stream()
                .content()
                .onErrorMap(e -> !(e instanceof ServiceUnavailableException),
                        e -> new ServiceUnavailableException("llm", "大模型调用失败: " + e.getMessage(), e));
    }
}
