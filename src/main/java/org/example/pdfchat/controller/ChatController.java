package org.example.pdfchat.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.InvalidInputException;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.entity.dto.ChatHistoryTurn;
import org.example.pdfchat.entity.dto.ChatRequest;
import org.example.pdfchat.service.ChatService;
import org.example.pdfchat.stream.ChatStreamSession;
import org.example.pdfchat.stream.SseEmitterEventSink;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 流式问答。参数校验失败时返回普通 JSON 错误，校验通过后才打开事件流。
 */
@Slf4j
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {
    private final ChatService chatService;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    /**
     * EventSource 只能发 GET，历史对话以 JSON 字符串放在 chatHistory 参数里
     */
    @GetMapping("/stream")
    public SseEmitter streamGet(@RequestParam("message") String message,
                                @RequestParam("projectId") String projectId,
                                @RequestParam(value = "chatHistory", required = false) String chatHistory) {
        ChatRequest request = new ChatRequest(message, projectId, parseHistory(chatHistory));
        return open(request);
    }

    @PostMapping("/stream")
    public SseEmitter streamPost(@RequestBody ChatRequest request) {
        return open(request);
    }

    private SseEmitter open(ChatRequest request) {
        chatService.validate(request);
        SseEmitter emitter = new SseEmitter(appProperties.getChat().getStreamTimeout().toMillis());
        ChatStreamSession session = SseEmitterEventSink.bind(emitter, UUID.randomUUID().toString());
        log.info("打开对话流，会话: {}, 项目: {}", session.getSessionId(), request.getProjectId());
        chatService.streamChat(request, session);
        return emitter;
    }

    private List<ChatHistoryTurn> parseHistory(String chatHistory) {
        if (chatHistory == null || chatHistory.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<ChatHistoryTurn> turns = objectMapper.readValue(chatHistory, new TypeReference<List<ChatHistoryTurn>>() {
            });
            return turns == null ? new ArrayList<>() : turns;
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("chatHistory 不是合法的 JSON 数组");
        }
    }
}
