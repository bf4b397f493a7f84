package org.example.pdfchat.stream;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * 基于 Spring MVC SseEmitter 的事件写出端，每个事件写成一行 data:{json}
 */
public class SseEmitterEventSink implements ChatEventSink {

    private final SseEmitter emitter;

    public SseEmitterEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    /**
     * 创建会话并把 emitter 的超时、出错、结束回调接到会话的断开处理上
     */
    public static ChatStreamSession bind(SseEmitter emitter, String sessionId) {
        ChatStreamSession session = new ChatStreamSession(sessionId, new SseEmitterEventSink(emitter));
        emitter.onTimeout(session::clientDisconnected);
        emitter.onError(e -> session.clientDisconnected());
        emitter.onCompletion(session::clientDisconnected);
        return session;
    }

    @Override
    public void send(ChatStreamEvent event) throws IOException {
        try {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
        } catch (IllegalStateException e) {
            // emitter 已经结束
            throw new IOException(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
