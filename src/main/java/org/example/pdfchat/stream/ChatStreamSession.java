package org.example.pdfchat.stream;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次流式对话连接。
 * 所有写操作串行执行，最多写出一个终止事件，关闭后的写入直接忽略；
 * 进入 CLOSED 时执行取消回调，且只执行一次。
 */
@Slf4j
public class ChatStreamSession {

    private final String sessionId;
    private final ChatEventSink sink;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private StreamState state = StreamState.OPEN;
    private Runnable cancelHook;

    public ChatStreamSession(String sessionId, ChatEventSink sink) {
        this.sessionId = sessionId;
        this.sink = sink;
    }

    public String getSessionId() {
        return sessionId;
    }

    public synchronized StreamState getState() {
        return state;
    }

    public synchronized boolean isOpen() {
        return state == StreamState.OPEN;
    }

    /**
     * @return 是否真正写出
     */
    public boolean sendToken(String token) {
        return write(ChatStreamEvent.token(token));
    }

    public boolean sendComplete(List<String> sources) {
        return write(ChatStreamEvent.complete(sources));
    }

    public boolean sendError(String message) {
        return write(ChatStreamEvent.error(message));
    }

    /**
     * 注册取消回调；如果连接已经关闭，立即执行
     */
    public void setCancelHook(Runnable hook) {
        boolean runNow;
        synchronized (this) {
            this.cancelHook = hook;
            runNow = state == StreamState.CLOSED;
        }
        if (runNow) {
            runCancelHook();
        }
    }

    /**
     * 客户端断开、写失败或响应超时
     */
    public void clientDisconnected() {
        synchronized (this) {
            if (state == StreamState.CLOSED) {
                return;
            }
            log.info("客户端断开，会话: {}, 状态: {}", sessionId, state);
            state = StreamState.CLOSED;
        }
        runCancelHook();
    }

    private boolean write(ChatStreamEvent event) {
        boolean disconnected = false;
        boolean terminal = false;
        synchronized (this) {
            if (state != StreamState.OPEN) {
                log.debug("会话已结束，丢弃事件，会话: {}", sessionId);
                return false;
            }
            try {
                sink.send(event);
            } catch (IOException e) {
                log.info("写出事件失败，视为客户端断开，会话: {}, 原因: {}", sessionId, e.getMessage());
                state = StreamState.CLOSED;
                disconnected = true;
            }
            if (!disconnected && event.isTerminal()) {
                state = StreamState.TERMINAL_SENT;
                terminal = true;
            }
        }
        // 取消回调在锁外执行
        if (disconnected) {
            runCancelHook();
            return false;
        }
        if (terminal) {
            close();
        }
        return true;
    }

    private void close() {
        synchronized (this) {
            if (state == StreamState.CLOSED) {
                return;
            }
            state = StreamState.CLOSED;
            sink.close();
        }
        runCancelHook();
    }

    private void runCancelHook() {
        Runnable hook;
        synchronized (this) {
            hook = cancelHook;
        }
        if (hook != null && cancelled.compareAndSet(false, true)) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("执行取消回调失败，会话: {}, 原因: {}", sessionId, e.getMessage());
            }
        }
    }
}
