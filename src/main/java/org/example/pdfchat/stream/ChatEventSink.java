package org.example.pdfchat.stream;

import java.io.IOException;

/**
 * 事件写出端
 */
public interface ChatEventSink {

    /**
     * 写出一个事件
     * @throws IOException 客户端已断开
     */
    void send(ChatStreamEvent event) throws IOException;

    /**
     * 正常结束响应
     */
    void close();
}
