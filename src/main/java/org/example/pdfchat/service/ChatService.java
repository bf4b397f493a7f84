package org.example.pdfchat.service;

import org.example.pdfchat.entity.dto.ChatRequest;
import org.example.pdfchat.stream.ChatStreamSession;

/**
 * 流式问答服务接口
 */
public interface ChatService {
    /**
     * 校验请求，必须在打开事件流之前调用
     * @throws org.example.pdfchat.common.exception.InvalidInputException 参数不合法
     * @throws org.example.pdfchat.common.exception.NotFoundException 项目不存在
     */
    void validate(ChatRequest request);

    /**
     * 异步执行检索和生成，事件写到 session；方法本身立即返回
     */
    void streamChat(ChatRequest request, ChatStreamSession session);
}
