package org.example.pdfchat.service.Impl;

import lombok.extern.slf4j.Slf4j;
import org.example.pdfchat.common.exception.InvalidInputException;
import org.example.pdfchat.common.exception.NotFoundException;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.entity.dto.ChatHistoryTurn;
import org.example.pdfchat.entity.dto.ChatRequest;
import org.example.pdfchat.model.RetrievedChunk;
import org.example.pdfchat.repository.ProjectRepository;
import org.example.pdfchat.service.ChatService;
import org.example.pdfchat.service.LlmBackend;
import org.example.pdfchat.service.PromptAssembler;
import org.example.pdfchat.service.VectorSearchService;
import org.example.pdfchat.stream.ChatStreamSession;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;

@Slf4j
@Service
public class ChatServiceImpl implements ChatService {
    static final String NO_CONTENT_ANSWER = "未能在文档中找到相关内容。";
    // 返回给客户端的错误提示，不带内部细节
    static final String STREAM_ERROR = "Chat service error";

    private final VectorSearchService vectorSearchService;
    private final PromptAssembler promptAssembler;
    private final LlmBackend llmBackend;
    private final ProjectRepository projectRepository;
    private final AppProperties appProperties;
    private final TaskExecutor chatTaskExecutor;

    public ChatServiceImpl(VectorSearchService vectorSearchService,
                           PromptAssembler promptAssembler,
                           LlmBackend llmBackend,
                           ProjectRepository projectRepository,
                           AppProperties appProperties,
                           @Qualifier("chatTaskExecutor") TaskExecutor chatTaskExecutor) {
        this.vectorSearchService = vectorSearchService;
        this.promptAssembler = promptAssembler;
        this.llmBackend = llmBackend;
        this.projectRepository = projectRepository;
        this.appProperties = appProperties;
        this.chatTaskExecutor = chatTaskExecutor;
    }

    @Override
    public void validate(ChatRequest request) {
        if (request == null) {
            throw new InvalidInputException("请求不能为空");
        }
        String message = request.getMessage();
        int maxLength = appProperties.getChat().getMaxMessageLength();
        if (message == null || message.trim().isEmpty()) {
            throw new InvalidInputException("问题不能为空");
        }
        if (message.length() > maxLength) {
            throw new InvalidInputException("问题长度不能超过" + maxLength + "个字符");
        }
        if (request.getProjectId() == null || request.getProjectId().isBlank()) {
            throw new InvalidInputException("projectId 不能为空");
        }
        if (request.getChatHistory() != null) {
            for (ChatHistoryTurn turn : request.getChatHistory()) {
                if (turn == null || !("user".equals(turn.getRole()) || "assistant".equals(turn.getRole()))) {
                    throw new InvalidInputException("历史消息的 role 只能是 user 或 assistant");
                }
                if (turn.getContent() == null || turn.getContent().isBlank()) {
                    throw new InvalidInputException("历史消息内容不能为空");
                }
            }
        }
        if (!projectRepository.existsById(request.getProjectId())) {
            throw new NotFoundException("项目不存在: " + request.getProjectId());
        }
    }

    @Override
    public void streamChat(ChatRequest request, ChatStreamSession session) {
        try {
            chatTaskExecutor.execute(() -> doStream(request, session));
        } catch (TaskRejectedException e) {
            // 线程池已满，流已经建立，只能以 error 事件结束
            log.warn("对话线程池已满，拒绝会话: {}", session.getSessionId());
            session.sendError(STREAM_ERROR);
        }
    }

    private void doStream(ChatRequest request, ChatStreamSession session) {
        String sessionId = session.getSessionId();
        try {
            if (!session.isOpen()) {
                log.info("客户端已断开，跳过检索，会话: {}", sessionId);
                return;
            }
            List<RetrievedChunk> chunks = vectorSearchService.search(request.getProjectId(), request.getMessage());
            //如果没查询到相关内容直接返回
            if (chunks.isEmpty()) {
                session.sendToken(NO_CONTENT_ANSWER);
                session.sendComplete(List.of());
                log.info("未检索到相关内容，会话: {}", sessionId);
                return;
            }

            PromptAssembler.AssembledPrompt prompt =
                    promptAssembler.assemble(request.getMessage(), request.getChatHistory(), chunks);
            Duration tokenTimeout = appProperties.getChat().getLlmTimeout();
            Disposable subscription = llmBackend.stream(prompt.getMessages())
                    .timeout(tokenTimeout)
                    .filter(token -> token != null && !token.isEmpty())
                    .subscribe(
                            session::sendToken,
                            error -> {
                                log.error("流式生成失败，会话: {}", sessionId, error);
                                session.sendError(STREAM_ERROR);
                            },
                            () -> {
                                session.sendComplete(prompt.getSourceIds());
                                log.info("流式生成完成，会话: {}, 引用: {}", sessionId, prompt.getSourceIds());
                            });
            // 客户端断开时取消大模型调用
            session.setCancelHook(subscription::dispose);
        } catch (Exception e) {
            log.error("对话处理失败，会话: {}", sessionId, e);
            session.sendError(STREAM_ERROR);
        }
    }
}
