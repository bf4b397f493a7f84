package org.example.pdfchat.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.entity.dto.ChatHistoryTurn;
import org.example.pdfchat.model.RetrievedChunk;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 组装提示词：系统消息（参考资料）+ 历史对话（按时间从早到晚）+ 本轮问题
 */
@Component
public class PromptAssembler {

    private static final String SYSTEM_TEMPLATE = """
            你是一个专业的文档问答助手。
            请仅根据以下提供的[参考资料]来回答用户的问题，回答时尽量注明来源文件和页码。
            如果[参考资料]中没有包含答案，请直接回答"我不知道"，不要编造信息。

            [参考资料]:
            {context}
            """;

    private final AppProperties appProperties;

    public PromptAssembler(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public AssembledPrompt assemble(String userMessage, List<ChatHistoryTurn> history, List<RetrievedChunk> chunks) {
        List<String> sourceIds = new ArrayList<>();
        String context = buildContext(chunks, sourceIds);

        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(new PromptTemplate(SYSTEM_TEMPLATE).render(Map.of("context", context))));
        for (ChatHistoryTurn turn : recentHistory(history)) {
            if ("assistant".equals(turn.getRole())) {
                messages.add(new AssistantMessage(turn.getContent()));
            } else {
                messages.add(new UserMessage(turn.getContent()));
            }
        }
        messages.add(new UserMessage(userMessage));
        return new AssembledPrompt(messages, sourceIds);
    }

    /**
     * 按检索排名依次拼接，超出长度上限即停止；只有被拼进去的切片才算引用来源
     */
    String buildContext(List<RetrievedChunk> chunks, List<String> sourceIds) {
        int maxLength = appProperties.getRetrieval().getMaxContextLength();
        StringBuilder context = new StringBuilder();
        for (RetrievedChunk chunk : chunks) {
            String block = header(chunk) + "\n" + chunk.getContent() + "\n\n";
            if (context.length() + block.length() > maxLength) {
                if (sourceIds.isEmpty()) {
                    // 第一个切片就超长时截断后放入，保证至少有一条参考资料
                    context.append(block, 0, maxLength);
                    sourceIds.add(chunk.getId());
                }
                break;
            }
            context.append(block);
            sourceIds.add(chunk.getId());
        }
        return context.toString().trim();
    }

    private static String header(RetrievedChunk chunk) {
        String header = "Source: " + chunk.getFilename();
        return chunk.getPageNumber() == null ? header : header + " (Page " + chunk.getPageNumber() + ")";
    }

    /**
     * 按时间戳稳定排序，取最近的若干轮
     */
    List<ChatHistoryTurn> recentHistory(List<ChatHistoryTurn> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<ChatHistoryTurn> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(ChatHistoryTurn::getTimestamp,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        int maxTurns = appProperties.getChat().getMaxHistoryTurns();
        return sorted.size() > maxTurns ? sorted.subList(sorted.size() - maxTurns, sorted.size()) : sorted;
    }

    @Data
    @AllArgsConstructor
    public static class AssembledPrompt {
        private List<Message> messages;
        // 实际放进上下文的切片 id，按排名顺序
        private List<String> sourceIds;
    }
}
