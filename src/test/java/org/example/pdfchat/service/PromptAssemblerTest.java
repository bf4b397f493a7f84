package org.example.pdfchat.service;

import org.example.pdfchat.config.AppProperties;
import org.example.pdfchat.entity.dto.ChatHistoryTurn;
import org.example.pdfchat.model.RetrievedChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptAssemblerTest {

    private AppProperties appProperties;
    private PromptAssembler assembler;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        assembler = new PromptAssembler(appProperties);
    }

    @Test
    void onlyChunksWithinBudgetAreCited() {
        appProperties.getRetrieval().setMaxContextLength(120);
        List<RetrievedChunk> chunks = List.of(
                chunk("c1", "a".repeat(40)),
                chunk("c2", "b".repeat(40)),
                chunk("c3", "c".repeat(40)));

        PromptAssembler.AssembledPrompt prompt = assembler.assemble("问题", List.of(), chunks);

        assertThat(prompt.getSourceIds()).containsExactly("c1");
        assertThat(prompt.getMessages().get(0).getText()).contains("a".repeat(40)).doesNotContain("b".repeat(40));
    }

    @Test
    void oversizedFirstChunkIsTruncatedNotDropped() {
        appProperties.getRetrieval().setMaxContextLength(50);

        List<String> sources = new ArrayList<>();
        String context = assembler.buildContext(List.of(chunk("c1", "x".repeat(500))), sources);

        assertThat(sources).containsExactly("c1");
        assertThat(context.length()).isLessThanOrEqualTo(50);
    }

    @Test
    void historyIsOrderedOldestFirstAndCapped() {
        appProperties.getChat().setMaxHistoryTurns(2);
        List<ChatHistoryTurn> history = List.of(
                new ChatHistoryTurn("assistant", "第三条", 30L),
                new ChatHistoryTurn("user", "第一条", 10L),
                new ChatHistoryTurn("user", "第二条", 20L));

        List<Message> messages = assembler.assemble("本轮", history, List.of(chunk("c1", "内容"))).getMessages();

        assertThat(messages).hasSize(4);
        assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
        assertThat(messages.get(1).getText()).isEqualTo("第二条");
        assertThat(messages.get(2)).isInstanceOf(AssistantMessage.class);
        assertThat(messages.get(2).getText()).isEqualTo("第三条");
        assertThat(messages.get(3).getText()).isEqualTo("本轮");
    }

    @Test
    void headerOmitsPageWhenUnknown() {
        RetrievedChunk noPage = RetrievedChunk.builder().id("c1").filename("notes.txt").content("正文").build();

        String context = assembler.buildContext(List.of(noPage), new ArrayList<>());

        assertThat(context).startsWith("Source: notes.txt\n正文");
    }

    private static RetrievedChunk chunk(String id, String content) {
        return RetrievedChunk.builder().id(id).filename("manual.pdf").pageNumber(1).content(content).build();
    }
}
