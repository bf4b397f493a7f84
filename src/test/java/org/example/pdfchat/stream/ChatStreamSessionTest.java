package org.example.pdfchat.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ChatStreamSessionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void writesTokensThenSingleCompleteThenCloses() throws Exception {
        RecordingSink sink = new RecordingSink();
        ChatStreamSession session = new ChatStreamSession("s-1", sink);

        for (String token : List.of("The", "answer", "is", "42")) {
            assertThat(session.sendToken(token)).isTrue();
        }
        assertThat(session.sendComplete(List.of("c1", "c2"))).isTrue();

        assertThat(wire(sink.events)).containsExactly(
                "data:{\"token\":\"The\"}",
                "data:{\"token\":\"answer\"}",
                "data:{\"token\":\"is\"}",
                "data:{\"token\":\"42\"}",
                "data:{\"complete\":true,\"sources\":[\"c1\",\"c2\"]}");
        assertThat(session.getState()).isEqualTo(StreamState.CLOSED);
        assertThat(sink.closed).isEqualTo(1);
    }

    @Test
    void nothingIsWrittenAfterTerminalEvent() {
        RecordingSink sink = new RecordingSink();
        ChatStreamSession session = new ChatStreamSession("s-1", sink);

        session.sendError("Chat service error");

        assertThat(session.sendToken("late")).isFalse();
        assertThat(session.sendComplete(List.of())).isFalse();
        assertThat(sink.events).hasSize(1);
        assertThat(sink.events.get(0).getError()).isEqualTo("Chat service error");
    }

    @Test
    void failedWriteClosesSessionAndRunsCancelHookOnce() {
        RecordingSink sink = new RecordingSink();
        sink.failAfter = 2;
        ChatStreamSession session = new ChatStreamSession("s-1", sink);
        AtomicInteger cancelled = new AtomicInteger();
        session.setCancelHook(cancelled::incrementAndGet);

        session.sendToken("a");
        session.sendToken("b");
        assertThat(session.sendToken("c")).isFalse();
        session.clientDisconnected();
        session.sendToken("d");

        assertThat(session.getState()).isEqualTo(StreamState.CLOSED);
        assertThat(sink.events).hasSize(2);
        assertThat(cancelled.get()).isEqualTo(1);
    }

    @Test
    void hookRegisteredAfterDisconnectRunsImmediately() {
        ChatStreamSession session = new ChatStreamSession("s-1", new RecordingSink());
        session.clientDisconnected();
        AtomicInteger cancelled = new AtomicInteger();

        session.setCancelHook(cancelled::incrementAndGet);
        session.clientDisconnected();

        assertThat(cancelled.get()).isEqualTo(1);
    }

    private List<String> wire(List<ChatStreamEvent> events) throws Exception {
        List<String> lines = new ArrayList<>();
        for (ChatStreamEvent event : events) {
            lines.add("data:" + objectMapper.writeValueAsString(event));
        }
        return lines;
    }

    static class RecordingSink implements ChatEventSink {
        final List<ChatStreamEvent> events = new ArrayList<>();
        int closed;
        int failAfter = Integer.MAX_VALUE;

        @Override
        public void send(ChatStreamEvent event) throws IOException {
            if (events.size() >= failAfter) {
                throw new IOException("Broken pipe");
            }
            events.add(event);
        }

        @Override
        public void close() {
            closed++;
        }
    }
}
