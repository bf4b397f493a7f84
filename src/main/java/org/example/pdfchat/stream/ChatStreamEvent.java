package org.example.pdfchat.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * SSE 事件体，三选一：
 * {"token":"..."} / {"complete":true,"sources":[...]} / {"error":"..."}
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"token", "complete", "sources", "error"})
public class ChatStreamEvent {
    private String token;
    private Boolean complete;
    private List<String> sources;
    private String error;

    public static ChatStreamEvent token(String token) {
        return new ChatStreamEvent(token, null, null, null);
    }

    public static ChatStreamEvent complete(List<String> sources) {
        return new ChatStreamEvent(null, Boolean.TRUE, List.copyOf(sources), null);
    }

    public static ChatStreamEvent error(String message) {
        return new ChatStreamEvent(null, null, null, message);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return complete != null || error != null;
    }
}
