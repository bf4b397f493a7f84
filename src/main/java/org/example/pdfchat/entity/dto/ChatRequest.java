package org.example.pdfchat.entity.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {
    private String message;
    @JsonAlias("documentId")
    private String projectId;
    private List<ChatHistoryTurn> chatHistory = new ArrayList<>();
}
