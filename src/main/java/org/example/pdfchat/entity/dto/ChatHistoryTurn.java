package org.example.pdfchat.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatHistoryTurn {
    // user 或 assistant
    private String role;
    private String content;
    // 毫秒时间戳，可为空
    private Long timestamp;
}
