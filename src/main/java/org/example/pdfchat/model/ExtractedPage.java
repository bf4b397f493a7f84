package org.example.pdfchat.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ExtractedPage {
    // 从 1 开始；非分页格式为 null
    private Integer pageNumber;
    private String text;
}
