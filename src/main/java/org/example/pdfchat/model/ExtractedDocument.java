package org.example.pdfchat.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ExtractedDocument {
    private String contentType;
    private List<ExtractedPage> pages;

    public boolean isBlank() {
        return pages.stream().allMatch(page -> page.getText() == null || page.getText().isBlank());
    }

    public int totalLength() {
        return pages.stream().mapToInt(page -> page.getText() == null ? 0 : page.getText().length()).sum();
    }
}
