package org.example.pdfchat.entity.dto;

import lombok.Data;

@Data
public class EnqueueJobRequest {
    private String fileId;
}
