package org.example.pdfchat.entity;

public enum FileProcessingStatus {
    PENDING,
    PROCESSING,
    DONE,
    FAILED
}
