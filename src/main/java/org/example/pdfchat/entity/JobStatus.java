package org.example.pdfchat.entity;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
