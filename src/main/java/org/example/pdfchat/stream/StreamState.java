package org.example.pdfchat.stream;

/**
 * OPEN -> TERMINAL_SENT -> CLOSED，客户端断开时 OPEN -> CLOSED
 */
public enum StreamState {
    OPEN,
    TERMINAL_SENT,
    CLOSED
}
