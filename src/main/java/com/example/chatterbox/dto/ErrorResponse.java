package com.example.chatterbox.dto;

/**
 * Body of every 4xx/5xx response: {@code {"error": "..."}}.
 *
 * @param error human-readable description, never a stack trace
 */
public record ErrorResponse(String error) {
}
