package com.example.chatterbox.dto;

import java.time.Instant;

import com.example.chatterbox.entity.Message;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * JSON view of a {@link Message}. {@code updated_at} is written as {@code null} until the first update.
 */
@JsonPropertyOrder({"id", "body", "username", "created_at", "updated_at"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record MessageResponse(
        Long id,
        String body,
        String username,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    public static MessageResponse from(Message message) {
        return new MessageResponse(
                message.getId(),
                message.getBody(),
                message.getUsername(),
                message.getCreatedAt(),
                message.getUpdatedAt());
    }
}
