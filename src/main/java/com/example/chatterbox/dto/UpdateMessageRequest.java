package com.example.chatterbox.dto;

import java.util.Optional;

/**
 * Request body of {@code PATCH /messages/{id}}. Only the body is editable.
 *
 * @param body replacement message text, required and non-empty
 */
public record UpdateMessageRequest(String body) {

    public static final String MISSING_BODY = "Missing 'body' field in request body for update";
    public static final String EMPTY_BODY = "Message body cannot be empty.";

    public static Optional<String> validate(UpdateMessageRequest request) {
        if (request == null || request.body() == null) {
            return Optional.of(MISSING_BODY);
        }
        if (request.body().isEmpty()) {
            return Optional.of(EMPTY_BODY);
        }
        return Optional.empty();
    }
}
