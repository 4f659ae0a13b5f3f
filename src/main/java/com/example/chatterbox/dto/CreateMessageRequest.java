package com.example.chatterbox.dto;

import java.util.Optional;

/**
 * Request body of {@code POST /messages}.
 *
 * @param body     message text, required and non-empty
 * @param username author name, required and non-empty
 */
public record CreateMessageRequest(String body, String username) {

    public static final String MISSING_FIELDS = "Missing required fields: 'body' and 'username'";
    public static final String EMPTY_FIELDS = "Body and username cannot be empty.";

    /**
     * Checks the request before it reaches the store. A {@code null} request means no JSON body was sent.
     *
     * @param request the bound request, may be {@code null}
     * @return the first violation, or empty if the request is valid
     */
    public static Optional<String> validate(CreateMessageRequest request) {
        if (request == null || request.body() == null || request.username() == null) {
            return Optional.of(MISSING_FIELDS);
        }
        if (request.body().isEmpty() || request.username().isEmpty()) {
            return Optional.of(EMPTY_FIELDS);
        }
        return Optional.empty();
    }
}
