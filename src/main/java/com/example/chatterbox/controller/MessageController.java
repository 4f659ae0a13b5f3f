package com.example.chatterbox.controller;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.chatterbox.dto.CreateMessageRequest;
import com.example.chatterbox.dto.ErrorResponse;
import com.example.chatterbox.dto.MessageResponse;
import com.example.chatterbox.dto.UpdateMessageRequest;
import com.example.chatterbox.entity.Message;
import com.example.chatterbox.service.MessageService;
import com.example.chatterbox.service.StoreOutcome;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/messages")
@Tag(name = "Message Controller", description = "Create, list, edit and delete board messages")
public class MessageController {

    static final String CREATE_INTEGRITY_VIOLATION = "Failed to create message due to data integrity issue.";
    static final String UPDATE_INTEGRITY_VIOLATION = "Failed to update message due to data integrity issue.";

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @Operation(
        summary = "List all messages",
        description = "Returns every message ordered by creation time, oldest first"
    )
    @GetMapping
    public ResponseEntity<List<MessageResponse>> list() {
        List<MessageResponse> messages = messageService.listAll().stream()
            .map(MessageResponse::from)
            .toList();
        return ResponseEntity.ok(messages);
    }

    @Operation(summary = "Get a single message")
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable long id) {
        return respond(messageService.findById(id), HttpStatus.OK);
    }

    @Operation(
        summary = "Post a new message",
        description = "Both body and username are required and must not be empty"
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "201",
            description = "Message created",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(
                    value = """
                    {
                      "id": 1,
                      "body": "hi",
                      "username": "ana",
                      "created_at": "2026-10-19T09:00:00.123456Z",
                      "updated_at": null
                    }
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "body or username missing or empty")
    })
    @PostMapping
    public ResponseEntity<?> create(
            @Parameter(
                description = "New message",
                content = @Content(
                    examples = @ExampleObject(value = "{\"body\": \"hi\", \"username\": \"ana\"}")
                )
            )
            @RequestBody(required = false) CreateMessageRequest request) {

        Optional<String> violation = CreateMessageRequest.validate(request);
        if (violation.isPresent()) {
            return badRequest(violation.get());
        }

        try {
            return respond(messageService.create(request.body(), request.username()), HttpStatus.CREATED);
        } catch (DataIntegrityViolationException e) {
            return integrityViolation("creating", e, CREATE_INTEGRITY_VIOLATION);
        }
    }

    @Operation(
        summary = "Edit a message body",
        description = "Replaces the body and stamps updated_at; the author cannot be changed"
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Message updated"),
        @ApiResponse(responseCode = "400", description = "body missing or empty"),
        @ApiResponse(responseCode = "404", description = "No message with that id")
    })
    @PatchMapping("/{id}")
    public ResponseEntity<?> update(
            @PathVariable long id,
            @RequestBody(required = false) UpdateMessageRequest request) {

        StoreOutcome<Message> existing = messageService.findById(id);
        if (!existing.isOk()) {
            return respond(existing, HttpStatus.OK);
        }

        Optional<String> violation = UpdateMessageRequest.validate(request);
        if (violation.isPresent()) {
            return badRequest(violation.get());
        }

        try {
            return respond(messageService.update(id, request.body()), HttpStatus.OK);
        } catch (DataIntegrityViolationException e) {
            return integrityViolation("updating", e, UPDATE_INTEGRITY_VIOLATION);
        }
    }

    @Operation(summary = "Delete a message")
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Message deleted",
            content = @Content(
                mediaType = "application/json",
                examples = @ExampleObject(value = "{\"message\": \"Message with id 1 successfully deleted\"}")
            )
        ),
        @ApiResponse(responseCode = "404", description = "No message with that id")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable long id) {
        StoreOutcome<Void> outcome = messageService.delete(id);
        if (!outcome.isOk()) {
            return failure(outcome);
        }
        return ResponseEntity.ok(Map.of("message", "Message with id " + id + " successfully deleted"));
    }

    private ResponseEntity<?> respond(StoreOutcome<Message> outcome, HttpStatus successStatus) {
        if (!outcome.isOk()) {
            return failure(outcome);
        }
        return ResponseEntity.status(successStatus).body(MessageResponse.from(outcome.value()));
    }

    private ResponseEntity<ErrorResponse> failure(StoreOutcome<?> outcome) {
        return switch (outcome.status()) {
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(outcome.message()));
            case INVALID -> badRequest(outcome.message());
            case OK -> throw new IllegalStateException("Not a failure: " + outcome);
        };
    }

    // the service transaction has already rolled back
    private ResponseEntity<ErrorResponse> integrityViolation(String action, DataIntegrityViolationException e, String message) {
        log.warn("Integrity violation while {} message: {}", action, e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(message));
    }

    private ResponseEntity<ErrorResponse> badRequest(String message) {
        log.debug("Rejected request: {}", message);
        return ResponseEntity.badRequest().body(new ErrorResponse(message));
    }
}
