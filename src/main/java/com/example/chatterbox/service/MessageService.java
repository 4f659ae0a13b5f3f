package com.example.chatterbox.service;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.chatterbox.entity.Message;
import com.example.chatterbox.repository.MessageRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Message store operations. Each method runs in a single transaction that is
 * rolled back on any runtime failure, so a row is never left half-modified.
 * Expected failures (unknown id, empty field) are reported through {@link StoreOutcome}.
 */
@Slf4j
@Service
public class MessageService {

    private final MessageRepository messageRepository;

    public MessageService(MessageRepository messageRepository) {
        this.messageRepository = messageRepository;
    }

    @Transactional
    public StoreOutcome<Message> create(String body, String username) {
        if (isEmpty(body) || isEmpty(username)) {
            return StoreOutcome.invalid("Body and username cannot be empty.");
        }

        Message saved = messageRepository.saveAndFlush(Message.builder()
                .body(body)
                .username(username)
                .build());

        log.info("Created message {} by {}", saved.getId(), saved.getUsername());
        return StoreOutcome.ok(saved);
    }

    @Transactional(readOnly = true)
    public List<Message> listAll() {
        return messageRepository.findAllByOrderByCreatedAtAscIdAsc();
    }

    @Transactional(readOnly = true)
    public StoreOutcome<Message> findById(long id) {
        return messageRepository.findById(id)
                .map(StoreOutcome::ok)
                .orElseGet(() -> StoreOutcome.notFound(notFoundMessage(id)));
    }

    @Transactional
    public StoreOutcome<Message> update(long id, String newBody) {
        Message message = messageRepository.findById(id).orElse(null);
        if (message == null) {
            return StoreOutcome.notFound(notFoundMessage(id));
        }
        if (isEmpty(newBody)) {
            return StoreOutcome.invalid("Message body cannot be empty.");
        }

        message.revise(newBody);
        Message saved = messageRepository.saveAndFlush(message);

        log.info("Updated message {}", id);
        return StoreOutcome.ok(saved);
    }

    @Transactional
    public StoreOutcome<Void> delete(long id) {
        Message message = messageRepository.findById(id).orElse(null);
        if (message == null) {
            return StoreOutcome.notFound(notFoundMessage(id));
        }

        messageRepository.delete(message);
        messageRepository.flush();

        log.info("Deleted message {}", id);
        return StoreOutcome.ok(null);
    }

    public static String notFoundMessage(long id) {
        return "Message with id " + id + " not found";
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
