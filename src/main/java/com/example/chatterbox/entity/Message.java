package com.example.chatterbox.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * JPA entity representing a single board message stored in the {@code messages} table.
 * The author ({@code username}) and {@code createdAt} are fixed at insert time;
 * only the {@code body} can be revised, which stamps {@code updatedAt}.
 */
@Entity
@Table(name = "messages")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

    public static final int MAX_BODY_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = MAX_BODY_LENGTH)
    private String body;

    @Column(nullable = false, updatable = false)
    private String username;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Replaces the body and marks the message as updated now, even when the text is unchanged.
     *
     * @param newBody the new message text
     */
    public void revise(String newBody) {
        this.body = newBody;
        this.updatedAt = now();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = now();
        updatedAt = null;
    }

    // database timestamps keep microseconds
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
