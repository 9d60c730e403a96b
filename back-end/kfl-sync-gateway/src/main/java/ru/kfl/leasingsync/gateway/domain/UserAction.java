package ru.kfl.leasingsync.gateway.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of something a user did in the bot. No setters: rows are
 * never updated once written.
 */
@Entity
@Table(
        name = "user_actions",
        indexes = {
                @Index(name = "ix_user_actions_telegram_id", columnList = "telegram_id"),
                @Index(name = "ix_user_actions_created_at", columnList = "created_at")
        }
)
@Getter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class UserAction {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY) @JoinColumn(name = "user_id")
    private TelegramUser user; // lookup only, may be null

    @Column(name = "telegram_id", nullable = false, updatable = false)
    private Long telegramId;

    @Column(length = 255, updatable = false)
    private String username;

    @Column(name = "first_name", length = 255, updatable = false)
    private String firstName;

    @Column(name = "last_name", length = 255, updatable = false)
    private String lastName;

    @Column(nullable = false, length = 128, updatable = false)
    private String action;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "raw_payload", columnDefinition = "TEXT", updatable = false)
    private String rawPayload;
}
