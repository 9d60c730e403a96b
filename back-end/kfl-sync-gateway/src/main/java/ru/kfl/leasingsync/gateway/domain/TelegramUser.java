package ru.kfl.leasingsync.gateway.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import ru.kfl.leasingsync.shared.model.UserRole;

import java.time.Instant;

@Entity
@Table(name = "telegram_users")
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class TelegramUser {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "telegram_id", nullable = false, unique = true, updatable = false)
    private Long telegramId;

    @Column(length = 255)
    private String username;

    @Column(name = "first_name", length = 255)
    private String firstName;

    @Column(name = "last_name", length = 255)
    private String lastName;

    @Column(name = "language_code", length = 16)
    private String languageCode;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Column(name = "avatar_file_id", length = 255)
    private String avatarFileId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private UserRole role;

    @Column(name = "is_authenticated", nullable = false)
    private boolean authenticated;

    @Column(name = "authenticated_at")
    private Instant authenticatedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Copies the mutable state of {@code source}. A {@code null} role on the
     * source keeps the current one.
     */
    public void replaceWith(TelegramUser source) {
        this.username = source.username;
        this.firstName = source.firstName;
        this.lastName = source.lastName;
        this.languageCode = source.languageCode;
        this.phoneNumber = source.phoneNumber;
        this.avatarFileId = source.avatarFileId;
        if (source.role != null) {
            this.role = source.role;
        }
        this.authenticated = source.authenticated;
        this.authenticatedAt = source.authenticatedAt;
        this.updatedAt = source.updatedAt;
    }
}
