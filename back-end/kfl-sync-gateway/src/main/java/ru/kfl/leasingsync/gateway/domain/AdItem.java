package ru.kfl.leasingsync.gateway.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import ru.kfl.leasingsync.shared.model.AdSourceType;
import ru.kfl.leasingsync.shared.model.AdStatus;

import java.time.Instant;

@Entity
@Table(
        name = "ad_items",
        indexes = @Index(name = "ix_ad_items_author", columnList = "author_telegram_id")
)
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder(toBuilder = true)
public class AdItem {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ad_id", nullable = false, unique = true, length = 128, updatable = false)
    private String adId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 16)
    private AdSourceType sourceType;

    @Column(name = "external_id", length = 128)
    private String externalId;

    @Column(nullable = false, length = 512)
    private String title;

    @Column(length = 64)
    private String category;

    @Column(nullable = false)
    private long price;

    @Column(name = "production_year")
    private Integer year;

    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(length = 255)
    private String location;

    @Column(columnDefinition = "TEXT")
    private String image;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AdStatus status;

    // ownership anchor, fixed at insert
    @Column(name = "author_telegram_id", updatable = false)
    private Long authorTelegramId;

    @Column(name = "author_username", length = 255, updatable = false)
    private String authorUsername;

    @Column(name = "author_first_name", length = 255, updatable = false)
    private String authorFirstName;

    @Column(name = "author_last_name", length = 255, updatable = false)
    private String authorLastName;

    @Column(name = "created_at_remote")
    private Instant createdAtRemote;

    @Column(name = "raw_payload", columnDefinition = "TEXT")
    private String rawPayload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Copies every content field of {@code source}. The key and the author
     * columns are left as they are.
     */
    public void replaceContentWith(AdItem source) {
        this.sourceType = source.sourceType;
        this.externalId = source.externalId;
        this.title = source.title;
        this.category = source.category;
        this.price = source.price;
        this.year = source.year;
        this.details = source.details;
        this.location = source.location;
        this.image = source.image;
        this.status = source.status;
        this.createdAtRemote = source.createdAtRemote;
        this.rawPayload = source.rawPayload;
        this.updatedAt = source.updatedAt;
    }
}
