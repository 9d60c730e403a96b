package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import ru.kfl.leasingsync.shared.model.AdStatus;

/**
 * A catalogue listing as exchanged between the bot feed and the gateway.
 * {@code id} is the stable ad key; {@code author.id} is the owning Telegram user.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdPayload(
        @JsonProperty("id") @JsonAlias("ad_id") String id,
        @JsonProperty("source_type") String sourceType,
        @JsonProperty("external_id") String externalId,
        String title,
        String category,
        Long price,
        Integer year,
        String details,
        String location,
        String image,
        String status,
        @JsonProperty("createdAt") @JsonAlias("created_at") String createdAt,
        AdAuthorPayload author
) {

    @JsonIgnore
    public Long authorTelegramId() {
        return author == null ? null : author.id();
    }

    /**
     * Applies the present fields of {@code changes}. Key, source, creation
     * time and author are carried over untouched.
     */
    public AdPayload withChanges(AdChanges changes) {
        String newStatus = changes.status() != null && AdStatus.parse(changes.status()).isPresent()
                ? AdStatus.parse(changes.status()).get().wireValue()
                : status;
        return new AdPayload(
                id,
                sourceType,
                externalId,
                changes.title() != null ? changes.title().strip() : title,
                changes.category() != null ? changes.category().strip() : category,
                changes.price() != null ? changes.price() : price,
                changes.year() != null ? changes.year() : year,
                changes.details() != null ? changes.details() : details,
                changes.location() != null ? changes.location() : location,
                changes.image() != null ? changes.image() : image,
                newStatus,
                createdAt,
                author
        );
    }
}
