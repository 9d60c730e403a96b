package ru.kfl.leasingsync.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import ru.kfl.leasingsync.gateway.domain.AdItem;
import ru.kfl.leasingsync.gateway.domain.TelegramUser;
import ru.kfl.leasingsync.gateway.domain.UserAction;
import ru.kfl.leasingsync.gateway.store.AdFilter;
import ru.kfl.leasingsync.gateway.store.UserActionFilter;
import ru.kfl.leasingsync.gateway.store.UserFilter;
import ru.kfl.leasingsync.shared.dto.action.UserActionPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdAuthorPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdPayload;
import ru.kfl.leasingsync.shared.dto.user.UserPayload;
import ru.kfl.leasingsync.shared.error.ValidationFailedException;
import ru.kfl.leasingsync.shared.model.AdSourceType;
import ru.kfl.leasingsync.shared.model.AdStatus;
import ru.kfl.leasingsync.shared.model.UserRole;
import ru.kfl.leasingsync.shared.store.AppendOnlyStore;
import ru.kfl.leasingsync.shared.store.DeletableStore;
import ru.kfl.leasingsync.shared.store.KeyedStore;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class UpsertEngine {

    private static final Logger log = LoggerFactory.getLogger(UpsertEngine.class);

    static final int MAX_AD_KEY_LENGTH = 128;
    static final int MAX_ACTION_LENGTH = 128;

    private final KeyedStore<Long, TelegramUser, UserFilter> users;
    private final DeletableStore<String, AdItem, AdFilter> ads;
    private final AppendOnlyStore<Long, UserAction, UserActionFilter> actions;
    private final TimestampParser timestamps;
    private final ObjectMapper mapper;
    private final Clock clock;

    public UpsertOutcome<TelegramUser> upsertUser(UserPayload payload) {
        Long telegramId = payload.telegramId();
        if (telegramId == null || telegramId <= 0) {
            throw new ValidationFailedException("telegram_id is required");
        }

        UserRole role = null;
        if (payload.role() != null) {
            role = UserRole.parse(payload.role())
                    .orElseThrow(() -> new ValidationFailedException("unrecognized role: " + payload.role()));
        } else if (users.get(telegramId).isEmpty()) {
            throw new ValidationFailedException("role is required for a new user");
        }

        Instant now = clock.instant();
        TelegramUser candidate = TelegramUser.builder()
                .telegramId(telegramId)
                .username(text(payload.username()))
                .firstName(text(payload.firstName()))
                .lastName(text(payload.lastName()))
                .languageCode(text(payload.languageCode()))
                .phoneNumber(text(payload.phoneNumber()))
                .avatarFileId(text(payload.avatarFileId()))
                .role(role)
                .authenticated(Boolean.TRUE.equals(payload.authenticated()))
                .authenticatedAt(timestamps.parse(payload.authenticatedAt()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        UpsertOutcome<TelegramUser> outcome = users.upsert(candidate);
        log.info("User {} {} with role {}", telegramId,
                outcome.created() ? "created" : "updated", outcome.entity().getRole().wireValue());
        return outcome;
    }

    public UserAction appendAction(UserActionPayload payload) {
        Long telegramId = payload.telegramId();
        if (telegramId == null || telegramId <= 0) {
            throw new ValidationFailedException("telegram_id is required");
        }
        String action = text(payload.action()).strip();
        if (action.isEmpty()) {
            throw new ValidationFailedException("action is required");
        }
        if (action.length() > MAX_ACTION_LENGTH) {
            throw new ValidationFailedException("action must be at most " + MAX_ACTION_LENGTH + " characters");
        }

        Instant eventTime = timestamps.parse(payload.timestamp());
        UserAction saved = actions.append(UserAction.builder()
                .user(users.get(telegramId).orElse(null))
                .telegramId(telegramId)
                .username(text(payload.username()))
                .firstName(text(payload.firstName()))
                .lastName(text(payload.lastName()))
                .action(action)
                .details(text(payload.details()))
                .createdAt(eventTime != null ? eventTime : clock.instant())
                .rawPayload(toJson(payload))
                .build());

        log.debug("Recorded action {} of user {} as #{}", action, telegramId, saved.getId());
        return saved;
    }

    public UpsertOutcome<AdItem> upsertAd(AdPayload payload) {
        String adId = text(payload.id()).strip();
        if (adId.isEmpty()) {
            throw new ValidationFailedException("ad_id is required");
        }
        if (adId.length() > MAX_AD_KEY_LENGTH) {
            throw new ValidationFailedException("ad_id must be at most " + MAX_AD_KEY_LENGTH + " characters");
        }
        String title = text(payload.title()).strip();
        if (title.isEmpty()) {
            throw new ValidationFailedException("title is required");
        }

        AdAuthorPayload author = payload.author() != null
                ? payload.author()
                : new AdAuthorPayload(null, null, null, null);
        Instant now = clock.instant();
        AdItem candidate = AdItem.builder()
                .adId(adId)
                .sourceType(AdSourceType.parse(payload.sourceType()).orElse(AdSourceType.MANUAL))
                .externalId(text(payload.externalId()))
                .title(title)
                .category(text(payload.category()).strip())
                .price(payload.price() != null ? payload.price() : 0L)
                .year(payload.year())
                .details(text(payload.details()))
                .location(text(payload.location()))
                .image(text(payload.image()))
                .status(AdStatus.parse(payload.status()).orElse(AdStatus.ACTIVE))
                .authorTelegramId(author.id())
                .authorUsername(text(author.username()))
                .authorFirstName(text(author.firstName()))
                .authorLastName(text(author.lastName()))
                .createdAtRemote(timestamps.parse(payload.createdAt()))
                .rawPayload(toJson(payload))
                .createdAt(now)
                .updatedAt(now)
                .build();

        UpsertOutcome<AdItem> outcome = ads.upsert(candidate);
        if (!outcome.created() && !Objects.equals(outcome.entity().getAuthorTelegramId(), author.id())) {
            log.warn("Ad {} keeps author {}, ignored author {} from upsert",
                    adId, outcome.entity().getAuthorTelegramId(), author.id());
        }
        log.info("Ad {} {}", adId, outcome.created() ? "created" : "updated");
        return outcome;
    }

    /**
     * Applies the fields present in {@code updates} to a stored ad. Fields not
     * listed there keep their values; {@code author} is never applied. An ad
     * deleted in the meantime stays deleted.
     */
    public UpsertOutcome<AdItem> applyAdUpdate(AdItem existing, JsonNode updates) {
        if (updates == null || !updates.isObject()) {
            throw new ValidationFailedException("updates must be object");
        }

        AdItem.AdItemBuilder changed = existing.toBuilder();
        boolean touched = false;

        if (updates.has("title")) {
            String title = text(updates.get("title")).strip();
            if (title.isEmpty()) {
                throw new ValidationFailedException("title must not be empty");
            }
            changed.title(title);
            touched = true;
        }
        if (updates.has("category")) {
            changed.category(text(updates.get("category")).strip());
            touched = true;
        }
        if (updates.has("price")) {
            changed.price(price(updates.get("price")));
            touched = true;
        }
        if (updates.has("year")) {
            changed.year(year(updates.get("year")));
            touched = true;
        }
        if (updates.has("details")) {
            changed.details(text(updates.get("details")));
            touched = true;
        }
        if (updates.has("location")) {
            changed.location(text(updates.get("location")));
            touched = true;
        }
        if (updates.has("image")) {
            changed.image(text(updates.get("image")));
            touched = true;
        }
        if (updates.has("status")) {
            AdStatus status = AdStatus.parse(text(updates.get("status"))).orElse(null);
            if (status != null) {
                changed.status(status);
                touched = true;
            }
        }
        if (updates.has("external_id")) {
            changed.externalId(text(updates.get("external_id")));
            touched = true;
        }
        if (updates.has("source_type")) {
            AdSourceType sourceType = AdSourceType.parse(text(updates.get("source_type"))).orElse(null);
            if (sourceType != null) {
                changed.sourceType(sourceType);
                touched = true;
            }
        }
        if (updates.has("createdAt") || updates.has("created_at")) {
            JsonNode value = updates.has("createdAt") ? updates.get("createdAt") : updates.get("created_at");
            changed.createdAtRemote(timestamps.parse(text(value)));
            touched = true;
        }
        if (updates.has("author")) {
            log.warn("Ignoring author change requested for ad {}", existing.getAdId());
        }

        if (!touched) {
            throw new ValidationFailedException("no updatable fields");
        }

        changed.rawPayload(withLastUpdate(existing.getRawPayload(), updates));
        changed.updatedAt(clock.instant());
        return UpsertOutcome.updated(ads.update(changed.build()));
    }

    private String withLastUpdate(String rawPayload, JsonNode updates) {
        ObjectNode payload;
        try {
            JsonNode parsed = rawPayload == null || rawPayload.isBlank()
                    ? null
                    : mapper.readTree(rawPayload);
            payload = parsed instanceof ObjectNode ? (ObjectNode) parsed : mapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("Stored raw payload is not valid JSON, replacing it: {}", e.getOriginalMessage());
            payload = mapper.createObjectNode();
        }
        payload.set("last_update", updates);
        return toJson(payload);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static long price(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0L;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(text(node).strip());
        } catch (NumberFormatException e) {
            throw new ValidationFailedException("price must be an integer");
        }
    }

    private static Integer year(JsonNode node) {
        if (node == null || node.isNull() || text(node).isBlank()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        try {
            return Integer.valueOf(text(node).strip());
        } catch (NumberFormatException e) {
            throw new ValidationFailedException("year must be an integer");
        }
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? "" : node.asText();
    }
}
