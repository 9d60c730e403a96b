package ru.kfl.leasingsync.bot.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.kfl.leasingsync.bot.gateway.SyncGatewayClient;
import ru.kfl.leasingsync.bot.local.LocalSyncLog;
import ru.kfl.leasingsync.shared.dto.action.UserActionPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdChanges;
import ru.kfl.leasingsync.shared.dto.ad.AdPayload;
import ru.kfl.leasingsync.shared.dto.ad.BulkItemResult;
import ru.kfl.leasingsync.shared.dto.ad.BulkUpsertResponse;
import ru.kfl.leasingsync.shared.dto.user.UserPayload;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;
import ru.kfl.leasingsync.shared.error.SyncException;
import ru.kfl.leasingsync.shared.error.ValidationFailedException;
import ru.kfl.leasingsync.shared.model.Actor;
import ru.kfl.leasingsync.shared.model.UserRole;
import ru.kfl.leasingsync.shared.permission.AdOperation;
import ru.kfl.leasingsync.shared.permission.AdPermissionEvaluator;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Writes the local log first, then forwards the change to the gateway once.
 * Forward failures are logged and reported, never retried.
 */
public class DualWriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DualWriteCoordinator.class);

    private final LocalSyncLog local;
    private final SyncGatewayClient gateway;
    private final AdPermissionEvaluator permissions;
    private final boolean forwardingEnabled;
    private final Set<Long> presetAdminIds;
    private final ForwardFailureListener failureListener;
    private final Clock clock;

    public DualWriteCoordinator(LocalSyncLog local,
                                SyncGatewayClient gateway,
                                AdPermissionEvaluator permissions,
                                boolean forwardingEnabled,
                                Set<Long> presetAdminIds,
                                ForwardFailureListener failureListener,
                                Clock clock) {
        this.local = Objects.requireNonNull(local, "local");
        this.permissions = Objects.requireNonNull(permissions, "permissions");
        this.forwardingEnabled = forwardingEnabled && gateway != null;
        this.gateway = gateway;
        this.presetAdminIds = Set.copyOf(presetAdminIds);
        this.failureListener = failureListener != null ? failureListener : ForwardFailureListener.NONE;
        this.clock = clock;
    }

    public boolean isForwardingEnabled() {
        return forwardingEnabled;
    }

    /**
     * Records a user. An absent role keeps the locally stored one; the gateway
     * only receives a role the caller stated, or {@code user} on first contact.
     */
    public UpsertOutcome<UserPayload> recordUser(UserPayload user) {
        if (user.telegramId() == null || user.telegramId() <= 0) {
            throw new ValidationFailedException("telegram_id is required");
        }
        Optional<UserRole> stored = local.users().get(user.telegramId())
                .flatMap(existing -> UserRole.parse(existing.role()));
        UserRole role;
        String forwardedRole;
        if (user.role() != null) {
            role = UserRole.parse(user.role())
                    .orElseThrow(() -> new ValidationFailedException("unrecognized role: " + user.role()));
            forwardedRole = role.wireValue();
        } else if (stored.isPresent()) {
            role = stored.get();
            forwardedRole = null;
        } else {
            role = UserRole.USER;
            forwardedRole = role.wireValue();
        }

        UpsertOutcome<UserPayload> outcome = local.users().upsert(user.withRole(role.wireValue()));
        UserPayload remote = outcome.entity().withRole(forwardedRole);
        forward("user upsert", user.telegramId(), () -> gateway.upsertUser(remote));
        return outcome;
    }

    public UserActionPayload recordAction(UserActionPayload action) {
        if (action.telegramId() == null || action.telegramId() <= 0) {
            throw new ValidationFailedException("telegram_id is required");
        }
        if (action.action() == null || action.action().isBlank()) {
            throw new ValidationFailedException("action is required");
        }
        UserActionPayload entry = action.timestamp() != null && !action.timestamp().isBlank()
                ? action
                : new UserActionPayload(action.telegramId(), action.username(), action.firstName(),
                        action.lastName(), action.action(), action.details(), OffsetDateTime.now(clock).toString());

        UserActionPayload stored = local.actions().append(entry);
        log.info("User action: {} ({}) - {} - {}",
                stored.username(), stored.telegramId(), stored.action(), stored.details());
        forward("action", stored.telegramId(), () -> gateway.createAction(stored));
        return stored;
    }

    /**
     * Publishes one ad. When the ad already exists locally its author is kept.
     */
    public UpsertOutcome<AdPayload> publishAd(AdPayload ad) {
        validateAd(ad);
        UpsertOutcome<AdPayload> outcome = local.ads().upsert(keepLocalAuthor(ad));
        forward("ad upsert", ad.id(), () -> gateway.upsertAd(outcome.entity()));
        return outcome;
    }

    /**
     * Publishes a batch of ads with one local write and one bulk forward. Items
     * without key or title are skipped and logged.
     */
    public List<UpsertOutcome<AdPayload>> publishAds(List<AdPayload> ads) {
        List<AdPayload> accepted = new ArrayList<>(ads.size());
        for (int i = 0; i < ads.size(); i++) {
            AdPayload ad = ads.get(i);
            try {
                validateAd(ad);
                accepted.add(keepLocalAuthor(ad));
            } catch (ValidationFailedException e) {
                log.warn("Skipping ad #{} of batch: {}", i, e.getMessage());
            }
        }
        if (accepted.isEmpty()) {
            return List.of();
        }

        List<UpsertOutcome<AdPayload>> outcomes = local.ads().upsertAll(accepted);
        forward("ad bulk upsert", accepted.size() + " ads",
                () -> reportRejectedItems(accepted, gateway.bulkUpsertAds(accepted)));
        return outcomes;
    }

    public AdPayload updateAd(String adId, Actor actor, AdChanges changes) {
        if (changes == null || changes.isEmpty()) {
            throw new ValidationFailedException("no updatable fields");
        }
        AdPayload existing = loadAuthorized(adId, actor, AdOperation.UPDATE);

        AdPayload updated = existing.withChanges(changes);
        if (updated.title() == null || updated.title().isBlank()) {
            throw new ValidationFailedException("title must not be empty");
        }
        local.ads().update(updated);
        log.info("Ad {} updated by {} {}", adId, actor.role().wireValue(), actor.telegramId());
        forward("ad update", adId, () -> gateway.updateAd(adId, actor, changes));
        return updated;
    }

    public void deleteAd(String adId, Actor actor) {
        loadAuthorized(adId, actor, AdOperation.DELETE);

        if (!local.ads().delete(adId)) {
            throw new NotFoundException("ad not found");
        }
        log.info("Ad {} deleted by {} {}", adId, actor.role().wireValue(), actor.telegramId());
        forward("ad delete", adId, () -> gateway.deleteAd(adId, actor));
    }

    /**
     * Preset administrators first, then the gateway's view, then the local
     * record; {@code user} when nobody knows the id.
     */
    public UserRole resolveRole(long telegramId) {
        if (presetAdminIds.contains(telegramId)) {
            return UserRole.ADMIN;
        }
        if (forwardingEnabled) {
            try {
                Optional<UserRole> remote = gateway.fetchRole(telegramId);
                if (remote.isPresent()) {
                    return remote.get();
                }
            } catch (RuntimeException e) {
                log.warn("Role lookup for {} failed, using local record: {}", telegramId, e.getMessage());
            }
        }
        return local.users().get(telegramId)
                .flatMap(user -> UserRole.parse(user.role()))
                .orElse(UserRole.USER);
    }

    public List<AdPayload> listAds(Predicate<AdPayload> filter) {
        return local.ads().list(filter);
    }

    private AdPayload loadAuthorized(String adId, Actor actor, AdOperation operation) {
        if (adId == null || adId.isBlank()) {
            throw new ValidationFailedException("ad_id is required");
        }
        Objects.requireNonNull(actor, "actor");
        AdPayload existing = local.ads().get(adId)
                .orElseThrow(() -> new NotFoundException("ad not found"));
        permissions.requireAllowed(actor.role(), actor.telegramId(), existing.authorTelegramId(), operation);
        return existing;
    }

    private AdPayload keepLocalAuthor(AdPayload ad) {
        return local.ads().get(ad.id())
                .filter(stored -> stored.author() != null)
                .map(stored -> new AdPayload(ad.id(), ad.sourceType(), ad.externalId(), ad.title(),
                        ad.category(), ad.price(), ad.year(), ad.details(), ad.location(), ad.image(),
                        ad.status(), ad.createdAt(), stored.author()))
                .orElse(ad);
    }

    private static void validateAd(AdPayload ad) {
        if (ad == null || ad.id() == null || ad.id().isBlank()) {
            throw new ValidationFailedException("ad_id is required");
        }
        if (ad.title() == null || ad.title().isBlank()) {
            throw new ValidationFailedException("title is required");
        }
    }

    // a 200 bulk response can still carry per-item rejections
    private void reportRejectedItems(List<AdPayload> sent, BulkUpsertResponse response) {
        if (response == null || response.results() == null) {
            return;
        }
        for (BulkItemResult result : response.results()) {
            if (result.ok()) {
                continue;
            }
            int index = result.index();
            String key = index >= 0 && index < sent.size() ? sent.get(index).id() : result.key();
            log.warn("Backend rejected ad {} of bulk upsert: {}", key, result.error());
            SyncException cause = SyncException.of(
                    result.kind() != null ? result.kind() : SyncErrorKind.VALIDATION_FAILED,
                    result.error() != null ? result.error() : "rejected");
            failureListener.onForwardFailure("ad bulk upsert", key, cause);
        }
    }

    private void forward(String operation, Object key, Runnable call) {
        if (!forwardingEnabled) {
            return;
        }
        try {
            call.run();
            log.debug("Forwarded {} {}", operation, key);
        } catch (RuntimeException e) {
            log.warn("Backend sync failed for {} {}: {}", operation, key, e.getMessage());
            failureListener.onForwardFailure(operation, key, e);
        }
    }
}
