package ru.kfl.leasingsync.gateway.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import ru.kfl.leasingsync.gateway.domain.AdItem;
import ru.kfl.leasingsync.gateway.store.AdFilter;
import ru.kfl.leasingsync.shared.dto.ad.AdDeleteRequest;
import ru.kfl.leasingsync.shared.dto.ad.AdUpdateRequest;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.error.PermissionDeniedException;
import ru.kfl.leasingsync.shared.error.ValidationFailedException;
import ru.kfl.leasingsync.shared.model.Actor;
import ru.kfl.leasingsync.shared.permission.AdOperation;
import ru.kfl.leasingsync.shared.permission.AdPermissionEvaluator;
import ru.kfl.leasingsync.shared.permission.PermissionDecision;
import ru.kfl.leasingsync.shared.store.DeletableStore;

/**
 * Update and delete of ads on behalf of a declared actor. Ownership is always
 * taken from the stored ad, never from the request.
 */
@Service
@RequiredArgsConstructor
public class AdManagementService {

    private static final Logger log = LoggerFactory.getLogger(AdManagementService.class);

    private final DeletableStore<String, AdItem, AdFilter> ads;
    private final AdPermissionEvaluator permissions;
    private final UpsertEngine engine;

    public AdItem update(AdUpdateRequest request) {
        String adId = requireAdId(request.adId());
        if (request.updates() == null || !request.updates().isObject()) {
            throw new ValidationFailedException("updates must be object");
        }
        Actor actor = requireActor(request.actorTelegramId(), request.actorRole());

        AdItem existing = ads.get(adId).orElseThrow(() -> new NotFoundException("ad not found"));
        authorize(actor, existing, AdOperation.UPDATE);

        AdItem updated = engine.applyAdUpdate(existing, request.updates()).entity();
        log.info("Ad {} updated by {} {}", adId, actor.role().wireValue(), actor.telegramId());
        return updated;
    }

    public void delete(AdDeleteRequest request) {
        String adId = requireAdId(request.adId());
        Actor actor = requireActor(request.actorTelegramId(), request.actorRole());

        AdItem existing = ads.get(adId).orElseThrow(() -> new NotFoundException("ad not found"));
        authorize(actor, existing, AdOperation.DELETE);

        if (!ads.delete(adId)) {
            throw new NotFoundException("ad not found");
        }
        log.info("Ad {} deleted by {} {}", adId, actor.role().wireValue(), actor.telegramId());
    }

    private void authorize(Actor actor, AdItem target, AdOperation operation) {
        PermissionDecision decision = permissions.evaluate(
                actor.role(), actor.telegramId(), target.getAuthorTelegramId(), operation);
        if (!decision.allowed()) {
            log.warn("Denied {} of ad {} to actor {}: {}",
                    operation, target.getAdId(), actor.telegramId(), decision.reason());
            throw new PermissionDeniedException(decision.reason());
        }
    }

    private static String requireAdId(String raw) {
        String adId = raw == null ? "" : raw.strip();
        if (adId.isEmpty()) {
            throw new ValidationFailedException("ad_id is required");
        }
        return adId;
    }

    private static Actor requireActor(Long actorTelegramId, String actorRole) {
        if (actorTelegramId == null) {
            throw new ValidationFailedException("actor_telegram_id is required");
        }
        return Actor.of(actorTelegramId, actorRole);
    }
}
