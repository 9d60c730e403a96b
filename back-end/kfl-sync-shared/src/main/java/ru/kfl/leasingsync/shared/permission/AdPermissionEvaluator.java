package ru.kfl.leasingsync.shared.permission;

import ru.kfl.leasingsync.shared.error.PermissionDeniedException;
import ru.kfl.leasingsync.shared.model.UserRole;

import java.util.Objects;

/** First matching rule wins; an unrecognized role is denied. */
public final class AdPermissionEvaluator {

    public PermissionDecision evaluate(UserRole actorRole,
                                       long actorTelegramId,
                                       Long targetAuthorTelegramId,
                                       AdOperation operation) {
        Objects.requireNonNull(operation, "operation");

        if (actorRole == null) {
            return PermissionDecision.deny("unrecognized role");
        }
        if (actorRole == UserRole.ADMIN) {
            return PermissionDecision.allow();
        }
        if (operation == AdOperation.CREATE) {
            return PermissionDecision.allow();
        }
        if (actorRole == UserRole.LEASING_COMPANY) {
            if (targetAuthorTelegramId == null || targetAuthorTelegramId != actorTelegramId) {
                return PermissionDecision.deny("leasing_company can modify only own ads");
            }
            return PermissionDecision.allow();
        }
        return PermissionDecision.deny("insufficient permissions");
    }

    public void requireAllowed(UserRole actorRole,
                               long actorTelegramId,
                               Long targetAuthorTelegramId,
                               AdOperation operation) {
        PermissionDecision decision = evaluate(actorRole, actorTelegramId, targetAuthorTelegramId, operation);
        if (!decision.allowed()) {
            throw new PermissionDeniedException(decision.reason());
        }
    }
}
