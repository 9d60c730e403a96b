package ru.kfl.leasingsync.shared.permission;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import ru.kfl.leasingsync.shared.error.PermissionDeniedException;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;
import ru.kfl.leasingsync.shared.model.UserRole;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdPermissionEvaluatorTest {

    private final AdPermissionEvaluator evaluator = new AdPermissionEvaluator();

    @ParameterizedTest
    @EnumSource(AdOperation.class)
    void admin_may_do_anything_even_on_ads_without_author(AdOperation operation) {
        assertTrue(evaluator.evaluate(UserRole.ADMIN, 1L, 42L, operation).allowed());
        assertTrue(evaluator.evaluate(UserRole.ADMIN, 1L, null, operation).allowed());
    }

    @ParameterizedTest
    @EnumSource(UserRole.class)
    void every_recognized_role_may_create(UserRole role) {
        assertTrue(evaluator.evaluate(role, 7L, null, AdOperation.CREATE).allowed());
    }

    @Test
    void leasing_company_may_modify_own_ads() {
        assertTrue(evaluator.evaluate(UserRole.LEASING_COMPANY, 42L, 42L, AdOperation.UPDATE).allowed());
        assertTrue(evaluator.evaluate(UserRole.LEASING_COMPANY, 42L, 42L, AdOperation.DELETE).allowed());
    }

    @Test
    void leasing_company_may_not_modify_foreign_ads() {
        PermissionDecision decision = evaluator.evaluate(UserRole.LEASING_COMPANY, 99L, 42L, AdOperation.UPDATE);

        assertFalse(decision.allowed());
        assertEquals("leasing_company can modify only own ads", decision.reason());
        assertFalse(evaluator.evaluate(UserRole.LEASING_COMPANY, 99L, 42L, AdOperation.DELETE).allowed());
    }

    @Test
    void leasing_company_may_not_modify_ads_without_author() {
        assertFalse(evaluator.evaluate(UserRole.LEASING_COMPANY, 42L, null, AdOperation.UPDATE).allowed());
        assertFalse(evaluator.evaluate(UserRole.LEASING_COMPANY, 42L, null, AdOperation.DELETE).allowed());
    }

    @Test
    void plain_user_may_not_modify_even_own_ads() {
        assertFalse(evaluator.evaluate(UserRole.USER, 42L, 42L, AdOperation.UPDATE).allowed());
        assertFalse(evaluator.evaluate(UserRole.USER, 42L, 42L, AdOperation.DELETE).allowed());
    }

    @ParameterizedTest
    @EnumSource(AdOperation.class)
    void unrecognized_role_is_denied(AdOperation operation) {
        PermissionDecision decision = evaluator.evaluate(null, 42L, 42L, operation);

        assertFalse(decision.allowed());
        assertEquals("unrecognized role", decision.reason());
    }

    @Test
    void require_allowed_throws_permission_denied() {
        PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                () -> evaluator.requireAllowed(UserRole.USER, 5L, 5L, AdOperation.DELETE));

        assertEquals(SyncErrorKind.PERMISSION_DENIED, ex.getKind());
        assertDoesNotThrow(() -> evaluator.requireAllowed(UserRole.ADMIN, 5L, 6L, AdOperation.DELETE));
    }
}
