package ru.kfl.leasingsync.gateway.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import ru.kfl.leasingsync.gateway.domain.AdItem;
import ru.kfl.leasingsync.gateway.repository.AdItemRepository;
import ru.kfl.leasingsync.gateway.repository.TelegramUserRepository;
import ru.kfl.leasingsync.gateway.repository.UserActionRepository;
import ru.kfl.leasingsync.gateway.service.UpsertEngine;
import ru.kfl.leasingsync.shared.permission.AdPermissionEvaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SyncGatewayApiTest {

    private static final String KEY = "test-key";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private AdItemRepository adRepo;

    @Autowired
    private TelegramUserRepository userRepo;

    @Autowired
    private UserActionRepository actionRepo;

    @SpyBean
    private UpsertEngine engine;

    @SpyBean
    private AdPermissionEvaluator permissions;

    @BeforeEach
    void cleanUp() {
        actionRepo.deleteAll();
        adRepo.deleteAll();
        userRepo.deleteAll();
    }

    private ResultActions postJson(String path, String body) throws Exception {
        return mvc.perform(post(path)
                .header("X-API-Key", KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private static String ad(String adId, String title, long author) {
        return """
                {"id": "%s", "title": "%s", "category": "trucks", "price": 1500000,
                 "status": "active", "author": {"id": %d, "username": "lessor"}}
                """.formatted(adId, title, author);
    }

    @Test
    void health_needs_no_key() throws Exception {
        mvc.perform(get("/api/health/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.service").value("kfl-sync-gateway"));
    }

    @Test
    void requests_without_valid_key_touch_nothing() throws Exception {
        mvc.perform(post("/api/users/upsert/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"telegram_id\": 42, \"role\": \"admin\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("AUTHENTICATION_FAILED"));

        mvc.perform(post("/api/ads/delete/")
                        .header("X-API-Key", "wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ad_id\": \"ad-1\", \"actor_telegram_id\": 1, \"actor_role\": \"admin\"}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(engine, permissions);
        assertEquals(0, userRepo.count());
    }

    @Test
    void user_upsert_reports_created_then_updated() throws Exception {
        String body = "{\"telegram_id\": 42, \"username\": \"ivan\", \"role\": \"leasing_company\"}";

        postJson("/api/users/upsert/", body)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true))
                .andExpect(jsonPath("$.telegram_id").value(42))
                .andExpect(jsonPath("$.role").value("leasing_company"));
        postJson("/api/users/upsert/", body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(false));

        mvc.perform(get("/api/users/42/role/").header("X-API-Key", KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("leasing_company"));
    }

    @Test
    void role_of_unknown_user_is_not_found() throws Exception {
        mvc.perform(get("/api/users/777/role/").header("X-API-Key", KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mvc.perform(get("/api/users/abc/role/").header("X-API-Key", KEY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_FAILED"));
    }

    @Test
    void unrecognized_role_is_rejected() throws Exception {
        postJson("/api/users/upsert/", "{\"telegram_id\": 42, \"role\": \"superuser\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_FAILED"));
        assertEquals(0, userRepo.count());
    }

    @Test
    void malformed_json_is_a_validation_failure() throws Exception {
        postJson("/api/actions/", "{\"telegram_id\": 42, ")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION_FAILED"));
    }

    @Test
    void actions_are_appended() throws Exception {
        postJson("/api/actions/", "{\"telegram_id\": 42, \"action\": \"start\", \"timestamp\": \"2024-05-01T10:00:00\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.id").isNumber());
        postJson("/api/actions/", "{\"telegram_id\": 42}")
                .andExpect(status().isBadRequest());

        assertEquals(1, actionRepo.count());
    }

    @Test
    void bulk_upsert_isolates_failing_items() throws Exception {
        postJson("/api/ads/upsert/", ad("a3", "Old", 42)).andExpect(status().isCreated());

        postJson("/api/ads/bulk-upsert/", """
                {"items": [
                  {"id": "a1", "title": "Truck"},
                  {"id": "a2"},
                  {"id": "a3", "title": "Excavator"}
                ]}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.created").value(1))
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.results.length()").value(3))
                .andExpect(jsonPath("$.results[0].ok").value(true))
                .andExpect(jsonPath("$.results[0].key").value("a1"))
                .andExpect(jsonPath("$.results[1].ok").value(false))
                .andExpect(jsonPath("$.results[1].kind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.results[2].created").value(false))
                .andExpect(jsonPath("$.errors[0].index").value(1));

        assertEquals(2, adRepo.count());
        assertEquals("Excavator", adRepo.findByAdId("a3").orElseThrow().getTitle());
    }

    @Test
    void bulk_upsert_requires_a_list() throws Exception {
        postJson("/api/ads/bulk-upsert/", "{\"items\": {\"id\": \"a1\"}}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("items must be a list"));
    }

    @Test
    void only_owner_or_admin_may_update_and_author_never_changes() throws Exception {
        postJson("/api/users/upsert/", "{\"telegram_id\": 42, \"role\": \"leasing_company\"}");
        postJson("/api/ads/upsert/", ad("ad-1", "Truck", 42))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ad_id").value("ad-1"));

        postJson("/api/ads/update/", """
                {"ad_id": "ad-1", "actor_telegram_id": 99, "actor_role": "leasing_company",
                 "updates": {"title": "Hijacked"}}
                """)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("PERMISSION_DENIED"));
        assertEquals("Truck", adRepo.findByAdId("ad-1").orElseThrow().getTitle());

        postJson("/api/ads/update/", """
                {"ad_id": "ad-1", "actor_telegram_id": 1, "actor_role": "admin",
                 "updates": {"title": "Truck (checked)", "author": {"id": 1}}}
                """)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.ad_id").value("ad-1"));

        postJson("/api/ads/upsert/", ad("ad-1", "Truck (feed)", 99)).andExpect(status().isOk());

        AdItem stored = adRepo.findByAdId("ad-1").orElseThrow();
        assertEquals("Truck (feed)", stored.getTitle());
        assertEquals(42L, stored.getAuthorTelegramId());
    }

    @Test
    void plain_user_may_not_delete_own_ad() throws Exception {
        postJson("/api/ads/upsert/", ad("ad-1", "Truck", 5));

        postJson("/api/ads/delete/", "{\"ad_id\": \"ad-1\", \"actor_telegram_id\": 5, \"actor_role\": \"user\"}")
                .andExpect(status().isForbidden());
        assertTrue(adRepo.findByAdId("ad-1").isPresent());
    }

    @Test
    void delete_then_recreate_is_a_fresh_create() throws Exception {
        postJson("/api/ads/upsert/", ad("ad-1", "Truck", 42)).andExpect(status().isCreated());

        String delete = "{\"ad_id\": \"ad-1\", \"actor_telegram_id\": 42, \"actor_role\": \"leasing_company\"}";
        postJson("/api/ads/delete/", delete)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ad_id").value("ad-1"));
        postJson("/api/ads/delete/", delete)
                .andExpect(status().isNotFound());

        postJson("/api/ads/upsert/", ad("ad-1", "Truck", 42))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true));
    }

    @Test
    void update_of_missing_ad_is_not_found() throws Exception {
        postJson("/api/ads/update/", """
                {"ad_id": "nope", "actor_telegram_id": 1, "actor_role": "admin", "updates": {"price": 1}}
                """)
                .andExpect(status().isNotFound());
    }
}
