package ru.kfl.leasingsync.bot.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import ru.kfl.leasingsync.bot.config.BotSyncProperties;
import ru.kfl.leasingsync.shared.dto.action.UserActionPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdChanges;
import ru.kfl.leasingsync.shared.dto.ad.AdPayload;
import ru.kfl.leasingsync.shared.dto.ad.BulkUpsertResponse;
import ru.kfl.leasingsync.shared.dto.user.UserPayload;
import ru.kfl.leasingsync.shared.dto.user.UserUpsertResponse;
import ru.kfl.leasingsync.shared.error.AuthenticationFailedException;
import ru.kfl.leasingsync.shared.error.PermissionDeniedException;
import ru.kfl.leasingsync.shared.error.StoreUnavailableException;
import ru.kfl.leasingsync.shared.model.Actor;
import ru.kfl.leasingsync.shared.model.UserRole;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SyncGatewayClientTest {

    private static final String BASE = "http://gateway.test";

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    private MockRestServiceServer server;
    private SyncGatewayClient client;

    @BeforeEach
    void setUp() {
        BotSyncProperties properties = new BotSyncProperties();
        properties.setBackendUrl(BASE + "/");
        properties.setApiKey("bot-key");

        RestClient.Builder builder = SyncGatewayClient.builder(properties);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new SyncGatewayClient(builder.build(), mapper);
    }

    private static String error(String kind, String detail, int status) {
        return """
                {"ok": false, "kind": "%s", "detail": "%s", "status": %d,
                 "path": "/api/x/", "timestamp": "2024-05-01T10:00:00Z"}
                """.formatted(kind, detail, status);
    }

    @Test
    void sends_key_and_snake_case_payload() {
        server.expect(requestTo(BASE + "/api/users/upsert/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-API-Key", "bot-key"))
                .andExpect(jsonPath("$.telegram_id").value(42))
                .andExpect(jsonPath("$.is_authenticated").value(true))
                .andExpect(jsonPath("$.role").value("leasing_company"))
                .andRespond(withStatus(HttpStatus.CREATED).contentType(MediaType.APPLICATION_JSON)
                        .body("{\"ok\": true, \"created\": true, \"telegram_id\": 42, \"role\": \"leasing_company\"}"));

        UserUpsertResponse response = client.upsertUser(new UserPayload(42L, "ivan", null, null, null, null, null,
                "leasing_company", true, null));

        assertTrue(response.created());
        server.verify();
    }

    @Test
    void role_lookup_maps_not_found_to_empty() {
        server.expect(requestTo(BASE + "/api/users/42/role/"))
                .andRespond(withSuccess("{\"ok\": true, \"telegram_id\": 42, \"role\": \"admin\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/users/7/role/"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).contentType(MediaType.APPLICATION_JSON)
                        .body(error("NOT_FOUND", "User not found", 404)));

        assertEquals(Optional.of(UserRole.ADMIN), client.fetchRole(42L));
        assertEquals(Optional.empty(), client.fetchRole(7L));
        server.verify();
    }

    @Test
    void error_documents_become_typed_exceptions() {
        server.expect(requestTo(BASE + "/api/ads/delete/"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).contentType(MediaType.APPLICATION_JSON)
                        .body(error("PERMISSION_DENIED", "leasing_company can modify only own ads", 403)));

        PermissionDeniedException ex = assertThrows(PermissionDeniedException.class,
                () -> client.deleteAd("ad-1", Actor.of(99L, "leasing_company")));
        assertEquals("leasing_company can modify only own ads", ex.getMessage());
    }

    @Test
    void bare_statuses_fall_back_to_their_kind() {
        server.expect(requestTo(BASE + "/api/actions/"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        server.expect(requestTo(BASE + "/api/actions/"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("busy"));
        server.expect(requestTo(BASE + "/api/actions/"))
                .andRespond(withServerError().body("<html>oops</html>"));

        UserActionPayload action = new UserActionPayload(42L, null, null, null, "start", null, null);
        assertThrows(AuthenticationFailedException.class, () -> client.createAction(action));
        assertThrows(StoreUnavailableException.class, () -> client.createAction(action));
        GatewayCallException ex = assertThrows(GatewayCallException.class, () -> client.createAction(action));
        assertEquals(500, ex.getStatus());
    }

    @Test
    void update_sends_only_touched_fields() {
        server.expect(requestTo(BASE + "/api/ads/update/"))
                .andExpect(jsonPath("$.ad_id").value("ad-1"))
                .andExpect(jsonPath("$.actor_telegram_id").value(1))
                .andExpect(jsonPath("$.actor_role").value("admin"))
                .andExpect(content().json("{\"updates\": {\"price\": 900000}}"))
                .andExpect(jsonPath("$.updates.title").doesNotExist())
                .andRespond(withSuccess("{\"ok\": true, \"ad_id\": \"ad-1\"}", MediaType.APPLICATION_JSON));

        client.updateAd("ad-1", Actor.of(1L, "админ"),
                new AdChanges(null, null, 900_000L, null, null, null, null, null));
        server.verify();
    }

    @Test
    void bulk_upsert_wraps_items() {
        server.expect(requestTo(BASE + "/api/ads/bulk-upsert/"))
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].id").value("a1"))
                .andRespond(withSuccess("""
                        {"ok": true, "created": 1, "updated": 0,
                         "results": [{"index": 0, "ok": true, "key": "a1", "created": true},
                                     {"index": 1, "ok": false, "kind": "VALIDATION_FAILED", "error": "title is required"}],
                         "errors": [{"index": 1, "error": "title is required"}]}
                        """, MediaType.APPLICATION_JSON));

        BulkUpsertResponse response = client.bulkUpsertAds(List.of(
                new AdPayload("a1", null, null, "Truck", null, null, null, null, null, null, null, null, null),
                new AdPayload("a2", null, null, null, null, null, null, null, null, null, null, null, null)));

        assertEquals(1, response.created());
        assertEquals(1, response.errors().size());
        server.verify();
    }
}
