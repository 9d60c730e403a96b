package ru.kfl.leasingsync.bot.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import ru.kfl.leasingsync.bot.config.BotSyncProperties;
import ru.kfl.leasingsync.shared.dto.ErrorResponse;
import ru.kfl.leasingsync.shared.dto.action.ActionCreatedResponse;
import ru.kfl.leasingsync.shared.dto.action.UserActionPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdBulkUpsertRequest;
import ru.kfl.leasingsync.shared.dto.ad.AdChanges;
import ru.kfl.leasingsync.shared.dto.ad.AdDeleteRequest;
import ru.kfl.leasingsync.shared.dto.ad.AdMutationResponse;
import ru.kfl.leasingsync.shared.dto.ad.AdPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdUpdateRequest;
import ru.kfl.leasingsync.shared.dto.ad.AdUpsertResponse;
import ru.kfl.leasingsync.shared.dto.ad.BulkUpsertResponse;
import ru.kfl.leasingsync.shared.dto.user.UserPayload;
import ru.kfl.leasingsync.shared.dto.user.UserRoleResponse;
import ru.kfl.leasingsync.shared.dto.user.UserUpsertResponse;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;
import ru.kfl.leasingsync.shared.error.SyncException;
import ru.kfl.leasingsync.shared.model.Actor;
import ru.kfl.leasingsync.shared.model.UserRole;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

public class SyncGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(SyncGatewayClient.class);

    public static final String API_KEY_HEADER = "X-API-Key";

    private final RestClient rest;
    private final ObjectMapper mapper;

    public SyncGatewayClient(RestClient rest, ObjectMapper mapper) {
        this.rest = rest;
        this.mapper = mapper;
    }

    /**
     * Builder preconfigured with the gateway base URL, the API key header and
     * connect/read timeouts from {@code properties}.
     */
    public static RestClient.Builder builder(BotSyncProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getTimeout());
        requestFactory.setReadTimeout(properties.getTimeout());

        String baseUrl = properties.getBackendUrl().strip();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return RestClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(API_KEY_HEADER, properties.getApiKey())
                .requestFactory(requestFactory);
    }

    public UserUpsertResponse upsertUser(UserPayload user) {
        return post("/api/users/upsert/", user, UserUpsertResponse.class);
    }

    /**
     * @return the role stored by the gateway, empty when the user is unknown there
     */
    public Optional<UserRole> fetchRole(long telegramId) {
        try {
            UserRoleResponse response = rest.get()
                    .uri("/api/users/{telegramId}/role/", telegramId)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, resp) -> {
                        throw decodeError(resp);
                    })
                    .body(UserRoleResponse.class);
            return response == null ? Optional.empty() : UserRole.parse(response.role());
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    public ActionCreatedResponse createAction(UserActionPayload action) {
        return post("/api/actions/", action, ActionCreatedResponse.class);
    }

    public AdUpsertResponse upsertAd(AdPayload ad) {
        return post("/api/ads/upsert/", ad, AdUpsertResponse.class);
    }

    public BulkUpsertResponse bulkUpsertAds(List<AdPayload> ads) {
        return post("/api/ads/bulk-upsert/", new AdBulkUpsertRequest(ads), BulkUpsertResponse.class);
    }

    public AdMutationResponse updateAd(String adId, Actor actor, AdChanges changes) {
        JsonNode updates = mapper.valueToTree(changes);
        return post("/api/ads/update/",
                new AdUpdateRequest(adId, actor.telegramId(), wireRole(actor), updates),
                AdMutationResponse.class);
    }

    public AdMutationResponse deleteAd(String adId, Actor actor) {
        return post("/api/ads/delete/",
                new AdDeleteRequest(adId, actor.telegramId(), wireRole(actor)),
                AdMutationResponse.class);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        return rest.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw decodeError(response);
                })
                .body(responseType);
    }

    private RuntimeException decodeError(ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        byte[] raw = response.getBody().readAllBytes();
        String detail = new String(raw, StandardCharsets.UTF_8);

        SyncErrorKind kind = null;
        if (raw.length > 0) {
            try {
                ErrorResponse error = mapper.readValue(raw, ErrorResponse.class);
                kind = error.kind();
                if (error.detail() != null) {
                    detail = error.detail();
                }
            } catch (IOException e) {
                log.debug("Gateway error body is not an error document: {}", e.getMessage());
            }
        }
        if (kind == null) {
            kind = kindForStatus(status);
        }
        if (kind == null) {
            return new GatewayCallException(status, "gateway returned HTTP " + status + ": " + abbreviate(detail));
        }
        return SyncException.of(kind, detail);
    }

    private static SyncErrorKind kindForStatus(int status) {
        for (SyncErrorKind kind : SyncErrorKind.values()) {
            if (kind.httpStatus() == status) {
                return kind;
            }
        }
        return null;
    }

    private static String wireRole(Actor actor) {
        return actor.role() == null ? null : actor.role().wireValue();
    }

    private static String abbreviate(String text) {
        return text.length() <= 300 ? text : text.substring(0, 300);
    }
}
