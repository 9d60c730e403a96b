package ru.kfl.leasingsync.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UrlPathHelper;
import ru.kfl.leasingsync.shared.dto.ErrorResponse;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/** Requires the pre-shared key on every path except the health check. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class ApiKeyFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    static final String HEALTH_PATH = "/api/health/";

    private final SyncGatewayProperties properties;
    private final ObjectMapper mapper;

    @Override
    public void doFilter(
            ServletRequest request,
            ServletResponse response,
            FilterChain chain) throws IOException, ServletException {

        HttpServletRequest req = (HttpServletRequest) request;
        String path = UrlPathHelper.defaultInstance.getLookupPathForRequest(req);

        if (!HEALTH_PATH.equals(path)) {
            String expected = properties.getApiKey();
            if (expected == null || expected.isBlank()) {
                log.error("kfl.sync.api-key is not configured, rejecting {} {}", req.getMethod(), path);
                reject((HttpServletResponse) response, path, "API key is not configured");
                return;
            }
            String provided = req.getHeader(properties.getApiKeyHeader());
            if (!matches(expected, provided)) {
                log.warn("Rejected {} {}: missing or invalid API key", req.getMethod(), path);
                reject((HttpServletResponse) response, path, "Unauthorized");
                return;
            }
        }

        chain.doFilter(request, response);
    }

    static boolean matches(String expected, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse response, String path, String detail) throws IOException {
        SyncErrorKind kind = SyncErrorKind.AUTHENTICATION_FAILED;
        response.setStatus(kind.httpStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        mapper.writeValue(response.getOutputStream(), ErrorResponse.of(kind, detail, kind.httpStatus(), path));
    }
}
