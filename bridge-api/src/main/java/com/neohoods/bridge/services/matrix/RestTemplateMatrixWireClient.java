package com.neohoods.bridge.services.matrix;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.model.matrix.PusherRequest;
import com.neohoods.bridge.model.matrix.SyncResponse;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Application-service implementation of {@link MatrixWireClient}: authenticates with the AS token and impersonates
 * users through the {@code user_id} query parameter.
 */
@Service
@Slf4j
public class RestTemplateMatrixWireClient implements MatrixWireClient {

    private static final String CLIENT_API = "/_matrix/client/v3";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${neohoods.bridge.matrix.homeserver-url}")
    private String homeserverUrl;

    @Value("${neohoods.bridge.matrix.server-name:}")
    private String configuredServerName;

    @Value("${neohoods.bridge.matrix.as-token}")
    private String asToken;

    @Value("${neohoods.bridge.matrix.sync-timeout-ms:30000}")
    private long syncTimeoutMs;

    @Value("${neohoods.bridge.matrix.sync-timeline-limit:100}")
    private int syncTimelineLimit;

    private String serverName;

    public RestTemplateMatrixWireClient(@Qualifier("matrixRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        homeserverUrl = normalizeHomeserverUrl(homeserverUrl);
        serverName = StringUtils.hasText(configuredServerName)
                ? configuredServerName.trim()
                : URI.create(homeserverUrl).getHost();
        log.info("Matrix wire client targeting {} (server name {})", homeserverUrl, serverName);
    }

    @Override
    public String serverName() {
        return serverName;
    }

    @Override
    public String sendMessage(String actingUserId, String roomId, Map<String, Object> content) {
        URI uri = clientUri("/rooms/{roomId}/send/m.room.message/{txnId}", actingUserId, Map.of(),
                roomId, UUID.randomUUID().toString());
        Map<String, Object> body = call(HttpMethod.PUT, uri, jsonEntity(content), "send message to " + roomId);
        String eventId = body == null ? null : (String) body.get("event_id");
        if (!StringUtils.hasText(eventId)) {
            throw new MatrixApiException(HttpStatus.OK.value(), null, "send message returned no event_id");
        }
        return eventId;
    }

    @Override
    public SyncResponse sync(String actingUserId, String since) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("timeout", String.valueOf(syncTimeoutMs));
        query.put("filter", syncFilter());
        if (StringUtils.hasText(since)) {
            query.put("since", since);
        }
        URI uri = clientUri("/sync", actingUserId, query);
        try {
            ResponseEntity<SyncResponse> response = restTemplate.exchange(uri, HttpMethod.GET,
                    new HttpEntity<>(authHeaders()), SyncResponse.class);
            SyncResponse sync = response.getBody();
            return sync == null ? new SyncResponse() : sync;
        } catch (HttpStatusCodeException e) {
            throw toMatrixException(e, "sync for " + actingUserId);
        } catch (RestClientException e) {
            throw new MatrixApiException("sync for " + actingUserId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String createDirectRoom(String actingUserId, String inviteeUserId, String aliasLocalpart) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("preset", "trusted_private_chat");
        request.put("visibility", "private");
        request.put("is_direct", true);
        request.put("invite", List.of(inviteeUserId));
        if (StringUtils.hasText(aliasLocalpart)) {
            request.put("room_alias_name", aliasLocalpart);
        }
        URI uri = clientUri("/createRoom", actingUserId, Map.of());
        Map<String, Object> body = call(HttpMethod.POST, uri, jsonEntity(request),
                "create direct room " + aliasLocalpart);
        String roomId = body == null ? null : (String) body.get("room_id");
        if (!StringUtils.hasText(roomId)) {
            throw new MatrixApiException(HttpStatus.OK.value(), null, "createRoom returned no room_id");
        }
        return roomId;
    }

    @Override
    public void joinRoom(String actingUserId, String roomId) {
        Map<String, String> query = new HashMap<>();
        String roomServer = MatrixIds.serverNameOf(roomId);
        if (roomServer != null && !roomServer.equalsIgnoreCase(serverName)) {
            query.put("server_name", roomServer);
        }
        URI uri = clientUri("/join/{roomId}", actingUserId, query, roomId);
        call(HttpMethod.POST, uri, jsonEntity(Map.of()), "join " + roomId + " as " + actingUserId);
    }

    @Override
    public Optional<String> resolveAlias(String alias) {
        URI uri = clientUri("/directory/room/{alias}", null, Map.of(), alias);
        try {
            Map<String, Object> body = call(HttpMethod.GET, uri, new HttpEntity<>(authHeaders()),
                    "resolve alias " + alias);
            String roomId = body == null ? null : (String) body.get("room_id");
            return StringUtils.hasText(roomId) ? Optional.of(roomId) : Optional.empty();
        } catch (MatrixApiException e) {
            if (e.getCode() == HttpStatus.NOT_FOUND.value() || MatrixApiException.M_NOT_FOUND.equals(e.getErrcode())) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> getRoomAliases(String actingUserId, String roomId) {
        URI uri = clientUri("/rooms/{roomId}/aliases", actingUserId, Map.of(), roomId);
        try {
            Map<String, Object> body = call(HttpMethod.GET, uri, new HttpEntity<>(authHeaders()),
                    "list aliases of " + roomId);
            Object aliases = body == null ? null : body.get("aliases");
            return aliases instanceof List ? new ArrayList<>((List<String>) aliases) : List.of();
        } catch (MatrixApiException e) {
            log.warn("Could not read aliases of room {}: {}", roomId, e.getMessage());
            return List.of();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<String> getJoinedMembers(String actingUserId, String roomId) {
        URI uri = clientUri("/rooms/{roomId}/joined_members", actingUserId, Map.of(), roomId);
        Map<String, Object> body = call(HttpMethod.GET, uri, new HttpEntity<>(authHeaders()),
                "list members of " + roomId);
        Object joined = body == null ? null : body.get("joined");
        if (joined instanceof Map) {
            return new ArrayList<>(((Map<String, Object>) joined).keySet());
        }
        return List.of();
    }

    @Override
    public String uploadMedia(String actingUserId, String contentType, byte[] data, String filename) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(homeserverUrl)
                .path("/_matrix/media/v3/upload")
                .queryParam("user_id", "{userId}");
        Map<String, Object> variables = new HashMap<>();
        variables.put("userId", actingUserId);
        if (StringUtils.hasText(filename)) {
            builder.queryParam("filename", "{filename}");
            variables.put("filename", filename);
        }
        URI uri = builder.encode().buildAndExpand(variables).toUri();

        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.parseMediaType(
                StringUtils.hasText(contentType) ? contentType : MediaType.APPLICATION_OCTET_STREAM_VALUE));
        Map<String, Object> body = call(HttpMethod.POST, uri, new HttpEntity<>(data, headers), "upload media");
        String contentUri = body == null ? null : (String) body.get("content_uri");
        if (contentUri == null || !contentUri.startsWith("mxc://")) {
            throw new MatrixApiException(HttpStatus.OK.value(), null, "upload returned no content_uri");
        }
        return contentUri;
    }

    @Override
    public void setPusher(String actingUserId, PusherRequest request) {
        URI uri = clientUri("/pushers/set", actingUserId, Map.of());
        call(HttpMethod.POST, uri, jsonEntity(request), "set pusher for " + actingUserId);
    }

    @Override
    public String resolveContentUrl(String mxcUri) {
        if (!StringUtils.hasText(mxcUri)) {
            return null;
        }
        if (!mxcUri.startsWith("mxc://")) {
            return mxcUri;
        }
        String[] parts = mxcUri.substring("mxc://".length()).split("/", 2);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            log.warn("Invalid MXC URL format: {}", mxcUri);
            return null;
        }
        return UriComponentsBuilder.fromHttpUrl(homeserverUrl)
                .pathSegment("_matrix", "media", "v3", "download", parts[0], parts[1])
                .build()
                .toUriString();
    }

    private URI clientUri(String path, String actingUserId, Map<String, String> query, Object... pathVariables) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(homeserverUrl).path(CLIENT_API + path);
        int index = pathVariables.length;
        List<Object> values = new ArrayList<>(List.of(pathVariables));
        if (StringUtils.hasText(actingUserId)) {
            builder.queryParam("user_id", "{q" + index++ + "}");
            values.add(actingUserId);
        }
        for (Map.Entry<String, String> param : query.entrySet()) {
            builder.queryParam(param.getKey(), "{q" + index++ + "}");
            values.add(param.getValue());
        }
        return builder.encode().buildAndExpand(values.toArray()).toUri();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> call(HttpMethod method, URI uri, HttpEntity<?> entity, String action) {
        try {
            ResponseEntity<Map> response = restTemplate.exchange(uri, method, entity, Map.class);
            return (Map<String, Object>) response.getBody();
        } catch (HttpStatusCodeException e) {
            throw toMatrixException(e, action);
        } catch (RestClientException e) {
            throw new MatrixApiException(action + " failed: " + e.getMessage(), e);
        }
    }

    private MatrixApiException toMatrixException(HttpStatusCodeException e, String action) {
        String errcode = null;
        String error = e.getStatusText();
        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            if (body != null && body.hasNonNull("errcode")) {
                errcode = body.get("errcode").asText();
            }
            if (body != null && body.hasNonNull("error")) {
                error = body.get("error").asText();
            }
        } catch (JsonProcessingException parseError) {
            log.debug("Matrix error body for {} is not JSON: {}", action, parseError.getMessage());
        }
        log.debug("Matrix call '{}' failed: HTTP {} {} {}", action, e.getStatusCode().value(), errcode, error);
        return new MatrixApiException(e.getStatusCode().value(), errcode,
                action + " failed: " + (errcode != null ? errcode + " " : "") + error);
    }

    private HttpEntity<Object> jsonEntity(Object body) {
        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(asToken);
        return headers;
    }

    private String syncFilter() {
        Map<String, Object> timeline = new LinkedHashMap<>();
        timeline.put("types", List.of("m.room.message"));
        timeline.put("limit", syncTimelineLimit);
        try {
            return objectMapper.writeValueAsString(Map.of("room", Map.of("timeline", timeline)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sync filter", e);
        }
    }

    private static String normalizeHomeserverUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("neohoods.bridge.matrix.homeserver-url is required");
        }
        String trimmed = url.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }
}
