package com.neohoods.bridge.services.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.model.MappingEntry;
import com.neohoods.bridge.services.cache.TtlCache;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates credentials against the NethVoice CTI API: {@code /api/login} for a JWT, then {@code /api/chat?users=1}
 * for the extensions of every chat user.
 */
@Service
@Slf4j
public class HttpExternalAuthClient implements ExternalAuthClient {

    private final RestTemplate restTemplate;
    private final TtlCache<String, Boolean> validatedCredentials;

    @Value("${neohoods.bridge.auth.url:}")
    private String authUrl;

    @Value("${neohoods.bridge.auth.chat-claim:nethvoice_cti.chat}")
    private String chatClaim;

    public HttpExternalAuthClient(@Qualifier("authRestTemplate") RestTemplate restTemplate,
            @Value("${neohoods.bridge.cache.ttl-seconds:3600}") long cacheTtlSeconds, Clock clock) {
        this.restTemplate = restTemplate;
        this.validatedCredentials = new TtlCache<>(Duration.ofSeconds(cacheTtlSeconds), clock);
    }

    @Override
    public AuthValidation validate(String username, String password, String serverName) {
        if (!StringUtils.hasText(authUrl)) {
            log.warn("External auth URL not configured, rejecting {}", username);
            return AuthValidation.rejected();
        }
        String user = stripDomain(username);
        // key includes a digest of the secret
        String cacheKey = user + "|" + serverName + "|" + fingerprint(password);
        if (validatedCredentials.get(cacheKey).isPresent()) {
            log.debug("External auth cache hit for {}", cacheKey);
            return AuthValidation.accepted(List.of());
        }

        String token = login(user, password);
        if (token == null) {
            return AuthValidation.rejected();
        }
        if (!hasChatAccess(token, user)) {
            return AuthValidation.rejected();
        }

        ChatResponse chat = fetchChatUsers(token);
        if (chat == null) {
            return AuthValidation.rejected();
        }
        validatedCredentials.put(cacheKey, Boolean.TRUE);

        List<MappingEntry> entries = new ArrayList<>();
        List<ChatUser> users = chat.getUsers() == null ? List.of() : chat.getUsers();
        for (ChatUser chatUser : users) {
            MappingEntry entry = toMappingEntry(chatUser, serverName);
            if (entry != null) {
                entries.add(entry);
            }
        }
        log.info("External auth accepted {} with {} chat users", user, entries.size());
        return AuthValidation.accepted(entries);
    }

    private String login(String user, String password) {
        String loginUrl = UriComponentsBuilder.fromHttpUrl(authUrl)
                .pathSegment("api", "login")
                .build()
                .toUriString();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, String>> request = new HttpEntity<>(
                Map.of("username", user, "password", password == null ? "" : password.trim()), headers);

        try {
            ResponseEntity<LoginResponse> response = restTemplate.exchange(loginUrl, HttpMethod.POST, request,
                    LoginResponse.class);
            if (response.getBody() == null || !StringUtils.hasText(response.getBody().getToken())) {
                log.warn("External auth login for {} returned no token", user);
                return null;
            }
            return response.getBody().getToken();
        } catch (HttpClientErrorException e) {
            log.warn("External auth login rejected for {}: HTTP {}", user, e.getStatusCode());
            return null;
        } catch (RestClientException e) {
            log.error("External auth login request failed for {}: {}", user, e.getMessage());
            throw new CodedErrorException(CodedError.EXTERNAL_AUTH_ERROR, Map.of("step", "login"), e);
        }
    }

    private boolean hasChatAccess(String token, String user) {
        Object claim;
        try {
            JWTClaimsSet claims = JWTParser.parse(token).getJWTClaimsSet();
            claim = claims.getClaim(chatClaim);
        } catch (ParseException e) {
            log.warn("External auth returned an unreadable JWT for {}: {}", user, e.getMessage());
            return false;
        }
        boolean allowed = Boolean.TRUE.equals(claim)
                || (claim instanceof String && "true".equalsIgnoreCase((String) claim));
        if (!allowed) {
            log.warn("User {} lacks the {} claim", user, chatClaim);
        }
        return allowed;
    }

    private ChatResponse fetchChatUsers(String token) {
        String chatUrl = UriComponentsBuilder.fromHttpUrl(authUrl)
                .pathSegment("api", "chat")
                .queryParam("users", 1)
                .build()
                .toUriString();
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        try {
            ResponseEntity<ChatResponse> response = restTemplate.exchange(chatUrl, HttpMethod.GET,
                    new HttpEntity<>(headers), ChatResponse.class);
            return response.getBody() == null ? new ChatResponse() : response.getBody();
        } catch (HttpClientErrorException e) {
            log.warn("External auth chat users request rejected: HTTP {}", e.getStatusCode());
            return null;
        } catch (RestClientException e) {
            log.error("External auth chat users request failed: {}", e.getMessage());
            throw new CodedErrorException(CodedError.EXTERNAL_AUTH_ERROR, Map.of("step", "chat"), e);
        }
    }

    private MappingEntry toMappingEntry(ChatUser chatUser, String serverName) {
        String mainExtension = chatUser.getMainExtension() == null ? "" : chatUser.getMainExtension().trim();
        if (!isNumeric(mainExtension)) {
            log.warn("Skipping chat user {} with invalid main extension '{}'", chatUser.getUserName(), mainExtension);
            return null;
        }
        if (!StringUtils.hasText(chatUser.getUserName())) {
            log.warn("Skipping chat user with empty user name for extension {}", mainExtension);
            return null;
        }

        Set<String> altNumbers = new LinkedHashSet<>();
        if (chatUser.getSubExtensions() != null) {
            for (String sub : chatUser.getSubExtensions()) {
                String trimmed = sub == null ? "" : sub.trim();
                if (isNumeric(trimmed)) {
                    altNumbers.add(trimmed);
                } else if (!trimmed.isEmpty()) {
                    log.debug("Skipping invalid sub extension '{}' of {}", trimmed, chatUser.getUserName());
                }
            }
        }

        return MappingEntry.builder()
                .number(mainExtension)
                .matrixId("@" + chatUser.getUserName().trim().toLowerCase(Locale.ROOT) + ":" + serverName)
                .altNumbers(altNumbers)
                .build();
    }

    private static String fingerprint(String password) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest((password == null ? "" : password.trim()).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String stripDomain(String username) {
        String user = username == null ? "" : username.trim();
        int at = user.indexOf('@');
        return at > 0 ? user.substring(0, at) : user;
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LoginResponse {
        private String token;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatResponse {
        private List<ChatUser> users = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChatUser {
        @JsonProperty("user_name")
        private String userName;
        @JsonProperty("main_extension")
        private String mainExtension;
        @JsonProperty("sub_extensions")
        private List<String> subExtensions = new ArrayList<>();
    }
}
