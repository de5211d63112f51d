package com.neohoods.bridge.services.push;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.neohoods.bridge.entities.PushTokenEntity;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.model.PushTokenReportRequest;
import com.neohoods.bridge.model.matrix.PusherRequest;
import com.neohoods.bridge.repositories.PushTokenRepository;
import com.neohoods.bridge.services.mapping.IdentityBootstrapService;
import com.neohoods.bridge.services.mapping.IdentityMappingService;
import com.neohoods.bridge.services.matrix.MatrixWireClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Device push registrations reported by softphones, and the matching homeserver pushers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PushTokenService {

    static final String PUSH_GATEWAY_PATH = "/_matrix/push/v1/notify";
    static final String DEVICE_DISPLAY_NAME = "Acrobits Softphone";

    private final PushTokenRepository pushTokenRepository;
    private final IdentityBootstrapService identityBootstrapService;
    private final IdentityMappingService identityMappingService;
    private final MatrixWireClient matrixWireClient;
    private final Clock clock;

    @Value("${neohoods.bridge.push.proxy-url:}")
    private String proxyUrl;

    /**
     * Looks a registration up by Matrix pushkey, which is either its message or its call token.
     */
    public Optional<PushTokenEntity> findByPushkey(String pushkey) {
        if (!StringUtils.hasText(pushkey)) {
            return Optional.empty();
        }
        return pushTokenRepository.findFirstByTokenMsgsOrTokenCalls(pushkey, pushkey);
    }

    @Transactional
    public PushTokenEntity save(String selector, String tokenMsgs, String appIdMsgs, String tokenCalls,
            String appIdCalls) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PushTokenEntity entity = pushTokenRepository.findBySelector(selector)
                .orElseGet(() -> PushTokenEntity.builder()
                        .id(UUID.randomUUID())
                        .selector(selector)
                        .createdAt(now)
                        .build());
        entity.setTokenMsgs(tokenMsgs);
        entity.setAppIdMsgs(appIdMsgs);
        entity.setTokenCalls(tokenCalls);
        entity.setAppIdCalls(appIdCalls);
        entity.setUpdatedAt(now);
        try {
            return pushTokenRepository.save(entity);
        } catch (DataAccessException e) {
            log.error("Failed to save push token for selector {}", selector, e);
            throw new CodedErrorException(CodedError.PUSH_STORAGE_ERROR, Map.of("selector", selector), e);
        }
    }

    public List<PushTokenEntity> list() {
        return pushTokenRepository.findAllByOrderByUpdatedAtDesc();
    }

    @Transactional
    public boolean delete(String selector) {
        Optional<PushTokenEntity> existing = pushTokenRepository.findBySelector(selector);
        existing.ifPresent(pushTokenRepository::delete);
        return existing.isPresent();
    }

    /**
     * @return the number of registrations removed
     */
    @Transactional
    public long reset() {
        long count = pushTokenRepository.count();
        pushTokenRepository.deleteAll();
        log.info("Removed {} push tokens", count);
        return count;
    }

    /**
     * Stores a softphone's push tokens after validating its credentials, then points the user's homeserver pusher
     * at this gateway. A pusher failure is logged and does not fail the report.
     */
    public PushTokenEntity report(PushTokenReportRequest request) {
        String username = request.getUsername() == null ? "" : request.getUsername().trim();
        String selector = request.getSelector() == null ? "" : request.getSelector().trim();
        String password = request.getPassword() == null ? "" : request.getPassword().trim();
        if (username.isEmpty()) {
            throw new CodedErrorException(CodedError.INVALID_INPUT, Map.of("field", "username"));
        }
        if (selector.isEmpty()) {
            throw new CodedErrorException(CodedError.INVALID_INPUT, Map.of("field", "selector"));
        }
        if (password.isEmpty()) {
            throw new CodedErrorException(CodedError.INVALID_INPUT, Map.of("field", "password"));
        }

        identityBootstrapService.validateAndLearn(username, password);

        PushTokenEntity saved = save(selector, request.getTokenMsgs(), request.getAppIdMsgs(),
                request.getTokenCalls(), request.getAppIdCalls());
        log.info("Push token reported for selector {}", selector);

        if (!StringUtils.hasText(proxyUrl)) {
            log.debug("Push proxy URL not configured, skipping pusher registration");
        } else if (StringUtils.hasText(request.getTokenMsgs())) {
            registerPusher(username, selector, request);
        }
        return saved;
    }

    private void registerPusher(String username, String selector, PushTokenReportRequest request) {
        Optional<String> matrixId = identityMappingService.resolve(username);
        if (matrixId.isEmpty()) {
            log.warn("Could not resolve {} to a Matrix user for pusher registration (selector {})", username,
                    selector);
            return;
        }

        String gatewayUrl = stripTrailingSlash(proxyUrl) + PUSH_GATEWAY_PATH;
        PusherRequest pusher = PusherRequest.builder()
                .kind("http")
                .appId(request.getAppIdMsgs())
                .appDisplayName(request.getAppIdMsgs())
                .deviceDisplayName(DEVICE_DISPLAY_NAME)
                .pushkey(request.getTokenMsgs())
                .lang("en")
                .append(false)
                .data(new PusherRequest.PusherData(gatewayUrl, "event_id_only"))
                .build();
        try {
            matrixWireClient.setPusher(matrixId.get(), pusher);
            log.info("Registered pusher for {} (selector {}) with gateway {}", matrixId.get(), selector, gatewayUrl);
        } catch (MatrixApiException e) {
            log.error("Failed to register pusher for {} (selector {}) with gateway {}: {}", matrixId.get(), selector,
                    gatewayUrl, e.getMessage());
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
