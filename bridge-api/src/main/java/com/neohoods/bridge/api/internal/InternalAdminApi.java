package com.neohoods.bridge.api.internal;

import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;

import com.neohoods.bridge.entities.PushTokenEntity;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.model.MappingEntry;
import com.neohoods.bridge.services.mapping.IdentityMappingService;
import com.neohoods.bridge.services.push.PushTokenService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Administrative endpoints, reachable from localhost only with the {@code X-Super-Admin-Token} header.
 */
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
@Slf4j
public class InternalAdminApi {

    static final String ADMIN_TOKEN_HEADER = "X-Super-Admin-Token";

    private final IdentityMappingService identityMappingService;
    private final PushTokenService pushTokenService;

    @Value("${neohoods.bridge.admin.token:${neohoods.bridge.matrix.as-token:}}")
    private String adminToken;

    /**
     * Implements POST /api/internal/map_number_to_matrix
     */
    @PostMapping("/map_number_to_matrix")
    public Mono<ResponseEntity<MappingEntry>> saveMapping(@RequestBody MappingEntry entry,
            ServerWebExchange exchange) {
        ensureAdminAccess(exchange);
        MappingEntry stored = identityMappingService.upsert(entry);
        log.info("Mapping {} -> {} saved through admin API", stored.getNumber(), stored.getMatrixId());
        return Mono.just(ResponseEntity.ok(stored));
    }

    /**
     * Implements GET /api/internal/map_number_to_matrix?number=
     */
    @GetMapping("/map_number_to_matrix")
    public Mono<ResponseEntity<MappingEntry>> getMapping(@RequestParam("number") String number,
            ServerWebExchange exchange) {
        ensureAdminAccess(exchange);
        return Mono.just(ResponseEntity.ok(identityMappingService.lookup(number)));
    }

    /**
     * Implements GET /api/internal/map_number_to_matrix/all
     */
    @GetMapping("/map_number_to_matrix/all")
    public Mono<ResponseEntity<List<MappingEntry>>> listMappings(ServerWebExchange exchange) {
        ensureAdminAccess(exchange);
        return Mono.just(ResponseEntity.ok(identityMappingService.list()));
    }

    /**
     * Implements GET /api/internal/push_tokens
     */
    @GetMapping("/push_tokens")
    public Mono<ResponseEntity<List<PushTokenEntity>>> listPushTokens(ServerWebExchange exchange) {
        ensureAdminAccess(exchange);
        return Mono.fromCallable(pushTokenService::list)
                .subscribeOn(Schedulers.boundedElastic())
                .map(tokens -> {
                    log.info("Listed {} push tokens", tokens.size());
                    return ResponseEntity.ok(tokens);
                });
    }

    /**
     * Implements DELETE /api/internal/push_tokens
     */
    @DeleteMapping("/push_tokens")
    public Mono<ResponseEntity<Map<String, Object>>> resetPushTokens(ServerWebExchange exchange) {
        ensureAdminAccess(exchange);
        return Mono.fromCallable(pushTokenService::reset)
                .subscribeOn(Schedulers.boundedElastic())
                .map(removed -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", "reset");
                    body.put("removed", removed);
                    return ResponseEntity.ok(body);
                });
    }

    void ensureAdminAccess(ServerWebExchange exchange) {
        if (!StringUtils.hasText(adminToken)) {
            throw new CodedErrorException(CodedError.INTERNAL_ERROR, Map.of("reason", "admin token not configured"));
        }
        InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
        if (remote == null || remote.getAddress() == null || !remote.getAddress().isLoopbackAddress()) {
            throw new CodedErrorException(CodedError.ADMIN_FORBIDDEN);
        }
        String token = exchange.getRequest().getHeaders().getFirst(ADMIN_TOKEN_HEADER);
        if (!adminToken.equals(token)) {
            throw new CodedErrorException(CodedError.ADMIN_TOKEN_INVALID);
        }
    }
}
