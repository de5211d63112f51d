package com.neohoods.bridge.api.matrix;

import java.time.Duration;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.neohoods.bridge.model.push.PushNotifyRequest;
import com.neohoods.bridge.model.push.PushNotifyResponse;
import com.neohoods.bridge.services.push.PushGatewayService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Endpoints called by the Matrix homeserver: the push gateway and application-service transactions.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class MatrixGatewayApi {

    private final PushGatewayService pushGatewayService;

    @Value("${neohoods.bridge.request-timeout-ms:90000}")
    private long requestTimeoutMs;

    @PostMapping("/_matrix/push/v1/notify")
    public Mono<ResponseEntity<PushNotifyResponse>> notify(@RequestBody PushNotifyRequest request) {
        return Mono.fromCallable(() -> pushGatewayService.translate(request))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .map(response -> {
                    log.info("Push notification processed, {} pushkeys rejected", response.getRejected().size());
                    return ResponseEntity.ok(response);
                });
    }

    /**
     * Transactions are acknowledged and otherwise ignored; messages are picked up through sync.
     */
    @PutMapping("/_matrix/app/v1/transactions/{txnId}")
    public Mono<ResponseEntity<Map<String, Object>>> transaction(@PathVariable String txnId,
            @RequestBody(required = false) String payload) {
        log.debug("Application service transaction {}: {}", txnId, payload);
        return Mono.just(ResponseEntity.ok(Map.of()));
    }
}
