package com.neohoods.bridge.api.client;

import java.time.Duration;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.neohoods.bridge.model.FetchMessagesRequest;
import com.neohoods.bridge.model.FetchMessagesResponse;
import com.neohoods.bridge.model.PushTokenReportRequest;
import com.neohoods.bridge.model.SendMessageRequest;
import com.neohoods.bridge.model.SendMessageResponse;
import com.neohoods.bridge.services.messages.MessageFetchService;
import com.neohoods.bridge.services.messages.MessageSendService;
import com.neohoods.bridge.services.push.PushTokenService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Endpoints called by the Acrobits softphone (web service URLs configured in the provisioning).
 */
@RestController
@RequestMapping("/api/client")
@RequiredArgsConstructor
@Slf4j
public class ClientApi {

    private final MessageSendService messageSendService;
    private final MessageFetchService messageFetchService;
    private final PushTokenService pushTokenService;

    @Value("${neohoods.bridge.request-timeout-ms:90000}")
    private long requestTimeoutMs;

    /**
     * Implements POST /api/client/send_message
     */
    @PostMapping("/send_message")
    public Mono<ResponseEntity<SendMessageResponse>> sendMessage(@RequestBody SendMessageRequest request) {
        log.debug("send_message from {} to {}", request.getFrom(), request.getTo());
        return Mono.fromCallable(() -> messageSendService.send(request))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .map(result -> {
                    log.info("send_message from {} to {} delivered as {} ({})", request.getFrom(), request.getTo(),
                            result.getMessageId(), result.getDelivery());
                    return ResponseEntity.ok(new SendMessageResponse(result.getMessageId()));
                });
    }

    /**
     * Implements POST /api/client/fetch_messages
     */
    @PostMapping("/fetch_messages")
    public Mono<ResponseEntity<FetchMessagesResponse>> fetchMessages(@RequestBody FetchMessagesRequest request) {
        log.debug("fetch_messages for {} (last_id {})", request.getUsername(), request.getLastId());
        return Mono.fromCallable(() -> messageFetchService.fetchMessages(request))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .map(response -> {
                    log.info("fetch_messages for {}: {} received, {} sent", request.getUsername(),
                            response.getReceivedMessages().size(), response.getSentMessages().size());
                    return ResponseEntity.ok(response);
                });
    }

    /**
     * Implements POST /api/client/push_token_report
     */
    @PostMapping("/push_token_report")
    public Mono<ResponseEntity<Map<String, Object>>> pushTokenReport(@RequestBody PushTokenReportRequest request) {
        log.debug("push_token_report for {} (selector {})", request.getUsername(), request.getSelector());
        return Mono.fromCallable(() -> pushTokenService.report(request))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .map(saved -> ResponseEntity.ok(Map.<String, Object>of()));
    }
}
