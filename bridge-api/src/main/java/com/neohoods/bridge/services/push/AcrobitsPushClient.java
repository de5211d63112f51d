package com.neohoods.bridge.services.push;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neohoods.bridge.model.push.AcrobitsPushRequest;
import com.neohoods.bridge.model.push.AcrobitsPushResponse;
import com.neohoods.bridge.model.push.PushDeliveryStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Client for the Acrobits PNM push service.
 */
@Service
@Slf4j
public class AcrobitsPushClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${neohoods.bridge.push.acrobits-url:https://pnm.cloudsoftphone.com/pnm2/send}")
    private String acrobitsUrl;

    public AcrobitsPushClient(@Qualifier("pushRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public PushDeliveryStatus send(AcrobitsPushRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        String responseBody;
        try {
            ResponseEntity<String> response = restTemplate.exchange(acrobitsUrl, HttpMethod.POST,
                    new HttpEntity<>(request, headers), String.class);
            responseBody = response.getBody();
        } catch (HttpStatusCodeException e) {
            responseBody = e.getResponseBodyAsString();
            log.debug("Acrobits PNM answered HTTP {} for selector {}", e.getStatusCode().value(),
                    request.getSelector());
        } catch (RestClientException e) {
            log.error("Failed to send push to Acrobits for selector {}: {}", request.getSelector(), e.getMessage());
            return PushDeliveryStatus.FAILED;
        }

        AcrobitsPushResponse reply;
        try {
            reply = objectMapper.readValue(responseBody == null ? "" : responseBody, AcrobitsPushResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable Acrobits response for selector {}: {}", request.getSelector(), responseBody);
            return PushDeliveryStatus.FAILED;
        }

        log.debug("Acrobits PNM replied code={} response={}", reply.getCode(), reply.getResponse());
        if (reply.getCode() == 200) {
            return PushDeliveryStatus.DELIVERED;
        }
        if (reply.getCode() == 404 || (reply.getResponse() != null && reply.getResponse().contains("404"))) {
            return PushDeliveryStatus.TOKEN_INVALID;
        }
        log.warn("Acrobits push failed for selector {}: code={} response={}", request.getSelector(),
                reply.getCode(), reply.getResponse());
        return PushDeliveryStatus.FAILED;
    }
}
