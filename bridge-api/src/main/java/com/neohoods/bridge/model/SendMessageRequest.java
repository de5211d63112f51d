package com.neohoods.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SendMessageRequest {
    private String from;
    private String password;
    private String to;
    private String body;
    @JsonProperty("content_type")
    private String contentType;
    @JsonProperty("disposition_notification")
    private String dispositionNotification;
}
