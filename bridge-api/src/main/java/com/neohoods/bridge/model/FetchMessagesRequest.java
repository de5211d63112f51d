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
public class FetchMessagesRequest {
    private String username;
    private String password;
    @JsonProperty("last_id")
    private String lastId;
    @JsonProperty("last_sent_id")
    private String lastSentId;
    private String device;
}
