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
public class PushTokenReportRequest {
    private String username;
    private String password;
    private String selector;
    @JsonProperty("token_msgs")
    private String tokenMsgs;
    @JsonProperty("appid_msgs")
    private String appIdMsgs;
    @JsonProperty("token_calls")
    private String tokenCalls;
    @JsonProperty("appid_calls")
    private String appIdCalls;
}
