package com.neohoods.bridge.model.push;

import java.util.Map;

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
public class PushDevice {
    @JsonProperty("app_id")
    private String appId;
    private String pushkey;
    @JsonProperty("pushkey_ts")
    private Long pushkeyTs;
    private Map<String, Object> data;
    private Map<String, Object> tweaks;
}
