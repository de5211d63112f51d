package com.neohoods.bridge.model.matrix;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /_matrix/client/v3/pushers/set}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PusherRequest {
    private String kind;
    @JsonProperty("app_id")
    private String appId;
    @JsonProperty("app_display_name")
    private String appDisplayName;
    @JsonProperty("device_display_name")
    private String deviceDisplayName;
    private String pushkey;
    private String lang;
    private PusherData data;
    private boolean append;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PusherData {
        private String url;
        private String format;
    }
}
