package com.neohoods.bridge.model.push;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload accepted by the Acrobits PNM {@code /pnm2/send} endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class AcrobitsPushRequest {
    public static final String VERB_NOTIFY_TEXT_MESSAGE = "NotifyTextMessage";

    @JsonProperty("verb")
    private String verb;
    @JsonProperty("AppId")
    private String appId;
    @JsonProperty("DeviceToken")
    private String deviceToken;
    @JsonProperty("Selector")
    private String selector;
    @JsonProperty("Message")
    private String message;
    @JsonProperty("ContentType")
    private String contentType;
    @JsonProperty("Badge")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private int badge;
    @JsonProperty("UserName")
    private String userName;
    @JsonProperty("UserDisplayName")
    private String userDisplayName;
    @JsonProperty("Id")
    private String id;
    @JsonProperty("ThreadId")
    private String threadId;
    @JsonProperty("Sound")
    private String sound;
}
