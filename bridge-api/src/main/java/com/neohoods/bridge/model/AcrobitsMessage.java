package com.neohoods.bridge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message as the softphone sees it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcrobitsMessage {
    @JsonProperty("message_id")
    private String messageId;
    @JsonProperty("sending_date")
    private String sendingDate;
    private String sender;
    private String recipient;
    @JsonProperty("message_text")
    private String text;
    @JsonProperty("content_type")
    private String contentType;
    @JsonProperty("stream_id")
    private String streamId;
}
