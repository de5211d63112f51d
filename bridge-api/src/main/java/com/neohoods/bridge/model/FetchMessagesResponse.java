package com.neohoods.bridge.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchMessagesResponse {
    private String date;
    @JsonProperty("received_messages")
    @Builder.Default
    private List<AcrobitsMessage> receivedMessages = new ArrayList<>();
    @JsonProperty("sent_messages")
    @Builder.Default
    private List<AcrobitsMessage> sentMessages = new ArrayList<>();
}
