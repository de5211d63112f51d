package com.neohoods.bridge.model.push;

import java.util.ArrayList;
import java.util.List;
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
public class PushNotification {
    @JsonProperty("event_id")
    private String eventId;
    @JsonProperty("room_id")
    private String roomId;
    private String type;
    private String sender;
    @JsonProperty("sender_display_name")
    private String senderDisplayName;
    @JsonProperty("room_name")
    private String roomName;
    @JsonProperty("room_alias")
    private String roomAlias;
    @JsonProperty("user_is_target")
    private Boolean userIsTarget;
    private String prio;
    private Map<String, Object> content;
    private PushCounts counts;
    @Builder.Default
    private List<PushDevice> devices = new ArrayList<>();
}
