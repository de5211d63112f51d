package com.neohoods.bridge.model.matrix;

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
public class RoomEvent {
    public static final String TYPE_MESSAGE = "m.room.message";

    @JsonProperty("event_id")
    private String eventId;
    private String type;
    private String sender;
    @JsonProperty("room_id")
    private String roomId;
    @JsonProperty("origin_server_ts")
    private long originServerTs;
    private Map<String, Object> content;
}
