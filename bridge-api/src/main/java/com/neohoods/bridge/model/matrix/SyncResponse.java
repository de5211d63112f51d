package com.neohoods.bridge.model.matrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The part of a {@code /sync} response the bridge reads: the next batch token and the joined rooms' timelines.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncResponse {
    @JsonProperty("next_batch")
    private String nextBatch;
    @Builder.Default
    private Rooms rooms = new Rooms();

    /**
     * @return joined rooms in the order the homeserver listed them
     */
    public Map<String, JoinedRoom> joinedRooms() {
        if (rooms == null || rooms.getJoin() == null) {
            return Map.of();
        }
        return rooms.getJoin();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Rooms {
        private Map<String, JoinedRoom> join = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JoinedRoom {
        private Timeline timeline = new Timeline();

        public List<RoomEvent> events() {
            if (timeline == null || timeline.getEvents() == null) {
                return List.of();
            }
            return timeline.getEvents();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timeline {
        private List<RoomEvent> events = new ArrayList<>();
        private boolean limited;
        @JsonProperty("prev_batch")
        private String prevBatch;
    }
}
