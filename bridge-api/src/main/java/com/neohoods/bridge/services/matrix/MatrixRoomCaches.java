package com.neohoods.bridge.services.matrix;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.neohoods.bridge.services.cache.TtlCache;

import lombok.Getter;

/**
 * Room lookup caches sharing one TTL: pair key to room id, room id to aliases, and room plus viewer to the
 * counterpart's display identifier.
 */
@Component
@Getter
public class MatrixRoomCaches {

    private final TtlCache<String, String> roomsByPairKey;
    private final TtlCache<String, List<String>> aliasesByRoom;
    private final TtlCache<String, String> counterpartsByRoomAndViewer;

    public MatrixRoomCaches(@Value("${neohoods.bridge.cache.ttl-seconds:3600}") long ttlSeconds, Clock clock) {
        Duration ttl = Duration.ofSeconds(ttlSeconds);
        this.roomsByPairKey = new TtlCache<>(ttl, clock);
        this.aliasesByRoom = new TtlCache<>(ttl, clock, ArrayList::new);
        this.counterpartsByRoomAndViewer = new TtlCache<>(ttl, clock);
    }

    public static String counterpartKey(String roomId, String viewerMatrixId) {
        return roomId + "|" + viewerMatrixId;
    }

    public void clear() {
        roomsByPairKey.clear();
        aliasesByRoom.clear();
        counterpartsByRoomAndViewer.clear();
    }
}
