package com.neohoods.bridge.services.matrix;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.services.mapping.IdentityMappingService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds or creates the single direct room shared by two users.
 * <p>
 * The room is published under an alias built from the pair key, so the homeserver's alias uniqueness decides which
 * of two racing creators wins. The local cache only saves round trips.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectRoomService {

    private final MatrixWireClient matrixWireClient;
    private final MatrixRoomCaches roomCaches;
    private final IdentityMappingService identityMappingService;

    public String ensureRoom(String actingUserId, String targetUserId) {
        String pairKey = MatrixIds.pairKey(actingUserId, targetUserId);
        Optional<String> cached = roomCaches.getRoomsByPairKey().get(pairKey);
        if (cached.isPresent()) {
            log.debug("Direct room {} for {} found in cache", cached.get(), pairKey);
            return cached.get();
        }

        String alias = MatrixIds.roomAlias(pairKey, matrixWireClient.serverName());
        String roomId = matrixWireClient.resolveAlias(alias).orElse(null);
        if (roomId != null) {
            log.debug("Direct room {} for {} resolved from alias", roomId, pairKey);
        } else {
            roomId = createRoom(actingUserId, targetUserId, pairKey, alias);
        }

        // only cached once the target is a member, so a failed join is retried on the next call
        try {
            matrixWireClient.joinRoom(targetUserId, roomId);
        } catch (MatrixApiException e) {
            log.error("Target user {} failed to join room {}: {}", targetUserId, roomId, e.getMessage());
            throw e;
        }
        roomCaches.getRoomsByPairKey().put(pairKey, roomId);
        log.info("Direct room {} ready for {} and {}", roomId, actingUserId, targetUserId);
        return roomId;
    }

    private String createRoom(String actingUserId, String targetUserId, String pairKey, String alias) {
        try {
            log.info("Creating direct room {} between {} and {}", alias, actingUserId, targetUserId);
            return matrixWireClient.createDirectRoom(actingUserId, targetUserId, pairKey);
        } catch (MatrixApiException e) {
            if (!e.isAliasInUse()) {
                log.error("Failed to create direct room between {} and {}: {}", actingUserId, targetUserId,
                        e.getMessage());
                throw e;
            }
            // lost the race: another caller registered the alias first
            String roomId = matrixWireClient.resolveAlias(alias).orElseThrow(() -> e);
            log.info("Direct room {} already created concurrently as {}", alias, roomId);
            return roomId;
        }
    }

    /**
     * Identifier of the other participant of a room, as seen by {@code viewerMatrixId}.
     * <p>
     * Read from the room's pair-key alias when it has one (cached per room and viewer). Rooms without such an alias
     * fall back to their joined members, then to the room id itself; fallback answers are not cached.
     */
    public String resolveCounterpart(String roomId, String viewerMatrixId) {
        String cacheKey = MatrixRoomCaches.counterpartKey(roomId, viewerMatrixId);
        Optional<String> cached = roomCaches.getCounterpartsByRoomAndViewer().get(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        for (String alias : roomAliases(roomId, viewerMatrixId)) {
            Optional<String> otherLocalpart = MatrixIds.otherSideOfPairKey(alias, viewerMatrixId);
            if (otherLocalpart.isEmpty()) {
                continue;
            }
            String identifier = identityMappingService.findByLocalpart(otherLocalpart.get())
                    .map(entry -> identityMappingService.reverseResolve(entry.getMatrixId()))
                    .orElseGet(() -> identityMappingService.reverseResolve(
                            "@" + otherLocalpart.get() + ":" + matrixWireClient.serverName()));
            roomCaches.getCounterpartsByRoomAndViewer().put(cacheKey, identifier);
            log.debug("Counterpart of {} in room {} resolved from alias {}: {}", viewerMatrixId, roomId, alias,
                    identifier);
            return identifier;
        }

        try {
            for (String member : matrixWireClient.getJoinedMembers(viewerMatrixId, roomId)) {
                if (!MatrixIds.sameUser(member, viewerMatrixId)) {
                    log.debug("Counterpart of {} in room {} taken from joined members: {}", viewerMatrixId, roomId,
                            member);
                    return identityMappingService.reverseResolve(member);
                }
            }
        } catch (MatrixApiException e) {
            log.warn("Could not list members of room {}: {}", roomId, e.getMessage());
        }
        log.debug("No counterpart found for {} in room {}, using the room id", viewerMatrixId, roomId);
        return roomId;
    }

    private List<String> roomAliases(String roomId, String viewerMatrixId) {
        Optional<List<String>> cached = roomCaches.getAliasesByRoom().get(roomId);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<String> aliases = matrixWireClient.getRoomAliases(viewerMatrixId, roomId);
        if (!aliases.isEmpty()) {
            roomCaches.getAliasesByRoom().put(roomId, aliases);
        }
        return aliases;
    }
}
