package com.neohoods.bridge.services.matrix;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.neohoods.bridge.model.matrix.PusherRequest;
import com.neohoods.bridge.model.matrix.SyncResponse;

/**
 * Matrix Client-Server calls the bridge needs. Every call names the user it acts as; implementations must not keep
 * an "acting as" state between calls.
 * <p>
 * Failures surface as {@link com.neohoods.bridge.exceptions.MatrixApiException}.
 */
public interface MatrixWireClient {

    /**
     * Server name used for room aliases and generated user ids.
     */
    String serverName();

    /**
     * @return the event id assigned by the homeserver
     */
    String sendMessage(String actingUserId, String roomId, Map<String, Object> content);

    /**
     * Incremental sync of {@code m.room.message} timelines.
     *
     * @param since continuation token, empty or null for a full sync
     */
    SyncResponse sync(String actingUserId, String since);

    /**
     * Creates a private direct room, inviting {@code inviteeUserId} and publishing {@code aliasLocalpart} as its
     * alias.
     *
     * @return the new room id
     */
    String createDirectRoom(String actingUserId, String inviteeUserId, String aliasLocalpart);

    void joinRoom(String actingUserId, String roomId);

    /**
     * @param alias full alias, {@code #localpart:server}
     */
    Optional<String> resolveAlias(String alias);

    /**
     * @return the room's local aliases, empty when they cannot be read
     */
    List<String> getRoomAliases(String actingUserId, String roomId);

    List<String> getJoinedMembers(String actingUserId, String roomId);

    /**
     * @return the {@code mxc://} URI of the uploaded content
     */
    String uploadMedia(String actingUserId, String contentType, byte[] data, String filename);

    void setPusher(String actingUserId, PusherRequest request);

    /**
     * Turns an {@code mxc://server/mediaId} URI into a downloadable HTTP URL. Other URLs are returned unchanged,
     * blank input gives null.
     */
    String resolveContentUrl(String mxcUri);
}
