package com.neohoods.bridge.services.messages;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.model.AcrobitsMessage;
import com.neohoods.bridge.model.FetchMessagesRequest;
import com.neohoods.bridge.model.FetchMessagesResponse;
import com.neohoods.bridge.model.FetchResult;
import com.neohoods.bridge.model.content.MediaMessageContent;
import com.neohoods.bridge.model.content.MessageContent;
import com.neohoods.bridge.model.matrix.RoomEvent;
import com.neohoods.bridge.model.matrix.SyncResponse;
import com.neohoods.bridge.services.mapping.IdentityBootstrapService;
import com.neohoods.bridge.services.mapping.IdentityMappingService;
import com.neohoods.bridge.services.matrix.DirectRoomService;
import com.neohoods.bridge.services.matrix.MatrixIds;
import com.neohoods.bridge.services.matrix.MatrixWireClient;
import com.neohoods.bridge.services.matrix.SyncPositionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls a user's Matrix timeline and translates new messages for the softphone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageFetchService {

    public static final String TEXT_CONTENT_TYPE = "text/plain";

    private final MatrixWireClient matrixWireClient;
    private final SyncPositionStore syncPositionStore;
    private final IdentityMappingService identityMappingService;
    private final IdentityBootstrapService identityBootstrapService;
    private final DirectRoomService directRoomService;
    private final FileTransferCodec fileTransferCodec;
    private final Clock clock;

    public FetchMessagesResponse fetchMessages(FetchMessagesRequest request) {
        String userId = identityBootstrapService.resolveCaller(request.getUsername(), request.getPassword());
        FetchResult result = fetchSince(userId);
        return FetchMessagesResponse.builder()
                .date(formatTimestamp(clock.instant()))
                .receivedMessages(result.getReceived())
                .sentMessages(result.getSent())
                .build();
    }

    /**
     * Syncs from the user's stored position and stores the new one before translating, so the next poll continues
     * after this batch even if the result is never delivered.
     */
    public FetchResult fetchSince(String matrixId) {
        String since = syncPositionStore.get(matrixId);
        Instant previousObservedAt = syncPositionStore.lastObservedAt(matrixId).orElse(null);
        log.debug("Syncing {} from position '{}' stored at {}", matrixId, since, previousObservedAt);

        SyncResponse sync;
        try {
            sync = matrixWireClient.sync(matrixId, since);
        } catch (MatrixApiException e) {
            if (!e.isInvalidSyncToken() || !StringUtils.hasText(since)) {
                throw mapAuthFailure(matrixId, e);
            }
            log.warn("Sync position for {} rejected by the homeserver, retrying with a full sync: {}", matrixId,
                    e.getMessage());
            syncPositionStore.clear(matrixId);
            since = "";
            try {
                sync = matrixWireClient.sync(matrixId, since);
            } catch (MatrixApiException retryError) {
                throw mapAuthFailure(matrixId, retryError);
            }
        }

        if (StringUtils.hasText(sync.getNextBatch())) {
            syncPositionStore.store(matrixId, sync.getNextBatch());
            log.debug("Stored next position '{}' for {}", sync.getNextBatch(), matrixId);
        }

        String callerIdentifier = identityMappingService.reverseResolve(matrixId);
        List<AcrobitsMessage> sent = new ArrayList<>();
        List<AcrobitsMessage> received = new ArrayList<>();

        for (Map.Entry<String, SyncResponse.JoinedRoom> room : sync.joinedRooms().entrySet()) {
            for (RoomEvent event : room.getValue().events()) {
                if (!RoomEvent.TYPE_MESSAGE.equals(event.getType())) {
                    continue;
                }
                String roomId = StringUtils.hasText(event.getRoomId()) ? event.getRoomId() : room.getKey();
                AcrobitsMessage message = translate(event, roomId);
                message.setSender(identityMappingService.reverseResolve(event.getSender()));

                if (MatrixIds.sameUser(event.getSender(), matrixId)) {
                    message.setRecipient(directRoomService.resolveCounterpart(roomId, matrixId));
                    sent.add(message);
                } else {
                    message.setRecipient(callerIdentifier);
                    received.add(message);
                }
                log.debug("Event {} in {}: {} -> {}", event.getEventId(), roomId, message.getSender(),
                        message.getRecipient());
            }
        }

        log.debug("Fetched {} received and {} sent messages for {}", received.size(), sent.size(), matrixId);
        return FetchResult.builder()
                .sent(sent)
                .received(received)
                .previousPosition(since)
                .nextPosition(sync.getNextBatch())
                .previousObservedAt(previousObservedAt)
                .build();
    }

    private AcrobitsMessage translate(RoomEvent event, String roomId) {
        AcrobitsMessage message = AcrobitsMessage.builder()
                .messageId(event.getEventId())
                .sendingDate(formatTimestamp(Instant.ofEpochMilli(event.getOriginServerTs())))
                .streamId(roomId)
                .build();

        MessageContent content = MessageContent.decode(event.getContent());
        message.setText(content.getBody());
        message.setContentType(TEXT_CONTENT_TYPE);
        if (!(content instanceof MediaMessageContent)) {
            return message;
        }

        MediaMessageContent media = (MediaMessageContent) content;
        String contentUrl = matrixWireClient.resolveContentUrl(media.getUrl());
        if (contentUrl == null) {
            log.warn("Media event {} has no usable URL, sending its body as text", event.getEventId());
            return message;
        }
        try {
            String thumbnailUrl = matrixWireClient.resolveContentUrl(media.getThumbnailUrl());
            message.setText(fileTransferCodec.toFileTransferJson(media, contentUrl, thumbnailUrl));
            message.setContentType(FileTransferCodec.CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode media event {} as file transfer: {}", event.getEventId(), e.getMessage());
        }
        return message;
    }

    private RuntimeException mapAuthFailure(String matrixId, MatrixApiException e) {
        log.error("Matrix sync failed for {}: {}", matrixId, e.getMessage());
        if (e.isAuthFailure()) {
            return new CodedErrorException(CodedError.AUTHENTICATION_FAILED, Map.of("user", matrixId), e);
        }
        return e;
    }

    static String formatTimestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
