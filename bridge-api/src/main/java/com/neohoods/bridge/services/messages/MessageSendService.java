package com.neohoods.bridge.services.messages;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.exceptions.MediaTransferException;
import com.neohoods.bridge.model.DeliveryMode;
import com.neohoods.bridge.model.FileTransferMessage;
import com.neohoods.bridge.model.SendMessageRequest;
import com.neohoods.bridge.model.SendResult;
import com.neohoods.bridge.model.content.MediaKind;
import com.neohoods.bridge.model.content.MediaMessageContent;
import com.neohoods.bridge.model.content.MessageContent;
import com.neohoods.bridge.model.content.TextMessageContent;
import com.neohoods.bridge.services.mapping.IdentityBootstrapService;
import com.neohoods.bridge.services.mapping.IdentityMappingService;
import com.neohoods.bridge.services.matrix.DirectRoomService;
import com.neohoods.bridge.services.matrix.MatrixIds;
import com.neohoods.bridge.services.matrix.MatrixWireClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers softphone messages into Matrix direct rooms.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageSendService {

    private final IdentityMappingService identityMappingService;
    private final IdentityBootstrapService identityBootstrapService;
    private final DirectRoomService directRoomService;
    private final MatrixWireClient matrixWireClient;
    private final MediaTransferService mediaTransferService;
    private final FileTransferCodec fileTransferCodec;

    /**
     * Sends on behalf of a softphone, authenticating the sender through the external validator if it is not mapped
     * yet.
     */
    public SendResult send(SendMessageRequest request) {
        if (!StringUtils.hasText(request.getFrom())) {
            throw new CodedErrorException(CodedError.INVALID_SENDER);
        }
        String sender = identityBootstrapService.resolveCaller(request.getFrom(), request.getPassword());
        return deliver(sender, request.getTo(), request.getBody(), request.getContentType());
    }

    /**
     * Sends from an already known identifier.
     *
     * @throws CodedErrorException {@link CodedError#INVALID_SENDER} or {@link CodedError#INVALID_RECIPIENT} when
     *                             either side does not resolve
     */
    public SendResult send(String from, String to, String body, String contentType) {
        String sender = identityMappingService.resolve(from)
                .orElseThrow(() -> new CodedErrorException(CodedError.INVALID_SENDER,
                        Map.of("from", from == null ? "" : from)));
        return deliver(sender, to, body, contentType);
    }

    private SendResult deliver(String sender, String to, String body, String contentType) {
        String roomId = targetRoom(sender, to);

        // the sender may have missed the join when the room was first set up
        matrixWireClient.joinRoom(sender, roomId);

        MessageContent content;
        DeliveryMode delivery;
        if (FileTransferCodec.isFileTransfer(contentType)) {
            FileTransferMessage envelope = fileTransferCodec.parse(body);
            List<?> attachments = envelope.getAttachments();
            if (attachments == null || attachments.isEmpty()) {
                log.debug("File transfer from {} has no attachments, sending as text", sender);
                content = new TextMessageContent(envelope.getBody());
                delivery = DeliveryMode.TEXT;
            } else {
                try {
                    content = transferMedia(sender, envelope);
                    delivery = DeliveryMode.MEDIA;
                } catch (MediaTransferException | MatrixApiException e) {
                    log.warn("Attachment from {} could not be transferred, falling back to text: {}", sender,
                            e.getMessage());
                    content = new TextMessageContent(envelope.getBody());
                    delivery = DeliveryMode.TEXT_FALLBACK;
                }
            }
        } else {
            content = new TextMessageContent(body);
            delivery = DeliveryMode.TEXT;
        }

        String eventId;
        try {
            eventId = matrixWireClient.sendMessage(sender, roomId, content.toEventContent());
        } catch (MatrixApiException e) {
            log.error("Failed to send message from {} to room {}: {}", sender, roomId, e.getMessage());
            if (e.isAuthFailure()) {
                throw new CodedErrorException(CodedError.AUTHENTICATION_FAILED, Map.of("sender", sender), e);
            }
            throw e;
        }
        log.info("Message {} sent from {} to room {} as {}", eventId, sender, roomId, delivery);
        return new SendResult(eventId, roomId, delivery);
    }

    private String targetRoom(String sender, String to) {
        if (!StringUtils.hasText(to)) {
            throw new CodedErrorException(CodedError.INVALID_RECIPIENT);
        }
        String recipient = to.trim();
        if (MatrixIds.isRoomId(recipient)) {
            log.debug("Recipient {} is a room id, using it directly", recipient);
            return recipient;
        }
        String recipientMatrixId = identityMappingService.resolve(recipient)
                .orElseThrow(() -> new CodedErrorException(CodedError.INVALID_RECIPIENT, Map.of("to", recipient)));
        return directRoomService.ensureRoom(sender, recipientMatrixId);
    }

    private MediaMessageContent transferMedia(String sender, FileTransferMessage envelope) {
        MediaMessageContent requested = fileTransferCodec.toMediaContent(envelope);

        byte[] data = mediaTransferService.download(requested.getUrl());
        String mimeType = mediaTransferService.effectiveMimeType(requested.getMimeType(), data);
        MediaKind kind = requested.getKind();
        MediaKind detectedKind = MediaKind.fromMimeType(mimeType);
        if (!mimeType.equals(requested.getMimeType()) && detectedKind != MediaKind.FILE) {
            kind = detectedKind;
        }

        String contentUri = matrixWireClient.uploadMedia(sender, mimeType, data, requested.getFilename());
        log.debug("Attachment {} uploaded as {} ({} bytes, {})", requested.getUrl(), contentUri, data.length,
                mimeType);

        return MediaMessageContent.builder()
                .kind(kind)
                .body(requested.getBody())
                .url(contentUri)
                .mimeType(mimeType)
                .size((long) data.length)
                .filename(requested.getFilename())
                .thumbnailUrl(requested.getThumbnailUrl())
                .thumbnailMimeType(requested.getThumbnailMimeType())
                .build();
    }
}
