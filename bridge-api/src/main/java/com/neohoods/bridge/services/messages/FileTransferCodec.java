package com.neohoods.bridge.services.messages;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.model.FileTransferAttachment;
import com.neohoods.bridge.model.FileTransferMessage;
import com.neohoods.bridge.model.FileTransferPreview;
import com.neohoods.bridge.model.content.MediaKind;
import com.neohoods.bridge.model.content.MediaMessageContent;

import lombok.RequiredArgsConstructor;

/**
 * Converts between the softphone file-transfer envelope and Matrix media content.
 */
@Component
@RequiredArgsConstructor
public class FileTransferCodec {

    public static final String CONTENT_TYPE = "application/x-acro-filetransfer+json";
    public static final String DEFAULT_ATTACHMENT_TYPE = "image/jpeg";
    public static final String DEFAULT_PREVIEW_TYPE = "image/jpeg";

    private final ObjectMapper objectMapper;

    public static boolean isFileTransfer(String contentType) {
        return contentType != null && CONTENT_TYPE.equalsIgnoreCase(contentType.trim());
    }

    /**
     * @throws CodedErrorException {@link CodedError#INVALID_INPUT} when the body is not a file-transfer envelope
     */
    public FileTransferMessage parse(String body) {
        try {
            FileTransferMessage message = objectMapper.readValue(body == null ? "" : body, FileTransferMessage.class);
            if (message == null) {
                throw new CodedErrorException(CodedError.INVALID_INPUT, Map.of("content_type", CONTENT_TYPE));
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new CodedErrorException(CodedError.INVALID_INPUT, Map.of("content_type", CONTENT_TYPE), e);
        }
    }

    /**
     * Describes the first attachment as Matrix media. The url is still the softphone's source URL; the caller
     * replaces it once the bytes are uploaded.
     */
    public MediaMessageContent toMediaContent(FileTransferMessage message) {
        List<FileTransferAttachment> attachments = message.getAttachments();
        if (attachments == null || attachments.isEmpty()) {
            throw new IllegalArgumentException("file transfer message has no attachments");
        }
        FileTransferAttachment attachment = attachments.get(0);

        String contentType = StringUtils.hasText(attachment.getContentType())
                ? attachment.getContentType()
                : DEFAULT_ATTACHMENT_TYPE;
        String body = firstNonBlank(attachment.getFilename(), message.getBody(), "attachment");

        MediaMessageContent.MediaMessageContentBuilder media = MediaMessageContent.builder()
                .kind(MediaKind.fromMimeType(contentType))
                .body(body)
                .url(attachment.getContentUrl())
                .mimeType(contentType)
                .size(attachment.getContentSize() != null && attachment.getContentSize() > 0
                        ? attachment.getContentSize()
                        : null)
                .filename(StringUtils.hasText(attachment.getFilename()) ? attachment.getFilename() : null);

        FileTransferPreview preview = attachment.getPreview();
        if (preview != null && isLink(preview.getContent())) {
            media.thumbnailUrl(preview.getContent());
            media.thumbnailMimeType(StringUtils.hasText(preview.getContentType()) ? preview.getContentType() : null);
        }
        return media.build();
    }

    /**
     * Builds the envelope handed to the softphone for a Matrix media event.
     *
     * @param contentUrl   downloadable URL of the media
     * @param thumbnailUrl downloadable URL of the thumbnail, may be null
     */
    public String toFileTransferJson(MediaMessageContent media, String contentUrl, String thumbnailUrl)
            throws JsonProcessingException {
        FileTransferAttachment.FileTransferAttachmentBuilder attachment = FileTransferAttachment.builder()
                .contentUrl(contentUrl)
                .contentType(StringUtils.hasText(media.getMimeType())
                        ? media.getMimeType()
                        : media.getKind().getDefaultMimeType())
                .contentSize(media.getSize() != null && media.getSize() > 0 ? media.getSize() : null)
                .filename(firstNonBlank(media.getFilename(), media.getBody(), null))
                .description(StringUtils.hasText(media.getBody()) ? media.getBody() : null);
        if (StringUtils.hasText(thumbnailUrl)) {
            attachment.preview(FileTransferPreview.builder()
                    .contentType(StringUtils.hasText(media.getThumbnailMimeType())
                            ? media.getThumbnailMimeType()
                            : DEFAULT_PREVIEW_TYPE)
                    .content(thumbnailUrl)
                    .build());
        }

        FileTransferMessage message = FileTransferMessage.builder()
                .body(media.getBody())
                .attachments(List.of(attachment.build()))
                .build();
        return objectMapper.writeValueAsString(message);
    }

    private static boolean isLink(String value) {
        return value != null
                && (value.startsWith("http://") || value.startsWith("https://") || value.startsWith("mxc://"));
    }

    private static String firstNonBlank(String first, String second, String fallback) {
        if (StringUtils.hasText(first)) {
            return first;
        }
        if (StringUtils.hasText(second)) {
            return second;
        }
        return fallback;
    }
}
