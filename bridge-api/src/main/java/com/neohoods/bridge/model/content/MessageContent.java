package com.neohoods.bridge.model.content;

import java.util.Map;

import lombok.Getter;

/**
 * Decoded content of an {@code m.room.message} event.
 * <p>
 * Exactly one of {@link TextMessageContent}, {@link MediaMessageContent} or {@link UnrecognizedMessageContent} is
 * produced by {@link #decode(Map)}; {@link #toEventContent()} goes the other way.
 */
@Getter
public abstract class MessageContent {

    public static final String TEXT_MSGTYPE = "m.text";

    private final String body;

    protected MessageContent(String body) {
        this.body = body == null ? "" : body;
    }

    public abstract String getMsgtype();

    public abstract Map<String, Object> toEventContent();

    public static MessageContent decode(Map<String, Object> raw) {
        if (raw == null) {
            return new UnrecognizedMessageContent(null, "");
        }
        String msgtype = stringValue(raw.get("msgtype"));
        String body = stringValue(raw.get("body"));

        if (TEXT_MSGTYPE.equals(msgtype)) {
            return new TextMessageContent(body);
        }
        MediaKind kind = MediaKind.fromMsgtype(msgtype);
        if (kind == null) {
            return new UnrecognizedMessageContent(msgtype, body);
        }

        MediaMessageContent.MediaMessageContentBuilder media = MediaMessageContent.builder()
                .kind(kind)
                .body(body)
                .url(stringValue(raw.get("url")))
                .filename(stringValue(raw.get("filename")));
        Object info = raw.get("info");
        if (info instanceof Map) {
            Map<?, ?> infoMap = (Map<?, ?>) info;
            media.mimeType(stringValue(infoMap.get("mimetype")));
            Object size = infoMap.get("size");
            if (size instanceof Number) {
                media.size(((Number) size).longValue());
            }
            media.thumbnailUrl(stringValue(infoMap.get("thumbnail_url")));
            Object thumbnailInfo = infoMap.get("thumbnail_info");
            if (thumbnailInfo instanceof Map) {
                media.thumbnailMimeType(stringValue(((Map<?, ?>) thumbnailInfo).get("mimetype")));
            }
        }
        return media.build();
    }

    private static String stringValue(Object value) {
        return value instanceof String ? (String) value : null;
    }
}
