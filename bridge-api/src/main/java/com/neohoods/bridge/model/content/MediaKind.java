package com.neohoods.bridge.model.content;

import java.util.Locale;
import java.util.Set;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MediaKind {
    IMAGE("m.image", "image/jpeg"),
    VIDEO("m.video", "video/mp4"),
    AUDIO("m.audio", "audio/mpeg"),
    FILE("m.file", "application/octet-stream");

    private static final Set<String> IMAGE_TYPES = Set.of(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp", "image/bmp", "image/tiff");
    private static final Set<String> VIDEO_TYPES = Set.of(
            "video/mp4", "video/webm", "video/ogg", "video/quicktime", "video/x-msvideo");
    private static final Set<String> AUDIO_TYPES = Set.of(
            "audio/mpeg", "audio/mp3", "audio/ogg", "audio/wav", "audio/x-wav", "audio/wave", "audio/webm", "audio/aac",
            "audio/flac");

    private final String msgtype;
    private final String defaultMimeType;

    /**
     * @return the kind for a Matrix msgtype, or null when the msgtype is not a media type
     */
    public static MediaKind fromMsgtype(String msgtype) {
        for (MediaKind kind : values()) {
            if (kind.msgtype.equals(msgtype)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Classifies a MIME type; anything outside the known image, video and audio lists is a plain file.
     */
    public static MediaKind fromMimeType(String mimeType) {
        String normalized = normalizeMimeType(mimeType);
        if (IMAGE_TYPES.contains(normalized)) {
            return IMAGE;
        }
        if (VIDEO_TYPES.contains(normalized)) {
            return VIDEO;
        }
        if (AUDIO_TYPES.contains(normalized)) {
            return AUDIO;
        }
        return FILE;
    }

    public static String normalizeMimeType(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        String value = mimeType;
        int paramsAt = value.indexOf(';');
        if (paramsAt >= 0) {
            value = value.substring(0, paramsAt);
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
