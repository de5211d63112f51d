package com.neohoods.bridge.model.content;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.util.StringUtils;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class MediaMessageContent extends MessageContent {

    private final MediaKind kind;
    private final String url;
    private final String mimeType;
    private final Long size;
    private final String filename;
    private final String thumbnailUrl;
    private final String thumbnailMimeType;

    @Builder
    public MediaMessageContent(MediaKind kind, String body, String url, String mimeType, Long size, String filename,
            String thumbnailUrl, String thumbnailMimeType) {
        super(body);
        this.kind = kind == null ? MediaKind.FILE : kind;
        this.url = url;
        this.mimeType = mimeType;
        this.size = size;
        this.filename = filename;
        this.thumbnailUrl = thumbnailUrl;
        this.thumbnailMimeType = thumbnailMimeType;
    }

    @Override
    public String getMsgtype() {
        return kind.getMsgtype();
    }

    @Override
    public Map<String, Object> toEventContent() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", kind.getMsgtype());
        content.put("body", getBody());
        if (StringUtils.hasText(url)) {
            content.put("url", url);
        }
        if (StringUtils.hasText(filename)) {
            content.put("filename", filename);
        }

        Map<String, Object> info = new LinkedHashMap<>();
        if (StringUtils.hasText(mimeType)) {
            info.put("mimetype", mimeType);
        }
        if (size != null && size > 0) {
            info.put("size", size);
        }
        if (StringUtils.hasText(thumbnailUrl)) {
            info.put("thumbnail_url", thumbnailUrl);
            if (StringUtils.hasText(thumbnailMimeType)) {
                info.put("thumbnail_info", Map.of("mimetype", thumbnailMimeType));
            }
        }
        if (!info.isEmpty()) {
            content.put("info", info);
        }
        return content;
    }
}
