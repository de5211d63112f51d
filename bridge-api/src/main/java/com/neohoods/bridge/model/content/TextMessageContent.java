package com.neohoods.bridge.model.content;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.ToString;

@ToString
public class TextMessageContent extends MessageContent {

    public TextMessageContent(String body) {
        super(body);
    }

    @Override
    public String getMsgtype() {
        return TEXT_MSGTYPE;
    }

    @Override
    public Map<String, Object> toEventContent() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", TEXT_MSGTYPE);
        content.put("body", getBody());
        return content;
    }
}
