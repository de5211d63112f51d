package com.neohoods.bridge.model.content;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.ToString;

/**
 * Any msgtype the bridge does not translate (notices, emotes, locations...). Only the body is carried through.
 */
@ToString
public class UnrecognizedMessageContent extends MessageContent {

    private final String msgtype;

    public UnrecognizedMessageContent(String msgtype, String body) {
        super(body);
        this.msgtype = msgtype;
    }

    @Override
    public String getMsgtype() {
        return msgtype;
    }

    @Override
    public Map<String, Object> toEventContent() {
        Map<String, Object> content = new LinkedHashMap<>();
        if (msgtype != null) {
            content.put("msgtype", msgtype);
        }
        content.put("body", getBody());
        return content;
    }
}
