package com.neohoods.bridge.services.push;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.neohoods.bridge.entities.PushTokenEntity;
import com.neohoods.bridge.model.push.AcrobitsPushRequest;
import com.neohoods.bridge.model.push.PushDevice;
import com.neohoods.bridge.model.push.PushDeliveryStatus;
import com.neohoods.bridge.model.push.PushNotification;
import com.neohoods.bridge.model.push.PushNotifyRequest;
import com.neohoods.bridge.model.push.PushNotifyResponse;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Matrix push gateway: forwards homeserver notifications to Acrobits and reports the pushkeys to drop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PushGatewayService {

    static final String DEFAULT_SOUND = "default";

    private final PushTokenService pushTokenService;
    private final AcrobitsPushClient acrobitsPushClient;

    public PushNotifyResponse translate(PushNotifyRequest request) {
        List<String> rejected = new ArrayList<>();
        PushNotification notification = request == null ? null : request.getNotification();
        if (notification == null || notification.getDevices() == null) {
            return new PushNotifyResponse(rejected);
        }

        for (PushDevice device : notification.getDevices()) {
            String pushkey = device.getPushkey();
            Optional<PushTokenEntity> token;
            try {
                token = pushTokenService.findByPushkey(pushkey);
            } catch (RuntimeException e) {
                log.error("Push token lookup failed for pushkey {}: {}", pushkey, e.getMessage());
                token = Optional.empty();
            }
            if (token.isEmpty()) {
                log.warn("No push registration for pushkey {}, rejecting it", pushkey);
                rejected.add(pushkey);
                continue;
            }

            AcrobitsPushRequest push = toAcrobits(notification, device, token.get());
            PushDeliveryStatus status = acrobitsPushClient.send(push);
            if (status == PushDeliveryStatus.TOKEN_INVALID) {
                log.warn("Acrobits reports the token of selector {} as invalid, rejecting pushkey {}",
                        push.getSelector(), pushkey);
                rejected.add(pushkey);
            } else if (status == PushDeliveryStatus.DELIVERED) {
                log.info("Push for event {} delivered to selector {}", notification.getEventId(), push.getSelector());
            }
        }
        return new PushNotifyResponse(rejected);
    }

    AcrobitsPushRequest toAcrobits(PushNotification notification, PushDevice device, PushTokenEntity token) {
        Map<String, Object> content = notification.getContent();
        Object body = content == null ? null : content.get("body");
        Object msgtype = content == null ? null : content.get("msgtype");
        Object sound = device.getTweaks() == null ? null : device.getTweaks().get("sound");

        return AcrobitsPushRequest.builder()
                .verb(AcrobitsPushRequest.VERB_NOTIFY_TEXT_MESSAGE)
                .appId(token.getAppIdMsgs())
                .deviceToken(token.getTokenMsgs())
                .selector(token.getSelector())
                .message(body instanceof String ? (String) body : null)
                .contentType(msgtype instanceof String ? (String) msgtype : null)
                .badge(notification.getCounts() == null ? 0 : notification.getCounts().getUnread())
                .userName(notification.getSender())
                .userDisplayName(StringUtils.hasText(notification.getSenderDisplayName())
                        ? notification.getSenderDisplayName()
                        : notification.getSender())
                .id(notification.getEventId())
                .threadId(notification.getRoomId())
                .sound(sound instanceof String && !((String) sound).isEmpty() ? (String) sound : DEFAULT_SOUND)
                .build();
    }
}
