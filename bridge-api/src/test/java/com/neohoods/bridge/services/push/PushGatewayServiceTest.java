package com.neohoods.bridge.services.push;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.neohoods.bridge.entities.PushTokenEntity;
import com.neohoods.bridge.model.push.AcrobitsPushRequest;
import com.neohoods.bridge.model.push.PushCounts;
import com.neohoods.bridge.model.push.PushDeliveryStatus;
import com.neohoods.bridge.model.push.PushDevice;
import com.neohoods.bridge.model.push.PushNotification;
import com.neohoods.bridge.model.push.PushNotifyRequest;
import com.neohoods.bridge.model.push.PushNotifyResponse;

@ExtendWith(MockitoExtension.class)
@DisplayName("PushGatewayService Unit Tests")
class PushGatewayServiceTest {

    @Mock
    private PushTokenService pushTokenService;

    @Mock
    private AcrobitsPushClient acrobitsPushClient;

    @InjectMocks
    private PushGatewayService pushGatewayService;

    private static PushTokenEntity token(String selector, String pushkey) {
        return PushTokenEntity.builder()
                .selector(selector)
                .tokenMsgs(pushkey)
                .appIdMsgs("com.acrobits.softphone")
                .build();
    }

    private static PushNotifyRequest notify(PushDevice... devices) {
        PushNotification notification = PushNotification.builder()
                .eventId("$evt")
                .roomId("!r1:srv")
                .sender("@bob:srv")
                .senderDisplayName("Bob")
                .content(Map.of("msgtype", "m.text", "body", "hello"))
                .counts(new PushCounts(3, 0))
                .devices(List.of(devices))
                .build();
        return new PushNotifyRequest(notification);
    }

    private static PushDevice device(String pushkey) {
        return PushDevice.builder().appId("com.acrobits.softphone").pushkey(pushkey).build();
    }

    @Test
    @DisplayName("translate should reject pushkeys without a registration and forward the others")
    void testTranslate_UnknownPushkeyRejected() {
        // Given
        when(pushTokenService.findByPushkey("known")).thenReturn(Optional.of(token("sel-1", "known")));
        when(pushTokenService.findByPushkey("unknown")).thenReturn(Optional.empty());
        when(acrobitsPushClient.send(any())).thenReturn(PushDeliveryStatus.DELIVERED);

        // When
        PushNotifyResponse response = pushGatewayService.translate(notify(device("known"), device("unknown")));

        // Then
        assertEquals(List.of("unknown"), response.getRejected());
        ArgumentCaptor<AcrobitsPushRequest> captor = ArgumentCaptor.forClass(AcrobitsPushRequest.class);
        verify(acrobitsPushClient).send(captor.capture());
        AcrobitsPushRequest push = captor.getValue();
        assertEquals(AcrobitsPushRequest.VERB_NOTIFY_TEXT_MESSAGE, push.getVerb());
        assertEquals("sel-1", push.getSelector());
        assertEquals("known", push.getDeviceToken());
        assertEquals("com.acrobits.softphone", push.getAppId());
        assertEquals("hello", push.getMessage());
        assertEquals("m.text", push.getContentType());
        assertEquals(3, push.getBadge());
        assertEquals("@bob:srv", push.getUserName());
        assertEquals("Bob", push.getUserDisplayName());
        assertEquals("$evt", push.getId());
        assertEquals("!r1:srv", push.getThreadId());
        assertEquals("default", push.getSound());
    }

    @Test
    @DisplayName("translate should reject tokens Acrobits reports as invalid but not transient failures")
    void testTranslate_DeliveryStatuses() {
        // Given
        when(pushTokenService.findByPushkey("stale")).thenReturn(Optional.of(token("sel-1", "stale")));
        when(pushTokenService.findByPushkey("flaky")).thenReturn(Optional.of(token("sel-2", "flaky")));
        when(acrobitsPushClient.send(any())).thenReturn(PushDeliveryStatus.TOKEN_INVALID, PushDeliveryStatus.FAILED);

        // When
        PushNotifyResponse response = pushGatewayService.translate(notify(device("stale"), device("flaky")));

        // Then
        assertEquals(List.of("stale"), response.getRejected());
    }

    @Test
    @DisplayName("translate should reject a pushkey whose lookup fails")
    void testTranslate_LookupFailure() {
        // Given
        when(pushTokenService.findByPushkey("k")).thenThrow(new IllegalStateException("db down"));

        // When
        PushNotifyResponse response = pushGatewayService.translate(notify(device("k")));

        // Then
        assertEquals(List.of("k"), response.getRejected());
        verify(acrobitsPushClient, never()).send(any());
    }

    @Test
    @DisplayName("translate should accept an empty notification")
    void testTranslate_Empty() {
        assertTrue(pushGatewayService.translate(new PushNotifyRequest()).getRejected().isEmpty());
        assertTrue(pushGatewayService.translate(null).getRejected().isEmpty());
    }

    @Test
    @DisplayName("toAcrobits should honour the sound tweak and fall back to the sender id")
    void testToAcrobits_Tweaks() {
        // Given
        PushNotification notification = PushNotification.builder().eventId("$e").sender("@bob:srv").build();
        PushDevice device = PushDevice.builder().pushkey("k").tweaks(Map.of("sound", "ring")).build();

        // When
        AcrobitsPushRequest push = pushGatewayService.toAcrobits(notification, device, token("sel", "k"));

        // Then
        assertEquals("ring", push.getSound());
        assertEquals("@bob:srv", push.getUserDisplayName());
        assertEquals(0, push.getBadge());
    }
}
