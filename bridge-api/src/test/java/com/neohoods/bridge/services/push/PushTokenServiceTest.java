package com.neohoods.bridge.services.push;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neohoods.bridge.MutableClock;
import com.neohoods.bridge.entities.PushTokenEntity;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.model.MappingEntry;
import com.neohoods.bridge.model.PushTokenReportRequest;
import com.neohoods.bridge.model.matrix.PusherRequest;
import com.neohoods.bridge.repositories.PushTokenRepository;
import com.neohoods.bridge.services.mapping.IdentityBootstrapService;
import com.neohoods.bridge.services.mapping.IdentityMappingService;
import com.neohoods.bridge.services.matrix.MatrixWireClient;

@ExtendWith(MockitoExtension.class)
@DisplayName("PushTokenService Unit Tests")
class PushTokenServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private PushTokenRepository pushTokenRepository;

    @Mock
    private IdentityBootstrapService identityBootstrapService;

    @Mock
    private MatrixWireClient matrixWireClient;

    private PushTokenService pushTokenService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        IdentityMappingService identityMappingService = new IdentityMappingService(new ObjectMapper(), clock);
        identityMappingService.upsert(MappingEntry.builder().number("201").matrixId("@alice:srv").build());
        pushTokenService = new PushTokenService(pushTokenRepository, identityBootstrapService, identityMappingService,
                matrixWireClient, clock);
        ReflectionTestUtils.setField(pushTokenService, "proxyUrl", "https://bridge.example.com/");
    }

    private static PushTokenReportRequest report() {
        return PushTokenReportRequest.builder()
                .username("201")
                .password("secret")
                .selector("sel-1")
                .tokenMsgs("msg-token")
                .appIdMsgs("com.acrobits.softphone")
                .tokenCalls("call-token")
                .appIdCalls("com.acrobits.softphone.voip")
                .build();
    }

    @Test
    @DisplayName("report should store the tokens and register a pusher for the user")
    void testReport() {
        // Given
        when(pushTokenRepository.findBySelector("sel-1")).thenReturn(Optional.empty());
        when(pushTokenRepository.save(any(PushTokenEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        PushTokenEntity saved = pushTokenService.report(report());

        // Then
        verify(identityBootstrapService).validateAndLearn("201", "secret");
        assertNotNull(saved.getId());
        assertEquals("sel-1", saved.getSelector());
        assertEquals("msg-token", saved.getTokenMsgs());
        assertEquals("call-token", saved.getTokenCalls());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), saved.getCreatedAt());

        ArgumentCaptor<PusherRequest> captor = ArgumentCaptor.forClass(PusherRequest.class);
        verify(matrixWireClient).setPusher(eq("@alice:srv"), captor.capture());
        PusherRequest pusher = captor.getValue();
        assertEquals("http", pusher.getKind());
        assertEquals("msg-token", pusher.getPushkey());
        assertEquals("com.acrobits.softphone", pusher.getAppId());
        assertEquals("Acrobits Softphone", pusher.getDeviceDisplayName());
        assertEquals("https://bridge.example.com/_matrix/push/v1/notify", pusher.getData().getUrl());
        assertEquals("event_id_only", pusher.getData().getFormat());
        assertFalse(pusher.isAppend());
    }

    @Test
    @DisplayName("report should update an existing registration in place")
    void testReport_UpdatesExisting() {
        // Given
        PushTokenEntity existing = PushTokenEntity.builder()
                .id(UUID.randomUUID())
                .selector("sel-1")
                .tokenMsgs("old")
                .createdAt(OffsetDateTime.parse("2024-01-01T00:00:00Z"))
                .build();
        when(pushTokenRepository.findBySelector("sel-1")).thenReturn(Optional.of(existing));
        when(pushTokenRepository.save(existing)).thenReturn(existing);

        // When
        PushTokenEntity saved = pushTokenService.report(report());

        // Then
        assertSame(existing, saved);
        assertEquals("msg-token", saved.getTokenMsgs());
        assertEquals(OffsetDateTime.parse("2024-01-01T00:00:00Z"), saved.getCreatedAt());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), saved.getUpdatedAt());
    }

    @Test
    @DisplayName("report should not fail when the pusher cannot be registered")
    void testReport_PusherFailureIgnored() {
        // Given
        when(pushTokenRepository.findBySelector("sel-1")).thenReturn(Optional.empty());
        when(pushTokenRepository.save(any(PushTokenEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
        doThrow(new MatrixApiException(500, "M_UNKNOWN", "boom")).when(matrixWireClient)
                .setPusher(anyString(), any(PusherRequest.class));

        // When / Then
        assertNotNull(pushTokenService.report(report()));
    }

    @Test
    @DisplayName("report should skip pusher registration without a proxy URL")
    void testReport_NoProxyUrl() {
        // Given
        ReflectionTestUtils.setField(pushTokenService, "proxyUrl", "");
        when(pushTokenRepository.findBySelector("sel-1")).thenReturn(Optional.empty());
        when(pushTokenRepository.save(any(PushTokenEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        pushTokenService.report(report());

        // Then
        verifyNoInteractions(matrixWireClient);
    }

    @Test
    @DisplayName("report should require username, selector and password")
    void testReport_MissingFields() {
        PushTokenReportRequest noSelector = report();
        noSelector.setSelector(" ");

        CodedErrorException exception = assertThrows(CodedErrorException.class,
                () -> pushTokenService.report(noSelector));

        assertEquals(CodedError.INVALID_INPUT, exception.getError());
        assertEquals("selector", exception.getVariables().get("field"));
        verify(identityBootstrapService, never()).validateAndLearn(anyString(), anyString());
    }

    @Test
    @DisplayName("save should report storage failures as PUSH_STORAGE_ERROR")
    void testSave_StorageFailure() {
        // Given
        when(pushTokenRepository.findBySelector("sel-1")).thenReturn(Optional.empty());
        when(pushTokenRepository.save(any(PushTokenEntity.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate"));

        // When
        CodedErrorException exception = assertThrows(CodedErrorException.class,
                () -> pushTokenService.save("sel-1", "m", "a", null, null));

        // Then
        assertEquals(CodedError.PUSH_STORAGE_ERROR, exception.getError());
    }

    @Test
    @DisplayName("findByPushkey should match message or call tokens and ignore blank keys")
    void testFindByPushkey() {
        // Given
        PushTokenEntity entity = PushTokenEntity.builder().selector("sel-1").tokenCalls("call-token").build();
        when(pushTokenRepository.findFirstByTokenMsgsOrTokenCalls("call-token", "call-token"))
                .thenReturn(Optional.of(entity));

        // When / Then
        assertSame(entity, pushTokenService.findByPushkey("call-token").orElse(null));
        assertTrue(pushTokenService.findByPushkey(" ").isEmpty());
    }

    @Test
    @DisplayName("reset and delete should remove registrations")
    void testResetAndDelete() {
        // Given
        PushTokenEntity entity = PushTokenEntity.builder().selector("sel-1").build();
        when(pushTokenRepository.count()).thenReturn(2L);
        when(pushTokenRepository.findBySelector("sel-1")).thenReturn(Optional.of(entity));
        when(pushTokenRepository.findBySelector("none")).thenReturn(Optional.empty());

        // When / Then
        assertEquals(2L, pushTokenService.reset());
        verify(pushTokenRepository).deleteAll();
        assertTrue(pushTokenService.delete("sel-1"));
        verify(pushTokenRepository).delete(entity);
        assertFalse(pushTokenService.delete("none"));
    }
}
