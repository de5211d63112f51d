package com.neohoods.bridge.services.messages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neohoods.bridge.MutableClock;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.model.AcrobitsMessage;
import com.neohoods.bridge.model.FetchMessagesRequest;
import com.neohoods.bridge.model.FetchMessagesResponse;
import com.neohoods.bridge.model.FetchResult;
import com.neohoods.bridge.model.MappingEntry;
import com.neohoods.bridge.model.matrix.RoomEvent;
import com.neohoods.bridge.model.matrix.SyncResponse;
import com.neohoods.bridge.services.mapping.IdentityBootstrapService;
import com.neohoods.bridge.services.mapping.IdentityMappingService;
import com.neohoods.bridge.services.matrix.DirectRoomService;
import com.neohoods.bridge.services.matrix.MatrixWireClient;
import com.neohoods.bridge.services.matrix.SyncPositionStore;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageFetchService Unit Tests")
class MessageFetchServiceTest {

    private static final String ALICE = "@alice:srv";
    private static final String BOB = "@bob:srv";
    private static final String ROOM = "!r1:srv";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00.750Z");

    @Mock
    private MatrixWireClient matrixWireClient;

    @Mock
    private IdentityBootstrapService identityBootstrapService;

    @Mock
    private DirectRoomService directRoomService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private SyncPositionStore syncPositionStore;
    private IdentityMappingService identityMappingService;
    private MessageFetchService messageFetchService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        syncPositionStore = new SyncPositionStore(clock);
        identityMappingService = new IdentityMappingService(objectMapper, clock);
        identityMappingService.upsert(MappingEntry.builder().number("201").matrixId(ALICE).build());
        identityMappingService.upsert(MappingEntry.builder().number("202").matrixId(BOB).build());
        messageFetchService = new MessageFetchService(matrixWireClient, syncPositionStore, identityMappingService,
                identityBootstrapService, directRoomService, new FileTransferCodec(objectMapper), clock);
    }

    private static RoomEvent textEvent(String eventId, String sender, long ts, String body) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", "m.text");
        content.put("body", body);
        return RoomEvent.builder()
                .eventId(eventId)
                .type(RoomEvent.TYPE_MESSAGE)
                .sender(sender)
                .originServerTs(ts)
                .content(content)
                .build();
    }

    private static SyncResponse sync(String nextBatch, RoomEvent... events) {
        SyncResponse.Timeline timeline = new SyncResponse.Timeline(new ArrayList<>(Arrays.asList(events)), false,
                null);
        Map<String, SyncResponse.JoinedRoom> join = new LinkedHashMap<>();
        join.put(ROOM, new SyncResponse.JoinedRoom(timeline));
        return SyncResponse.builder().nextBatch(nextBatch).rooms(new SyncResponse.Rooms(join)).build();
    }

    @Test
    @DisplayName("fetchSince should continue from the stored position and store the next one")
    void testFetchSince_AdvancesPosition() {
        // Given
        syncPositionStore.store(ALICE, "tok1");
        when(matrixWireClient.sync(ALICE, "tok1")).thenReturn(sync("tok2"));

        // When
        FetchResult result = messageFetchService.fetchSince(ALICE);

        // Then
        assertEquals("tok1", result.getPreviousPosition());
        assertEquals("tok2", result.getNextPosition());
        assertEquals(NOW, result.getPreviousObservedAt());
        assertEquals("tok2", syncPositionStore.get(ALICE));
        assertTrue(result.getSent().isEmpty());
        assertTrue(result.getReceived().isEmpty());
    }

    @Test
    @DisplayName("fetchSince should split messages into sent and received with display identifiers")
    void testFetchSince_SplitsDirections() {
        // Given
        when(matrixWireClient.sync(ALICE, "")).thenReturn(sync("tok1",
                textEvent("$in", BOB, 1700000000123L, "hi alice"),
                textEvent("$out", ALICE, 1700000001000L, "hi bob"),
                RoomEvent.builder().eventId("$state").type("m.room.member").sender(BOB).build()));
        when(directRoomService.resolveCounterpart(ROOM, ALICE)).thenReturn("202");

        // When
        FetchResult result = messageFetchService.fetchSince(ALICE);

        // Then
        assertNull(result.getPreviousObservedAt());
        assertEquals(1, result.getReceived().size());
        AcrobitsMessage received = result.getReceived().get(0);
        assertEquals("$in", received.getMessageId());
        assertEquals("202", received.getSender());
        assertEquals("201", received.getRecipient());
        assertEquals("hi alice", received.getText());
        assertEquals("text/plain", received.getContentType());
        assertEquals(ROOM, received.getStreamId());
        assertEquals("2023-11-14T22:13:20Z", received.getSendingDate());

        assertEquals(1, result.getSent().size());
        AcrobitsMessage sent = result.getSent().get(0);
        assertEquals("$out", sent.getMessageId());
        assertEquals("201", sent.getSender());
        assertEquals("202", sent.getRecipient());
    }

    @Test
    @DisplayName("fetchSince should restart from scratch once when the stored position is rejected")
    void testFetchSince_InvalidPositionRetried() {
        // Given
        syncPositionStore.store(ALICE, "stale");
        when(matrixWireClient.sync(ALICE, "stale"))
                .thenThrow(new MatrixApiException(400, MatrixApiException.M_UNKNOWN, "Invalid stream token"));
        when(matrixWireClient.sync(ALICE, "")).thenReturn(sync("fresh", textEvent("$in", BOB, 1000L, "hello")));

        // When
        FetchResult result = messageFetchService.fetchSince(ALICE);

        // Then
        assertEquals("", result.getPreviousPosition());
        assertEquals("fresh", syncPositionStore.get(ALICE));
        assertEquals(1, result.getReceived().size());
        verify(matrixWireClient, times(1)).sync(ALICE, "");
    }

    @Test
    @DisplayName("fetchSince should not retry a rejected full sync")
    void testFetchSince_FullSyncFailure() {
        // Given
        MatrixApiException error = new MatrixApiException(400, MatrixApiException.M_UNKNOWN, "broken");
        when(matrixWireClient.sync(ALICE, "")).thenThrow(error);

        // When / Then
        MatrixApiException thrown = assertThrows(MatrixApiException.class,
                () -> messageFetchService.fetchSince(ALICE));
        assertSame(error, thrown);
        verify(matrixWireClient, times(1)).sync(ALICE, "");
    }

    @Test
    @DisplayName("fetchSince should report a rejected token as an authentication failure")
    void testFetchSince_AuthFailure() {
        // Given
        when(matrixWireClient.sync(ALICE, ""))
                .thenThrow(new MatrixApiException(401, MatrixApiException.M_UNKNOWN_TOKEN, "Unknown token"));

        // When
        CodedErrorException exception = assertThrows(CodedErrorException.class,
                () -> messageFetchService.fetchSince(ALICE));

        // Then
        assertEquals(CodedError.AUTHENTICATION_FAILED, exception.getError());
        assertEquals("", syncPositionStore.get(ALICE));
    }

    @Test
    @DisplayName("fetchSince should deliver media events as file-transfer envelopes")
    void testFetchSince_MediaAsFileTransfer() throws Exception {
        // Given
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("mimetype", "image/png");
        info.put("size", 2048);
        info.put("thumbnail_url", "mxc://srv/thumb");
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", "m.image");
        content.put("body", "cat.png");
        content.put("url", "mxc://srv/media");
        content.put("info", info);
        RoomEvent image = RoomEvent.builder().eventId("$img").type(RoomEvent.TYPE_MESSAGE).sender(BOB)
                .originServerTs(1000L).content(content).build();
        when(matrixWireClient.sync(ALICE, "")).thenReturn(sync("tok1", image));
        when(matrixWireClient.resolveContentUrl("mxc://srv/media"))
                .thenReturn("https://hs/_matrix/media/v3/download/srv/media");
        when(matrixWireClient.resolveContentUrl("mxc://srv/thumb"))
                .thenReturn("https://hs/_matrix/media/v3/download/srv/thumb");

        // When
        AcrobitsMessage message = messageFetchService.fetchSince(ALICE).getReceived().get(0);

        // Then
        assertEquals(FileTransferCodec.CONTENT_TYPE, message.getContentType());
        JsonNode envelope = objectMapper.readTree(message.getText());
        JsonNode attachment = envelope.get("attachments").get(0);
        assertEquals("cat.png", envelope.get("body").asText());
        assertEquals("image/png", attachment.get("content-type").asText());
        assertEquals("https://hs/_matrix/media/v3/download/srv/media", attachment.get("content-url").asText());
        assertEquals(2048, attachment.get("content-size").asLong());
        assertEquals("cat.png", attachment.get("filename").asText());
        assertEquals("https://hs/_matrix/media/v3/download/srv/thumb",
                attachment.get("preview").get("content").asText());
    }

    @Test
    @DisplayName("fetchSince should fall back to text for media without a usable URL")
    void testFetchSince_MediaWithoutUrl() {
        // Given
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("msgtype", "m.file");
        content.put("body", "report.pdf");
        RoomEvent file = RoomEvent.builder().eventId("$f").type(RoomEvent.TYPE_MESSAGE).sender(BOB)
                .originServerTs(1000L).content(content).build();
        when(matrixWireClient.sync(ALICE, "")).thenReturn(sync("tok1", file));
        when(matrixWireClient.resolveContentUrl(null)).thenReturn(null);

        // When
        AcrobitsMessage message = messageFetchService.fetchSince(ALICE).getReceived().get(0);

        // Then
        assertEquals("text/plain", message.getContentType());
        assertEquals("report.pdf", message.getText());
    }

    @Test
    @DisplayName("fetchMessages should authenticate the caller and stamp the response date")
    void testFetchMessages() {
        // Given
        FetchMessagesRequest request = FetchMessagesRequest.builder().username("201").password("secret").build();
        when(identityBootstrapService.resolveCaller("201", "secret")).thenReturn(ALICE);
        when(matrixWireClient.sync(ALICE, "")).thenReturn(sync("tok1", textEvent("$in", BOB, 1000L, "hello")));

        // When
        FetchMessagesResponse response = messageFetchService.fetchMessages(request);

        // Then
        assertEquals("2025-03-01T10:00:00Z", response.getDate());
        assertEquals(1, response.getReceivedMessages().size());
        assertTrue(response.getSentMessages().isEmpty());
        verify(directRoomService, never()).resolveCounterpart(anyString(), anyString());
    }

    @Test
    @DisplayName("formatTimestamp should drop sub-second precision")
    void testFormatTimestamp() {
        assertEquals("2025-03-01T10:00:00Z", MessageFetchService.formatTimestamp(NOW));
    }
}
