package com.neohoods.bridge.services.messages;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.neohoods.bridge.exceptions.MediaTransferException;
import com.neohoods.bridge.model.content.MediaKind;

@DisplayName("MediaTransferService Unit Tests")
class MediaTransferServiceTest {

    private static final String URL = "https://files.example.com/cat.png";
    private static final byte[] PNG = new byte[] { (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A,
            0, 0, 0, 0x0D, 'I', 'H', 'D', 'R' };

    private MockRestServiceServer server;
    private MediaTransferService mediaTransferService;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        mediaTransferService = new MediaTransferService(restTemplate);
        ReflectionTestUtils.setField(mediaTransferService, "maxDownloadBytes", 1024L);
    }

    @Test
    @DisplayName("download should return the response bytes")
    void testDownload() {
        // Given
        server.expect(requestTo(URL)).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(PNG, MediaType.IMAGE_PNG));

        // When
        byte[] data = mediaTransferService.download(URL);

        // Then
        assertArrayEquals(PNG, data);
        server.verify();
    }

    @Test
    @DisplayName("download should refuse bodies above the configured limit")
    void testDownload_TooLarge() {
        // Given
        ReflectionTestUtils.setField(mediaTransferService, "maxDownloadBytes", 8L);
        server.expect(requestTo(URL)).andRespond(withSuccess(PNG, MediaType.IMAGE_PNG));

        // When / Then
        assertThrows(MediaTransferException.class, () -> mediaTransferService.download(URL));
    }

    @Test
    @DisplayName("download should fail on error statuses, empty bodies and missing URLs")
    void testDownload_Failures() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertThrows(MediaTransferException.class, () -> mediaTransferService.download(URL));

        server.reset();
        server.expect(requestTo(URL)).andRespond(withSuccess(new byte[0], MediaType.IMAGE_PNG));
        assertThrows(MediaTransferException.class, () -> mediaTransferService.download(URL));

        assertThrows(MediaTransferException.class, () -> mediaTransferService.download(" "));
    }

    @Test
    @DisplayName("effectiveMimeType should prefer sniffed image types and replace generic declarations")
    void testEffectiveMimeType() {
        byte[] text = "plain words".getBytes();

        assertEquals("image/png", mediaTransferService.effectiveMimeType("image/jpeg", PNG));
        assertEquals("image/png", mediaTransferService.effectiveMimeType("application/octet-stream", PNG));
        assertEquals("audio/mpeg", mediaTransferService.effectiveMimeType("audio/mpeg", text));
        assertEquals("application/octet-stream", mediaTransferService.effectiveMimeType(null, text));
    }

    @Test
    @DisplayName("effectiveMimeType should recognise container formats declared as octet-stream")
    void testEffectiveMimeType_SniffedFormats() {
        byte[] webp = bytes("RIFF", 0x24, 0, 0, 0, "WEBPVP8 ");
        byte[] wav = bytes("RIFF", 0x24, 0, 0, 0, "WAVEfmt ");
        byte[] mp4 = bytes(0, 0, 0, 0x18, "ftypisom", 0, 0, 2, 0);
        byte[] mov = bytes(0, 0, 0, 0x14, "ftypqt  ", 0, 0, 2, 0);
        byte[] mp3WithTag = bytes("ID3", 4, 0, 0, 0, 0, 0, 0);
        byte[] mp3Frame = bytes(0xFF, 0xFB, 0x90, 0x64, 0, 0);
        byte[] ogg = bytes("OggS", 0, 2, 0, 0);
        byte[] webm = bytes(0x1A, 0x45, 0xDF, 0xA3, 0x9F, 0x42, 0x86, 0x81);

        assertSniffed("image/webp", MediaKind.IMAGE, webp);
        assertSniffed("audio/wav", MediaKind.AUDIO, wav);
        assertSniffed("video/mp4", MediaKind.VIDEO, mp4);
        assertSniffed("video/quicktime", MediaKind.VIDEO, mov);
        assertSniffed("audio/mpeg", MediaKind.AUDIO, mp3WithTag);
        assertSniffed("audio/mpeg", MediaKind.AUDIO, mp3Frame);
        assertSniffed("audio/ogg", MediaKind.AUDIO, ogg);
        assertSniffed("video/webm", MediaKind.VIDEO, webm);
    }

    @Test
    @DisplayName("sniff should not mistake a JPEG or a truncated RIFF header for audio")
    void testSniff_AmbiguousPrefixes() {
        assertEquals("image/jpeg", mediaTransferService.sniff(bytes(0xFF, 0xD8, 0xFF, 0xE0, 0, 0x10)));
        assertEquals("application/octet-stream", mediaTransferService.sniff(bytes("RIFF", 0, 0)));
        assertEquals("application/octet-stream", mediaTransferService.sniff(new byte[0]));
    }

    @Test
    @DisplayName("wav aliases should classify as audio")
    void testMediaKind_WavAliases() {
        assertEquals(MediaKind.AUDIO, MediaKind.fromMimeType("audio/x-wav"));
        assertEquals(MediaKind.AUDIO, MediaKind.fromMimeType("audio/wave"));
    }

    private void assertSniffed(String expectedMime, MediaKind expectedKind, byte[] data) {
        String mime = mediaTransferService.effectiveMimeType("application/octet-stream", data);
        assertEquals(expectedMime, mime);
        assertEquals(expectedKind, MediaKind.fromMimeType(mime));
    }

    private static byte[] bytes(Object... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Object part : parts) {
            if (part instanceof String) {
                byte[] ascii = ((String) part).getBytes(StandardCharsets.ISO_8859_1);
                out.write(ascii, 0, ascii.length);
            } else {
                out.write((Integer) part);
            }
        }
        return out.toByteArray();
    }
}
