package com.neohoods.bridge.services.messages;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.neohoods.bridge.exceptions.MediaTransferException;
import com.neohoods.bridge.model.content.MediaKind;

import lombok.extern.slf4j.Slf4j;

/**
 * Fetches attachment bytes from softphone URLs and works out their real content type.
 */
@Service
@Slf4j
public class MediaTransferService {

    private static final List<Signature> SIGNATURES = List.of(
            new Signature(new int[] { 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A }, "image/png"),
            new Signature(new int[] { 0xFF, 0xD8, 0xFF }, "image/jpeg"),
            new Signature("GIF87a", "image/gif"),
            new Signature("GIF89a", "image/gif"),
            new Signature("BM", "image/bmp"),
            new Signature(new int[] { 0x1A, 0x45, 0xDF, 0xA3 }, "video/webm"),
            new Signature("ID3", "audio/mpeg"),
            new Signature("OggS", "audio/ogg"),
            new Signature("fLaC", "audio/flac"),
            new Signature("%PDF-", "application/pdf"));

    private final RestTemplate restTemplate;

    @Value("${neohoods.bridge.media.max-download-bytes:104857600}")
    private long maxDownloadBytes;

    public MediaTransferService(@Qualifier("mediaRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Downloads {@code url}, refusing anything larger than the configured ceiling.
     */
    public byte[] download(String url) {
        if (!StringUtils.hasText(url)) {
            throw new MediaTransferException("attachment has no content URL");
        }
        try {
            byte[] data = restTemplate.execute(URI.create(url.trim()), HttpMethod.GET, null,
                    response -> readBounded(response.getBody()));
            if (data == null || data.length == 0) {
                throw new MediaTransferException("empty response from " + url);
            }
            log.debug("Downloaded {} bytes from {}", data.length, url);
            return data;
        } catch (RestClientException | IllegalArgumentException e) {
            throw new MediaTransferException("failed to download " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Picks the MIME type to publish: the sniffed one wins when it is an image, or when the declared type is missing
     * or generic.
     */
    public String effectiveMimeType(String declared, byte[] data) {
        String detected = sniff(data);
        String declaredType = MediaKind.normalizeMimeType(declared);
        if (detected.startsWith("image/")
                || declaredType.isEmpty()
                || MediaType.APPLICATION_OCTET_STREAM_VALUE.equals(declaredType)) {
            return detected;
        }
        return declared;
    }

    /**
     * Identifies the payload from its leading bytes; unknown content is {@code application/octet-stream}.
     */
    String sniff(byte[] data) {
        if (data == null) {
            return MediaType.APPLICATION_OCTET_STREAM_VALUE;
        }
        if (startsWith(data, 0, "RIFF") && data.length >= 12) {
            if (startsWith(data, 8, "WEBP")) {
                return "image/webp";
            }
            if (startsWith(data, 8, "WAVE")) {
                return "audio/wav";
            }
            if (startsWith(data, 8, "AVI ")) {
                return "video/x-msvideo";
            }
        }
        if (startsWith(data, 4, "ftyp")) {
            return startsWith(data, 8, "qt  ") ? "video/quicktime" : "video/mp4";
        }
        for (Signature signature : SIGNATURES) {
            if (startsWith(data, 0, signature.magic)) {
                return signature.mimeType;
            }
        }
        // bare MPEG audio frame sync
        if (data.length >= 2 && (data[0] & 0xFF) == 0xFF && (data[1] & 0xE6) == 0xE2) {
            return "audio/mpeg";
        }
        return MediaType.APPLICATION_OCTET_STREAM_VALUE;
    }

    private static boolean startsWith(byte[] data, int offset, String ascii) {
        return startsWith(data, offset, ascii.getBytes(StandardCharsets.ISO_8859_1));
    }

    private static boolean startsWith(byte[] data, int offset, byte[] magic) {
        if (data.length < offset + magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (data[offset + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    private static final class Signature {
        private final byte[] magic;
        private final String mimeType;

        private Signature(int[] magic, String mimeType) {
            this.magic = new byte[magic.length];
            for (int i = 0; i < magic.length; i++) {
                this.magic[i] = (byte) magic[i];
            }
            this.mimeType = mimeType;
        }

        private Signature(String magic, String mimeType) {
            this.magic = magic.getBytes(StandardCharsets.ISO_8859_1);
            this.mimeType = mimeType;
        }
    }

    private byte[] readBounded(InputStream body) throws IOException {
        if (body == null) {
            return new byte[0];
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            total += read;
            if (total > maxDownloadBytes) {
                throw new MediaTransferException(
                        "file too large: exceeds limit of " + maxDownloadBytes + " bytes");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
}
