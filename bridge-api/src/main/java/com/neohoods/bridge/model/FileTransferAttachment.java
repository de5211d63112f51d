package com.neohoods.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileTransferAttachment {
    @JsonProperty("content-type")
    private String contentType;
    @JsonProperty("content-url")
    private String contentUrl;
    @JsonProperty("content-size")
    private Long contentSize;
    private String filename;
    private String description;
    @JsonProperty("encryption-key")
    private String encryptionKey;
    private FileTransferPreview preview;
}
