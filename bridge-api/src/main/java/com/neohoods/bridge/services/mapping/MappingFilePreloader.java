package com.neohoods.bridge.services.mapping;

import java.io.IOException;
import java.nio.file.Path;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds the mapping table from {@code neohoods.bridge.mapping.file} at startup, when set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MappingFilePreloader {

    private final IdentityMappingService identityMappingService;

    @Value("${neohoods.bridge.mapping.file:}")
    private String mappingFile;

    @PostConstruct
    public void preload() {
        if (!StringUtils.hasText(mappingFile)) {
            log.debug("No mapping file configured, skipping preload");
            return;
        }
        try {
            identityMappingService.loadFromFile(Path.of(mappingFile.trim()));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load mappings from {}: {}", mappingFile, e.getMessage(), e);
        }
    }
}
