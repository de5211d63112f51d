package com.neohoods.bridge.services.mapping;

import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.model.MappingEntry;
import com.neohoods.bridge.services.auth.AuthValidation;
import com.neohoods.bridge.services.auth.ExternalAuthClient;
import com.neohoods.bridge.services.matrix.MatrixIds;
import com.neohoods.bridge.services.matrix.MatrixWireClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the identifier a softphone presents into its Matrix user, learning new mappings from the external
 * credential validator when the identifier is unknown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdentityBootstrapService {

    private final IdentityMappingService identityMappingService;
    private final ExternalAuthClient externalAuthClient;
    private final MatrixWireClient matrixWireClient;

    /**
     * @throws CodedErrorException {@link CodedError#AUTHENTICATION_FAILED} when the caller cannot be resolved
     */
    public String resolveCaller(String identifier, String secret) {
        if (!StringUtils.hasText(identifier)) {
            throw new CodedErrorException(CodedError.AUTHENTICATION_FAILED);
        }
        String caller = identifier.trim();
        if (MatrixIds.isUserId(caller)) {
            log.debug("Caller {} is already a Matrix id, skipping external auth", caller);
            return caller;
        }

        Optional<String> known = identityMappingService.resolve(caller);
        if (known.isPresent()) {
            log.debug("Caller {} resolved from existing mapping to {}", caller, known.get());
            return known.get();
        }

        if (!StringUtils.hasText(secret)) {
            log.warn("Caller {} is not mapped and no password was provided", caller);
            throw new CodedErrorException(CodedError.AUTHENTICATION_FAILED, Map.of("identifier", caller));
        }
        validateAndLearn(caller, secret);

        return identityMappingService.resolve(caller).orElseThrow(() -> {
            log.warn("Caller {} authenticated but has no mapping", caller);
            return new CodedErrorException(CodedError.AUTHENTICATION_FAILED, Map.of("identifier", caller));
        });
    }

    /**
     * Validates credentials and stores every mapping the validator returns.
     *
     * @throws CodedErrorException {@link CodedError#AUTHENTICATION_FAILED} when the credentials are rejected
     */
    public void validateAndLearn(String identifier, String secret) {
        AuthValidation validation = externalAuthClient.validate(identifier, secret, matrixWireClient.serverName());
        if (!validation.isAuthenticated()) {
            log.warn("External auth rejected {}", identifier);
            throw new CodedErrorException(CodedError.AUTHENTICATION_FAILED, Map.of("identifier", identifier));
        }
        for (MappingEntry entry : validation.getEntries()) {
            identityMappingService.upsert(entry);
        }
        log.debug("External auth for {} stored {} mappings", identifier, validation.getEntries().size());
    }
}
