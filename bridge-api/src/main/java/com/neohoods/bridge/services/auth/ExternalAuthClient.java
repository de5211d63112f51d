package com.neohoods.bridge.services.auth;

/**
 * Validates softphone credentials against the PBX and returns the mappings the caller is allowed to know about.
 */
public interface ExternalAuthClient {

    /**
     * @param username   extension or user name, optionally suffixed with {@code @domain}
     * @param password   the softphone secret
     * @param serverName Matrix server name used to build the returned user ids
     * @throws com.neohoods.bridge.exceptions.CodedErrorException {@code EXTERNAL_AUTH_ERROR} when the service cannot
     *                                                            be reached
     */
    AuthValidation validate(String username, String password, String serverName);
}
