package com.neohoods.bridge.services.auth;

import java.util.List;

import com.neohoods.bridge.model.MappingEntry;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class AuthValidation {

    private final boolean authenticated;
    private final List<MappingEntry> entries;

    private AuthValidation(boolean authenticated, List<MappingEntry> entries) {
        this.authenticated = authenticated;
        this.entries = entries;
    }

    public static AuthValidation accepted(List<MappingEntry> entries) {
        return new AuthValidation(true, List.copyOf(entries));
    }

    public static AuthValidation rejected() {
        return new AuthValidation(false, List.of());
    }
}
