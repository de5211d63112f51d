package com.neohoods.bridge.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One external participant: a canonical number, the Matrix user it maps to and the alternate numbers that also
 * resolve to that user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MappingEntry {
    private String number;
    @JsonProperty("matrix_id")
    private String matrixId;
    @JsonProperty("display_name")
    private String displayName;
    @JsonProperty("sub_numbers")
    @Builder.Default
    private Set<String> altNumbers = new LinkedHashSet<>();
    @JsonProperty("updated_at")
    private Instant updatedAt;

    public MappingEntry copy() {
        return toBuilder()
                .altNumbers(altNumbers == null ? new LinkedHashSet<>() : new LinkedHashSet<>(altNumbers))
                .build();
    }
}
