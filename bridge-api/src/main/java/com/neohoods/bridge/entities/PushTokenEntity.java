package com.neohoods.bridge.entities;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "push_tokens")
public class PushTokenEntity {

    @Id
    private UUID id;

    @Column(name = "selector", nullable = false, unique = true)
    private String selector;

    @JsonProperty("token_msgs")
    @Column(name = "token_msgs", columnDefinition = "text")
    private String tokenMsgs;

    @JsonProperty("appid_msgs")
    @Column(name = "appid_msgs")
    private String appIdMsgs;

    @JsonProperty("token_calls")
    @Column(name = "token_calls", columnDefinition = "text")
    private String tokenCalls;

    @JsonProperty("appid_calls")
    @Column(name = "appid_calls")
    private String appIdCalls;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @JsonProperty("updated_at")
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
