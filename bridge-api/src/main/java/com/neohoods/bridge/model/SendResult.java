package com.neohoods.bridge.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class SendResult {
    private final String messageId;
    private final String roomId;
    private final DeliveryMode delivery;
}
