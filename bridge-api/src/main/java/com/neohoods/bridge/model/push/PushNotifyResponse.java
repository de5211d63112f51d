package com.neohoods.bridge.model.push;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PushNotifyResponse {
    /** Pushkeys the homeserver should stop notifying. */
    private List<String> rejected = new ArrayList<>();
}
