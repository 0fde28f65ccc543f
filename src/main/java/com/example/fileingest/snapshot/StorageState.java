package com.example.fileingest.snapshot;

import java.util.Map;

public record StorageState(String key, boolean exists, Map<String, String> metadata) {
    public StorageState {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
