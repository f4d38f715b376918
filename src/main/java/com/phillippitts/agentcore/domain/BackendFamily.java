package com.phillippitts.agentcore.domain;

/** Capability families that have their own backend registry. */
public enum BackendFamily {
    TRANSCRIPTION("transcription"),
    SYNTHESIS("synthesis");

    private final String key;

    BackendFamily(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a family from its path/property key (case-insensitive).
     *
     * @throws IllegalArgumentException if the key is unknown
     */
    public static BackendFamily fromKey(String key) {
        for (BackendFamily family : values()) {
            if (family.key.equalsIgnoreCase(key)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown backend family: " + key);
    }
}
