package com.phillippitts.agentcore.domain;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of an orchestration request: the user text plus optional media references and metadata.
 *
 * @param text request text (must not be null)
 * @param mediaRefs opaque references to attached media (paths, URIs); may be empty
 * @param metadata free-form string metadata (e.g. {@code source=speech}); may be empty
 */
public record RequestInput(String text, List<String> mediaRefs, Map<String, String> metadata) {

    public RequestInput {
        Objects.requireNonNull(text, "text must not be null");
        mediaRefs = mediaRefs == null ? List.of() : List.copyOf(mediaRefs);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static RequestInput of(String text) {
        return new RequestInput(text, List.of(), Map.of());
    }

    public static RequestInput of(String text, Map<String, String> metadata) {
        return new RequestInput(text, List.of(), metadata);
    }
}
