package com.phillippitts.agentcore.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request to invoke one named delegate with a structured argument payload.
 *
 * @param delegateName name of the delegate to dispatch to
 * @param arguments structured arguments; never null, iteration order preserved
 */
public record DelegateCall(String delegateName, Map<String, Object> arguments) {

    public DelegateCall {
        Objects.requireNonNull(delegateName, "delegateName must not be null");
        if (delegateName.isBlank()) {
            throw new IllegalArgumentException("delegateName must not be blank");
        }
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static DelegateCall of(String delegateName, Map<String, Object> arguments) {
        return new DelegateCall(delegateName, arguments);
    }
}
