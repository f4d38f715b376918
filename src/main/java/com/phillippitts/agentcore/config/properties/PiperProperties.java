package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Piper synthesis backend settings.
 *
 * @param enabled whether the provider is registered
 * @param binaryPath piper executable
 * @param modelPath voice model ({@code .onnx}); its {@code .onnx.json} config must sit next to it
 * @param modelUrl optional download source for the model when it is missing
 * @param timeoutSeconds per-utterance process timeout
 */
@ConfigurationProperties(prefix = "backend.piper")
@Validated
public record PiperProperties(
        @DefaultValue("true") boolean enabled,

        @NotBlank(message = "Piper binary path must not be blank")
        @DefaultValue("tools/piper/piper") String binaryPath,

        @NotBlank(message = "Piper model path must not be blank")
        @DefaultValue("models/en_US-lessac-medium.onnx") String modelPath,

        String modelUrl,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("30") int timeoutSeconds
) {
    @ConstructorBinding
    public PiperProperties {
    }

    public PiperProperties() {
        this(true, "tools/piper/piper", "models/en_US-lessac-medium.onnx", null, 30);
    }
}
