package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * whisper.cpp transcription backend settings.
 *
 * @param enabled whether the provider is registered
 * @param binaryPath whisper.cpp CLI executable
 * @param modelPath ggml model file
 * @param modelUrl optional download source for the model when it is missing
 * @param timeoutSeconds per-clip process timeout
 * @param language ISO language code passed with {@code -l}
 * @param threads worker threads passed with {@code -t}
 * @param maxStdoutBytes cap on captured transcription output
 */
@ConfigurationProperties(prefix = "backend.whisper-cpp")
@Validated
public record WhisperCppProperties(
        @DefaultValue("true") boolean enabled,

        @NotBlank(message = "whisper.cpp binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/main") String binaryPath,

        @NotBlank(message = "whisper.cpp model path must not be blank")
        @DefaultValue("models/ggml-base.en.bin") String modelPath,

        String modelUrl,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("30") int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("en") String language,

        @Positive(message = "Thread count must be positive")
        @DefaultValue("4") int threads,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576") int maxStdoutBytes
) {
    @ConstructorBinding
    public WhisperCppProperties {
    }

    public WhisperCppProperties() {
        this(true, "tools/whisper.cpp/main", "models/ggml-base.en.bin", null, 30, "en", 4, 1_048_576);
    }
}
