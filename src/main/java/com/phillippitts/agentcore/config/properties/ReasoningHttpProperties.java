package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * OpenAI-compatible chat completion endpoint used as the reasoning backend.
 * Works with local servers (llama.cpp, Ollama, LM Studio) as well as hosted APIs.
 */
@ConfigurationProperties(prefix = "reasoning.http")
@Validated
public class ReasoningHttpProperties {

    /** Base URL up to and excluding {@code /chat/completions}. */
    @NotBlank
    private String baseUrl = "http://localhost:11434/v1";

    @NotBlank
    private String model = "llama3.1";

    /** Sent as a bearer token when non-blank. */
    private String apiKey;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.2;

    @Positive
    private int timeoutMs = 60_000;

    /** Extra system instructions prepended to every prompt. */
    private String instructions = "You are a helpful assistant that solves tasks step by step, "
            + "calling delegates when you need information or actions.";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public String getInstructions() {
        return instructions;
    }

    public void setInstructions(String instructions) {
        this.instructions = instructions;
    }
}
