package dev.pekelund.docflow.processor.googleai;

import java.util.List;
import java.util.Objects;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.StringUtils;

/**
 * Generation settings sent with every Gemini request. Penalties and stop sequences are not used by the
 * document classification prompt and are always reported as unset.
 */
public final class GeminiGenerationOptions implements ChatOptions {

    public static final String DEFAULT_MODEL = "gemini-1.5-flash";

    private final String model;
    private final Double temperature;
    private final Integer topK;
    private final Double topP;
    private final Integer maxOutputTokens;

    private GeminiGenerationOptions(Builder builder) {
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.topK = builder.topK;
        this.topP = builder.topP;
        this.maxOutputTokens = builder.maxOutputTokens;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Deterministic settings for structured extraction: temperature 0.1, topK 1, topP 1, 2048 output tokens.
     */
    public static GeminiGenerationOptions classificationDefaults() {
        return builder().model(DEFAULT_MODEL).temperature(0.1).topK(1).topP(1.0).maxOutputTokens(2048).build();
    }

    /**
     * Returns these options with every non-null value of {@code overrides} applied on top.
     */
    public GeminiGenerationOptions merge(GeminiGenerationOptions overrides) {
        if (overrides == null) {
            return this;
        }
        return builder()
            .model(StringUtils.hasText(overrides.model) ? overrides.model : model)
            .temperature(overrides.temperature != null ? overrides.temperature : temperature)
            .topK(overrides.topK != null ? overrides.topK : topK)
            .topP(overrides.topP != null ? overrides.topP : topP)
            .maxOutputTokens(overrides.maxOutputTokens != null ? overrides.maxOutputTokens : maxOutputTokens)
            .build();
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public Double getFrequencyPenalty() {
        return null;
    }

    @Override
    public Integer getMaxTokens() {
        return maxOutputTokens;
    }

    @Override
    public Double getPresencePenalty() {
        return null;
    }

    @Override
    public List<String> getStopSequences() {
        return List.of();
    }

    @Override
    public Double getTemperature() {
        return temperature;
    }

    @Override
    public Integer getTopK() {
        return topK;
    }

    @Override
    public Double getTopP() {
        return topP;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends ChatOptions> T copy() {
        return (T) builder().model(model).temperature(temperature).topK(topK).topP(topP)
            .maxOutputTokens(maxOutputTokens).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeminiGenerationOptions that)) {
            return false;
        }
        return Objects.equals(model, that.model)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(topK, that.topK)
            && Objects.equals(topP, that.topP)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, temperature, topK, topP, maxOutputTokens);
    }

    @Override
    public String toString() {
        return "GeminiGenerationOptions{"
            + "model='" + model + '\''
            + ", temperature=" + temperature
            + ", topK=" + topK
            + ", topP=" + topP
            + ", maxOutputTokens=" + maxOutputTokens
            + '}';
    }

    public static final class Builder implements ChatOptions.Builder {

        private String model;
        private Double temperature;
        private Integer topK;
        private Double topP;
        private Integer maxOutputTokens;

        @Override
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        @Override
        public Builder frequencyPenalty(Double frequencyPenalty) {
            return this;
        }

        @Override
        public Builder maxTokens(Integer maxTokens) {
            this.maxOutputTokens = maxTokens;
            return this;
        }

        @Override
        public Builder presencePenalty(Double presencePenalty) {
            return this;
        }

        @Override
        public Builder stopSequences(List<String> stopSequences) {
            return this;
        }

        @Override
        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        @Override
        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        @Override
        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        @Override
        public GeminiGenerationOptions build() {
            return new GeminiGenerationOptions(this);
        }
    }
}
