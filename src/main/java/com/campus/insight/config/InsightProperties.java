package com.campus.insight.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "insight")
public record InsightProperties(@Valid @DefaultValue Ml ml,
                                @Valid @DefaultValue Sentiment sentiment) {

    public record Ml(@NotBlank @DefaultValue("models") String modelDir,
                     @DefaultValue("true") boolean loadOnStartup,
                     @Min(1) @DefaultValue("100") int numTrees,
                     @Min(0) @DefaultValue("10") int regressorMaxDepth,
                     @Min(0) @DefaultValue("8") int classifierMaxDepth,
                     @DefaultValue("42") int seed,
                     @DecimalMin("0.0") @DecimalMax("0.5") @DefaultValue("0.2") double testFraction) {
    }

    public record Sentiment(@Min(0) @DefaultValue("10000") long cacheMaximumSize) {
    }
}
