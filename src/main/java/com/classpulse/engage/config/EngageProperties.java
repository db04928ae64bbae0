package com.classpulse.engage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "classpulse")
public record EngageProperties(@DefaultValue("http://localhost:5173") @NotBlank String publicAppUrl,
                               @DefaultValue @Valid Session session,
                               @DefaultValue @Valid Recommendation recommendation) {

    public record Session(@DefaultValue("How are you feeling today?") @NotBlank String defaultMoodPrompt,
                          @DefaultValue("16") @Min(8) @Max(64) int joinTokenLength) {}

    /**
     * @param systemDefaultActivityId activity returned when a course has no activities at all;
     *                                blank disables that last tier
     */
    public record Recommendation(String systemDefaultActivityId) {

        public boolean hasSystemDefault() {
            return systemDefaultActivityId != null && !systemDefaultActivityId.isBlank();
        }
    }
}
