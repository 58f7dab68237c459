package com.jasmin.outbreakguard.engine;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "outbreak-guard.engine")
public class EngineProperties {

    /** Worker threads used to evaluate the series of one region in parallel. */
    @Min(1) private int parallelism = 4;

    @Valid private SeverityThresholds severity = new SeverityThresholds();

    @Valid private Correlation correlation = new Correlation();

    @Data
    public static class SeverityThresholds {
        // Independent methods that must agree for high/critical by agreement
        @Min(2) private int agreeingMethods = 2;
        @DecimalMin("0.0") @DecimalMax("1.0") private double critical = 0.8;
        @DecimalMin("0.0") @DecimalMax("1.0") private double high = 0.7;
        @DecimalMin("0.0") @DecimalMax("1.0") private double medium = 0.4;
    }

    @Data
    public static class Correlation {
        private boolean enabled = true;
        /** Distinct data sources in one region needed to form a correlation group. */
        @Min(2) private int minSources = 2;
        /** Fraction of the gap to the group's maximum confidence closed for each member. */
        @DecimalMin("0.0") @DecimalMax("1.0") private double confidenceBoost = 0.5;
    }
}
