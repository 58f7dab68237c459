package com.jasmin.outbreakguard.detectors.statistical;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.statistical")
public class StatisticalProperties {

    private boolean enabled = true;

    /** |z| above this fires the z-score test. */
    @DecimalMin("0.0") private double zThreshold = 2.5;

    /** |z| at which z-score confidence saturates at 1.0. */
    @DecimalMin("0.1") private double zSaturation = 5.0;

    /** Tukey fence multiplier applied to the IQR. */
    @DecimalMin("0.0") private double iqrMultiplier = 1.5;

    /** |M| above this fires the MAD-based modified z-score test. */
    @DecimalMin("0.0") private double modifiedZThreshold = 3.5;

    /** |M| at which modified z-score confidence saturates at 1.0. */
    @DecimalMin("0.1") private double modifiedZSaturation = 7.0;

    /** Floor for std, MAD and IQR to avoid division by zero. */
    @DecimalMin("0.0") private double epsilon = 1e-9;
}
