package com.jasmin.outbreakguard.detectors.environmental;

import com.jasmin.outbreakguard.constants.Constants;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.environmental")
public class EnvironmentalProperties {

    private boolean enabled = true;

    /**
     * Level above which a metric is a health risk (e.g. AQI 150 = "unhealthy").
     * Only metrics listed here go through the environmental path.
     */
    private Map<String, Double> healthRiskLevels = defaultLevels();

    /** Minimum deviation from the baseline mean, in percent, once above the risk level. */
    @DecimalMin("0.0") private double minDeviationPercent = 10.0;

    /** Deviation (percent) at which confidence saturates at 1.0. */
    @DecimalMin("1.0") private double saturationPercent = 30.0;

    private static Map<String, Double> defaultLevels() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(Constants.AIR_QUALITY_INDEX, 150.0);
        m.put("pm25", 35.4);
        return m;
    }
}
