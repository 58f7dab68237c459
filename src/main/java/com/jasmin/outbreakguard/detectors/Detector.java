package com.jasmin.outbreakguard.detectors;

import com.jasmin.outbreakguard.models.DetectorFamily;
import com.jasmin.outbreakguard.models.DetectorVerdict;

import java.util.Optional;

public interface Detector {

    /**
     * Evaluates the current reading of one series.
     *
     * @return empty when the detector does not apply to this series or is disabled
     */
    Optional<DetectorVerdict> detect(DetectionContext ctx);

    DetectorFamily family();
}
