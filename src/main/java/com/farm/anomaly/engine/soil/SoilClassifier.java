package com.farm.anomaly.engine.soil;

import com.farm.anomaly.model.NutrientLevel;
import com.farm.anomaly.model.PhClass;
import com.farm.anomaly.model.SoilQuality;
import org.springframework.stereotype.Component;

/**
 * Classifies N, P and K into low/medium/high bands and pH into acidic/neutral/alkaline.
 */
@Component
public class SoilClassifier {

    static final double NITROGEN_LOW = 50.0;
    static final double NITROGEN_HIGH = 100.0;
    static final double PHOSPHORUS_LOW = 30.0;
    static final double PHOSPHORUS_HIGH = 60.0;
    static final double POTASSIUM_LOW = 40.0;
    static final double POTASSIUM_HIGH = 80.0;

    public SoilQuality classify(double nitrogen, double phosphorus, double potassium, double ph) {
        return SoilQuality.builder()
                .nitrogen(NutrientLevel.of(nitrogen, NITROGEN_LOW, NITROGEN_HIGH))
                .phosphorus(NutrientLevel.of(phosphorus, PHOSPHORUS_LOW, PHOSPHORUS_HIGH))
                .potassium(NutrientLevel.of(potassium, POTASSIUM_LOW, POTASSIUM_HIGH))
                .phClass(PhClass.fromPh(ph))
                .build();
    }
}
