package com.farm.anomaly.service;

import com.farm.anomaly.engine.soil.CropRecommender;
import com.farm.anomaly.engine.soil.SoilClassifier;
import com.farm.anomaly.model.SensorReading;
import com.farm.anomaly.model.SoilAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Soil classification and crop ranking for forwarded readings, grouped by edge region.
 *
 * A reading is assessed only when it carries all of N, P, K and ph. The region is the
 * payload's "edge_node" field, or {@value #UNKNOWN_REGION} when absent. The latest
 * assessment per device is kept in memory per region.
 */
@Service
public class RegionalSoilService {

    private static final Logger log = LoggerFactory.getLogger(RegionalSoilService.class);

    public static final String REGION_FIELD = "edge_node";
    public static final String UNKNOWN_REGION = "unknown";

    static final String NITROGEN = "N";
    static final String PHOSPHORUS = "P";
    static final String POTASSIUM = "K";
    static final String PH = "ph";

    private final SoilClassifier soilClassifier;
    private final CropRecommender cropRecommender;
    private final ConcurrentMap<String, ConcurrentMap<String, SoilAssessment>> latestByRegion = new ConcurrentHashMap<>();

    public RegionalSoilService(SoilClassifier soilClassifier, CropRecommender cropRecommender) {
        this.soilClassifier = soilClassifier;
        this.cropRecommender = cropRecommender;
    }

    /**
     * Classify the reading's soil, rank crops and remember the result for its region.
     * Empty when any of N, P, K or ph is missing.
     */
    public Optional<SoilAssessment> assess(SensorReading reading) {
        Map<String, Double> params = reading.getParameters();
        Double n = params.get(NITROGEN);
        Double p = params.get(PHOSPHORUS);
        Double k = params.get(POTASSIUM);
        Double ph = params.get(PH);
        if (n == null || p == null || k == null || ph == null) {
            log.debug("Skipping soil assessment for device={}: N, P, K and ph are not all present",
                    reading.getDeviceId());
            return Optional.empty();
        }

        String region = regionOf(reading);
        SoilAssessment assessment = SoilAssessment.builder()
                .region(region)
                .deviceId(reading.getDeviceId())
                .timestamp(reading.getTimestamp())
                .soil(soilClassifier.classify(n, p, k, ph))
                .crops(cropRecommender.recommend(n, p, k, ph))
                .build();

        latestByRegion.computeIfAbsent(region, r -> new ConcurrentHashMap<>())
                .merge(reading.getDeviceId(), assessment,
                        (existing, incoming) -> incoming.getTimestamp() >= existing.getTimestamp() ? incoming : existing);

        log.info("Soil assessment for region={}, device={}: soil={}, best crop={}",
                region, reading.getDeviceId(), assessment.getSoil(), assessment.getCrops().get(0).getCrop());
        return Optional.of(assessment);
    }

    public Set<String> regions() {
        return new TreeSet<>(latestByRegion.keySet());
    }

    /**
     * Latest assessment of every device in the region, ordered by device id.
     */
    public List<SoilAssessment> latestForRegion(String region) {
        Map<String, SoilAssessment> devices = latestByRegion.get(region);
        if (devices == null) {
            return List.of();
        }
        List<SoilAssessment> result = new ArrayList<>(devices.values());
        result.sort(Comparator.comparing(SoilAssessment::getDeviceId));
        return result;
    }

    private String regionOf(SensorReading reading) {
        Object node = reading.getPayload().get(REGION_FIELD);
        if (node instanceof String s && !s.isBlank()) {
            return s;
        }
        return UNKNOWN_REGION;
    }
}
