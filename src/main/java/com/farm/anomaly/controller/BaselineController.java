package com.farm.anomaly.controller;

import com.farm.anomaly.engine.baseline.BaselineStore;
import com.farm.anomaly.model.BaselineSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/baselines")
@Tag(name = "Baselines", description = "Inspect and reset the in-memory rolling baselines")
public class BaselineController {

    private final BaselineStore baselineStore;

    public BaselineController(BaselineStore baselineStore) {
        this.baselineStore = baselineStore;
    }

    @Operation(summary = "List devices with baselines")
    @GetMapping
    public ResponseEntity<Map<String, Object>> listDevices() {
        return ResponseEntity.ok(Map.of(
                "deviceIds", baselineStore.deviceIds(),
                "trackedKeys", baselineStore.size(),
                "windowSize", baselineStore.getWindowSize()
        ));
    }

    @Operation(summary = "Get a device's baselines",
            description = "Returns the window (oldest first) and previous value of every parameter tracked for the device.")
    @GetMapping("/{deviceId}")
    public ResponseEntity<Map<String, BaselineSnapshot>> getDeviceBaselines(
            @Parameter(description = "Device ID", example = "device_germany")
            @PathVariable String deviceId) {
        Map<String, BaselineSnapshot> snapshot = baselineStore.snapshot(deviceId);
        if (snapshot.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(snapshot);
    }

    @Operation(summary = "Reset a device's baselines",
            description = "Drops every window and previous value for the device. Detection starts from an empty history.")
    @DeleteMapping("/{deviceId}")
    public ResponseEntity<Map<String, Object>> clearDeviceBaselines(
            @Parameter(description = "Device ID", example = "device_germany")
            @PathVariable String deviceId) {
        int removed = baselineStore.clear(deviceId);
        if (removed == 0) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of(
                "deviceId", deviceId,
                "clearedParameters", removed
        ));
    }
}
