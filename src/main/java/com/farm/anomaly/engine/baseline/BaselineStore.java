package com.farm.anomaly.engine.baseline;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.model.BaselineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory rolling baselines keyed by (device, parameter).
 *
 * Each key keeps at most {@code detection.window-size} values, evicting the
 * oldest first, plus the last recorded value. Every key has its own lock:
 * {@link #withLock} serializes the read-evaluate-record sequence for one key
 * while different keys proceed in parallel. Locks live in their own map and
 * outlive {@link #clear}, which takes each key's lock before dropping its
 * baseline.
 *
 * A device tracks at most {@code detection.max-parameters-per-device}
 * distinct parameters; {@link #admit} refuses new ones beyond that.
 */
@Component
public class BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

    private final int windowSize;
    private final int maxParametersPerDevice;
    private final ConcurrentMap<BaselineKey, ParameterBaseline> baselines = new ConcurrentHashMap<>();
    private final ConcurrentMap<BaselineKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> parametersByDevice = new ConcurrentHashMap<>();

    public BaselineStore(DetectionConfig config) {
        if (config.getWindowSize() < 1) {
            throw new IllegalArgumentException("detection.window-size must be >= 1, got " + config.getWindowSize());
        }
        if (config.getMaxParametersPerDevice() < 1) {
            throw new IllegalArgumentException("detection.max-parameters-per-device must be >= 1, got "
                    + config.getMaxParametersPerDevice());
        }
        this.windowSize = config.getWindowSize();
        this.maxParametersPerDevice = config.getMaxParametersPerDevice();
        log.info("Baseline store initialized with window size {} and at most {} parameters per device",
                windowSize, maxParametersPerDevice);
    }

    /**
     * Reserve a slot for the parameter on the device. True when the parameter is
     * already tracked or the device is under its parameter cap.
     */
    public boolean admit(String deviceId, String parameter) {
        boolean[] admitted = new boolean[1];
        parametersByDevice.compute(deviceId, (id, params) -> {
            Set<String> tracked = params == null ? new HashSet<>() : params;
            if (tracked.contains(parameter) || tracked.size() < maxParametersPerDevice) {
                tracked.add(parameter);
                admitted[0] = true;
            }
            return tracked;
        });
        if (!admitted[0]) {
            log.warn("Device={} already tracks {} parameters; ignoring new parameter '{}'",
                    deviceId, maxParametersPerDevice, parameter);
        }
        return admitted[0];
    }

    /**
     * Append a value to the key's window, evicting the oldest beyond capacity,
     * and make it the key's previous value. Creates the key on first use.
     */
    public void record(String deviceId, String parameter, double value) {
        baselines.computeIfAbsent(new BaselineKey(deviceId, parameter), key -> new ParameterBaseline(windowSize))
                .record(value);
    }

    /**
     * Copy of the key's window, oldest first. Empty for unknown keys.
     */
    public List<Double> window(String deviceId, String parameter) {
        ParameterBaseline baseline = baselines.get(new BaselineKey(deviceId, parameter));
        return baseline == null ? List.of() : baseline.window();
    }

    /**
     * Last recorded value for the key, if any.
     */
    public Optional<Double> previous(String deviceId, String parameter) {
        ParameterBaseline baseline = baselines.get(new BaselineKey(deviceId, parameter));
        return baseline == null ? Optional.empty() : Optional.ofNullable(baseline.previous());
    }

    /**
     * Run an action while holding the key's exclusive lock. Calls to
     * {@link #window}, {@link #previous} and {@link #record} for the same key
     * from inside the action see a consistent state. The action must not
     * block on I/O.
     */
    public <T> T withLock(String deviceId, String parameter, Supplier<T> action) {
        ReentrantLock lock = lockFor(new BaselineKey(deviceId, parameter));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Set<String> deviceIds() {
        Set<String> ids = new TreeSet<>();
        for (BaselineKey key : baselines.keySet()) {
            ids.add(key.getDeviceId());
        }
        return ids;
    }

    /**
     * Windows and previous values of every parameter tracked for a device,
     * keyed and sorted by parameter name.
     */
    public Map<String, BaselineSnapshot> snapshot(String deviceId) {
        Map<String, BaselineSnapshot> result = new TreeMap<>();
        baselines.forEach((key, baseline) -> {
            if (key.getDeviceId().equals(deviceId)) {
                result.put(key.getParameter(), BaselineSnapshot.builder()
                        .parameter(key.getParameter())
                        .window(baseline.window())
                        .previous(baseline.previous())
                        .build());
            }
        });
        return result;
    }

    /**
     * Drop every baseline of a device and free its parameter slots. Waits for
     * any in-flight {@link #withLock} on each key. Returns the number of
     * parameters removed.
     */
    public int clear(String deviceId) {
        int removed = 0;
        for (BaselineKey key : baselines.keySet()) {
            if (!key.getDeviceId().equals(deviceId)) {
                continue;
            }
            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                if (baselines.remove(key) != null) {
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }
        parametersByDevice.remove(deviceId);
        if (removed > 0) {
            log.info("Cleared {} baselines for device={}", removed, deviceId);
        }
        return removed;
    }

    public int size() {
        return baselines.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getMaxParametersPerDevice() {
        return maxParametersPerDevice;
    }

    private ReentrantLock lockFor(BaselineKey key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }
}
