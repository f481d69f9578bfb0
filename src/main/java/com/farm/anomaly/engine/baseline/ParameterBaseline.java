package com.farm.anomaly.engine.baseline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Window and previous value of one device parameter. Access is synchronized;
 * the read-evaluate-record sequence is serialized by {@link BaselineStore#withLock}.
 */
class ParameterBaseline {

    private final int capacity;
    private final Deque<Double> window;
    private Double previous;

    ParameterBaseline(int capacity) {
        this.capacity = capacity;
        this.window = new ArrayDeque<>(capacity + 1);
    }

    synchronized void record(double value) {
        window.addLast(value);
        while (window.size() > capacity) {
            window.removeFirst();
        }
        previous = value;
    }

    synchronized List<Double> window() {
        return new ArrayList<>(window);
    }

    synchronized Double previous() {
        return previous;
    }
}
