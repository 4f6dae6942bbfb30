package com.docqa.service.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-invocation stopwatch. Not thread-safe: create one per pipeline run.
 */
public class StageTimer {

    private Long startTime;
    private Long endTime;

    private final Map<String, Long> marks = new LinkedHashMap<>();

    public static StageTimer started() {
        StageTimer timer = new StageTimer();
        timer.start();
        return timer;
    }

    public void start() {
        this.startTime = System.currentTimeMillis();
        this.endTime = null;
        this.marks.clear();
    }

    public void mark(String stage) {
        if (startTime == null) {
            start();
        }
        marks.put(stage, System.currentTimeMillis() - startTime);
    }

    public void end() {
        if (endTime == null) {
            this.endTime = System.currentTimeMillis();
        }
    }

    public double getTotalTime() {
        if (startTime == null || endTime == null) {
            return 0.0;
        }
        return (endTime - startTime) / 1000.0;
    }

    /**
     * Seconds spent in each stage, in the order the stages were marked.
     */
    public Map<String, Double> getStepDurations() {
        Map<String, Double> durations = new LinkedHashMap<>();

        long previous = 0L;
        for (Map.Entry<String, Long> entry : marks.entrySet()) {
            long cumulative = entry.getValue();
            durations.put(entry.getKey(), (cumulative - previous) / 1000.0);
            previous = cumulative;
        }

        return durations;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalTime", getTotalTime());
        result.put("stepDurations", getStepDurations());
        result.put("timestamp", Instant.now().toString());
        return result;
    }
}
