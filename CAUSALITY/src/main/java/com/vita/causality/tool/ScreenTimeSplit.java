package com.vita.causality.tool;

import com.vita.causality.domain.model.BehavioralEvent;
import com.vita.causality.domain.model.GlucoseReading;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Passive screen minutes split by causal direction. An episode starting within 30 minutes
 * after a glucose crash is reactive (an effect of the crash); every other episode is genuine.
 */
public record ScreenTimeSplit(double genuineMinutes, double reactiveMinutes) {

    static final Duration REACTIVE_WINDOW = Duration.ofMinutes(30);

    public static ScreenTimeSplit of(List<BehavioralEvent> behaviors, List<GlucoseReading> glucose) {
        List<Instant> crashTimes = glucose.stream()
                .filter(GlucoseReading::isCrash)
                .map(GlucoseReading::getTimestamp)
                .toList();

        double genuine = 0.0;
        double reactive = 0.0;
        for (BehavioralEvent event : behaviors) {
            if (!event.isPassive()) {
                continue;
            }
            if (isReactive(event, crashTimes)) {
                reactive += event.minutes();
            } else {
                genuine += event.minutes();
            }
        }
        return new ScreenTimeSplit(genuine, reactive);
    }

    static boolean isReactive(BehavioralEvent event, List<Instant> crashTimes) {
        return crashTimes.stream().anyMatch(crash -> {
            Duration delta = Duration.between(crash, event.getTimestamp());
            return !delta.isNegative() && !delta.isZero() && delta.compareTo(REACTIVE_WINDOW) < 0;
        });
    }

    public double totalMinutes() {
        return genuineMinutes + reactiveMinutes;
    }

    public boolean mostlyReactive() {
        return reactiveMinutes > genuineMinutes;
    }
}
