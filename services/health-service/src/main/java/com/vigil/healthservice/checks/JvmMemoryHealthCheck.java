package com.vigil.healthservice.checks;

import com.vigil.health.Check;
import com.vigil.health.CheckOutcome;
import com.vigil.health.HealthCheck;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.function.Supplier;

/**
 * Reports heap usage relative to the maximum heap size: YELLOW from {@link #DEFAULT_YELLOW_RATIO},
 * RED from {@link #DEFAULT_RED_RATIO}. GREEN when the JVM has no defined heap maximum.
 */
public final class JvmMemoryHealthCheck implements HealthCheck {

    public static final String ID = "jvm-memory";

    public static final Check CHECK = new Check(
            ID,
            "JVM heap usage",
            "heap is nearly exhausted and garbage collection slows request handling",
            "heap is exhausted and requests may fail with OutOfMemoryError");

    public static final double DEFAULT_YELLOW_RATIO = 0.85;
    public static final double DEFAULT_RED_RATIO = 0.95;

    private final Supplier<MemoryUsage> heapUsage;
    private final double yellowRatio;
    private final double redRatio;

    public JvmMemoryHealthCheck() {
        this(() -> ManagementFactory.getMemoryMXBean().getHeapMemoryUsage(), DEFAULT_YELLOW_RATIO, DEFAULT_RED_RATIO);
    }

    public JvmMemoryHealthCheck(Supplier<MemoryUsage> heapUsage, double yellowRatio, double redRatio) {
        if (heapUsage == null) {
            throw new IllegalArgumentException("heapUsage must not be null");
        }
        if (yellowRatio <= 0 || redRatio > 1 || yellowRatio > redRatio) {
            throw new IllegalArgumentException("ratios must satisfy 0 < yellowRatio <= redRatio <= 1");
        }
        this.heapUsage = heapUsage;
        this.yellowRatio = yellowRatio;
        this.redRatio = redRatio;
    }

    @Override
    public CheckOutcome check() {
        MemoryUsage heap = heapUsage.get();
        if (heap.getMax() <= 0) {
            return CheckOutcome.green();
        }
        double ratio = (double) heap.getUsed() / heap.getMax();
        if (ratio >= redRatio) {
            return CheckOutcome.red(describe(heap, ratio));
        }
        if (ratio >= yellowRatio) {
            return CheckOutcome.yellow(describe(heap, ratio));
        }
        return CheckOutcome.green();
    }

    private static String describe(MemoryUsage heap, double ratio) {
        return "heap usage %.1f%% (%d of %d bytes)".formatted(ratio * 100, heap.getUsed(), heap.getMax());
    }
}
