package fr.lapetina.domainreview.engine;

import java.time.Duration;
import java.util.Locale;

/**
 * Decides how long to wait before the next domain, given the time elapsed since the
 * previous domain started.
 */
@FunctionalInterface
public interface DelayPolicy {

    Duration delayFor(Duration elapsedSinceLastStart);

    /**
     * Always waits {@code delay}, however long the previous domain took.
     */
    static DelayPolicy fixed(Duration delay) {
        return elapsed -> delay;
    }

    /**
     * Waits only what remains of {@code interval} since the previous domain started.
     */
    static DelayPolicy minimumInterval(Duration interval) {
        return elapsed -> elapsed.compareTo(interval) >= 0 ? Duration.ZERO : interval.minus(elapsed);
    }

    /**
     * Resolves a configured policy name: {@code fixed} or {@code minimum-interval}.
     */
    static DelayPolicy named(String name, Duration delay) {
        String key = name == null || name.isBlank() ? "fixed" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "fixed" -> fixed(delay);
            case "minimum-interval", "minimum_interval" -> minimumInterval(delay);
            default -> throw new IllegalArgumentException("Unknown delay policy: " + name);
        };
    }
}
