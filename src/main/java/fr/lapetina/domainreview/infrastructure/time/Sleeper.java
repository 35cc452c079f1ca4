package fr.lapetina.domainreview.infrastructure.time;

import java.time.Duration;

/**
 * Blocking pause, injectable so pacing and browser settle delays can be faked in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
