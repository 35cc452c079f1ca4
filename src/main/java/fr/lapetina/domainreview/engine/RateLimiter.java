package fr.lapetina.domainreview.engine;

import fr.lapetina.domainreview.infrastructure.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Spaces out successive domain reviews. The primary source allows about four calls a
 * minute, so one domain's sources run unthrottled and the pause happens between domains.
 *
 * Used by the single pass thread only.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final DelayPolicy policy;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastStart;

    public RateLimiter(DelayPolicy policy, Clock clock, Sleeper sleeper) {
        this.policy = policy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public RateLimiter(DelayPolicy policy) {
        this(policy, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    /**
     * Records that a domain review is starting.
     */
    public void markDomainStart() {
        lastStart = clock.instant();
    }

    /**
     * Blocks for the delay the policy asks for. Call after a domain, before the next one.
     *
     * @return the delay actually requested from the sleeper
     * @throws InterruptedException if the pass is cancelled while waiting
     */
    public Duration pace() throws InterruptedException {
        Duration elapsed = lastStart == null ? Duration.ZERO : Duration.between(lastStart, clock.instant());
        Duration delay = policy.delayFor(elapsed);
        if (delay == null || delay.isNegative() || delay.isZero()) {
            return Duration.ZERO;
        }
        log.info("Pausing before next domain: delay={}s", delay.toSeconds());
        sleeper.sleep(delay);
        return delay;
    }
}
