package fr.lapetina.domainreview.source;

/**
 * Reputation lookup for a single IP address, used on the passive DNS history.
 */
@FunctionalInterface
public interface IpReputationChecker {

    /**
     * Returns true when the address has a bad reputation. Lookup failures return false.
     *
     * @throws InterruptedException if the pass is stopped while the lookup is in flight
     */
    boolean isFlagged(String ipAddress) throws InterruptedException;
}
