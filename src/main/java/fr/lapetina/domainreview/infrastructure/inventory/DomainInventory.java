package fr.lapetina.domainreview.infrastructure.inventory;

import fr.lapetina.domainreview.domain.model.Domain;

import java.util.List;

/**
 * Source of the domains to review, in review order.
 * The engine never writes back; callers persist the returned reports.
 */
@FunctionalInterface
public interface DomainInventory {

    List<Domain> domains();
}
