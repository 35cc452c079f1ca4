package fr.lapetina.domainreview.domain.policy;

import fr.lapetina.domainreview.domain.model.SourceQueryResult;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the aggregated category set of a domain.
 *
 * The union is deduplicated case-insensitively and keeps the spelling of the first
 * occurrence, walking sources in query order. Only successful lookups contribute.
 */
public final class CategoryNormalizer {

    public Set<String> aggregate(Collection<SourceQueryResult> results) {
        Map<String, String> firstSpelling = new LinkedHashMap<>();
        for (SourceQueryResult result : results) {
            for (String category : result.contributedCategories()) {
                if (category == null || category.isBlank()) {
                    continue;
                }
                String trimmed = category.trim();
                firstSpelling.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(firstSpelling.values()));
    }
}
