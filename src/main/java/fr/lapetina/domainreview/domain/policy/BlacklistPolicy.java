package fr.lapetina.domainreview.domain.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static denylist of category labels that make a domain unusable.
 *
 * Matching is case-insensitive on the whole label. Sources spell the same category
 * differently ("Phishing", "PHISHING"), so entries are stored lowercase.
 */
public final class BlacklistPolicy {

    public static final List<String> DEFAULT_DENYLIST = List.of(
            "phishing",
            "web ads/analytics",
            "suspicious",
            "shopping",
            "placeholders",
            "pornography",
            "spam",
            "gambling",
            "scam/questionable/illegal",
            "malicious sources/malnets"
    );

    private final Set<String> denylist;

    public BlacklistPolicy(Collection<String> denylist) {
        this.denylist = denylist.stream()
                .map(BlacklistPolicy::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public BlacklistPolicy() {
        this(DEFAULT_DENYLIST);
    }

    public boolean matches(String category) {
        return category != null && denylist.contains(normalize(category));
    }

    /**
     * Returns the categories that match the denylist, capitalized for display and
     * deduplicated, in input order.
     */
    public List<String> badCategories(Collection<String> categories) {
        Set<String> bad = new LinkedHashSet<>();
        for (String category : categories) {
            if (matches(category)) {
                bad.add(capitalize(category));
            }
        }
        return new ArrayList<>(bad);
    }

    public Set<String> getDenylist() {
        return denylist;
    }

    /**
     * Upper-cases the first character and lower-cases the rest: {@code "SPAM" -> "Spam"}.
     */
    static String capitalize(String category) {
        String trimmed = category.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return trimmed.substring(0, 1).toUpperCase(Locale.ROOT)
                + trimmed.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }
}
