package fr.lapetina.domainreview.domain.policy;

import fr.lapetina.domainreview.domain.model.FailureType;
import fr.lapetina.domainreview.domain.model.SourceQueryResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryNormalizerTest {

    private final CategoryNormalizer normalizer = new CategoryNormalizer();

    @Test
    @DisplayName("should build a case-insensitive union keeping the first spelling")
    void shouldBuildCaseInsensitiveUnion() {
        Set<String> categories = normalizer.aggregate(List.of(
                SourceQueryResult.success("a", List.of("Spam", "Ads")),
                SourceQueryResult.success("b", List.of("ads", "Malware"))
        ));

        assertThat(categories).containsExactly("Spam", "Ads", "Malware");
    }

    @Test
    @DisplayName("should not count a source's categories twice")
    void shouldNotDuplicateSourceCategories() {
        SourceQueryResult result = SourceQueryResult.success("a", List.of("Business"));

        Set<String> categories = normalizer.aggregate(List.of(result, result));

        assertThat(categories).hasSize(1);
    }

    @Test
    @DisplayName("should ignore failed, unknown and uncategorized results")
    void shouldIgnoreNonSuccessResults() {
        Set<String> categories = normalizer.aggregate(List.of(
                SourceQueryResult.failed("a", FailureType.NETWORK, "refused"),
                SourceQueryResult.unknown("b"),
                SourceQueryResult.uncategorized("c"),
                SourceQueryResult.success("d", List.of(" Gambling ", ""))
        ));

        assertThat(categories).containsExactly("Gambling");
    }

    @Test
    @DisplayName("should return an empty set when nothing succeeded")
    void shouldReturnEmptySet() {
        assertThat(normalizer.aggregate(List.of())).isEmpty();
    }
}
