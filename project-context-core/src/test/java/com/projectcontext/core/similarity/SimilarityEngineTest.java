package com.projectcontext.core.similarity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SimilarityEngine}.
 */
class SimilarityEngineTest {

    @ParameterizedTest
    @CsvSource({
        "api, API",
        "billing-api, billing_api",
        "billing api, Billing-API",
        "'  my__project  ', my-project"
    })
    void score_equalAfterNormalization_returnsOne(String query, String target) {
        assertThat(SimilarityEngine.score(query, target)).isEqualTo(1.0);
    }

    @Test
    void score_differentStrings_neverReachesOne() {
        assertThat(SimilarityEngine.score("billingapi", "billing-api")).isLessThan(1.0);
        assertThat(SimilarityEngine.score("orchestrator", "orchestrator-project")).isLessThanOrEqualTo(0.99);
    }

    @Test
    void score_blankOrNull_returnsZero() {
        assertThat(SimilarityEngine.score(null, "api")).isZero();
        assertThat(SimilarityEngine.score("api", "  ")).isZero();
    }

    @Test
    void score_containment_addsLengthWeightedBonus() {
        double contained = SimilarityEngine.score("ling", "billing-service");
        double baseline = SimilarityEngine.lcsRatio("ling", "billing-service");

        assertThat(contained).isGreaterThan(baseline);
        assertThat(contained).isEqualTo(baseline + 0.25 * 4 / 15, within(1e-9));
    }

    @Test
    void score_initialism_getsLargestAbbreviationBonus() {
        double initials = SimilarityEngine.score("ccp", "claude-code-project");
        double baseline = SimilarityEngine.lcsRatio("ccp", "claude-code-project");

        assertThat(initials).isEqualTo(baseline + 0.35, within(1e-9));
    }

    @Test
    void score_subsequence_getsAbbreviationBonus() {
        double abbreviated = SimilarityEngine.score("orch", "orchestrator");

        assertThat(abbreviated).isGreaterThanOrEqualTo(SimilarityEngine.lcsRatio("orch", "orchestrator") + 0.2 - 1e-9);
    }

    @Test
    void score_tokenOverlap_raisesScore() {
        double overlap = SimilarityEngine.score("payment gateway service", "gateway payment");

        assertThat(overlap).isGreaterThan(SimilarityEngine.lcsRatio("payment-gateway-service", "gateway-payment"));
    }

    @Test
    void score_unrelatedNames_staysLow() {
        assertThat(SimilarityEngine.score("dashboard", "kernel")).isLessThan(0.5);
    }

    @Test
    void score_isSymmetric() {
        List<String> names = List.of("api", "app", "billing-api", "Billing API", "ccp", "claude-code-project",
            "orch", "orchestrator", "x", "payment gateway", "gateway-payments", "a-b-c", "abc");
        for (String a : names) {
            for (String b : names) {
                assertThat(SimilarityEngine.score(a, b))
                    .as("score(%s, %s)", a, b)
                    .isEqualTo(SimilarityEngine.score(b, a));
            }
        }
    }

    @Test
    void score_randomInputs_stayInRangeAndSymmetric() {
        Random random = new Random(42);
        String alphabet = "abc-_ ";
        for (int i = 0; i < 500; i++) {
            String a = randomString(random, alphabet);
            String b = randomString(random, alphabet);
            double score = SimilarityEngine.score(a, b);
            assertThat(score).isBetween(0.0, 1.0);
            assertThat(score).isEqualTo(SimilarityEngine.score(b, a));
        }
    }

    @Test
    void normalize_collapsesSeparators() {
        assertThat(SimilarityEngine.normalize("  My__Cool -- Project ")).isEqualTo("my-cool-project");
        assertThat(SimilarityEngine.normalize(null)).isEmpty();
    }

    private static String randomString(Random random, String alphabet) {
        int length = random.nextInt(8);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < length; i++) {
            builder.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return builder.toString();
    }
}
