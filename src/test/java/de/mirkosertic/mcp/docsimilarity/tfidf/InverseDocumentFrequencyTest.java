package de.mirkosertic.mcp.docsimilarity.tfidf;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InverseDocumentFrequencyTest {

    private static SortedMap<String, Double> tf(final String text) {
        return TermFrequencyCalculator.compute(TermTokenizer.tokenize(text));
    }

    @Test
    void shouldUseSmoothedFormula() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.of(tf("a b"), tf("a")));

        // N = 2: df(a) = 2, df(b) = 1
        assertThat(idf.weight("a")).isCloseTo(Math.log(3.0 / 3.0) + 1.0, within(1e-12));
        assertThat(idf.weight("b")).isCloseTo(Math.log(3.0 / 2.0) + 1.0, within(1e-12));
        assertThat(idf.corpusSize()).isEqualTo(2);
        assertThat(idf.termCount()).isEqualTo(2);
    }

    @Test
    void shouldProduceStrictlyPositiveWeights() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.of(
                tf("common rare"), tf("common"), tf("common other"), tf("common")));

        assertThat(idf.asMap().values()).allSatisfy(weight -> assertThat(weight).isGreaterThan(0.0));
    }

    @Test
    void shouldWeightRarerTermsHigher() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.of(
                tf("common rare medium"), tf("common medium"), tf("common")));

        assertThat(idf.weight("rare")).isGreaterThanOrEqualTo(idf.weight("medium"));
        assertThat(idf.weight("medium")).isGreaterThanOrEqualTo(idf.weight("common"));
    }

    @Test
    void shouldCountTermOncePerDocument() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.of(tf("x x x x"), tf("y")));

        assertThat(idf.weight("x")).isEqualTo(idf.weight("y"));
    }

    @Test
    void shouldReturnZeroForUnknownTerm() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.of(tf("known")));

        assertThat(idf.contains("unknown")).isFalse();
        assertThat(idf.weight("unknown")).isEqualTo(0.0);
    }

    @Test
    void shouldBeEmptyForEmptyCorpus() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.<Map<String, Double>>of());

        assertThat(idf.isEmpty()).isTrue();
        assertThat(idf.corpusSize()).isZero();
    }

    @Test
    void shouldCountEmptyMembersInCorpusSize() {
        final InverseDocumentFrequency idf = InverseDocumentFrequency.compute(List.of(tf("word"), tf("")));

        assertThat(idf.corpusSize()).isEqualTo(2);
        assertThat(idf.weight("word")).isCloseTo(Math.log(3.0 / 2.0) + 1.0, within(1e-12));
    }
}
