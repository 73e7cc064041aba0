package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Invariants that must hold for every analysis of every word.
 */
@DisplayName("Morphology properties")
class MorphologyPropertiesTest {

    private static final List<String> WORDS = List.of(
            "kitablar", "kitablarımızdan", "kitabçılıqda", "evlərdə", "evlərimizdə", "gözlərim",
            "ürəyi", "ürəyimizdən", "otağı", "otağımızda", "çiçəktə", "çiçəklərdir",
            "gəlmədi", "gəlməyəcəklər", "yazmışdır", "oxuyuruq", "oxuyursunuz", "gələcəksən",
            "danışırlar", "gəlsə", "getməli", "yazaraq", "oxuyan", "gözəllik", "dostluq",
            "işsiz", "duzlu", "görüşdük", "yazılır", "gəlirmi", "Bakıdan", "KİTABLARDA",
            "ÜRƏYİ", "Ağacları", "məktəblərdən", "müəllimlərimizin", "şəhərlərdə", "uşaqlıqdan");

    private static final List<String> KNOWN_WORDS = List.of(
            "kitablar", "kitablarımızdan", "kitabçılıqda", "evlərdə", "gözlər", "ürəyi", "otağı",
            "gəlmədi", "oğlum", "alnı", "burnu", "ağzı", "ana", "Kitablar");

    private final MorphologicalAnalyzer analyzer = new MorphologicalAnalyzer(AzerbaijaniStemmerTest.DICTIONARY);
    private final AzerbaijaniStemmer stemmer = new AzerbaijaniStemmer(AzerbaijaniStemmerTest.DICTIONARY);

    @Test
    @DisplayName("Stem plus surfaces spells the word, up to restored k and q")
    void reconstruction() {
        for (final String word : WORDS) {
            final String lowerWord = AzerbaijaniCase.toLowerCase(word);
            for (final Analysis analysis : analyzer.analyze(word)) {
                final String rebuilt = AzerbaijaniCase.toLowerCase(analysis.stem()
                        + analysis.morphemes().stream().map(Morpheme::surface).collect(Collectors.joining()));
                assertThat(rebuilt).as("%s -> %s", word, analysis).hasSameSizeAs(lowerWord);
                for (int i = 0; i < rebuilt.length(); i++) {
                    final char expected = lowerWord.charAt(i);
                    final char actual = rebuilt.charAt(i);
                    final boolean restored = (actual == 'k' && expected == 'y') || (actual == 'q' && expected == 'ğ');
                    assertThat(actual == expected || restored)
                            .as("%s -> %s at %d", word, analysis, i)
                            .isTrue();
                }
            }
        }
    }

    @Test
    @DisplayName("No analysis is deeper than the walker limit")
    void boundedDepth() {
        for (final String word : WORDS) {
            assertThat(analyzer.analyze(word))
                    .as(word)
                    .allMatch(analysis -> analysis.morphemes().size() <= SuffixWalker.MAX_DEPTH);
        }
    }

    @Test
    @DisplayName("Every harmonic suffix agrees with the vowel before it")
    void harmonyValidity() {
        for (final String word : WORDS) {
            for (final Analysis analysis : analyzer.analyze(word)) {
                final StringBuilder preceding = new StringBuilder(AzerbaijaniCase.toLowerCase(analysis.stem()));
                for (final Morpheme morpheme : analysis.morphemes()) {
                    final String surface = AzerbaijaniCase.toLowerCase(morpheme.surface());
                    final int stemVowel = Phonology.lastVowel(preceding);
                    final int suffixVowel = Phonology.firstVowel(surface);
                    if (stemVowel != Phonology.NO_VOWEL && suffixVowel != Phonology.NO_VOWEL) {
                        final HarmonyKind harmony = harmonyOf(morpheme.tag(), surface);
                        if (harmony == HarmonyKind.BACK_FRONT) {
                            assertThat(Phonology.matchesBackFront(stemVowel, suffixVowel))
                                    .as("%s -> %s", word, analysis).isTrue();
                        } else if (harmony == HarmonyKind.FOUR_WAY) {
                            assertThat(Phonology.matchesFourWay(stemVowel, suffixVowel))
                                    .as("%s -> %s", word, analysis).isTrue();
                        }
                    }
                    preceding.append(surface);
                }
            }
        }
    }

    @Test
    @DisplayName("Stemming a stem changes nothing")
    void idempotentStem() {
        for (final String word : KNOWN_WORDS) {
            final String stem = stemmer.stem(word);
            assertThat(stemmer.stem(stem)).as("%s -> %s", word, stem).isEqualTo(stem);
        }
    }

    @Test
    @DisplayName("Oversized words are neither analyzed nor stemmed")
    void oversizeGuard() {
        final String word = "kitab".repeat(52);
        assertThat(word.length()).isGreaterThan(MorphologicalAnalyzer.MAX_WORD_BYTES);
        assertThat(analyzer.analyze(word)).containsExactly(Analysis.bare(word));
        assertThat(stemmer.stem(word)).isEqualTo(word);
    }

    private static HarmonyKind harmonyOf(final MorphTag tag, final String surface) {
        return SuffixGrammar.getInstance().rules().stream()
                .filter(rule -> rule.tag() == tag && rule.surfaces().contains(surface))
                .map(SuffixRule::harmony)
                .findFirst()
                .orElseThrow();
    }
}
