package de.mirkosertic.aznlp;

import de.mirkosertic.aznlp.config.MorphologyConfig;
import de.mirkosertic.aznlp.morph.Analysis;
import de.mirkosertic.aznlp.morph.LemmaSetDictionary;
import de.mirkosertic.aznlp.morph.MorphTag;
import de.mirkosertic.aznlp.morph.Morpheme;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AzerbaijaniMorphology")
class AzerbaijaniMorphologyTest {

    @Test
    @DisplayName("Defaults load the bundled lexicon and cache stems")
    void defaultsWithCache() {
        final AzerbaijaniMorphology morphology = AzerbaijaniMorphology.create(MorphologyConfig.defaults());

        assertThat(morphology.stem("kitablarımızdan")).isEqualTo("kitab");
        assertThat(morphology.stem("kitablarımızdan")).isEqualTo("kitab");
        assertThat(morphology.stem("ürəyi")).isEqualTo("ürək");
        assertThat(morphology.stems(List.of("evlərdə", "gözlər"))).containsExactly("ev", "göz");

        assertThat(morphology.getCacheStats()).hasValueSatisfying(stats -> {
            assertThat(stats.cache().hitCount()).isEqualTo(1);
            assertThat(stats.cache().missCount()).isEqualTo(4);
            assertThat(stats.reducedWords()).isEqualTo(4);
        });
    }

    @Test
    @DisplayName("Analyses are exposed best first")
    void analyze() {
        final AzerbaijaniMorphology morphology = AzerbaijaniMorphology.create(MorphologyConfig.defaults());

        final List<Analysis> analyses = morphology.analyze("kitablar");

        assertThat(analyses.get(0)).isEqualTo(new Analysis("kitab", List.of(new Morpheme("lar", MorphTag.PLURAL))));
        assertThat(analyses).contains(Analysis.bare("kitablar"));
    }

    @Test
    @DisplayName("An explicit dictionary gives an uncached instance")
    void withDictionary() {
        final AzerbaijaniMorphology morphology =
                AzerbaijaniMorphology.withDictionary(LemmaSetDictionary.of(List.of("kitab")));

        assertThat(morphology.stem("kitablar")).isEqualTo("kitab");
        assertThat(morphology.getCacheStats()).isEmpty();
    }

    @Test
    @DisplayName("The Lucene analyzer shares the instance's stemmer")
    void newAnalyzer() throws IOException {
        final AzerbaijaniMorphology morphology = AzerbaijaniMorphology.create(MorphologyConfig.defaults());

        final List<String> tokens = new ArrayList<>();
        try (final Analyzer analyzer = morphology.newAnalyzer();
             final TokenStream stream = analyzer.tokenStream("content", "Kitablarımızdan")) {
            final CharTermAttribute termAttr = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            stream.end();
        }

        assertThat(tokens).containsExactly("kitab");
    }
}
