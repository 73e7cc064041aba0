package de.mirkosertic.aznlp;

import de.mirkosertic.aznlp.morph.AzerbaijaniStemmer;
import de.mirkosertic.aznlp.morph.LemmaSetDictionary;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.miscellaneous.SetKeywordMarkerFilter;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AzerbaijaniStemFilter")
class AzerbaijaniStemFilterTest {

    private final AzerbaijaniStemmer stemmer = new AzerbaijaniStemmer(
            LemmaSetDictionary.of(List.of("kitab", "ev", "gəl", "gəlmə", "ürək")));

    private static List<String> collect(final TokenStream stream) throws IOException {
        final List<String> tokens = new ArrayList<>();
        try (stream) {
            final CharTermAttribute termAttr = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            stream.end();
        }
        return tokens;
    }

    private static Tokenizer whitespace(final String text) {
        final Tokenizer tokenizer = new WhitespaceTokenizer();
        tokenizer.setReader(new StringReader(text));
        return tokenizer;
    }

    @Test
    @DisplayName("Replaces every token by its stem")
    void stemsTokens() throws IOException {
        final TokenStream stream = new AzerbaijaniStemFilter(whitespace("kitablar evlərdə ürəyi gəlmədi"), stemmer);

        assertThat(collect(stream)).containsExactly("kitab", "ev", "ürək", "gəl");
    }

    @Test
    @DisplayName("Keyword tokens pass through unchanged")
    void keywordsAreKept() throws IOException {
        final CharArraySet keywords = new CharArraySet(List.of("evlərdə"), false);
        final TokenStream stream = new AzerbaijaniStemFilter(
                new SetKeywordMarkerFilter(whitespace("kitablar evlərdə"), keywords), stemmer);

        assertThat(collect(stream)).containsExactly("kitab", "evlərdə");
    }

    @Test
    @DisplayName("Offsets still cover the inflected surface form")
    void offsetsAreUntouched() throws IOException {
        final List<int[]> offsets = new ArrayList<>();
        try (final TokenStream stream = new AzerbaijaniStemFilter(whitespace("kitablar ev"), stemmer)) {
            final OffsetAttribute offsetAttr = stream.addAttribute(OffsetAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                offsets.add(new int[]{offsetAttr.startOffset(), offsetAttr.endOffset()});
            }
            stream.end();
        }

        assertThat(offsets).hasSize(2);
        assertThat(offsets.get(0)).containsExactly(0, 8);
        assertThat(offsets.get(1)).containsExactly(9, 11);
    }
}
