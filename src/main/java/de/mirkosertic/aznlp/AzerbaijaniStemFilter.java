package de.mirkosertic.aznlp;

import de.mirkosertic.aznlp.morph.Stemmer;
import org.apache.lucene.analysis.TokenFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.KeywordAttribute;

import java.io.IOException;
import java.util.Objects;

/**
 * Token filter that replaces each token with its Azerbaijani stem.
 *
 * <p>Tokens flagged by {@link KeywordAttribute} (for example by a
 * {@code SetKeywordMarkerFilter}) pass through unchanged. Offsets and positions are not
 * touched, so highlighting still covers the full surface form.</p>
 */
public final class AzerbaijaniStemFilter extends TokenFilter {

    private final CharTermAttribute termAtt = addAttribute(CharTermAttribute.class);
    private final KeywordAttribute keywordAtt = addAttribute(KeywordAttribute.class);
    private final Stemmer stemmer;

    public AzerbaijaniStemFilter(final TokenStream input, final Stemmer stemmer) {
        super(input);
        this.stemmer = Objects.requireNonNull(stemmer, "stemmer");
    }

    @Override
    public boolean incrementToken() throws IOException {
        if (!input.incrementToken()) {
            return false;
        }
        if (keywordAtt.isKeyword()) {
            return true;
        }

        final String term = termAtt.toString();
        final String stem = stemmer.stem(term);
        if (!stem.equals(term)) {
            termAtt.setEmpty().append(stem);
        }
        return true;
    }
}
