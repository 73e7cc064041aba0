package de.mirkosertic.aznlp;

import com.ibm.icu.text.Normalizer2;
import de.mirkosertic.aznlp.morph.Stemmer;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.icu.ICUNormalizer2CharFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tr.TurkishLowerCaseFilter;

import java.io.Reader;
import java.util.Objects;

/**
 * Analyzer for Azerbaijani Latin text that indexes stems instead of inflected forms.
 *
 * <p>Token chain: {@code ICUNormalizer2CharFilter(NFC) -> StandardTokenizer -> TurkishLowerCaseFilter
 * -> AzerbaijaniStemFilter [-> ICUFoldingFilter]}</p>
 *
 * <p>The NFC char filter composes decomposed letters (o + U+0308) before tokenization because
 * the suffix grammar only matches precomposed ö ü ç ş ğ. {@link TurkishLowerCaseFilter} applies
 * the dotted/dotless I rules Azerbaijani shares with Turkish; a plain
 * {@code LowerCaseFilter} would turn {@code I} into {@code i} and break vowel harmony.</p>
 *
 * <p>Folding diacritics is optional and runs after stemming, since the grammar depends on
 * the distinction between a and ə, ı and i.</p>
 */
public class AzerbaijaniStemmingAnalyzer extends Analyzer {

    private final Stemmer stemmer;
    private final boolean foldDiacritics;

    public AzerbaijaniStemmingAnalyzer(final Stemmer stemmer) {
        this(stemmer, false);
    }

    /**
     * @param stemmer        the stemmer applied to every lowercased token
     * @param foldDiacritics whether to append an {@link ICUFoldingFilter} after stemming
     */
    public AzerbaijaniStemmingAnalyzer(final Stemmer stemmer, final boolean foldDiacritics) {
        this.stemmer = Objects.requireNonNull(stemmer, "stemmer");
        this.foldDiacritics = foldDiacritics;
    }

    @Override
    protected Reader initReader(final String fieldName, final Reader reader) {
        return new ICUNormalizer2CharFilter(reader, Normalizer2.getNFCInstance());
    }

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = new StandardTokenizer();
        TokenStream stream = new TurkishLowerCaseFilter(tokenizer);
        stream = new AzerbaijaniStemFilter(stream, stemmer);
        if (foldDiacritics) {
            stream = new ICUFoldingFilter(stream);
        }
        return new TokenStreamComponents(tokenizer, stream);
    }
}
