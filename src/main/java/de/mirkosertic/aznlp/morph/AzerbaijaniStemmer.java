package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the single best stem of a word from the ranked analyses of a {@link MorphologicalAnalyzer}.
 *
 * <p>Selection, in order:</p>
 * <ol>
 *   <li>Words with an internal hyphen are stemmed part by part. For a word with an
 *       apostrophe between two letters (Bakı'nın) the text before the first apostrophe is the
 *       stem.</li>
 *   <li>If the word itself is not in the dictionary: the shortest known stem whose first suffix
 *       is a negation, obligative or conditional marker (gəlmədi is gəl + mə + di, not the
 *       noun gəlmə + di), else the best ranked known stem, else a known stem reached by
 *       restoring a dropped vowel (oğlum to oğul).</li>
 *   <li>If the word is in the dictionary it is kept unless it decomposes into another known
 *       stem plus a productive suffix of at least two letters, so that ana is not cut
 *       down to an.</li>
 *   <li>Otherwise the best ranked analysis with suffixes, or the word itself.</li>
 * </ol>
 *
 * <p>Thread-safe.</p>
 */
public class AzerbaijaniStemmer implements Stemmer {

    private static final Logger logger = LoggerFactory.getLogger(AzerbaijaniStemmer.class);

    private static final Set<MorphTag> ROOT_ADJACENT_TAGS =
            EnumSet.of(MorphTag.NEGATION, MorphTag.MOOD_OBLIG, MorphTag.MOOD_COND);

    private static final int MIN_PRODUCTIVE_SURFACE = 2;

    private final MorphologicalAnalyzer analyzer;
    private final VowelDropRestorer restorer;

    public AzerbaijaniStemmer(final StemDictionary dictionary) {
        this(new MorphologicalAnalyzer(dictionary), new VowelDropRestorer(dictionary));
    }

    public AzerbaijaniStemmer(final MorphologicalAnalyzer analyzer, final VowelDropRestorer restorer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.restorer = Objects.requireNonNull(restorer, "restorer");
    }

    @Override
    public String stem(final String word) {
        Objects.requireNonNull(word, "word");
        if (word.isEmpty() || MorphologicalAnalyzer.exceedsMaxLength(word)) {
            return word;
        }

        if (hasInternalHyphen(word)) {
            return stemHyphenated(word);
        }

        final int apostrophe = indexOfApostrophe(word);
        if (apostrophe > 0 && apostrophe < word.length() - 1) {
            return word.substring(0, apostrophe);
        }

        final List<Analysis> analyses = analyzer.analyze(word);
        final boolean wordKnown = analyzer.isKnown(word);

        final Optional<String> selected = wordKnown
                ? productiveDecomposition(word, analyses)
                : knownStem(analyses).or(() -> restoredStem(analyses));
        if (selected.isPresent()) {
            return selected.get();
        }
        if (wordKnown) {
            return word;
        }

        for (final Analysis analysis : analyses) {
            if (analysis.hasMorphemes()) {
                if (logger.isDebugEnabled()) {
                    logger.debug("No known stem for '{}', falling back to {}", word, analysis);
                }
                return analysis.stem();
            }
        }
        return word;
    }

    private String stemHyphenated(final String word) {
        return Arrays.stream(word.split("-", -1))
                .map(part -> part.isEmpty() ? part : stem(part))
                .collect(Collectors.joining("-"));
    }

    private static boolean hasInternalHyphen(final String word) {
        for (int i = 1; i < word.length() - 1; i++) {
            if (word.charAt(i) == '-') {
                return true;
            }
        }
        return false;
    }

    private static int indexOfApostrophe(final String word) {
        for (int i = 0; i < word.length(); i++) {
            final char c = word.charAt(i);
            if (c == '\'' || c == '\u2019' || c == '\u02BC') {
                return i;
            }
        }
        return -1;
    }

    private Optional<String> knownStem(final List<Analysis> analyses) {
        Analysis rootAdjacent = null;
        int rootAdjacentLength = Integer.MAX_VALUE;
        Analysis firstKnown = null;

        for (final Analysis analysis : analyses) {
            if (!analysis.hasMorphemes() || !analyzer.isKnown(analysis.stem())) {
                continue;
            }
            if (firstKnown == null) {
                firstKnown = analysis;
            }
            if (ROOT_ADJACENT_TAGS.contains(analysis.innermost().tag())) {
                final int length = analysis.stem().codePointCount(0, analysis.stem().length());
                if (length < rootAdjacentLength) {
                    rootAdjacent = analysis;
                    rootAdjacentLength = length;
                }
            }
        }
        if (rootAdjacent != null) {
            return Optional.of(rootAdjacent.stem());
        }
        return Optional.ofNullable(firstKnown).map(Analysis::stem);
    }

    private Optional<String> restoredStem(final List<Analysis> analyses) {
        // Not just the first unknown stem: shortest-first ranking puts fragments like oğ ahead of oğl
        for (final Analysis analysis : analyses) {
            if (!analysis.hasMorphemes() || analyzer.isKnown(analysis.stem())) {
                continue;
            }
            final Optional<String> restored = restorer.tryRestore(analysis.stem());
            if (restored.isPresent()) {
                return Optional.of(AzerbaijaniCase.applyCase(analysis.stem(), restored.get()));
            }
        }
        return Optional.empty();
    }

    private Optional<String> productiveDecomposition(final String word, final List<Analysis> analyses) {
        final int wordLength = word.codePointCount(0, word.length());
        for (final Analysis analysis : analyses) {
            if (!analysis.hasMorphemes()) {
                continue;
            }
            final String stem = analysis.stem();
            if (stem.codePointCount(0, stem.length()) >= wordLength || stem.equals(word)
                    || !analyzer.isKnown(stem)) {
                continue;
            }
            final Morpheme first = analysis.innermost();
            if (first.tag().isProductive()
                    && first.surface().codePointCount(0, first.surface().length()) >= MIN_PRODUCTIVE_SURFACE) {
                return Optional.of(stem);
            }
        }
        return Optional.empty();
    }

    public MorphologicalAnalyzer getAnalyzer() {
        return analyzer;
    }
}
