package de.mirkosertic.aznlp;

import de.mirkosertic.aznlp.config.MorphologyConfig;
import de.mirkosertic.aznlp.morph.Analysis;
import de.mirkosertic.aznlp.morph.AzerbaijaniStemmer;
import de.mirkosertic.aznlp.morph.LemmaSetDictionary;
import de.mirkosertic.aznlp.morph.MorphologicalAnalyzer;
import de.mirkosertic.aznlp.morph.StemDictionary;
import de.mirkosertic.aznlp.morph.Stemmer;
import de.mirkosertic.aznlp.morph.VowelDropRestorer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the library: wires dictionary, analyzer, stemmer and cache.
 *
 * <pre>{@code
 * AzerbaijaniMorphology morphology = AzerbaijaniMorphology.create();
 * morphology.stem("kitablarımızdan");     // "kitab"
 * morphology.analyze("kitablarımızdan");  // [kitab[Plural:lar|Poss1Pl:ımız|CaseAbl:dan], ...]
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class AzerbaijaniMorphology implements Stemmer {

    private static final Logger logger = LoggerFactory.getLogger(AzerbaijaniMorphology.class);

    private final MorphologicalAnalyzer analyzer;
    private final Stemmer stemmer;
    private final @Nullable CachingStemmer cache;
    private final boolean foldDiacritics;

    private AzerbaijaniMorphology(final MorphologicalAnalyzer analyzer, final Stemmer stemmer,
                                  final @Nullable CachingStemmer cache, final boolean foldDiacritics) {
        this.analyzer = analyzer;
        this.stemmer = stemmer;
        this.cache = cache;
        this.foldDiacritics = foldDiacritics;
    }

    /**
     * Creates an instance from {@link MorphologyConfig#load()}.
     */
    public static AzerbaijaniMorphology create() {
        return create(MorphologyConfig.load());
    }

    public static AzerbaijaniMorphology create(final MorphologyConfig config) {
        Objects.requireNonNull(config, "config");
        final LemmaSetDictionary dictionary = loadDictionary(config);
        final MorphologicalAnalyzer analyzer = new MorphologicalAnalyzer(dictionary);
        final Stemmer stemmer = new AzerbaijaniStemmer(analyzer, new VowelDropRestorer(dictionary));

        if (!config.isCacheEnabled()) {
            logger.info("Stem cache disabled");
            return new AzerbaijaniMorphology(analyzer, stemmer, null, config.isFoldDiacritics());
        }
        final CachingStemmer cache = new CachingStemmer(stemmer, config.getCacheMaxSize());
        logger.info("Stem cache enabled with max size {}", config.getCacheMaxSize());
        return new AzerbaijaniMorphology(analyzer, cache, cache, config.isFoldDiacritics());
    }

    /**
     * Creates an uncached instance over an explicit dictionary.
     */
    public static AzerbaijaniMorphology withDictionary(final StemDictionary dictionary) {
        final MorphologicalAnalyzer analyzer = new MorphologicalAnalyzer(dictionary);
        return new AzerbaijaniMorphology(analyzer,
                new AzerbaijaniStemmer(analyzer, new VowelDropRestorer(dictionary)), null, false);
    }

    private static LemmaSetDictionary loadDictionary(final MorphologyConfig config) {
        final long start = System.currentTimeMillis();
        final String path = config.getDictionaryPath();
        final LemmaSetDictionary dictionary = path != null
                ? LemmaSetDictionary.fromFile(Paths.get(path))
                : LemmaSetDictionary.fromResource(config.getDictionaryResource());
        logger.info("Loaded {} stems from {} in {} ms", dictionary.size(),
                path != null ? path : config.getDictionaryResource(), System.currentTimeMillis() - start);
        return dictionary;
    }

    /**
     * All analyses of {@code word}, best first.
     */
    public List<Analysis> analyze(final String word) {
        return analyzer.analyze(word);
    }

    @Override
    public String stem(final String word) {
        return stemmer.stem(word);
    }

    /**
     * A new Lucene analyzer stemming with this instance.
     */
    public AzerbaijaniStemmingAnalyzer newAnalyzer() {
        return new AzerbaijaniStemmingAnalyzer(stemmer, foldDiacritics);
    }

    /**
     * A snapshot of the stem cache statistics, empty if caching is disabled.
     */
    public Optional<StemCacheStats> getCacheStats() {
        return Optional.ofNullable(cache).map(CachingStemmer::getStats);
    }
}
