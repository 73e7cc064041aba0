package de.mirkosertic.aznlp;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Locale;
import java.util.Objects;

/**
 * Point-in-time view of a {@link CachingStemmer}.
 *
 * <p>Combines Caffeine's own {@link CacheStats} with what the stemmer did to the distinct words
 * it computed: a word is <em>reduced</em> if its stem differs from the word, <em>unchanged</em>
 * if the stemmer returned it as is (bare lemmas, unknown words without a parse, oversized
 * input).</p>
 *
 * @param cache          Caffeine statistics of the stem cache
 * @param size           estimated number of cached words
 * @param reducedWords   computed words whose stem is shorter than the word
 * @param unchangedWords computed words that were their own stem
 */
public record StemCacheStats(CacheStats cache, long size, long reducedWords, long unchangedWords) {

    public StemCacheStats {
        Objects.requireNonNull(cache, "cache");
    }

    /**
     * Number of distinct words the wrapped stemmer was actually called for.
     */
    public long stemmedWords() {
        return reducedWords + unchangedWords;
    }

    /**
     * Cache hit rate as a percentage (0-100), 0.0 before the first lookup.
     */
    public double hitRatePercent() {
        if (cache.requestCount() == 0) {
            return 0.0;
        }
        return cache.hitRate() * 100.0;
    }

    /**
     * Share of computed words that lost at least one suffix, as a percentage (0-100).
     */
    public double reductionPercent() {
        final long stemmed = stemmedWords();
        if (stemmed == 0) {
            return 0.0;
        }
        return reducedWords * 100.0 / stemmed;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "lookups=%d (%.1f%% hits), cached=%d, evicted=%d, stemmed=%d (%.1f%% reduced)",
                cache.requestCount(), hitRatePercent(), size, cache.evictionCount(),
                stemmedWords(), reductionPercent());
    }
}
