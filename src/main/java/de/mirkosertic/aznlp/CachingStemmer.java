package de.mirkosertic.aznlp;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.aznlp.morph.Stemmer;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizing {@link Stemmer} decorator backed by a bounded Caffeine cache.
 *
 * <p>Running text repeats the same inflected forms constantly, and the backtracking walker is
 * by far the most expensive step of stemming, so results are cached per surface form. Keys
 * are case-sensitive because stems keep the casing of the input word.</p>
 *
 * <p>Cache characteristics:</p>
 * <ul>
 *   <li>Size-bounded, Caffeine's W-TinyLFU eviction</li>
 *   <li>Thread-safe; concurrent lookups of a missing word stem it once</li>
 *   <li>Caffeine statistics recorded, exposed with reduction counts via {@link #getStats()}</li>
 * </ul>
 */
public class CachingStemmer implements Stemmer {

    public static final long DEFAULT_MAX_SIZE = 100_000;

    private final Stemmer delegate;
    private final Cache<String, String> cache;
    private final AtomicLong reducedWords = new AtomicLong(0);
    private final AtomicLong unchangedWords = new AtomicLong(0);

    public CachingStemmer(final Stemmer delegate) {
        this(delegate, DEFAULT_MAX_SIZE);
    }

    /**
     * @param delegate the stemmer to call on cache misses
     * @param maxSize  maximum number of cached words
     */
    public CachingStemmer(final Stemmer delegate, final long maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                // Run eviction on the calling thread so statistics are current when stem() returns
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    @Override
    public String stem(final String word) {
        Objects.requireNonNull(word, "word");
        return cache.get(word, this::stemUncached);
    }

    private String stemUncached(final String word) {
        final String stem = delegate.stem(word);
        if (stem.equals(word)) {
            unchangedWords.incrementAndGet();
        } else {
            reducedWords.incrementAndGet();
        }
        return stem;
    }

    /**
     * Performs pending cache maintenance, including evictions.
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    public StemCacheStats getStats() {
        return new StemCacheStats(cache.stats(), cache.estimatedSize(), reducedWords.get(), unchangedWords.get());
    }
}
