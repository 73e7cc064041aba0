package de.mirkosertic.aznlp.morph;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Reduces inflected words to a single base form.
 */
public interface Stemmer {

    /**
     * Returns the stem of {@code word}, or the word itself if nothing can be stripped.
     *
     * @param word the word to stem (must not be null)
     */
    String stem(String word);

    /**
     * Stems every word of {@code words}, preserving order and length.
     *
     * @return the stems, or null if {@code words} is null
     */
    default @Nullable List<String> stems(final @Nullable List<String> words) {
        if (words == null) {
            return null;
        }
        return words.stream().map(this::stem).toList();
    }
}
