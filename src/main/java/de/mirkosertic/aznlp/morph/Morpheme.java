package de.mirkosertic.aznlp.morph;

import java.util.Objects;

/**
 * A stripped suffix: its surface text in the casing of the analyzed word and its tag.
 */
public record Morpheme(String surface, MorphTag tag) {

    public Morpheme {
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(tag, "tag");
    }
}
