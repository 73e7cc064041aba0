package de.mirkosertic.aznlp.morph;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One suffix of the grammar: all its allomorphs plus the morphotactic transition it performs.
 *
 * <p>Surfaces are kept sorted by descending code point length so the walker always tries the
 * longest allomorph first. Code points and first vowels are precomputed once because the walker
 * compares them for every position of every word.</p>
 */
public final class SuffixRule {

    private final List<String> surfaces;
    private final int[][] surfaceCodePoints;
    private final int[] surfaceFirstVowels;
    private final MorphTag tag;
    private final List<FsmState> fromStates;
    private final FsmState toState;
    private final HarmonyKind harmony;
    private final boolean dtAlternating;
    private final int minSurfaceLength;

    SuffixRule(final MorphTag tag, final HarmonyKind harmony, final List<FsmState> fromStates,
               final FsmState toState, final List<String> surfaces) {
        if (surfaces.isEmpty()) {
            throw new IllegalArgumentException("Rule " + tag + " has no surfaces");
        }
        this.tag = Objects.requireNonNull(tag);
        this.harmony = Objects.requireNonNull(harmony);
        this.fromStates = List.copyOf(fromStates);
        this.toState = Objects.requireNonNull(toState);
        // Stable sort: allomorphs of equal length keep their declaration order
        this.surfaces = surfaces.stream()
                .sorted(Comparator.comparingInt((String s) -> s.codePointCount(0, s.length())).reversed())
                .toList();
        this.surfaceCodePoints = this.surfaces.stream()
                .map(s -> s.codePoints().toArray())
                .toArray(int[][]::new);
        this.surfaceFirstVowels = this.surfaces.stream()
                .mapToInt(Phonology::firstVowel)
                .toArray();
        this.dtAlternating = startsWithAny(this.surfaceCodePoints, 'd') && startsWithAny(this.surfaceCodePoints, 't');
        this.minSurfaceLength = surfaceCodePoints[surfaceCodePoints.length - 1].length;
    }

    private static boolean startsWithAny(final int[][] codePoints, final int first) {
        return Arrays.stream(codePoints).anyMatch(cps -> cps.length > 0 && cps[0] == first);
    }

    public List<String> surfaces() {
        return surfaces;
    }

    public MorphTag tag() {
        return tag;
    }

    public List<FsmState> fromStates() {
        return fromStates;
    }

    public FsmState toState() {
        return toState;
    }

    public HarmonyKind harmony() {
        return harmony;
    }

    /**
     * True if the rule has both d-initial and t-initial allomorphs, i.e. its first consonant
     * assimilates to the voicing of the stem.
     */
    public boolean isDtAlternating() {
        return dtAlternating;
    }

    public int minSurfaceLength() {
        return minSurfaceLength;
    }

    int surfaceCount() {
        return surfaceCodePoints.length;
    }

    int[] surfaceCodePoints(final int index) {
        return surfaceCodePoints[index];
    }

    int surfaceFirstVowel(final int index) {
        return surfaceFirstVowels[index];
    }

    @Override
    public String toString() {
        return "SuffixRule[" + tag + " " + fromStates + " -> " + toState + " " + surfaces + "]";
    }
}
