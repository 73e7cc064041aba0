package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable hash set of lemmas.
 *
 * <p>Text sources hold one lemma per line. Blank lines and lines starting with {@code #} are
 * ignored, entries are trimmed and lowercased.</p>
 */
public final class LemmaSetDictionary implements StemDictionary {

    private final Set<String> lemmas;

    private LemmaSetDictionary(final Set<String> lemmas) {
        this.lemmas = Set.copyOf(lemmas);
    }

    public static LemmaSetDictionary of(final Collection<String> lemmas) {
        final Set<String> normalized = new HashSet<>();
        for (final String lemma : lemmas) {
            addLine(normalized, lemma);
        }
        return new LemmaSetDictionary(normalized);
    }

    /**
     * Loads a lemma list from the classpath.
     *
     * @param resourcePath absolute resource path, e.g. {@code /az-stems.txt}
     * @throws IllegalStateException if the resource does not exist
     * @throws UncheckedIOException  if the resource cannot be read
     */
    public static LemmaSetDictionary fromResource(final String resourcePath) {
        final InputStream stream = LemmaSetDictionary.class.getResourceAsStream(resourcePath);
        if (stream == null) {
            throw new IllegalStateException("Stem dictionary not found on classpath: " + resourcePath);
        }
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return read(reader);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read stem dictionary: " + resourcePath, e);
        }
    }

    /**
     * Loads a UTF-8 lemma list from a file.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static LemmaSetDictionary fromFile(final Path path) {
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to read stem dictionary: " + path, e);
        }
    }

    private static LemmaSetDictionary read(final BufferedReader reader) throws IOException {
        final Set<String> lemmas = new HashSet<>();
        String line;
        while ((line = reader.readLine()) != null) {
            addLine(lemmas, line);
        }
        return new LemmaSetDictionary(lemmas);
    }

    private static void addLine(final Set<String> lemmas, final String line) {
        final String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return;
        }
        lemmas.add(AzerbaijaniCase.toLowerCase(AzerbaijaniCase.toNfc(trimmed)));
    }

    @Override
    public boolean isKnownStem(final String stem) {
        Objects.requireNonNull(stem, "stem");
        return !stem.isEmpty() && lemmas.contains(stem);
    }

    public int size() {
        return lemmas.size();
    }
}
