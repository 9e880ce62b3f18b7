package com.culture.mcp.knowledge.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom segmentation entries, e.g. product names the Chinese segmenter would
 * otherwise split apart.
 *
 * File format: one entry per line, the first whitespace-separated field is the
 * word (frequency and tag columns are tolerated and ignored), {@code #} starts a
 * comment line. Each file is read once per process and shared by every analyzer
 * that points at it.
 */
public final class UserDictionary {

    private static final Logger log = LoggerFactory.getLogger(UserDictionary.class);

    private static final UserDictionary EMPTY = new UserDictionary(Set.of());
    private static final Map<Path, UserDictionary> LOADED = new ConcurrentHashMap<>();

    private final Set<String> words;
    private final int maxWordLength;

    private UserDictionary(Set<String> words) {
        this.words = Set.copyOf(words);
        this.maxWordLength = words.stream().mapToInt(String::length).max().orElse(0);
    }

    public static UserDictionary empty() {
        return EMPTY;
    }

    public static UserDictionary of(Collection<String> entries) {
        Set<String> words = new HashSet<>();
        for (String entry : entries) {
            String word = normalize(entry);
            if (word != null) words.add(word);
        }
        return words.isEmpty() ? EMPTY : new UserDictionary(words);
    }

    /** Returns the dictionary for {@code path}, loading it on first use. A null path means no dictionary. */
    public static UserDictionary forPath(Path path) {
        if (path == null) return EMPTY;
        return LOADED.computeIfAbsent(path.toAbsolutePath().normalize(), UserDictionary::load);
    }

    public static UserDictionary parse(Reader reader) throws IOException {
        Set<String> words = new HashSet<>();
        BufferedReader lines = new BufferedReader(reader);
        String line;
        while ((line = lines.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            String word = normalize(trimmed.split("\\s+")[0]);
            if (word != null) words.add(word);
        }
        return words.isEmpty() ? EMPTY : new UserDictionary(words);
    }

    private static UserDictionary load(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("Custom dictionary not found, continuing without it path={}", path);
            return EMPTY;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            UserDictionary dictionary = parse(reader);
            log.info("Loaded custom dictionary path={} entries={}", path, dictionary.size());
            return dictionary;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read custom dictionary " + path, e);
        }
    }

    private static String normalize(String entry) {
        if (entry == null) return null;
        String word = entry.strip().toLowerCase(Locale.ROOT);
        return word.isEmpty() ? null : word;
    }

    public boolean contains(CharSequence word) {
        return words.contains(word.toString());
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public int size() {
        return words.size();
    }

    public int maxWordLength() {
        return maxWordLength;
    }
}
