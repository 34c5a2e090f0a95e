/*
 * Problem-Check - Problem Package Auditor
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.probcheck.dictionary;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Word lists for spell checking, one set per language. A dictionary directory holds one
 * subdirectory per language (named by its two-letter tag, plus {@code global} for words valid in
 * every language), each containing any number of files with one word per line.
 */
public final class SpellingDictionaries {
    public static final String GLOBAL = "global";

    private static final Logger logger = LoggerFactory.getLogger(SpellingDictionaries.class);

    private final Map<String, Set<String>> byLanguage;

    private SpellingDictionaries(Map<String, Set<String>> byLanguage) {
        Map<String, Set<String>> copy = new HashMap<>();
        byLanguage.forEach((lang, words) -> copy.put(lang, Set.copyOf(words)));
        this.byLanguage = Map.copyOf(copy);
    }

    public static SpellingDictionaries empty() {
        return new SpellingDictionaries(Map.of());
    }

    public static SpellingDictionaries of(Map<String, Set<String>> byLanguage) {
        return new SpellingDictionaries(byLanguage);
    }

    /**
     * Loads every file below {@code root}, following symbolic links. Files directly in {@code
     * root} are ignored; a file anywhere else belongs to the language named by its parent
     * directory.
     *
     * @throws NoSuchFileException if {@code root} is not a directory
     * @throws IOException if a word list cannot be read as UTF-8 text
     */
    public static SpellingDictionaries load(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "no such directory");
        }
        Map<String, Set<String>> byLanguage = new HashMap<>();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root, FileVisitOption.FOLLOW_LINKS)) {
            files =
                    walk.filter(Files::isRegularFile)
                            .filter(p -> !p.getParent().equals(root))
                            .sorted()
                            .toList();
        }
        for (Path file : files) {
            String language = file.getParent().getFileName().toString();
            Set<String> words = byLanguage.computeIfAbsent(language, k -> new HashSet<>());
            for (String line : readWords(file)) {
                words.add(line.strip().toLowerCase(Locale.ROOT));
            }
            logger.info("Loaded dictionary {} for {}", file.getFileName(), language);
        }
        return new SpellingDictionaries(byLanguage);
    }

    private static List<String> readWords(Path file) throws IOException {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new IOException(file + " is not valid UTF-8 text", e);
        }
    }

    /**
     * Returns the words for {@code language} together with the global words, or empty when no
     * dictionary was loaded for that language.
     */
    public Optional<Set<String>> forLanguage(String language) {
        Set<String> words = byLanguage.get(language);
        if (words == null) {
            return Optional.empty();
        }
        Set<String> global = byLanguage.getOrDefault(GLOBAL, Set.of());
        return Optional.of(
                Stream.concat(words.stream(), global.stream())
                        .collect(Collectors.toUnmodifiableSet()));
    }

    public Set<String> languages() {
        return byLanguage.keySet();
    }

    public boolean isEmpty() {
        return byLanguage.isEmpty();
    }
}
