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
package net.boyechko.probcheck.checks;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits prose into words: maximal runs that start and end with a word character and contain no
 * whitespace. Punctuation inside a word (apostrophes, hyphens) survives; punctuation at either end
 * is trimmed.
 */
public final class Tokenizer {
    private static final Pattern WORD =
            Pattern.compile("\\b\\w(\\S*\\w)?\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private Tokenizer() {}

    /** Returns the distinct words of {@code text} in order of first appearance. */
    public static Set<String> tokens(String text) {
        Set<String> words = new LinkedHashSet<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }
}
