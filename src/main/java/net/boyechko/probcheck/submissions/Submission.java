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
package net.boyechko.probcheck.submissions;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** A single solution file and the language it is written in. */
public record Submission(Path path, String language) {
    static final String UNKNOWN_LANGUAGE = "unknown";

    private static final Map<String, String> LANGUAGES_BY_EXTENSION =
            Map.ofEntries(
                    Map.entry("c", "C"),
                    Map.entry("cc", "C++"),
                    Map.entry("cpp", "C++"),
                    Map.entry("cxx", "C++"),
                    Map.entry("c++", "C++"),
                    Map.entry("java", "Java"),
                    Map.entry("kt", "Kotlin"),
                    Map.entry("py", "Python 3"),
                    Map.entry("py3", "Python 3"),
                    Map.entry("py2", "Python 2"),
                    Map.entry("go", "Go"),
                    Map.entry("rs", "Rust"),
                    Map.entry("cs", "C#"),
                    Map.entry("js", "JavaScript"),
                    Map.entry("rb", "Ruby"),
                    Map.entry("hs", "Haskell"),
                    Map.entry("ml", "OCaml"),
                    Map.entry("pas", "Pascal"),
                    Map.entry("scala", "Scala"),
                    Map.entry("php", "PHP"));

    /** Directory submissions get their language from the directory name, usually unknown. */
    public static Submission of(Path path) {
        return new Submission(path, languageOf(path));
    }

    static String languageOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return UNKNOWN_LANGUAGE;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return LANGUAGES_BY_EXTENSION.getOrDefault(extension, UNKNOWN_LANGUAGE);
    }
}
