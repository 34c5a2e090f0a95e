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
package net.boyechko.probcheck.issue;

import java.nio.file.Path;

/** Represents where a defect was found: the whole run, one problem, or one file. */
public sealed interface IssueLoc {
    /** Key used for run-wide issues. */
    String GENERAL_KEY = "_general_";

    record General() implements IssueLoc {
        @Override
        public String key() {
            return GENERAL_KEY;
        }
    }

    record AtProblem(String problem) implements IssueLoc {
        @Override
        public String key() {
            return problem;
        }
    }

    /** A file inside a problem package; {@code path} starts with the problem name. */
    record AtFile(String path) implements IssueLoc {
        @Override
        public String key() {
            return path;
        }
    }

    String key();

    static IssueLoc general() {
        return new General();
    }

    static IssueLoc atProblem(String problem) {
        return new AtProblem(problem);
    }

    static IssueLoc atFile(String path) {
        return new AtFile(path);
    }

    /** Returns the location of {@code file} relative to the package at {@code problemDir}. */
    static IssueLoc atFile(String problem, Path problemDir, Path file) {
        String relative = problemDir.relativize(file).toString().replace('\\', '/');
        return new AtFile(problem + "/" + relative);
    }

    /** Maps a free-form log key back to a location. */
    static IssueLoc fromKey(String key) {
        if (GENERAL_KEY.equals(key)) {
            return general();
        }
        return key.contains("/") ? atFile(key) : atProblem(key);
    }

    /** Returns the report section this location belongs to: the key up to its first slash. */
    default String prefix() {
        String key = key();
        int slash = key.indexOf('/');
        return slash >= 0 ? key.substring(0, slash) : key;
    }
}
