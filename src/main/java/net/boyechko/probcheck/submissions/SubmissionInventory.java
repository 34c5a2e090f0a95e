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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/** The solutions a problem ships, grouped by the verdict they are expected to get. */
public final class SubmissionInventory {
    public static final String DIRECTORY = "submissions";

    private final Map<Verdict, List<Submission>> byVerdict;

    private SubmissionInventory(Map<Verdict, List<Submission>> byVerdict) {
        this.byVerdict = byVerdict;
    }

    /** Scans {@code <problemDir>/submissions/<verdict>/}. Missing directories are empty. */
    public static SubmissionInventory scan(Path problemDir) throws IOException {
        Map<Verdict, List<Submission>> byVerdict = new EnumMap<>(Verdict.class);
        for (Verdict verdict : Verdict.values()) {
            Path dir = problemDir.resolve(DIRECTORY).resolve(verdict.directoryName());
            List<Submission> submissions = new ArrayList<>();
            if (Files.isDirectory(dir)) {
                try (Stream<Path> entries = Files.list(dir)) {
                    entries.sorted().map(Submission::of).forEach(submissions::add);
                }
            }
            byVerdict.put(verdict, Collections.unmodifiableList(submissions));
        }
        return new SubmissionInventory(byVerdict);
    }

    public static SubmissionInventory of(Map<Verdict, List<Submission>> submissions) {
        Map<Verdict, List<Submission>> byVerdict = new EnumMap<>(Verdict.class);
        for (Verdict verdict : Verdict.values()) {
            byVerdict.put(verdict, List.copyOf(submissions.getOrDefault(verdict, List.of())));
        }
        return new SubmissionInventory(byVerdict);
    }

    public List<Submission> get(Verdict verdict) {
        return byVerdict.get(verdict);
    }

    public int count(Verdict verdict) {
        return get(verdict).size();
    }
}
