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
package net.boyechko.probcheck;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import net.boyechko.probcheck.core.CheckerOptions;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.core.ProcessingDefaults;
import net.boyechko.probcheck.dictionary.SpellingDictionaries;
import net.boyechko.probcheck.submissions.Verdict;
import org.junit.jupiter.api.io.TempDir;

/** Base class for tests that need problem packages on disk. */
public abstract class ProblemTestBase {

    @TempDir protected Path tempDir;

    /** A package with a matching title and one submission of each kind, so it has no findings. */
    protected static final String CLEAN_METADATA =
            "name:\n  en: Hello World\nsource: NCPC 2024\nlicense: cc by-sa\n";

    protected Path createProblem(String name, String problemYaml) throws IOException {
        Path dir = tempDir.resolve(name);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("problem.yaml"), problemYaml, StandardCharsets.UTF_8);
        return dir;
    }

    protected Path writeStatement(Path problemDir, String fileName, String tex)
            throws IOException {
        Path dir = problemDir.resolve(ProblemContext.STATEMENT_DIRECTORY);
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName);
        Files.writeString(file, tex, StandardCharsets.UTF_8);
        return file;
    }

    protected Path addSubmission(Path problemDir, Verdict verdict, String fileName)
            throws IOException {
        Path dir = problemDir.resolve("submissions").resolve(verdict.directoryName());
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName);
        Files.writeString(file, "// " + fileName + "\n", StandardCharsets.UTF_8);
        return file;
    }

    /** Adds AC (C++ and Python), WA and TLE submissions. */
    protected void addRobustSubmissions(Path problemDir) throws IOException {
        addSubmission(problemDir, Verdict.AC, "fast.cpp");
        addSubmission(problemDir, Verdict.AC, "slow.py");
        addSubmission(problemDir, Verdict.WA, "wrong.cpp");
        addSubmission(problemDir, Verdict.TLE, "naive.py");
    }

    protected ProblemContext contextFor(Path problemDir) {
        return contextFor(problemDir, SpellingDictionaries.empty(), CheckerOptions.defaults());
    }

    protected ProblemContext contextFor(
            Path problemDir, SpellingDictionaries dictionaries, CheckerOptions options) {
        return new ProblemContext(
                problemDir,
                ProcessingDefaults.parser(),
                ProcessingDefaults.schema(Optional.empty()),
                dictionaries,
                options);
    }
}
