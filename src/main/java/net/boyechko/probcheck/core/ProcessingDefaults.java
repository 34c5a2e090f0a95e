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
package net.boyechko.probcheck.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.probcheck.checks.LargeImageCheck;
import net.boyechko.probcheck.checks.LineRule;
import net.boyechko.probcheck.checks.MetadataDefaultsCheck;
import net.boyechko.probcheck.checks.NameTitleCheck;
import net.boyechko.probcheck.checks.StatementFilesCheck;
import net.boyechko.probcheck.checks.SubmissionRobustnessCheck;
import net.boyechko.probcheck.checks.TextIssueDetector;
import net.boyechko.probcheck.dictionary.SpellingDictionaries;
import net.boyechko.probcheck.document.LatexParser;
import net.boyechko.probcheck.document.MarkupParser;
import net.boyechko.probcheck.metadata.DefaultsChecker;
import net.boyechko.probcheck.metadata.MetadataSchema;
import net.boyechko.probcheck.validation.ProblemCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProcessingDefaults {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingDefaults.class);

    public static final String PARSER_NAME = "LaTeX parser";
    public static final String SCHEMA_NAME = "metadata defaults";
    public static final String DICTIONARIES_NAME = "spelling dictionaries";

    /** Metadata keys that are rarely right to set; anyone setting them should double-check. */
    public static final Set<String> UNUSUAL_SETTINGS =
            Set.of(
                    "validation",
                    "type",
                    "limits/memory",
                    "limits/output",
                    "limits/compilation_time",
                    "limits/validation_time",
                    "limits/validation_memory",
                    "limits/validation_output");

    private ProcessingDefaults() {}

    public static List<LineRule> lineRules(CheckerOptions options) {
        List<LineRule> rules = new ArrayList<>();
        rules.add(LineRule.DOUBLE_QUOTES);
        rules.add(LineRule.INCLUDEGRAPHICS_WIDTH);
        rules.add(LineRule.THREE_PERIODS);
        rules.add(LineRule.FLOATING_POINT);
        rules.add(LineRule.TIMES);
        if (options.checkFutureTense()) {
            rules.add(LineRule.FUTURE_TENSE);
        }
        return rules;
    }

    /** Per-problem checks, in the order they run. */
    public static List<ProblemCheck> problemChecks(CheckerOptions options) {
        return List.of(
                new NameTitleCheck(),
                new MetadataDefaultsCheck(
                        new DefaultsChecker(UNUSUAL_SETTINGS, options.warnOnDefaultValues())),
                new SubmissionRobustnessCheck(),
                new StatementFilesCheck(TextIssueDetector.withLineRules(lineRules(options))),
                new LargeImageCheck());
    }

    public static Collaborator<MarkupParser> parser() {
        return Collaborator.available(PARSER_NAME, new LatexParser());
    }

    /** Loads the schema from {@code file}, or the bundled one when no file is given. */
    public static Collaborator<MetadataSchema> schema(Optional<Path> file) {
        try {
            MetadataSchema schema =
                    file.isPresent()
                            ? MetadataSchema.fromFile(file.get())
                            : MetadataSchema.loadDefault();
            return Collaborator.available(SCHEMA_NAME, schema);
        } catch (Exception e) {
            logger.error("Failed to load {}: {}", SCHEMA_NAME, e.getMessage());
            return Collaborator.unavailable(SCHEMA_NAME, String.valueOf(e.getMessage()));
        }
    }

    /** Loads the word lists below {@code root}; a missing or unreadable tree is unavailable. */
    public static Collaborator<SpellingDictionaries> dictionaries(Path root) {
        try {
            return Collaborator.available(DICTIONARIES_NAME, SpellingDictionaries.load(root));
        } catch (IOException | UncheckedIOException e) {
            logger.error("Failed to load {}: {}", DICTIONARIES_NAME, e.getMessage());
            return Collaborator.unavailable(DICTIONARIES_NAME, String.valueOf(e.getMessage()));
        }
    }

    /** No word lists at all; spell checking is silently skipped for every language. */
    public static Collaborator<SpellingDictionaries> noDictionaries() {
        return Collaborator.available(DICTIONARIES_NAME, SpellingDictionaries.empty());
    }
}
