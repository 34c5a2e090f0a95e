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

import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.validation.StatementCheck;
import net.boyechko.probcheck.validation.StatementContext;

/**
 * Looks up every prose word in the spelling dictionary. Unknown words that look like numbers
 * belong in math mode; the others are reported as misspelled. Skipped when no dictionary is loaded
 * for the statement's language.
 */
public class SpellingCheck implements StatementCheck {
    private static final Pattern BARE_NUMBER = Pattern.compile("^[0-9.,]+");

    @Override
    public String name() {
        return "Spelling Check";
    }

    @Override
    public IssueList findIssues(StatementContext ctx) {
        IssueList issues = new IssueList();
        Optional<Set<String>> dictionary = ctx.dictionary();
        if (ctx.streams().isEmpty() || dictionary.isEmpty() || dictionary.get().isEmpty()) {
            return issues;
        }

        TextStreams streams = ctx.streams().get();
        SortedSet<String> missingMathMode = new TreeSet<>();
        SortedSet<String> misspelled = new TreeSet<>();
        for (String word : Tokenizer.tokens(streams.plainText())) {
            if (dictionary.get().contains(word)) {
                continue;
            }
            if (BARE_NUMBER.matcher(word).lookingAt()) {
                missingMathMode.add(word);
            } else {
                misspelled.add(word);
            }
        }

        if (!misspelled.isEmpty()) {
            issues.add(
                    new Issue(
                            IssueType.MISSPELLED_WORDS,
                            IssueSev.WARNING,
                            ctx.where(),
                            "misspelled words: " + QuotedList.of(misspelled)));
        }
        if (!missingMathMode.isEmpty()) {
            issues.add(
                    new Issue(
                            IssueType.MISSING_MATH_MODE,
                            IssueSev.WARNING,
                            ctx.where(),
                            "missing math mode: " + QuotedList.of(missingMathMode)));
        }
        return issues;
    }
}
