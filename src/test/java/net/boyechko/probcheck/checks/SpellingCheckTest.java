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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.validation.StatementContext;
import org.junit.jupiter.api.Test;

class SpellingCheckTest {
    private static final IssueLoc WHERE = IssueLoc.atFile("cat/problem_statement/problem.tex");

    private static IssueList check(String plainText, Optional<Set<String>> dictionary) {
        return new SpellingCheck()
                .findIssues(
                        new StatementContext(
                                WHERE,
                                Optional.of(new TextStreams(plainText, "")),
                                List.of(),
                                dictionary));
    }

    @Test
    void splitsUnknownWordsIntoNumbersAndMisspellings() {
        IssueList issues =
                check("the cat sat on 42 mats", Optional.of(Set.of("the", "cat", "sat")));

        assertEquals(
                List.of("misspelled words: ['mats', 'on']", "missing math mode: ['42']"),
                issues.messages());
        assertEquals(IssueType.MISSPELLED_WORDS, issues.get(0).type());
        assertEquals(IssueType.MISSING_MATH_MODE, issues.get(1).type());
        assertEquals(WHERE, issues.get(0).where());
    }

    @Test
    void numberLikeMeansLeadingDigitDotOrComma() {
        IssueList issues = check("3rd .net ,x 2024 x2", Optional.of(Set.of("x")));

        assertEquals(
                List.of("misspelled words: ['net', 'x2']", "missing math mode: ['2024', '3rd']"),
                issues.messages(),
                "Tokens are trimmed at the edges, so '.net' is the word 'net'");
    }

    @Test
    void missingDictionarySkipsCheck() {
        assertTrue(check("zzz 42", Optional.empty()).isEmpty());
    }

    @Test
    void emptyDictionarySkipsCheck() {
        assertTrue(check("zzz 42", Optional.of(Set.of())).isEmpty());
    }

    @Test
    void knownWordsProduceNoFindings() {
        assertTrue(check("the cat", Optional.of(Set.of("the", "cat"))).isEmpty());
    }

    @Test
    void unparsedStatementHasNothingToCheck() {
        IssueList issues =
                new SpellingCheck()
                        .findIssues(
                                new StatementContext(
                                        WHERE,
                                        Optional.empty(),
                                        List.of(),
                                        Optional.of(Set.of("a"))));
        assertTrue(issues.isEmpty());
    }
}
