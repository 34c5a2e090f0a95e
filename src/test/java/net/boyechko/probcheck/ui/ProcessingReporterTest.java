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
package net.boyechko.probcheck.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.probcheck.core.VerbosityLevel;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueLog;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ProcessingReporterTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ProcessingReporter reporter(VerbosityLevel verbosity) {
        return new ProcessingReporter(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), verbosity);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Issue typo(String file) {
        return new Issue(
                IssueType.MISSPELLED_WORDS,
                IssueSev.WARNING,
                IssueLoc.atFile(file),
                "misspelled words: ['wrold']");
    }

    @Test
    void phasesAreBoxed() {
        ProcessingReporter reporter = reporter(VerbosityLevel.NORMAL);

        reporter.onPhaseStart("hello");
        reporter.onWarning(
                new Issue(
                        IssueType.NO_TLE_SUBMISSIONS,
                        IssueSev.WARNING,
                        IssueLoc.atProblem("hello"),
                        "has no TLE submissions"));
        reporter.onWarning(typo("hello/problem_statement/problem.tex"));
        reporter.onSuccess("Large Image Check: no issues");
        reporter.finish();

        String out = output();
        assertTrue(out.contains("┌─ hello "), out);
        assertTrue(out.contains("has no TLE submissions"), out);
        assertTrue(out.contains("problem_statement/problem.tex: misspelled words: ['wrold']"), out);
        assertFalse(out.contains("hello/problem_statement"), "Paths are shown inside the package");
        assertFalse(out.contains("no issues"), "Passed checks only show when verbose");
        assertTrue(out.strip().endsWith("└─╯"), out);
    }

    @Test
    void passedChecksShowWhenVerbose() {
        ProcessingReporter reporter = reporter(VerbosityLevel.VERBOSE);

        reporter.onPhaseStart("hello");
        reporter.onSuccess("Large Image Check: no issues");

        assertTrue(output().contains("✓ Large Image Check: no issues"));
    }

    @Test
    void groupsSummarizeFiles() {
        ProcessingReporter reporter = reporter(VerbosityLevel.NORMAL);

        reporter.onIssueGroup(
                IssueType.MISSPELLED_WORDS.groupLabel(),
                List.of(
                        typo("hello/problem_statement/problem.tex"),
                        typo("hello/problem_statement/problem.sv.tex"),
                        typo("hello/problem_statement/problem.de.tex")));

        String firstLine = "3 statements with misspelled words (problem_statement/problem.de.tex,";
        assertTrue(output().contains(firstLine), output());
        assertFalse(output().contains("[wrold]"), "Members are listed only when verbose");
    }

    @Test
    void quietShowsOnlyErrors() {
        ProcessingReporter reporter = reporter(VerbosityLevel.QUIET);

        reporter.onPhaseStart("hello");
        reporter.onWarning(typo("hello/problem_statement/problem.tex"));
        reporter.onError("hello: java.io.IOException: disk on fire");
        reporter.onSummary(new IssueLog());

        String out = output();
        assertFalse(out.contains("┌─"), out);
        assertFalse(out.contains("wrold"), out);
        assertTrue(out.contains("disk on fire"), out);
    }

    @Test
    void summaryCountsFindingsAndProblems() {
        IssueLog log = new IssueLog();
        log.logAll(List.of(typo("hello/problem_statement/problem.tex"), typo("bye/p/problem.tex")));
        log.error(IssueType.NAME_CHECK_UNAVAILABLE, IssueLoc.general(), "could not check names");

        reporter(VerbosityLevel.NORMAL).onSummary(log);

        String out = output();
        assertTrue(out.contains("Findings: 3 (1 errors)"), out);
        assertTrue(out.contains("Problems with findings: 2"), out);
    }

    @Test
    void emptySummary() {
        reporter(VerbosityLevel.NORMAL).onSummary(new IssueLog());

        assertTrue(output().contains("No findings"));
    }

    @Test
    void logEventsAreShownInsideTheBox() {
        ProcessingReporter reporter = reporter(VerbosityLevel.NORMAL);

        reporter.onPhaseStart("hello");
        LoggerFactory.getLogger("net.boyechko.probcheck.dictionary.SpellingDictionaries")
                .error("Dictionary directory /nope is unreadable");
        reporter.finish();

        assertTrue(
                output().contains("[ERROR] SpellingDictionaries: Dictionary directory /nope"),
                output());
    }

    @Test
    void wordWrapKeepsLineBreaks() {
        assertEquals(
                List.of("aaa bbb", "ccc", "next line"),
                ProcessingReporter.wordWrap("aaa bbb ccc\nnext line", 10));
        assertEquals(List.of(), ProcessingReporter.wordWrap("", 8));
    }
}
