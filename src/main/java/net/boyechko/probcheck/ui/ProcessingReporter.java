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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import net.boyechko.probcheck.core.ProcessingListener;
import net.boyechko.probcheck.core.VerbosityLevel;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueLog;
import net.boyechko.probcheck.issue.IssueSev;
import org.slf4j.LoggerFactory;

/** Prints progress as one box per phase: the name check, each problem, and the summary. */
public class ProcessingReporter implements ProcessingListener {
    static final String APP_LOGGER = "net.boyechko.probcheck";

    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ProcessingReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;

        Set<String> files =
                issues.stream()
                        .map(Issue::where)
                        .filter(where -> where instanceof IssueLoc.AtFile)
                        .map(ProcessingReporter::shortLocation)
                        .collect(Collectors.toCollection(TreeSet::new));

        String summary = issues.size() + " " + groupLabel;
        if (!files.isEmpty()) {
            summary += " (" + String.join(", ", files) + ")";
        }
        printLine(summary, iconFor(issues));

        if (verbosity.shouldShow(VerbosityLevel.VERBOSE)) {
            for (Issue issue : issues) {
                printLine(describe(issue), iconFor(issue), VerbosityLevel.VERBOSE);
            }
        }
    }

    @Override
    public void onSummary(IssueLog log) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            IssueList all = log.allIssues();
            long errors = all.stream().filter(i -> i.severity() == IssueSev.ERROR).count();
            long problems =
                    log.allKeys().stream()
                            .map(IssueLoc::fromKey)
                            .filter(where -> !(where instanceof IssueLoc.General))
                            .map(IssueLoc::prefix)
                            .distinct()
                            .count();

            closePhaseBoxIfOpen();
            printBoxHeader("Summary");
            if (all.isEmpty()) {
                printLine("No findings", SUCCESS);
            } else {
                printLine("Findings: " + all.size() + " (" + errors + " errors)", INFO);
                printLine("Problems with findings: " + problems, INFO);
            }
            printBoxFooter();
        }
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onWarning(Issue issue) {
        printLine(describe(issue), iconFor(issue));
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    @Override
    public void onVerboseOutput(String message) {
        output.print(message);
    }

    public boolean shouldShow(VerbosityLevel level) {
        return verbosity.shouldShow(level);
    }

    /** Closes the open box, if any, flushing buffered log events into it. */
    public void finish() {
        closePhaseBoxIfOpen();
    }

    private static String describe(Issue issue) {
        if (issue.where() instanceof IssueLoc.AtFile) {
            return shortLocation(issue.where()) + ": " + issue.message();
        }
        return issue.message();
    }

    /** The file's path inside its problem package. */
    private static String shortLocation(IssueLoc where) {
        String key = where.key();
        int slash = key.indexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    private static String iconFor(Issue issue) {
        return issue.severity() == IssueSev.ERROR ? ERROR : WARNING;
    }

    private static String iconFor(List<Issue> issues) {
        return issues.stream().anyMatch(i -> i.severity() == IssueSev.ERROR) ? ERROR : WARNING;
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
            output.println("│");
        }
    }

    private void printBoxFooter() {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            drainLogBuffer();
            output.println("│");
            output.println("└─╯");
        }
    }

    /**
     * Flushes log events captured since the last drain into the open box, formatted with the same
     * icons used for warnings and errors elsewhere in the output.
     */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        printEmptyLine();
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            String levelString = event.getLevel().toString().toUpperCase();
            String origin = event.getLoggerName();
            origin = origin.substring(origin.lastIndexOf('.') + 1);
            printLine("[" + levelString + "] " + origin + ": " + event.getFormattedMessage(), icon);
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width. Continuation lines are indented to align with the message start.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.shouldShow(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(INDENT.strip());
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    private void printEmptyLine() {
        printLine("", "", VerbosityLevel.QUIET);
    }

    /**
     * Word-wraps text at word boundaries to fit within maxWidth characters per line. Embedded line
     * breaks, as in stack traces, are kept.
     */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\\R")) {
            if (paragraph.length() <= maxWidth) {
                lines.add(paragraph);
                continue;
            }
            StringBuilder currentLine = new StringBuilder();
            for (String word : paragraph.split(" ")) {
                if (currentLine.isEmpty()) {
                    currentLine.append(word);
                } else if (currentLine.length() + 1 + word.length() <= maxWidth) {
                    currentLine.append(' ').append(word);
                } else {
                    lines.add(currentLine.toString());
                    currentLine.setLength(0);
                    currentLine.append(word);
                }
            }
            if (!currentLine.isEmpty()) {
                lines.add(currentLine.toString());
            }
        }
        return lines;
    }
}
