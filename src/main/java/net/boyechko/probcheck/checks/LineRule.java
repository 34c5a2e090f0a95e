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

import java.util.regex.Pattern;
import net.boyechko.probcheck.issue.IssueType;

/**
 * A line-scoped style rule. Each pattern only looks at the part of a line before the first
 * {@code %}, so commented-out LaTeX is ignored; an escaped {@code \%} also ends the examined part.
 */
public enum LineRule {
    DOUBLE_QUOTES(
            "\"", IssueType.DOUBLE_QUOTES, "uses double-quotes; use two single-quotes instead"),
    INCLUDEGRAPHICS_WIDTH(
            "\\\\includegraphics(?!\\[width=[0-9.]+\\\\(textwidth|linewidth)\\])",
            IssueType.INCLUDEGRAPHICS_WIDTH,
            "bad includegraphics width; use a multiplier (e.g. width=0.9\\textwidth) or HTML"
                    + " layout can break"),
    THREE_PERIODS("\\.\\.\\.", IssueType.THREE_PERIODS, "use \\ldots rather than three periods"),
    FLOATING_POINT(
            "floating[- ]*point",
            IssueType.FLOATING_POINT,
            "use \"real\" rather than \"floating-point\""),
    TIMES(
            "\\\\times\\b",
            IssueType.TIMES_SYMBOL,
            "use \\cdot instead of \\times for multiplication"),
    FUTURE_TENSE(
            "\\bwill\\b",
            IssueType.FUTURE_TENSE,
            "uses future tense (\"will\"); prefer present tense");

    private final Pattern pattern;
    private final IssueType type;
    private final String message;

    LineRule(String regex, IssueType type, String message) {
        this.pattern =
                Pattern.compile(
                        "^[^%]*" + regex,
                        Pattern.CASE_INSENSITIVE
                                | Pattern.UNICODE_CASE
                                | Pattern.UNICODE_CHARACTER_CLASS);
        this.type = type;
        this.message = message;
    }

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }

    public IssueType type() {
        return type;
    }

    public String message() {
        return message;
    }
}
