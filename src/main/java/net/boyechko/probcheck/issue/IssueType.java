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

/** Represents the type of a defect found in a problem package. */
public enum IssueType {
    // Run-wide issues
    NAME_ALREADY_USED("problem names already in use"),
    NAME_CHECK_UNAVAILABLE("problem name uniqueness not checked"),
    INCONSISTENT_METADATA("metadata fields with inconsistent values"),
    METADATA_CONSISTENCY_UNCHECKED("metadata fields not checked for consistency"),

    // Problem-level issues
    PROBLEM_CHECK_FAILED("problems that could not be checked"),
    COLLABORATOR_UNAVAILABLE("checks skipped for lack of a collaborator"),
    NAME_TITLE_MISMATCH("directory names not matching the title"),
    NO_WA_SUBMISSIONS("problems without WA submissions"),
    NO_TLE_SUBMISSIONS("problems without TLE submissions"),
    SINGLE_AC_SUBMISSION("problems with only one AC submission"),
    NO_SLOW_AC_SUBMISSION("problems without slow accepted submissions"),
    LARGE_IMAGE("large statement images"),

    // Metadata issues
    MISSING_METADATA("problems without metadata"),
    OPTION_NOT_IN_DEFAULT("metadata options not in the defaults"),
    UNUSUAL_METADATA("unusual metadata values"),
    DEFAULT_VALUE_SPECIFIED("metadata values equal to the default"),

    // Statement issues
    TEX_PARSE_FAILED("statements that could not be parsed"),
    MISSPELLED_WORDS("statements with misspelled words"),
    MISSING_MATH_MODE("statements with numbers outside math mode"),
    INCORRECT_MATH("statements with badly formatted numbers in math mode"),
    DOUBLE_QUOTES("statements using double-quotes"),
    INCLUDEGRAPHICS_WIDTH("statements with bad includegraphics width"),
    THREE_PERIODS("statements using three periods"),
    FLOATING_POINT("statements mentioning floating-point"),
    TIMES_SYMBOL("statements using \\times"),
    FUTURE_TENSE("statements using future tense"),

    GENERAL("other findings");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
