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
package net.boyechko.probcheck.validation;

import java.io.IOException;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.issue.IssueList;

/** A check that inspects a whole problem package. */
public interface ProblemCheck {

    String name();

    default String passedMessage() {
        return name() + ": no issues";
    }

    IssueList findIssues(ProblemContext ctx) throws IOException;
}
