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

import java.io.IOException;
import net.boyechko.probcheck.core.Collaborator;
import net.boyechko.probcheck.core.ProblemContext;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.metadata.DefaultsChecker;
import net.boyechko.probcheck.metadata.MetadataSchema;
import net.boyechko.probcheck.validation.ProblemCheck;

/** Compares a problem's declared metadata against the default schema. */
public class MetadataDefaultsCheck implements ProblemCheck {
    private final DefaultsChecker checker;

    public MetadataDefaultsCheck(DefaultsChecker checker) {
        this.checker = checker;
    }

    @Override
    public String name() {
        return "Metadata Defaults Check";
    }

    @Override
    public IssueList findIssues(ProblemContext ctx) throws IOException {
        Collaborator<MetadataSchema> schema = ctx.schema();
        if (!schema.isAvailable()) {
            return new IssueList(
                    new Issue(
                            IssueType.COLLABORATOR_UNAVAILABLE,
                            IssueSev.ERROR,
                            ctx.where(),
                            schema.unavailableMessage()));
        }
        return checker.checkDefaults(
                ctx.metadata().declared(), schema.get().defaults(), ctx.metadataLocation());
    }
}
