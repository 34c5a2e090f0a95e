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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.probcheck.core.Collaborator;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import net.boyechko.probcheck.metadata.MetadataSchema;
import net.boyechko.probcheck.metadata.ProblemMetadata;

/**
 * Problems audited together usually come from one contest and should agree on where they come
 * from and how they are licensed.
 */
public class MetadataConsistencyCheck {
    public static final List<String> FIELDS = List.of("source", "source_url", "license");

    public String name() {
        return "Metadata Consistency Check";
    }

    /**
     * @param metadataByProblem metadata of every problem that was checked without an exception,
     *     in check order
     */
    public IssueList findIssues(
            Map<String, ProblemMetadata> metadataByProblem, Collaborator<MetadataSchema> schema) {
        IssueList issues = new IssueList();
        boolean checkable =
                schema.isAvailable()
                        && metadataByProblem.values().stream().allMatch(ProblemMetadata::isPresent);

        for (String field : FIELDS) {
            if (!checkable) {
                issues.add(
                        new Issue(
                                IssueType.METADATA_CONSISTENCY_UNCHECKED,
                                IssueSev.WARNING,
                                IssueLoc.general(),
                                "could not check for consistency of metadata field " + field));
                continue;
            }

            Map<String, Object> defaults = schema.get().defaults();
            Map<Object, Integer> counts = new LinkedHashMap<>();
            for (ProblemMetadata metadata : metadataByProblem.values()) {
                counts.merge(metadata.effectiveValue(field, defaults), 1, Integer::sum);
            }
            if (counts.size() > 1) {
                issues.add(
                        new Issue(
                                IssueType.INCONSISTENT_METADATA,
                                IssueSev.WARNING,
                                IssueLoc.general(),
                                "multiple values for " + field + ": " + counts));
            }
        }
        return issues;
    }
}
