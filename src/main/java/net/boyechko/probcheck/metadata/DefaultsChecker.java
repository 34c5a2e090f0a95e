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
package net.boyechko.probcheck.metadata;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.boyechko.probcheck.issue.Issue;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;

/**
 * Recursive structural diff of declared metadata against a default schema.
 *
 * <p>For every declared key, in declaration order:
 *
 * <ul>
 *   <li>a key on the unusual-settings watch-list is reported, whatever else happens;
 *   <li>a key the schema does not know is an error, and its subtree is not examined;
 *   <li>a map value is compared recursively when the schema also has a map there; any other schema
 *       value means the content is free-form;
 *   <li>a scalar equal to a non-null schema default is reported as redundant, when enabled.
 * </ul>
 *
 * Keys are written as slash-separated paths from the root, e.g. {@code limits/memory}.
 */
public class DefaultsChecker {
    private final Set<String> unusualSettings;
    private final boolean warnOnDefaultValues;

    public DefaultsChecker(Set<String> unusualSettings, boolean warnOnDefaultValues) {
        this.unusualSettings = Set.copyOf(unusualSettings);
        this.warnOnDefaultValues = warnOnDefaultValues;
    }

    public IssueList checkDefaults(Object declared, Map<String, Object> schema, IssueLoc where) {
        IssueList issues = new IssueList();
        if (!(declared instanceof Map<?, ?> declaredMap)) {
            issues.add(
                    new Issue(
                            IssueType.MISSING_METADATA,
                            IssueSev.ERROR,
                            where,
                            "there is no metadata"));
            return issues;
        }
        checkRecursive(declaredMap, schema, "", where, issues);
        return issues;
    }

    private void checkRecursive(
            Map<?, ?> declared, Map<?, ?> schema, String path, IssueLoc where, IssueList issues) {
        for (Map.Entry<?, ?> entry : declared.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String fullKey = path.isEmpty() ? key : path + "/" + key;

            if (unusualSettings.contains(fullKey)) {
                issues.add(
                        new Issue(
                                IssueType.UNUSUAL_METADATA,
                                IssueSev.WARNING,
                                where,
                                "specifying unusual metadata value " + fullKey));
            }

            if (!schema.containsKey(key)) {
                issues.add(
                        new Issue(
                                IssueType.OPTION_NOT_IN_DEFAULT,
                                IssueSev.ERROR,
                                where,
                                "option " + fullKey + " is not in default"));
                continue;
            }

            Object value = entry.getValue();
            Object defaultValue = schema.get(key);
            if (value instanceof Map<?, ?> nested) {
                if (defaultValue instanceof Map<?, ?> nestedSchema) {
                    checkRecursive(nested, nestedSchema, fullKey, where, issues);
                }
            } else if (warnOnDefaultValues
                    && defaultValue != null
                    && sameValue(value, defaultValue)) {
                issues.add(
                        new Issue(
                                IssueType.DEFAULT_VALUE_SPECIFIED,
                                IssueSev.WARNING,
                                where,
                                "specifies default value for "
                                        + fullKey
                                        + "; remove the definition"));
            }
        }
    }

    /** Numbers compare by value, so {@code 1024} equals {@code 1024.0}. */
    static boolean sameValue(Object declared, Object defaultValue) {
        if (declared instanceof Number a && defaultValue instanceof Number b) {
            try {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
            } catch (NumberFormatException e) {
                // NaN and infinities have no BigDecimal form
                return a.doubleValue() == b.doubleValue();
            }
        }
        return Objects.equals(declared, defaultValue);
    }

    public boolean warnsOnDefaultValues() {
        return warnOnDefaultValues;
    }
}
