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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Append-only log of issues, keyed by file, problem, or {@link IssueLoc#GENERAL_KEY}. Keys are
 * kept in lexicographic order and never removed; messages keep their insertion order and are not
 * deduplicated.
 *
 * <p>Not thread-safe. Concurrent workers should each fill their own log and {@link #merge} them.
 */
public class IssueLog {
    private final Map<String, IssueList> entries = new TreeMap<>();

    public void log(Issue issue) {
        entries.computeIfAbsent(issue.key(), k -> new IssueList()).add(issue);
    }

    public void logAll(Collection<Issue> issues) {
        for (Issue issue : issues) {
            log(issue);
        }
    }

    /** Appends a free-form message under {@code key}. */
    public void log(String key, String message) {
        log(new Issue(IssueType.GENERAL, IssueSev.WARNING, IssueLoc.fromKey(key), message));
    }

    public void warning(IssueType type, IssueLoc where, String message) {
        log(new Issue(type, IssueSev.WARNING, where, message));
    }

    public void error(IssueType type, IssueLoc where, String message) {
        log(new Issue(type, IssueSev.ERROR, where, message));
    }

    public Set<String> allKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    public List<String> messagesFor(String key) {
        IssueList issues = entries.get(key);
        return issues != null ? issues.messages() : List.of();
    }

    public IssueList issuesFor(String key) {
        IssueList issues = entries.get(key);
        return issues != null ? new IssueList(issues) : new IssueList();
    }

    /** Returns every issue, ordered by key and then by insertion. */
    public IssueList allIssues() {
        IssueList all = new IssueList();
        for (IssueList issues : entries.values()) {
            all.addAll(issues);
        }
        return all;
    }

    public int size() {
        int total = 0;
        for (IssueList issues : entries.values()) {
            total += issues.size();
        }
        return total;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Appends every issue of {@code other} to this log, key by key. */
    public void merge(IssueLog other) {
        for (Map.Entry<String, IssueList> entry : other.entries.entrySet()) {
            entries.computeIfAbsent(entry.getKey(), k -> new IssueList()).addAll(entry.getValue());
        }
    }
}
