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

import java.util.Collection;
import java.util.stream.Collectors;

/** Formats words for messages as {@code ['mats', 'on']}. */
final class QuotedList {
    private QuotedList() {}

    static String of(Collection<String> items) {
        return items.stream().map(QuotedList::quote).collect(Collectors.joining(", ", "[", "]"));
    }

    // A word with an apostrophe is wrapped in double quotes instead.
    static String quote(String item) {
        if (item.indexOf('\'') >= 0 && item.indexOf('"') < 0) {
            return "\"" + item + "\"";
        }
        return "'" + item.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
