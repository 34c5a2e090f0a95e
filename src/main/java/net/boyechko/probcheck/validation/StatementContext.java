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

import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.probcheck.document.TextStreams;
import net.boyechko.probcheck.issue.IssueLoc;

/**
 * Everything the statement checks look at for one statement file.
 *
 * @param where location findings are filed under
 * @param streams classified text, empty when the statement could not be parsed
 * @param rawLines source lines of the statement
 * @param dictionary spelling dictionary for the statement's language, empty when none is loaded
 */
public record StatementContext(
        IssueLoc where,
        Optional<TextStreams> streams,
        List<String> rawLines,
        Optional<Set<String>> dictionary) {

    public StatementContext {
        streams = streams != null ? streams : Optional.empty();
        rawLines = List.copyOf(rawLines);
        dictionary = dictionary != null ? dictionary : Optional.empty();
    }
}
