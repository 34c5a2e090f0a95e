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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class QuotedListTest {
    @Test
    void wordsAreQuotedInOrder() {
        assertEquals("['mats', 'on']", QuotedList.of(new TreeSet<>(List.of("on", "mats"))));
        assertEquals("[]", QuotedList.of(List.of()));
    }

    @Test
    void apostropheSwitchesToDoubleQuotes() {
        assertEquals("\"don't\"", QuotedList.quote("don't"));
        assertEquals("'say \"don\\'t\"'", QuotedList.quote("say \"don't\""));
    }
}
