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
package net.boyechko.probcheck.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class CollaboratorTest {
    @Test
    void availableCollaboratorHandsOutItsValue() {
        Collaborator<String> parser = Collaborator.available("parser", "value");

        assertTrue(parser.isAvailable());
        assertEquals("value", parser.get());
        assertNull(parser.reason());
        assertEquals("parser", parser.toString());
    }

    @Test
    void unavailableCollaboratorExplainsWhy() {
        Collaborator<String> parser = Collaborator.unavailable("LaTeX parser", "not on path");

        assertFalse(parser.isAvailable());
        assertEquals("could not load LaTeX parser: not on path", parser.unavailableMessage());
        NoSuchElementException e = assertThrows(NoSuchElementException.class, parser::get);
        assertEquals(parser.unavailableMessage(), e.getMessage());
    }

    @Test
    void nullValueIsRejected() {
        assertThrows(NullPointerException.class, () -> Collaborator.available("x", null));
        assertThrows(NullPointerException.class, () -> Collaborator.unavailable("x", null));
    }
}
