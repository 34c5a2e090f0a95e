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

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * An external component the checks depend on, together with whether it could be loaded. Checks
 * that need an unavailable collaborator are skipped and the reason is reported instead.
 *
 * @param <T> the collaborator's type
 */
public final class Collaborator<T> {
    private final String name;
    private final T value;
    private final String reason;

    private Collaborator(String name, T value, String reason) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.reason = reason;
    }

    public static <T> Collaborator<T> available(String name, T value) {
        return new Collaborator<>(name, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Collaborator<T> unavailable(String name, String reason) {
        return new Collaborator<>(name, null, Objects.requireNonNull(reason, "reason"));
    }

    public String name() {
        return name;
    }

    public boolean isAvailable() {
        return value != null;
    }

    /**
     * @throws NoSuchElementException if the collaborator could not be loaded
     */
    public T get() {
        if (value == null) {
            throw new NoSuchElementException(unavailableMessage());
        }
        return value;
    }

    public String reason() {
        return reason;
    }

    public String unavailableMessage() {
        return "could not load " + name + ": " + reason;
    }

    @Override
    public String toString() {
        return isAvailable() ? name : name + " (unavailable: " + reason + ")";
    }
}
