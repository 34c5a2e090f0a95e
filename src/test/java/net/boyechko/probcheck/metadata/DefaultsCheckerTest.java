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

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.probcheck.issue.IssueList;
import net.boyechko.probcheck.issue.IssueLoc;
import net.boyechko.probcheck.issue.IssueSev;
import net.boyechko.probcheck.issue.IssueType;
import org.junit.jupiter.api.Test;

class DefaultsCheckerTest {
    private static final IssueLoc WHERE = IssueLoc.atFile("p/problem.yaml");

    private static Map<String, Object> schema() {
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("memory", 1024);
        limits.put("time_multiplier", 5);
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("name", null);
        schema.put("license", "unknown");
        schema.put("limits", limits);
        schema.put("keywords", "");
        schema.put("extra", null);
        return schema;
    }

    private static Map<String, Object> declared(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static IssueList check(Object declared) {
        return new DefaultsChecker(Set.of("limits/memory"), true)
                .checkDefaults(declared, schema(), WHERE);
    }

    @Test
    void cleanMetadataHasNoFindings() {
        assertTrue(check(declared("name", "Hello", "license", "cc by-sa")).isEmpty());
    }

    @Test
    void missingMetadataIsExactlyOneError() {
        for (Object notAMap : new Object[] {null, "just text", List.of("a", "b")}) {
            IssueList issues = check(notAMap);
            assertEquals(1, issues.size());
            assertEquals(IssueType.MISSING_METADATA, issues.get(0).type());
            assertEquals(IssueSev.ERROR, issues.get(0).severity());
            assertEquals("there is no metadata", issues.get(0).message());
            assertEquals(WHERE, issues.get(0).where());
        }
    }

    @Test
    void unknownKeyIsAnErrorAndSiblingsAreStillChecked() {
        IssueList issues =
                check(declared("bogus", declared("deep", 1), "license", "unknown", "name", "x"));

        assertEquals(
                List.of(
                        "option bogus is not in default",
                        "specifies default value for license; remove the definition"),
                issues.messages());
        assertEquals(IssueSev.ERROR, issues.get(0).severity());
        assertEquals(IssueSev.WARNING, issues.get(1).severity());
    }

    @Test
    void nestedUnknownKeyUsesSlashPath() {
        IssueList issues = check(declared("limits", declared("memroy", 2048)));

        assertEquals(List.of("option limits/memroy is not in default"), issues.messages());
    }

    @Test
    void watchListFiresEvenForNonDefaultValues() {
        IssueList issues = check(declared("limits", declared("memory", 2048)));

        assertEquals(List.of("specifying unusual metadata value limits/memory"), issues.messages());
        assertEquals(IssueType.UNUSUAL_METADATA, issues.get(0).type());
    }

    @Test
    void watchListAndDefaultValueCanBothFire() {
        IssueList issues = check(declared("limits", declared("memory", 1024)));

        assertEquals(
                List.of(
                        "specifying unusual metadata value limits/memory",
                        "specifies default value for limits/memory; remove the definition"),
                issues.messages());
    }

    @Test
    void numbersCompareByValue() {
        IssueList issues = check(declared("limits", declared("time_multiplier", 5.0)));

        assertEquals(
                List.of(
                        "specifies default value for limits/time_multiplier; remove the"
                                + " definition"),
                issues.messages());
        assertTrue(DefaultsChecker.sameValue(1024L, 1024));
        assertFalse(DefaultsChecker.sameValue(1024, "1024"));
    }

    @Test
    void emptyStringDefaultIsStillADefault() {
        assertEquals(
                List.of("specifies default value for keywords; remove the definition"),
                check(declared("keywords", "")).messages());
    }

    @Test
    void nullSchemaValueMeansFreeForm() {
        assertTrue(check(declared("extra", declared("anything", declared("goes", 1)))).isEmpty());
        assertTrue(check(declared("name", declared("en", "Hello", "sv", "Hej"))).isEmpty());
    }

    @Test
    void mapAgainstScalarDefaultIsNotExamined() {
        assertTrue(check(declared("license", declared("unknown", "unknown"))).isEmpty());
    }

    @Test
    void defaultValueWarningsCanBeTurnedOff() {
        DefaultsChecker lenient = new DefaultsChecker(Set.of("limits/memory"), false);

        IssueList issues =
                lenient.checkDefaults(
                        declared("license", "unknown", "limits", declared("memory", 1024)),
                        schema(),
                        WHERE);

        assertFalse(lenient.warnsOnDefaultValues());
        assertEquals(List.of("specifying unusual metadata value limits/memory"), issues.messages());
    }

    @Test
    void bundledSchemaDefaultsAreRecognised() {
        DefaultsChecker checker = new DefaultsChecker(Set.of(), true);
        Map<String, Object> defaults = MetadataSchema.loadDefault().defaults();

        IssueList issues =
                checker.checkDefaults(
                        declared(
                                "name", "Hello",
                                "type", "pass-fail",
                                "limits", declared("memory", 1024, "code", 64)),
                        defaults,
                        WHERE);

        assertEquals(
                List.of(
                        "specifies default value for type; remove the definition",
                        "specifies default value for limits/memory; remove the definition"),
                issues.messages());
    }
}
