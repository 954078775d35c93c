package com.eventfilter.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eventfilter.action.Action;
import com.eventfilter.action.ActionStep;
import com.eventfilter.action.MatchingMode;
import com.eventfilter.filter.ErrorKind;
import com.eventfilter.filter.FilterException;
import com.eventfilter.filter.FilterSpec;
import com.eventfilter.filter.GroupCombinator;
import com.eventfilter.filter.PropertyDomain;
import com.eventfilter.filter.PropertyOperator;
import com.eventfilter.splice.FilterPayload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FilterSpecReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadProperty() {
        FilterSpec spec = FilterSpecReader.read(
            "{\"type\": \"person\", \"key\": \"country\", \"operator\": \"exact\", \"value\": [\"US\", \"CA\"]}");
        assertEquals(FilterSpec.Property.person("country", PropertyOperator.EXACT, List.of("US", "CA")), spec);
    }

    @Test
    void testScalarValueTypes() {
        assertEquals(42L, property("{\"key\": \"n\", \"value\": 42}").value());
        assertEquals(1.5, property("{\"key\": \"n\", \"value\": 1.5}").value());
        assertEquals(Boolean.TRUE, property("{\"key\": \"n\", \"value\": true}").value());
        assertNull(property("{\"key\": \"n\", \"operator\": \"is_set\"}").value());
    }

    @Test
    void testMissingTypeDefaultsToEvent() {
        FilterSpec.Property property = property("{\"key\": \"$browser\", \"value\": \"Chrome\"}");
        assertEquals(PropertyDomain.EVENT, property.domain());
        assertNull(property.operator());
    }

    @Test
    void testReadGroupsAndTopLevelList() {
        FilterSpec spec = FilterSpecReader.read("{\"type\": \"OR\", \"values\": ["
            + "{\"type\": \"AND\", \"values\": [{\"key\": \"a\", \"value\": 1}]},"
            + "{\"type\": \"cohort\", \"key\": \"id\", \"value\": 5}]}");
        FilterSpec.Group group = assertInstanceOf(FilterSpec.Group.class, spec);
        assertEquals(GroupCombinator.OR, group.combinator());
        assertInstanceOf(FilterSpec.Group.class, group.members().get(0));
        assertEquals(PropertyDomain.COHORT, ((FilterSpec.Property) group.members().get(1)).domain());

        FilterSpec list = FilterSpecReader.read("[{\"key\": \"a\", \"value\": 1}, {\"key\": \"b\", \"value\": 2}]");
        FilterSpec.Group listGroup = assertInstanceOf(FilterSpec.Group.class, list);
        assertEquals(GroupCombinator.AND, listGroup.combinator());
        assertEquals(2, listGroup.members().size());
    }

    @Test
    void testUnknownCombinatorIsDeferred() {
        FilterSpec.Group group = assertInstanceOf(FilterSpec.Group.class,
            FilterSpecReader.read("{\"type\": \"XOR\", \"values\": []}"));
        assertNull(group.combinator());
    }

    @Test
    void testReadActionRef() {
        FilterSpec spec = FilterSpecReader.read("{\"steps\": [{\"event\": \"$autocapture\", \"tag_name\": \"a\","
            + " \"href\": \"/x\", \"href_matching\": \"regex\", \"url\": \"/p\", \"url_matching\": \"contains\","
            + " \"properties\": [{\"key\": \"plan\", \"value\": \"pro\"}]}]}");
        FilterSpec.ActionRef ref = assertInstanceOf(FilterSpec.ActionRef.class, spec);
        ActionStep step = ref.steps().get(0);
        assertEquals("$autocapture", step.event());
        assertEquals("a", step.tagName());
        assertEquals(MatchingMode.REGEX, step.hrefMatching());
        assertEquals(MatchingMode.CONTAINS, step.urlMatching());
        assertNull(step.textMatching());
        assertInstanceOf(FilterSpec.Group.class, step.properties());
    }

    @Test
    void testReadAction() throws IOException {
        Path file = tempDir.resolve("action.json");
        Files.writeString(file, "{\"id\": 12, \"name\": \"Signed up\", \"steps\": [{\"event\": \"signup\"}, {\"event\": \"register\"}]}");
        Action action = FilterSpecReader.readAction(file);
        assertEquals(12L, action.id());
        assertEquals("Signed up", action.name());
        assertEquals(List.of(ActionStep.ofEvent("signup"), ActionStep.ofEvent("register")), action.steps());
    }

    @Test
    void testReadPayload() {
        FilterPayload payload = FilterSpecReader.readPayload(
            "{\"date_from\": \"-30d\", \"properties\": [{\"key\": \"a\", \"value\": \"b\"}]}");
        assertEquals("-30d", payload.dateFrom());
        assertNull(payload.dateTo());
        assertInstanceOf(FilterSpec.Group.class, payload.properties());

        assertTrue(FilterSpecReader.readPayload("{}").isEmpty());
        assertTrue(FilterSpecReader.readPayload("null").isEmpty());
    }

    @Test
    void testErrors() {
        assertKind(ErrorKind.UNSUPPORTED_DOMAIN, "{\"type\": \"planet\", \"key\": \"a\"}");
        assertKind(ErrorKind.UNSUPPORTED_OPERATOR, "{\"key\": \"a\", \"operator\": \"between\", \"value\": 1}");
        assertKind(ErrorKind.UNSUPPORTED_SPEC, "{\"key\": \"a\", \"value\": {\"nested\": true}}");
        assertKind(ErrorKind.UNSUPPORTED_SPEC, "{\"type\": \"AND\", \"values\": {}}");
        assertKind(ErrorKind.UNSUPPORTED_SPEC, "42");
        assertKind(ErrorKind.UNSUPPORTED_SPEC, "{not json");
        assertKind(ErrorKind.UNSUPPORTED_SPEC, "{\"steps\": [{\"event\": \"a\", \"url\": \"/\", \"url_matching\": \"fuzzy\"}]}");
    }

    @Test
    void testReadMissingFile() {
        assertThrows(IOException.class, () -> FilterSpecReader.read(tempDir.resolve("missing.json")));
    }

    private static FilterSpec.Property property(String json) {
        return assertInstanceOf(FilterSpec.Property.class, FilterSpecReader.read(json));
    }

    private static void assertKind(ErrorKind expected, String json) {
        FilterException exception = assertThrows(FilterException.class, () -> FilterSpecReader.read(json));
        assertEquals(expected, exception.getKind());
    }
}
