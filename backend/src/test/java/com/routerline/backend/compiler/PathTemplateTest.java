package com.routerline.backend.compiler;

import com.routerline.backend.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PathTemplateTest {

    @Test
    void render_substitutesParameters() {
        PathTemplate t = PathTemplate.parse("firewall group address-group {name} address {value}");

        Path p = t.render("address-group.address", Map.of("name", "LAN", "value", "10.0.0.1"));

        assertEquals(List.of("firewall", "group", "address-group", "LAN", "address", "10.0.0.1"), p.tokens());
        assertEquals(Set.of("name", "value"), t.parameters());
        assertTrue(t.endsWithValue());
    }

    @Test
    void render_splitsSplatParameter() {
        PathTemplate t = PathTemplate.parse("tcp flags {value*}");

        Path p = t.render("rule.tcp.flags", Map.of("value", "syn  ack"));

        assertEquals(List.of("tcp", "flags", "syn", "ack"), p.tokens());
    }

    @Test
    void render_keepsValueWithSpacesAsOneToken() {
        Path p = PathTemplate.parse("description {value}").render("description", Map.of("value", "Office LAN"));

        assertEquals(List.of("description", "Office LAN"), p.tokens());
    }

    @Test
    void render_rejectsMissingValue() {
        PathTemplate t = PathTemplate.parse("rule {rule} action {value}");

        var e = assertThrows(ValidationException.class, () -> t.render("rule.action", Map.of("rule", "10")));
        assertEquals("Operation rule.action requires a value", e.getMessage());

        var e2 = assertThrows(ValidationException.class, () -> t.render("rule.action", Map.of("value", "accept", "rule", " ")));
        assertEquals("Operation rule.action requires 'rule'", e2.getMessage());
    }

    @Test
    void withoutTrailingValue_dropsOnlyTheValue() {
        PathTemplate t = PathTemplate.parse("rule {rule} description {value}").withoutTrailingValue();

        assertFalse(t.endsWithValue());
        assertEquals("rule {rule} description", t.pattern());
        assertEquals(List.of("rule", "5", "description"), t.render("x", Map.of("rule", "5")).tokens());
    }

    @Test
    void parse_rejectsBlankPattern() {
        assertThrows(IllegalArgumentException.class, () -> PathTemplate.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> PathTemplate.parse("a {} b"));
    }
}
