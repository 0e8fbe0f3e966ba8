package com.vidnyan.semacro.domain.rule;

import com.vidnyan.semacro.domain.expansion.ExpansionEngine;
import com.vidnyan.semacro.domain.expansion.ExpansionNode;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleMergerTest {

    private static final TypeTransitionRule TRANSITION =
            TypeTransitionRule.of("a", "b", "file", "c");

    @Test
    void merge_ShouldUnionPermissionsInFirstSeenOrder() {
        // Arrange
        List<Rule> rules = List.of(
                AllowRule.allow("a", "b", "file", "read"),
                TRANSITION,
                AllowRule.allow("a", "b", "file", "open", "read"),
                AllowRule.allow("a", "b", "dir", "search"),
                new AllowRule(AllowRule.AccessKind.DONTAUDIT, "a", "b", "file", Set.of("write")),
                TRANSITION);

        // Act
        List<Rule> merged = RuleMerger.merge(rules);

        // Assert
        assertEquals(4, merged.size());
        assertEquals("allow a b:file { read open };", merged.get(0).render());
        assertEquals(TRANSITION, merged.get(1));
        assertEquals("allow a b:dir { search };", merged.get(2).render());
        assertEquals("dontaudit a b:file { write };", merged.get(3).render());
    }

    @Test
    void merge_ShouldBeIdempotent() {
        List<Rule> rules = List.of(
                AllowRule.allow("a", "b", "file", "read"),
                AllowRule.allow("a", "b", "file", "write"),
                new PolicyStatement("typeattribute a domain;"),
                new PolicyStatement("typeattribute a domain;"));

        List<Rule> once = RuleMerger.merge(rules);

        assertEquals(once, RuleMerger.merge(once));
        assertEquals(2, once.size());
    }

    @Test
    void flatten_ShouldSkipMarkersAndKeepBodyOrder() {
        // Arrange
        ExpansionEngine engine = new ExpansionEngine(PolicyFixtures.catalog().index());
        ExpansionNode tree = engine.expand(MacroCall.of("apache_read_log", "ntpd_t"));

        // Act
        List<String> rendered = RuleMerger.render(RuleMerger.mergedRules(tree));

        // Assert
        assertEquals(List.of(
                "allow ntpd_t httpd_log_t:dir { getattr search open read lock ioctl };",
                "allow ntpd_t httpd_log_t:file { getattr open read lock ioctl };"), rendered);
    }
}
