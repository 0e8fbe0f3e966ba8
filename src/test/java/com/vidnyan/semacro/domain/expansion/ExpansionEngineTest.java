package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.AllowRule;
import com.vidnyan.semacro.domain.rule.Rule;
import com.vidnyan.semacro.domain.rule.RuleMerger;
import com.vidnyan.semacro.domain.rule.TypeTransitionRule;
import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpansionEngineTest {

    private static final String LOOPS = """
            interface(`loop_a',`
            	loop_b($1)
            ')

            interface(`loop_b',`
            	loop_a($1)
            ')

            interface(`self_loop',`
            	allow $1 self:process signal;
            	self_loop($1)
            ')
            """;

    private static final String DEPRECATED = """
            interface(`files_var_run_filetrans',`
            	files_pid_filetrans($*)
            ')
            """;

    private ExpansionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ExpansionEngine(PolicyFixtures.catalog().index());
    }

    @Test
    void expand_ShouldProduceRulesThroughNestedPattern() {
        // Arrange
        MacroCall call = MacroCall.of("files_pid_filetrans", "ntpd_t", "ntpd_var_run_t", "file");

        // Act
        ExpansionNode root = engine.expand(call);
        List<Rule> rules = RuleMerger.mergedRules(root);

        // Assert
        assertEquals(ExpansionNode.Kind.MACRO, root.kind());
        assertEquals(0, root.depth());
        assertFalse(root.truncated());
        assertEquals(List.of(
                AllowRule.allow("ntpd_t", "var_t", "dir", "getattr", "search", "open"),
                AllowRule.allow("ntpd_t", "var_run_t", "dir",
                        "open", "read", "getattr", "lock", "search", "ioctl", "add_name", "remove_name", "write"),
                TypeTransitionRule.of("ntpd_t", "var_run_t", "file", "ntpd_var_run_t")), rules);
    }

    @Test
    void expand_ShouldPadMissingArgumentsWithEmptyStrings() {
        ExpansionNode root = engine.expand(MacroCall.of("files_pid_filetrans", "ntpd_t", "ntpd_var_run_t", "file"));

        ExpansionNode nested = root.children().get(1);

        assertEquals(ExpansionNode.Kind.MACRO, nested.kind());
        assertEquals(1, nested.depth());
        assertEquals("filetrans_pattern(ntpd_t, var_run_t, ntpd_var_run_t, file, )", nested.text());
        assertEquals(5, nested.call().arguments().size());
        assertTrue(nested.children().stream().allMatch(c -> c.isRule() && c.depth() == 2));
    }

    @Test
    void expand_ShouldKeepFilenameFromQuotedArgument() {
        ExpansionNode root = engine.expand(MacroCall.of("apache_manage_pid_files", "httpd_t"));

        TypeTransitionRule transition = RuleMerger.mergedRules(root).stream()
                .filter(TypeTransitionRule.class::isInstance)
                .map(TypeTransitionRule.class::cast)
                .findFirst()
                .orElseThrow();

        assertEquals("httpd_var_run_t", transition.newType());
        assertEquals("httpd.pid", transition.filename());
    }

    @Test
    void expand_ShouldMarkUnresolvedCalls() {
        // Act
        ExpansionNode root = engine.expand(MacroCall.of("apache_read_log", "ntpd_t"));

        // Assert
        ExpansionNode first = root.children().get(0);
        assertEquals(ExpansionNode.Kind.UNRESOLVED, first.kind());
        assertEquals("logging_search_logs(ntpd_t)", first.text());
        assertEquals(1, first.depth());
        assertTrue(first.children().isEmpty());
    }

    @Test
    void expand_ShouldReturnUnresolvedRootForUnknownMacro() {
        ExpansionNode root = engine.expand(MacroCall.of("nonexistent_macro", "a"));

        assertEquals(ExpansionNode.Kind.UNRESOLVED, root.kind());
        assertTrue(RuleMerger.flatten(root).isEmpty());
    }

    @Test
    void expand_ShouldTruncateAtMaxDepth() {
        // Act
        ExpansionNode root = engine.expand(MacroCall.of("apache_manage_pid_files", "httpd_t"), 1);

        // Assert
        ExpansionNode filetrans = root.children().get(0);
        assertEquals("files_pid_filetrans", filetrans.call().name());
        assertTrue(filetrans.truncated());
        ExpansionNode marker = filetrans.children().stream()
                .filter(c -> c.kind() == ExpansionNode.Kind.DEPTH_LIMIT)
                .findFirst()
                .orElseThrow();
        assertEquals("filetrans_pattern", marker.call().name());
        assertTrue(marker.text().endsWith("... (max depth reached)"));
        assertTrue(root.walk().allMatch(n -> n.depth() <= 2));
    }

    @Test
    void expand_ShouldTruncateRootAtDepthZero() {
        ExpansionNode root = engine.expand(MacroCall.of("apache_manage_pid_files", "httpd_t"), 0);

        assertTrue(root.truncated());
        assertTrue(root.children().stream().allMatch(c -> c.kind() == ExpansionNode.Kind.DEPTH_LIMIT));
    }

    @Test
    void expand_ShouldNotShrinkAsDepthGrows() {
        MacroCall call = MacroCall.of("apache_manage_pid_files", "httpd_t");

        for (int depth = 0; depth < 5; depth++) {
            assertTrue(engine.expand(call, depth).walk().count() <= engine.expand(call, depth + 1).walk().count(),
                    "depth " + depth);
        }
    }

    @Test
    void expand_ShouldBeDeterministic() {
        MacroCall call = MacroCall.of("files_read_etc_files", "ntpd_t");

        assertEquals(engine.expand(call), engine.expand(call));
    }

    @Test
    void expand_ShouldStopMutualRecursion() {
        // Arrange
        DefinitionIndex index = PolicyFixtures.catalogWith("apps/loops.if", LOOPS).index();
        ExpansionEngine loopEngine = new ExpansionEngine(index);

        // Act
        ExpansionNode root = loopEngine.expand(MacroCall.of("loop_a", "x_t"));

        // Assert
        ExpansionNode b = root.children().get(0);
        assertEquals("loop_b", b.call().name());
        ExpansionNode cycle = b.children().get(0);
        assertEquals(ExpansionNode.Kind.CYCLE, cycle.kind());
        assertEquals(2, cycle.depth());
        assertEquals("loop_a(x_t) ... (recursive call)", cycle.text());
    }

    @Test
    void expand_ShouldStopSelfRecursionAndKeepRules() {
        ExpansionEngine loopEngine = new ExpansionEngine(PolicyFixtures.catalogWith("apps/loops.if", LOOPS).index());

        ExpansionNode root = loopEngine.expand(MacroCall.of("self_loop", "x_t"));

        assertEquals(2, root.children().size());
        assertTrue(root.children().get(0).isRule());
        assertEquals(ExpansionNode.Kind.CYCLE, root.children().get(1).kind());
        assertEquals(List.of("allow x_t self:process { signal };"), RuleMerger.render(RuleMerger.mergedRules(root)));
    }

    @Test
    void expand_ShouldRejectNegativeDepth() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.expand(MacroCall.of("files_search_var", "a"), -1));
    }

    @Test
    void effectiveBody_ShouldKeepReferencesWhenCalledWithoutArguments() {
        MacroDefinition definition = PolicyFixtures.catalog().index().lookup("files_search_var").orElseThrow();

        String raw = ExpansionEngine.effectiveBody(definition, MacroCall.of("files_search_var"));
        String substituted = ExpansionEngine.effectiveBody(definition, MacroCall.of("files_search_var", "ntpd_t"));

        assertTrue(raw.contains("allow $1 var_t:dir search_dir_perms;"));
        assertFalse(raw.contains("gen_require"));
        assertTrue(substituted.contains("allow ntpd_t var_t:dir search_dir_perms;"));
    }

    @Test
    void expand_ShouldForwardAllArgumentsThroughWrapperInterface() {
        // Arrange
        ExpansionEngine wrapperEngine = new ExpansionEngine(
                PolicyFixtures.catalogWith("system/deprecated.if", DEPRECATED).index());

        // Act
        ExpansionNode root = wrapperEngine.expand(
                MacroCall.of("files_var_run_filetrans", "ntpd_t", "ntpd_var_run_t", "file"));
        List<Rule> rules = RuleMerger.mergedRules(root);

        // Assert
        ExpansionNode forwarded = root.children().stream()
                .filter(c -> c.kind() == ExpansionNode.Kind.MACRO)
                .findFirst()
                .orElseThrow();
        assertEquals("files_pid_filetrans(ntpd_t, ntpd_var_run_t, file)", forwarded.text());
        assertTrue(rules.contains(AllowRule.allow("ntpd_t", "var_t", "dir", "getattr", "search", "open")));
        assertTrue(rules.contains(TypeTransitionRule.of("ntpd_t", "var_run_t", "file", "ntpd_var_run_t")));
        assertTrue(rules.stream().noneMatch(r -> r.render().contains("$*")));
    }
}
