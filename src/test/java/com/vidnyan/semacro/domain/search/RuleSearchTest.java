package com.vidnyan.semacro.domain.search;

import com.vidnyan.semacro.domain.UsageException;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.AllowRule;
import com.vidnyan.semacro.domain.rule.TypeTransitionRule;
import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleSearchTest {

    private RuleSearch search;

    @BeforeEach
    void setUp() {
        search = new RuleSearch(PolicyFixtures.catalog().index());
    }

    @Test
    void search_ShouldFindMacroGrantingPermission() {
        // Act
        List<WhichMatch> matches = search.search(WhichQuery.access("ntpd_t", "httpd_log_t", "read"));

        // Assert
        assertEquals(1, matches.size());
        assertEquals("apache_read_log", matches.get(0).name());
        assertEquals("apache_read_log(ntpd_t)", matches.get(0).signature());
    }

    @Test
    void search_ShouldHonourClassFilter() {
        List<WhichMatch> matches = search.search(WhichQuery.access("ntpd_t", "httpd_log_t", "read").withClass("file"));

        AllowRule rule = assertInstanceOf(AllowRule.class, matches.get(0).matchedRule());
        assertEquals("file", rule.objectClass());
    }

    @Test
    void search_ShouldRequireEveryPermission() {
        assertTrue(search.search(WhichQuery.access("ntpd_t", "httpd_log_t", "read append")).isEmpty());
        assertEquals(List.of("apache_append_log"),
                search.search(WhichQuery.access("ntpd_t", "httpd_log_t", "append"))
                        .stream().map(WhichMatch::name).toList());
    }

    @Test
    void search_ShouldFindTransitionMacro() {
        // Act
        List<WhichMatch> matches = search.search(WhichQuery.transition("ntpd_t", "var_run_t", "ntpd_var_run_t"));

        // Assert
        assertEquals(1, matches.size());
        assertEquals("files_pid_filetrans", matches.get(0).name());
        assertEquals("files_pid_filetrans(ntpd_t, ntpd_var_run_t, file)", matches.get(0).signature());
    }

    @Test
    void search_ShouldUseRequestedClassInTransitionTrials() {
        List<WhichMatch> matches = search.search(
                WhichQuery.transition("ntpd_t", "var_run_t", "ntpd_var_run_t").withClass("dir"));

        TypeTransitionRule rule = assertInstanceOf(TypeTransitionRule.class, matches.get(0).matchedRule());
        assertEquals("dir", rule.objectClass());
    }

    @Test
    void search_ShouldFilterByFilename() {
        WhichQuery query = WhichQuery.transition("ntpd_t", "var_run_t", "ntpd_var_run_t").withFilename("ntpd.pid");

        assertTrue(search.search(query).isEmpty());
    }

    @Test
    void search_ShouldReuseExpansionsWithinOneSearch() {
        WhichQuery query = WhichQuery.access("ntpd_t", "httpd_log_t", "read");
        search.search(query);
        int afterFirst = search.memoSize();

        search.search(query);

        assertEquals(afterFirst, search.memoSize());
        assertTrue(afterFirst > 0);
    }

    @Test
    void candidates_ShouldSkipLiteralDefines() {
        assertTrue(search.candidates(WhichQuery.access("a_t", "getattr", "read"))
                .stream().noneMatch(MacroDefinition::isLiteralDefine));
    }

    @Test
    void trials_ShouldDeriveArgumentsFromArity() {
        WhichQuery access = WhichQuery.access("s_t", "t_t", "read");
        WhichQuery transition = WhichQuery.transition("s_t", "p_t", "n_t").withClass("dir");

        assertEquals(List.of(List.of("s_t")), RuleSearch.trials(1, access));
        assertEquals(List.of(List.of("s_t", "t_t", "read", "")), RuleSearch.trials(4, access));
        assertEquals(List.of(
                List.of("s_t", "n_t", "dir", ""),
                List.of("s_t", "p_t", "n_t", "dir"),
                List.of("s_t", "n_t", "", ""),
                List.of("s_t", "p_t", "n_t", "")), RuleSearch.trials(4, transition));
    }

    @Test
    void query_ShouldRejectFilenameWithoutTransition() {
        UsageException e = assertThrows(UsageException.class,
                () -> WhichQuery.access("a", "b", "read").withFilename("x"));

        assertEquals("--name only applies with --transition", e.getMessage());
    }

    @Test
    void query_ShouldDescribeItself() {
        assertEquals("ntpd_t read on httpd_log_t", WhichQuery.access("ntpd_t", "httpd_log_t", "read").describe());
        assertEquals("type_transition a_t b_t -> c_t", WhichQuery.transition("a_t", "b_t", "c_t").describe());
    }
}
