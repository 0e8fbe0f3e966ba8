package com.vidnyan.semacro.domain.graph;

import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphTest {

    private CallGraph graph;

    @BeforeEach
    void setUp() {
        graph = PolicyFixtures.catalog().callGraph();
    }

    @Test
    void callersOf_ShouldReturnDirectCallersSortedByName() {
        // Act
        List<String> callers = graph.callersOf("read_files_pattern").stream().map(CallEdge::caller).toList();

        // Assert
        assertEquals(List.of("apache_read_log", "files_read_etc_files", "kernel_read_system_state"), callers);
        assertEquals(List.of("files_pid_filetrans", "files_var_filetrans"),
                graph.callersOf("filetrans_pattern").stream().map(CallEdge::caller).toList());
    }

    @Test
    void callersOf_ShouldCarryCallerLocation() {
        CallEdge edge = graph.callersOf("files_search_var").get(0);

        assertEquals("files_read_etc_files", edge.caller());
        assertEquals("kernel/files.if", edge.location().filePath());
    }

    @Test
    void getOutgoingCalls_ShouldSkipKeywordsAndKeepBodyOrder() {
        assertEquals(List.of("read_files_pattern", "files_search_var"), callees("files_read_etc_files"));
        assertEquals(List.of("files_pid_filetrans", "manage_files_pattern"), callees("apache_manage_pid_files"));
        assertTrue(callees("search_dir_perms").isEmpty());
    }

    @Test
    void danglingReferences_ShouldRecordUndefinedNames() {
        assertEquals(Set.of("logging_search_logs"), graph.danglingReferences("apache_read_log"));
        assertEquals(Set.of("files_search_pids"), graph.danglingReferences("logging_send_syslog_msg"));
        assertEquals(Set.of("domain_type"), graph.danglingReferences("apache_content_template"));
        assertEquals(3, graph.stats().danglingReferences());
    }

    @Test
    void callersOf_ShouldExcludeSelfCalls() {
        // Arrange
        DefinitionIndex index = PolicyFixtures.catalogWith("apps/self.if", """
                interface(`self_loop',`
                	self_loop($1)
                ')
                """).index();

        // Act
        CallGraph selfGraph = CallGraph.build(index);

        // Assert
        assertEquals(1, selfGraph.getIncomingCalls("self_loop").size());
        assertTrue(selfGraph.callersOf("self_loop").isEmpty());
    }

    private List<String> callees(String name) {
        return graph.getOutgoingCalls(name).stream().map(CallEdge::callee).toList();
    }
}
