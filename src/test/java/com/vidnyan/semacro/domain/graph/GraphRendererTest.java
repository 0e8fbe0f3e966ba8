package com.vidnyan.semacro.domain.graph;

import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GraphRendererTest {

    private final DependencyGraph graph =
            DependencyGraph.build(PolicyFixtures.catalog().callGraph(), "apache_manage_pid_files", 10);

    @Test
    void render_ShouldWriteDot() {
        String expected = """
                digraph "apache_manage_pid_files" {
                    rankdir=LR;
                    node [shape=box];
                    "apache_manage_pid_files" [style=bold];
                    "files_pid_filetrans";
                    "manage_files_pattern";
                    "filetrans_pattern";
                    "apache_manage_pid_files" -> "files_pid_filetrans";
                    "apache_manage_pid_files" -> "manage_files_pattern";
                    "files_pid_filetrans" -> "filetrans_pattern";
                }
                """;

        assertEquals(expected, GraphRenderer.render(graph, GraphFormat.DOT));
    }

    @Test
    void render_ShouldWriteMermaid() {
        String expected = """
                graph LR
                    n0["apache_manage_pid_files"]
                    n1["files_pid_filetrans"]
                    n2["manage_files_pattern"]
                    n3["filetrans_pattern"]
                    n0 --> n1
                    n0 --> n2
                    n1 --> n3
                """;

        assertEquals(expected, GraphRenderer.render(graph, GraphFormat.MERMAID));
    }

    @Test
    void render_ShouldAnnotateCycles() {
        DependencyGraph loops = DependencyGraph.build(PolicyFixtures.catalogWith("apps/loops.if", """
                interface(`loop_a',`
                	loop_b($1)
                ')
                interface(`loop_b',`
                	loop_a($1)
                ')
                """).callGraph(), "loop_a", 5);

        assertTrue(GraphRenderer.render(loops, GraphFormat.DOT).contains("    // cycle: loop_a -> loop_b -> loop_a\n"));
        assertTrue(GraphRenderer.render(loops, GraphFormat.MERMAID).contains("    %% cycle: loop_a -> loop_b -> loop_a\n"));
    }

    @Test
    void fromName_ShouldAcceptAliases() {
        assertEquals(Optional.of(GraphFormat.DOT), GraphFormat.fromName("graphviz"));
        assertEquals(Optional.of(GraphFormat.MERMAID), GraphFormat.fromName("Mermaid"));
        assertTrue(GraphFormat.fromName("svg").isEmpty());
    }
}
