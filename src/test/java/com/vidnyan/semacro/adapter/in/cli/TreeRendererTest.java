package com.vidnyan.semacro.adapter.in.cli;

import com.vidnyan.semacro.domain.expansion.ExpansionEngine;
import com.vidnyan.semacro.domain.expansion.ExpansionNode;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeRendererTest {

    private final ExpansionEngine engine = new ExpansionEngine(PolicyFixtures.catalog().index());

    @Test
    void render_ShouldDrawConnectors() {
        // Arrange
        ExpansionNode tree = engine.expand(MacroCall.of("files_pid_filetrans", "ntpd_t", "ntpd_var_run_t", "file"));

        // Act
        String rendered = new TreeRenderer(false).render(tree);

        // Assert
        assertEquals("""
                files_pid_filetrans(ntpd_t, ntpd_var_run_t, file)
                ├── allow ntpd_t var_t:dir { getattr search open };
                └── filetrans_pattern(ntpd_t, var_run_t, ntpd_var_run_t, file, )
                    ├── allow ntpd_t var_run_t:dir { open read getattr lock search ioctl add_name remove_name write };
                    └── type_transition ntpd_t var_run_t:file ntpd_var_run_t;""", rendered);
    }

    @Test
    void render_ShouldShowDepthMarkers() {
        ExpansionNode tree = engine.expand(MacroCall.of("apache_manage_pid_files", "httpd_t"), 1);

        String rendered = new TreeRenderer(false).render(tree);

        assertTrue(rendered.contains("│   └── filetrans_pattern(httpd_t, var_run_t, httpd_var_run_t, file, \"httpd.pid\") ... (max depth reached)"));
    }

    @Test
    void colored_ShouldWrapOnlyWhenEnabled() {
        assertEquals("x", new TreeRenderer(false).colored("x", TreeRenderer.BOLD));
        assertEquals(TreeRenderer.BOLD + "x" + TreeRenderer.RESET, new TreeRenderer(true).colored("x", TreeRenderer.BOLD));
    }
}
