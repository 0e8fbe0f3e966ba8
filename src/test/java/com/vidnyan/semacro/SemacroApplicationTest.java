package com.vidnyan.semacro;

import com.vidnyan.semacro.adapter.in.cli.SemacroCliRunner;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SemacroApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private SemacroProperties properties;

    @Test
    void contextLoads_ShouldWireQueryServiceWithoutRunningCli() {
        assertNotNull(context.getBean(MacroQueryUseCase.class));
        assertTrue(context.getBeansOfType(SemacroCliRunner.class).isEmpty());
    }

    @Test
    void properties_ShouldBindDefaults() {
        assertEquals(List.of("/nonexistent/semacro/include"), properties.getDefaultIncludePaths());
        assertEquals(List.of(".if"), properties.getInterfaceSuffixes());
        assertEquals(List.of(".spt"), properties.getDefineSuffixes());
        assertEquals(10, properties.getDefaultDepth());
        assertEquals(5, properties.getWhichDepth());
    }
}
