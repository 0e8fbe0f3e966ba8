package com.vidnyan.semacro.domain.index;

import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.MacroKind;
import com.vidnyan.semacro.support.PolicyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionIndexTest {

    private DefinitionIndex index;

    @BeforeEach
    void setUp() {
        index = DefinitionIndex.of(PolicyFixtures.definitions());
    }

    @Test
    void find_ShouldReturnMatchesSortedByName() {
        // Act
        List<String> names = index.find("filetrans").map(MacroDefinition::name).toList();

        // Assert
        assertEquals(List.of("files_pid_filetrans", "files_var_filetrans", "filetrans_pattern"), names);
    }

    @Test
    void find_ShouldBeCaseSensitive() {
        assertEquals(0, index.find("FILETRANS").count());
        assertEquals(1, index.find("^kernel_").count());
    }

    @Test
    void find_ShouldRejectInvalidRegex() {
        InvalidPatternException e = assertThrows(InvalidPatternException.class, () -> index.find("files_("));

        assertEquals("files_(", e.getPattern());
        assertTrue(e.getMessage().startsWith("invalid regex 'files_('"));
    }

    @Test
    void list_ShouldFilterByCategory() {
        // Act
        List<String> kernel = index.list("kernel").map(MacroDefinition::name).toList();

        // Assert
        assertEquals(List.of("files_pid_filetrans", "files_read_etc_files", "files_search_var",
                "files_var_filetrans", "kernel_read_system_state"), kernel);
        assertEquals(22, index.list(DefinitionIndex.ALL_CATEGORIES).count());
        assertEquals(22, index.list(null).count());
        assertEquals(0, index.list("roles").count());
    }

    @Test
    void suggest_ShouldReturnContainingNamesIgnoringCase() {
        assertEquals(List.of("apache_append_log", "apache_content_template", "apache_manage_pid_files",
                "apache_read_log"), index.suggest("apache", 5));
        assertEquals(List.of("apache_append_log", "apache_read_log"), index.suggest("LOG", 2));
        assertTrue(index.suggest("", 5).isEmpty());
    }

    @Test
    void lookup_ShouldPreferFirstDefinitionAndKeepDuplicates() {
        // Arrange
        MacroDefinition first = new MacroDefinition("dup", MacroKind.INTERFACE, "a/one.if", 3, "a", "allow $1 a_t:file read;");
        MacroDefinition second = new MacroDefinition("dup", MacroKind.INTERFACE, "b/two.if", 7, "b", "allow $1 b_t:file read;");

        // Act
        DefinitionIndex duplicated = DefinitionIndex.of(List.of(first, second));

        // Assert
        assertEquals(first, duplicated.lookup("dup").orElseThrow());
        assertEquals(List.of(first, second), duplicated.duplicatesOf("dup"));
        assertEquals(1, duplicated.size());
        assertEquals(1, duplicated.stats().duplicateNames());
        assertTrue(duplicated.lookup("missing").isEmpty());
        assertTrue(duplicated.duplicatesOf("missing").isEmpty());
    }

    @Test
    void stats_ShouldCountKinds() {
        DefinitionIndex.Stats stats = index.stats();

        assertEquals(22, stats.names());
        assertEquals(9, stats.interfaces());
        assertEquals(1, stats.templates());
        assertEquals(12, stats.defines());
    }
}
