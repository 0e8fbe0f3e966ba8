package com.vidnyan.semacro.domain.expansion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationStripperTest {

    @Test
    void strip_ShouldRemoveGenRequireBlock() {
        // Arrange
        String body = "\tgen_require(`\n\t\ttype var_t;\n\t')\n\n\tallow $1 var_t:dir search_dir_perms;";

        // Act
        String stripped = DeclarationStripper.strip(body);

        // Assert
        assertFalse(stripped.contains("gen_require"));
        assertFalse(stripped.contains("type var_t"));
        assertTrue(stripped.contains("allow $1 var_t:dir search_dir_perms;"));
    }

    @Test
    void strip_ShouldRemoveRequireBraces() {
        String body = "require {\n\ttype etc_t;\n}\nallow $1 etc_t:file read;";

        assertEquals("allow $1 etc_t:file read;", DeclarationStripper.strip(body));
    }

    @Test
    void strip_ShouldLeaveUnterminatedBlockInPlace() {
        String body = "gen_require(`\n\ttype var_t;\nallow $1 var_t:dir search;";

        assertEquals(body, DeclarationStripper.strip(body));
    }
}
