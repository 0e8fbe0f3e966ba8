package com.vidnyan.semacro.domain.expansion;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentSubstitutorTest {

    @Test
    void substitute_ShouldReplacePositionalParameters() {
        String result = ArgumentSubstitutor.substitute("allow $1 $2:file $3;", List.of("a_t", "b_t", "read"));

        assertEquals("allow a_t b_t:file read;", result);
    }

    @Test
    void substitute_ShouldUseEmptyStringForMissingArguments() {
        String result = ArgumentSubstitutor.substitute("type_transition $1 $2:$4 $3 $5;", List.of("a", "b", "c", "file"));

        assertEquals("type_transition a b:file c ;", result);
    }

    @Test
    void substitute_ShouldNotRescanReplacedText() {
        assertEquals("x $2 y", ArgumentSubstitutor.substitute("x $1 y", List.of("$2", "z")));
    }

    @Test
    void substitute_ShouldLeaveSpecialReferencesUntouched() {
        assertEquals("$0 $@ $ a", ArgumentSubstitutor.substitute("$0 $@ $ $1", List.of("a")));
    }

    @Test
    void substitute_ShouldJoinAllArgumentsForStar() {
        String result = ArgumentSubstitutor.substitute("\tfiles_pid_filetrans($*)", List.of("ntpd_t", "ntpd_var_run_t", "file"));

        assertEquals("\tfiles_pid_filetrans(ntpd_t,ntpd_var_run_t,file)", result);
    }

    @Test
    void substitute_ShouldReadMultiDigitParameters() {
        List<String> arguments = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j");

        assertEquals("j b", ArgumentSubstitutor.substitute("$10 $2", arguments));
        assertEquals("x  y", ArgumentSubstitutor.substitute("x $12 y", List.of("a")));
    }
}
