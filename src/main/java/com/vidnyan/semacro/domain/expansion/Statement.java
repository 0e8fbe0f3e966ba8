package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.domain.model.MacroCall;

import java.util.Objects;

/**
 * One logical statement of a macro body, tagged by what it does.
 */
public record Statement(
    Kind kind,
    String text,
    MacroCall call
) {
    
    public enum Kind {
        CALL,               // name(args) or a bare macro name
        ALLOW_RULE,         // allow / dontaudit / auditallow / neverallow
        TRANSITION_RULE,    // type_transition
        DECLARATION_BLOCK,  // gen_require / require, grants nothing
        POLICY_STATEMENT,   // any other statement terminated by ';'
        PLAIN_TEXT          // comments, blank lines, conditional wrappers
    }
    
    public Statement {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (kind == Kind.CALL) {
            Objects.requireNonNull(call, "call");
        }
    }
    
    public static Statement call(String text, MacroCall call) {
        return new Statement(Kind.CALL, text, call);
    }
    
    public static Statement of(Kind kind, String text) {
        return new Statement(kind, text, null);
    }
    
    /**
     * True for statements that end up as rule leaves.
     */
    public boolean isRule() {
        return kind == Kind.ALLOW_RULE || kind == Kind.TRANSITION_RULE || kind == Kind.POLICY_STATEMENT;
    }
}
