package com.vidnyan.semacro.domain.rule;

/**
 * A terminal policy statement produced by expansion.
 * Implemented by {@link AllowRule}, {@link TypeTransitionRule} and {@link PolicyStatement}.
 */
public interface Rule {
    
    /**
     * Policy-source text for this rule, terminated by a semicolon.
     */
    String render();
}
