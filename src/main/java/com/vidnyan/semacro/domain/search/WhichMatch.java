package com.vidnyan.semacro.domain.search;

import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.Rule;

/**
 * A macro that produces the requested rule, with the call that produced it.
 */
public record WhichMatch(
    MacroDefinition definition,
    MacroCall call,
    Rule matchedRule
) {

    public String name() {
        return definition.name();
    }

    /**
     * Call signature with the empty padding arguments dropped, e.g. {@code apache_read_log(ntpd_t)}.
     */
    public String signature() {
        return call.name() + "(" + String.join(", ",
                call.arguments().stream().filter(a -> !a.isEmpty()).toList()) + ")";
    }
}
