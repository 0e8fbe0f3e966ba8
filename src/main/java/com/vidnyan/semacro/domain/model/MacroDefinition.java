package com.vidnyan.semacro.domain.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A parsed macro definition (interface, template, or define).
 * Immutable value object created once while the catalog is loaded.
 */
public record MacroDefinition(
    String name,
    MacroKind kind,
    String sourcePath,
    int lineNumber,
    String category,
    String body
) {
    
    private static final Pattern POSITIONAL = Pattern.compile("\\$(\\d+)");
    private static final Pattern PARAMETER = Pattern.compile("\\$([1-9]|\\*)");
    
    public MacroDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        sourcePath = sourcePath == null ? "" : sourcePath;
        category = category == null ? "" : category;
        body = body == null ? "" : body;
    }
    
    public Location location() {
        return Location.at(sourcePath, lineNumber);
    }
    
    /**
     * True when the body references a positional parameter or {@code $*}.
     */
    public boolean isParameterized() {
        return PARAMETER.matcher(body).find();
    }
    
    /**
     * A define without positional parameters, e.g. a permission set such as
     * {@code read_file_perms}. These are spliced inline during expansion.
     */
    public boolean isLiteralDefine() {
        return kind == MacroKind.DEFINE && !isParameterized();
    }
    
    /**
     * Highest {@code $N} referenced by the body.
     */
    public int arity() {
        var matcher = POSITIONAL.matcher(body);
        int max = 0;
        while (matcher.find()) {
            String digits = matcher.group(1);
            if (digits.length() <= 3) {
                max = Math.max(max, Integer.parseInt(digits));
            }
        }
        return max;
    }
    
    /**
     * Render the definition the way it appears in the policy sources.
     */
    public String displayText(String renderedBody) {
        return kind.keyword() + "(`" + name + "',`\n" + renderedBody + "\n')";
    }
}
