package com.vidnyan.semacro.domain.rule;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code type_transition source target:class newType ["filename"];}
 */
public record TypeTransitionRule(
    String source,
    String target,
    String objectClass,
    String newType,
    String filename
) implements Rule {
    
    public TypeTransitionRule {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(objectClass, "objectClass");
        Objects.requireNonNull(newType, "newType");
        filename = filename == null || filename.isEmpty() ? null : filename;
    }
    
    public static TypeTransitionRule of(String source, String target, String objectClass, String newType) {
        return new TypeTransitionRule(source, target, objectClass, newType, null);
    }
    
    public Optional<String> optionalFilename() {
        return Optional.ofNullable(filename);
    }
    
    @Override
    public String render() {
        String base = "type_transition " + source + " " + target + ":" + objectClass + " " + newType;
        return filename == null ? base + ";" : base + " \"" + filename + "\";";
    }
}
