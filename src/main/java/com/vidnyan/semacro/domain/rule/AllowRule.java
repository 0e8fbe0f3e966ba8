package com.vidnyan.semacro.domain.rule;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Access-vector rule: {@code allow source target:class { perms };} and its
 * dontaudit/auditallow/neverallow siblings.
 *
 * <p>Permissions keep first-seen order for rendering; equality compares them as a set.
 */
public record AllowRule(
    AccessKind kind,
    String source,
    String target,
    String objectClass,
    Set<String> permissions
) implements Rule {
    
    public enum AccessKind {
        ALLOW("allow"),
        DONTAUDIT("dontaudit"),
        AUDITALLOW("auditallow"),
        NEVERALLOW("neverallow");
        
        private final String keyword;
        
        AccessKind(String keyword) {
            this.keyword = keyword;
        }
        
        public String keyword() {
            return keyword;
        }
        
        public static AccessKind fromKeyword(String keyword) {
            for (AccessKind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("not an access-vector keyword: " + keyword);
        }
    }
    
    /**
     * Rules with equal keys are merged by unioning their permissions.
     */
    public record MergeKey(AccessKind kind, String source, String target, String objectClass) {}
    
    public AllowRule {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(objectClass, "objectClass");
        permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }
    
    public static AllowRule allow(String source, String target, String objectClass, String... permissions) {
        return new AllowRule(AccessKind.ALLOW, source, target, objectClass,
                new LinkedHashSet<>(Arrays.asList(permissions)));
    }
    
    public MergeKey mergeKey() {
        return new MergeKey(kind, source, target, objectClass);
    }
    
    /**
     * Copy of this rule with the other rule's permissions appended.
     */
    public AllowRule union(Collection<String> more) {
        Set<String> merged = new LinkedHashSet<>(permissions);
        merged.addAll(more);
        return new AllowRule(kind, source, target, objectClass, merged);
    }
    
    public boolean grantsAll(Collection<String> requested) {
        return permissions.containsAll(requested);
    }
    
    @Override
    public String render() {
        return kind.keyword() + " " + source + " " + target + ":" + objectClass
                + " { " + String.join(" ", permissions) + " };";
    }
}
