package com.vidnyan.semacro.domain.graph;

import com.vidnyan.semacro.domain.model.Location;

/**
 * Represents an edge in the macro call graph: {@code caller} textually invokes {@code callee}.
 * Immutable value object.
 */
public record CallEdge(
    String caller,
    String callee,
    Location location
) {

    public boolean isSelfCall() {
        return caller.equals(callee);
    }

    /**
     * Builder for CallEdge.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String caller;
        private String callee;
        private Location location;

        public Builder caller(String name) { this.caller = name; return this; }
        public Builder callee(String name) { this.callee = name; return this; }
        public Builder location(Location loc) { this.location = loc; return this; }

        public CallEdge build() {
            return new CallEdge(caller, callee, location);
        }
    }
}
