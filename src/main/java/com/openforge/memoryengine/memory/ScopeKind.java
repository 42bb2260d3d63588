package com.openforge.memoryengine.memory;

/** Key of the per-(scope, kind) breakdown in {@link StatsSnapshot}. */
public record ScopeKind(String scope, String kind) {

    @Override
    public String toString() {
        return scope + "/" + kind;
    }
}
