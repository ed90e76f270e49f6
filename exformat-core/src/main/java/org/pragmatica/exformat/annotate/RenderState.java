package org.pragmatica.exformat.annotate;

import java.util.HashSet;
import java.util.Set;

/**
 * Immutable state threaded through rendering.
 *
 * @param parenlessCalls     local call names rendered without argument parentheses
 * @param parenlessZeroArity render zero-argument calls without parentheses (type specs)
 */
public record RenderState(Set<String> parenlessCalls, boolean parenlessZeroArity) {
    public RenderState {
        parenlessCalls = Set.copyOf(parenlessCalls);
    }

    public static RenderState renderState(Set<String> parenlessCalls) {
        return new RenderState(parenlessCalls, false);
    }

    public boolean isParenless(String name) {
        return parenlessCalls.contains(name);
    }

    public RenderState withParenless(String name) {
        if (parenlessCalls.contains(name)) {
            return this;
        }
        var names = new HashSet<>(parenlessCalls);
        names.add(name);
        return new RenderState(names, parenlessZeroArity);
    }

    public RenderState withParenlessZeroArity() {
        return new RenderState(parenlessCalls, true);
    }
}
