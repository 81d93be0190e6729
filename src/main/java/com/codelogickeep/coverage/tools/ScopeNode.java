package com.codelogickeep.coverage.tools;

import java.util.List;

/**
 * A class-like or callable scope spanning {@code [startLine, endLine]}.
 *
 * @param declarationLine line holding the declared name, which is where the signature starts
 * @param parameters      parameter names, empty for types
 */
public record ScopeNode(
        int startLine,
        int endLine,
        Kind kind,
        String name,
        int declarationLine,
        List<String> parameters
) {

    public enum Kind {
        CLASS,
        FUNCTION
    }

    public ScopeNode {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean contains(int line) {
        return startLine <= line && line <= endLine;
    }

    public int span() {
        return endLine - startLine;
    }
}
