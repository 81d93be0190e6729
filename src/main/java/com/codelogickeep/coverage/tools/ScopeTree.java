package com.codelogickeep.coverage.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interval index over the scopes of one source file.
 * <p>
 * Scopes of one kind are either disjoint or properly nested, so the innermost scope
 * containing a line is the containing scope with the greatest start line. Lookup is a
 * binary search for the last start at or before the line followed by a backwards walk
 * to the first interval that still contains it.
 */
public class ScopeTree {

    private static final Comparator<ScopeNode> BY_START = Comparator
            .comparingInt(ScopeNode::startLine)
            .thenComparing(Comparator.comparingInt(ScopeNode::span).reversed());

    private final List<ScopeNode> all;
    private final Map<ScopeNode.Kind, List<ScopeNode>> byKind = new EnumMap<>(ScopeNode.Kind.class);

    public ScopeTree(List<ScopeNode> scopes) {
        List<ScopeNode> sorted = new ArrayList<>(scopes);
        sorted.sort(BY_START);
        this.all = Collections.unmodifiableList(sorted);
        for (ScopeNode.Kind kind : ScopeNode.Kind.values()) {
            List<ScopeNode> ofKind = new ArrayList<>();
            for (ScopeNode node : sorted) {
                if (node.kind() == kind) {
                    ofKind.add(node);
                }
            }
            byKind.put(kind, ofKind);
        }
    }

    public static ScopeTree empty() {
        return new ScopeTree(List.of());
    }

    public List<ScopeNode> scopes() {
        return all;
    }

    public List<ScopeNode> scopes(ScopeNode.Kind kind) {
        return Collections.unmodifiableList(byKind.get(kind));
    }

    /**
     * Smallest scope of the given kind containing {@code line}.
     */
    public Optional<ScopeNode> innermost(int line, ScopeNode.Kind kind) {
        List<ScopeNode> nodes = byKind.get(kind);
        int index = lastStartAtOrBefore(nodes, line);
        for (int i = index; i >= 0; i--) {
            ScopeNode node = nodes.get(i);
            if (node.contains(line)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the function whose declaration sits on {@code line}, if any.
     */
    public Optional<ScopeNode> functionDeclaredAt(int line) {
        for (ScopeNode node : byKind.get(ScopeNode.Kind.FUNCTION)) {
            if (node.declarationLine() == line) {
                return Optional.of(node);
            }
            if (node.startLine() > line) {
                break;
            }
        }
        return Optional.empty();
    }

    private static int lastStartAtOrBefore(List<ScopeNode> nodes, int line) {
        int low = 0;
        int high = nodes.size() - 1;
        int result = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (nodes.get(mid).startLine() <= line) {
                result = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return result;
    }
}
