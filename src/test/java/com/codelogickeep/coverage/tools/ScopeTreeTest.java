package com.codelogickeep.coverage.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTreeTest {

    private static ScopeNode function(String name, int start, int end) {
        return new ScopeNode(start, end, ScopeNode.Kind.FUNCTION, name, start, List.of());
    }

    private static ScopeNode type(String name, int start, int end) {
        return new ScopeNode(start, end, ScopeNode.Kind.CLASS, name, start, null);
    }

    private final ScopeTree tree = new ScopeTree(List.of(
            function("inner", 12, 14),
            type("Outer", 1, 40),
            function("outer", 10, 20),
            function("later", 25, 30),
            type("Nested", 22, 35)));

    @Test
    @DisplayName("scopes should be ordered by start line, wider scopes first")
    void scopes_shouldBeSortedByStart() {
        assertEquals(List.of("Outer", "outer", "inner", "Nested", "later"),
                tree.scopes().stream().map(ScopeNode::name).toList());
    }

    @Test
    @DisplayName("innermost should pick the narrowest enclosing scope")
    void innermost_shouldPickNarrowestScope() {
        assertEquals("inner", tree.innermost(13, ScopeNode.Kind.FUNCTION).orElseThrow().name());
        assertEquals("outer", tree.innermost(18, ScopeNode.Kind.FUNCTION).orElseThrow().name());
        assertEquals("later", tree.innermost(25, ScopeNode.Kind.FUNCTION).orElseThrow().name());
        assertEquals("Nested", tree.innermost(26, ScopeNode.Kind.CLASS).orElseThrow().name());
        assertEquals("Outer", tree.innermost(21, ScopeNode.Kind.CLASS).orElseThrow().name());
    }

    @Test
    @DisplayName("innermost should be empty outside every scope")
    void innermost_shouldBeEmptyOutsideScopes() {
        assertTrue(tree.innermost(22, ScopeNode.Kind.FUNCTION).isEmpty());
        assertTrue(tree.innermost(41, ScopeNode.Kind.CLASS).isEmpty());
        assertTrue(ScopeTree.empty().innermost(1, ScopeNode.Kind.CLASS).isEmpty());
    }

    @Test
    @DisplayName("functionDeclaredAt should match the declaration line only")
    void functionDeclaredAt_shouldMatchDeclarationLine() {
        assertEquals("outer", tree.functionDeclaredAt(10).orElseThrow().name());
        assertTrue(tree.functionDeclaredAt(11).isEmpty());
    }

    @Test
    @DisplayName("a null parameter list should become empty")
    void scopeNode_shouldDefaultParameters() {
        ScopeNode node = type("Outer", 1, 40);

        assertTrue(node.parameters().isEmpty());
        assertEquals(39, node.span());
        assertTrue(node.contains(40));
        assertFalse(node.contains(41));
    }
}
