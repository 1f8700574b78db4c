package io.synphot.core.lang;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Syntax tree node. Structure ({@code kind}, {@code attr}, {@code children}) is fixed by the
 * parser; {@code value} and {@code displayText} are filled in once by the {@link Interpreter}.
 */
public final class AstNode {

    private final NodeKind kind;
    private final String attr;
    private final List<AstNode> children;
    private Value value;
    private String displayText;

    AstNode(NodeKind kind, String attr, List<AstNode> children) {
        this.kind = kind;
        this.attr = attr;
        this.children = List.copyOf(children);
    }

    static AstNode terminal(NodeKind kind, String text) {
        return new AstNode(kind, text, List.of());
    }

    public NodeKind kind() {
        return kind;
    }

    /** Operator, sign, function name or lexeme, depending on the kind. */
    public String attr() {
        return attr;
    }

    public List<AstNode> children() {
        return children;
    }

    public AstNode child(int index) {
        return children.get(index);
    }

    /** Interpreted value, or {@code null} before interpretation. */
    public Value value() {
        return value;
    }

    /**
     * Source-like text for simple constructs (terminals, argument lists of terminals, groups);
     * {@code null} elsewhere. {@code band} reads its keyword list from here.
     */
    public String displayText() {
        return displayText;
    }

    void assign(Value value, String displayText) {
        if (this.value != null) {
            throw new IllegalStateException("Node already interpreted: " + this);
        }
        this.value = value;
        this.displayText = displayText;
    }

    /** Re-creates expression text from the tree; re-scanning it yields the same tree. */
    public String render() {
        return switch (kind) {
            case EXPR, TERM -> child(0).render() + " " + attr + " " + child(1).render();
            case FACTOR -> attr + child(0).render();
            case GROUP -> "(" + child(0).render() + ")";
            case FUNCTION_CALL -> attr + "(" + child(1).render() + ")";
            case ARGLIST -> children.stream().map(AstNode::render).collect(Collectors.joining(","));
            case FILELIST -> "@" + attr;
            case INTEGER, FLOAT, IDENTIFIER -> attr;
        };
    }

    @Override
    public String toString() {
        if (kind.isTerminal()) {
            return kind + "(" + attr + ")";
        }
        return kind + (attr != null ? "[" + attr + "]" : "") + children;
    }
}
