package io.github.cyfko.truthtable.core.ast;

import io.github.cyfko.truthtable.core.api.Operator;

/**
 * A node of an {@link ExpressionTree}.
 * <p>
 * Nodes live in the arena of their tree and reference their operands by id, never by object.
 * The id is assigned at construction, strictly increasing within a tree and never reused; it
 * is the memoization key used during evaluation. Two nodes are never compared structurally:
 * structural sameness is decided on the rendered label (see {@link ExpressionTree#label(Node)}).
 * </p>
 *
 * @since 1.0.0
 */
public final class Node {

    /**
     * Shape of a node.
     */
    public enum Kind {
        VARIABLE,
        CONSTANT,
        UNARY,
        BINARY
    }

    static final int NONE = -1;

    private final int id;
    private final Kind kind;
    private final String name;
    private final boolean value;
    private final Operator operator;
    private final int left;
    private final int right;

    private Node(int id, Kind kind, String name, boolean value, Operator operator, int left, int right) {
        this.id = id;
        this.kind = kind;
        this.name = name;
        this.value = value;
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    static Node variable(int id, String name) {
        return new Node(id, Kind.VARIABLE, name, false, null, NONE, NONE);
    }

    static Node constant(int id, boolean value) {
        return new Node(id, Kind.CONSTANT, null, value, null, NONE, NONE);
    }

    static Node unary(int id, Operator operator, int operand) {
        return new Node(id, Kind.UNARY, null, false, operator, operand, NONE);
    }

    static Node binary(int id, Operator operator, int left, int right) {
        return new Node(id, Kind.BINARY, null, false, operator, left, right);
    }

    public int id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return {@code true} for variables and constants
     */
    public boolean isLeaf() {
        return kind == Kind.VARIABLE || kind == Kind.CONSTANT;
    }

    /**
     * @return the variable name, {@code null} unless this is a {@link Kind#VARIABLE} node
     */
    public String name() {
        return name;
    }

    /**
     * @return the literal, meaningful only for {@link Kind#CONSTANT} nodes
     */
    public boolean value() {
        return value;
    }

    /**
     * @return the connective, {@code null} for leaves
     */
    public Operator operator() {
        return operator;
    }

    /**
     * @return the id of the single operand of a unary node, or of the left operand of a binary node
     */
    public int left() {
        return left;
    }

    /**
     * @return the id of the right operand of a binary node, {@code -1} otherwise
     */
    public int right() {
        return right;
    }

    @Override
    public String toString() {
        return "Node[id=" + id + ", kind=" + kind + "]";
    }
}
