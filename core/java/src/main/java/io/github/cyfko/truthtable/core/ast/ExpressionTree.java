package io.github.cyfko.truthtable.core.ast;

import java.util.Collections;
import java.util.List;

/**
 * Arena holding the nodes of one parsed expression.
 * <p>
 * Nodes are stored at the index equal to their id. Since the tree is built from a postfix
 * sequence, every operand has a smaller id than the node that consumes it, and ascending id
 * order is a post-order traversal (operands first, left before right). The root has the
 * largest id.
 * </p>
 *
 * <p>
 * Canonical labels are computed once, bottom-up, when the tree is created:
 * </p>
 * <ul>
 *   <li>variables render as their name, constants as {@code T} or {@code F}</li>
 *   <li>binary nodes render fully parenthesized: {@code (a & b)}</li>
 *   <li>NOT renders as {@code !x} over a leaf, and as {@code !(inner)} over a combinator,
 *       where a binary operand brings its own parentheses</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared across threads.</p>
 *
 * @since 1.0.0
 */
public final class ExpressionTree {

    private final List<Node> nodes;
    private final String[] labels;

    ExpressionTree(List<Node> nodes) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("An expression tree requires at least one node");
        }
        this.nodes = Collections.unmodifiableList(nodes);
        this.labels = new String[nodes.size()];
        for (Node node : nodes) {
            labels[node.id()] = render(node);
        }
    }

    public Node root() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * @param id a node id of this tree
     * @return the node with that id
     * @throws IndexOutOfBoundsException if the id does not belong to this tree
     */
    public Node node(int id) {
        return nodes.get(id);
    }

    /**
     * @return all nodes in ascending id order, i.e. in post-order
     */
    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @param node a node of this tree
     * @return the canonical rendering of the sub-expression rooted at {@code node}
     */
    public String label(Node node) {
        return labels[node.id()];
    }

    /**
     * @return the canonical rendering of the whole expression
     */
    public String label() {
        return label(root());
    }

    private String render(Node node) {
        return switch (node.kind()) {
            case VARIABLE -> node.name();
            case CONSTANT -> node.value() ? "T" : "F";
            case UNARY -> {
                Node operand = nodes.get(node.left());
                String inner = labels[operand.id()];
                if (operand.isLeaf() || operand.kind() == Node.Kind.BINARY) {
                    yield node.operator().getLabel() + inner;
                }
                yield node.operator().getLabel() + "(" + inner + ")";
            }
            case BINARY -> "(" + labels[node.left()] + " " + node.operator().getLabel() + " " + labels[node.right()] + ")";
        };
    }

    @Override
    public String toString() {
        return label();
    }
}
