package org.pragmatica.bbcode.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Depth-first, pre-order traversal over a subtree, root included.
 */
public final class NodeWalker implements Iterator<Node> {
    private final Deque<Node> pending = new ArrayDeque<>();

    private NodeWalker(Node root) {
        pending.push(root);
    }

    public static Iterator<Node> preOrder(Node root) {
        return new NodeWalker(root);
    }

    @Override
    public boolean hasNext() {
        return !pending.isEmpty();
    }

    @Override
    public Node next() {
        if (pending.isEmpty()) {
            throw new NoSuchElementException();
        }
        var node = pending.pop();
        var children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
        return node;
    }
}
