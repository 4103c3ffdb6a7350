package org.tesis.floorplan;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Recorridos iterativos sobre una pila explícita. La profundidad del árbol no consume pila de Java,
 * así que un postorden casi lineal de muchos nodos no desborda.
 */
final class SliceTraversal {

    private SliceTraversal() {}

    @FunctionalInterface
    interface Visitor {
        void visit(SliceNode node);
    }

    // self, left, right
    static void preorder(SliceNode root, Visitor visitor) {
        if (root == null) return;
        Deque<SliceNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SliceNode n = stack.pop();
            visitor.visit(n);
            if (n instanceof CutNode c) {
                stack.push(c.right);
                stack.push(c.left);
            }
        }
    }

    // left, right, self
    static void postorder(SliceNode root, Visitor visitor) {
        if (root == null) return;
        Deque<SliceNode> stack = new ArrayDeque<>();
        SliceNode lastVisited = null;
        SliceNode node = root;
        while (!stack.isEmpty() || node != null) {
            if (node != null) {
                stack.push(node);
                node = (node instanceof CutNode c) ? c.left : null;
            } else {
                SliceNode peek = stack.peek();
                if (peek instanceof CutNode c && lastVisited != c.right) {
                    node = c.right;
                } else {
                    visitor.visit(peek);
                    lastVisited = stack.pop();
                }
            }
        }
    }
}
