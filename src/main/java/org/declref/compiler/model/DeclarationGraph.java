package org.declref.compiler.model;

import org.declref.compiler.semantics.SymbolId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Flat arena holding every declaration node of an analyzed package.
 * Parent/child relations are index links into the arena. The graph is
 * immutable once built and may be shared by any number of concurrent readers.
 */
public class DeclarationGraph {

    private final List<DeclarationNode> nodes;

    private DeclarationGraph(List<DeclarationNode> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    /**
     * Gets the node for a handle.
     *
     * @param id The node handle.
     * @return The node.
     * @throws IllegalArgumentException if the handle does not belong to this graph.
     */
    public DeclarationNode node(DeclarationId id) {
        if (id.index() < 0 || id.index() >= nodes.size()) {
            throw new IllegalArgumentException("Unknown declaration handle " + id);
        }
        return nodes.get(id.index());
    }

    /**
     * Collects the children of a node whose name equals {@code name} exactly.
     *
     * @param node The parent node.
     * @param name The identifier to match.
     * @return The matching children in declaration order, possibly empty.
     */
    public List<DeclarationNode> childrenNamed(DeclarationNode node, String name) {
        List<DeclarationNode> matches = new ArrayList<>();
        for (DeclarationId childId : node.children()) {
            DeclarationNode child = node(childId);
            if (child.name().equals(name)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /**
     * Renders the dotted path from the export root down to {@code node}, e.g. {@code Button.onClick}.
     */
    public String qualifiedName(DeclarationNode node) {
        Deque<String> parts = new ArrayDeque<>();
        DeclarationNode current = node;
        parts.push(current.name());
        while (current.parent() != null) {
            current = node(current.parent());
            parts.push(current.name());
        }
        return String.join(".", parts);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Accumulates nodes before the graph is frozen. Not thread-safe.
     */
    public static final class Builder {

        private record Pending(String name, DeclarationKind kind, SymbolId entity, DeclarationId parent,
                               List<DeclarationId> children) {
        }

        private final List<Pending> pending = new ArrayList<>();

        /**
         * Adds the root declaration of an export.
         */
        public DeclarationId addRoot(SymbolId entity, String name, DeclarationKind kind) {
            return add(entity, null, name, kind);
        }

        /**
         * Adds a declaration nested inside {@code parent}. The child inherits the parent's entity.
         */
        public DeclarationId addChild(DeclarationId parent, String name, DeclarationKind kind) {
            if (parent.index() < 0 || parent.index() >= pending.size()) {
                throw new IllegalArgumentException("Unknown parent handle " + parent);
            }
            DeclarationId id = add(pending.get(parent.index()).entity(), parent, name, kind);
            pending.get(parent.index()).children().add(id);
            return id;
        }

        private DeclarationId add(SymbolId entity, DeclarationId parent, String name, DeclarationKind kind) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Declaration name must not be empty");
            }
            DeclarationId id = new DeclarationId(pending.size());
            pending.add(new Pending(name, kind, entity, parent, new ArrayList<>()));
            return id;
        }

        public DeclarationGraph build() {
            List<DeclarationNode> nodes = new ArrayList<>(pending.size());
            for (int i = 0; i < pending.size(); i++) {
                Pending p = pending.get(i);
                nodes.add(new DeclarationNode(new DeclarationId(i), p.name(), p.kind(), p.entity(), p.parent(),
                        p.children()));
            }
            return new DeclarationGraph(nodes);
        }
    }
}
