package org.declref.compiler.model;

import org.declref.compiler.semantics.ModuleId;
import org.declref.compiler.semantics.SymbolId;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DeclarationGraphTest {

    private static final SymbolId SHAPE = new SymbolId(new ModuleId("index"), "Shape");

    @Test
    void childrenNamedKeepsDeclarationOrderAndExactNames() {
        DeclarationGraph.Builder builder = new DeclarationGraph.Builder();
        DeclarationId shape = builder.addRoot(SHAPE, "Shape", DeclarationKind.CLASS);
        DeclarationId first = builder.addChild(shape, "area", DeclarationKind.FUNCTION);
        builder.addChild(shape, "Area", DeclarationKind.VARIABLE);
        DeclarationId second = builder.addChild(shape, "area", DeclarationKind.VARIABLE);
        DeclarationGraph graph = builder.build();

        assertThat(graph.childrenNamed(graph.node(shape), "area"))
                .extracting(DeclarationNode::id)
                .containsExactly(first, second);
        assertThat(graph.childrenNamed(graph.node(shape), "perimeter")).isEmpty();
    }

    @Test
    void childrenInheritOwnerAndLinkToParent() {
        DeclarationGraph.Builder builder = new DeclarationGraph.Builder();
        DeclarationId shape = builder.addRoot(SHAPE, "Shape", DeclarationKind.NAMESPACE);
        DeclarationId inner = builder.addChild(shape, "Inner", DeclarationKind.CLASS);
        DeclarationId leaf = builder.addChild(inner, "size", DeclarationKind.VARIABLE);
        DeclarationGraph graph = builder.build();

        DeclarationNode leafNode = graph.node(leaf);
        assertThat(leafNode.entity()).isEqualTo(SHAPE);
        assertThat(leafNode.parent()).isEqualTo(inner);
        assertThat(leafNode.isRoot()).isFalse();
        assertThat(graph.node(shape).isRoot()).isTrue();
        assertThat(graph.qualifiedName(leafNode)).isEqualTo("Shape.Inner.size");
        assertThat(graph.size()).isEqualTo(3);
    }

    @Test
    void builtNodesAreImmutable() {
        DeclarationGraph.Builder builder = new DeclarationGraph.Builder();
        DeclarationId shape = builder.addRoot(SHAPE, "Shape", DeclarationKind.CLASS);
        builder.addChild(shape, "area", DeclarationKind.FUNCTION);
        DeclarationGraph graph = builder.build();

        builder.addChild(shape, "later", DeclarationKind.FUNCTION);

        assertThat(graph.node(shape).children()).hasSize(1);
        assertThatThrownBy(() -> graph.node(shape).children().add(new DeclarationId(9)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void foreignHandlesAreRejected() {
        DeclarationGraph graph = new DeclarationGraph.Builder().build();

        assertThatThrownBy(() -> graph.node(new DeclarationId(0))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeclarationGraph.Builder().addChild(new DeclarationId(3), "x",
                DeclarationKind.CLASS)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void selectorTagsMapToKinds() {
        assertThat(DeclarationKind.fromSelectorTag("type")).contains(DeclarationKind.TYPE_ALIAS);
        assertThat(DeclarationKind.fromSelectorTag("namespace")).contains(DeclarationKind.NAMESPACE);
        assertThat(DeclarationKind.fromSelectorTag("Class")).isEmpty();
        assertThat(DeclarationKind.fromSelectorTag("method")).isEmpty();
    }
}
