package com.dataflowscope.core.hierarchy;

import com.dataflowscope.core.model.HierarchyContainer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ContainerArena}.
 */
class ContainerArenaTest {

    private final ContainerArena arena = new ContainerArena("c_");

    @Test
    void create_assignsIdsInCreationOrder() {
        int first = arena.create("first");
        int second = arena.createChild("second", first);

        assertThat(arena.id(first)).isEqualTo("c_0");
        assertThat(arena.id(second)).isEqualTo("c_1");
        assertThat(arena.children(first)).containsExactly(second);
        assertThat(arena.size()).isEqualTo(2);
    }

    @Test
    void attach_alreadyAttachedChild_throws() {
        int root = arena.create("root");
        int other = arena.create("other");
        int child = arena.createChild("child", root);

        assertThatThrownBy(() -> arena.attach(other, child))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("c_2");
    }

    @Test
    void attach_toItself_throws() {
        int slot = arena.create("loop");

        assertThatThrownBy(() -> arena.attach(slot, slot)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void collapseSingleChildChains_spine_mergesIntoTopContainer() {
        int root = arena.create("file");
        int a = arena.createChild("a", root);
        int b = arena.createChild("b", a);
        int c = arena.createChild("c", b);
        arena.bump(c);

        int merges = arena.collapseSingleChildChains(root);

        assertThat(merges).isEqualTo(2);
        assertThat(arena.resolve(c)).isEqualTo(a);
        assertThat(arena.resolve(b)).isEqualTo(a);
        assertThat(arena.directAssignments(a)).isEqualTo(1);

        HierarchyContainer tree = arena.materialize(root);
        assertThat(tree.children()).singleElement()
            .satisfies(container -> {
                assertThat(container.id()).isEqualTo("c_1");
                assertThat(container.name()).isEqualTo("a→b→c");
                assertThat(container.children()).isEmpty();
            });
    }

    @Test
    void collapseSingleChildChains_rootWithSingleChild_keepsRoot() {
        int root = arena.create("file");
        int only = arena.createChild("fn main", root);
        arena.bump(only);

        int merges = arena.collapseSingleChildChains(root);

        assertThat(merges).isZero();
        assertThat(arena.name(root)).isEqualTo("file");
        assertThat(arena.children(root)).containsExactly(only);
    }

    @Test
    void collapseSingleChildChains_containerWithOwnAssignments_isKept() {
        int root = arena.create("file");
        int function = arena.createChild("fn main", root);
        int variable = arena.createChild("counts", function);
        arena.bump(function);
        arena.bump(variable);

        int merges = arena.collapseSingleChildChains(root);

        assertThat(merges).isZero();
        assertThat(arena.resolve(variable)).isEqualTo(variable);
        assertThat(arena.materialize(root).children().get(0).children())
            .extracting(HierarchyContainer::name)
            .containsExactly("counts");
    }

    @Test
    void collapseSingleChildChains_grandchildrenAreAdopted() {
        int root = arena.create("file");
        int function = arena.createChild("fn main", root);
        int group = arena.createChild("group", function);
        int left = arena.createChild("left", group);
        int right = arena.createChild("right", group);
        arena.bump(left);
        arena.bump(right);

        arena.collapseSingleChildChains(root);

        HierarchyContainer collapsed = arena.materialize(root).children().get(0);
        assertThat(collapsed.name()).isEqualTo("fn main→group");
        assertThat(collapsed.children()).extracting(HierarchyContainer::name).containsExactly("left", "right");
        assertThat(arena.resolve(group)).isEqualTo(function);
    }
}
