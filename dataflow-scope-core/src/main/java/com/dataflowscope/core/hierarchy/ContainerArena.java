package com.dataflowscope.core.hierarchy;

import com.dataflowscope.core.model.HierarchyContainer;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-addressed store of hierarchy containers under construction.
 *
 * <p>Containers are slots in a list; parent and child links are slot indices, so looking a
 * container up is a list access and a child can only ever have one parent. Slots may exist
 * detached from any parent, which lets builders create containers eagerly and decide later
 * which ones make it into the tree.
 *
 * <p>Container ids are {@code prefix + slot index}, so they follow creation order.
 */
final class ContainerArena {

    private static final int NO_PARENT = -1;
    private static final String COLLAPSE_SEPARATOR = "→";

    private final String idPrefix;
    private final List<Slot> slots = new ArrayList<>();

    ContainerArena(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    /**
     * Creates a detached container.
     *
     * @param name display name
     * @return slot index
     */
    int create(String name) {
        slots.add(new Slot(idPrefix + slots.size(), name));
        return slots.size() - 1;
    }

    /**
     * Creates a container as the last child of {@code parent}.
     *
     * @param name display name
     * @param parent parent slot
     * @return slot index
     */
    int createChild(String name, int parent) {
        int slot = create(name);
        attach(parent, slot);
        return slot;
    }

    /**
     * Appends a detached container to a parent's children.
     *
     * @param parent parent slot
     * @param child child slot
     * @throws IllegalStateException if the child already has a parent
     */
    void attach(int parent, int child) {
        Slot childSlot = slots.get(child);
        if (childSlot.parent != NO_PARENT) {
            throw new IllegalStateException("Container " + childSlot.id + " is already attached");
        }
        if (parent == child) {
            throw new IllegalArgumentException("Container " + childSlot.id + " cannot contain itself");
        }
        childSlot.parent = parent;
        slots.get(parent).children.add(child);
    }

    /**
     * Counts one more node assigned directly to a container.
     *
     * @param slot container slot
     */
    void bump(int slot) {
        slots.get(slot).directAssignments++;
    }

    int directAssignments(int slot) {
        return slots.get(slot).directAssignments;
    }

    String id(int slot) {
        return slots.get(slot).id;
    }

    String name(int slot) {
        return slots.get(slot).name;
    }

    List<Integer> children(int slot) {
        return List.copyOf(slots.get(slot).children);
    }

    int size() {
        return slots.size();
    }

    /**
     * Follows merges to the container that now holds a slot's assignments.
     *
     * @param slot original slot
     * @return surviving slot
     */
    int resolve(int slot) {
        int current = slot;
        while (slots.get(current).mergedInto != NO_PARENT) {
            current = slots.get(current).mergedInto;
        }
        return current;
    }

    /**
     * Collapses single-child chains below {@code root}, bottom-up.
     *
     * <p>A container other than {@code root} with exactly one child and no direct assignments
     * absorbs that child: it is renamed {@code parent→child}, takes over the child's
     * assignments and children, and the child resolves to it from then on.
     *
     * @param root slot excluded from collapsing
     * @return number of merges performed
     */
    int collapseSingleChildChains(int root) {
        return collapse(root, true);
    }

    private int collapse(int slotIndex, boolean isRoot) {
        Slot slot = slots.get(slotIndex);
        int merges = 0;
        for (int child : List.copyOf(slot.children)) {
            merges += collapse(child, false);
        }

        if (!isRoot && slot.children.size() == 1 && slot.directAssignments == 0) {
            int onlyChildIndex = slot.children.get(0);
            Slot onlyChild = slots.get(onlyChildIndex);

            slot.name = slot.name + COLLAPSE_SEPARATOR + onlyChild.name;
            slot.directAssignments += onlyChild.directAssignments;
            slot.children.clear();
            for (int grandChild : onlyChild.children) {
                slots.get(grandChild).parent = slotIndex;
                slot.children.add(grandChild);
            }

            onlyChild.children.clear();
            onlyChild.directAssignments = 0;
            onlyChild.parent = NO_PARENT;
            onlyChild.mergedInto = slotIndex;
            merges++;
        }
        return merges;
    }

    /**
     * Converts a subtree into immutable containers.
     *
     * @param slot subtree root
     * @return container tree
     */
    HierarchyContainer materialize(int slot) {
        Slot current = slots.get(slot);
        List<HierarchyContainer> children = new ArrayList<>(current.children.size());
        for (int child : current.children) {
            children.add(materialize(child));
        }
        return new HierarchyContainer(current.id, current.name, children);
    }

    private static final class Slot {
        private final String id;
        private String name;
        private int parent = NO_PARENT;
        private int mergedInto = NO_PARENT;
        private int directAssignments;
        private final List<Integer> children = new ArrayList<>();

        private Slot(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }
}
