package com.parallax.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Full execution ordering of a specification's work items.
 * <p>
 * Levels partition the nodes: every node is in exactly one level and all of
 * its dependencies sit in strictly earlier levels. Level members are listed in
 * original item order.
 *
 * @param nodes    nodes in original item order
 * @param levels   execution levels, each a list of node indices
 * @param degraded true when dependency inference failed and all items were placed in one level
 */
public record DependencyGraph(
    List<WorkItemNode> nodes,
    List<List<Integer>> levels,
    boolean degraded
) implements Serializable {

    public DependencyGraph {
        nodes = List.copyOf(nodes);
        var copied = new ArrayList<List<Integer>>(levels.size());
        for (var level : levels) {
            copied.add(List.copyOf(level));
        }
        levels = List.copyOf(copied);
    }

    /**
     * A graph with every item independent and in a single level.
     */
    public static DependencyGraph singleLevel(List<String> items, boolean degraded) {
        var nodes = IntStream.range(0, items.size())
                .mapToObj(i -> new WorkItemNode(i, items.get(i), Set.of()))
                .toList();
        List<List<Integer>> levels = items.isEmpty()
                ? List.of()
                : List.of(IntStream.range(0, items.size()).boxed().toList());
        return new DependencyGraph(nodes, levels, degraded);
    }

    public int levelCount() {
        return levels.size();
    }

    public WorkItemNode node(int index) {
        return nodes.get(index);
    }

    /**
     * Level number holding the given node, or -1 when the index is unknown.
     */
    public int levelOf(int index) {
        for (int i = 0; i < levels.size(); i++) {
            if (levels.get(i).contains(index)) {
                return i;
            }
        }
        return -1;
    }
}
