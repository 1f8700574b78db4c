package io.synphot.core.obsmode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All rows of a graph table that share one input node: an optional default transition and the
 * keyword-named transitions. A keyword that appears on more than one row keeps its first row;
 * the others are recorded as conflicts.
 */
public final class GraphNode {

    private final int id;
    private Transition defaultTransition;
    private final Map<String, Transition> named = new LinkedHashMap<>();
    private final Map<String, List<Transition>> conflicts = new LinkedHashMap<>();

    GraphNode(int id) {
        this.id = id;
    }

    /** @return {@code false} if a row for {@code keyword} already existed */
    boolean add(String keyword, Transition transition) {
        if (GraphTable.DEFAULT_KEYWORD.equals(keyword)) {
            if (defaultTransition == null) {
                defaultTransition = transition;
                return true;
            }
        } else if (!named.containsKey(keyword)) {
            named.put(keyword, transition);
            return true;
        }
        conflicts.computeIfAbsent(keyword, k -> new ArrayList<>()).add(transition);
        return false;
    }

    public int id() {
        return id;
    }

    /** The default transition, or {@code null} when the node has none ("no successor"). */
    public Transition defaultTransition() {
        return defaultTransition;
    }

    public Map<String, Transition> named() {
        return Collections.unmodifiableMap(named);
    }

    public boolean isConflicted(String keyword) {
        return conflicts.containsKey(keyword);
    }

    public Map<String, List<Transition>> conflicts() {
        return Collections.unmodifiableMap(conflicts);
    }

    /** Ids of all nodes this node has an edge to, conflicting rows included. */
    public Set<Integer> successors() {
        Set<Integer> ids = new LinkedHashSet<>();
        if (defaultTransition != null) {
            ids.add(defaultTransition.nextNode());
        }
        named.values().forEach(t -> ids.add(t.nextNode()));
        conflicts.values().forEach(list -> list.forEach(t -> ids.add(t.nextNode())));
        return ids;
    }

    @Override
    public String toString() {
        return "GraphNode[" + id + ", default=" + defaultTransition + ", named=" + named + "]";
    }
}
