package io.synphot.core.obsmode;

import io.synphot.core.error.AmbiguousObsmodeException;
import io.synphot.core.error.GraphTableException;
import io.synphot.core.error.IncompleteObsmodeException;
import io.synphot.core.error.TableReadException;
import io.synphot.core.error.UnusedKeywordException;
import io.synphot.core.model.GraphValidationReport;
import io.synphot.core.model.ResolvedModePath;
import io.synphot.core.table.DataTable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instrument wiring graph. Each row {@code (COMPNAME, KEYWORD, INNODE, OUTNODE, THCOMPNAME)}
 * is an edge from {@code INNODE} to {@code OUTNODE} taken when the mode contains
 * {@code KEYWORD} (or by default, for keyword {@code default}); the edge contributes optical
 * component {@code COMPNAME} and thermal component {@code THCOMPNAME}.
 *
 * <p>
 * Strings are lower-cased and component names equal to {@code clear} become {@code null}.
 * Keywords repeated at one node are kept as conflicts and logged; traversing such a keyword
 * fails as ambiguous. The optional {@code PRIMAREA} header keyword gives the collecting area.
 *
 * <p>
 * Immutable and safe to share once built.
 */
public final class GraphTable {

    private static final Logger LOG = LoggerFactory.getLogger(GraphTable.class);

    /** Traversal always starts here. */
    public static final int START_NODE = 1;

    static final String DEFAULT_KEYWORD = "default";

    private final String name;
    private final Double primaryArea;
    private final Map<Integer, GraphNode> nodes;

    private GraphTable(String name, Double primaryArea, Map<Integer, GraphNode> nodes) {
        this.name = name;
        this.primaryArea = primaryArea;
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    /** Builds the graph from a table with the standard graph-table columns. */
    public static GraphTable fromTable(DataTable table) {
        List<String> compnames = table.strings("COMPNAME");
        List<String> keywords = table.strings("KEYWORD");
        int[] innodes = table.ints("INNODE");
        int[] outnodes = table.ints("OUTNODE");
        List<String> thcompnames = table.strings("THCOMPNAME");

        Map<Integer, GraphNode> nodes = new TreeMap<>();
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < table.rowCount(); i++) {
            String keyword = keywords.get(i).toLowerCase(Locale.ROOT);
            Transition transition =
                    new Transition(outnodes[i], componentName(compnames.get(i)), componentName(thcompnames.get(i)));
            GraphNode node = nodes.computeIfAbsent(innodes[i], GraphNode::new);
            if (!node.add(keyword, transition)) {
                problems.add(String.format("(%d, %s, %s)", innodes[i], keyword, transition));
            }
        }
        if (!problems.isEmpty()) {
            LOG.warn(
                    "Ambiguous nodes encountered in {} (innode, keyword, (outnode, compname, thcompname)):\n{}",
                    table.source(),
                    String.join("\n", problems));
        }

        Double area = null;
        String primarea = table.keyword("PRIMAREA");
        if (primarea != null) {
            try {
                area = Double.parseDouble(primarea.trim());
            } catch (NumberFormatException e) {
                throw new TableReadException(
                        "PRIMAREA of " + table.source() + " is not numeric: '" + primarea + "'", e, table.source());
            }
        }
        LOG.debug("Loaded graph table {} ({} nodes, PRIMAREA={})", table.source(), nodes.size(), area);
        return new GraphTable(table.source(), area, nodes);
    }

    private static String componentName(String raw) {
        String lower = raw.trim().toLowerCase(Locale.ROOT);
        return lower.isEmpty() || ComponentTable.CLEAR.equals(lower) ? null : lower;
    }

    public String name() {
        return name;
    }

    /** Collecting area from the {@code PRIMAREA} header keyword, in cm². */
    public Optional<Double> primaryArea() {
        return Optional.ofNullable(primaryArea);
    }

    public Set<Integer> nodeIds() {
        return nodes.keySet();
    }

    public GraphNode node(int id) {
        return nodes.get(id);
    }

    public ResolvedModePath traverse(String obsmode) {
        return traverse(ModeKeywords.parse(obsmode));
    }

    /**
     * Walks the graph from {@link #START_NODE} while the current node has rows.
     *
     * @throws AmbiguousObsmodeException   if several keywords, or a conflicted keyword, match at
     *                                     one node
     * @throws IncompleteObsmodeException  if no keyword matches and the node has no default
     * @throws UnusedKeywordException      if keywords remain after the walk
     * @throws GraphTableException         if the walk revisits more nodes than the table has
     */
    public ResolvedModePath traverse(ModeKeywords mode) {
        List<String> optical = new ArrayList<>();
        List<String> thermal = new ArrayList<>();
        Map<String, Double> parameters = new LinkedHashMap<>();
        List<ResolvedModePath.Step> steps = new ArrayList<>();
        SortedSet<String> used = new TreeSet<>();

        int current = START_NODE;
        int visited = 0;
        while (nodes.containsKey(current)) {
            if (++visited > nodes.size()) {
                throw new GraphTableException(
                        String.format("Graph table %s loops at node %d for %s", name, current, mode.obsmode()), name);
            }
            GraphNode node = nodes.get(current);
            SortedSet<String> found = new TreeSet<>(node.named().keySet());
            found.retainAll(mode.keywords());

            Transition chosen;
            String matched = null;
            if (found.size() > 1) {
                throw new AmbiguousObsmodeException("Cannot use " + found + " together", mode.obsmode());
            } else if (found.size() == 1) {
                matched = found.first();
                if (node.isConflicted(matched)) {
                    throw new AmbiguousObsmodeException(
                            String.format("Keyword '%s' has %d rows at node %d of %s",
                                    matched, node.conflicts().get(matched).size() + 1, current, name),
                            mode.obsmode());
                }
                used.add(matched);
                chosen = node.named().get(matched);
            } else {
                chosen = node.defaultTransition();
            }
            if (chosen == null) {
                throw new IncompleteObsmodeException(
                        "Legal possibilities " + new TreeSet<>(node.named().keySet()), mode.obsmode());
            }
            LOG.debug("Node {}: {} -> {}", current, matched != null ? matched : DEFAULT_KEYWORD, chosen);

            if (chosen.opticalComponent() != null) {
                optical.add(chosen.opticalComponent());
            }
            if (chosen.thermalComponent() != null) {
                thermal.add(chosen.thermalComponent());
            }
            steps.add(new ResolvedModePath.Step(chosen.opticalComponent(), chosen.thermalComponent()));
            if (matched != null && mode.parameters().containsKey(matched)) {
                Double value = mode.parameters().get(matched);
                if (chosen.opticalComponent() != null) {
                    parameters.put(chosen.opticalComponent(), value);
                }
                if (chosen.thermalComponent() != null) {
                    parameters.put(chosen.thermalComponent(), value);
                }
            }
            current = chosen.nextNode();
        }

        if (!used.containsAll(mode.keywords())) {
            SortedSet<String> unused = new TreeSet<>(mode.keywords());
            unused.removeAll(used);
            throw new UnusedKeywordException("Unused keyword(s) " + unused, mode.obsmode());
        }
        return new ResolvedModePath(mode.obsmode(), optical, thermal, parameters, steps, name);
    }

    /**
     * Depth-first walk from {@link #START_NODE} reporting nodes it never reaches and nodes that
     * lie on a cycle. Output nodes without rows of their own count as nodes.
     */
    public GraphValidationReport validate() {
        SortedSet<Integer> all = new TreeSet<>();
        for (GraphNode node : nodes.values()) {
            all.add(node.id());
            all.addAll(node.successors());
        }

        Map<Integer, Boolean> onStack = new HashMap<>();
        SortedSet<Integer> loops = new TreeSet<>();
        Deque<Iterator<Integer>> pending = new ArrayDeque<>();
        Deque<Integer> path = new ArrayDeque<>();

        onStack.put(START_NODE, true);
        path.push(START_NODE);
        pending.push(successors(START_NODE));
        while (!pending.isEmpty()) {
            Iterator<Integer> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                onStack.put(path.pop(), false);
                continue;
            }
            int child = next.next();
            Boolean state = onStack.get(child);
            if (state == null) {
                onStack.put(child, true);
                path.push(child);
                pending.push(successors(child));
            } else if (state) {
                for (int member : path) {
                    loops.add(member);
                    if (member == child) {
                        break;
                    }
                }
            }
        }

        SortedSet<Integer> unreachable = new TreeSet<>(all);
        unreachable.removeAll(onStack.keySet());
        GraphValidationReport report = new GraphValidationReport(name, unreachable, loops);
        report.messages().forEach(m -> LOG.warn("{}: {}", name, m));
        return report;
    }

    private Iterator<Integer> successors(int id) {
        GraphNode node = nodes.get(id);
        return node == null ? Collections.emptyIterator() : node.successors().iterator();
    }

    @Override
    public String toString() {
        return "GraphTable[" + name + ", " + nodes.size() + " nodes]";
    }
}
