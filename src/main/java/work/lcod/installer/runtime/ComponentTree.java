package work.lcod.installer.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import work.lcod.installer.config.ComponentEntry;

/**
 * Component tree with deterministic section ids.
 *
 * <p>Ids come from one pre-order fold carrying two counters: leaves get {@code SEC_PKG_<n>},
 * described groups get {@code SEC_GROUP_<m>}. Groups without a description are transparent and
 * get no id. Building the tree twice from the same entries yields the same ids.</p>
 */
public final class ComponentTree {
    public static final String SECTION_PREFIX = "SEC_PKG_";
    public static final String GROUP_PREFIX = "SEC_GROUP_";

    private final List<Node> roots;

    private ComponentTree(List<Node> roots) {
        this.roots = List.copyOf(roots);
    }

    public static ComponentTree of(List<ComponentEntry> entries) {
        return new ComponentTree(fold(entries, 0, new Counters(0, 0)).nodes());
    }

    public enum Kind {
        SECTION,
        GROUP,
        TRANSPARENT
    }

    /**
     * @param id section or group id, empty for transparent groups
     */
    public record Node(ComponentEntry entry, Kind kind, String id, int depth, List<Node> children) {
        public Node {
            children = List.copyOf(children);
        }

        public String name() {
            return entry.name();
        }
    }

    private record Counters(int leaves, int groups) {}

    private record Folded(List<Node> nodes, Counters counters) {}

    private static Folded fold(List<ComponentEntry> entries, int depth, Counters counters) {
        var nodes = new ArrayList<Node>(entries.size());
        var current = counters;
        for (var entry : entries) {
            if (entry.isLeaf()) {
                nodes.add(new Node(entry, Kind.SECTION, SECTION_PREFIX + current.leaves(), depth, List.of()));
                current = new Counters(current.leaves() + 1, current.groups());
                continue;
            }
            var kind = Kind.TRANSPARENT;
            var id = "";
            if (!entry.description().isEmpty()) {
                kind = Kind.GROUP;
                id = GROUP_PREFIX + current.groups();
                current = new Counters(current.leaves(), current.groups() + 1);
            }
            var children = fold(entry.children(), depth + 1, current);
            current = children.counters();
            nodes.add(new Node(entry, kind, id, depth, children.nodes()));
        }
        return new Folded(nodes, current);
    }

    public List<Node> roots() {
        return roots;
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    /** Every node in pre-order. */
    public List<Node> nodes() {
        return collect(node -> true);
    }

    /** Leaf sections in pre-order. */
    public List<Node> sections() {
        return collect(node -> node.kind() == Kind.SECTION);
    }

    /** Nodes with an id and a description, in pre-order. */
    public List<Node> described() {
        return collect(node -> node.kind() != Kind.TRANSPARENT && !node.entry().description().isEmpty());
    }

    private List<Node> collect(Predicate<Node> filter) {
        var out = new ArrayList<Node>();
        walk(roots, filter, out);
        return out;
    }

    private static void walk(List<Node> nodes, Predicate<Node> filter, List<Node> out) {
        for (var node : nodes) {
            if (filter.test(node)) {
                out.add(node);
            }
            walk(node.children(), filter, out);
        }
    }
}
