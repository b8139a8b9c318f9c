package work.lcod.installer.flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * A small state machine rendered as labelled jump code.
 *
 * <p>States are emitted in declaration order. The first state is the entry; states that cannot be
 * reached from it are dropped. A label is written only for states some emitted instruction jumps
 * to, so every label is used and every jump has a target.</p>
 */
public final class ControlFlow {
    private static final Pattern LABEL = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final String labelPrefix;
    private final List<State> states;
    private final Map<String, Integer> indexByName;

    private ControlFlow(String labelPrefix, List<State> states) {
        this.labelPrefix = labelPrefix;
        this.states = List.copyOf(states);
        var index = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < this.states.size(); i++) {
            index.put(this.states.get(i).name(), i);
        }
        this.indexByName = Collections.unmodifiableMap(index);
    }

    public static Builder builder(String labelPrefix) {
        return new Builder(labelPrefix);
    }

    public String labelOf(String state) {
        return labelPrefix + state;
    }

    /** Names of the states that survive reachability pruning, in emission order. */
    public List<String> reachableStates() {
        var reachable = reachable();
        var names = new ArrayList<String>();
        for (int i = 0; i < states.size(); i++) {
            if (reachable.contains(i)) {
                names.add(states.get(i).name());
            }
        }
        return names;
    }

    public List<String> emit(String indent) {
        var reachable = reachable();
        var order = new ArrayList<Integer>();
        for (int i = 0; i < states.size(); i++) {
            if (reachable.contains(i)) {
                order.add(i);
            }
        }

        var labelled = new HashSet<String>();
        for (int pos = 0; pos < order.size(); pos++) {
            var state = states.get(order.get(pos));
            var next = pos + 1 < order.size() ? states.get(order.get(pos + 1)).name() : null;
            if (state.exit() instanceof Branch branch) {
                labelled.addAll(branch.targets());
                if (!branch.otherwise().equals(next)) {
                    labelled.add(branch.otherwise());
                }
            } else if (state.exit() instanceof Jump jump && !jump.target().equals(next)) {
                labelled.add(jump.target());
            }
        }

        var lines = new ArrayList<String>();
        var inner = indent + "  ";
        for (int pos = 0; pos < order.size(); pos++) {
            var state = states.get(order.get(pos));
            var next = pos + 1 < order.size() ? states.get(order.get(pos + 1)).name() : null;
            if (labelled.contains(state.name())) {
                lines.add(indent + labelOf(state.name()) + ":");
            }
            state.body().forEach(line -> lines.add(line.isEmpty() ? line : inner + line));
            var exit = state.exit();
            if (exit instanceof Jump jump) {
                if (!jump.target().equals(next)) {
                    lines.add(inner + "Goto " + labelOf(jump.target()));
                }
            } else if (exit instanceof Branch branch) {
                lines.add(inner + branch.render(this::labelOf));
                if (!branch.otherwise().equals(next)) {
                    lines.add(inner + "Goto " + labelOf(branch.otherwise()));
                }
            } else if (exit instanceof Stop stop) {
                stop.lines().forEach(line -> lines.add(inner + line));
            }
        }
        return lines;
    }

    private Set<Integer> reachable() {
        var seen = new HashSet<Integer>();
        if (states.isEmpty()) {
            return seen;
        }
        var pending = new ArrayDeque<Integer>();
        pending.push(0);
        while (!pending.isEmpty()) {
            int index = pending.pop();
            if (!seen.add(index)) {
                continue;
            }
            for (var successor : successors(index)) {
                pending.push(successor);
            }
        }
        return seen;
    }

    private List<Integer> successors(int index) {
        var exit = states.get(index).exit();
        var result = new ArrayList<Integer>();
        if (exit instanceof Jump jump) {
            result.add(indexByName.get(jump.target()));
        } else if (exit instanceof Branch branch) {
            branch.targets().forEach(target -> result.add(indexByName.get(target)));
            result.add(indexByName.get(branch.otherwise()));
        } else if (exit instanceof Next && index + 1 < states.size()) {
            result.add(index + 1);
        }
        return result;
    }

    /** How control leaves a state. */
    public interface Exit {}

    /** Unconditional transfer. */
    public record Jump(String target) implements Exit {}

    /**
     * A conditional instruction. Placeholders {@code {0}}, {@code {1}}, ... in the instruction are
     * replaced with the labels of {@code targets}; when no target is taken control goes to
     * {@code otherwise}.
     */
    public record Branch(String instruction, List<String> targets, String otherwise) implements Exit {
        public Branch {
            targets = List.copyOf(targets);
        }

        String render(Function<String, String> labels) {
            var rendered = instruction;
            for (int i = 0; i < targets.size(); i++) {
                rendered = rendered.replace("{" + i + "}", labels.apply(targets.get(i)));
            }
            return rendered;
        }
    }

    /** Terminal action; control does not continue. */
    public record Stop(List<String> lines) implements Exit {
        public Stop {
            lines = List.copyOf(lines);
        }
    }

    /** Falls through to the next declared state, or past the end of the flow. */
    public record Next() implements Exit {}

    public record State(String name, List<String> body, Exit exit) {
        public State {
            Objects.requireNonNull(name, "name");
            body = List.copyOf(body);
            Objects.requireNonNull(exit, "exit");
        }
    }

    public static Exit jump(String target) {
        return new Jump(target);
    }

    public static Exit branch(String instruction, String otherwise, String... targets) {
        return new Branch(instruction, List.of(targets), otherwise);
    }

    public static Exit stop(String... lines) {
        return new Stop(List.of(lines));
    }

    public static Exit next() {
        return new Next();
    }

    public static final class Builder {
        private final String labelPrefix;
        private final List<State> states = new ArrayList<>();

        private Builder(String labelPrefix) {
            this.labelPrefix = Objects.requireNonNull(labelPrefix, "labelPrefix");
        }

        public Builder state(String name, List<String> body, Exit exit) {
            states.add(new State(name, body, exit));
            return this;
        }

        public Builder state(String name, Exit exit) {
            return state(name, List.of(), exit);
        }

        public ControlFlow build() {
            var names = new HashSet<String>();
            for (var state : states) {
                if (!names.add(state.name())) {
                    throw new IllegalStateException("Duplicate state '" + state.name() + "' in flow " + labelPrefix);
                }
                if (!LABEL.matcher(labelPrefix + state.name()).matches()) {
                    throw new IllegalStateException("Invalid label: " + labelPrefix + state.name());
                }
            }
            for (var state : states) {
                for (var target : targetsOf(state.exit())) {
                    if (!names.contains(target)) {
                        throw new IllegalStateException(
                            "State '" + state.name() + "' jumps to unknown state '" + target + "' in flow " + labelPrefix
                        );
                    }
                }
            }
            return new ControlFlow(labelPrefix, states);
        }

        private static List<String> targetsOf(Exit exit) {
            if (exit instanceof Jump jump) {
                return List.of(jump.target());
            }
            if (exit instanceof Branch branch) {
                var all = new ArrayList<>(branch.targets());
                all.add(branch.otherwise());
                return all;
            }
            return List.of();
        }
    }
}
