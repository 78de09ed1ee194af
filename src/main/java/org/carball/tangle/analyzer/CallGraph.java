package org.carball.tangle.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.model.analysis.Diagnostic;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.unit.FunctionUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Call graph of one batch, built from RECURSIVE_CALL targets. Every unit of
 * the batch is a vertex, nested functions and lambdas included. The graph is
 * complete before any unit is scored and is discarded with the batch.
 */
@Slf4j
public class CallGraph {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();
    private final Map<String, List<String>> bySimpleName = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<PendingCall> pendingCalls = new ArrayList<>();

    private CallGraph() {
    }

    public static CallGraph build(List<FunctionUnit> units) {
        CallGraph graph = new CallGraph();
        for (FunctionUnit unit : units) {
            graph.registerAll(unit.getIdentifier(), unit.getBody());
        }
        graph.resolvePendingCalls();
        log.debug("Built call graph with {} unit(s) and {} edge(s)", graph.edges.size(), graph.edgeCount());
        return graph;
    }

    /**
     * Identifiers of every unit that sits on a cycle: a strongly connected
     * component with more than one member, or a unit that calls itself.
     */
    public Set<String> findRecursiveUnits() {
        Set<String> recursive = new LinkedHashSet<>();
        for (List<String> component : new TarjanSearch().run()) {
            if (component.size() > 1) {
                recursive.addAll(component);
            } else {
                String only = component.get(0);
                if (edges.get(only).contains(only)) {
                    recursive.add(only);
                }
            }
        }
        return recursive;
    }

    public Set<String> getUnits() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public Set<String> getCallees(String identifier) {
        return Collections.unmodifiableSet(edges.getOrDefault(identifier, Set.of()));
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private void register(String identifier) {
        if (edges.putIfAbsent(identifier, new LinkedHashSet<>()) == null) {
            bySimpleName.computeIfAbsent(NestedUnitNamer.simpleName(identifier), k -> new ArrayList<>())
                    .add(identifier);
        }
    }

    /**
     * Registers a unit and every function nested in it. Bodies are walked
     * depth first in source order, the order {@link ComplexityScorer} names
     * nested units in.
     */
    private void registerAll(String identifier, List<ConstructNode> body) {
        Deque<Branch> branches = new ArrayDeque<>();
        register(identifier);
        branches.push(new Branch(identifier, new NestedUnitNamer(identifier), body));

        while (!branches.isEmpty()) {
            Branch branch = branches.peek();
            if (!branch.nodes.hasNext()) {
                branches.pop();
                continue;
            }
            ConstructNode node = branch.nodes.next();
            if (node.getKind().isFunction()) {
                String nested = branch.namer.next(node);
                register(nested);
                branches.push(new Branch(nested, new NestedUnitNamer(nested), node.getChildren()));
                continue;
            }
            if (node.getKind() == ConstructKind.RECURSIVE_CALL) {
                pendingCalls.add(new PendingCall(branch.owner, node));
            }
            branches.push(new Branch(branch.owner, branch.namer, node.getChildren()));
        }
    }

    private void resolvePendingCalls() {
        for (PendingCall call : pendingCalls) {
            String target = call.node.getTarget();
            if (target == null || target.isBlank()) {
                edges.get(call.caller).add(call.caller);
                continue;
            }
            String resolved = resolve(target, call);
            if (resolved != null) {
                edges.get(call.caller).add(resolved);
            }
        }
        pendingCalls.clear();
    }

    private String resolve(String target, PendingCall call) {
        if (edges.containsKey(target)) {
            return target;
        }
        // Only a bare name may fall back to a unit of another owner
        List<String> candidates = target.indexOf('.') < 0
                ? bySimpleName.getOrDefault(target, List.of())
                : List.of();
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        String reason = candidates.isEmpty()
                ? String.format("Call target '%s' is not part of the batch", target)
                : String.format("Call target '%s' is ambiguous: %s", target, candidates);
        log.warn("{} (called from {} at {}); treating the call as non-recursive",
                reason, call.caller, call.node.getLocation());
        diagnostics.add(Diagnostic.warning(Diagnostic.CYCLE_DETECTION_FAILURE, reason, call.node.getLocation()));
        return null;
    }

    private int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    private static final class PendingCall {
        private final String caller;
        private final ConstructNode node;

        private PendingCall(String caller, ConstructNode node) {
            this.caller = caller;
            this.node = node;
        }
    }

    private static final class Branch {
        private final String owner;
        private final NestedUnitNamer namer;
        private final Iterator<ConstructNode> nodes;

        private Branch(String owner, NestedUnitNamer namer, List<ConstructNode> nodes) {
            this.owner = owner;
            this.namer = namer;
            this.nodes = nodes.iterator();
        }
    }

    /**
     * Tarjan's strongly connected components, iterative so deep call chains
     * cannot exhaust the stack.
     */
    private final class TarjanSearch {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter = 0;

        private List<List<String>> run() {
            for (String vertex : edges.keySet()) {
                if (!index.containsKey(vertex)) {
                    connect(vertex);
                }
            }
            return components;
        }

        private void connect(String root) {
            Deque<Frame> frames = new ArrayDeque<>();
            enter(root);
            frames.push(new Frame(root));

            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        enter(next);
                        frames.push(new Frame(next));
                    } else if (onStack.contains(next)) {
                        lowLink.merge(frame.vertex, index.get(next), Math::min);
                    }
                    continue;
                }

                frames.pop();
                if (!frames.isEmpty()) {
                    lowLink.merge(frames.peek().vertex, lowLink.get(frame.vertex), Math::min);
                }
                if (lowLink.get(frame.vertex).equals(index.get(frame.vertex))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.vertex));
                    components.add(component);
                }
            }
        }

        private void enter(String vertex) {
            index.put(vertex, counter);
            lowLink.put(vertex, counter);
            counter++;
            stack.push(vertex);
            onStack.add(vertex);
        }

        private final class Frame {
            private final String vertex;
            private final Iterator<String> successors;

            private Frame(String vertex) {
                this.vertex = vertex;
                this.successors = edges.get(vertex).iterator();
            }
        }
    }
}
