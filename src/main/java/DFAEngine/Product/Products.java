package DFAEngine.Product;

import DFAEngine.DFATrim;
import DFAEngine.Model.Automaton;
import DFAEngine.Model.Automaton.Edge;
import DFAEngine.Model.State;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Synchronized products of two automata. Intersection, union and concatenation are all instances of
 * {@link #zip(Automaton, Automaton, Set, State, boolean, ProductAcceptance)}.
 * <p>
 * Both arguments are modified: their alphabets are joined and they are completed. Neither change alters the
 * language they accept.
 */
public class Products {
    public static boolean DEBUG = false;

    public static Automaton intersection(Automaton a, Automaton b) {
        return zip(a, b, Set.of(), b.getInitialState(), true, ProductAcceptance.intersection());
    }

    public static Automaton union(Automaton a, Automaton b) {
        return zip(a, b, Set.of(), b.getInitialState(), true, ProductAcceptance.union());
    }

    /**
     * Words made of an a-word followed by a b-word: every time the run of a reaches an accepting state, a fresh run
     * of b is started.
     */
    public static Automaton concatenation(Automaton a, Automaton b) {
        return zip(a, b, new HashSet<>(a.getAcceptingStates()), b.getInitialState(), ProductAcceptance.concatenation());
    }

    /**
     * Product whose initial configuration tracks the injected state only if the initial state of a is a trigger.
     * @see #zip(Automaton, Automaton, Set, State, boolean, ProductAcceptance)
     */
    public static Automaton zip(Automaton a, Automaton b, Set<State> triggers, State injected,
                                ProductAcceptance acceptance) {
        return zip(a, b, triggers, injected, triggers.contains(a.getInitialState()), acceptance);
    }

    /**
     * Breadth-first construction of the reachable part of a synchronized product.
     * <p>
     * A product state is the current state of a together with a set of tracked states of b. On each symbol every
     * member moves along its edge; whenever the a-member lands on a trigger state, the injected state is added to the
     * tracked set. Product states get the names "1", "2", ... in order of discovery, "1" being initial.
     * @param a - left automaton, completed in place
     * @param b - right automaton, completed in place
     * @param triggers - states of a that start tracking the injected state
     * @param injected - state of b to track
     * @param seedInjected - whether the initial product state already tracks the injected state
     * @param acceptance - decides terminality of each product state once exploration is done
     * @return the product automaton over the joint alphabet
     */
    public static Automaton zip(Automaton a, Automaton b, Set<State> triggers, State injected, boolean seedInjected,
                                ProductAcceptance acceptance) {
        joinAlphabets(a, b);
        DFATrim.complete(a);
        DFATrim.complete(b);

        final Set<State> triggerSet = new HashSet<>(triggers);
        final List<Character> alphabet = new ArrayList<>(a.getAlphabet());
        final ProductRegistry registry = new ProductRegistry();
        final Deque<ProductState> queue = new ArrayDeque<>();
        final List<Edge> edges = new ArrayList<>();

        final ProductState init = new ProductState(a.getInitialState(), seedInjected ? Set.of(injected) : Set.of());
        registry.put(init);
        queue.add(init);

        while (!queue.isEmpty()) {
            ProductState curr = queue.poll();
            String source = String.valueOf(registry.get(curr));

            for (char c : alphabet) {
                ProductState succ = successor(curr, c, triggerSet, injected);
                int target = registry.get(succ);
                if (target == ProductRegistry.MISSING_ELEMENT) {
                    target = registry.put(succ);
                    queue.add(succ);
                }
                edges.add(Edge.of(source, c, String.valueOf(target)));
            }
        }

        final List<String> names = new ArrayList<>(registry.size());
        final List<String> accepting = new ArrayList<>();
        for (ProductState s : registry.getStates()) {
            String name = String.valueOf(registry.get(s));
            names.add(name);
            if (acceptance.test(s, a, b)) {
                accepting.add(name);
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: Product explored " + registry.size() + " states, " + accepting.size() + " accepting");
        }
        return new Automaton(names, alphabet, names.get(0), accepting, edges);
    }

    private static ProductState successor(ProductState curr, char c, Set<State> triggers, State injected) {
        State left = curr.left().walkEdge(c);
        if (left == null) {
            throw new IllegalStateException("No edge from " + curr.left() + " on " + c + " after completion");
        }

        Set<State> right = new LinkedHashSet<>();
        for (State r : curr.right()) {
            State next = r.walkEdge(c);
            // a tracked run may only die on states that are no longer registered
            if (next != null) {
                right.add(next);
            }
        }
        if (triggers.contains(left)) {
            right.add(injected);
        }
        return new ProductState(left, right);
    }

    private static void joinAlphabets(Automaton a, Automaton b) {
        for (char c : b.getAlphabet()) {
            a.addSymbol(c);
        }
        for (char c : a.getAlphabet()) {
            b.addSymbol(c);
        }
    }
}
