package DFAEngine;

import DFAEngine.Model.Automaton;
import DFAEngine.Model.State;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completion and reachability reductions. All operations work in place.
 */
public class DFATrim {
    public static final String JUNKYARD = "junkyard";

    /**
     * Totalize the transition function: every missing (state, symbol) edge is sent to a non-accepting sink state,
     * which loops on every symbol. The sink is only created if at least one edge is missing. Dangling states are
     * registered first, see {@link #registerDanglingStates(Automaton)}.
     * @param automaton - automaton to complete
     */
    public static void complete(Automaton automaton) {
        registerDanglingStates(automaton);
        State junkyard = null;

        for (State s : new ArrayList<>(automaton.getStates())) {
            for (char c : automaton.getAlphabet()) {
                if (s.walkEdge(c) == null) {
                    if (junkyard == null) {
                        junkyard = junkyard(automaton);
                    }
                    automaton.addEdge(s, c, junkyard);
                }
            }
        }

        if (junkyard != null) {
            // nothing escapes the junkyard
            for (char c : automaton.getAlphabet()) {
                if (junkyard.walkEdge(c) == null) {
                    automaton.addEdge(junkyard, c, junkyard);
                }
            }
        }
    }

    /**
     * Register the states that are still reachable through edges but were removed from the registry. A dangling
     * state whose name has since been given to another state is replaced by a fresh state under a free name, and
     * the edges into it are redirected. Dangling states are never accepting, so the language is unchanged.
     * @param automaton - automaton to repair
     */
    public static void registerDanglingStates(Automaton automaton) {
        final Map<State, State> replacements = new IdentityHashMap<>();

        for (State s : knownStates(automaton)) {
            if (!automaton.containsState(s.getName())) {
                automaton.addState(s);
            } else if (automaton.getState(s.getName()) != s) {
                replacements.put(s, automaton.addState(freeName(automaton, s.getName())));
            }
        }
        if (replacements.isEmpty()) {
            return;
        }

        for (Map.Entry<State, State> r : replacements.entrySet()) {
            for (Map.Entry<Character, State> e : r.getKey().getNeighbours().entrySet()) {
                automaton.addEdge(r.getValue(), e.getKey(), e.getValue());
            }
        }
        for (State s : new ArrayList<>(automaton.getStates())) {
            for (char c : automaton.getAlphabet()) {
                State target = replacements.get(s.walkEdge(c));
                if (target != null) {
                    automaton.addEdge(s, c, target);
                }
            }
        }
    }

    private static String freeName(Automaton automaton, String name) {
        int i = 1;
        while (automaton.containsState(name + i)) {
            i++;
        }
        return name + i;
    }

    // reuse a registered junkyard if it is still a sink, otherwise pick a free name
    private static State junkyard(Automaton automaton) {
        String name = JUNKYARD;
        for (int i = 1; automaton.containsState(name); i++) {
            State existing = automaton.getState(name);
            if (isSink(automaton, existing)) {
                return existing;
            }
            name = JUNKYARD + i;
        }
        return automaton.addState(name);
    }

    private static boolean isSink(Automaton automaton, State s) {
        if (automaton.isTerminal(s)) {
            return false;
        }
        for (State t : s.getNeighbours().values()) {
            if (t != s) {
                return false;
            }
        }
        return true;
    }

    /**
     * Remove all states that cannot be reached from the initial state.
     * Edges of surviving states are left untouched.
     * @param automaton - automaton to reduce
     */
    public static void reduceNonAccessibleStates(Automaton automaton) {
        final Set<State> reachable = accessibleStates(automaton);

        for (State s : new ArrayList<>(automaton.getStates())) {
            if (!reachable.contains(s)) {
                automaton.removeState(s);
            }
        }
    }

    /**
     * Breadth-first search from the initial state over the (sorted) alphabet.
     * @return reachable states in discovery order
     */
    public static Set<State> accessibleStates(Automaton automaton) {
        final Set<State> reachable = new LinkedHashSet<>();
        final Deque<State> queue = new ArrayDeque<>();

        reachable.add(automaton.getInitialState());
        queue.add(automaton.getInitialState());

        while (!queue.isEmpty()) {
            State s = queue.poll();
            for (char c : automaton.getAlphabet()) {
                State t = Automaton.walkEdge(s, c);
                if (t != null && reachable.add(t)) {
                    queue.add(t);
                }
            }
        }
        return reachable;
    }

    /**
     * Backward breadth-first search from the accepting states.
     * @return states from which some accepting state can be reached
     */
    public static Set<State> coaccessibleStates(Automaton automaton) {
        final Map<State, List<State>> predecessors = new HashMap<>();
        for (State s : knownStates(automaton)) {
            for (char c : automaton.getAlphabet()) {
                State t = s.walkEdge(c);
                if (t != null) {
                    predecessors.computeIfAbsent(t, k -> new ArrayList<>()).add(s);
                }
            }
        }

        final Set<State> result = new HashSet<>();
        final Deque<State> queue = new ArrayDeque<>(automaton.getAcceptingStates());
        result.addAll(queue);

        while (!queue.isEmpty()) {
            State s = queue.poll();
            for (State p : predecessors.getOrDefault(s, List.of())) {
                if (result.add(p)) {
                    queue.add(p);
                }
            }
        }
        return result;
    }

    /**
     * @return registered states, the initial state, and everything reachable from them through edges, dangling
     * states included
     */
    static Set<State> knownStates(Automaton automaton) {
        final Set<State> known = new LinkedHashSet<>(automaton.getStates());
        known.add(automaton.getInitialState());
        final Deque<State> pending = new ArrayDeque<>(known);

        while (!pending.isEmpty()) {
            State s = pending.poll();
            for (State t : s.getNeighbours().values()) {
                if (known.add(t)) {
                    pending.add(t);
                }
            }
        }
        return known;
    }
}
