package DFAEngine;

import DFAEngine.Model.Automaton;
import DFAEngine.Model.Automaton.Edge;
import DFAEngine.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between {@link Automaton} and AutomataLib's DFAs.
 */
public class CompactConversions {

    public static CompactDFA<Character> toCompactDFA(Automaton automaton) {
        return toCompactDFA(automaton, Alphabets.fromCollection(automaton.getAlphabet()));
    }

    /**
     * Registered states come first, in registration order. States that are only referenced by edges (i.e. removed
     * from the registry but still reachable) are appended so that no transition gets lost.
     * Edges labelled with symbols outside the given alphabet are dropped.
     * @param automaton - automaton to convert, not modified
     * @param alphabet - input alphabet of the result
     * @return (partial) compact DFA
     */
    public static CompactDFA<Character> toCompactDFA(Automaton automaton, Alphabet<Character> alphabet) {
        final CompactDFA<Character> out = new CompactDFA<>(alphabet, automaton.size());
        final Map<State, Integer> ids = new IdentityHashMap<>();
        final Deque<State> pending = new ArrayDeque<>();

        for (State s : automaton.getStates()) {
            ids.put(s, out.addState(automaton.isTerminal(s)));
            pending.add(s);
        }

        while (!pending.isEmpty()) {
            State s = pending.poll();
            int source = ids.get(s);
            for (Map.Entry<Character, State> e : s.getNeighbours().entrySet()) {
                Character symbol = e.getKey();
                if (!alphabet.containsSymbol(symbol)) {
                    continue;
                }
                State t = e.getValue();
                Integer target = ids.get(t);
                if (target == null) {
                    target = out.addState(automaton.isTerminal(t));
                    ids.put(t, target);
                    pending.add(t);
                }
                out.setTransition(source, alphabet.getSymbolIndex(symbol), (int) target);
            }
        }

        out.setInitialState(ids.get(automaton.getInitialState()));
        return out;
    }

    /**
     * Build an automaton from the reachable part of a DFA. States are named by their discovery index ("0" is the
     * initial state), and the alphabet of the result is exactly the given inputs.
     * @param dfa - source DFA, may be partial
     * @param inputs - input symbols to explore
     * @return new automaton
     * @param <S> - state type of the DFA
     */
    public static <S> Automaton fromDFA(DFA<S, Character> dfa, Collection<Character> inputs) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new IllegalArgumentException("DFA has no initial state");
        }

        final Map<S, String> names = new HashMap<>();
        final List<String> stateNames = new ArrayList<>();
        final List<String> accepting = new ArrayList<>();
        final List<Edge> edges = new ArrayList<>();
        final Deque<S> queue = new ArrayDeque<>();

        names.put(init, "0");
        stateNames.add("0");
        queue.add(init);

        while (!queue.isEmpty()) {
            S s = queue.poll();
            String name = names.get(s);
            if (dfa.isAccepting(s)) {
                accepting.add(name);
            }
            for (Character c : inputs) {
                S t = dfa.getSuccessor(s, c);
                if (t == null) {
                    continue;
                }
                String targetName = names.get(t);
                if (targetName == null) {
                    targetName = String.valueOf(names.size());
                    names.put(t, targetName);
                    stateNames.add(targetName);
                    queue.add(t);
                }
                edges.add(Edge.of(name, c, targetName));
            }
        }

        return new Automaton(stateNames, inputs, "0", accepting, edges);
    }
}
