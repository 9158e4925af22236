package DFAEngine;

import DFAEngine.Model.Automaton;
import DFAEngine.Model.State;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structural and semantic comparison of states and automata.
 */
public class Equivalence {

    /**
     * Same name, and the same symbols leading to states of the same names.
     */
    public static boolean structurallyEquals(State a, State b) {
        if (!a.getName().equals(b.getName())) {
            return false;
        }
        Map<Character, State> na = a.getNeighbours();
        Map<Character, State> nb = b.getNeighbours();
        if (na.size() != nb.size()) {
            return false;
        }
        for (Map.Entry<Character, State> e : na.entrySet()) {
            State t = nb.get(e.getKey());
            if (t == null || !t.getName().equals(e.getValue().getName())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Same alphabet, initial state name, state names, edges (by target name) and accepting state names.
     */
    public static boolean structurallyEquals(Automaton a, Automaton b) {
        if (!a.getAlphabet().equals(b.getAlphabet())) {
            return false;
        }
        if (!a.getInitialState().getName().equals(b.getInitialState().getName())) {
            return false;
        }
        if (!a.getStateNames().equals(b.getStateNames())) {
            return false;
        }
        for (State s : a.getStates()) {
            if (!structurallyEquals(s, b.getState(s.getName()))) {
                return false;
            }
        }
        return Set.copyOf(a.getAcceptingStateNames()).equals(Set.copyOf(b.getAcceptingStateNames()));
    }

    /**
     * Equality of two states up to renaming of their neighbours: the same outgoing symbols, and targets that
     * coincide in a coincide in b as well (and vice versa).
     */
    public static boolean semanticEquals(State a, State b) {
        Map<Character, State> na = a.getNeighbours();
        Map<Character, State> nb = b.getNeighbours();
        if (!na.keySet().equals(nb.keySet())) {
            return false;
        }
        Map<State, State> aToB = new IdentityHashMap<>();
        Map<State, State> bToA = new IdentityHashMap<>();
        for (char c : new TreeSet<>(na.keySet())) {
            State s = na.get(c);
            State t = nb.get(c);
            State pairedWithS = aToB.putIfAbsent(s, t);
            State pairedWithT = bToA.putIfAbsent(t, s);
            if ((pairedWithS != null && pairedWithS != t) || (pairedWithT != null && pairedWithT != s)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Equality of two automata up to renaming of states. Reachable states are labelled canonically by the shortest,
     * then lexicographically smallest, word leading to them; both automata must agree on labels, acceptance and
     * edges. Unreachable states are ignored.
     */
    public static boolean semanticEquals(Automaton a, Automaton b) {
        if (!a.getAlphabet().equals(b.getAlphabet())) {
            return false;
        }
        SortedSet<Character> alphabet = a.getAlphabet();
        Map<State, String> labelsA = canonicalLabels(a.getInitialState(), alphabet);
        Map<State, String> labelsB = canonicalLabels(b.getInitialState(), alphabet);
        if (labelsA.size() != labelsB.size()) {
            return false;
        }

        Map<String, State> byLabelB = new HashMap<>();
        for (Map.Entry<State, String> e : labelsB.entrySet()) {
            byLabelB.put(e.getValue(), e.getKey());
        }

        for (Map.Entry<State, String> e : labelsA.entrySet()) {
            State s = e.getKey();
            State t = byLabelB.get(e.getValue());
            if (t == null) {
                return false;
            }
            if (a.isTerminal(s) != b.isTerminal(t)) {
                return false;
            }
            for (char c : alphabet) {
                State sNext = s.walkEdge(c);
                State tNext = t.walkEdge(c);
                if (sNext == null || tNext == null) {
                    if (sNext != tNext) {
                        return false;
                    }
                    continue;
                }
                if (!labelsA.get(sNext).equals(labelsB.get(tNext))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Breadth-first labelling: every reachable state gets the first word (in shortlex order) reaching it.
     */
    static Map<State, String> canonicalLabels(State initialState, SortedSet<Character> alphabet) {
        Map<State, String> labels = new IdentityHashMap<>();
        Deque<State> queue = new ArrayDeque<>();
        labels.put(initialState, "");
        queue.add(initialState);

        while (!queue.isEmpty()) {
            State s = queue.poll();
            String label = labels.get(s);
            for (char c : alphabet) {
                State t = s.walkEdge(c);
                if (t != null && !labels.containsKey(t)) {
                    labels.put(t, label + c);
                    queue.add(t);
                }
            }
        }
        return labels;
    }

    /**
     * Language equality over the union of both alphabets. Neither argument is modified; the comparison runs on
     * completed copies, so a missing edge and an edge into a rejecting sink are the same thing.
     */
    public static boolean languageEquals(Automaton a, Automaton b) {
        SortedSet<Character> symbols = new TreeSet<>(a.getAlphabet());
        symbols.addAll(b.getAlphabet());
        Alphabet<Character> alphabet = Alphabets.fromCollection(symbols);

        CompactDFA<Character> dfaA = CompactConversions.toCompactDFA(completeCopy(a, symbols), alphabet);
        CompactDFA<Character> dfaB = CompactConversions.toCompactDFA(completeCopy(b, symbols), alphabet);
        return Automata.testEquivalence(dfaA, dfaB, alphabet);
    }

    private static Automaton completeCopy(Automaton automaton, Set<Character> symbols) {
        Automaton result = automaton.copy();
        for (char c : symbols) {
            result.addSymbol(c);
        }
        DFATrim.complete(result);
        return result;
    }
}
