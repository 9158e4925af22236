package DFAEngine;

import DFAEngine.Model.Automaton;
import DFAEngine.Model.State;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Questions about the language of an automaton: membership, complement, infiniteness.
 */
public class Languages {

    /**
     * Run a word through the automaton.
     * @param automaton - automaton, not necessarily complete
     * @param word - input word
     * @return true iff the run ends in an accepting state; false on unknown symbols or missing edges
     */
    public static boolean isAccepted(Automaton automaton, String word) {
        State s = automaton.getInitialState();
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (!automaton.getAlphabet().contains(c)) {
                return false;
            }
            s = Automaton.walkEdge(s, c);
            if (s == null) {
                return false;
            }
        }
        return automaton.isTerminal(s);
    }

    /**
     * Swap accepting and non-accepting states, in place. This only complements the language of a complete
     * automaton; see {@link DFATrim#complete(Automaton)}.
     */
    public static void complement(Automaton automaton) {
        List<State> newTerminalStates = new ArrayList<>();
        for (State s : automaton.getStates()) {
            if (!automaton.isTerminal(s)) {
                newTerminalStates.add(s);
            }
        }
        for (State s : new ArrayList<>(automaton.getAcceptingStates())) {
            automaton.removeTerminalState(s);
        }
        for (State s : newTerminalStates) {
            automaton.addTerminalState(s);
        }
    }

    /**
     * @return a new automaton accepting exactly the words over the alphabet that the argument rejects
     */
    public static Automaton complementOf(Automaton automaton) {
        Automaton result = automaton.copy();
        DFATrim.complete(result);
        complement(result);
        return result;
    }

    /**
     * Decide whether the accepted language is infinite, i.e. whether a cycle reachable from the initial state
     * can still lead to acceptance.
     * <p>
     * Iterative DFS. Only an edge back to a state on the current path closes a cycle; edges to states that were
     * already finished are ignored.
     */
    public static boolean hasLoop(Automaton automaton) {
        final Set<State> productive = DFATrim.coaccessibleStates(automaton);
        if (productive.isEmpty()) {
            return false;
        }

        final Set<State> onStack = new HashSet<>();
        final Set<State> visited = new HashSet<>();
        final Deque<Frame> stack = new ArrayDeque<>();

        State init = automaton.getInitialState();
        stack.push(new Frame(init, successors(automaton, init)));
        onStack.add(init);
        visited.add(init);

        while (!stack.isEmpty()) {
            Frame curr = stack.peek();
            if (!curr.successors().hasNext()) {
                stack.pop();
                onStack.remove(curr.state());
                continue;
            }

            State next = curr.successors().next();
            if (onStack.contains(next)) {
                // every state of the cycle reaches every other, so checking one suffices
                if (productive.contains(next)) {
                    return true;
                }
            } else if (visited.add(next)) {
                stack.push(new Frame(next, successors(automaton, next)));
                onStack.add(next);
            }
        }
        return false;
    }

    private static Iterator<State> successors(Automaton automaton, State s) {
        List<State> result = new ArrayList<>(automaton.getAlphabet().size());
        for (char c : automaton.getAlphabet()) {
            State t = s.walkEdge(c);
            if (t != null) {
                result.add(t);
            }
        }
        return result.iterator();
    }

    private record Frame(State state, Iterator<State> successors) { }
}
