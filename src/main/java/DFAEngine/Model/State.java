package DFAEngine.Model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A named node of a DFA with at most one outgoing edge per symbol.
 * A state knows nothing about the automata it is registered in; it is compared by identity.
 * Structural and semantic comparison live in {@link DFAEngine.Equivalence}.
 */
public class State {
    private final String name;
    private final Map<Character, State> neighbours;

    public State(String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.neighbours = new TreeMap<>();
    }

    public State(String name, Map<Character, State> neighbours) {
        this(name);
        for (Map.Entry<Character, State> e : neighbours.entrySet()) {
            setEdge(e.getKey(), e.getValue());
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return unmodifiable view of the outgoing edges, sorted by symbol
     */
    public Map<Character, State> getNeighbours() {
        return Collections.unmodifiableMap(neighbours);
    }

    /**
     * Follow the edge labelled by symbol.
     * @param symbol - edge label
     * @return target state, or null if there is no such edge
     */
    public State walkEdge(char symbol) {
        return neighbours.get(symbol);
    }

    public boolean hasEdge(char symbol) {
        return neighbours.containsKey(symbol);
    }

    // package-private: edges are added through the automaton so that symbols get registered
    void setEdge(char symbol, State target) {
        neighbours.put(symbol, Objects.requireNonNull(target, "target"));
    }

    boolean removeEdge(char symbol) {
        return neighbours.remove(symbol) != null;
    }

    @Override
    public String toString() {
        return name;
    }
}
