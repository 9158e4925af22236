package DFAEngine.Model;

import DFAEngine.Equivalence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A deterministic finite automaton: a registry of named states, an alphabet, an initial state and a set of
 * accepting states.
 * <p>
 * There are two ways of building one. The validating constructor rejects every reference to an unknown state or
 * symbol. The mutation primitives ({@link #addState(String)}, {@link #addEdge(String, char, String)}, ...) are
 * permissive instead: missing states and symbols are registered on the fly.
 * <p>
 * Not thread-safe.
 */
public class Automaton {
    public static final String EPSILON = "epsilon";

    private final Map<String, State> states;
    private final SortedSet<Character> alphabet;
    private final Set<State> acceptingStates;
    private State initialState;

    /**
     * A labelled edge between two named states, used by the validating constructor.
     */
    public record Edge(String source, char symbol, String target) {
        public static Edge of(String source, char symbol, String target) {
            return new Edge(source, symbol, target);
        }

        @Override
        public String toString() {
            return "(" + source + "," + symbol + "," + target + ")";
        }
    }

    /**
     * Empty automaton: a single non-accepting initial state named "epsilon" and no symbols.
     */
    public Automaton() {
        this.states = new LinkedHashMap<>();
        this.alphabet = new TreeSet<>();
        this.acceptingStates = Collections.newSetFromMap(new IdentityHashMap<>());
        this.initialState = new State(EPSILON);
        this.states.put(EPSILON, initialState);
    }

    public Automaton(List<String> states, Collection<Character> alphabet, String initialState,
                     Collection<String> acceptingStates) {
        this(states, alphabet, initialState, acceptingStates, List.of());
    }

    /**
     * Validating constructor.
     * @param states - state names
     * @param alphabet - symbols
     * @param initialState - name of the initial state, must be one of states
     * @param acceptingStates - names of accepting states, each must be one of states
     * @param edges - edges, endpoints must be in states and symbols in alphabet
     * @throws IllegalArgumentException if any reference is unknown
     */
    public Automaton(List<String> states, Collection<Character> alphabet, String initialState,
                     Collection<String> acceptingStates, List<Edge> edges) {
        Set<String> names = new LinkedHashSet<>(states);
        if (!names.contains(initialState)) {
            throw new IllegalArgumentException("Initial state " + initialState + " is not a state");
        }
        for (String s : acceptingStates) {
            if (!names.contains(s)) {
                throw new IllegalArgumentException("Accepting state " + s + " is not a state");
            }
        }
        for (Edge e : edges) {
            if (!names.contains(e.source())) {
                throw new IllegalArgumentException("State " + e.source() + " from edge " + e + " is not a state");
            }
            if (!alphabet.contains(e.symbol())) {
                throw new IllegalArgumentException("Symbol " + e.symbol() + " from edge " + e + " is not in the alphabet");
            }
            if (!names.contains(e.target())) {
                throw new IllegalArgumentException("State " + e.target() + " from edge " + e + " is not a state");
            }
        }

        this.states = new LinkedHashMap<>();
        this.alphabet = new TreeSet<>(alphabet);
        this.acceptingStates = Collections.newSetFromMap(new IdentityHashMap<>());
        for (String name : names) {
            this.states.put(name, new State(name));
        }
        for (String name : acceptingStates) {
            this.acceptingStates.add(this.states.get(name));
        }
        for (Edge e : edges) {
            this.states.get(e.source()).setEdge(e.symbol(), this.states.get(e.target()));
        }
        this.initialState = this.states.get(initialState);
    }

    /**
     * @return a deep copy sharing no state objects with this automaton. States that are only referenced by edges
     * are copied along with their edges and stay unregistered.
     */
    public Automaton copy() {
        Automaton result = new Automaton();
        result.states.clear();
        result.alphabet.addAll(alphabet);

        Map<State, State> mapping = new IdentityHashMap<>();
        for (State s : states.values()) {
            State c = new State(s.getName());
            mapping.put(s, c);
            result.states.put(c.getName(), c);
        }

        Deque<State> pending = new ArrayDeque<>(states.values());
        while (!pending.isEmpty()) {
            State s = pending.poll();
            State c = mapping.get(s);
            for (Map.Entry<Character, State> e : s.getNeighbours().entrySet()) {
                State target = mapping.get(e.getValue());
                if (target == null) {
                    target = new State(e.getValue().getName());
                    mapping.put(e.getValue(), target);
                    pending.add(e.getValue());
                }
                c.setEdge(e.getKey(), target);
            }
        }
        for (State s : acceptingStates) {
            result.acceptingStates.add(mapping.get(s));
        }
        result.initialState = mapping.get(initialState);
        return result;
    }

    //
    // Adding things
    //

    /**
     * Register a new state, or get the one already registered under that name.
     * @param name - state name
     * @return the registered state
     */
    public State addState(String name) {
        return states.computeIfAbsent(Objects.requireNonNull(name, "name"), State::new);
    }

    /**
     * Install the given state object under its name, replacing any state registered under the same name.
     * Symbols of its edges are added to the alphabet.
     * @param state - state to install
     * @return the installed state
     */
    public State addState(State state) {
        State previous = states.put(state.getName(), state);
        if (previous != null && previous != state) {
            if (previous == initialState) {
                initialState = state;
            }
            if (acceptingStates.remove(previous)) {
                acceptingStates.add(state);
            }
        }
        alphabet.addAll(state.getNeighbours().keySet());
        return state;
    }

    public State addTerminalState(String name) {
        State s = addState(name);
        acceptingStates.add(s);
        return s;
    }

    /**
     * Make the given state accepting. If no state of that name is registered, the object is installed first;
     * otherwise the registered state of that name is made accepting.
     * @param state - state to mark as accepting
     * @return the registered accepting state
     */
    public State addTerminalState(State state) {
        State registered = states.get(state.getName());
        if (registered == null) {
            registered = addState(state);
        }
        acceptingStates.add(registered);
        return registered;
    }

    public void addSymbol(char symbol) {
        alphabet.add(symbol);
    }

    /**
     * Add (or redefine) the edge source -symbol-> target. Missing states and the symbol are registered first.
     */
    public void addEdge(String source, char symbol, String target) {
        addEdge(addState(source), symbol, addState(target));
    }

    /**
     * Add (or redefine) the edge source -symbol-> target. States whose name is not registered yet are installed,
     * the symbol is added to the alphabet.
     */
    public void addEdge(State source, char symbol, State target) {
        if (!states.containsKey(source.getName())) {
            addState(source);
        }
        if (!states.containsKey(target.getName())) {
            addState(target);
        }
        alphabet.add(symbol);
        source.setEdge(symbol, target);
    }

    //
    // Removing things
    //

    public void removeState(String name) {
        removeState(getState(name));
    }

    /**
     * Unregister a state. Edges pointing to it are left alone.
     * @throws IllegalStateException if the state is the initial state
     */
    public void removeState(State state) {
        if (state == initialState) {
            throw new IllegalStateException("Cannot remove initial state " + state.getName());
        }
        acceptingStates.remove(state);
        states.remove(state.getName(), state);
    }

    public void removeTerminalState(String name) {
        removeTerminalState(getState(name));
    }

    public void removeTerminalState(State state) {
        acceptingStates.remove(state);
    }

    public void removeEdge(String name, char symbol) {
        removeEdge(getState(name), symbol);
    }

    /**
     * @return true if an edge was removed
     */
    public boolean removeEdge(State state, char symbol) {
        return state.removeEdge(symbol);
    }

    //
    // Getters
    //

    /**
     * @param name - state name
     * @return registered state of that name
     * @throws IllegalArgumentException if no such state is registered
     */
    public State getState(String name) {
        State s = states.get(name);
        if (s == null) {
            throw new IllegalArgumentException("Unknown state: " + name);
        }
        return s;
    }

    public boolean containsState(String name) {
        return states.containsKey(name);
    }

    public boolean isTerminal(String name) {
        return isTerminal(getState(name));
    }

    public boolean isTerminal(State state) {
        return acceptingStates.contains(state);
    }

    public State walkEdge(String name, char symbol) {
        return getState(name).walkEdge(symbol);
    }

    public static State walkEdge(State state, char symbol) {
        return state.walkEdge(symbol);
    }

    public State getInitialState() {
        return initialState;
    }

    /**
     * @return unmodifiable view of the registered states, in registration order
     */
    public Collection<State> getStates() {
        return Collections.unmodifiableCollection(states.values());
    }

    public Set<String> getStateNames() {
        return Collections.unmodifiableSet(states.keySet());
    }

    /**
     * @return unmodifiable view of the alphabet, sorted
     */
    public SortedSet<Character> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    public Set<State> getAcceptingStates() {
        return Collections.unmodifiableSet(acceptingStates);
    }

    /**
     * @return names of the accepting states, in registration order of the automaton
     */
    public List<String> getAcceptingStateNames() {
        List<String> result = new ArrayList<>(acceptingStates.size());
        for (State s : states.values()) {
            if (acceptingStates.contains(s)) {
                result.add(s.getName());
            }
        }
        return result;
    }

    public int size() {
        return states.size();
    }

    /**
     * Structural equality, see {@link Equivalence#structurallyEquals(Automaton, Automaton)}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        return Equivalence.structurallyEquals(this, (Automaton) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alphabet, initialState.getName(), states.keySet());
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states.keySet() + ", alphabet=" + alphabet + ", initial=" + initialState
                + ", accepting=" + getAcceptingStateNames() + "}";
    }
}
