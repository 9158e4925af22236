package DFAEngine.Product;

import DFAEngine.Model.State;

import java.util.Set;

/**
 * A state of a synchronized product: the current state of the left automaton together with the set of right
 * states being tracked. Equality is by member identity, so equal product states denote the same configuration.
 * @param left - state of the left automaton
 * @param right - states of the right automaton, possibly empty
 */
public record ProductState(State left, Set<State> right) {

    public ProductState {
        right = Set.copyOf(right);
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
