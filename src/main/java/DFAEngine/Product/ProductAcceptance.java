package DFAEngine.Product;

import DFAEngine.Model.Automaton;
import DFAEngine.Model.State;

/**
 * Decides which product states of a {@link Products#zip} are accepting.
 */
@FunctionalInterface
public interface ProductAcceptance {

    /**
     * @param state - discovered product state
     * @param left - left automaton of the product
     * @param right - right automaton of the product
     * @return whether the product state is accepting
     */
    boolean test(ProductState state, Automaton left, Automaton right);

    /**
     * Both sides accept: the left member and every tracked right member are accepting.
     */
    static ProductAcceptance intersection() {
        return (state, left, right) -> {
            if (!left.isTerminal(state.left()) || state.right().isEmpty()) {
                return false;
            }
            for (State s : state.right()) {
                if (!right.isTerminal(s)) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * Either side accepts.
     */
    static ProductAcceptance union() {
        return (state, left, right) -> left.isTerminal(state.left()) || anyAccepting(state, right);
    }

    /**
     * Some run of the right automaton, started after an accepted prefix, accepts.
     */
    static ProductAcceptance concatenation() {
        return (state, left, right) -> anyAccepting(state, right);
    }

    private static boolean anyAccepting(ProductState state, Automaton right) {
        for (State s : state.right()) {
            if (right.isTerminal(s)) {
                return true;
            }
        }
        return false;
    }
}
