package DFAEngine.Product;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands out consecutive ids, starting at 1, to product states in order of discovery.
 */
public class ProductRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<ProductState> key2Id;
    private final List<ProductState> states;

    public ProductRegistry() {
        this.key2Id = new Object2IntOpenHashMap<>();
        this.key2Id.defaultReturnValue(MISSING_ELEMENT);
        this.states = new ArrayList<>();
    }

    /**
     * @return id of the product state, or MISSING_ELEMENT if it was never registered
     */
    public int get(ProductState state) {
        return key2Id.getInt(state);
    }

    /**
     * Register a new product state.
     * @return its fresh id
     */
    public int put(ProductState state) {
        int id = states.size() + 1;
        int previous = key2Id.putIfAbsent(state, id);
        if (previous != MISSING_ELEMENT) {
            throw new IllegalStateException("Product state " + state + " is already registered as " + previous);
        }
        states.add(state);
        return id;
    }

    /**
     * @return registered product states, the one with id i at index i - 1
     */
    public List<ProductState> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }
}
