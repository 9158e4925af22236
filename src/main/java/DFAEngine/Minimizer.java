package DFAEngine;

import DFAEngine.Model.Automaton;
import DFAEngine.Model.Automaton.Edge;
import DFAEngine.Model.State;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Moore-style partition refinement.
 */
public class Minimizer {
    public static boolean DEBUG = false;
    private static final int MISSING_BLOCK = -1;

    /**
     * Compute the minimal automaton of the same language. The argument is left untouched; completion and
     * reduction happen on a copy.
     * @param automaton - automaton to minimize
     * @return new minimal, complete automaton whose states are named "1", "2", ...
     */
    public static Automaton minimalize(Automaton automaton) {
        final Automaton work = automaton.copy();
        DFATrim.complete(work);
        DFATrim.reduceNonAccessibleStates(work);

        final List<List<State>> blocks = initialBlocks(work);
        Object2IntMap<State> blockOf = indexBlocks(blocks);

        boolean hasChanged = true;
        while (hasChanged) {
            hasChanged = false;
            for (int b = 0; b < blocks.size() && !hasChanged; b++) {
                for (char c : work.getAlphabet()) {
                    List<List<State>> split = split(blocks.get(b), c, blockOf);
                    if (split.size() > 1) {
                        // the block list changed under us, so start the scan over
                        blocks.remove(b);
                        blocks.addAll(split);
                        blockOf = indexBlocks(blocks);
                        hasChanged = true;
                        break;
                    }
                }
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: Minimized " + work.size() + " reachable states into " + blocks.size() + " blocks");
        }
        return buildQuotient(work, blocks, blockOf);
    }

    private static List<List<State>> initialBlocks(Automaton work) {
        final List<State> accepting = new ArrayList<>();
        final List<State> rejecting = new ArrayList<>();
        for (State s : work.getStates()) {
            if (work.isTerminal(s)) {
                accepting.add(s);
            } else {
                rejecting.add(s);
            }
        }

        final List<List<State>> blocks = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            blocks.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            blocks.add(rejecting);
        }
        return blocks;
    }

    private static Object2IntMap<State> indexBlocks(List<List<State>> blocks) {
        final Object2IntMap<State> blockOf = new Object2IntOpenHashMap<>();
        blockOf.defaultReturnValue(MISSING_BLOCK);
        for (int b = 0; b < blocks.size(); b++) {
            for (State s : blocks.get(b)) {
                blockOf.put(s, b);
            }
        }
        return blockOf;
    }

    /**
     * Group the members of a block by the block their c-successor lies in.
     * @return the sub-blocks, in order of first occurrence; a single element if no split is needed
     */
    private static List<List<State>> split(List<State> block, char c, Object2IntMap<State> blockOf) {
        final IntList targetBlocks = new IntArrayList(block.size());
        final Int2IntMap groupOf = new Int2IntOpenHashMap();
        groupOf.defaultReturnValue(MISSING_BLOCK);

        for (State s : block) {
            int target = successorBlock(s, c, blockOf);
            targetBlocks.add(target);
            if (groupOf.get(target) == MISSING_BLOCK) {
                groupOf.put(target, groupOf.size());
            }
        }

        final List<List<State>> result = new ArrayList<>(groupOf.size());
        if (groupOf.size() == 1) {
            result.add(block);
            return result;
        }
        for (int g = 0; g < groupOf.size(); g++) {
            result.add(new ArrayList<>());
        }
        for (int i = 0; i < block.size(); i++) {
            result.get(groupOf.get(targetBlocks.getInt(i))).add(block.get(i));
        }
        return result;
    }

    private static int successorBlock(State s, char c, Object2IntMap<State> blockOf) {
        State t = s.walkEdge(c);
        int target = t == null ? MISSING_BLOCK : blockOf.getInt(t);
        if (target == MISSING_BLOCK) {
            throw new IllegalStateException("Successor of " + s + " on " + c + " is not a reachable state");
        }
        return target;
    }

    private static Automaton buildQuotient(Automaton work, List<List<State>> blocks, Object2IntMap<State> blockOf) {
        final List<String> names = new ArrayList<>(blocks.size());
        final List<String> accepting = new ArrayList<>();
        final List<Edge> edges = new ArrayList<>();

        for (int b = 0; b < blocks.size(); b++) {
            names.add(blockName(b));
        }
        for (int b = 0; b < blocks.size(); b++) {
            State representative = blocks.get(b).get(0);
            if (work.isTerminal(representative)) {
                accepting.add(blockName(b));
            }
            for (char c : work.getAlphabet()) {
                edges.add(Edge.of(blockName(b), c, blockName(successorBlock(representative, c, blockOf))));
            }
        }

        final String initial = blockName(blockOf.getInt(work.getInitialState()));
        return new Automaton(names, work.getAlphabet(), initial, accepting, edges);
    }

    private static String blockName(int block) {
        return String.valueOf(block + 1);
    }
}
