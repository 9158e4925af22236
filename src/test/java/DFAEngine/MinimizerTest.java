package DFAEngine;

import DFAEngine.Model.Automaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class MinimizerTest {
  // b*, with the a-successor of epsilon removed from the registry but still referenced
  private static Automaton withDanglingState() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "x");
    a.addEdge("epsilon", 'b', "epsilon");
    a.addTerminalState("epsilon");
    a.removeState("x");
    return a;
  }

  // {a}+ : ->(epsilon) -a-> ((a)) -a-> ((a))
  private static Automaton onePlus() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addEdge("a", 'a', "a");
    a.addTerminalState("a");
    return a;
  }

  @Test
  void testMinimalizing() {
    Automaton a = onePlus();
    Automaton b = onePlus();

    a = Minimizer.minimalize(a);
    Assertions.assertTrue(Equivalence.semanticEquals(a, b)); // minimalizing a minimal automaton changes nothing

    a.addTerminalState(a.getInitialState());
    //  ->((epsilon)) -a-> ((a)) -a-> ((a))

    a = Minimizer.minimalize(a);
    Assertions.assertFalse(Equivalence.semanticEquals(a, b));
    Assertions.assertEquals(1, a.size()); // a single accepting state now
    Assertions.assertTrue(a.isTerminal(a.getInitialState()));
  }

  @Test
  void testArgumentUntouched() {
    Automaton a = onePlus();
    a.addState("unreachable");
    Automaton before = a.copy();

    Minimizer.minimalize(a);
    Assertions.assertEquals(before, a);
  }

  @Test
  void testResultShape() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addEdge("epsilon", 'b', "b");
    a.addTerminalState("a");
    a.addTerminalState("b");
    a.addState("unreachable");

    Automaton m = Minimizer.minimalize(a);
    // {epsilon}, {a, b}, {junkyard}
    Assertions.assertEquals(3, m.size());
    Assertions.assertEquals(a.getAlphabet(), m.getAlphabet());
    for (String name : m.getStateNames()) {
      Assertions.assertTrue(name.matches("[1-9][0-9]*"), name);
    }
    for (char c : m.getAlphabet()) {
      m.getStates().forEach(s -> Assertions.assertNotNull(s.walkEdge(c))); // complete
    }
  }

  @Test
  void testMergesEquivalentStates() {
    // (a|b)* spread over three accepting states
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "x");
    a.addEdge("epsilon", 'b', "y");
    a.addEdge("x", 'a', "y");
    a.addEdge("x", 'b', "epsilon");
    a.addEdge("y", 'a', "x");
    a.addEdge("y", 'b', "y");
    a.addTerminalState("epsilon");
    a.addTerminalState("x");
    a.addTerminalState("y");

    Automaton m = Minimizer.minimalize(a);
    Assertions.assertEquals(1, m.size());
    Assertions.assertTrue(Languages.isAccepted(m, "abba"));
  }

  @Test
  void testEmptyLanguage() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "x");
    a.addEdge("x", 'b', "y");

    Automaton m = Minimizer.minimalize(a);
    Assertions.assertEquals(1, m.size());
    Assertions.assertTrue(m.getAcceptingStates().isEmpty());
  }

  @Test
  void testEmptyAlphabet() {
    Automaton a = new Automaton();
    a.addTerminalState(a.getInitialState());
    Automaton m = Minimizer.minimalize(a);
    Assertions.assertEquals(1, m.size());
    Assertions.assertTrue(Languages.isAccepted(m, ""));
  }

  @Test
  void testIdempotent() {
    for (int seed = 0; seed < 20; seed++) {
      Automaton m = Minimizer.minimalize(RandomDFA.getRandomAutomaton(seed, 8));
      Automaton mm = Minimizer.minimalize(m);
      Assertions.assertTrue(Equivalence.semanticEquals(m, mm), "seed " + seed);
      Assertions.assertEquals(m.size(), mm.size(), "seed " + seed);
    }
  }

  @Test
  void testPreservesLanguage() {
    List<String> words = RandomDFA.allWords("ab", 7);
    for (int seed = 0; seed < 20; seed++) {
      Automaton a = RandomDFA.getRandomAutomaton(seed, 8);
      Automaton m = Minimizer.minimalize(a);
      Assertions.assertTrue(m.size() <= a.size() + 1, "seed " + seed); // + junkyard
      for (String w : words) {
        Assertions.assertEquals(Languages.isAccepted(a, w), Languages.isAccepted(m, w), "seed " + seed + ": " + w);
      }
    }
  }

  @Test
  void testCanonical() {
    // odd number of a's, built twice with different names and redundancy
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "odd");
    a.addEdge("odd", 'a', "epsilon");
    a.addTerminalState("odd");

    Automaton b = new Automaton();
    b.addEdge("epsilon", 'a', "1");
    b.addEdge("1", 'a', "2");
    b.addEdge("2", 'a', "3");
    b.addEdge("3", 'a', "2");
    b.addTerminalState("1");
    b.addTerminalState("3");

    Assertions.assertFalse(Equivalence.semanticEquals(a, b));
    Automaton ma = Minimizer.minimalize(a);
    Automaton mb = Minimizer.minimalize(b);
    Assertions.assertTrue(Equivalence.semanticEquals(ma, mb));
    Assertions.assertEquals(ma.size(), mb.size());
  }

  @Test
  void testDanglingState() {
    Automaton a = withDanglingState();
    Automaton m = Minimizer.minimalize(a);
    Assertions.assertEquals(2, m.size()); // {epsilon}, {x, junkyard}
    Assertions.assertTrue(Languages.isAccepted(m, "bb"));
    Assertions.assertFalse(Languages.isAccepted(m, "ba"));
    Assertions.assertFalse(a.containsState("x")); // argument untouched
  }
}
