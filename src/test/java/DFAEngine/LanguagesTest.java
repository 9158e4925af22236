package DFAEngine;

import DFAEngine.Model.Automaton;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LanguagesTest {
  @Test
  void testAcceptingBehaviour() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addTerminalState("a");

    //  ->(epsilon) -a-> ((a))
    Assertions.assertFalse(Languages.isAccepted(a, ""));
    Assertions.assertTrue(Languages.isAccepted(a, "a"));
    Assertions.assertFalse(Languages.isAccepted(a, "aa")); // missing edge
    Assertions.assertFalse(Languages.isAccepted(a, "b")); // symbol not in the alphabet

    a.addTerminalState("epsilon");
    Assertions.assertTrue(Languages.isAccepted(a, "")); // empty word only depends on the initial state
  }

  @Test
  void testEmptyAlphabet() {
    Automaton a = new Automaton();
    Assertions.assertFalse(Languages.isAccepted(a, ""));
    Assertions.assertFalse(Languages.isAccepted(a, "a"));

    a.addTerminalState(a.getInitialState());
    Assertions.assertTrue(Languages.isAccepted(a, ""));
    Assertions.assertFalse(Languages.isAccepted(a, "a"));
    Assertions.assertFalse(Languages.hasLoop(a));
  }

  @Test
  void testComplement() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addTerminalState("a");

    Assertions.assertTrue(a.isTerminal("a"));
    Assertions.assertFalse(a.isTerminal("epsilon"));

    Languages.complement(a);
    Assertions.assertFalse(a.isTerminal("a"));
    Assertions.assertTrue(a.isTerminal("epsilon"));
    Assertions.assertEquals(2, a.size()); // no implicit completion

    Languages.complement(a);
    Assertions.assertTrue(a.isTerminal("a"));
    Assertions.assertFalse(a.isTerminal("epsilon"));
  }

  @Test
  void testComplementOf() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addEdge("a", 'b', "epsilon");
    a.addTerminalState("a");
    Automaton before = a.copy();

    Automaton c = Languages.complementOf(a);
    Assertions.assertEquals(before, a); // argument untouched
    for (String w : RandomDFA.allWords("ab", 6)) {
      Assertions.assertNotEquals(Languages.isAccepted(a, w), Languages.isAccepted(c, w), w);
    }
  }

  @Test
  void testFindingLoops() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addTerminalState("a");

    //  ->(epsilon) -a-> ((a))
    Assertions.assertFalse(Languages.hasLoop(a));

    a.addEdge("a", 'a', "a");
    Assertions.assertTrue(Languages.hasLoop(a));

    a.removeTerminalState("a");
    Assertions.assertFalse(Languages.hasLoop(a)); // the loop exists but cannot reach acceptance
  }

  @Test
  void testLongerLoop() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addEdge("a", 'a', "aa");
    a.addEdge("aa", 'a', "a");
    a.addTerminalState("a");

    //  ->(epsilon) -a-> ((a)) <-a-> (aa)
    Assertions.assertTrue(Languages.hasLoop(a));

    a.removeTerminalState("a");
    Assertions.assertFalse(Languages.hasLoop(a));

    // the cycle is productive as soon as it can reach acceptance
    a.addEdge("aa", 'b', "t");
    a.addTerminalState("t");
    Assertions.assertTrue(Languages.hasLoop(a));
  }

  @Test
  void testSharedPathsAreNotLoops() {
    // diamond: two paths into the same accepting state
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "x");
    a.addEdge("epsilon", 'b', "y");
    a.addEdge("x", 'a', "z");
    a.addEdge("y", 'a', "z");
    a.addEdge("x", 'b', "y");
    a.addTerminalState("z");
    Assertions.assertFalse(Languages.hasLoop(a));
  }

  @Test
  void testUnreachableLoopIgnored() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "t");
    a.addTerminalState("t");
    a.addEdge("u", 'a', "u"); // unreachable loops
    a.addEdge("v", 'a', "v");
    a.addTerminalState("v");
    Assertions.assertFalse(Languages.hasLoop(a));
  }

  @Test
  void testLoopAfterComplete() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "a");
    a.addTerminalState("a");
    DFATrim.complete(a);
    // the junkyard loops forever, but never accepts
    Assertions.assertFalse(Languages.hasLoop(a));
  }

  @Test
  void testComplementOfWithDanglingState() {
    Automaton a = new Automaton();
    a.addEdge("epsilon", 'a', "x");
    a.addEdge("epsilon", 'b', "epsilon");
    a.addTerminalState("epsilon");
    a.removeState("x");

    Automaton c = Languages.complementOf(a);
    for (String w : RandomDFA.allWords("ab", 5)) {
      Assertions.assertNotEquals(Languages.isAccepted(a, w), Languages.isAccepted(c, w), w);
    }
    Assertions.assertFalse(a.containsState("x"));
  }
}
