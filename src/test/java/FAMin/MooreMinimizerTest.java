package FAMin;

import FAMin.Model.DA;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.MinimizationResult;
import FAMin.Model.Partition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class MooreMinimizerTest {
  // q3 behaves like the accepting q1
  static DA fourStates() {
    return DA.builder()
        .addStates("q0", "q1", "q2", "q3")
        .addSymbols("a", "b")
        .addTransition("q0", "a", "q1")
        .addTransition("q0", "b", "q3")
        .addTransition("q1", "a", "q2")
        .addTransition("q1", "b", "q1")
        .addTransition("q3", "a", "q2")
        .addTransition("q3", "b", "q1")
        .addTransition("q2", "a", "q2")
        .addTransition("q2", "b", "q2")
        .setStart("q0")
        .addAccepting("q1", "q3")
        .build();
  }

  @Test
  void testMergesEquivalentStates() {
    DA dfa = fourStates();
    MinimizationResult result = MooreMinimizer.minimizeWithSummary(dfa);
    DA minimized = result.minimized();

    DA expected = DA.builder()
        .addStates("q0", "q1", "q2")
        .addSymbols("a", "b")
        .addTransition("q0", "a", "q1")
        .addTransition("q0", "b", "q1")
        .addTransition("q1", "a", "q2")
        .addTransition("q1", "b", "q1")
        .addTransition("q2", "a", "q2")
        .addTransition("q2", "b", "q2")
        .setStart("q0")
        .addAccepting("q1")
        .build();
    Assertions.assertEquals(expected, minimized);
    Assertions.assertEquals(Map.of("q0", "q0", "q1", "q1", "q3", "q1", "q2", "q2"), result.equivalenceTable());
    Assertions.assertEquals(result.equivalenceTable().get(dfa.getStart()), minimized.getStart());

    Assertions.assertEquals(4, result.originalStates());
    Assertions.assertEquals(4, result.reachableStates());
    Assertions.assertEquals(3, result.minimizedStates());
    Assertions.assertEquals(0, result.unreachableRemoved());
    Assertions.assertEquals(25.0, result.reductionPercentage(), 1e-9);
    Assertions.assertEquals(3, result.partition().size());
    LanguageAssertions.assertSameWords(dfa, minimized, 7);
  }

  @Test
  void testDropsUnreachableStates() {
    for (boolean accepting : List.of(true, false)) {
      DA.Builder builder = DA.builder()
          .addStates("q0", "q1", "u")
          .addSymbols("a")
          .addTransition("q0", "a", "q1")
          .addTransition("q1", "a", "q0")
          .addTransition("u", "a", "q0")
          .setStart("q0")
          .addAccepting("q1");
      if (accepting) {
        builder.addAccepting("u");
      }
      DA dfa = builder.build();
      MinimizationResult result = MooreMinimizer.minimizeWithSummary(dfa);
      Assertions.assertEquals(2, result.minimizedStates());
      Assertions.assertEquals(1, result.unreachableRemoved());
      Assertions.assertFalse(result.equivalenceTable().containsKey("u"));
      Assertions.assertEquals(Set.of("q0", "q1"), MooreMinimizer.pruneUnreachable(dfa).getStates());
    }
  }

  @Test
  void testMissingTransitionsStayDistinct() {
    DA dfa = DA.builder()
        .addStates("s", "t", "u")
        .addSymbols("a", "b")
        .addTransition("s", "a", "t")
        .addTransition("s", "b", "u")
        .addTransition("t", "a", "t")
        .setStart("s")
        .build();
    DA minimized = MooreMinimizer.minimize(dfa);
    Assertions.assertEquals(3, minimized.size());
    Assertions.assertFalse(minimized.isComplete());
    Assertions.assertTrue(minimized.getAcceptingStates().isEmpty());
  }

  @Test
  void testInitialPartitionAndRefine() {
    DA dfa = fourStates();
    Partition initial = MooreMinimizer.initialPartition(dfa);
    Assertions.assertEquals(new Partition(List.of(List.of("q1", "q3"), List.of("q0", "q2"))), initial);
    Assertions.assertTrue(MooreMinimizer.areEquivalent("q1", "q3", dfa, initial));
    Assertions.assertFalse(MooreMinimizer.areEquivalent("q0", "q2", dfa, initial));

    Partition stable = MooreMinimizer.refine(dfa, initial);
    Assertions.assertEquals(new Partition(List.of(List.of("q1", "q3"), List.of("q0"), List.of("q2"))), stable);
    Assertions.assertEquals(stable, MooreMinimizer.refine(dfa, stable));

    // no accepting states: a single block
    DA rejecting = DA.builder().addStates("p", "q").addSymbols("a").setStart("p").build();
    Assertions.assertEquals(1, MooreMinimizer.initialPartition(rejecting).size());
  }

  @Test
  void testPartitionMustCoverSuccessors() {
    DA dfa = DA.builder()
        .addStates("p", "q", "r")
        .addSymbols("a")
        .addTransition("p", "a", "r")
        .setStart("p")
        .build();
    // r is in no block, so p must not look like q, which has no transition
    Partition partial = new Partition(List.of(List.of("p", "q")));
    assertThrows(IllegalArgumentException.class, () -> MooreMinimizer.areEquivalent("p", "q", dfa, partial));
    assertThrows(IllegalArgumentException.class, () -> MooreMinimizer.refine(dfa, partial));
  }

  @Test
  void testIdempotentAndCanonical() {
    DA dfa = fourStates();
    DA once = MooreMinimizer.minimize(dfa);
    Assertions.assertEquals(once, MooreMinimizer.minimize(once));

    // two presentations of "ends in b"
    DA small = DA.builder()
        .addStates("x", "y")
        .addSymbols("a", "b")
        .addTransition("x", "a", "x")
        .addTransition("x", "b", "y")
        .addTransition("y", "a", "x")
        .addTransition("y", "b", "y")
        .setStart("x")
        .addAccepting("y")
        .build();
    DA large = DA.builder()
        .addStates("p0", "p1", "p2")
        .addSymbols("a", "b")
        .addTransition("p0", "a", "p0")
        .addTransition("p0", "b", "p1")
        .addTransition("p1", "a", "p2")
        .addTransition("p1", "b", "p1")
        .addTransition("p2", "a", "p2")
        .addTransition("p2", "b", "p1")
        .setStart("p0")
        .addAccepting("p1")
        .build();
    Assertions.assertEquals(MooreMinimizer.minimize(small), MooreMinimizer.minimize(large));
    Assertions.assertEquals(2, MooreMinimizer.minimize(large).size());
  }

  @Test
  void testSingleState() {
    DA dfa = DA.builder().addStates("only").addSymbols("a").setStart("only").addAccepting("only").build();
    DA minimized = MooreMinimizer.minimize(dfa);
    Assertions.assertEquals(1, minimized.size());
    Assertions.assertEquals("q0", minimized.getStart());
    Assertions.assertTrue(minimized.acceptsWord(""));
    Assertions.assertFalse(minimized.acceptsWord("a"));
  }

  @Test
  void testPreconditions() {
    DA noStates = DA.builder().addSymbols("a").setStart("q0").build();
    assertThrows(InvalidAutomatonException.class, () -> MooreMinimizer.minimize(noStates));

    DA unknownStart = DA.builder().addStates("q0").addSymbols("a").setStart("q9").build();
    assertThrows(InvalidAutomatonException.class, () -> MooreMinimizer.minimize(unknownStart));

    DA dangling = DA.builder()
        .addStates("q0")
        .addSymbols("a")
        .addTransition("q0", "a", "q9")
        .setStart("q0")
        .build();
    assertThrows(InvalidAutomatonException.class, () -> MooreMinimizer.minimize(dangling));
  }

  @Test
  void testRandomPartialDAs() {
    for (int seed = 0; seed < 50; seed++) {
      DA dfa = TabakovVardiRandomNA.getRandomDA(seed, 10, false);
      DA minimized = MooreMinimizer.minimize(dfa);
      LanguageAssertions.assertSameLanguage(dfa, minimized, "seed " + seed);
      Assertions.assertTrue(minimized.size() <= dfa.reachableStates().size(), "seed " + seed);
      Assertions.assertEquals(minimized, MooreMinimizer.minimize(minimized), "seed " + seed);
    }
  }
}
