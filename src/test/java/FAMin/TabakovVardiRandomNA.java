package FAMin;

import FAMin.Model.DA;
import FAMin.Model.NA;
import net.automatalib.common.util.random.RandomUtil;

import java.util.List;
import java.util.Random;

public class TabakovVardiRandomNA {
  public static final List<String> ALPHABET = List.of("a", "b");

  /**
   * Generate a random NA the way Tabakov and Vardi do in
   * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>.
   * States are named q0 ... q(size-1); q0 is the start state and always accepting.
   * @param r - random instance
   * @param size - number of states
   * @param td - transition density per symbol, in [0,size]
   * @param ad - acceptance density, in (0,1]
   * @param ed - epsilon move density, in [0,size]; 0 for none
   * @param alphabet - symbols
   * @return a random NA, not necessarily connected
   */
  public static NA generateNA(Random r, int size, float td, float ad, float ed, List<String> alphabet) {
    final int edgeNum = Math.round(td * size);
    final int acceptNum = Math.max(1, Math.round(ad * size));
    final int epsilonNum = Math.round(ed * size);

    final NA.Builder builder = NA.builder().addSymbols(alphabet);
    for (int i = 0; i < size; i++) {
      builder.addState(name(i));
    }
    builder.setStart(name(0)).addAccepting(name(0));

    // acceptNum-1 further accepting states from [1,size)
    for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
      builder.addAccepting(name(f));
    }
    for (String a : alphabet) {
      for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size * size)) {
        builder.addTransition(name(edgeIndex / size), a, name(edgeIndex % size));
      }
    }
    for (int edgeIndex : RandomUtil.distinctIntegers(r, epsilonNum, size * size)) {
      builder.addEpsilonTransition(name(edgeIndex / size), name(edgeIndex % size));
    }
    return builder.build();
  }

  public static NA getRandomAutomaton(int randomSeed, int size) {
    return generateNA(new Random(randomSeed), size, 1.25f, 0.5f, 0f, ALPHABET);
  }

  public static NA getRandomEpsilonAutomaton(int randomSeed, int size) {
    return generateNA(new Random(randomSeed), size, 1.25f, 0.5f, 0.3f, ALPHABET);
  }

  /**
   * Random DA; if not complete, each (state, symbol) pair is defined with probability 3/4.
   */
  public static DA getRandomDA(int randomSeed, int size, boolean complete) {
    final Random r = new Random(randomSeed);
    final DA.Builder builder = DA.builder().addSymbols(ALPHABET).setStart(name(0));
    for (int i = 0; i < size; i++) {
      builder.addState(name(i));
      if (r.nextBoolean()) {
        builder.addAccepting(name(i));
      }
    }
    for (int i = 0; i < size; i++) {
      for (String a : ALPHABET) {
        if (complete || r.nextInt(4) != 0) {
          builder.addTransition(name(i), a, name(r.nextInt(size)));
        }
      }
    }
    return builder.build();
  }

  private static String name(int i) {
    return "q" + i;
  }
}
