package FAMin.Interop;

import FAMin.LanguageAssertions;
import FAMin.Model.DA;
import FAMin.Model.NA;
import FAMin.MooreMinimizer;
import FAMin.Record.MalformedRecordException;
import FAMin.SubsetDeterminizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class BAFormatTest {
  @TempDir
  Path tempDir;

  private static Path getFilePath(String resourcePath) throws URISyntaxException {
    return Paths.get(Objects.requireNonNull(
        BAFormatTest.class.getClassLoader().getResource(resourcePath)).toURI());
  }

  @Test
  void testReadBA() throws Exception {
    NA nfa = BAFormat.read(getFilePath("ends-in-ab.ba"));
    Assertions.assertEquals(3, nfa.size());
    Assertions.assertEquals(Set.of("a", "b"), nfa.getAlphabet());
    Assertions.assertTrue(nfa.acceptsWord("ab"));
    Assertions.assertTrue(nfa.acceptsWord("bbaab"));
    Assertions.assertFalse(nfa.acceptsWord("abb"));
    Assertions.assertFalse(nfa.acceptsWord(""));
    Assertions.assertFalse(nfa.isDeterministic());
  }

  @Test
  void testWriteAndReadBack() throws IOException, MalformedRecordException {
    DA dfa = MooreMinimizer.minimize(SubsetDeterminizer.determinize(
        BAFormat.read(new ByteArrayInputStream("[0]\na,[0]->[0]\na,[0]->[1]\nb,[1]->[0]\n[1]\n"
            .getBytes(StandardCharsets.UTF_8)))));
    ByteArrayOutputStream os = new ByteArrayOutputStream();
    BAFormat.write(os, dfa);
    NA back = BAFormat.read(new ByteArrayInputStream(os.toByteArray()));
    LanguageAssertions.assertSameWords(dfa, back, 6);

    Path file = tempDir.resolve("out.ba");
    BAFormat.write(file, dfa);
    LanguageAssertions.assertSameWords(dfa, BAFormat.read(file), 6);
  }

  @Test
  void testMalformedBA() {
    assertThrows(MalformedRecordException.class, () -> BAFormat.read(
        new ByteArrayInputStream("[0]\na,[0]->\n".getBytes(StandardCharsets.UTF_8))));
  }
}
