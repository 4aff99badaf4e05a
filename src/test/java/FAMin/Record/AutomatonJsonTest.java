package FAMin.Record;

import FAMin.Model.AutomatonKind;
import FAMin.Model.DA;
import FAMin.Model.FiniteAutomaton;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.NA;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class AutomatonJsonTest {
  @TempDir
  Path tempDir;

  static Path getFilePath(String resourcePath) throws URISyntaxException {
    return Paths.get(Objects.requireNonNull(
        AutomatonJsonTest.class.getClassLoader().getResource(resourcePath)).toURI());
  }

  @Test
  void testReadFixtures() throws Exception {
    FiniteAutomaton dfa = AutomatonJson.read(getFilePath("ends-in-b.json"));
    Assertions.assertEquals(AutomatonKind.DA, dfa.kind());
    Assertions.assertTrue(dfa.acceptsWord("ab"));
    Assertions.assertFalse(dfa.acceptsWord("ba"));

    // metadata is ignored
    FiniteAutomaton nfa = AutomatonJson.read(getFilePath("ends-in-ab-nfa.json"));
    Assertions.assertEquals(AutomatonKind.NA, nfa.kind());
    Assertions.assertEquals(Set.of("q0", "q1"), ((NA) nfa).getSuccessors("q0", "a"));

    NA lambda = (NA) AutomatonJson.read(getFilePath("lambda-nfa.json"));
    Assertions.assertTrue(lambda.hasEpsilonTransitions());
    Assertions.assertFalse(lambda.getAlphabet().contains("lambda"));

    // no type: DA
    Assertions.assertEquals(AutomatonKind.DA, AutomatonJson.read(getFilePath("four-states.json")).kind());
  }

  @Test
  void testWriteAndRead() throws IOException, MalformedRecordException {
    NA nfa = NA.builder()
        .addStates("q0", "q1")
        .addSymbols("a", "<b>")
        .addTransition("q0", "<b>", "q1")
        .addEpsilonTransition("q0", "q1")
        .setStart("q0")
        .addAccepting("q1")
        .build();
    Path file = tempDir.resolve("nfa.json");
    AutomatonJson.write(file, nfa, true);
    Assertions.assertEquals(nfa, AutomatonJson.read(file));

    AutomatonRecord record = AutomatonJson.readRecord(file);
    Assertions.assertEquals(AutomatonKind.NA, record.type());
    Assertions.assertEquals(new TransitionRecord("q0", "lambda", "q1"), record.transitions().get(1));
  }

  @Test
  void testMetadata() {
    DA dfa = DA.builder().addStates("q0").addSymbols("a").setStart("q0").addAccepting("q0").build();
    JsonObject plain = JsonParser.parseString(AutomatonJson.toJson(dfa)).getAsJsonObject();
    Assertions.assertFalse(plain.has("metadata"));
    Assertions.assertEquals("DA", plain.get("type").getAsString());

    JsonObject withMetadata = JsonParser.parseString(AutomatonJson.toJson(dfa, true)).getAsJsonObject();
    JsonObject metadata = withMetadata.getAsJsonObject("metadata");
    Assertions.assertEquals(AutomatonJson.FORMAT_VERSION, metadata.get("version").getAsString());
    Assertions.assertTrue(metadata.has("created"));
    Assertions.assertEquals(1, metadata.getAsJsonObject("statistics").get("states").getAsInt());
    Assertions.assertFalse(metadata.getAsJsonObject("statistics").get("complete").getAsBoolean());
  }

  @Test
  void testMalformed() throws URISyntaxException {
    MalformedRecordException e = assertThrows(MalformedRecordException.class,
        () -> AutomatonJson.read(getFilePath("malformed-states.json")));
    Assertions.assertEquals("field 'states' must be an array of strings", e.getMessage());

    assertMalformed("{", "not valid JSON");
    assertMalformed("[]", "automaton must be a JSON object");
    assertMalformed("{\"type\": \"DFA\", \"states\": [], \"alphabet\": [], \"transitions\": [],"
        + " \"start\": \"q\", \"accepting\": []}", "unknown automaton type 'DFA', expected DA or NA");
    assertMalformed("{\"states\": [\"q\"], \"alphabet\": [], \"transitions\": [], \"accepting\": []}",
        "missing field 'start'");
    assertMalformed("{\"states\": [\"q\", 1], \"alphabet\": [], \"transitions\": [], \"start\": \"q\","
        + " \"accepting\": []}", "field 'states' must be an array of strings");
    assertMalformed("{\"states\": [\"q\"], \"alphabet\": [], \"transitions\": [{\"origin\": \"q\"}],"
        + " \"start\": \"q\", \"accepting\": []}", "missing field 'transitions[0].symbol'");
    assertMalformed("{\"states\": [\"q\"], \"alphabet\": [], \"transitions\": [], \"start\": [\"q\"],"
        + " \"accepting\": []}", "field 'start' must be a string");
    assertMalformed("{\"states\": [], \"alphabet\": [], \"transitions\": {}, \"start\": \"q\","
        + " \"accepting\": []}", "field 'transitions' must be an array of objects");
  }

  private static void assertMalformed(String json, String expectedMessage) {
    MalformedRecordException e = assertThrows(MalformedRecordException.class, () -> AutomatonJson.fromJson(json));
    Assertions.assertTrue(e.getMessage().startsWith(expectedMessage), e.getMessage());
  }

  @Test
  void testEpsilonSpellingAsSymbolIsRejected() {
    NA nfa = NA.builder()
        .addStates("q0", "q1")
        .addSymbols("λ")
        .addTransition("q0", "λ", "q1")
        .setStart("q0")
        .addAccepting("q1")
        .build();
    Assertions.assertTrue(nfa.acceptsWord("λ"));
    Assertions.assertFalse(nfa.acceptsWord(""));

    // read back, the symbol move would become an epsilon move and accept the empty word
    String json = AutomatonJson.toJson(nfa);
    InvalidAutomatonException e = assertThrows(InvalidAutomatonException.class, () -> AutomatonJson.fromJson(json));
    Assertions.assertEquals(List.of("alphabet contains the reserved epsilon token 'λ'"), e.getProblems());
  }

  @Test
  void testInvalid() {
    InvalidAutomatonException e = assertThrows(InvalidAutomatonException.class,
        () -> AutomatonJson.read(getFilePath("invalid-start.json")));
    Assertions.assertEquals(List.of("start state 'q5' is not a state"), e.getProblems());
  }
}
