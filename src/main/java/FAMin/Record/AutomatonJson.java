package FAMin.Record;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import FAMin.Model.AutomatonKind;
import FAMin.Model.AutomatonStatistics;
import FAMin.Model.FiniteAutomaton;

/**
 * JSON form of the structural record:
 * <pre>
 * {"type": "DA" | "NA", "states": [...], "alphabet": [...],
 *  "transitions": [{"origin": ..., "symbol": ..., "destination": ...}, ...],
 *  "start": ..., "accepting": [...], "metadata": {...}}
 * </pre>
 * {@code type} defaults to DA. {@code metadata} is optional and ignored on read.
 */
public final class AutomatonJson {
    public static final String FORMAT_VERSION = "1.0";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private AutomatonJson() {
    }

    public static String toJson(FiniteAutomaton automaton) {
        return toJson(automaton, false);
    }

    public static String toJson(FiniteAutomaton automaton, boolean includeMetadata) {
        return GSON.toJson(toJsonObject(automaton, includeMetadata));
    }

    public static JsonObject toJsonObject(FiniteAutomaton automaton, boolean includeMetadata) {
        final AutomatonRecord record = AutomatonRecords.toRecord(automaton);
        final JsonObject json = new JsonObject();
        json.addProperty("type", record.type().name());
        json.add("states", stringArray(record.states()));
        json.add("alphabet", stringArray(record.alphabet()));

        final JsonArray transitions = new JsonArray();
        for (TransitionRecord t : record.transitions()) {
            final JsonObject transition = new JsonObject();
            transition.addProperty("origin", t.origin());
            transition.addProperty("symbol", t.symbol());
            transition.addProperty("destination", t.destination());
            transitions.add(transition);
        }
        json.add("transitions", transitions);
        json.addProperty("start", record.start());
        json.add("accepting", stringArray(record.accepting()));

        if (includeMetadata) {
            final AutomatonStatistics stats = automaton.statistics();
            final JsonObject statistics = new JsonObject();
            statistics.addProperty("states", stats.states());
            statistics.addProperty("symbols", stats.symbols());
            statistics.addProperty("acceptingStates", stats.acceptingStates());
            statistics.addProperty("transitions", stats.transitions());
            statistics.addProperty("complete", stats.complete());
            statistics.addProperty("deterministic", stats.deterministic());

            final JsonObject metadata = new JsonObject();
            metadata.addProperty("created", Instant.now().toString());
            metadata.addProperty("version", FORMAT_VERSION);
            metadata.add("statistics", statistics);
            json.add("metadata", metadata);
        }
        return json;
    }

    /**
     * Parse and validate an automaton.
     * @throws MalformedRecordException on unparseable JSON, a missing field or a field of the wrong type
     * @throws FAMin.Model.InvalidAutomatonException if the automaton described is structurally invalid
     */
    public static FiniteAutomaton fromJson(String json) throws MalformedRecordException {
        return AutomatonRecords.fromRecord(parseRecord(parse(json)));
    }

    public static AutomatonRecord parseRecord(String json) throws MalformedRecordException {
        return parseRecord(parse(json));
    }

    public static AutomatonRecord parseRecord(JsonElement element) throws MalformedRecordException {
        if (element == null || !element.isJsonObject()) {
            throw new MalformedRecordException("automaton must be a JSON object");
        }
        final JsonObject json = element.getAsJsonObject();

        final AutomatonKind type;
        final JsonElement typeElement = json.get("type");
        if (typeElement == null || typeElement.isJsonNull()) {
            type = AutomatonKind.DA;
        } else {
            final String tag = stringValue(typeElement, "type");
            try {
                type = AutomatonKind.valueOf(tag);
            } catch (IllegalArgumentException e) {
                throw new MalformedRecordException("unknown automaton type '" + tag + "', expected DA or NA", e);
            }
        }

        final List<TransitionRecord> transitions = new ArrayList<>();
        int index = 0;
        for (JsonElement t : array(json, "transitions", "an array of objects")) {
            final String field = "transitions[" + index + "]";
            if (!t.isJsonObject()) {
                throw new MalformedRecordException("field '" + field + "' must be an object");
            }
            final JsonObject transition = t.getAsJsonObject();
            transitions.add(new TransitionRecord(
                string(transition, "origin", field + ".origin"),
                string(transition, "symbol", field + ".symbol"),
                string(transition, "destination", field + ".destination")));
            index++;
        }

        return new AutomatonRecord(type,
            stringList(json, "states"),
            stringList(json, "alphabet"),
            transitions,
            string(json, "start", "start"),
            stringList(json, "accepting"));
    }

    public static FiniteAutomaton read(Path path) throws IOException, MalformedRecordException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static FiniteAutomaton read(Reader reader) throws MalformedRecordException {
        return AutomatonRecords.fromRecord(parseRecord(parse(reader)));
    }

    /**
     * Read the record of a file without building or validating it.
     */
    public static AutomatonRecord readRecord(Path path) throws IOException, MalformedRecordException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parseRecord(parse(reader));
        }
    }

    public static void write(Path path, FiniteAutomaton automaton, boolean includeMetadata) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJsonObject(automaton, includeMetadata), writer);
            writer.write(System.lineSeparator());
        }
    }

    private static JsonElement parse(String json) throws MalformedRecordException {
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new MalformedRecordException("not valid JSON: " + e.getMessage(), e);
        }
    }

    private static JsonElement parse(Reader reader) throws MalformedRecordException {
        try {
            return JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new MalformedRecordException("not valid JSON: " + e.getMessage(), e);
        }
    }

    private static JsonArray array(JsonObject json, String field, String expected) throws MalformedRecordException {
        final JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new MalformedRecordException("missing field '" + field + "'");
        }
        if (!element.isJsonArray()) {
            throw new MalformedRecordException("field '" + field + "' must be " + expected);
        }
        return element.getAsJsonArray();
    }

    private static List<String> stringList(JsonObject json, String field) throws MalformedRecordException {
        final List<String> result = new ArrayList<>();
        for (JsonElement element : array(json, field, "an array of strings")) {
            if (!isString(element)) {
                throw new MalformedRecordException("field '" + field + "' must be an array of strings");
            }
            result.add(element.getAsString());
        }
        return result;
    }

    private static String string(JsonObject json, String key, String field) throws MalformedRecordException {
        final JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            throw new MalformedRecordException("missing field '" + field + "'");
        }
        return stringValue(element, field);
    }

    private static String stringValue(JsonElement element, String field) throws MalformedRecordException {
        if (!isString(element)) {
            throw new MalformedRecordException("field '" + field + "' must be a string");
        }
        return element.getAsString();
    }

    private static boolean isString(JsonElement element) {
        return element.isJsonPrimitive() && ((JsonPrimitive) element).isString();
    }

    private static JsonArray stringArray(List<String> values) {
        final JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }
}
