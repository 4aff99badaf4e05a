package FAMin.Record;

/**
 * One transition of a structural record. NA epsilon moves use {@link FAMin.Model.NA#EPSILON} as symbol.
 */
public record TransitionRecord(String origin, String symbol, String destination) {
}
