package FAMin.Record;

/**
 * A structural record could not be read: a field is missing or has the wrong type, the type tag is unknown,
 * or the input is not parseable at all.
 */
public class MalformedRecordException extends Exception {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
