package se.kth.syntax.exception;

/**
 * Thrown when a serialized raw tree cannot be read back.
 *
 * @author Simon Larsén
 */
public class SerializationException extends SyntaxException {
    public SerializationException(String s) {
        super(s);
    }

    public SerializationException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
