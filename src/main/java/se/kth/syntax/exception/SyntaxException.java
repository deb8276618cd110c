package se.kth.syntax.exception;

/**
 * Base exception for errors raised by the syntax tree library.
 *
 * @author Simon Larsén
 */
public abstract class SyntaxException extends RuntimeException {
    public SyntaxException(String s) {
        super(s);
    }

    public SyntaxException(String s, Throwable throwable) {
        super(s, throwable);
    }
}
