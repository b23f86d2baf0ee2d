package space.ketterling.waterstress.grid;

/**
 * Thrown when grid coordinate or time metadata cannot be trusted: axes that
 * are not strictly monotonic, duplicate coordinates, missing variables or
 * shapes that do not match the declared dimensions. Always fatal for a run.
 */
public class MalformedGridException extends RuntimeException {

    public MalformedGridException(String message) {
        super(message);
    }

    public MalformedGridException(String message, Throwable cause) {
        super(message, cause);
    }
}
