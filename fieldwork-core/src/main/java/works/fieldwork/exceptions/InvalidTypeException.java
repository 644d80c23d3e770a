package works.fieldwork.exceptions;

/**
 * A type cannot be described by a {@link works.fieldwork.FieldTable},
 * or the table it has cannot do what was asked of it,
 * such as constructing a new instance.
 */
public class InvalidTypeException extends Exception {
	public InvalidTypeException(String message) {
		super(message);
	}

	public InvalidTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
