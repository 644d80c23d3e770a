package works.fieldwork.exceptions;

/**
 * A value could not be converted to the requested type.
 */
public class CoercionException extends Exception {
	private final Class<?> targetType;

	public Class<?> targetType() {
		return targetType;
	}

	public CoercionException(Object value, Class<?> targetType) {
		super(message(value, targetType));
		this.targetType = targetType;
	}

	public CoercionException(Object value, Class<?> targetType, Throwable cause) {
		super(message(value, targetType), cause);
		this.targetType = targetType;
	}

	private static String message(Object value, Class<?> targetType) {
		String description = (value == null) ? "null" : value.getClass().getSimpleName() + " \"" + value + "\"";
		return "Cannot convert " + description + " to " + targetType.getSimpleName();
	}
}
