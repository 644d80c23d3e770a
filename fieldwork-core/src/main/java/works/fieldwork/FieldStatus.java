package works.fieldwork;

/**
 * The detailed outcome of reading or writing one field.
 * {@link FieldAccessor#getField getField} and {@link FieldAccessor#setField setField}
 * merge every status other than {@link #OK} into a single "absent" or {@code false} result;
 * {@link FieldAccessor#read read} and {@link FieldAccessor#write write} report them separately.
 */
public enum FieldStatus {
	OK,

	/**
	 * The record itself was null.
	 */
	NO_RECORD,

	/**
	 * The record's type has no field by that name.
	 */
	NO_SUCH_FIELD,

	NOT_READABLE,
	READ_ONLY,

	/**
	 * The value could not be converted to the declared type of the field (when writing)
	 * or to the type requested by the caller (when reading).
	 */
	COERCION_FAILED,

	/**
	 * The field's own getter or setter threw an exception.
	 */
	REJECTED,
}
