package works.fieldwork;

import java.lang.invoke.MethodHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.fieldwork.exceptions.CoercionException;
import works.fieldwork.exceptions.InvalidTypeException;

/**
 * A table for a Java {@link Record}: every field is read-only,
 * and all of them are bound at construction time.
 */
final class RecordFieldTable<R> implements FieldTable<R> {
	private final Class<R> recordType;
	private final List<FieldHandle<R, ?>> fields;
	private final MethodHandle canonicalConstructor;

	RecordFieldTable(Class<R> recordType, List<FieldHandle<R, ?>> fields, MethodHandle canonicalConstructor) {
		this.recordType = recordType;
		this.fields = fields;
		this.canonicalConstructor = canonicalConstructor;
	}

	@Override
	public Class<R> recordType() {
		return recordType;
	}

	@Override
	public List<FieldHandle<R, ?>> fields() {
		return fields;
	}

	@Override
	public R newInstance() throws InvalidTypeException {
		return newInstance(Map.of());
	}

	/**
	 * Each component takes its value from {@code initialValues}, coerced to the component's type.
	 * Components that are missing, or whose value can't be coerced, get their default value.
	 */
	@Override
	public R newInstance(Map<String, ?> initialValues) throws InvalidTypeException {
		List<Object> arguments = new ArrayList<>(fields.size());
		for (FieldHandle<R, ?> field : fields) {
			Object argument = Coercions.defaultValue(field.type());
			if (initialValues.containsKey(field.name())) {
				Object supplied = initialValues.get(field.name());
				try {
					argument = Coercions.coerce(supplied, field.type());
				} catch (CoercionException e) {
					LOGGER.debug("Leaving {}.{} at its default value: {}", recordType.getSimpleName(), field.name(), e.getMessage());
				}
			}
			arguments.add(argument);
		}
		try {
			return recordType.cast(canonicalConstructor.invokeWithArguments(arguments));
		} catch (Throwable e) {
			throw new InvalidTypeException("Unable to construct " + recordType.getSimpleName(), e);
		}
	}

	@Override
	public String toString() {
		return "FieldTable(" + recordType.getSimpleName() + ")" + fields;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordFieldTable.class);
}
