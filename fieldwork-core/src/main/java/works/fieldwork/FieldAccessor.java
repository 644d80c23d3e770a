package works.fieldwork;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.fieldwork.exceptions.CoercionException;
import works.fieldwork.exceptions.InvalidTypeException;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * Reads, writes, copies and compares fields of records whose shape
 * is known only at runtime, through their {@link FieldTable}s.
 *
 * <p>
 * Every operation is best-effort: a field that doesn't exist, can't be read or written,
 * or holds a value that can't be coerced to the required type
 * is reported as an absent value (null, or zero for primitives) or {@code false},
 * never as an exception. As a consequence, {@link #getField} can't distinguish
 * a missing field from one that holds its zero value; use {@link #hasField}
 * or {@link #read} when that matters.
 *
 * <p>
 * Construction failures are the exception that proves the rule: operations that
 * must build a new record, such as {@link #fromMapping} and {@link #copyFields},
 * return null when the target type can't be constructed.
 *
 * <p>
 * An accessor holds no record state, so it may be shared freely between threads.
 * Concurrent writes to the <em>same</em> record are not synchronized here;
 * each individual field is either fully updated or left alone,
 * but a sequence of writes is not atomic as a whole.
 */
public final class FieldAccessor {
	private final FieldTableRegistry registry;
	private final FieldworkSettings settings;
	private final MappingTranscoder transcoder;

	public FieldAccessor() {
		this(new FieldTableRegistry(), FieldworkSettings.defaults());
	}

	public FieldAccessor(FieldTableRegistry registry, FieldworkSettings settings) {
		this.registry = requireNonNull(registry);
		this.settings = requireNonNull(settings);
		this.transcoder = new FieldTableTranscoder(this);
	}

	public FieldAccessor(FieldTableRegistry registry, FieldworkSettings settings, MappingTranscoder transcoder) {
		this.registry = requireNonNull(registry);
		this.settings = requireNonNull(settings);
		this.transcoder = requireNonNull(transcoder);
	}

	public FieldTableRegistry registry() {
		return registry;
	}

	public FieldworkSettings settings() {
		return settings;
	}

	public MappingTranscoder transcoder() {
		return transcoder;
	}

	//
	// Conversion
	//

	/**
	 * Reinterprets {@code source} as a {@code targetType}.
	 * If {@code source} already is one, it is returned as-is;
	 * otherwise it is encoded to a mapping and decoded as a new {@code targetType}
	 * by the {@link #transcoder()}.
	 *
	 * @return null if {@code source} is null or the round trip fails
	 */
	public <T> @Nullable T convertTo(@Nullable Object source, @NotNull Class<T> targetType) {
		if (source == null) {
			return null;
		} else if (targetType.isInstance(source)) {
			return targetType.cast(source);
		}
		try {
			Map<String, Object> mapping = transcoder.encode(source);
			return transcoder.decode(mapping, targetType);
		} catch (RuntimeException e) {
			LOGGER.debug("Unable to convert {} to {} using {}", source.getClass().getSimpleName(), targetType.getSimpleName(), transcoder, e);
			return null;
		}
	}

	/**
	 * Like {@link #convertTo} for scalar types such as numbers, booleans and dates,
	 * using {@link Coercions#coerce} instead of a structural copy.
	 *
	 * @return the {@link Coercions#zeroValue zero value} of {@code kind}
	 * if {@code source} is null or can't be coerced
	 */
	public <T> T convertToScalar(@Nullable Object source, @NotNull Class<T> kind) {
		if (source == null) {
			return Coercions.zeroValue(kind);
		}
		try {
			return Coercions.coerce(source, kind);
		} catch (CoercionException e) {
			LOGGER.debug("Unable to convert to scalar: {}", e.getMessage());
			return Coercions.zeroValue(kind);
		}
	}

	//
	// Individual fields
	//

	/**
	 * @return the descriptor of the named field of {@code record}'s type, if it has one
	 */
	public Optional<FieldHandle<?, ?>> describe(@Nullable Object record, @Nullable String fieldName) {
		if (record == null || fieldName == null || fieldName.isEmpty()) {
			return Optional.empty();
		}
		try {
			return resolve(registry.tableOf(record), fieldName).map(h -> h);
		} catch (InvalidTypeException e) {
			logMiss("describe", record, fieldName, FieldStatus.NO_SUCH_FIELD, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * @return true if {@code record} has a readable field named {@code fieldName},
	 * regardless of the value it holds
	 */
	public boolean hasField(@Nullable Object record, @Nullable String fieldName) {
		return describe(record, fieldName)
			.map(FieldHandle::readable)
			.orElse(false);
	}

	/**
	 * Reads a field, reporting exactly why when there is no value to return.
	 */
	public <V> FieldRead<V> read(@Nullable Object record, @Nullable String fieldName, @NotNull Class<V> type) {
		if (record == null) {
			return logMiss("read", null, fieldName, FieldRead.failed(FieldStatus.NO_RECORD));
		}
		Optional<FieldHandle<Object, ?>> handle = resolveOrLog(record, fieldName);
		if (handle.isEmpty()) {
			return FieldRead.failed(FieldStatus.NO_SUCH_FIELD);
		} else if (!handle.get().readable()) {
			return logMiss("read", record, fieldName, FieldRead.failed(FieldStatus.NOT_READABLE));
		}

		Object raw;
		try {
			raw = handle.get().get(record);
		} catch (RuntimeException e) {
			LOGGER.debug("Getter for {}.{} threw", record.getClass().getSimpleName(), fieldName, e);
			return FieldRead.failed(FieldStatus.REJECTED);
		}
		try {
			return FieldRead.of(Coercions.coerce(raw, type));
		} catch (CoercionException e) {
			logMiss("read", record, fieldName, FieldStatus.COERCION_FAILED, e.getMessage());
			return FieldRead.failed(FieldStatus.COERCION_FAILED);
		}
	}

	/**
	 * @return the field's value, or null if there isn't one
	 */
	public @Nullable Object getField(@Nullable Object record, @Nullable String fieldName) {
		return getField(record, fieldName, Object.class);
	}

	/**
	 * @return the field's value coerced to {@code type},
	 * or the {@link Coercions#defaultValue default value} of {@code type}
	 * if the field is missing, unreadable, or not coercible
	 */
	public <V> V getField(@Nullable Object record, @Nullable String fieldName, @NotNull Class<V> type) {
		return read(record, fieldName, type).orElse(Coercions.defaultValue(type));
	}

	/**
	 * Writes a field, reporting exactly why when it can't.
	 * The value is coerced to the field's declared type first,
	 * so a failed coercion leaves the field untouched.
	 */
	public FieldStatus write(@Nullable Object record, @Nullable String fieldName, @Nullable Object value) {
		if (record == null) {
			return logMiss("write", null, fieldName, FieldStatus.NO_RECORD, "no record");
		}
		Optional<FieldHandle<Object, ?>> handle = resolveOrLog(record, fieldName);
		if (handle.isEmpty()) {
			return FieldStatus.NO_SUCH_FIELD;
		} else if (!handle.get().writable()) {
			return logMiss("write", record, fieldName, FieldStatus.READ_ONLY, "field is read-only");
		}
		return assign(handle.get(), record, value);
	}

	/**
	 * @return true if the field was updated; false if it is missing, read-only,
	 * or {@code value} can't be coerced to its type, in which case the record is unchanged
	 */
	public boolean setField(@Nullable Object record, @Nullable String fieldName, @Nullable Object value) {
		return write(record, fieldName, value) == FieldStatus.OK;
	}

	private <R, V> FieldStatus assign(FieldHandle<R, V> handle, R record, Object value) {
		V coerced;
		try {
			coerced = Coercions.coerce(value, handle.type());
		} catch (CoercionException e) {
			return logMiss("write", record, handle.name(), FieldStatus.COERCION_FAILED, e.getMessage());
		}
		try {
			handle.set(record, coerced);
		} catch (RuntimeException e) {
			LOGGER.debug("Setter for {}.{} threw", record.getClass().getSimpleName(), handle.name(), e);
			return FieldStatus.REJECTED;
		}
		return FieldStatus.OK;
	}

	//
	// Mappings
	//

	/**
	 * @return every readable field of {@code record}, in table order;
	 * empty if {@code record} is null or its type can't be described
	 */
	public Map<String, Object> toMapping(@Nullable Object record) {
		Map<String, Object> result = new LinkedHashMap<>();
		if (record == null) {
			return result;
		}
		FieldTable<Object> table;
		try {
			table = registry.tableOf(record);
		} catch (InvalidTypeException e) {
			LOGGER.debug("Unable to map {}: {}", record.getClass().getSimpleName(), e.getMessage());
			return result;
		}
		for (FieldHandle<Object, ?> field : table.fields()) {
			if (field.readable()) {
				try {
					result.put(field.name(), field.get(record));
				} catch (RuntimeException e) {
					LOGGER.debug("Omitting {}.{} because its getter threw", table.recordType().getSimpleName(), field.name(), e);
				}
			}
		}
		return result;
	}

	/**
	 * Creates a new {@code targetType} and sets each field in {@code mapping}, in mapping order.
	 * Fields that can't be set are left at their zero value.
	 *
	 * @return null if {@code mapping} is null or {@code targetType} can't be constructed
	 */
	public <T> @Nullable T fromMapping(@Nullable Map<String, ?> mapping, @NotNull Class<T> targetType) {
		if (mapping == null) {
			return null;
		}
		try {
			return buildFromMapping(mapping, targetType);
		} catch (InvalidTypeException e) {
			LOGGER.debug("Unable to build {}: {}", targetType.getSimpleName(), e.getMessage());
			return null;
		}
	}

	<T> T buildFromMapping(Map<String, ?> mapping, Class<T> targetType) throws InvalidTypeException {
		FieldTable<T> table = registry.tableFor(targetType);
		Map<String, Object> initialValues = new LinkedHashMap<>();
		mapping.forEach((name, value) -> resolve(table, name)
			.ifPresent(field -> initialValues.putIfAbsent(field.name(), value)));
		T result = table.newInstance(initialValues);
		mapping.forEach((name, value) -> write(result, name, value));
		return result;
	}

	//
	// Copying
	//

	/**
	 * Creates a new {@code targetType} whose named fields are read from {@code source}.
	 * A name that {@code source} lacks is copied as an absent value, which clears
	 * the corresponding target field if it accepts null.
	 *
	 * @return null if {@code source} is null, no names are given, or {@code targetType} can't be constructed
	 */
	public <T> @Nullable T copyFields(@Nullable Object source, @NotNull Class<T> targetType, String... fieldNames) {
		return copyFields(source, targetType, (fieldNames == null) ? null : asList(fieldNames));
	}

	public <T> @Nullable T copyFields(@Nullable Object source, @NotNull Class<T> targetType, @Nullable List<String> fieldNames) {
		if (source == null || fieldNames == null || fieldNames.isEmpty()) {
			return null;
		}
		Map<String, Object> values = new LinkedHashMap<>();
		for (String name : fieldNames) {
			values.putIfAbsent(name, getField(source, name));
		}
		return fromMapping(values, targetType);
	}

	/**
	 * {@link #copyFields} for every readable field of {@code source}.
	 */
	public <T> @Nullable T copyAllFields(@Nullable Object source, @NotNull Class<T> targetType) {
		if (source == null) {
			return null;
		}
		return copyFields(source, targetType, readableFieldNames(source));
	}

	/**
	 * @return the names of {@code record}'s readable fields, in table order
	 */
	public List<String> readableFieldNames(@Nullable Object record) {
		return new ArrayList<>(toMapping(record).keySet());
	}

	//
	// Bulk updates
	//

	/**
	 * Sets each named field to null.
	 * Fields that don't accept null are left unchanged.
	 */
	public void clearFields(@Nullable Object record, String... fieldNames) {
		if (record == null || fieldNames == null) {
			return;
		}
		for (String name : fieldNames) {
			setField(record, name, null);
		}
	}

	/**
	 * Sets each named field to the {@link Coercions#zeroValue zero value} of its declared type.
	 */
	public void resetFields(@Nullable Object record, String... fieldNames) {
		if (record == null || fieldNames == null) {
			return;
		}
		for (String name : fieldNames) {
			describe(record, name).ifPresent(field ->
				setField(record, field.name(), Coercions.zeroValue(field.type())));
		}
	}

	//
	// Comparison
	//

	/**
	 * @return true if every named field has deeply equal values in {@code a} and {@code b};
	 * false if either record or {@code fieldNames} is null
	 */
	public boolean fieldsEqual(@Nullable Object a, @Nullable Object b, String... fieldNames) {
		return fieldsEqual(a, b, (fieldNames == null) ? null : asList(fieldNames));
	}

	public boolean fieldsEqual(@Nullable Object a, @Nullable Object b, @Nullable List<String> fieldNames) {
		if (a == null || b == null || fieldNames == null) {
			return false;
		}
		for (String name : fieldNames) {
			if (!Objects.deepEquals(getField(a, name), getField(b, name))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the names, in the order given, of the fields whose values differ
	 * between {@code original} and {@code current}
	 */
	public List<String> changedFields(@Nullable Object original, @Nullable Object current, String... fieldNames) {
		return changedFields(original, current, (fieldNames == null) ? null : asList(fieldNames));
	}

	public List<String> changedFields(@Nullable Object original, @Nullable Object current, @Nullable List<String> fieldNames) {
		List<String> result = new ArrayList<>();
		if (original == null || current == null || fieldNames == null) {
			return result;
		}
		for (String name : fieldNames) {
			if (!Objects.deepEquals(getField(original, name), getField(current, name))) {
				result.add(name);
			}
		}
		return result;
	}

	//
	// Resolution
	//

	private <R> Optional<FieldHandle<R, ?>> resolve(FieldTable<R> table, String fieldName) {
		return switch (settings.getNameMatching()) {
			case EXACT -> table.field(fieldName);
			case IGNORE_CASE -> table.fieldIgnoringCase(fieldName);
		};
	}

	private Optional<FieldHandle<Object, ?>> resolveOrLog(Object record, String fieldName) {
		if (fieldName == null || fieldName.isEmpty()) {
			logMiss("resolve", record, fieldName, FieldStatus.NO_SUCH_FIELD, "no field name");
			return Optional.empty();
		}
		Optional<FieldHandle<Object, ?>> result;
		try {
			result = resolve(registry.tableOf(record), fieldName);
		} catch (InvalidTypeException e) {
			logMiss("resolve", record, fieldName, FieldStatus.NO_SUCH_FIELD, e.getMessage());
			return Optional.empty();
		}
		if (result.isEmpty()) {
			logMiss("resolve", record, fieldName, FieldStatus.NO_SUCH_FIELD, "no such field");
		}
		return result;
	}

	private <V> FieldRead<V> logMiss(String operation, Object record, String fieldName, FieldRead<V> outcome) {
		logMiss(operation, record, fieldName, outcome.status(), null);
		return outcome;
	}

	private FieldStatus logMiss(String operation, Object record, String fieldName, FieldStatus status, String detail) {
		String typeName = (record == null) ? "null" : record.getClass().getSimpleName();
		if (settings.isLogMisses()) {
			LOGGER.debug("{} {}.{}: {} {}", operation, typeName, fieldName, status, (detail == null) ? "" : detail);
		} else {
			LOGGER.trace("{} {}.{}: {} {}", operation, typeName, fieldName, status, (detail == null) ? "" : detail);
		}
		return status;
	}

	@Override
	public String toString() {
		return "FieldAccessor{" +
			"settings=" + settings +
			", transcoder=" + transcoder +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldAccessor.class);
}
