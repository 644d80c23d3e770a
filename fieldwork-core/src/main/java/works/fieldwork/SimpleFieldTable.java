package works.fieldwork;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.fieldwork.exceptions.InvalidTypeException;

final class SimpleFieldTable<R> implements FieldTable<R> {
	private final Class<R> recordType;
	private final List<FieldHandle<R, ?>> fields;
	private final Map<String, FieldHandle<R, ?>> fieldsByName;
	private final @Nullable Supplier<? extends R> constructor;

	SimpleFieldTable(Class<R> recordType, List<FieldHandle<R, ?>> fields, @Nullable Supplier<? extends R> constructor) {
		this.recordType = recordType;
		this.fields = fields;
		this.fieldsByName = new LinkedHashMap<>();
		fields.forEach(f -> fieldsByName.put(f.name(), f));
		this.constructor = constructor;
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
	public Optional<FieldHandle<R, ?>> field(String name) {
		return Optional.ofNullable(fieldsByName.get(name));
	}

	@Override
	public R newInstance() throws InvalidTypeException {
		if (constructor == null) {
			throw new InvalidTypeException("No constructor for " + recordType.getSimpleName());
		}
		R result;
		try {
			result = constructor.get();
		} catch (RuntimeException e) {
			throw new InvalidTypeException("Unable to construct " + recordType.getSimpleName(), e);
		}
		if (result == null) {
			throw new InvalidTypeException("Constructor for " + recordType.getSimpleName() + " returned null");
		}
		return result;
	}

	@Override
	public String toString() {
		return "FieldTable(" + recordType.getSimpleName() + ")" + fields;
	}
}
