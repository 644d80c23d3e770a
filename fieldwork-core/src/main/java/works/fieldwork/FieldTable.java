package works.fieldwork;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import works.fieldwork.exceptions.InvalidTypeException;

/**
 * The capability that lets {@link FieldAccessor} work with records of type {@code R}
 * without knowing their shape: the fields they have, in order,
 * and a way to create a fresh instance.
 * <p>
 * A table can be written by hand using {@link #builder}, or derived
 * reflectively by {@link FieldTables#scan}. Either way, it is immutable type
 * metadata, and holds no record state.
 */
public interface FieldTable<R> {
	Class<R> recordType();

	/**
	 * @return every field, in the order the type declares them
	 */
	List<FieldHandle<R, ?>> fields();

	default Optional<FieldHandle<R, ?>> field(String name) {
		return fields().stream()
			.filter(f -> f.name().equals(name))
			.findFirst();
	}

	default Optional<FieldHandle<R, ?>> fieldIgnoringCase(String name) {
		return field(name).or(() -> fields().stream()
			.filter(f -> f.name().equalsIgnoreCase(name))
			.findFirst());
	}

	/**
	 * @return a new instance with every field at its zero value
	 * @throws InvalidTypeException if {@code R} can't be default-constructed
	 */
	R newInstance() throws InvalidTypeException;

	/**
	 * Creates a new instance, passing any constructor-bound fields their values
	 * from {@code initialValues}.
	 * <p>
	 * Tables for mutable types have no constructor-bound fields,
	 * so the default implementation ignores {@code initialValues};
	 * callers apply them afterward through the {@link FieldHandle#setter setters}.
	 */
	default R newInstance(Map<String, ?> initialValues) throws InvalidTypeException {
		return newInstance();
	}

	static <R> Builder<R> builder(Class<R> recordType, Supplier<? extends R> constructor) {
		return new Builder<>(recordType, constructor);
	}

	/**
	 * For types that can't be constructed; {@link #newInstance()} will always throw.
	 */
	static <R> Builder<R> builder(Class<R> recordType) {
		return new Builder<>(recordType, null);
	}

	final class Builder<R> {
		private final Class<R> recordType;
		private final @Nullable Supplier<? extends R> constructor;
		private final Map<String, FieldHandle<R, ?>> fields = new LinkedHashMap<>();

		Builder(Class<R> recordType, @Nullable Supplier<? extends R> constructor) {
			this.recordType = recordType;
			this.constructor = constructor;
		}

		public <V> Builder<R> field(String name, Class<V> type, Function<? super R, ? extends V> getter, BiConsumer<? super R, ? super V> setter) {
			return add(FieldHandle.readWrite(name, type, getter, setter));
		}

		public <V> Builder<R> readOnly(String name, Class<V> type, Function<? super R, ? extends V> getter) {
			return add(FieldHandle.readOnly(name, type, getter));
		}

		public <V> Builder<R> writeOnly(String name, Class<V> type, BiConsumer<? super R, ? super V> setter) {
			return add(FieldHandle.writeOnly(name, type, setter));
		}

		public Builder<R> add(FieldHandle<R, ?> handle) {
			FieldHandle<R, ?> existing = fields.putIfAbsent(handle.name(), handle);
			if (existing != null) {
				throw new IllegalArgumentException("Duplicate field \"" + handle.name() + "\" in " + recordType.getSimpleName());
			}
			return this;
		}

		public FieldTable<R> build() {
			return new SimpleFieldTable<>(recordType, List.copyOf(fields.values()), constructor);
		}

		@Override
		public String toString() {
			return "FieldTable.Builder(recordType=" + recordType.getSimpleName() + ", fields=" + fields.keySet() + ")";
		}
	}
}
