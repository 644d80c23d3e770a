package works.fieldwork;

import java.util.function.BiConsumer;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Describes one named field of records of type {@code R}:
 * its declared {@code type}, and the functions that read and write it.
 * <p>
 * A field without a {@code getter} is not readable; a field without a
 * {@code setter} is read-only and is ignored by every write operation.
 *
 * @param type the declared type, which may be primitive,
 *             in which case the field rejects {@code null}
 */
public record FieldHandle<R, V>(
	String name,
	Class<V> type,
	@Nullable Function<? super R, ? extends V> getter,
	@Nullable BiConsumer<? super R, ? super V> setter
) {
	public FieldHandle {
		requireNonNull(name);
		requireNonNull(type);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Field name can't be empty");
		} else if (getter == null && setter == null) {
			throw new IllegalArgumentException("Field \"" + name + "\" must be readable or writable");
		}
	}

	public static <R, V> FieldHandle<R, V> readWrite(String name, Class<V> type, Function<? super R, ? extends V> getter, BiConsumer<? super R, ? super V> setter) {
		return new FieldHandle<>(name, type, requireNonNull(getter), requireNonNull(setter));
	}

	public static <R, V> FieldHandle<R, V> readOnly(String name, Class<V> type, Function<? super R, ? extends V> getter) {
		return new FieldHandle<>(name, type, requireNonNull(getter), null);
	}

	public static <R, V> FieldHandle<R, V> writeOnly(String name, Class<V> type, BiConsumer<? super R, ? super V> setter) {
		return new FieldHandle<>(name, type, null, requireNonNull(setter));
	}

	public boolean readable() {
		return getter != null;
	}

	public boolean writable() {
		return setter != null;
	}

	public V get(R record) {
		if (getter == null) {
			throw new IllegalStateException("Field \"" + name + "\" is not readable");
		}
		return getter.apply(record);
	}

	public void set(R record, V value) {
		if (setter == null) {
			throw new IllegalStateException("Field \"" + name + "\" is read-only");
		}
		setter.accept(record, value);
	}

	@Override
	public String toString() {
		return name + ":" + type.getSimpleName() + (readable() ? "" : " (write-only)") + (writable() ? "" : " (read-only)");
	}
}
