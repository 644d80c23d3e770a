package works.fieldwork;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The value of a field, or the reason there isn't one.
 *
 * @param value meaningful only when {@code status} is {@link FieldStatus#OK OK}
 */
public record FieldRead<V>(FieldStatus status, @Nullable V value) {
	public FieldRead {
		requireNonNull(status);
		if (status != FieldStatus.OK && value != null) {
			throw new IllegalArgumentException("Unsuccessful read can't have a value");
		}
	}

	public static <V> FieldRead<V> of(@Nullable V value) {
		return new FieldRead<>(FieldStatus.OK, value);
	}

	public static <V> FieldRead<V> failed(FieldStatus status) {
		if (status == FieldStatus.OK) {
			throw new IllegalArgumentException("Status must indicate a failure");
		}
		return new FieldRead<>(status, null);
	}

	public boolean isPresent() {
		return status == FieldStatus.OK;
	}

	public V orElse(V fallback) {
		return isPresent() ? value : fallback;
	}
}
