package works.fieldwork;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class FieldworkSettings {
	/**
	 * How field names supplied by callers are matched against a {@link FieldTable}.
	 * An exact match always wins over a case-insensitive one.
	 */
	@Default NameMatching nameMatching = NameMatching.EXACT;

	/**
	 * Failed reads and writes are logged at {@code TRACE} normally,
	 * since they are part of the accessor's ordinary contract.
	 * Set this to log them at {@code DEBUG} instead when hunting for
	 * a misspelled field name or a type mismatch.
	 */
	@Default boolean logMisses = false;

	public static FieldworkSettings defaults() {
		return builder().build();
	}

	public enum NameMatching {
		EXACT,
		IGNORE_CASE,
	}
}
