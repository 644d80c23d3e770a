package works.fieldwork;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The uniform outcome of a service-level operation:
 * either a {@link Success} carrying an optional payload and a total count
 * (for paged results), or a {@link Failure} carrying at least one error message.
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {
	boolean isSuccess();

	/**
	 * @return the payload of a {@link Success}; always empty for a {@link Failure}
	 */
	Optional<T> payload();

	/**
	 * @return the error messages of a {@link Failure}; always empty for a {@link Success}
	 */
	List<String> errors();

	int totalCount();

	static <T> OperationResult<T> success() {
		return new Success<>(null, 0);
	}

	static <T> OperationResult<T> success(@Nullable T payload) {
		return new Success<>(payload, 0);
	}

	static <T> OperationResult<T> success(@Nullable T payload, int totalCount) {
		return new Success<>(payload, totalCount);
	}

	static <T> OperationResult<T> failure(String message) {
		return new Failure<>(List.of(message));
	}

	static <T> OperationResult<T> failure(List<String> messages) {
		return new Failure<>(messages);
	}

	default <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
		if (this instanceof Success<T> s) {
			return new Success<>(mapper.apply(s.value()), s.totalCount());
		}
		return new Failure<>(errors());
	}

	default <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> mapper) {
		if (this instanceof Success<T> s) {
			return requireNonNull(mapper.apply(s.value()));
		}
		return new Failure<>(errors());
	}

	default T orElse(T fallback) {
		return payload().orElse(fallback);
	}

	record Success<T>(@Nullable T value, int totalCount) implements OperationResult<T> {
		public Success {
			if (totalCount < 0) {
				throw new IllegalArgumentException("Total count can't be negative: " + totalCount);
			}
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public Optional<T> payload() {
			return Optional.ofNullable(value);
		}

		@Override
		public List<String> errors() {
			return List.of();
		}
	}

	record Failure<T>(List<String> errors) implements OperationResult<T> {
		public Failure {
			errors = List.copyOf(errors);
			if (errors.isEmpty()) {
				throw new IllegalArgumentException("Failure must have at least one error message");
			}
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		public Optional<T> payload() {
			return Optional.empty();
		}

		@Override
		public int totalCount() {
			return 0;
		}
	}
}
