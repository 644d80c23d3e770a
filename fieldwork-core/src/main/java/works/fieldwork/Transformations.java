package works.fieldwork;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static java.util.Objects.requireNonNull;

/**
 * Service-facing record transformations built on a {@link FieldAccessor},
 * reporting their outcomes as {@link OperationResult}s instead of absent values.
 */
public final class Transformations {
	private final FieldAccessor accessor;

	public Transformations(FieldAccessor accessor) {
		this.accessor = requireNonNull(accessor);
	}

	public OperationResult<Map<String, Object>> toMapping(Object record, boolean includeNulls) {
		if (record == null) {
			return OperationResult.failure("Record can't be null");
		}
		Map<String, Object> mapping = accessor.toMapping(record);
		if (!includeNulls) {
			mapping.values().removeIf(v -> v == null);
		}
		return OperationResult.success(mapping);
	}

	public <T> OperationResult<T> fromMapping(Map<String, ?> mapping, Class<T> targetType) {
		if (mapping == null) {
			return OperationResult.failure("Mapping can't be null");
		}
		return present(accessor.fromMapping(mapping, targetType), "Unable to construct " + targetType.getSimpleName());
	}

	public <T> OperationResult<T> transformTo(Object source, Class<T> targetType) {
		if (source == null) {
			return OperationResult.failure("Source can't be null");
		}
		return present(accessor.convertTo(source, targetType),
			"Unable to transform " + source.getClass().getSimpleName() + " to " + targetType.getSimpleName());
	}

	/**
	 * Transforms every element, skipping those that fail.
	 * The {@link OperationResult#totalCount() total count} is the number of sources,
	 * so callers can tell how many were skipped.
	 */
	public <T> OperationResult<List<T>> transformAll(List<?> sources, Class<T> targetType) {
		if (sources == null) {
			return OperationResult.failure("Source list can't be null");
		}
		List<T> result = new ArrayList<>(sources.size());
		for (Object source : sources) {
			OperationResult<T> transformed = transformTo(source, targetType);
			if (transformed.isSuccess()) {
				result.add(transformed.orElse(null));
			} else {
				LOGGER.debug("Skipping element: {}", transformed.errors());
			}
		}
		return OperationResult.success(result, sources.size());
	}

	/**
	 * Copies {@code source} by a full round trip through the accessor's {@link MappingTranscoder}.
	 */
	@SuppressWarnings("unchecked")
	public <T> OperationResult<T> deepCopy(T source) {
		if (source == null) {
			return OperationResult.failure("Source can't be null");
		}
		Class<T> type = (Class<T>) source.getClass();
		try {
			MappingTranscoder transcoder = accessor.transcoder();
			return OperationResult.success(transcoder.decode(transcoder.encode(source), type));
		} catch (RuntimeException e) {
			LOGGER.debug("Deep copy of {} failed", type.getSimpleName(), e);
			return OperationResult.failure("Unable to copy " + type.getSimpleName() + ": " + e.getMessage());
		}
	}

	public <T> OperationResult<T> copyFields(Object source, Class<T> targetType, String... fieldNames) {
		if (source == null) {
			return OperationResult.failure("Source can't be null");
		} else if (fieldNames == null || fieldNames.length == 0) {
			return OperationResult.failure("No field names given");
		}
		return present(accessor.copyFields(source, targetType, fieldNames), "Unable to construct " + targetType.getSimpleName());
	}

	/**
	 * Copies every readable field of {@code source} except those named,
	 * which are matched without regard to case.
	 */
	public <T> OperationResult<T> copyFieldsExcluding(Object source, Class<T> targetType, String... excludedNames) {
		if (source == null) {
			return OperationResult.failure("Source can't be null");
		}
		Set<String> excluded = (excludedNames == null) ? Set.of() : lowerCase(asList(excludedNames));
		List<String> names = accessor.readableFieldNames(source).stream()
			.filter(name -> !excluded.contains(name.toLowerCase(Locale.ROOT)))
			.collect(Collectors.toList());
		if (names.isEmpty()) {
			return present(accessor.fromMapping(Map.of(), targetType), "Unable to construct " + targetType.getSimpleName());
		}
		return present(accessor.copyFields(source, targetType, names), "Unable to construct " + targetType.getSimpleName());
	}

	/**
	 * Applies the non-null {@code updates} to {@code target} in place.
	 *
	 * @return the names of the fields actually updated
	 */
	public OperationResult<List<String>> update(Object target, Map<String, ?> updates) {
		if (target == null) {
			return OperationResult.failure("Target can't be null");
		} else if (updates == null || updates.isEmpty()) {
			return OperationResult.failure("No updates given");
		}
		List<String> updated = new ArrayList<>();
		updates.forEach((name, value) -> {
			if (value != null && accessor.setField(target, name, value)) {
				updated.add(name);
			}
		});
		return OperationResult.success(updated, updated.size());
	}

	/**
	 * Like {@link #update(Object, Map)}, ignoring updates to fields not in {@code allowedNames},
	 * which are matched without regard to case.
	 */
	public OperationResult<List<String>> update(Object target, Map<String, ?> updates, String... allowedNames) {
		if (target == null) {
			return OperationResult.failure("Target can't be null");
		} else if (allowedNames == null || allowedNames.length == 0) {
			return OperationResult.failure("No allowed field names given");
		} else if (updates == null || updates.isEmpty()) {
			return OperationResult.failure("No updates given");
		}
		Set<String> allowed = lowerCase(asList(allowedNames));
		Map<String, Object> filtered = new LinkedHashMap<>();
		updates.forEach((name, value) -> {
			if (allowed.contains(name.toLowerCase(Locale.ROOT))) {
				filtered.put(name, value);
			}
		});
		if (filtered.isEmpty()) {
			return OperationResult.success(List.of(), 0);
		}
		return update(target, filtered);
	}

	/**
	 * @return whether all the named fields are equal in {@code a} and {@code b}
	 */
	public OperationResult<Boolean> compare(Object a, Object b, String... fieldNames) {
		if (a == null || b == null) {
			return OperationResult.failure("Records can't be null");
		} else if (fieldNames == null || fieldNames.length == 0) {
			return OperationResult.failure("No field names given");
		}
		return OperationResult.success(accessor.fieldsEqual(a, b, fieldNames));
	}

	private static <T> OperationResult<T> present(T value, String errorMessage) {
		if (value == null) {
			return OperationResult.failure(errorMessage);
		}
		return OperationResult.success(value);
	}

	private static Set<String> lowerCase(List<String> names) {
		return names.stream()
			.map(n -> n.toLowerCase(Locale.ROOT))
			.collect(Collectors.toSet());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Transformations.class);
}
