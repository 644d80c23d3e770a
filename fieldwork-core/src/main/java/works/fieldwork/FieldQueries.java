package works.fieldwork;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import works.fieldwork.exceptions.CoercionException;

import static java.util.Objects.requireNonNull;

/**
 * Sorting, filtering, grouping and aggregation of record lists
 * by a field named at runtime.
 * <p>
 * When no element of the list has the named field, operations that reorder or
 * filter return the elements unchanged, and aggregates return zero.
 * All results are new lists; the input is never modified.
 */
public final class FieldQueries {
	private final FieldAccessor accessor;

	public FieldQueries(FieldAccessor accessor) {
		this.accessor = requireNonNull(accessor);
	}

	public <T> List<T> sortBy(List<T> records, String fieldName, boolean ascending) {
		List<T> result = new ArrayList<>(records);
		if (!anyHas(records, fieldName)) {
			return result;
		}
		Comparator<T> comparator = Comparator.comparing(r -> accessor.getField(r, fieldName), FieldQueries::compareValues);
		result.sort(ascending ? comparator : comparator.reversed());
		return result;
	}

	public <T> List<T> whereEquals(List<T> records, String fieldName, Object value) {
		if (!anyHas(records, fieldName)) {
			return new ArrayList<>(records);
		}
		return records.stream()
			.filter(r -> Objects.deepEquals(accessor.getField(r, fieldName), value))
			.collect(Collectors.toList());
	}

	/**
	 * Keeps records whose field, as a string, contains {@code text} without regard to case.
	 * Records whose field is null never match.
	 */
	public <T> List<T> whereContains(List<T> records, String fieldName, String text) {
		if (!anyHas(records, fieldName)) {
			return new ArrayList<>(records);
		}
		String needle = text.toLowerCase(Locale.ROOT);
		return records.stream()
			.filter(r -> {
				Object fieldValue = accessor.getField(r, fieldName);
				if (fieldValue == null) {
					return false;
				}
				String haystack = fieldValue.toString();
				return !haystack.isEmpty() && haystack.toLowerCase(Locale.ROOT).contains(needle);
			})
			.collect(Collectors.toList());
	}

	/**
	 * @return groups in order of first appearance; records lacking the field are grouped under null
	 */
	public <T> Map<Object, List<T>> groupBy(List<T> records, String fieldName) {
		Map<Object, List<T>> result = new LinkedHashMap<>();
		for (T record : records) {
			result.computeIfAbsent(accessor.getField(record, fieldName), k -> new ArrayList<>()).add(record);
		}
		return result;
	}

	/**
	 * @return the first record for each distinct value of the field
	 */
	public <T> List<T> distinctBy(List<T> records, String fieldName) {
		if (!anyHas(records, fieldName)) {
			return new ArrayList<>(records);
		}
		return groupBy(records, fieldName).values().stream()
			.map(group -> group.get(0))
			.collect(Collectors.toList());
	}

	/**
	 * Null and non-numeric values count as zero.
	 */
	public BigDecimal sum(List<?> records, String fieldName) {
		BigDecimal total = BigDecimal.ZERO;
		if (!anyHas(records, fieldName)) {
			return total;
		}
		for (Object record : records) {
			total = total.add(numericValue(record, fieldName));
		}
		return total;
	}

	public BigDecimal average(List<?> records, String fieldName) {
		if (records.isEmpty() || !anyHas(records, fieldName)) {
			return BigDecimal.ZERO;
		}
		return sum(records, fieldName).divide(BigDecimal.valueOf(records.size()), MathContext.DECIMAL128);
	}

	public <T> Optional<T> minBy(List<T> records, String fieldName) {
		return sortBy(records, fieldName, true).stream().findFirst();
	}

	public <T> Optional<T> maxBy(List<T> records, String fieldName) {
		return sortBy(records, fieldName, false).stream().findFirst();
	}

	/**
	 * @param pageNumber one-based; values below 1 are treated as 1
	 * @param pageSize values below 1 are treated as {@value #DEFAULT_PAGE_SIZE}
	 */
	public static <T> List<T> page(List<T> records, int pageNumber, int pageSize) {
		int number = Math.max(pageNumber, 1);
		int size = (pageSize < 1) ? DEFAULT_PAGE_SIZE : pageSize;
		long from = (long) (number - 1) * size;
		if (from >= records.size()) {
			return new ArrayList<>();
		}
		int to = (int) Math.min(from + size, records.size());
		return new ArrayList<>(records.subList((int) from, to));
	}

	public static int totalPages(int recordCount, int pageSize) {
		int size = (pageSize < 1) ? DEFAULT_PAGE_SIZE : pageSize;
		return (int) ((Math.max(recordCount, 0) + (long) size - 1) / size);
	}

	/**
	 * Splits {@code records} into consecutive pages of {@code pageSize};
	 * only the last may be shorter.
	 *
	 * @param pageSize values below 1 are treated as {@value #DEFAULT_PAGE_SIZE}
	 */
	public static <T> List<List<T>> chunk(List<T> records, int pageSize) {
		int pages = totalPages(records.size(), pageSize);
		List<List<T>> result = new ArrayList<>(pages);
		for (int i = 1; i <= pages; i++) {
			result.add(page(records, i, pageSize));
		}
		return result;
	}

	private boolean anyHas(List<?> records, String fieldName) {
		return records.stream().anyMatch(r -> accessor.hasField(r, fieldName));
	}

	private BigDecimal numericValue(Object record, String fieldName) {
		Object value = accessor.getField(record, fieldName);
		if (value == null) {
			return BigDecimal.ZERO;
		}
		try {
			return Coercions.coerce(value, BigDecimal.class);
		} catch (CoercionException e) {
			return BigDecimal.ZERO;
		}
	}

	/**
	 * A total order over arbitrary field values: nulls first, then numbers by value
	 * regardless of their class, then everything else grouped by class name.
	 * Within a class, comparable values use their natural order
	 * and anything else its string form.
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	static int compareValues(Object a, Object b) {
		if (a == b) {
			return 0;
		} else if (a == null) {
			return -1;
		} else if (b == null) {
			return 1;
		}
		boolean aNumber = a instanceof Number;
		boolean bNumber = b instanceof Number;
		if (aNumber && bNumber) {
			return compareNumbers((Number) a, (Number) b);
		} else if (aNumber != bNumber) {
			return aNumber ? -1 : 1;
		} else if (a.getClass() != b.getClass()) {
			return a.getClass().getName().compareTo(b.getClass().getName());
		} else if (a instanceof Comparable) {
			return ((Comparable) a).compareTo(b);
		}
		return a.toString().compareTo(b.toString());
	}

	private static int compareNumbers(Number a, Number b) {
		double da = a.doubleValue();
		double db = b.doubleValue();
		if (!Double.isFinite(da) || !Double.isFinite(db)) {
			return Double.compare(da, db);
		}
		try {
			return Coercions.coerce(a, BigDecimal.class).compareTo(Coercions.coerce(b, BigDecimal.class));
		} catch (CoercionException e) {
			return Double.compare(da, db);
		}
	}

	public static final int DEFAULT_PAGE_SIZE = 10;
}
