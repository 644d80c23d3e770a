package works.fieldwork;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import works.fieldwork.exceptions.CoercionException;

import static works.fieldwork.util.ReflectionHelpers.boxedClass;

/**
 * Converts values between the scalar types that fields commonly declare.
 * <p>
 * Conversions are exact: a number that doesn't fit the target type,
 * or a string that doesn't parse, is a {@link CoercionException}
 * rather than a silently truncated value.
 * Fractional numbers converted to integral types are rounded half-to-even.
 */
public final class Coercions {
	private Coercions() { }

	/**
	 * @return {@code value} converted to {@code targetType}; boxed if {@code targetType} is primitive
	 * @throws CoercionException if there is no conversion, or {@code value} is null and {@code targetType} is primitive
	 */
	@SuppressWarnings("unchecked")
	public static <T> T coerce(Object value, Class<T> targetType) throws CoercionException {
		if (value == null) {
			if (targetType.isPrimitive()) {
				throw new CoercionException(null, targetType);
			}
			return null;
		}
		Class<?> target = boxedClass(targetType);
		if (target.isInstance(value)) {
			return (T) value;
		}
		try {
			Object result = convert(value, target);
			if (result != null) {
				return (T) result;
			}
		} catch (ArithmeticException | IllegalArgumentException | DateTimeException e) {
			throw new CoercionException(value, targetType, e);
		}
		throw new CoercionException(value, targetType);
	}

	/**
	 * @return true if {@link #coerce} would succeed
	 */
	public static boolean canCoerce(Object value, Class<?> targetType) {
		try {
			coerce(value, targetType);
			return true;
		} catch (CoercionException e) {
			return false;
		}
	}

	/**
	 * The value the JVM gives an uninitialized field: zero for primitives, null otherwise.
	 */
	@SuppressWarnings("unchecked")
	public static <T> T defaultValue(Class<T> type) {
		if (type.isPrimitive()) {
			return (T) PRIMITIVE_DEFAULTS.get(type);
		}
		return null;
	}

	/**
	 * The "empty" value of a type, used when resetting fields:
	 * zero for every numeric type, boxed or not, {@code false}, the empty string,
	 * the epoch for dates and times, empty collections, and the first constant of an enum.
	 * Types with no natural zero get null.
	 */
	@SuppressWarnings("unchecked")
	public static <T> T zeroValue(Class<T> type) {
		Class<?> boxed = boxedClass(type);
		Object zero = ZERO_VALUES.get(boxed);
		if (zero != null) {
			return (T) zero;
		} else if (boxed.isEnum()) {
			Object[] constants = boxed.getEnumConstants();
			return (constants.length == 0) ? null : (T) constants[0];
		} else if (boxed == List.class || boxed == Collection.class) {
			return (T) List.of();
		} else if (boxed == Set.class) {
			return (T) Set.of();
		} else if (boxed == Map.class) {
			return (T) Map.of();
		}
		return null;
	}

	private static Object convert(Object value, Class<?> target) {
		if (target == String.class) {
			return value.toString();
		} else if (Number.class.isAssignableFrom(target)) {
			return toNumber(value, target);
		} else if (target == Boolean.class) {
			return toBoolean(value);
		} else if (target == Character.class) {
			return toCharacter(value);
		} else if (target.isEnum()) {
			return toEnum(value, target);
		} else if (target == LocalDate.class) {
			return toLocalDate(value);
		} else if (target == LocalDateTime.class) {
			return toLocalDateTime(value);
		} else if (target == Instant.class) {
			return toInstant(value);
		} else if (target == UUID.class && value instanceof CharSequence s) {
			return UUID.fromString(s.toString().trim());
		}
		return null;
	}

	private static Object toNumber(Object value, Class<?> target) {
		if (target == Double.class || target == Float.class) {
			double d;
			if (value instanceof Number n) {
				d = n.doubleValue();
			} else if (value instanceof CharSequence s) {
				d = Double.parseDouble(s.toString().trim());
			} else {
				BigDecimal decimal = toBigDecimal(value);
				if (decimal == null) {
					return null;
				}
				d = decimal.doubleValue();
			}
			// NaN and infinities pass through only from a Double or Float that already held one
			boolean nonFiniteSource = (value instanceof Double || value instanceof Float) && !Double.isFinite(d);
			if (!nonFiniteSource) {
				if (!Double.isFinite(d)) {
					throw new ArithmeticException("Not a finite " + target.getSimpleName() + ": " + value);
				} else if (target == Float.class && Float.isInfinite((float) d)) {
					throw new ArithmeticException("Out of range for Float: " + value);
				}
			}
			return (target == Double.class) ? (Object) d : (Object) (float) d;
		}

		BigDecimal decimal = toBigDecimal(value);
		if (decimal == null) {
			return null;
		} else if (target == BigDecimal.class) {
			return decimal;
		}
		BigDecimal integral = decimal.setScale(0, RoundingMode.HALF_EVEN);
		if (target == Integer.class) {
			return integral.intValueExact();
		} else if (target == Long.class) {
			return integral.longValueExact();
		} else if (target == Short.class) {
			return integral.shortValueExact();
		} else if (target == Byte.class) {
			return integral.byteValueExact();
		} else if (target == BigInteger.class) {
			return integral.toBigIntegerExact();
		}
		return null;
	}

	private static BigDecimal toBigDecimal(Object value) {
		if (value instanceof BigDecimal d) {
			return d;
		} else if (value instanceof BigInteger i) {
			return new BigDecimal(i);
		} else if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new ArithmeticException("Not a finite number: " + d);
			}
			return new BigDecimal(value.toString());
		} else if (value instanceof Number n) {
			return new BigDecimal(n.toString());
		} else if (value instanceof CharSequence s) {
			return new BigDecimal(s.toString().trim());
		} else if (value instanceof Boolean b) {
			return b ? BigDecimal.ONE : BigDecimal.ZERO;
		} else if (value instanceof Character c) {
			return BigDecimal.valueOf(c);
		} else if (value instanceof Enum<?> e) {
			return BigDecimal.valueOf(e.ordinal());
		}
		return null;
	}

	private static Boolean toBoolean(Object value) {
		if (value instanceof Number) {
			return toBigDecimal(value).signum() != 0;
		} else if (value instanceof CharSequence s) {
			String text = s.toString().trim();
			if (text.equalsIgnoreCase("true")) {
				return true;
			} else if (text.equalsIgnoreCase("false")) {
				return false;
			}
			throw new IllegalArgumentException("Not a boolean: \"" + text + "\"");
		}
		return null;
	}

	private static Character toCharacter(Object value) {
		if (value instanceof CharSequence s) {
			if (s.length() != 1) {
				throw new IllegalArgumentException("Expected exactly one character: \"" + s + "\"");
			}
			return s.charAt(0);
		} else if (value instanceof Number) {
			int codeUnit = toBigDecimal(value).intValueExact();
			if (codeUnit < Character.MIN_VALUE || codeUnit > Character.MAX_VALUE) {
				throw new ArithmeticException("Out of range for char: " + codeUnit);
			}
			return (char) codeUnit;
		}
		return null;
	}

	private static Object toEnum(Object value, Class<?> target) {
		Object[] constants = target.getEnumConstants();
		if (value instanceof CharSequence s) {
			String name = s.toString().trim();
			Enum<?> caseInsensitiveMatch = null;
			for (Object constant : constants) {
				Enum<?> e = (Enum<?>) constant;
				if (e.name().equals(name)) {
					return e;
				} else if (caseInsensitiveMatch == null && e.name().equalsIgnoreCase(name)) {
					caseInsensitiveMatch = e;
				}
			}
			if (caseInsensitiveMatch != null) {
				return caseInsensitiveMatch;
			}
			throw new IllegalArgumentException("No constant " + target.getSimpleName() + "." + name);
		} else if (value instanceof Number) {
			int ordinal = toBigDecimal(value).intValueExact();
			if (ordinal < 0 || ordinal >= constants.length) {
				throw new IllegalArgumentException("No constant of " + target.getSimpleName() + " with ordinal " + ordinal);
			}
			return constants[ordinal];
		}
		return null;
	}

	private static LocalDate toLocalDate(Object value) {
		if (value instanceof CharSequence s) {
			return LocalDate.parse(s.toString().trim());
		} else if (value instanceof LocalDateTime dt) {
			return dt.toLocalDate();
		} else if (value instanceof Instant i) {
			return LocalDate.ofInstant(i, ZoneOffset.UTC);
		}
		return null;
	}

	private static LocalDateTime toLocalDateTime(Object value) {
		if (value instanceof CharSequence s) {
			return LocalDateTime.parse(s.toString().trim());
		} else if (value instanceof LocalDate d) {
			return d.atStartOfDay();
		} else if (value instanceof Instant i) {
			return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
		}
		return null;
	}

	private static Instant toInstant(Object value) {
		if (value instanceof CharSequence s) {
			return Instant.parse(s.toString().trim());
		} else if (value instanceof Long || value instanceof Integer) {
			return Instant.ofEpochMilli(((Number) value).longValue());
		} else if (value instanceof LocalDateTime dt) {
			return dt.toInstant(ZoneOffset.UTC);
		} else if (value instanceof LocalDate d) {
			return d.atStartOfDay().toInstant(ZoneOffset.UTC);
		}
		return null;
	}

	private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = Map.of(
		boolean.class, false,
		byte.class, (byte) 0,
		short.class, (short) 0,
		char.class, '\0',
		int.class, 0,
		long.class, 0L,
		float.class, 0.0f,
		double.class, 0.0d
	);

	private static final Map<Class<?>, Object> ZERO_VALUES = Map.ofEntries(
		Map.entry(Boolean.class, false),
		Map.entry(Byte.class, (byte) 0),
		Map.entry(Short.class, (short) 0),
		Map.entry(Character.class, '\0'),
		Map.entry(Integer.class, 0),
		Map.entry(Long.class, 0L),
		Map.entry(Float.class, 0.0f),
		Map.entry(Double.class, 0.0d),
		Map.entry(BigDecimal.class, BigDecimal.ZERO),
		Map.entry(BigInteger.class, BigInteger.ZERO),
		Map.entry(String.class, ""),
		Map.entry(LocalDate.class, LocalDate.EPOCH),
		Map.entry(LocalDateTime.class, LocalDateTime.of(LocalDate.EPOCH, LocalTime.MIDNIGHT)),
		Map.entry(Instant.class, Instant.EPOCH)
	);
}
