package works.fieldwork;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.fieldwork.exceptions.CoercionException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

class CoercionsTest {

	@ParameterizedTest
	@MethodSource("conversions")
	void coerce_convertsValue(Object value, Class<?> targetType, Object expected) throws CoercionException {
		assertEquals(expected, Coercions.coerce(value, targetType));
	}

	static Stream<Arguments> conversions() {
		UUID uuid = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
		return Stream.of(
			arguments(42L, String.class, "42"),
			arguments("42", int.class, 42),
			arguments(" 42 ", Integer.class, 42),
			arguments(42, long.class, 42L),
			arguments(2.5, int.class, 2),
			arguments(3.5, int.class, 4),
			arguments("1.25", BigDecimal.class, new BigDecimal("1.25")),
			arguments(7, BigInteger.class, BigInteger.valueOf(7)),
			arguments("1.5", double.class, 1.5),
			arguments(3, float.class, 3.0f),
			arguments(true, int.class, 1),
			arguments("TRUE", boolean.class, true),
			arguments(0, Boolean.class, false),
			arguments("x", char.class, 'x'),
			arguments(65, Character.class, 'A'),
			arguments("GREEN", Color.class, Color.GREEN),
			arguments("green", Color.class, Color.GREEN),
			arguments(2, Color.class, Color.BLUE),
			arguments(Color.BLUE, int.class, 2),
			arguments("2024-01-02", LocalDate.class, LocalDate.of(2024, 1, 2)),
			arguments(LocalDateTime.of(2024, 1, 2, 3, 4), LocalDate.class, LocalDate.of(2024, 1, 2)),
			arguments(LocalDate.of(2024, 1, 2), LocalDateTime.class, LocalDateTime.of(2024, 1, 2, 0, 0)),
			arguments(0L, Instant.class, Instant.EPOCH),
			arguments("1970-01-01T00:00:00Z", Instant.class, Instant.EPOCH),
			arguments(uuid.toString(), UUID.class, uuid),
			arguments(Double.NaN, double.class, Double.NaN),
			arguments(Double.NaN, float.class, Float.NaN),
			arguments(Double.MAX_VALUE, double.class, Double.MAX_VALUE)
		);
	}

	@ParameterizedTest
	@MethodSource("failures")
	void coerce_impossibleConversion_throws(Object value, Class<?> targetType) {
		CoercionException e = assertThrows(CoercionException.class, () -> Coercions.coerce(value, targetType));
		assertEquals(targetType, e.targetType());
		assertFalse(Coercions.canCoerce(value, targetType));
	}

	static Stream<Arguments> failures() {
		return Stream.of(
			arguments(null, int.class),
			arguments("abc", int.class),
			arguments(3_000_000_000L, int.class),
			arguments(300, byte.class),
			arguments(Double.NaN, long.class),
			arguments("maybe", boolean.class),
			arguments("xy", char.class),
			arguments("PURPLE", Color.class),
			arguments(7, Color.class),
			arguments("yesterday", LocalDate.class),
			arguments("not-a-uuid", UUID.class),
			arguments(List.of(), Map.class),
			arguments(1e300, float.class),
			arguments(new BigDecimal("1e400"), double.class),
			arguments("1e400", double.class),
			arguments("NaN", double.class),
			arguments("-Infinity", float.class)
		);
	}

	@Test
	void coerce_nullToReferenceType_isNull() throws CoercionException {
		assertNull(Coercions.coerce(null, String.class));
		assertNull(Coercions.coerce(null, Integer.class));
		assertTrue(Coercions.canCoerce(null, LocalDate.class));
	}

	@Test
	void coerce_instanceOfTarget_isUnchanged() throws CoercionException {
		List<String> list = List.of("a");
		assertSame(list, Coercions.coerce(list, List.class));
		assertSame(list, Coercions.coerce(list, Object.class));
	}

	@Test
	void coercionException_describesValue() {
		CoercionException e = assertThrows(CoercionException.class, () -> Coercions.coerce("abc", int.class));
		assertThat(e.getMessage(), containsString("String \"abc\""));
		assertThat(e.getMessage(), containsString("int"));
	}

	@Test
	void defaultValue_isWhatTheJvmUses() {
		assertEquals(0, Coercions.defaultValue(int.class));
		assertEquals(false, Coercions.defaultValue(boolean.class));
		assertEquals('\0', Coercions.defaultValue(char.class));
		assertNull(Coercions.defaultValue(Integer.class));
		assertNull(Coercions.defaultValue(String.class));
	}

	@Test
	void zeroValue_isTheEmptyValueOfEachType() {
		assertEquals(0, Coercions.zeroValue(int.class));
		assertEquals(0, Coercions.zeroValue(Integer.class));
		assertEquals(0.0, Coercions.zeroValue(double.class));
		assertEquals(false, Coercions.zeroValue(Boolean.class));
		assertEquals("", Coercions.zeroValue(String.class));
		assertEquals(BigDecimal.ZERO, Coercions.zeroValue(BigDecimal.class));
		assertEquals(LocalDate.EPOCH, Coercions.zeroValue(LocalDate.class));
		assertEquals(Instant.EPOCH, Coercions.zeroValue(Instant.class));
		assertEquals(Color.RED, Coercions.zeroValue(Color.class));
		assertEquals(List.of(), Coercions.zeroValue(List.class));
		assertEquals(Map.of(), Coercions.zeroValue(Map.class));
		assertNull(Coercions.zeroValue(UUID.class));
		assertNull(Coercions.zeroValue(Object.class));
	}

	@Test
	void zeroValue_onlyForDeclaredCollectionInterfaces() {
		assertEquals(List.of(), Coercions.zeroValue(Collection.class));
		assertEquals(Set.of(), Coercions.zeroValue(Set.class));
		assertNull(Coercions.zeroValue(Iterable.class));
		assertNull(Coercions.zeroValue(Object.class));
		assertNull(Coercions.zeroValue(ArrayList.class));
	}

	public enum Color { RED, GREEN, BLUE }
}
