package works.fieldwork.jackson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.fieldwork.FieldAccessor;
import works.fieldwork.FieldTableRegistry;
import works.fieldwork.FieldworkSettings;
import works.fieldwork.OperationResult;
import works.fieldwork.Transformations;
import works.fieldwork.exceptions.TranscodingException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonTranscoderTest {
	JacksonTranscoder transcoder;
	Person person;

	@BeforeEach
	void setupTranscoder() {
		transcoder = new JacksonTranscoder();
		person = new Person("Ada", 36, true, new Address("12 Analytical Row", "London"));
	}

	@Test
	void encode_nestsRecords() {
		Map<String, Object> mapping = transcoder.encode(person);
		assertThat(mapping, hasEntry("name", (Object) "Ada"));
		assertThat(mapping, hasEntry("age", (Object) 36));
		assertThat(mapping, hasEntry("active", (Object) true));
		assertThat(mapping.get("address"), instanceOf(Map.class));
		assertEquals("London", ((Map<?, ?>) mapping.get("address")).get("city"));
	}

	@Test
	void decode_ignoresUnknownProperties() {
		Map<String, Object> mapping = new LinkedHashMap<>();
		mapping.put("name", "Grace");
		mapping.put("age", 85);
		mapping.put("nickname", "Amazing Grace");
		Person decoded = transcoder.decode(mapping, Person.class);
		assertEquals("Grace", decoded.getName());
		assertEquals(85, decoded.getAge());
	}

	@Test
	void decode_record() {
		Map<String, Object> mapping = Map.of("street", "1 Main St", "city", "Springfield");
		assertEquals(new Address("1 Main St", "Springfield"), transcoder.decode(mapping, Address.class));
	}

	@Test
	void roundTrip_reproducesRecord() {
		Person copy = transcoder.decode(transcoder.encode(person), Person.class);
		assertEquals(person, copy);
		assertNotSame(person.getAddress(), copy.getAddress());
	}

	@Test
	void failures_throwTranscodingException() {
		assertThrows(TranscodingException.class, () -> transcoder.encode(null));
		assertThrows(TranscodingException.class, () -> transcoder.decode(Map.of("age", "old"), Person.class));
	}

	@Test
	void fieldAccessor_convertsThroughJackson() {
		FieldAccessor accessor = new FieldAccessor(new FieldTableRegistry(), FieldworkSettings.defaults(), transcoder);
		assertSame(transcoder, accessor.transcoder());

		PersonSummary summary = accessor.convertTo(person, PersonSummary.class);
		assertEquals(new PersonSummary("Ada", new Address("12 Analytical Row", "London")), summary);
		assertEquals(36, accessor.getField(person, "age"));
	}

	@Test
	void deepCopy_copiesNestedRecords() {
		Transformations transformations = new Transformations(
			new FieldAccessor(new FieldTableRegistry(), FieldworkSettings.defaults(), transcoder));
		OperationResult<Person> result = transformations.deepCopy(person);
		assertTrue(result.isSuccess());
		Person copy = result.orElse(null);
		assertEquals(person, copy);
		assertNotSame(person.getAddress(), copy.getAddress());
	}

	@Test
	void transformAll_convertsEachElement() {
		Transformations transformations = new Transformations(
			new FieldAccessor(new FieldTableRegistry(), FieldworkSettings.defaults(), transcoder));
		OperationResult<List<PersonSummary>> result = transformations.transformAll(List.of(person, person), PersonSummary.class);
		assertEquals(2, result.totalCount());
		assertEquals(2, result.orElse(null).size());
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class Person {
		private String name;
		private int age;
		private boolean isActive;
		private Address address;
	}

	public record Address(String street, String city) { }

	public record PersonSummary(String name, Address address) { }
}
