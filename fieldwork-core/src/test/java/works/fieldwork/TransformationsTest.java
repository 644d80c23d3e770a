package works.fieldwork;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.fieldwork.TestRecords.NoDefaultConstructor;
import works.fieldwork.TestRecords.User;
import works.fieldwork.TestRecords.UserSummary;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformationsTest {
	Transformations transformations;
	User user;

	@BeforeEach
	void setupTransformations() {
		transformations = new Transformations(new FieldAccessor());
		user = User.ada();
	}

	@Test
	void toMapping_omitsNullsUnlessRequested() {
		Map<String, Object> withoutNulls = transformations.toMapping(user, false).orElse(null);
		assertThat(withoutNulls, not(hasKey("updatedDate")));
		assertEquals("Ada", withoutNulls.get("name"));

		Map<String, Object> withNulls = transformations.toMapping(user, true).orElse(null);
		assertThat(withNulls, hasKey("updatedDate"));
	}

	@Test
	void toMapping_nullRecord_fails() {
		assertFalse(transformations.toMapping(null, true).isSuccess());
	}

	@Test
	void fromMapping() {
		OperationResult<User> result = transformations.fromMapping(Map.of("name", "Grace"), User.class);
		assertEquals("Grace", result.orElse(null).getName());

		assertFalse(transformations.fromMapping(null, User.class).isSuccess());

		OperationResult<NoDefaultConstructor> unconstructible = transformations.fromMapping(Map.of(), NoDefaultConstructor.class);
		assertFalse(unconstructible.isSuccess());
		assertThat(unconstructible.errors().get(0), containsString("NoDefaultConstructor"));
	}

	@Test
	void transformTo() {
		UserSummary summary = transformations.transformTo(user, UserSummary.class).orElse(null);
		assertEquals("Ada", summary.getName());
		assertFalse(transformations.transformTo(null, UserSummary.class).isSuccess());
		assertFalse(transformations.transformTo(user, NoDefaultConstructor.class).isSuccess());
	}

	@Test
	void transformAll_skipsFailuresButCountsAllSources() {
		User grace = new User();
		grace.setName("Grace");
		OperationResult<List<UserSummary>> result = transformations.transformAll(List.of(user, "not a record", grace), UserSummary.class);
		assertTrue(result.isSuccess());
		assertEquals(3, result.totalCount());
		List<UserSummary> summaries = result.orElse(null);
		assertEquals(2, summaries.size());
		assertEquals("Ada", summaries.get(0).getName());
		assertEquals("Grace", summaries.get(1).getName());

		assertFalse(transformations.transformAll(null, UserSummary.class).isSuccess());
	}

	@Test
	void deepCopy() {
		User copy = transformations.deepCopy(user).orElse(null);
		assertNotSame(user, copy);
		assertEquals(user, copy);

		assertFalse(transformations.deepCopy(null).isSuccess());
		assertFalse(transformations.deepCopy(new NoDefaultConstructor("x")).isSuccess());
	}

	@Test
	void copyFields() {
		UserSummary summary = transformations.copyFields(user, UserSummary.class, "email").orElse(null);
		assertEquals("ada@x.com", summary.getEmail());
		assertNull(summary.getName());

		assertEquals(List.of("No field names given"), transformations.copyFields(user, UserSummary.class).errors());
		assertFalse(transformations.copyFields(null, UserSummary.class, "email").isSuccess());
	}

	@Test
	void copyFieldsExcluding_matchesNamesIgnoringCase() {
		User copy = transformations.copyFieldsExcluding(user, User.class, "ID", "email").orElse(null);
		assertEquals(0L, copy.getId());
		assertEquals("", copy.getEmail());
		assertEquals("Ada", copy.getName());
		assertEquals(user.getCreatedDate(), copy.getCreatedDate());
	}

	@Test
	void update_appliesNonNullValues() {
		Map<String, Object> updates = new LinkedHashMap<>();
		updates.put("name", "Grace");
		updates.put("email", null);
		updates.put("nonexistent", 1);
		updates.put("id", "not a number");
		OperationResult<List<String>> result = transformations.update(user, updates);
		assertEquals(List.of("name"), result.orElse(null));
		assertEquals(1, result.totalCount());
		assertEquals("Grace", user.getName());
		assertEquals("ada@x.com", user.getEmail());
		assertEquals(42L, user.getId());
	}

	@Test
	void update_nothingToDo_fails() {
		assertFalse(transformations.update(user, Map.of()).isSuccess());
		assertFalse(transformations.update(null, Map.of("name", "Grace")).isSuccess());
	}

	@Test
	void update_withAllowedNames_ignoresOthers() {
		Map<String, Object> updates = new LinkedHashMap<>();
		updates.put("name", "Grace");
		updates.put("email", "grace@x.com");
		OperationResult<List<String>> result = transformations.update(user, updates, "NAME");
		assertEquals(List.of("name"), result.orElse(null));
		assertEquals("Grace", user.getName());
		assertEquals("ada@x.com", user.getEmail());
	}

	@Test
	void update_noAllowedUpdates_succeedsWithNothing() {
		OperationResult<List<String>> result = transformations.update(user, Map.of("email", "grace@x.com"), "name");
		assertTrue(result.isSuccess());
		assertEquals(List.of(), result.orElse(null));
		assertEquals("ada@x.com", user.getEmail());
	}

	@Test
	void update_withAllowedNames_nullTarget_fails() {
		OperationResult<List<String>> result = transformations.update(null, Map.of("name", "Grace"), "email");
		assertFalse(result.isSuccess());
		assertEquals(List.of("Target can't be null"), result.errors());
	}

	@Test
	void update_noAllowedNames_fails() {
		assertFalse(transformations.update(user, Map.of("name", "Grace"), new String[0]).isSuccess());
	}

	@Test
	void compare() {
		User other = User.ada();
		other.setEmail("other@x.com");
		assertEquals(true, transformations.compare(user, other, "name", "id").orElse(null));
		assertEquals(false, transformations.compare(user, other, "name", "email").orElse(null));
		assertFalse(transformations.compare(user, null, "name").isSuccess());
		assertFalse(transformations.compare(user, other).isSuccess());
	}
}
