package works.fieldwork;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Record shapes shared by the tests.
 */
final class TestRecords {
	private TestRecords() { }

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class User {
		private long id;
		private String name = "";
		private String email = "";
		private String description;
		private LocalDateTime createdDate;
		private LocalDateTime updatedDate;
		private boolean isActive = true;

		public static User ada() {
			return new User(
				42,
				"Ada",
				"ada@x.com",
				"Analyst",
				LocalDateTime.of(2024, 3, 1, 9, 30),
				null,
				true);
		}
	}

	@Data
	@NoArgsConstructor
	public static class UserSummary {
		private String name;
		private String email;
		private boolean isActive;
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class Abc {
		private int a;
		private int b;
		private int c;
	}

	public record Contact(String name, String email) { }

	public record Point(int x, int y) { }

	public static class Ticket {
		private final String code;
		private String title;

		public Ticket() {
			this("T-1");
		}

		public Ticket(String code) {
			this.code = code;
		}

		public String getCode() {
			return code;
		}

		public String getTitle() {
			return title;
		}

		public void setTitle(String title) {
			this.title = title;
		}
	}

	public static class Counter {
		public int count;
		public final String label = "fixed";
	}

	public static class Guarded {
		private int level;

		public int getLevel() {
			return level;
		}

		public void setLevel(int level) {
			if (level < 0) {
				throw new IllegalArgumentException("Level can't be negative");
			}
			this.level = level;
		}
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class Holder {
		private Object payload;
	}

	public static class NoDefaultConstructor {
		private final String name;

		public NoDefaultConstructor(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}
	}
}
