package works.fieldwork;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.fieldwork.exceptions.InvalidTypeException;

/**
 * Finds the {@link FieldTable} for a class.
 * <p>
 * A table {@link #register registered} for a class is used for exactly that class;
 * any other class is {@link FieldTables#scan scanned} the first time it's needed.
 * Tables are type metadata only, so one registry can safely be shared by any number of threads.
 */
public final class FieldTableRegistry {
	private final Map<Class<?>, FieldTable<?>> tables = new ConcurrentHashMap<>();

	public <R> FieldTableRegistry register(FieldTable<R> table) {
		FieldTable<?> previous = tables.put(table.recordType(), table);
		if (previous != null && previous != table) {
			LOGGER.debug("Replaced field table for {}", table.recordType().getSimpleName());
		}
		return this;
	}

	@SuppressWarnings("unchecked")
	public <R> FieldTable<R> tableFor(Class<R> type) throws InvalidTypeException {
		FieldTable<R> existing = (FieldTable<R>) tables.get(type);
		if (existing != null) {
			return existing;
		}
		FieldTable<R> scanned = FieldTables.scan(type);
		FieldTable<R> raced = (FieldTable<R>) tables.putIfAbsent(type, scanned);
		return (raced == null) ? scanned : raced;
	}

	/**
	 * @return the table for the runtime class of {@code record}
	 */
	@SuppressWarnings("unchecked")
	public <R> FieldTable<R> tableOf(R record) throws InvalidTypeException {
		return tableFor((Class<R>) record.getClass());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldTableRegistry.class);
}
