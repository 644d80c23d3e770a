package works.fieldwork;

import java.util.Map;
import works.fieldwork.exceptions.InvalidTypeException;
import works.fieldwork.exceptions.TranscodingException;

/**
 * Transcodes using {@link FieldTable}s, through {@link FieldAccessor#toMapping}
 * and {@link FieldAccessor#fromMapping}.
 * Nested records are carried as-is rather than being encoded themselves.
 */
public final class FieldTableTranscoder implements MappingTranscoder {
	private final FieldAccessor accessor;

	public FieldTableTranscoder(FieldAccessor accessor) {
		this.accessor = accessor;
	}

	@Override
	public Map<String, Object> encode(Object record) {
		if (record == null) {
			throw new TranscodingException("Can't encode null");
		}
		try {
			accessor.registry().tableOf(record);
		} catch (InvalidTypeException e) {
			throw new TranscodingException("Can't encode " + record.getClass().getSimpleName(), e);
		}
		return accessor.toMapping(record);
	}

	@Override
	public <T> T decode(Map<String, ?> mapping, Class<T> targetType) {
		try {
			return accessor.buildFromMapping(mapping, targetType);
		} catch (InvalidTypeException e) {
			throw new TranscodingException("Can't decode " + targetType.getSimpleName(), e);
		}
	}

	@Override
	public String toString() {
		return "FieldTableTranscoder";
	}
}
