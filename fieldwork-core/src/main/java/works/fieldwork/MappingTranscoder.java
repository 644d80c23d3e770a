package works.fieldwork;

import java.util.Map;
import works.fieldwork.exceptions.TranscodingException;

/**
 * Converts records to and from the generic field-mapping representation.
 * {@link FieldAccessor#convertTo convertTo} uses one of these to bridge
 * records of unrelated types: it encodes the source and decodes the result
 * as the target type.
 * <p>
 * The default is {@link FieldTableTranscoder}; the {@code fieldwork-jackson}
 * module supplies one built on Jackson's data binding.
 */
public interface MappingTranscoder {
	/**
	 * @throws TranscodingException if {@code record} can't be represented as a mapping
	 */
	Map<String, Object> encode(Object record);

	/**
	 * @throws TranscodingException if no {@code targetType} can be built from {@code mapping}
	 */
	<T> T decode(Map<String, ?> mapping, Class<T> targetType);
}
