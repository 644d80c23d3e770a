package works.fieldwork.jackson;

import java.util.Map;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.fieldwork.MappingTranscoder;
import works.fieldwork.exceptions.TranscodingException;

import static java.util.Objects.requireNonNull;

/**
 * A {@link MappingTranscoder} that uses Jackson's data binding
 * to convert records to and from mappings, without going through JSON text.
 * <p>
 * Unlike {@link works.fieldwork.FieldTableTranscoder}, this one encodes nested records
 * as nested mappings, and it can build any type Jackson can deserialize,
 * including records and classes with {@code @JsonCreator} constructors.
 * Properties of the mapping that the target type doesn't have are ignored.
 */
public final class JacksonTranscoder implements MappingTranscoder {
	private final ObjectMapper mapper;

	public JacksonTranscoder() {
		this(defaultMapper());
	}

	/**
	 * @param mapper used as-is; it's up to the caller to configure it
	 * to tolerate unknown properties if desired
	 */
	public JacksonTranscoder(ObjectMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	public static JsonMapper defaultMapper() {
		return JsonMapper.builder()
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();
	}

	@Override
	public Map<String, Object> encode(Object record) {
		if (record == null) {
			throw new TranscodingException("Can't encode null");
		}
		try {
			return mapper.convertValue(record, MAPPING_TYPE);
		} catch (RuntimeException e) {
			throw new TranscodingException("Can't encode " + record.getClass().getSimpleName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public <T> T decode(Map<String, ?> mapping, Class<T> targetType) {
		T result;
		try {
			result = mapper.convertValue(mapping, targetType);
		} catch (RuntimeException e) {
			throw new TranscodingException("Can't decode " + targetType.getSimpleName() + ": " + e.getMessage(), e);
		}
		if (result == null) {
			throw new TranscodingException("Decoding " + targetType.getSimpleName() + " produced null");
		}
		return result;
	}

	@Override
	public String toString() {
		return "JacksonTranscoder";
	}

	private static final TypeReference<Map<String, Object>> MAPPING_TYPE = new TypeReference<>() { };
}
