package works.fieldwork.exceptions;

/**
 * A {@link works.fieldwork.MappingTranscoder} was unable to encode or decode a record.
 */
public class TranscodingException extends RuntimeException {
	public TranscodingException(String message) {
		super(message);
	}

	public TranscodingException(String message, Throwable cause) {
		super(message, cause);
	}
}
