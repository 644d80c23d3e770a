/**
 * Integration with the Jackson library.
 * <p>
 * See {@link works.fieldwork.jackson.JacksonTranscoder}.
 */
package works.fieldwork.jackson;
