/**
 * Exceptions raised while describing types and converting values.
 * <p>
 * {@link works.fieldwork.FieldAccessor} catches all of these internally;
 * they escape only from the lower-level APIs such as
 * {@link works.fieldwork.FieldTables} and {@link works.fieldwork.Coercions}.
 */
package works.fieldwork.exceptions;
