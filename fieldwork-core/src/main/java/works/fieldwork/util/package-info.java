/**
 * Reflection utilities used to build {@link works.fieldwork.FieldTable}s for classes
 * that don't supply their own.
 */
package works.fieldwork.util;
