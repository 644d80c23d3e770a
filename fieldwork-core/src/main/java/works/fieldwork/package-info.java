/**
 * Generic field access over records whose shape is known only at runtime.
 * <p>
 * Start with {@link works.fieldwork.FieldAccessor}. It finds each record's
 * {@link works.fieldwork.FieldTable} in a {@link works.fieldwork.FieldTableRegistry},
 * either {@link works.fieldwork.FieldTable#builder written by hand} or
 * {@link works.fieldwork.FieldTables#scan derived by reflection}, and converts values
 * between types using {@link works.fieldwork.Coercions}.
 * {@link works.fieldwork.Transformations} and {@link works.fieldwork.FieldQueries}
 * build on the accessor for service code that reports its outcomes as
 * {@link works.fieldwork.OperationResult}s or works on lists of records.
 */
package works.fieldwork;
