package works.fieldwork;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.fieldwork.exceptions.InvalidTypeException;

import static java.lang.invoke.MethodType.methodType;
import static java.lang.reflect.Modifier.isAbstract;
import static java.lang.reflect.Modifier.isFinal;
import static java.lang.reflect.Modifier.isPublic;
import static works.fieldwork.util.ReflectionHelpers.decapitalize;
import static works.fieldwork.util.ReflectionHelpers.getInstanceFieldsInOrder;
import static works.fieldwork.util.ReflectionHelpers.getterPropertyName;
import static works.fieldwork.util.ReflectionHelpers.privateLookupFor;
import static works.fieldwork.util.ReflectionHelpers.setterPropertyName;

/**
 * Derives a {@link FieldTable} from a class using reflection,
 * for classes whose authors haven't written one.
 *
 * <ul>
 *     <li>
 *         A {@link Record} gets one read-only field per component, in component order,
 *         and is constructed through its canonical constructor.
 *     </li>
 *     <li>
 *         Any other class gets one field per JavaBean property
 *         ({@code getX}/{@code isX} and {@code setX}), plus one per public instance field
 *         that has no such property; public final fields are read-only.
 *         Fields are ordered by the declaration of their backing fields,
 *         superclass first, followed by any properties with no backing field,
 *         in name order.
 *         It is constructed through its no-argument constructor, if it has one.
 *     </li>
 * </ul>
 */
public final class FieldTables {
	private FieldTables() { }

	public static <R> FieldTable<R> scan(Class<R> type) throws InvalidTypeException {
		if (type.isPrimitive() || type.isArray() || type.isEnum()) {
			throw new InvalidTypeException("Can't describe fields of " + type.getSimpleName());
		}
		Lookup lookup;
		try {
			lookup = privateLookupFor(type);
		} catch (IllegalArgumentException e) {
			throw new InvalidTypeException("Can't access " + type.getName(), e);
		}
		FieldTable<R> result = type.isRecord()
			? scanRecord(type, lookup)
			: scanBean(type, lookup);
		int fieldCount = result.fields().size();
		LOGGER.debug("Scanned {} field{} in {}", fieldCount, (fieldCount == 1) ? "" : "s", type.getSimpleName());
		return result;
	}

	private static <R> FieldTable<R> scanRecord(Class<R> type, Lookup lookup) throws InvalidTypeException {
		RecordComponent[] components = type.getRecordComponents();
		List<FieldHandle<R, ?>> fields = new ArrayList<>(components.length);
		for (RecordComponent rc : components) {
			MethodHandle accessor;
			try {
				accessor = lookup.unreflect(rc.getAccessor());
			} catch (IllegalAccessException e) {
				throw new InvalidTypeException("Accessor of " + type.getSimpleName() + "." + rc.getName() + " is not accessible", e);
			}
			fields.add(handle(rc.getName(), rc.getType(), accessor, null));
		}
		MethodHandle constructor;
		try {
			constructor = lookup.findConstructor(type, methodType(void.class, Stream.of(components)
				.map(RecordComponent::getType).toArray(Class<?>[]::new)));
		} catch (NoSuchMethodException e) {
			throw new AssertionError("Canonical constructor must exist for " + type);
		} catch (IllegalAccessException e) {
			throw new InvalidTypeException("Can't access canonical constructor of " + type.getSimpleName(), e);
		}
		return new RecordFieldTable<>(type, List.copyOf(fields), constructor);
	}

	private static <R> FieldTable<R> scanBean(Class<R> type, Lookup lookup) throws InvalidTypeException {
		Method[] methods = type.getMethods();
		Arrays.sort(methods, Comparator.comparing(Method::getName).thenComparing(Method::toString));
		Map<String, Method> getters = new LinkedHashMap<>();
		Map<String, List<Method>> setters = new LinkedHashMap<>();
		for (Method m : methods) {
			String getterName = getterPropertyName(m);
			if (getterName != null) {
				getters.putIfAbsent(getterName, m);
			}
			String setterName = setterPropertyName(m);
			if (setterName != null) {
				setters.computeIfAbsent(setterName, k -> new ArrayList<>()).add(m);
			}
		}

		Map<String, FieldHandle<R, ?>> properties = new TreeMap<>();
		Set<String> propertyNames = new LinkedHashSet<>(getters.keySet());
		propertyNames.addAll(setters.keySet());
		for (String name : propertyNames) {
			Method getter = getters.get(name);
			Method setter = chooseSetter(getter, setters.getOrDefault(name, List.of()));
			Class<?> propertyType = (getter != null) ? getter.getReturnType() : setter.getParameterTypes()[0];
			try {
				properties.put(name, handle(
					name,
					propertyType,
					(getter == null) ? null : lookup.unreflect(getter),
					(setter == null) ? null : lookup.unreflect(setter)));
			} catch (IllegalAccessException e) {
				throw new InvalidTypeException("Accessor of " + type.getSimpleName() + "." + name + " is not accessible", e);
			}
		}

		List<Field> declaredFields = getInstanceFieldsInOrder(type);
		for (Field f : declaredFields) {
			if (isPublic(f.getModifiers()) && !properties.containsKey(f.getName())) {
				try {
					properties.put(f.getName(), handle(
						f.getName(),
						f.getType(),
						lookup.unreflectGetter(f),
						isFinal(f.getModifiers()) ? null : lookup.unreflectSetter(f)));
				} catch (IllegalAccessException e) {
					throw new InvalidTypeException("Field " + type.getSimpleName() + "." + f.getName() + " is not accessible", e);
				}
			}
		}

		Map<String, FieldHandle<R, ?>> remaining = new TreeMap<>(properties);
		List<FieldHandle<R, ?>> ordered = new ArrayList<>(properties.size());
		for (Field f : declaredFields) {
			FieldHandle<R, ?> property = remaining.remove(f.getName());
			if (property == null && f.getName().length() > 2 && f.getName().startsWith("is") && Character.isUpperCase(f.getName().charAt(2))) {
				// boolean isActive; with isActive() and setActive()
				property = remaining.remove(decapitalize(f.getName().substring(2)));
			}
			if (property != null) {
				ordered.add(property);
			}
		}
		ordered.addAll(remaining.values());

		return new SimpleFieldTable<>(type, List.copyOf(ordered), noArgConstructor(type, lookup));
	}

	/**
	 * Prefers the setter whose parameter matches the getter's type;
	 * without a getter, any setter will do.
	 */
	private static Method chooseSetter(Method getter, List<Method> candidates) {
		if (getter == null) {
			return candidates.isEmpty() ? null : candidates.get(0);
		}
		return candidates.stream()
			.filter(s -> s.getParameterTypes()[0] == getter.getReturnType())
			.findFirst()
			.orElse(null);
	}

	private static <R> Supplier<R> noArgConstructor(Class<R> type, Lookup lookup) {
		if (type.isInterface() || isAbstract(type.getModifiers())) {
			return null;
		}
		MethodHandle constructor;
		try {
			constructor = lookup.unreflectConstructor(type.getDeclaredConstructor());
		} catch (NoSuchMethodException | IllegalAccessException e) {
			LOGGER.debug("No usable no-argument constructor for {}", type.getSimpleName());
			return null;
		}
		return () -> type.cast(invoke(constructor));
	}

	@SuppressWarnings("unchecked")
	private static <R, V> FieldHandle<R, V> handle(String name, Class<V> type, MethodHandle getter, MethodHandle setter) {
		Function<R, V> readFunction = (getter == null) ? null : record -> (V) invoke(getter, record);
		BiConsumer<R, V> writeFunction = (setter == null) ? null : (record, value) -> invoke(setter, record, value);
		return new FieldHandle<>(name, type, readFunction, writeFunction);
	}

	static Object invoke(MethodHandle handle, Object... args) {
		try {
			return handle.invokeWithArguments(args);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unexpected checked exception from " + handle, e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FieldTables.class);
}
