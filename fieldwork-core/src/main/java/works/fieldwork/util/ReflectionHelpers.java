package works.fieldwork.util;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static java.lang.reflect.Modifier.isPublic;
import static java.lang.reflect.Modifier.isStatic;

public final class ReflectionHelpers {
	private ReflectionHelpers() { }

	/**
	 * @return a lookup with full access to {@code type}, suitable for unreflecting
	 * its constructors, accessors and fields.
	 * @throws IllegalArgumentException if {@code type}'s package is not open to this library
	 */
	public static Lookup privateLookupFor(Class<?> type) {
		try {
			return MethodHandles.privateLookupIn(type, MethodHandles.lookup());
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Package of " + type.getName() + " is not open for reflection", e);
		}
	}

	/**
	 * The non-static, non-synthetic fields of {@code type} and its superclasses,
	 * superclass fields first, each class's fields in the order the JVM reports them
	 * (declaration order on every mainstream JVM).
	 */
	public static List<Field> getInstanceFieldsInOrder(Class<?> type) {
		Deque<Class<?>> hierarchy = new ArrayDeque<>();
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			hierarchy.push(c);
		}
		List<Field> result = new ArrayList<>();
		for (Class<?> c : hierarchy) {
			for (Field f : c.getDeclaredFields()) {
				if (!isStatic(f.getModifiers()) && !f.isSynthetic()) {
					result.add(f);
				}
			}
		}
		return result;
	}

	/**
	 * @return the bean property name for an accessor method, or null if {@code method} is not a getter
	 */
	public static String getterPropertyName(Method method) {
		if (!isCandidateAccessor(method) || method.getParameterCount() != 0) {
			return null;
		}
		String name = method.getName();
		Class<?> returnType = method.getReturnType();
		if (name.startsWith("get") && name.length() > 3 && returnType != void.class) {
			return decapitalize(name.substring(3));
		} else if (name.startsWith("is") && name.length() > 2 && (returnType == boolean.class || returnType == Boolean.class)) {
			return decapitalize(name.substring(2));
		} else {
			return null;
		}
	}

	/**
	 * @return the bean property name for a mutator method, or null if {@code method} is not a setter
	 */
	public static String setterPropertyName(Method method) {
		if (!isCandidateAccessor(method) || method.getParameterCount() != 1 || method.getReturnType() != void.class) {
			return null;
		}
		String name = method.getName();
		if (name.startsWith("set") && name.length() > 3) {
			return decapitalize(name.substring(3));
		} else {
			return null;
		}
	}

	private static boolean isCandidateAccessor(Method method) {
		return isPublic(method.getModifiers())
			&& !isStatic(method.getModifiers())
			&& !method.isBridge()
			&& !method.isSynthetic()
			&& method.getDeclaringClass() != Object.class;
	}

	/**
	 * Same rule as {@code java.beans.Introspector.decapitalize}: {@code "Email"} becomes {@code "email"}
	 * but {@code "URL"} stays {@code "URL"}.
	 */
	public static String decapitalize(String name) {
		if (name.isEmpty()) {
			return name;
		}
		if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
			return name;
		}
		return Character.toLowerCase(name.charAt(0)) + name.substring(1);
	}

	public static Class<?> boxedClass(Class<?> type) {
		if (type.isPrimitive()) {
			return BOXES.get(type);
		} else {
			return type;
		}
	}

	private static final Map<Class<?>, Class<?>> BOXES = Map.of(
		boolean.class, Boolean.class,
		byte.class, Byte.class,
		short.class, Short.class,
		char.class, Character.class,
		int.class, Integer.class,
		long.class, Long.class,
		float.class, Float.class,
		double.class, Double.class,
		void.class, Void.class
	);
}
