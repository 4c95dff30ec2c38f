package dev.attrib.util;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import static java.lang.reflect.Modifier.isPrivate;
import static java.util.Objects.requireNonNull;
import static org.objectweb.asm.ClassReader.SKIP_CODE;
import static org.objectweb.asm.ClassReader.SKIP_DEBUG;
import static org.objectweb.asm.ClassReader.SKIP_FRAMES;
import static org.objectweb.asm.Opcodes.ASM9;
import static org.objectweb.asm.Type.ARRAY;
import static org.objectweb.asm.Type.OBJECT;

public final class ReflectionHelpers {
	private ReflectionHelpers() {}

	public static Field setAccessible(Field field) {
		makeAccessible(field, field.getModifiers());
		return field;
	}

	public static <T extends Executable> T setAccessible(T method) {
		makeAccessible(method, method.getModifiers());
		return method;
	}

	private static void makeAccessible(AccessibleObject object, int modifiers) {
		// Private members stay private, so their owners can
		// refactor them without breaking a record type declaration.
		if (isPrivate(modifiers)) {
			throw new IllegalArgumentException("Access to private " + object.getClass().getSimpleName() + " is forbidden: " + object);
		}
		object.setAccessible(true);
	}

	/**
	 * @param type must be defined in a classfile accessible by passing {@link Class#getResourceAsStream(String)}
	 *             the class's own name followed by <code>.class</code>.
	 *             In particular, this can't be a dynamically generated class.
	 * @return like {@link Class#getDeclaredMethods()} except in bytecode order.
	 */
	public static List<Method> getDeclaredMethodsInOrder(Class<?> type) {
		List<Method> result = new ArrayList<>();
		ClassLoader loader = type.getClassLoader();
		classReaderFor(type).accept(new ClassVisitor(ASM9) {
			@Override
			public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
				if (name.equals("<init>") || name.equals("<clinit>")) {
					// getDeclaredMethods explicitly excludes these
					return null;
				} else if ((access & Opcodes.ACC_SYNTHETIC) != 0) {
					return null;
				}
				Type[] argumentTypes = Type.getArgumentTypes(descriptor);
				Class<?>[] argumentClasses = new Class<?>[argumentTypes.length];
				for (int i = 0; i < argumentTypes.length; i++) {
					argumentClasses[i] = findClass(argumentTypes[i], loader);
				}
				try {
					result.add(type.getDeclaredMethod(name, argumentClasses));
				} catch (NoSuchMethodException e) {
					throw new IllegalStateException(e);
				}
				return null;
			}
		}, SKIP_CODE | SKIP_DEBUG | SKIP_FRAMES);
		return result;
	}

	/**
	 * Same restrictions on <code>type</code> as {@link #getDeclaredMethodsInOrder}.
	 *
	 * @return like {@link Class#getDeclaredFields()} except in bytecode order.
	 */
	public static List<Field> getDeclaredFieldsInOrder(Class<?> type) {
		List<Field> result = new ArrayList<>();
		classReaderFor(type).accept(new ClassVisitor(ASM9) {
			@Override
			public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
				if ((access & Opcodes.ACC_SYNTHETIC) != 0) {
					// Things like this$0 and $assertionsDisabled
					return null;
				}
				try {
					result.add(type.getDeclaredField(name));
				} catch (NoSuchFieldException e) {
					throw new IllegalStateException(e);
				}
				return null;
			}
		}, SKIP_CODE | SKIP_DEBUG | SKIP_FRAMES);
		return result;
	}

	private static ClassReader classReaderFor(Class<?> type) {
		String typeName = type.getName();
		String fileName = typeName.substring(typeName.lastIndexOf('.') + 1) + ".class";
		try (InputStream resource = type.getResourceAsStream(fileName)) {
			if (resource == null) {
				throw new IOException("No resource called \"" + fileName + "\"");
			}
			return new ClassReader(resource);
		} catch (IOException e) {
			throw new IllegalStateException("Unable to open the classfile corresponding to " + type, e);
		}
	}

	private static Class<?> findClass(Type argumentType, ClassLoader loader) {
		try {
			return switch (argumentType.getSort()) {
				case OBJECT ->
					requireNonNull(Class.forName(argumentType.getClassName(), false, loader));
				case ARRAY -> {
					Class<?> result = findClass(argumentType.getElementType(), loader);
					for (int i = 0; i < argumentType.getDimensions(); i++) {
						result = result.arrayType();
					}
					yield result;
				}
				default ->
					requireNonNull(classForPrimitiveName(argumentType.getClassName()));
			};
		} catch (ClassNotFoundException e) {
			throw new IllegalStateException(e);
		}
	}

	private static Class<?> classForPrimitiveName(String primitiveName) {
		return switch(primitiveName) {
			case "int"     -> int.class;
			case "long"    -> long.class;
			case "short"   -> short.class;
			case "char"    -> char.class;
			case "byte"    -> byte.class;
			case "float"   -> float.class;
			case "double"  -> double.class;
			case "boolean" -> boolean.class;
			case "void"    -> void.class;
			default        -> null;
		};
	}
}
