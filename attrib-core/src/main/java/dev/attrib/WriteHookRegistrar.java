package dev.attrib;

import dev.attrib.annotations.WriteHook;
import dev.attrib.exceptions.HookThrewException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static dev.attrib.util.ReflectionHelpers.getDeclaredMethodsInOrder;
import static dev.attrib.util.ReflectionHelpers.setAccessible;
import static java.lang.reflect.Modifier.isPrivate;
import static java.lang.reflect.Modifier.isStatic;
import static java.util.Comparator.comparing;

/**
 * Builds a {@link WriteListener} from the {@link WriteHook} methods of an arbitrary object.
 */
final class WriteHookRegistrar {
	private WriteHookRegistrar() {}

	static WriteListener listenerFor(Object receiverObject) {
		List<Method> methods = hookMethods(receiverObject.getClass());
		if (methods.isEmpty()) {
			LOGGER.warn("Found no write hook methods in {}; may be misconfigured", receiverObject.getClass().getSimpleName());
		}

		List<BoundHook> hooks = new ArrayList<>(methods.size());
		for (Method method : methods) {
			setAccessible(method);
			List<ArgumentSource> argumentSources = new ArrayList<>(method.getParameterCount());
			for (Parameter p : method.getParameters()) {
				ArgumentSource source = argumentSourceFor(method, p);
				if (argumentSources.contains(source)) {
					throw new IllegalArgumentException("Duplicate " + source + " parameter: " + method.getName() + " parameter " + p);
				}
				argumentSources.add(source);
			}
			MethodHandle handle;
			try {
				handle = MethodHandles.lookup().unreflect(method);
			} catch (IllegalAccessException e) {
				throw new IllegalArgumentException(e);
			}
			Set<String> names = Set.of(method.getAnnotation(WriteHook.class).value());
			hooks.add(new BoundHook(method.getName(), handle.bindTo(receiverObject), argumentSources, names));
			LOGGER.debug("Registered write hook {}", method);
		}
		int numHooks = hooks.size();
		LOGGER.info("Registered {} write hook{} in {}", numHooks, (numHooks >= 2) ? "s" : "", receiverObject.getClass().getSimpleName());
		return new HookListener(receiverObject.getClass().getSimpleName(), List.copyOf(hooks));
	}

	private static ArgumentSource argumentSourceFor(Method method, Parameter p) {
		Class<?> type = p.getType();
		if (type == RawAttributes.class) {
			return ArgumentSource.RAW;
		} else if (type == String.class) {
			return ArgumentSource.NAME;
		} else if (type == Object.class) {
			return ArgumentSource.VALUE;
		} else {
			throw new IllegalArgumentException("Unsupported parameter type " + type + ": " + method.getName() + " parameter " + p);
		}
	}

	private static List<Method> hookMethods(Class<?> c) {
		Deque<Class<?>> descendingHierarchy = new ArrayDeque<>();
		for (
			Class<?> receiverClass = c;
			receiverClass != Object.class;
			receiverClass = receiverClass.getSuperclass()
		) {
			descendingHierarchy.addFirst(receiverClass);
		}
		List<Method> hookMethods = new ArrayList<>();
		for (Class<?> receiverClass: descendingHierarchy) {
			for (Method method : getDeclaredMethodsInOrder(receiverClass)) {
				WriteHook hookAnnotation = method.getAnnotation(WriteHook.class);
				if (hookAnnotation == null) {
					continue;
				} else {
					LOGGER.debug("Found write hook {}: {}", method, hookAnnotation);
				}
				if (isStatic(method.getModifiers())) {
					throw new IllegalArgumentException("Write hook method cannot be static: " + method);
				} else if (isPrivate(method.getModifiers())) {
					throw new IllegalArgumentException("Write hook method cannot be private: " + method);
				}
				hookMethods.add(method);
			}
		}
		// Stable sort preserves bytecode order within a priority
		return hookMethods.stream()
			.sorted(comparing(WriteHookRegistrar::hookPriority))
			.toList();
	}

	private static int hookPriority(Method method) {
		return -method.getAnnotation(WriteHook.class).priority();
	}

	private enum ArgumentSource { RAW, NAME, VALUE }

	private record BoundHook(String methodName, MethodHandle handle, List<ArgumentSource> argumentSources, Set<String> names) {
		boolean appliesTo(String name) {
			return names.isEmpty() || names.contains(name);
		}

		void invoke(RawAttributes raw, String name, Object value) {
			List<Object> arguments = new ArrayList<>(argumentSources.size());
			for (ArgumentSource source: argumentSources) {
				switch (source) {
					case RAW -> arguments.add(raw);
					case NAME -> arguments.add(name);
					case VALUE -> arguments.add(value);
				}
			}
			try {
				handle.invokeWithArguments(arguments);
			} catch (Error e) {
				throw e;
			} catch (Throwable e) {
				throw new HookThrewException("Write hook \"" + methodName + "\" threw while writing \"" + name + "\"", e);
			}
		}
	}

	@RequiredArgsConstructor
	private static final class HookListener implements WriteListener {
		private final String receiverName;
		private final List<BoundHook> hooks;

		@Override
		public void beforeWrite(RawAttributes raw, String name, Object value) {
			for (BoundHook hook: hooks) {
				if (hook.appliesTo(name)) {
					hook.invoke(raw, name, value);
				}
			}
		}

		@Override
		public String toString() {
			return "WriteHooks(" + receiverName + ")";
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WriteHookRegistrar.class);
}
