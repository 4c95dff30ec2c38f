package dev.attrib.testing;

import dev.attrib.Interceptable;
import dev.attrib.exceptions.AttributeMissingException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;

import static java.util.Collections.unmodifiableSet;

/**
 * Makes sure {@link InterceptableConformanceTest} works properly by testing
 * a bare map-based {@link Interceptable} against it.
 */
public class ConformanceMetaTest extends InterceptableConformanceTest {

	@BeforeEach
	void setupSubjectFactory() {
		subjectFactory = () -> {
			MapInterceptable result = new MapInterceptable();
			result.setAttribute("greeting", "hello");
			return result;
		};
		expectedAttributes = Map.of("greeting", "hello");
	}

	static final class MapInterceptable implements Interceptable {
		private final Map<String, Object> values = new LinkedHashMap<>();

		@Override
		public Object getAttribute(String name) {
			if (values.containsKey(name)) {
				return values.get(name);
			} else {
				throw new AttributeMissingException(name);
			}
		}

		@Override
		public void setAttribute(String name, Object value) {
			values.put(name, value);
		}

		@Override
		public Set<String> attributeNames() {
			return unmodifiableSet(values.keySet());
		}
	}

}
