package dev.attrib;

import dev.attrib.exceptions.InvalidRecordTypeException;
import org.jetbrains.annotations.Nullable;

/**
 * Checks that record type declarations follow the rules.
 */
final class DeclarationValidation {
	private DeclarationValidation() {}

	/**
	 * @return null if <code>name</code> may be used as a declared field name;
	 * otherwise the reason it can't.
	 */
	static @Nullable String attributeNameProblem(String name) {
		if (name.isEmpty()) {
			return "name can't be empty";
		} else if (isBetween('0', '9', name.codePointAt(0))) {
			return "name can't start with a digit";
		}
		for (int i = 0; i < name.length(); i++) {
			if (!isValidNameChar(name.codePointAt(i))) {
				return "Only ASCII letters, numbers, and underscores are allowed in declared field names; illegal character '" + name.charAt(i) + "' at offset " + i;
			}
		}
		return null;
	}

	static void validateAttributeName(Class<?> recordClass, String name) {
		String problem = attributeNameProblem(name);
		if (problem != null) {
			throw InvalidRecordTypeException.forField(recordClass, name, problem);
		}
	}

	static void validateValueClass(String fieldName, Class<?> valueClass) {
		if (valueClass.isPrimitive()) {
			throw new InvalidRecordTypeException("Field \"" + fieldName + "\" can't use primitive " + valueClass.getSimpleName() + "; use the boxed type instead");
		}
	}

	/**
	 * Note that we reserve the character "$", which would otherwise be a valid
	 * character in a Java field name.
	 */
	private static boolean isValidNameChar(int codePoint) {
		return codePoint == '_'
			|| isBetween('a','z', codePoint)
			|| isBetween('A','Z', codePoint)
			|| isBetween('0','9', codePoint)
			;
	}

	static boolean isBetween(char start, char end, int codePoint) {
		return start <= codePoint && codePoint <= end;
	}
}
