package dev.attrib;

import dev.attrib.annotations.Declared;
import dev.attrib.exceptions.AttributeMissingException;
import dev.attrib.exceptions.InvalidRecordTypeException;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecordTypeTest extends AbstractRecordTest {

	@Test
	void scanDeclaredFields_findsFieldsInOrder() {
		List<String> names = Exam.TYPE.declaredFields().stream()
			.map(ValidatedField::name)
			.toList();
		assertEquals(List.of("math_grade", "writing_grade", "science_grade"), names);
		assertSame(Exam.WRITING_GRADE, Exam.TYPE.declaredField("writing_grade"));
		assertNull(Exam.TYPE.declaredField("history_grade"));
	}

	@Test
	void declaredFields_readableThroughInterceptable() {
		Exam exam = new Exam();
		exam.setAttribute("math_grade", 77);
		assertEquals(77, exam.getAttribute("math_grade"));
		assertEquals(77, Exam.MATH_GRADE.read(exam));
		assertEquals(0, exam.getAttribute("science_grade"));
		assertThat(exam.attributeNames(), contains("math_grade"));
	}

	@Test
	void undeclaredName_storedOrMissing() {
		Exam exam = new Exam();
		assertThrows(AttributeMissingException.class, () -> exam.getAttribute("history_grade"));
		exam.setAttribute("comment", "see me");
		assertEquals("see me", exam.getAttribute("comment"));
		assertEquals(AttributeState.PLAIN, Exam.TYPE.stateOf(exam, "comment"));
	}

	@Test
	void sameFieldSharedByTwoTypes_keepsValuesSeparate() {
		ValidatedField<Integer> shared = grade("shared");
		RecordType<LazyRecord> first = RecordType.builder(LazyRecord.class).declare(shared).build();
		RecordType<SavingRecord> second = RecordType.builder(SavingRecord.class).declare(shared).build();
		LazyRecord a = new LazyRecord(first);
		SavingRecord b = new SavingRecord(second);
		a.setAttribute("shared", 10);
		b.setAttribute("shared", 20);
		assertEquals(10, a.getAttribute("shared"));
		assertEquals(20, b.getAttribute("shared"));
	}

	@Test
	void duplicateName_rejected() {
		InvalidRecordTypeException e = assertThrows(InvalidRecordTypeException.class, () -> RecordType.builder(PlainRecord.class)
			.declare(grade("grade"))
			.declare(grade("grade"))
			.build());
		assertThat(e.getMessage(), containsString("more than once"));
	}

	@Test
	void nonStaticDeclaredField_rejected() {
		InvalidRecordTypeException e = assertThrows(InvalidRecordTypeException.class, () -> RecordType.builder(NonStaticDeclared.class)
			.scanDeclaredFields());
		assertThat(e.getMessage(), containsString("static"));
	}

	@Test
	void wrongTypeDeclaredField_rejected() {
		assertThrows(InvalidRecordTypeException.class, () -> RecordType.builder(WrongTypeDeclared.class)
			.scanDeclaredFields());
	}

	@Test
	void declaredFieldAfterType_rejected() {
		ExceptionInInitializerError e = assertThrows(ExceptionInInitializerError.class, () -> new DeclaredTooLate());
		assertThat(e.getCause(), instanceOf(InvalidRecordTypeException.class));
		assertThat(e.getCause().getMessage(), containsString("not yet initialized"));
	}

	@Test
	void noDeclaredFields_scanStillBuilds() {
		RecordType<PlainRecord> type = RecordType.builder(PlainRecord.class)
			.scanDeclaredFields()
			.build();
		assertFalse(type.declaredFields().iterator().hasNext());
	}

	@Test
	void wrongRecordClass_rejectedByConstructor() {
		assertThrows(IllegalArgumentException.class, () -> new Impostor());
	}

	@Test
	void stateOf_plainRecord() {
		PlainRecord r = new PlainRecord();
		assertEquals(AttributeState.PLAIN, PlainRecord.TYPE.stateOf(r, "anything"));
		assertFalse(PlainRecord.TYPE.hasLazyBinder());
		assertFalse(PlainRecord.TYPE.hasFullInterceptor());
		assertFalse(PlainRecord.TYPE.hasWriteInterceptor());
	}

	@Test
	void name_isSimpleClassName() {
		assertEquals("Exam", Exam.TYPE.name());
		assertEquals(Exam.class, Exam.TYPE.recordClass());
	}

	public static class NonStaticDeclared extends AttributeRecord {
		@Declared final ValidatedField<Integer> grade = grade("grade");

		public NonStaticDeclared() {
			super(PlainRecord.TYPE);
		}
	}

	public static class WrongTypeDeclared extends AttributeRecord {
		@Declared static final String GRADE = "grade";

		public WrongTypeDeclared() {
			super(PlainRecord.TYPE);
		}
	}

	public static class DeclaredTooLate extends AttributeRecord {
		public static final RecordType<DeclaredTooLate> TYPE = RecordType.builder(DeclaredTooLate.class)
			.scanDeclaredFields()
			.build();
		@Declared static final ValidatedField<Integer> GRADE = grade("grade");

		public DeclaredTooLate() {
			super(TYPE);
		}
	}

	public static class Impostor extends AttributeRecord {
		public Impostor() {
			super(PlainRecord.TYPE);
		}
	}
}
