package dev.attrib;

import dev.attrib.annotations.Declared;
import java.util.Map;

/**
 * Record types shared by the tests.
 */
public abstract class AbstractRecordTest {

	static ValidatedField<Integer> grade(String name) {
		return ValidatedField.of(name, Integer.class, 0, Validators.range(0, 100));
	}

	static RecordType<SavingRecord> typeDeclaring(ValidatedField<?>... fields) {
		RecordType.Builder<SavingRecord> builder = RecordType.builder(SavingRecord.class);
		for (ValidatedField<?> field: fields) {
			builder.declare(field);
		}
		return builder.build();
	}

	public static class Homework extends AttributeRecord {
		public static final ValidatedField<Integer> GRADE = grade("grade");
		public static final RecordType<Homework> TYPE = RecordType.builder(Homework.class)
			.declare(GRADE)
			.build();

		public Homework() {
			super(TYPE);
		}
	}

	public static class Exam extends AttributeRecord {
		@Declared static final ValidatedField<Integer> MATH_GRADE = grade("math_grade");
		@Declared static final ValidatedField<Integer> WRITING_GRADE = grade("writing_grade");
		@Declared static final ValidatedField<Integer> SCIENCE_GRADE = grade("science_grade");

		public static final RecordType<Exam> TYPE = RecordType.builder(Exam.class)
			.scanDeclaredFields()
			.build();

		public Exam() {
			super(TYPE);
		}
	}

	public static class BoundedResistance extends AttributeRecord {
		public static final ValidatedField<Double> OHMS = ValidatedField.builder("ohms", Double.class)
			.validator(Validators.greaterThan(0.0))
			.defaultValue(1.0)
			.build();
		public static final RecordType<BoundedResistance> TYPE = RecordType.builder(BoundedResistance.class)
			.declare(OHMS)
			.build();

		public BoundedResistance(double ohms) {
			super(TYPE);
			OHMS.write(this, ohms);
		}
	}

	public static class FixedResistance extends AttributeRecord {
		public static final ValidatedField<Double> OHMS = ValidatedField.builder("ohms", Double.class)
			.validator(Validators.greaterThan(0.0))
			.defaultValue(1.0)
			.writeOnce()
			.build();
		public static final RecordType<FixedResistance> TYPE = RecordType.builder(FixedResistance.class)
			.declare(OHMS)
			.build();

		public FixedResistance(double ohms) {
			super(TYPE);
			OHMS.write(this, ohms);
		}
	}

	/**
	 * Its type is supplied by each test, so each test can count computations.
	 */
	public static class LazyRecord extends AttributeRecord {
		public LazyRecord(RecordType<LazyRecord> type) {
			super(type);
			setAttribute("exists", 5);
		}
	}

	public static class DictionaryRecord extends AttributeRecord {
		public static final RecordType<DictionaryRecord> TYPE = RecordType.builder(DictionaryRecord.class)
			.intercept(BackingMapInterceptor.instance())
			.build();

		public DictionaryRecord(Map<String, ?> data) {
			this(TYPE, data);
		}

		public DictionaryRecord(RecordType<DictionaryRecord> type, Map<String, ?> data) {
			super(type);
			BackingMapInterceptor.attach(raw(), data);
		}
	}

	/**
	 * Its type is supplied by each test, so each test can observe writes.
	 */
	public static class SavingRecord extends AttributeRecord {
		public static final ValidatedField<Integer> GRADE = grade("grade");

		public SavingRecord(RecordType<SavingRecord> type) {
			super(type);
		}
	}

	public static class PlainRecord extends AttributeRecord {
		public static final RecordType<PlainRecord> TYPE = RecordType.plain(PlainRecord.class);

		public PlainRecord() {
			super(TYPE);
		}
	}
}
