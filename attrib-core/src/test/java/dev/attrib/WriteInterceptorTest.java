package dev.attrib;

import dev.attrib.exceptions.ValidationException;
import dev.attrib.interceptors.AuditingWriteListener;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WriteInterceptorTest extends AbstractRecordTest {

	@Test
	void listener_seesPreviousValueBeforeCommit() {
		List<String> log = new ArrayList<>();
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.onWrite((raw, name, value) -> log.add(name + ": " + raw.get(name) + " -> " + value))
			.build();
		SavingRecord r = new SavingRecord(type);
		r.setAttribute("foo", 5);
		r.setAttribute("foo", 6);
		assertThat(log, contains(
			"foo: Missing[] -> 5",
			"foo: Found[value=5] -> 6"));
		assertEquals(6, r.getAttribute("foo"));
	}

	@Test
	void throwingListener_preventsCommit() {
		IllegalStateException veto = new IllegalStateException("read-only");
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.onWrite((raw, name, value) -> {
				if (name.equals("locked")) {
					throw veto;
				}
			})
			.build();
		SavingRecord r = new SavingRecord(type);
		assertSame(veto, assertThrows(IllegalStateException.class, () -> r.setAttribute("locked", 1)));
		assertFalse(r.hasAttribute("locked"));
		r.setAttribute("open", 2);
		assertEquals(2, r.getAttribute("open"));
	}

	@Test
	void listenerWritingThroughRaw_doesNotRecurse() {
		List<String> log = new ArrayList<>();
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.onWrite((raw, name, value) -> {
				log.add(name);
				raw.put("last_written", name);
			})
			.build();
		SavingRecord r = new SavingRecord(type);
		r.setAttribute("foo", 1);
		assertThat(log, contains("foo"));
		assertEquals("foo", r.getAttribute("last_written"));
	}

	@Test
	void declaredField_rejectedWriteNeverReachesListener() {
		List<Object> audited = new ArrayList<>();
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.declare(SavingRecord.GRADE)
			.onWrite((raw, name, value) -> audited.add(value))
			.build();
		SavingRecord r = new SavingRecord(type);
		r.setAttribute("grade", 90);
		assertThrows(ValidationException.class, () -> r.setAttribute("grade", 150));
		assertThrows(ValidationException.class, () -> r.setAttribute("grade", "ninety"));
		assertThat(audited, contains(90));
		assertEquals(90, r.getAttribute("grade"));
		assertFalse(r.raw().contains("grade"), "Declared values don't go to the store");
	}

	@Test
	void declaredWriteOnceField_secondWriteNeverReachesListener() {
		ValidatedField<String> id = ValidatedField.builder("id", String.class)
			.writeOnce()
			.build();
		List<Object> audited = new ArrayList<>();
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.declare(id)
			.onWrite((raw, name, value) -> audited.add(value))
			.build();
		SavingRecord r = new SavingRecord(type);
		r.setAttribute("id", "first");
		assertThrows(ValidationException.class, () -> r.setAttribute("id", "second"));
		assertThat(audited, contains("first"));
		assertEquals("first", r.getAttribute("id"));
	}

	@Test
	void declaredField_throwingListenerPreventsCommit() {
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.declare(SavingRecord.GRADE)
			.onWrite((raw, name, value) -> {
				throw new IllegalStateException("read-only");
			})
			.build();
		SavingRecord r = new SavingRecord(type);
		assertThrows(IllegalStateException.class, () -> r.setAttribute("grade", 50));
		assertFalse(SavingRecord.GRADE.isSet(r));
	}

	@Test
	void multipleListeners_runInOrder() {
		List<String> log = new ArrayList<>();
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.onWrite((raw, name, value) -> log.add("first"))
			.onWrite((raw, name, value) -> log.add("second"))
			.onWrite(AuditingWriteListener.forType(SavingRecord.class))
			.onWrite((raw, name, value) -> log.add("third"))
			.build();
		SavingRecord r = new SavingRecord(type);
		r.setAttribute("foo", 1);
		assertThat(log, contains("first", "second", "third"));
		assertTrue(type.hasWriteInterceptor());
	}

	@Test
	void reservedName_rejectedBeforeListener() {
		List<String> log = new ArrayList<>();
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class)
			.onWrite((raw, name, value) -> log.add(name))
			.build();
		SavingRecord r = new SavingRecord(type);
		assertThrows(IllegalArgumentException.class, () -> r.setAttribute("secret$", 1));
		assertTrue(log.isEmpty());
	}

	@Test
	void noListeners_noInterceptor() {
		RecordType<SavingRecord> type = RecordType.builder(SavingRecord.class).build();
		assertFalse(type.hasWriteInterceptor());
		SavingRecord r = new SavingRecord(type);
		r.setAttribute("foo", 1);
		assertEquals(1, r.getAttribute("foo"));
	}
}
