package me.golemcore.admission.adapter.outbound.deadletter;

import me.golemcore.admission.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.admission.domain.model.DeadLetterEvent;
import me.golemcore.admission.domain.model.ErrorClass;
import me.golemcore.admission.domain.model.ErrorSeverity;
import me.golemcore.admission.domain.model.FailureNotificationEvent;
import me.golemcore.admission.domain.model.FailureRecord;
import me.golemcore.admission.infrastructure.config.AdmissionProperties;
import me.golemcore.admission.infrastructure.config.AutoConfiguration;
import me.golemcore.admission.infrastructure.event.SpringEventBus;
import me.golemcore.admission.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import static org.junit.jupiter.api.Assertions.*;

class LocalDeadLetterAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SpringEventBus eventBus;
    private LocalDeadLetterAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        AdmissionProperties properties = new AdmissionProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        eventBus = mock(SpringEventBus.class);
        adapter = new LocalDeadLetterAdapter(eventBus, storage, AutoConfiguration.objectMapper(), properties, clock);
    }

    private static FailureRecord failure(String errorId, Instant timestamp) {
        return FailureRecord.builder()
                .errorId(errorId)
                .errorHash("hash-" + errorId)
                .timestamp(timestamp)
                .requestId("req-1")
                .subjectId("u1")
                .dependency("bedrock")
                .operation("generate")
                .exceptionType("DependencyException")
                .exceptionMessage("down")
                .severity(ErrorSeverity.CRITICAL)
                .errorClass(ErrorClass.SERVICE_UNAVAILABLE)
                .errorCode("ServiceUnavailableException")
                .statusCode(503)
                .attempts(4)
                .rawDetails(Map.of("cause", "down"))
                .expiresAt(timestamp.plus(Duration.ofDays(30)))
                .build();
    }

    @Test
    void enqueue_publishesDeadLetterEvent() {
        FailureRecord record = failure("e1", NOW);

        adapter.enqueue(record);

        verify(eventBus).publish(new DeadLetterEvent(record));
    }

    @Test
    void persist_appendsOneLinePerRecordToDailyFile() throws Exception {
        adapter.persist(failure("e1", NOW));
        adapter.persist(failure("e2", NOW.plusSeconds(60)));

        List<String> lines = Files.readAllLines(tempDir.resolve("failures/2026-03-10.jsonl"));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"errorId\":\"e1\""));

        List<FailureRecord> records = adapter.readFailures(LocalDate.of(2026, 3, 10));
        assertEquals(List.of("e1", "e2"), records.stream().map(FailureRecord::getErrorId).toList());
        assertEquals(ErrorSeverity.CRITICAL, records.get(0).getSeverity());
        assertEquals(NOW, records.get(0).getTimestamp());
    }

    @Test
    void readFailures_skipsExpiredAndUnreadableLines() throws Exception {
        adapter.persist(failure("e1", NOW));
        Files.writeString(tempDir.resolve("failures/2026-03-10.jsonl"), "not json\n",
                StandardOpenOption.APPEND);

        assertEquals(1, adapter.readFailures(LocalDate.of(2026, 3, 10)).size());

        clock.advance(Duration.ofDays(31));
        assertTrue(adapter.readFailures(LocalDate.of(2026, 3, 10)).isEmpty());
    }

    @Test
    void readFailures_returnsEmptyForDayWithoutLog() {
        assertTrue(adapter.readFailures(LocalDate.of(2026, 1, 1)).isEmpty());
    }

    @Test
    void listFailureDays_ignoresForeignFiles() throws Exception {
        adapter.persist(failure("e1", NOW));
        adapter.persist(failure("e2", NOW.minus(Duration.ofDays(2))));
        Files.writeString(tempDir.resolve("failures/notes.jsonl"), "x");

        assertEquals(List.of(LocalDate.of(2026, 3, 8), LocalDate.of(2026, 3, 10)), adapter.listFailureDays());
    }

    @Test
    void notify_publishesNotificationWithSubject() {
        FailureRecord record = failure("e1", NOW);

        adapter.notify(record);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).publish(captor.capture());
        FailureNotificationEvent event = assertInstanceOf(FailureNotificationEvent.class, captor.getValue());
        assertEquals("CRITICAL Error - bedrock", event.subject());
        assertTrue(event.message().contains("errorId=e1"));
        assertSame(record, event.record());
    }
}
