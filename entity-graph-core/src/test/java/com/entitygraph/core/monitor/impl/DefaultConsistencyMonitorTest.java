package com.entitygraph.core.monitor.impl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.entitygraph.core.integrity.IntegrityChecker;
import com.entitygraph.core.integrity.IntegrityCheckerConfig;
import com.entitygraph.core.integrity.RepairOptions;
import com.entitygraph.core.integrity.impl.DefaultIntegrityChecker;
import com.entitygraph.core.model.DriftResult;
import com.entitygraph.core.model.Entity;
import com.entitygraph.core.model.IntegrityReport;
import com.entitygraph.core.model.IntegrityViolation;
import com.entitygraph.core.model.MonitorEvent;
import com.entitygraph.core.model.MonitorEventType;
import com.entitygraph.core.model.MonitorStatus;
import com.entitygraph.core.model.NormalizedEntities;
import com.entitygraph.core.model.OnDelete;
import com.entitygraph.core.model.RelationDefinition;
import com.entitygraph.core.model.RepairResult;
import com.entitygraph.core.model.StateSnapshot;
import com.entitygraph.core.monitor.ConsistencyMonitor;
import com.entitygraph.core.monitor.ConsistencyMonitorConfig;
import com.entitygraph.core.monitor.Subscription;
import com.entitygraph.core.store.EntityStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DefaultConsistencyMonitor}.
 */
class DefaultConsistencyMonitorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IntegrityChecker checker;
    private NormalizedEntities store;
    private ConsistencyMonitor monitor;

    @BeforeEach
    void setUp() {
        checker = new DefaultIntegrityChecker(IntegrityCheckerConfig.builder()
            .entities("users", "posts")
            .relation(RelationDefinition.required("posts", "author", "users").withOnDelete(OnDelete.CASCADE))
            .build());
        store = NormalizedEntities.of(Map.of(
            "users", Map.of(
                "1", Entity.of(Map.of("id", "1")),
                "2", Entity.of(Map.of("id", "2")),
                "3", Entity.of(Map.of("id", "3"))),
            "posts", Map.of("10", Entity.of(Map.of("id", "10", "author", "1")))));
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).build());
    }

    @AfterEach
    void tearDown() {
        monitor.dispose();
    }

    @Test
    void newMonitor_isIdleWithoutReports() {
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.IDLE);
        assertThat(monitor.getLastReport()).isEmpty();
        assertThat(monitor.getLastRepairResult()).isEmpty();
        assertThat(monitor.isActive()).isFalse();
    }

    @Test
    void check_validStore_emitsLifecycleEvents() {
        List<MonitorEvent> events = new ArrayList<>();
        monitor.subscribe(events::add);

        IntegrityReport report = monitor.check(store);

        assertThat(report.valid()).isTrue();
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.VALID);
        assertThat(monitor.getLastReport()).contains(report);
        assertThat(events).extracting(MonitorEvent::type).containsExactly(
            MonitorEventType.STATUS_CHANGE,
            MonitorEventType.CHECK_START,
            MonitorEventType.STATUS_CHANGE,
            MonitorEventType.CHECK_COMPLETE);
        assertThat(events.get(0).data()).isEqualTo(new MonitorEvent.StatusChange(MonitorStatus.IDLE, MonitorStatus.CHECKING));
        assertThat(events.get(3).data()).isSameAs(report);
        assertThat(monitor.getHistory()).isEqualTo(events);
    }

    @Test
    void check_brokenStore_reportsViolationsAndCallback() {
        AtomicReference<List<IntegrityViolation>> seen = new AtomicReference<>();
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).onViolation(seen::set).build());

        monitor.check(EntityStore.removeEntity(store, "users", "1"));

        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.INVALID);
        assertThat(seen.get()).hasSize(1);
        assertThat(monitor.getHistory()).extracting(MonitorEvent::type).contains(MonitorEventType.VIOLATION_DETECTED);
    }

    @Test
    void check_withAutoRepair_repairsBeforeCompleting() {
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).autoRepair(true).build());

        monitor.check(EntityStore.removeEntity(store, "users", "1"));

        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.VALID);
        RepairResult repair = monitor.getLastRepairResult().orElseThrow();
        assertThat(repair.entities().contains("posts", "10")).isFalse();
        List<MonitorEventType> types = monitor.getHistory().stream().map(MonitorEvent::type).toList();
        assertThat(types.indexOf(MonitorEventType.REPAIR_COMPLETE))
            .isLessThan(types.indexOf(MonitorEventType.CHECK_COMPLETE));
    }

    @Test
    void repair_withoutPriorCheck_checksFirst() {
        RepairResult result = monitor.repair(EntityStore.removeEntity(store, "users", "1"));

        assertThat(monitor.getLastReport()).isPresent();
        assertThat(result.repairs()).hasSize(1);
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.VALID);
    }

    @Test
    void repair_dryRun_keepsStore() {
        NormalizedEntities broken = EntityStore.removeEntity(store, "users", "1");
        monitor.check(broken);

        monitor.repair(broken, RepairOptions.builder().dryRun(true).build());

        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.VALID);
        assertThat(monitor.getLastRepairResult().orElseThrow().entities()).isSameAs(broken);
    }

    @Test
    void repair_withRemainingViolations_isInvalid() {
        IntegrityChecker restrictive = new DefaultIntegrityChecker(IntegrityCheckerConfig.builder()
            .entities("posts")
            .relation(RelationDefinition.required("posts", "author", "users").withOnDelete(OnDelete.RESTRICT))
            .build());
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(restrictive).build());

        RepairResult result = monitor.repair(EntityStore.removeEntity(store, "users", "1"));

        assertThat(result.remaining()).hasSize(1);
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.INVALID);
    }

    @Test
    void check_checkerFailure_setsErrorAndRethrows() {
        IntegrityChecker failing = new DefaultIntegrityChecker(IntegrityCheckerConfig.builder().entities("users").build()) {
            @Override
            public IntegrityReport check(NormalizedEntities entities) {
                throw new IllegalStateException("checker down");
            }
        };
        AtomicReference<Throwable> error = new AtomicReference<>();
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(failing).onError(error::set).build());

        assertThatThrownBy(() -> monitor.check(store)).isInstanceOf(IllegalStateException.class);

        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.ERROR);
        assertThat(error.get()).hasMessage("checker down");
        assertThat(monitor.getHistory()).filteredOn(event -> event.type() == MonitorEventType.ERROR)
            .singleElement().extracting(MonitorEvent::data).isEqualTo("checker down");
    }

    @Test
    void check_afterCheckerFailure_staysErrorUntilNextSuccessfulCheck() {
        AtomicBoolean down = new AtomicBoolean(true);
        IntegrityChecker flaky = new DefaultIntegrityChecker(IntegrityCheckerConfig.builder()
            .entities("users", "posts")
            .relation(RelationDefinition.required("posts", "author", "users"))
            .build()) {
            @Override
            public IntegrityReport check(NormalizedEntities entities) {
                if (down.get()) {
                    throw new IllegalStateException("checker down");
                }
                return super.check(entities);
            }
        };
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(flaky).build());

        assertThatThrownBy(() -> monitor.check(store)).isInstanceOf(IllegalStateException.class);
        monitor.createSnapshot(store);
        monitor.detectDrift(store);
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.ERROR);

        down.set(false);
        monitor.check(store);
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.VALID);

        down.set(true);
        assertThatThrownBy(() -> monitor.check(store)).isInstanceOf(IllegalStateException.class);
        down.set(false);
        monitor.check(EntityStore.removeEntity(store, "users", "1"));
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.INVALID);
    }

    @Test
    void detectDrift_serializesWithNestedSnapshots() {
        monitor.check(store);
        monitor.createSnapshot(store, "baseline");

        DriftResult drift = monitor.detectDrift(EntityStore.removeEntity(store, "users", "3")).orElseThrow();
        JsonNode json = MAPPER.valueToTree(drift);

        assertThat(fieldNames(json)).containsExactly("hasDrift", "snapshots", "changes", "totalChanges");
        assertThat(fieldNames(json.get("snapshots"))).containsExactly("source", "target");
        assertThat(json.get("snapshots").get("source").get("label").asText()).isEqualTo("baseline");
        assertThat(json.get("changes").get("removed").get("users").asInt()).isEqualTo(1);
        assertThat(fieldNames(json.get("snapshots").get("source")))
            .contains("id", "timestamp", "entityCounts", "hash", "report", "label");
    }

    @Test
    void check_reportAndEventsSerializeToPlainJson() {
        List<MonitorEvent> events = new ArrayList<>();
        monitor.subscribe(events::add);

        IntegrityReport report = monitor.check(EntityStore.removeEntity(store, "users", "1"));
        JsonNode json = MAPPER.valueToTree(report);

        assertThat(fieldNames(json))
            .containsExactly("valid", "timestamp", "duration", "entityCounts", "violations", "stats");
        assertThat(json.get("valid").asBoolean()).isFalse();
        assertThat(json.get("violations").get(0).get("type").asText()).isEqualTo("referential");

        JsonNode event = MAPPER.valueToTree(events.get(events.size() - 1));
        assertThat(fieldNames(event)).containsExactly("type", "timestamp", "data");
        assertThat(event.get("type").asText()).isEqualTo("check-complete");
        assertThat(event.get("data").get("duration").isNumber()).isTrue();
    }

    @Test
    void detectDrift_afterRemovingUser_reportsRemoval() {
        AtomicReference<DriftResult> drift = new AtomicReference<>();
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).onDrift(drift::set).build());
        monitor.createSnapshot(store);

        DriftResult result = monitor.detectDrift(EntityStore.removeEntity(store, "users", "3")).orElseThrow();

        assertThat(result.hasDrift()).isTrue();
        assertThat(result.changes().removed()).containsEntry("users", 1);
        assertThat(result.changes().added()).isEmpty();
        assertThat(result.totalChanges()).isEqualTo(1);
        assertThat(drift.get()).isSameAs(result);
    }

    @Test
    void detectDrift_unchangedStore_hasNoDrift() {
        monitor.createSnapshot(store, "baseline");

        DriftResult result = monitor.detectDrift(NormalizedEntities.of(store.types())).orElseThrow();

        assertThat(result.hasDrift()).isFalse();
        assertThat(result.totalChanges()).isZero();
        assertThat(result.snapshots().source().label()).isEqualTo("baseline");
        assertThat(monitor.getHistory()).extracting(MonitorEvent::type)
            .doesNotContain(MonitorEventType.DRIFT_DETECTED);
    }

    @Test
    void detectDrift_withoutSnapshot_isEmpty() {
        assertThat(monitor.detectDrift(store)).isEmpty();
    }

    @Test
    void detectDrift_sameCountsDifferentIds_hasDriftWithoutChanges() {
        monitor.createSnapshot(store);
        NormalizedEntities swapped = EntityStore.putEntity(
            EntityStore.removeEntity(store, "users", "3"), "users", "4", Entity.of(Map.of("id", "4")));

        DriftResult result = monitor.detectDrift(swapped).orElseThrow();

        assertThat(result.hasDrift()).isTrue();
        assertThat(result.totalChanges()).isZero();
    }

    @Test
    void compareWithSnapshot_unknownId_isEmpty() {
        StateSnapshot first = monitor.createSnapshot(store);
        monitor.createSnapshot(EntityStore.removeEntity(store, "users", "2"));

        assertThat(monitor.compareWithSnapshot(store, "missing")).isEmpty();
        assertThat(monitor.compareWithSnapshot(store, first.id()).orElseThrow().hasDrift()).isFalse();
        assertThat(monitor.getSnapshots()).hasSize(2);
    }

    @Test
    void snapshots_areCappedAtMaximum() {
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).maxSnapshots(2).build());

        monitor.createSnapshot(store, "a");
        monitor.createSnapshot(store, "b");
        monitor.createSnapshot(store, "c");

        assertThat(monitor.getSnapshots()).extracting(StateSnapshot::label).containsExactly("b", "c");
    }

    @Test
    void history_isCappedAndClearable() {
        monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker).maxHistory(3).build());

        monitor.check(store);
        monitor.check(store);

        assertThat(monitor.getHistory()).hasSize(3);
        monitor.clearHistory();
        assertThat(monitor.getHistory()).isEmpty();
    }

    @Test
    void subscribe_unsubscribeStopsDelivery() {
        List<MonitorEvent> events = new ArrayList<>();
        Subscription subscription = monitor.subscribe(events::add);
        monitor.createSnapshot(store);

        subscription.unsubscribe();
        monitor.createSnapshot(store);

        assertThat(events).hasSize(1);
    }

    @Test
    void failingListener_doesNotBreakOthers() {
        List<MonitorEvent> events = new ArrayList<>();
        monitor.subscribe(event -> {
            throw new IllegalStateException("listener failure");
        });
        monitor.subscribe(events::add);

        monitor.check(store);

        assertThat(events).isNotEmpty();
        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.VALID);
    }

    @Test
    void failingListenerAndCallback_areLoggedAsErrors() {
        Logger logger = (Logger) LoggerFactory.getLogger(DefaultConsistencyMonitor.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            monitor = ConsistencyMonitor.create(ConsistencyMonitorConfig.builder(checker)
                .onViolation(violations -> {
                    throw new IllegalStateException("callback failure");
                })
                .build());
            monitor.subscribe(event -> {
                throw new IllegalStateException("listener failure");
            });

            monitor.check(EntityStore.removeEntity(store, "users", "1"));

            assertThat(appender.list)
                .filteredOn(event -> event.getFormattedMessage().contains("failure"))
                .isNotEmpty()
                .allSatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.ERROR))
                .anySatisfy(event -> assertThat(event.getFormattedMessage()).contains("callback failure"))
                .anySatisfy(event -> assertThat(event.getFormattedMessage()).contains("listener failure"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void start_withInterval_runsScheduledChecks() throws InterruptedException {
        monitor = ConsistencyMonitor.create(
            ConsistencyMonitorConfig.builder(checker).checkInterval(Duration.ofMillis(20)).build());
        CountDownLatch checks = new CountDownLatch(2);
        List<MonitorEvent> completed = new CopyOnWriteArrayList<>();
        monitor.subscribe(event -> {
            if (event.type() == MonitorEventType.CHECK_COMPLETE) {
                completed.add(event);
                checks.countDown();
            }
        });

        monitor.start(() -> store);
        monitor.start(() -> store);

        assertThat(monitor.isActive()).isTrue();
        assertThat(checks.await(5, TimeUnit.SECONDS)).isTrue();
        monitor.stop();
        assertThat(monitor.isActive()).isFalse();
        assertThat(completed).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    void start_withoutInterval_isActiveButOnDemand() {
        monitor.start(() -> store);

        assertThat(monitor.isActive()).isTrue();
        assertThat(monitor.getHistory()).isEmpty();
    }

    @Test
    void dispose_resetsState() {
        monitor.check(store);
        monitor.createSnapshot(store);

        monitor.dispose();

        assertThat(monitor.getStatus()).isEqualTo(MonitorStatus.IDLE);
        assertThat(monitor.getHistory()).isEmpty();
        assertThat(monitor.getSnapshots()).isEmpty();
        assertThat(monitor.getLastReport()).isEmpty();
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
