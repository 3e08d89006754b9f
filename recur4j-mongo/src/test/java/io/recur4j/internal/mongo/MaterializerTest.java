package io.recur4j.internal.mongo;

import com.mongodb.MongoException;
import io.recur4j.InstanceCreatedHook;
import io.recur4j.core.CallReminderSettings;
import io.recur4j.core.InstanceHookRegistry;
import io.recur4j.core.JobSnapshot;
import io.recur4j.core.MaterializeResult;
import io.recur4j.core.Occurrence;
import io.recur4j.core.RecurrenceRule;
import io.recur4j.core.RecurrenceType;
import io.recur4j.core.ScopeViolationException;
import io.recur4j.core.SeriesStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.UncategorizedMongoDbException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaterializerTest {

    private static final ZoneId ZONE = ZoneId.of("America/Chicago");
    private static final LocalDateTime ANCHOR = LocalDateTime.parse("2026-01-19T09:00");

    @Mock
    private MongoOccurrenceStore store;

    private final List<String> fired = new ArrayList<>();
    private Materializer materializer;

    @BeforeEach
    void setUp() {
        InstanceCreatedHook recorder = new InstanceCreatedHook() {
            @Override
            public String name() {
                return "recorder";
            }

            @Override
            public void onInstanceCreated(Occurrence instance) {
                fired.add(instance.id());
            }
        };
        materializer = new Materializer(store, TransactionOperations.withoutTransaction(),
                new InstanceHookRegistry(List.of(recorder)));
    }

    private static Occurrence parent(RecurrenceRule rule) {
        return Occurrence.newParent("main-shop",
                        LocalDateTime.parse("2026-01-05T09:00"),
                        LocalDateTime.parse("2026-01-05T11:00"),
                        ZONE, false, JobSnapshot.empty(), CallReminderSettings.none())
                .withRule(rule == null ? null : rule.toRecord())
                .withId("parent-1");
    }

    private static Occurrence weeklyParent() {
        return parent(RecurrenceRule.forever(RecurrenceType.WEEKLY, 1));
    }

    @Test
    void firstCallShouldCreateAndFireHooks() {
        Occurrence p = weeklyParent();
        when(store.findInstance("parent-1", ANCHOR)).thenReturn(Optional.empty());
        when(store.insert(any())).thenAnswer(inv -> inv.<Occurrence>getArgument(0).withId("i-1"));

        MaterializeResult result = materializer.materialize(p, ANCHOR);

        assertThat(result.created()).isTrue();
        assertThat(result.occurrence().id()).isEqualTo("i-1");
        assertThat(result.occurrence().parentId()).isEqualTo("parent-1");
        assertThat(result.occurrence().originalAnchor()).isEqualTo(ANCHOR);
        assertThat(fired).containsExactly("i-1");
    }

    @Test
    void existingInstanceShouldBeReturnedAsIs() {
        Occurrence existing = Occurrence.instanceOf(weeklyParent(), ANCHOR).withId("i-1");
        when(store.findInstance("parent-1", ANCHOR)).thenReturn(Optional.of(existing));

        MaterializeResult result = materializer.materialize(weeklyParent(), ANCHOR);

        assertThat(result.created()).isFalse();
        assertThat(result.occurrence()).isEqualTo(existing);
        verify(store, never()).insert(any());
        assertThat(fired).isEmpty();
    }

    @Test
    void losingARaceShouldReturnTheWinner() {
        Occurrence winner = Occurrence.instanceOf(weeklyParent(), ANCHOR).withId("i-winner");
        when(store.findInstance("parent-1", ANCHOR))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(store.insert(any())).thenThrow(new DuplicateKeyException("E11000 duplicate key ux_parent_anchor"));

        MaterializeResult result = materializer.materialize(weeklyParent(), ANCHOR);

        assertThat(result.created()).isFalse();
        assertThat(result.occurrence().id()).isEqualTo("i-winner");
        assertThat(fired).isEmpty();
    }

    @Test
    void conflictWithoutWinnerShouldFail() {
        when(store.findInstance(eq("parent-1"), any())).thenReturn(Optional.empty());
        when(store.insert(any())).thenThrow(new DuplicateKeyException("E11000"));

        assertThatThrownBy(() -> materializer.materialize(weeklyParent(), ANCHOR))
                .isInstanceOf(SeriesStoreException.class)
                .hasCauseInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void otherFailuresShouldPropagate() {
        when(store.findInstance(eq("parent-1"), any())).thenReturn(Optional.empty());
        when(store.insert(any())).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> materializer.materialize(weeklyParent(), ANCHOR))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("connection reset");
    }

    @Test
    void nonRecurringParentShouldBeRejected() {
        assertThatThrownBy(() -> materializer.materialize(parent(null), ANCHOR))
                .isInstanceOf(ScopeViolationException.class);
    }

    @Test
    void parentSlotShouldBeRejected() {
        assertThatThrownBy(() -> materializer.materialize(weeklyParent(), LocalDateTime.parse("2026-01-05T09:00")))
                .isInstanceOf(ScopeViolationException.class);
    }

    @Test
    void anchorPastSeriesEndShouldBeRejected() {
        Occurrence ended = weeklyParent().withSeriesEndOverride(LocalDate.of(2026, 1, 18));

        assertThatThrownBy(() -> materializer.materialize(ended, ANCHOR))
                .isInstanceOf(ScopeViolationException.class)
                .hasMessageContaining("2026-01-18");
        verify(store, never()).insert(any());
    }

    @Test
    void anchorOffTheSeriesShouldBeRejected() {
        // a Tuesday in a Monday series, and a Monday before the parent
        assertThatThrownBy(() -> materializer.materialize(weeklyParent(), LocalDateTime.parse("2026-01-20T09:00")))
                .isInstanceOf(ScopeViolationException.class)
                .hasMessageContaining("not an occurrence");
        assertThatThrownBy(() -> materializer.materialize(weeklyParent(), LocalDateTime.parse("2025-12-29T09:00")))
                .isInstanceOf(ScopeViolationException.class);
        assertThatThrownBy(() -> materializer.materialize(weeklyParent(), LocalDateTime.parse("2026-01-19T10:00")))
                .isInstanceOf(ScopeViolationException.class);
        verify(store, never()).insert(any());
    }

    @Test
    void transientTransactionErrorShouldCountAsConflict() {
        MongoException writeConflict = new MongoException(112, "WriteConflict");
        writeConflict.addLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL);

        assertThat(Materializer.isWriteConflict(new UncategorizedMongoDbException("tx aborted", writeConflict))).isTrue();
        assertThat(Materializer.isWriteConflict(new DuplicateKeyException("E11000"))).isTrue();
        assertThat(Materializer.isWriteConflict(new IllegalStateException("boom"))).isFalse();
    }
}
