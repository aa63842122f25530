package io.fullerstack.switchboard.container;

import io.fullerstack.switchboard.cell.DispatchContext;
import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.error.AlreadyBorrowedException;
import io.fullerstack.switchboard.registry.ChannelKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Channel}.
 */
class ChannelTest {

    interface Sink {
        void accept(String event);
    }

    static final class Recorder implements Sink {
        final String name;
        final List<String> log;

        Recorder(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public void accept(String event) {
            log.add(name + ":" + event);
        }
    }

    private final DispatchContext context = new DispatchContext();
    private final List<String> log = new ArrayList<>();
    private final Channel<Sink> channel = new Channel<>("events");

    private ExclusivityCell<Recorder> recorder(String name) {
        return ExclusivityCell.of(new Recorder(name, log), context);
    }

    // ========== Ordering ==========

    @Test
    void testDispatch_VisitsInInsertionOrder() {
        channel.insert(recorder("a"));
        channel.insert(recorder("b"));
        channel.insert(recorder("c"));

        channel.dispatch(sink -> sink.accept("e"));

        assertThat(log).containsExactly("a:e", "b:e", "c:e");
        assertThat(channel.kind()).isEqualTo(ChannelKind.CHANNEL);
        assertThat(channel.registry()).isNull();
    }

    @Test
    void testInsert_OrdersByKey() {
        channel.insert(5, recorder("late"));
        channel.insert(-5, recorder("early"));
        channel.insert(recorder("middle"));

        channel.dispatch(sink -> sink.accept("e"));

        assertThat(log).containsExactly("early:e", "middle:e", "late:e");
    }

    @Test
    void testInsert_NegativeKeyPrependsAmongEqualKeys() {
        channel.insert(-1, recorder("first"));
        channel.insert(-1, recorder("second"));
        channel.insert(1, recorder("third"));
        channel.insert(1, recorder("fourth"));

        channel.dispatch(sink -> sink.accept("e"));

        assertThat(log).containsExactly("second:e", "first:e", "third:e", "fourth:e");
    }

    @Test
    void testRemoveIf_PreservesSurvivorOrder() {
        channel.insert(recorder("a"));
        channel.insert(recorder("b"));
        channel.insert(recorder("c"));
        channel.insert(recorder("d"));

        int removed = channel.removeIf(sink -> ((Recorder) sink).name.equals("b"));
        channel.dispatch(sink -> sink.accept("e"));

        assertThat(removed).isEqualTo(1);
        assertThat(log).containsExactly("a:e", "c:e", "d:e");
    }

    @Test
    void testSortBy_IsStableAndToleratesDuplicateMembers() {
        ExclusivityCell<Recorder> twice = recorder("m");
        channel.insert(recorder("z"));
        channel.insert(twice);
        channel.insert(recorder("a"));
        channel.insert(twice);

        channel.sortBy(Comparator.comparing((Sink sink) -> ((Recorder) sink).name));
        channel.dispatch(sink -> sink.accept("e"));

        assertThat(log).containsExactly("a:e", "m:e", "m:e", "z:e");
    }

    // ========== Membership ==========

    @Test
    void testRemove_RemovesEveryIdenticalEntry() {
        // Given: one cell inserted three times at the same key
        ExclusivityCell<Recorder> cell = recorder("x");
        ExclusivityCell<Recorder> bystander = recorder("y");
        channel.insert(cell);
        channel.insert(bystander);
        channel.insert(cell);
        channel.insert(cell);

        // When
        int removed = channel.remove(cell);
        channel.dispatch(sink -> sink.accept("e"));

        // Then
        assertThat(removed).isEqualTo(3);
        assertThat(channel.contains(cell)).isFalse();
        assertThat(channel.members()).containsExactly(bystander);
        assertThat(log).containsExactly("y:e");
    }

    @Test
    void testRemove_OfAbsentCellRemovesNothing() {
        channel.insert(recorder("a"));

        assertThat(channel.remove(recorder("b"))).isZero();
        assertThat(channel.size()).isEqualTo(1);
    }

    @Test
    void testStructuralChange_DuringDispatchFails() {
        channel.insert(recorder("a"));

        assertThatThrownBy(() -> channel.dispatch(sink -> channel.insert(recorder("b"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("events");
        assertThat(channel.isDispatching()).isFalse();
        assertThat(channel.size()).isEqualTo(1);
    }

    // ========== Exclusivity ==========

    @Test
    void testDispatch_IntoChannelHoldingBusyCellFails() {
        // Given: the same cell on two channels
        Channel<Sink> other = new Channel<>("other");
        ExclusivityCell<Recorder> cell = recorder("x");
        channel.insert(cell);
        other.insert(cell);

        // Then: dispatching the second channel from inside the first, without suspending, fails
        assertThatThrownBy(() -> channel.dispatch(sink -> other.dispatch(inner -> inner.accept("nested"))))
            .isInstanceOf(AlreadyBorrowedException.class);
        assertThat(cell.isFree()).isTrue();
        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void testDispatch_WithSuspendReentersSameCellOnce() {
        // Given: the same cell on two channels
        Channel<Sink> other = new Channel<>("other");
        ExclusivityCell<Recorder> cell = recorder("x");
        channel.insert(cell);
        other.insert(cell);

        // When: the handler suspends itself before dispatching the second channel
        channel.dispatch((sink, hold) -> {
            sink.accept("outer");
            hold.suspend(() -> other.dispatch(inner -> inner.accept("inner")));
        });

        // Then
        assertThat(log).containsExactly("x:outer", "x:inner");
        assertThat(cell.isFree()).isTrue();
    }

    @Test
    void testDispatchShared_AllowsNestedSharedDispatch() {
        Channel<Sink> other = new Channel<>("other");
        ExclusivityCell<Recorder> cell = recorder("x");
        channel.insert(cell);
        other.insert(cell);

        channel.dispatchShared(sink -> other.dispatchShared(inner -> inner.accept("read")));

        assertThat(log).containsExactly("x:read");
    }
}
