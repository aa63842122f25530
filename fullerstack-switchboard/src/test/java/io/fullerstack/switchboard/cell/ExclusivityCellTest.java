package io.fullerstack.switchboard.cell;

import io.fullerstack.switchboard.error.AlreadyBorrowedException;
import io.fullerstack.switchboard.error.NotInContextException;
import io.fullerstack.switchboard.error.UnexpectedItemException;
import io.fullerstack.switchboard.registry.HandlerIdentity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ExclusivityCell}, {@link Hold} and {@link DispatchContext}.
 */
class ExclusivityCellTest {

    static final class Counter {
        int value;
    }

    private final DispatchContext context = new DispatchContext();
    private final ExclusivityCell<Counter> cell =
        new ExclusivityCell<>(new Counter(), context, HandlerIdentity.of("Counter"));

    // ========== Basic dispatch ==========

    @Test
    void testDispatch_GivesPayloadAndRestoresFree() {
        int result = cell.dispatch(hold -> {
            assertThat(cell.state()).isEqualTo(AccessState.EXCLUSIVE);
            assertThat(context.top()).isSameAs(hold);
            return ++hold.payload().value;
        });

        assertThat(result).isEqualTo(1);
        assertThat(cell.isFree()).isTrue();
        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void testDispatch_RestoresStateWhenFunctionThrows() {
        assertThatThrownBy(() -> cell.dispatch(hold -> {
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");

        assertThat(cell.isFree()).isTrue();
        assertThat(context.depth()).isZero();
    }

    @Test
    void testHold_IsReleasedAfterDispatch() {
        AtomicReference<Hold<Counter>> escaped = new AtomicReference<>();
        cell.dispatch(hold -> {
            escaped.set(hold);
            return null;
        });

        assertThat(escaped.get().isReleased()).isTrue();
        assertThatThrownBy(() -> escaped.get().payload())
            .isInstanceOf(NotInContextException.class);
    }

    // ========== Exclusivity ==========

    @Test
    void testReentrantDispatch_WithoutSuspendFails() {
        assertThatThrownBy(() -> cell.dispatch(hold -> cell.dispatch(inner -> inner.payload().value)))
            .isInstanceOf(AlreadyBorrowedException.class)
            .hasMessageContaining("Counter");

        assertThat(cell.isFree()).isTrue();
    }

    @Test
    void testSharedDispatch_NestsButBlocksExclusive() {
        int readers = cell.dispatchShared(outer -> cell.dispatchShared(inner -> {
            assertThat(outer.payload()).isSameAs(inner.payload());
            return ((AccessState.Shared) cell.state()).readers();
        }));

        assertThat(readers).isEqualTo(2);
        assertThatThrownBy(() -> cell.dispatchShared(hold -> cell.dispatch(inner -> 0)))
            .isInstanceOf(AlreadyBorrowedException.class);
        assertThat(cell.isFree()).isTrue();
    }

    // ========== Suspend ==========

    @Test
    void testSuspend_AllowsReentry() {
        List<String> trace = new ArrayList<>();

        cell.dispatch(hold -> {
            trace.add("outer");
            hold.suspend(() -> cell.dispatch(inner -> {
                trace.add("inner");
                inner.payload().value++;
                return null;
            }));
            hold.payload().value++;
            return null;
        });

        assertThat(trace).containsExactly("outer", "inner");
        int value = cell.dispatch(hold -> hold.payload().value);
        assertThat(value).isEqualTo(2);
    }

    @Test
    void testSuspend_HidesPayloadWhileSuspended() {
        cell.dispatch(hold -> {
            hold.suspend(() -> {
                assertThat(hold.isSuspended()).isTrue();
                assertThatThrownBy(hold::payload).isInstanceOf(NotInContextException.class);
            });
            assertThat(hold.isActive()).isTrue();
            return hold.payload();
        });
    }

    @Test
    void testSuspend_RestoresHoldWhenBodyThrows() {
        cell.dispatch(hold -> {
            assertThatThrownBy(() -> hold.suspend(() -> {
                throw new IllegalStateException("inner failure");
            })).hasMessage("inner failure");
            assertThat(cell.state()).isEqualTo(AccessState.EXCLUSIVE);
            assertThat(hold.isActive()).isTrue();
            return null;
        });
        assertThat(cell.isFree()).isTrue();
    }

    @Test
    void testSuspend_OutsideDispatchFails() {
        Hold<Counter> stale = cell.dispatch(hold -> hold);

        assertThatThrownBy(() -> cell.suspend(stale, () -> { }))
            .isInstanceOf(NotInContextException.class);
    }

    @Test
    void testSuspend_WithForeignHoldFails() {
        ExclusivityCell<Counter> other = ExclusivityCell.of(new Counter(), context);

        cell.dispatch(hold -> {
            assertThatThrownBy(() -> other.suspend(hold, () -> { }))
                .isInstanceOf(UnexpectedItemException.class);
            return null;
        });
    }

    @Test
    void testSuspend_OfOuterHoldFails() {
        ExclusivityCell<Counter> other = ExclusivityCell.of(new Counter(), context);

        cell.dispatch(outer -> other.dispatch(inner -> {
            assertThatThrownBy(() -> outer.suspend(() -> { }))
                .isInstanceOf(UnexpectedItemException.class)
                .hasMessageContaining("innermost");
            return null;
        }));
    }

    @Test
    void testSuspend_OfOuterHoldCannotReenterOuterCell() {
        ExclusivityCell<Counter> inner = ExclusivityCell.of(new Counter(), context);
        List<String> trace = new ArrayList<>();

        cell.dispatch(outerHold -> inner.dispatch(innerHold -> {
            assertThatThrownBy(() -> outerHold.suspend(() -> {
                cell.dispatch(again -> trace.add("reentered"));
            }))
                .isInstanceOf(UnexpectedItemException.class);
            assertThat(outerHold.isActive()).isTrue();
            return null;
        }));

        assertThat(trace).isEmpty();
        assertThat(cell.isFree()).isTrue();
        assertThat(inner.isFree()).isTrue();
        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void testSuspend_TwiceFails() {
        cell.dispatch(hold -> {
            hold.suspend(() -> {
                assertThatThrownBy(() -> hold.suspend(() -> { }))
                    .isInstanceOf(NotInContextException.class)
                    .hasMessageContaining("already suspended");
            });
            return null;
        });
    }

    @Test
    void testSuspendShared_ReleasesOneReader() {
        cell.dispatchShared(hold -> hold.suspend(() -> {
            assertThat(cell.isFree()).isTrue();
            return cell.dispatch(inner -> ++inner.payload().value);
        }));

        assertThat(cell.isFree()).isTrue();
    }

    // ========== Context ==========

    @Test
    void testContext_TracksNestedDispatches() {
        ExclusivityCell<Counter> other = ExclusivityCell.of(new Counter(), context);

        int depth = cell.dispatch(outer -> other.dispatch(inner -> context.depth()));

        assertThat(depth).isEqualTo(2);
        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void testContext_IsConfinedToFirstThread() throws Exception {
        cell.dispatch(hold -> null);

        CompletableFuture<Object> elsewhere = CompletableFuture.supplyAsync(() -> cell.dispatch(hold -> null));

        assertThatThrownBy(elsewhere::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(cell.isFree()).isTrue();
    }
}
