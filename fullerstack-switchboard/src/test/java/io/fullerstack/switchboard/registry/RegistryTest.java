package io.fullerstack.switchboard.registry;

import io.fullerstack.switchboard.error.DuplicateChannelNameException;
import io.fullerstack.switchboard.error.DuplicateDeclarationException;
import io.fullerstack.switchboard.error.NoActiveFrameException;
import io.fullerstack.switchboard.error.RecursionDetectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Registry}.
 */
class RegistryTest {

    private static final HandlerIdentity X = HandlerIdentity.of("X");
    private static final HandlerIdentity Y = HandlerIdentity.of("Y");

    private Registry registry;

    @BeforeEach
    void setUp() {
        registry = new Registry();
        registry.declareChannel("a", ChannelKind.CHANNEL);
        registry.declareChannel("b", ChannelKind.CHANNEL);
        registry.declareChannel("c", ChannelKind.SLOT);
    }

    private void subscribe(HandlerIdentity identity, String listen, String emit) {
        ConstructionFrame frame = registry.beginSubscription(identity);
        registry.recordListen(frame, listen);
        registry.recordEmit(frame, emit);
        registry.endSubscription(frame);
    }

    // ========== Declaration ==========

    @Test
    void testDeclareChannel_RecordsKindAndSortsNames() {
        assertThat(registry.channels()).containsExactly("a", "b", "c");
        assertThat(registry.kind("c")).isEqualTo(ChannelKind.SLOT);
        assertThat(registry.record("a")).hasValueSatisfying(record -> {
            assertThat(record.kind()).isEqualTo(ChannelKind.CHANNEL);
            assertThat(record.listeners()).isEmpty();
        });
    }

    @Test
    void testDeclareChannel_RejectsDuplicateName() {
        assertThatThrownBy(() -> registry.declareChannel("a", ChannelKind.SINGLE))
            .isInstanceOf(DuplicateChannelNameException.class)
            .hasMessage("name is already registered to this registry: \"a\"");
    }

    // ========== Frames ==========

    @Test
    void testRecord_OutsideFrameFails() {
        assertThatThrownBy(() -> registry.recordListen("a"))
            .isInstanceOf(NoActiveFrameException.class);
    }

    @Test
    void testRecord_OnOuterFrameWhileInnerIsOpenFails() {
        ConstructionFrame outer = registry.beginSubscription(X);
        registry.beginSubscription(Y);

        assertThatThrownBy(() -> registry.recordEmit(outer, "a"))
            .isInstanceOf(NoActiveFrameException.class);
    }

    @Test
    void testRecord_WithoutFrameArgumentTargetsInnermost() {
        ConstructionFrame outer = registry.beginSubscription(X);
        ConstructionFrame inner = registry.beginSubscription(Y);

        registry.recordListen("a");
        registry.endSubscription(inner);
        registry.recordEmit("b");

        assertThat(inner.listens()).containsExactly("a");
        assertThat(outer.emits()).containsExactly("b");
        assertThat(outer.listens()).isEmpty();
    }

    @Test
    void testRecord_RepeatedDeclarationFails() {
        ConstructionFrame frame = registry.beginSubscription(X);
        registry.recordListen(frame, "a");

        assertThatThrownBy(() -> registry.recordListen(frame, "a"))
            .isInstanceOf(DuplicateDeclarationException.class)
            .satisfies(e -> assertThat(((DuplicateDeclarationException) e).getDirection())
                .isEqualTo(DuplicateDeclarationException.Direction.LISTEN));
    }

    @Test
    void testRecord_UndeclaredChannelFails() {
        ConstructionFrame frame = registry.beginSubscription(X);

        assertThatThrownBy(() -> registry.recordEmit(frame, "nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void testEndSubscription_ClosesFrame() {
        ConstructionFrame frame = registry.beginSubscription(X);
        registry.endSubscription(frame);

        assertThat(frame.isOpen()).isFalse();
        assertThat(registry.hasOpenFrame()).isFalse();
        assertThatThrownBy(() -> registry.recordListen(frame, "a"))
            .isInstanceOf(NoActiveFrameException.class);
    }

    @Test
    void testAbandonSubscription_FoldsNothing() {
        ConstructionFrame frame = registry.beginSubscription(X);
        registry.recordListen(frame, "a");
        registry.recordEmit(frame, "b");

        registry.abandonSubscription(frame);

        assertThat(registry.edges()).isEmpty();
        assertThat(registry.hasOpenFrame()).isFalse();
    }

    // ========== Folding ==========

    @Test
    void testEndSubscription_FoldsCrossProduct() {
        ConstructionFrame frame = registry.beginSubscription(X);
        registry.recordListen(frame, "a");
        registry.recordListen(frame, "b");
        registry.recordEmit(frame, "c");
        registry.endSubscription(frame);

        assertThat(registry.edges()).containsExactly(new Edge("a", "c"), new Edge("b", "c"));
        assertThat(registry.reaches("a", "c")).isTrue();
        assertThat(registry.record("c").orElseThrow().emitters()).containsExactly(X);
        assertThat(registry.isAcyclic()).isTrue();
    }

    @Test
    void testEndSubscription_RejectsCycleWithoutSideEffects() {
        // Given
        subscribe(X, "a", "b");

        // When
        assertThatThrownBy(() -> subscribe(Y, "b", "a"))
            .isInstanceOf(RecursionDetectedException.class)
            .hasMessage("found a recursion during subscription of Y: [X]a -> [Y]b -> a")
            .satisfies(e -> {
                RecursionDetectedException error = (RecursionDetectedException) e;
                assertThat(error.subscriber()).isEqualTo(Y);
                assertThat(error.chain()).containsExactly("a", "b");
                assertThat(error.closedChain()).containsExactly("a", "b", "a");
            });

        // Then
        assertThat(registry.edges()).containsExactly(new Edge("a", "b"));
        assertThat(registry.record("b").orElseThrow().listeners()).isEmpty();
        assertThat(registry.hasOpenFrame()).isFalse();
        assertThat(registry.isAcyclic()).isTrue();
    }

    @Test
    void testPerKindPolicy_CollapsesRepeatedKind() {
        Registry perKind = new Registry(SubscriptionPolicy.PER_KIND);
        perKind.declareChannel("a", ChannelKind.CHANNEL);
        perKind.declareChannel("b", ChannelKind.CHANNEL);

        ConstructionFrame first = perKind.beginSubscription(X);
        perKind.recordListen(first, "a");
        perKind.endSubscription(first);

        // Same kind wired differently: collapsed into the first contribution
        ConstructionFrame second = perKind.beginSubscription(X);
        perKind.recordListen(second, "b");
        perKind.recordEmit(second, "a");
        perKind.endSubscription(second);

        assertThat(perKind.policy()).isEqualTo(SubscriptionPolicy.PER_KIND);
        assertThat(perKind.edges()).isEmpty();
        assertThat(perKind.hasOpenFrame()).isFalse();
    }

    @Test
    void testPerInstancePolicy_FoldsEverySubscription() {
        ConstructionFrame first = registry.beginSubscription(X);
        registry.recordListen(first, "a");
        registry.endSubscription(first);

        ConstructionFrame second = registry.beginSubscription(X);
        registry.recordListen(second, "b");
        registry.recordEmit(second, "a");
        registry.endSubscription(second);

        assertThat(registry.policy()).isEqualTo(SubscriptionPolicy.PER_INSTANCE);
        assertThat(registry.edges()).containsExactly(new Edge("b", "a"));
    }
}
