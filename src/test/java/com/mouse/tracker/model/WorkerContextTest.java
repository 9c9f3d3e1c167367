package com.mouse.tracker.model;

import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.enums.HookLayer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerContextTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final WorkerContext ctx = new WorkerContext("sbx_1", "s1", "t1", "https://shop.example/item/1", 0, NOW, null);

    @Test
    void readyLayerSnapshotIsDetachedAndReadOnly() {
        ctx.markLayerReady(HookLayer.PAGE, Set.of(HookLayer.PAGE, HookLayer.NETWORK));
        Set<HookLayer> snapshot = ctx.readyLayerSnapshot();

        assertThat(ctx.markLayerReady(HookLayer.NETWORK, Set.of(HookLayer.PAGE, HookLayer.NETWORK))).isTrue();

        assertThat(snapshot).containsExactly(HookLayer.PAGE);
        assertThatThrownBy(() -> snapshot.add(HookLayer.NETWORK)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(ctx.readyLayerSnapshot()).containsExactlyInAnyOrder(HookLayer.PAGE, HookLayer.NETWORK);
    }

    @Test
    void exchangeSnapshotDoesNotTrackLaterCaptures() {
        ctx.recordExchange(CapturedExchange.builder().id("ex-1").url("https://shop.example/api").source(HookLayer.PAGE).build());
        List<CapturedExchange> snapshot = ctx.exchangeSnapshot();

        ctx.recordExchange(CapturedExchange.builder().id("ex-2").url("https://shop.example/api").source(HookLayer.PAGE).build());

        assertThat(snapshot).hasSize(1);
        assertThat(ctx.getExchangeCount()).isEqualTo(2);
    }

    @Test
    void teardownIsClaimedOnce() {
        assertThat(ctx.beginTeardown()).isTrue();
        assertThat(ctx.beginTeardown()).isFalse();
        assertThat(ctx.isTornDown()).isTrue();
    }
}
