package io.github.vevoly.rewards.core.processor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 由引擎在处理每个命令前固定时刻的时钟，使回执时间与业务时间一致。
 * <br><span style="color: gray;">Clock pinned by the engine before each command so receipt time and accounting time agree.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
final class PinnedClock extends Clock {

    private volatile Instant instant = Instant.EPOCH;

    void pin(long epochSecond) {
        this.instant = Instant.ofEpochSecond(epochSecond);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
