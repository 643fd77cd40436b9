package site.redisclone.server.reactor;

import lombok.Getter;
import lombok.Setter;

/**
 * 定时事件：下次执行时间（毫秒时间戳）加回调
 */
@Getter
public class TimeEvent {

    private final long id;

    @Setter
    private long processAt;

    private final TimeEventHandler handler;

    public TimeEvent(long id, long processAt, TimeEventHandler handler) {
        this.id = id;
        this.processAt = processAt;
        this.handler = handler;
    }

    @Override
    public String toString() {
        return "TimeEvent{id=" + id + ", processAt=" + processAt + '}';
    }
}
