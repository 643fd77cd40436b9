package site.redisclone.server.reactor;

/**
 * 定时事件的回调
 */
@FunctionalInterface
public interface TimeEventHandler {

    /** 返回该值表示事件不再执行 */
    long NOMORE = -1;

    /**
     * 执行一次定时事件
     *
     * @return 距离下次执行的毫秒数，或 {@link #NOMORE}
     */
    long onTimeEvent();
}
