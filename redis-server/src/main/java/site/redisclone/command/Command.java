package site.redisclone.command;

import site.redisclone.protocol.Resp;

/**
 * Redis命令接口，定义了所有Redis命令的基本行为。
 *
 * <p>命令实例由 {@link CommandType#createCommand} 针对每个请求创建，生命周期只有一次执行：
 * <ul>
 *   <li>{@link #setContext(Resp[])} 注入请求参数
 *   <li>{@link #handle()} 校验参数、读写存储并返回回复
 * </ul>
 *
 * <p>实现要求：
 * <ul>
 *   <li>参数个数错误、选项错误等命令错误以 {@link site.redisclone.protocol.Errors} 回复返回，不抛出异常
 *   <li>访问键之前先做惰性过期检查
 *   <li>只在事件循环线程中执行，不需要加锁
 * </ul>
 *
 * @since 1.0
 */
public interface Command {

    /**
     * 获取命令类型。
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 设置命令执行的上下文。
     *
     * @param array 完整的请求数组，第0个元素为命令名
     */
    void setContext(Resp[] array);

    /**
     * 执行命令并返回结果。
     *
     * @return RESP协议格式的执行结果
     */
    Resp handle();
}
