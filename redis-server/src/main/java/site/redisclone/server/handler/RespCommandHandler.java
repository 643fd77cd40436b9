package site.redisclone.server.handler;

import lombok.extern.slf4j.Slf4j;
import site.redisclone.command.Command;
import site.redisclone.command.CommandType;
import site.redisclone.protocol.Errors;
import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;
import site.redisclone.server.context.RedisContext;

/**
 * Redis命令处理器，负责把解码后的请求分发给对应的命令。
 *
 * <p>处理流程：
 * <ul>
 *   <li>按小写命令名查找命令类型
 *   <li>创建命令实例并注入参数
 *   <li>执行命令并返回回复
 * </ul>
 *
 * <p>所有命令错误都在这里转换为 {@link Errors} 回复，不会传播到事件循环，连接保持可用。
 *
 * @since 1.0
 */
@Slf4j
public class RespCommandHandler {

    /** 空命令错误响应 */
    private static final Errors EMPTY_COMMAND_ERROR = new Errors("ERR empty command");

    /** 未知命令回复中最多回显的参数个数 */
    private static final int MAX_ECHOED_ARGS = 10;

    /** Redis服务器上下文 */
    private final RedisContext redisContext;

    public RespCommandHandler(final RedisContext redisContext) {
        if (redisContext == null) {
            throw new IllegalArgumentException("Redis上下文不能为null");
        }
        this.redisContext = redisContext;
    }

    /**
     * 处理一条Redis命令。
     *
     * @param respArray 命令数组，第0个元素为命令名
     * @return 命令执行结果，永远不为null
     */
    public Resp processCommand(final RespArray respArray) {
        final Resp[] array = respArray.getContent();
        if (array == null || array.length == 0) {
            return EMPTY_COMMAND_ERROR;
        }
        log.debug("Received command: {}", respArray);

        final String commandName = array[0].toString();
        final CommandType commandType = CommandType.findByName(commandName);
        if (commandType == null) {
            return unknownCommand(commandName, array);
        }

        try {
            final Command command = commandType.createCommand(redisContext);
            command.setContext(array);
            return command.handle();
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", commandType, e);
            return new Errors("ERR " + e.getMessage());
        }
    }

    /**
     * 未知命令的错误回复，回显命令名和前几个参数
     *
     * @param commandName 客户端发送的命令名
     * @param array 完整的请求数组
     * @return 错误回复
     */
    private static Errors unknownCommand(final String commandName, final Resp[] array) {
        final StringBuilder sb = new StringBuilder("ERR unknown command `")
                .append(commandName)
                .append("`, with args beginning with:");
        final int end = Math.min(array.length, MAX_ECHOED_ARGS + 1);
        for (int i = 1; i < end; i++) {
            sb.append(" `").append(array[i]).append("`,");
        }
        return new Errors(sb.toString());
    }
}
