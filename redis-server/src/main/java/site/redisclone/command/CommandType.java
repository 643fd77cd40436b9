package site.redisclone.command;

import lombok.Getter;
import site.redisclone.command.impl.key.Pttl;
import site.redisclone.command.impl.key.Ttl;
import site.redisclone.command.impl.server.CommandCommand;
import site.redisclone.command.impl.string.Get;
import site.redisclone.command.impl.string.Set;
import site.redisclone.protocol.BulkString;
import site.redisclone.protocol.Errors;
import site.redisclone.protocol.RespArray;
import site.redisclone.protocol.RespInteger;
import site.redisclone.server.context.RedisContext;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Redis命令类型枚举，定义了系统支持的所有Redis命令。
 *
 * <p>每个命令类型同时携带COMMAND命令所需的元数据：
 * <ul>
 *   <li>arity - 参数个数（包含命令名），负数表示"至少"
 *   <li>flags - 命令标志位
 *   <li>firstKey/lastKey/step - 键在参数中的位置
 *   <li>aclCategories - ACL分类
 * </ul>
 *
 * <p>命令名匹配不区分大小写，查找表在类加载时构建一次。
 *
 * @since 1.0
 */
@Getter
public enum CommandType {
    /** COMMAND命令：返回命令元数据 */
    COMMAND("command", -1, new String[]{"random", "loading", "stale"}, 0, 0, 0,
            new String[]{"@slow", "@connection"}, CommandCommand::new),
    /** GET命令：获取键值 */
    GET("get", 2, new String[]{"readonly", "fast"}, 1, 1, 1,
            new String[]{"@read", "@string", "@fast"}, Get::new),
    /** SET命令：设置键值对 */
    SET("set", -3, new String[]{"write", "denyoom"}, 1, 1, 1,
            new String[]{"@write", "@string", "@slow"}, Set::new),
    /** TTL命令：获取键的剩余生存时间（秒） */
    TTL("ttl", 2, new String[]{"readonly", "random", "fast"}, 1, 1, 1,
            new String[]{"@keyspace", "@read", "@fast"}, Ttl::new),
    /** PTTL命令：获取键的剩余生存时间（毫秒） */
    PTTL("pttl", 2, new String[]{"readonly", "random", "fast"}, 1, 1, 1,
            new String[]{"@keyspace", "@read", "@fast"}, Pttl::new);

    /** 小写命令名到命令类型的映射 */
    private static final Map<String, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandName, type);
        }
    }

    private final String commandName;

    private final int arity;

    private final String[] flags;

    private final int firstKey;

    private final int lastKey;

    private final int step;

    private final String[] aclCategories;

    @Getter(lombok.AccessLevel.NONE)
    private final Function<RedisContext, Command> factory;

    CommandType(final String commandName, final int arity, final String[] flags,
                final int firstKey, final int lastKey, final int step,
                final String[] aclCategories, final Function<RedisContext, Command> factory) {
        this.commandName = commandName;
        this.arity = arity;
        this.flags = flags;
        this.firstKey = firstKey;
        this.lastKey = lastKey;
        this.step = step;
        this.aclCategories = aclCategories;
        this.factory = factory;
    }

    /**
     * 根据命令名查找命令类型，不区分大小写。
     *
     * @param commandName 命令名称字符串
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByName(final String commandName) {
        if (commandName == null || commandName.isEmpty()) {
            return null;
        }
        return COMMAND_CACHE.get(commandName.toLowerCase(Locale.ROOT));
    }

    /**
     * 使用Redis上下文创建命令实例。
     *
     * @param context Redis上下文
     * @return 新的命令实例
     */
    public Command createCommand(final RedisContext context) {
        return factory.apply(context);
    }

    /**
     * 参数个数错误的回复
     *
     * @return 错误回复
     */
    public Errors wrongNumberOfArguments() {
        return new Errors("ERR wrong number of arguments for '" + commandName.toUpperCase(Locale.ROOT) + "' command");
    }

    /**
     * COMMAND命令中该命令的元数据
     *
     * @return [名称, 参数个数, 标志位, 第一个键, 最后一个键, 步长, ACL分类]
     */
    public RespArray describe() {
        return RespArray.valueOf(
                BulkString.fromString(commandName),
                RespInteger.valueOf(arity),
                RespArray.ofSimpleStrings(flags),
                RespInteger.valueOf(firstKey),
                RespInteger.valueOf(lastKey),
                RespInteger.valueOf(step),
                RespArray.ofSimpleStrings(aclCategories));
    }
}
