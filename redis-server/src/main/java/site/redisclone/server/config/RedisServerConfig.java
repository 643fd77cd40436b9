package site.redisclone.server.config;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Redis服务器配置类
 *
 * <p>采用Builder模式创建，所有参数都有合理的默认值。主要配置包括：
 * <ul>
 *   <li>网络配置：监听地址、端口、连接队列、单次读取大小
 *   <li>定时任务配置：serverCron的执行频率
 *   <li>过期配置：每个周期主动检查的过期键数量
 *   <li>日志配置：是否输出调试日志
 * </ul>
 *
 * <p>进程启动时通过 {@link #fromEnvironment(Map)} 从环境变量读取配置。
 *
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    /** 环境变量：非空时开启调试日志 */
    public static final String ENV_DEBUG = "DEBUG";

    /** 环境变量：监听端口 */
    public static final String ENV_PORT = "REDIS_PORT";

    // ========== 网络配置 ==========

    /** 服务器监听地址 */
    @Builder.Default
    private String host = "0.0.0.0";

    /** 服务器监听端口，0表示由系统分配 */
    @Builder.Default
    private int port = 2000;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 511;

    /** 每次可读事件最多读取的字节数 */
    @Builder.Default
    private int readBufferSize = 1024;

    // ========== 定时任务配置 ==========

    /** serverCron每秒执行的次数 */
    @Builder.Default
    private int hz = 10;

    /** 每个周期主动检查的过期索引项数量 */
    @Builder.Default
    private int activeExpireLookups = 20;

    // ========== 日志配置 ==========

    @Builder.Default
    private boolean debug = false;

    // ========== 工厂方法 ==========

    public static RedisServerConfig defaultConfig() {
        return RedisServerConfig.builder().build();
    }

    /**
     * 从环境变量创建配置
     *
     * @param env 环境变量
     * @return 配置
     * @throws IllegalArgumentException 如果端口不是数字
     */
    public static RedisServerConfig fromEnvironment(Map<String, String> env) {
        final RedisServerConfigBuilder builder = RedisServerConfig.builder();

        final String debugValue = env.get(ENV_DEBUG);
        builder.debug(debugValue != null && !debugValue.isEmpty());

        final String portValue = env.get(ENV_PORT);
        if (portValue != null && !portValue.trim().isEmpty()) {
            try {
                builder.port(Integer.parseInt(portValue.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("端口号必须是数字: " + portValue, e);
            }
        }
        return builder.build();
    }

    /**
     * serverCron的执行间隔
     *
     * @return 毫秒数
     */
    public long cronIntervalMillis() {
        return 1000 / hz;
    }

    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (backlogSize <= 0 || readBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (hz <= 0 || hz > 1000) {
            throw new IllegalArgumentException("hz必须在1-1000范围内");
        }

        if (activeExpireLookups <= 0) {
            throw new IllegalArgumentException("每周期过期检查数量必须大于0");
        }
    }
}
