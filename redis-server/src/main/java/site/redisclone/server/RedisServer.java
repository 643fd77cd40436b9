package site.redisclone.server;

import site.redisclone.protocol.Resp;
import site.redisclone.protocol.RespArray;

/**
 * Redis服务器核心接口，定义服务器的生命周期。
 *
 * <p>实现需要保证：
 * <ul>
 *   <li>所有客户端命令都在同一个事件循环线程中执行
 *   <li>停止时释放所有套接字和缓冲区
 * </ul>
 *
 * @since 1.0
 */
public interface RedisServer {

    /**
     * 绑定端口并在后台线程启动事件循环。
     *
     * @throws IllegalStateException 如果服务器已经在运行
     * @throws java.io.UncheckedIOException 如果端口绑定失败
     */
    void start();

    /**
     * 停止事件循环并关闭所有连接，等待循环线程退出。
     */
    void stop();

    /**
     * 实际监听的端口
     *
     * @return 端口号
     */
    int getPort();

    /**
     * 在调用线程中直接执行一条命令，不经过网络。
     *
     * <p>仅在事件循环未运行时使用，否则会与循环线程并发访问存储。
     *
     * @param command 命令数组
     * @return 回复
     */
    Resp executeCommand(RespArray command);
}
