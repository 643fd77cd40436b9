package site.redisclone.protocol;

/**
 * 协议错误
 *
 * <p>长度字段非法或帧标记错误时由解码器抛出。协议错误对连接是致命的：
 * 服务端回复错误帧后关闭连接。数据不完整不属于协议错误。
 *
 * @since 1.0.0
 */
public class ProtocolException extends RuntimeException {

    private static final String PREFIX = "ERR Protocol error: ";

    public ProtocolException(String detail) {
        super(PREFIX + detail);
    }

    /**
     * 转换为发送给客户端的错误回复
     *
     * @return 错误回复，内容为完整的错误消息
     */
    public Errors toResp() {
        return new Errors(getMessage());
    }
}
