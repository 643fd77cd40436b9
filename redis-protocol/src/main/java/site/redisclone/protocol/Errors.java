package site.redisclone.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis错误消息类型
 *
 * <p>用于向客户端传递命令错误和协议错误，连接是否关闭由调用方决定。
 *
 * <p>错误格式：
 * <ul>
 *     <li>语法："-Error message\r\n"</li>
 *     <li>示例："-ERR syntax error"</li>
 *     <li>示例："-ERR Protocol error: invalid bulk length"</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(String content) {
        this.content = content;
    }

    @Override
    public void encode(Resp resp, ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(((Errors) resp).getContent().getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
