package site.redisclone.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis简单字符串类型
 *
 * <p>用于状态回复（如"OK"）以及COMMAND命令中的标志位、ACL分类等元数据。
 * 内容不能包含换行符。
 *
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 字符串内容 */
    private final String content;

    /** 字符串的字节表示 */
    private final byte[] contentBytes;

    public SimpleString(final String content) {
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 工厂方法：对于"OK"返回缓存实例，其余创建新实例
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        }
        return new SimpleString(content);
    }

    @Override
    public void encode(Resp resp, ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(((SimpleString) resp).contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
