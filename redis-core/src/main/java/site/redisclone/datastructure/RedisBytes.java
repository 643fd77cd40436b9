package site.redisclone.datastructure;

import java.util.Arrays;

/**
 * 不可变字节数组封装，用作存储中的键和值。
 *
 * <p>客户端发送的键和值是任意字节，不保证是合法的UTF-8，因此存储层只比较字节内容。
 * equals/hashCode基于字节内容，哈希值在构造时预先计算。
 *
 * @since 1.0
 */
public final class RedisBytes {

    /**
     * 存储的字节数组（不可变）。
     */
    private final byte[] bytes;

    /**
     * 预计算的哈希值。
     */
    private final int hashCode;

    private RedisBytes(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = bytes;
        this.hashCode = Arrays.hashCode(bytes);
    }

    /**
     * 创建零拷贝实例。
     *
     * <p><b>警告</b>：调用者必须保证参数数组在实例生命周期内不被修改！
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new RedisBytes(trustedBytes);
    }

    /**
     * 获取底层字节数组的直接引用。
     *
     * <p><strong>警告：</strong>调用者不得修改返回的数组！
     *
     * @return 字节数组的直接引用
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 可打印ASCII原样输出，其他字节输出为\xNN
     */
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(bytes.length);
        for (final byte b : bytes) {
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        return sb.toString();
    }
}
