package site.respkv.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变的二进制安全字节串，作为存储的键与值、以及协议层批量字符串的载体。
 *
 * <p>特点：
 * <ul>
 *   <li>{@link #wrapTrusted(byte[])} 直接持有数组，不做拷贝，只用于解码器等可信路径
 *   <li>预计算哈希值，适合作为 {@code ConcurrentHashMap} 的键
 *   <li>字符串表示延迟初始化并缓存
 * </ul>
 *
 * <p>线程安全性：实例不可变，可在多个连接之间自由共享。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class KvBytes {

    /** 字符串编解码使用的字符集 */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /** 预分配的空字节串 */
    public static final KvBytes EMPTY = new KvBytes(new byte[0]);

    private final byte[] bytes;

    private final int hashCode;

    /** 延迟初始化的字符串值 */
    private volatile String stringValue;

    private KvBytes(final byte[] bytes) {
        this.bytes = bytes;
        this.hashCode = Arrays.hashCode(bytes);
    }

    /**
     * 零拷贝工厂方法。
     *
     * <p><b>警告</b>：调用者必须保证数组在实例生命周期内不再被修改。
     *
     * @param trustedBytes 受信任的字节数组
     * @return KvBytes实例，输入为null时返回null
     */
    public static KvBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        return new KvBytes(trustedBytes);
    }

    /**
     * 以UTF-8编码创建字节串。
     *
     * @param str 源字符串
     * @return KvBytes实例，输入为null时返回null
     */
    public static KvBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final KvBytes kvBytes = new KvBytes(str.getBytes(CHARSET));
        kvBytes.stringValue = str;
        return kvBytes;
    }

    /**
     * 获取底层字节数组的直接引用，仅用于只读场景（编码、网络写出）。
     *
     * @return 底层数组，调用者不得修改
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取字符串表示（UTF-8解码）。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            // 并发下可能重复解码，结果相同，无需加锁
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 返回ASCII小写形式的新字节串，非字母字节保持不变。
     *
     * @return 小写字节串，本身已是小写时返回自身
     */
    public KvBytes toLowerCase() {
        byte[] lowered = null;
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            final byte l = toLowerAscii(b);
            if (l != b) {
                if (lowered == null) {
                    lowered = bytes.clone();
                }
                lowered[i] = l;
            }
        }
        return lowered == null ? this : new KvBytes(lowered);
    }

    private static byte toLowerAscii(final byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final KvBytes other = (KvBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("KvBytes[length=").append(bytes.length);
        if (bytes.length <= 32) {
            sb.append(", preview='");
            for (int i = 0; i < Math.min(bytes.length, 16); i++) {
                final byte b = bytes[i];
                if (b >= 32 && b <= 126) {
                    sb.append((char) b);
                } else {
                    sb.append("\\x").append(String.format("%02x", b & 0xFF));
                }
            }
            if (bytes.length > 16) {
                sb.append("...");
            }
            sb.append("'");
        } else {
            sb.append(", type=binary");
        }
        sb.append("]");
        return sb.toString();
    }
}
