package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * RESP 回复值的基类。
 *
 * <p>每个子类对应一种回复形态，并负责把自身写成线上格式：
 * <ul>
 *     <li>状态 - "+OK\r\n"，见 {@link SimpleString}</li>
 *     <li>错误 - "-ERR message\r\n"，见 {@link Errors}</li>
 *     <li>批量字符串 - "$6\r\nfoobar\r\n"，空值为 "$-1\r\n"，见 {@link BulkString}</li>
 *     <li>数组 - "*2\r\n" 后跟逐个编码的元素，见 {@link RespArray}</li>
 * </ul>
 *
 * <p>编码是全函数：任何构造合法的实例都有且只有一种编码，且不会失败。
 *
 * @author respkv
 * @since 1.0.0
 */
public abstract class Resp {

    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[256][];

    static {
        for (int i = 0; i < NUMBERS.length; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入整数的十进制ASCII表示，小整数走缓存。
     *
     * @param buf 目标缓冲区
     * @param value 要写入的整数值
     */
    protected static void writeIntegerAsBytes(final ByteBuf buf, final int value) {
        if (value >= 0 && value < NUMBERS.length) {
            buf.writeBytes(NUMBERS[value]);
        } else {
            buf.writeBytes(String.valueOf(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 将当前值编码到缓冲区。
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);
}
