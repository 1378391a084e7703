package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.respkv.datastructure.KvBytes;

import java.nio.charset.StandardCharsets;

/**
 * 批量字符串，二进制安全。内容为null时表示空值回复 "$-1\r\n"。
 *
 * <p>解码器通过 {@link #wrapTrusted(byte[])} 零拷贝创建，空值统一使用 {@link #NULL}。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {

    /** 空值的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空值回复 */
    public static final BulkString NULL = new BulkString(null);

    /** 内容，为null表示空值 */
    private final KvBytes content;

    public BulkString(final KvBytes content) {
        this.content = content;
    }

    /**
     * 零拷贝模式：调用者必须保证数组不再被修改。
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(KvBytes.wrapTrusted(trustedBytes));
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        final byte[] bytes = content.getBytesUnsafe();
        final int length = bytes.length;
        if (length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }
        // '$' + 长度 + CRLF + 内容 + CRLF
        byteBuf.ensureWritable(1 + 10 + 2 + length + 2);
        byteBuf.writeByte('$');
        writeIntegerAsBytes(byteBuf, length);
        byteBuf.writeBytes(CRLF);
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * @return 内容的字符串形式，空值时返回null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
