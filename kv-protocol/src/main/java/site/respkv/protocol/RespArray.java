package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 数组。既用于请求（批量字符串数组，首元素为命令名），也用于回复
 * （数组头 "*N\r\n" 后跟 N 个逐个编码的元素，元素可以是任意回复类型）。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {

    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空数组 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    private final Resp[] content;

    /**
     * @param content 数组元素，不能为null，元素也不能为null
     */
    public RespArray(final Resp[] content) {
        if (content == null) {
            throw new IllegalArgumentException("数组内容不能为null");
        }
        for (final Resp element : content) {
            if (element == null) {
                throw new IllegalArgumentException("数组元素不能为null");
            }
        }
        this.content = content;
    }

    public static RespArray valueOf(final Resp... content) {
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    public int size() {
        return content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }
        byteBuf.writeByte('*');
        writeIntegerAsBytes(byteBuf, content.length);
        byteBuf.writeBytes(CRLF);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    public String toString() {
        return Arrays.toString(content);
    }
}
