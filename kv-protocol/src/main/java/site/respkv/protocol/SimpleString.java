package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 状态回复（简单字符串），非二进制安全，内容不得包含CR/LF。
 *
 * <p>常用的状态回复预先分配，优先通过 {@link #valueOf(String)} 获取。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {

    /** 成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    private final String content;

    /** 内容的字节表示，构造时一次性编码 */
    private final byte[] contentBytes;

    /**
     * @param content 状态文本
     * @throws IllegalArgumentException 如果内容为null或包含换行
     */
    public SimpleString(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("状态回复内容不能为null");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("状态回复不能包含CR或LF: " + content);
        }
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.ensureWritable(contentBytes.length + 3);
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
