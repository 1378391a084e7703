package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误回复。
 *
 * <p>格式："-ERR message\r\n"。命令错误（参数个数不符、未知命令）以本类回复后连接保持打开；
 * 协议错误回复后连接随即关闭。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {

    private final String content;

    public Errors(final String content) {
        if (content == null) {
            throw new IllegalArgumentException("错误内容不能为null");
        }
        // 错误行内不允许换行，替换为空格以保证帧完整
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * 未知命令错误，命令名按收到的原样回显。
     *
     * @param commandName 客户端发送的命令名
     * @return 错误回复
     */
    public static Errors unknownCommand(final String commandName) {
        return new Errors("ERR unknown command '" + commandName + "'");
    }

    /**
     * 参数个数错误。
     *
     * @param commandName 命令名（小写）
     * @return 错误回复
     */
    public static Errors wrongArity(final String commandName) {
        return new Errors("ERR wrong number of arguments for '" + commandName + "' command");
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        final byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        byteBuf.ensureWritable(bytes.length + 3);
        byteBuf.writeByte('-');
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
