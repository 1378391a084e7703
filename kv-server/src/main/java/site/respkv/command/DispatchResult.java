package site.respkv.command;

import lombok.Getter;
import site.respkv.protocol.Resp;

/**
 * 一次分发的结果：要写回的回复，以及写完后是否关闭连接。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public final class DispatchResult {

    private final Resp reply;

    private final boolean closeConnection;

    private DispatchResult(final Resp reply, final boolean closeConnection) {
        this.reply = reply;
        this.closeConnection = closeConnection;
    }

    public static DispatchResult reply(final Resp reply) {
        return new DispatchResult(reply, false);
    }

    public static DispatchResult replyThenClose(final Resp reply) {
        return new DispatchResult(reply, true);
    }
}
