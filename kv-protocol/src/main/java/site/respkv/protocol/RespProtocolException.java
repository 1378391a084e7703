package site.respkv.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * 请求流违反RESP语法或超出协议限制时抛出。
 *
 * <p>属于帧错误：处理器会尝试把消息作为错误回复写回，然后关闭连接。
 *
 * @author respkv
 * @since 1.0.0
 */
public class RespProtocolException extends CorruptedFrameException {

    private static final long serialVersionUID = 1L;

    public RespProtocolException(final String message) {
        super("Protocol error: " + message);
    }
}
