package site.respkv.protocol.handler;

import io.netty.channel.DefaultMessageSizeEstimator;
import io.netty.channel.MessageSizeEstimator;
import site.respkv.protocol.Resp;

/**
 * 按编码后的大小估算 {@link Resp} 回复占用的写缓冲。
 *
 * <p>Netty默认的估算器只识别ByteBuf，未编码的回复对象一律按8字节计，
 * 从非I/O线程提交的大回复因此不会及时改变通道的可写状态。其他类型的消息交给默认估算器处理。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RespMessageSizeEstimator implements MessageSizeEstimator {

    public static final RespMessageSizeEstimator INSTANCE = new RespMessageSizeEstimator();

    private static final Handle HANDLE = new Handle() {
        private final Handle fallback = DefaultMessageSizeEstimator.DEFAULT.newHandle();

        @Override
        public int size(final Object msg) {
            if (msg instanceof Resp) {
                return RespEncoder.estimateMessageSize((Resp) msg);
            }
            return fallback.size(msg);
        }
    };

    private RespMessageSizeEstimator() {
    }

    @Override
    public Handle newHandle() {
        return HANDLE;
    }
}
