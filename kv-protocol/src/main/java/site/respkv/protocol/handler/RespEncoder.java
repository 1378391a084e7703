package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

/**
 * 回复编码器：把 {@link Resp} 写成线上格式。
 *
 * <p>编码器无状态，可以在多个连接间共享。编码前按回复类型预估大小，减少ByteBuf扩容。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<Resp> {

    public RespEncoder() {
        super(Resp.class);
    }

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        out.ensureWritable(estimateMessageSize(msg));
        msg.encode(out);
        if (log.isDebugEnabled()) {
            log.debug("编码回复: {} ({} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
        }
    }

    /**
     * 估算回复编码后的字节数。
     *
     * @param msg 回复
     * @return 估算大小
     */
    static int estimateMessageSize(final Resp msg) {
        if (msg instanceof BulkString) {
            final BulkString bulkString = (BulkString) msg;
            return bulkString.isNull() ? 5 : bulkString.getContent().length() + 16;
        }
        if (msg instanceof RespArray) {
            int totalSize = 16;
            for (final Resp element : ((RespArray) msg).getContent()) {
                totalSize += estimateMessageSize(element);
            }
            return totalSize;
        }
        return 64;
    }
}
