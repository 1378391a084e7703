package site.respkv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.Errors;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 连接数上限控制。超出上限的连接收到一条错误回复后被关闭，其输入被丢弃。
 *
 * <p>每个连接一个实例，计数器在同一服务器的所有实例间共享。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class ConnectionLimitHandler extends ChannelInboundHandlerAdapter {

    private static final Errors MAX_CLIENTS_ERROR = new Errors("ERR max number of clients reached");

    private final AtomicInteger activeConnections;

    private final int maxConnections;

    private boolean rejected;

    /**
     * @param activeConnections 共享的活跃连接计数
     * @param maxConnections 上限，0表示不限制
     */
    public ConnectionLimitHandler(final AtomicInteger activeConnections, final int maxConnections) {
        this.activeConnections = activeConnections;
        this.maxConnections = maxConnections;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        final int current = activeConnections.incrementAndGet();
        if (maxConnections > 0 && current > maxConnections) {
            rejected = true;
            log.warn("连接数已达上限 {}，拒绝来自 {} 的连接", maxConnections, ctx.channel().remoteAddress());
            ctx.channel().config().setAutoRead(false);
            ctx.writeAndFlush(MAX_CLIENTS_ERROR).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
        if (rejected) {
            ReferenceCountUtil.release(msg);
            return;
        }
        super.channelRead(ctx, msg);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        activeConnections.decrementAndGet();
        if (rejected) {
            return;
        }
        super.channelInactive(ctx);
    }
}
