package site.respkv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.respkv.command.CommandDispatcher;
import site.respkv.command.DispatchResult;
import site.respkv.protocol.Errors;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespProtocolException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Queue;

/**
 * 连接处理器，每个连接一个实例，负责“解码 - 分发 - 编码 - 写回”循环的分发与写回部分。
 *
 * <p>连接状态：
 * <ul>
 *   <li>打开 - 记录连接来源
 *   <li>等待命令 / 分发 / 回复 - 每个请求分发后立即写回，写失败即关闭连接
 *   <li>等待写出 - 写缓冲超过高水位时暂停读取，新到的请求排队，通道重新可写后按顺序继续处理
 *   <li>关闭中 - QUIT的回复写出后关闭；之后到达的请求一律丢弃
 *   <li>已关闭 - 记录连接关闭
 * </ul>
 *
 * <p>错误处理：
 * <ul>
 *   <li>协议错误 - 排队的请求处理完后写回错误回复，然后关闭
 *   <li>I/O错误 - 直接关闭
 *   <li>命令错误 - 由分发器转换为错误回复，连接保持打开
 * </ul>
 *
 * <p>处理器运行在命令执行器上，同一连接的事件始终由同一线程按顺序处理，因此回复顺序与请求顺序一致，
 * 字段也无需同步。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<RespArray> {

    /** 写失败时记录并关闭连接 */
    private static final ChannelFutureListener WRITE_FAILURE_LISTENER = future -> {
        if (!future.isSuccess()) {
            log.info("closed connection from {} during write: {}",
                    future.channel().remoteAddress(), future.cause().getMessage());
            future.channel().close();
        }
    };

    private final CommandDispatcher dispatcher;

    /** 通道不可写期间到达的请求 */
    private final Queue<RespArray> pending = new ArrayDeque<>();

    /** 排队请求处理完后要写回的协议错误 */
    private Errors deferredError;

    /** 进入关闭流程后不再处理请求 */
    private boolean closing;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分发器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.info("opened connection from {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final RespArray request) {
        if (closing || deferredError != null) {
            log.debug("连接 {} 正在关闭，丢弃请求", ctx.channel().remoteAddress());
            return;
        }
        if (!pending.isEmpty() || !ctx.channel().isWritable()) {
            pending.add(request);
            pauseReading(ctx);
            return;
        }
        process(ctx, request);
        if (!closing && !ctx.channel().isWritable()) {
            pauseReading(ctx);
        }
    }

    @Override
    public void channelWritabilityChanged(final ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable() && !closing) {
            drainPending(ctx);
        }
        super.channelWritabilityChanged(ctx);
    }

    /**
     * 在通道可写期间按顺序处理排队的请求，全部处理完后恢复读取。
     */
    private void drainPending(final ChannelHandlerContext ctx) {
        while (!closing && ctx.channel().isWritable() && !pending.isEmpty()) {
            process(ctx, pending.poll());
        }
        if (closing || !pending.isEmpty()) {
            return;
        }
        if (deferredError != null) {
            writeErrorAndClose(ctx, deferredError);
            deferredError = null;
            return;
        }
        if (ctx.channel().isWritable()) {
            log.debug("连接 {} 写缓冲已回落，恢复读取", ctx.channel().remoteAddress());
            ctx.channel().config().setAutoRead(true);
        }
    }

    private void process(final ChannelHandlerContext ctx, final RespArray request) {
        final DispatchResult result = dispatcher.dispatch(request);
        if (result.isCloseConnection()) {
            closing = true;
            pending.clear();
            ctx.channel().config().setAutoRead(false);
            ctx.writeAndFlush(result.getReply()).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        ctx.writeAndFlush(result.getReply()).addListener(WRITE_FAILURE_LISTENER);
    }

    private void pauseReading(final ChannelHandlerContext ctx) {
        if (ctx.channel().config().isAutoRead()) {
            log.debug("连接 {} 写缓冲超过高水位，暂停读取", ctx.channel().remoteAddress());
            ctx.channel().config().setAutoRead(false);
        }
    }

    private void writeErrorAndClose(final ChannelHandlerContext ctx, final Errors error) {
        closing = true;
        if (ctx.channel().isActive()) {
            ctx.writeAndFlush(error).addListener(ChannelFutureListener.CLOSE);
        } else {
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (closing || deferredError != null) {
            closing = true;
            ctx.close();
            return;
        }

        if (cause instanceof RespProtocolException) {
            log.info("closed connection from {} during read: {}", ctx.channel().remoteAddress(), cause.getMessage());
            final Errors error = new Errors("ERR " + cause.getMessage());
            if (pending.isEmpty()) {
                writeErrorAndClose(ctx, error);
            } else {
                deferredError = error;
            }
            return;
        }
        closing = true;
        if (cause instanceof IOException) {
            log.info("closed connection from {} during read: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常: {}", cause.getMessage(), cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        pending.clear();
        deferredError = null;
        log.info("closed connection from {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }
}
