package site.respkv.server.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelConfig;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import site.respkv.command.CommandDispatcher;
import site.respkv.core.KvStore;
import site.respkv.core.KvStoreImpl;
import site.respkv.datastructure.KvBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespProtocolException;
import site.respkv.protocol.SimpleString;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.protocol.handler.RespRequestDecoder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("连接处理器测试")
class RespCommandHandlerTest {

    @Mock
    private ChannelHandlerContext ctx;

    @Mock
    private Channel channel;

    private KvStore store;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        store = new KvStoreImpl();
        dispatcher = new CommandDispatcher(store);
        when(ctx.channel()).thenReturn(channel);
    }

    private EmbeddedChannel newChannel() {
        return new EmbeddedChannel(new RespEncoder(), new RespRequestDecoder(), new RespCommandHandler(dispatcher));
    }

    private static ByteBuf bytes(final String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.ISO_8859_1);
    }

    /** 读出所有已写出的字节 */
    private static String drainOutbound(final EmbeddedChannel channel) {
        final StringBuilder sb = new StringBuilder();
        ByteBuf buf;
        while ((buf = channel.readOutbound()) != null) {
            sb.append(buf.toString(StandardCharsets.ISO_8859_1));
            buf.release();
        }
        return sb.toString();
    }

    @Test
    @DisplayName("流水线请求按顺序回复")
    void testPipelinedReplies() {
        final EmbeddedChannel channel = newChannel();

        channel.writeInbound(bytes("*1\r\n$4\r\nPING\r\n"
                + "*3\r\n$3\r\nset\r\n$1\r\nk\r\n$1\r\nv\r\n"
                + "*2\r\n$3\r\nget\r\n$1\r\nk\r\n"
                + "*2\r\n$3\r\nget\r\n$4\r\nnone\r\n"));

        assertEquals("+PONG\r\n+OK\r\n$1\r\nv\r\n$-1\r\n", drainOutbound(channel));
        assertTrue(channel.isActive());
        channel.finish();
    }

    @Test
    @DisplayName("命令错误不关闭连接")
    void testCommandErrorKeepsConnection() {
        final EmbeddedChannel channel = newChannel();

        channel.writeInbound(bytes("*1\r\n$3\r\nget\r\n*1\r\n$3\r\nfoo\r\n*1\r\n$4\r\nping\r\n"));

        assertEquals("-ERR wrong number of arguments for 'get' command\r\n"
                + "-ERR unknown command 'foo'\r\n"
                + "+PONG\r\n", drainOutbound(channel));
        assertTrue(channel.isActive());
        channel.finish();
    }

    @Test
    @DisplayName("QUIT写出一次OK后关闭，之后的请求被丢弃")
    void testQuit() {
        final EmbeddedChannel channel = newChannel();

        channel.writeInbound(bytes("*1\r\n$4\r\nquit\r\n*3\r\n$3\r\nset\r\n$1\r\nk\r\n$1\r\nv\r\n"));

        assertEquals("+OK\r\n", drainOutbound(channel));
        assertFalse(channel.isActive());
        assertNull(store.get(KvBytes.fromString("k")));
    }

    @Test
    @DisplayName("协议错误写回错误后关闭")
    void testProtocolError() {
        final EmbeddedChannel channel = newChannel();

        channel.writeInbound(bytes("*1\r\n$4\r\nping\r\nGET k\r\n"));

        assertEquals("+PONG\r\n-ERR Protocol error: expected '*', got 'G'\r\n", drainOutbound(channel));
        assertFalse(channel.isActive());
    }

    @Test
    @DisplayName("超长批量字符串触发协议错误")
    void testOversizedBulk() {
        final EmbeddedChannel channel = newChannel();

        channel.writeInbound(bytes("*2\r\n$4\r\necho\r\n$999999999\r\n"));

        assertEquals("-ERR Protocol error: invalid bulk length\r\n", drainOutbound(channel));
        assertFalse(channel.isActive());
    }

    @Test
    @DisplayName("I/O错误直接关闭连接")
    void testIoErrorCloses() {
        final RespCommandHandler handler = new RespCommandHandler(dispatcher);

        handler.exceptionCaught(ctx, new IOException("Connection reset by peer"));

        verify(ctx).close();
        verify(ctx, never()).writeAndFlush(any());
    }

    @Test
    @DisplayName("通道不可写时暂停读取，请求排队并在可写后按顺序处理")
    void testQueueWhileUnwritable() throws Exception {
        final ChannelConfig config = mock(ChannelConfig.class);
        final ChannelFuture future = mock(ChannelFuture.class);
        when(channel.config()).thenReturn(config);
        when(config.isAutoRead()).thenReturn(true);
        when(ctx.writeAndFlush(any())).thenReturn(future);
        when(channel.isWritable()).thenReturn(false);

        final RespCommandHandler handler = new RespCommandHandler(dispatcher);
        handler.channelRead0(ctx, request("set", "k", "v"));
        handler.channelRead0(ctx, request("get", "k"));

        verify(config).setAutoRead(false);
        verify(ctx, never()).writeAndFlush(any());
        assertNull(store.get(KvBytes.fromString("k")));

        when(channel.isWritable()).thenReturn(true);
        handler.channelWritabilityChanged(ctx);

        final InOrder inOrder = inOrder(ctx, config);
        inOrder.verify(ctx).writeAndFlush(SimpleString.OK);
        inOrder.verify(ctx).writeAndFlush(argThat(reply -> "v".equals(String.valueOf(reply))));
        inOrder.verify(config).setAutoRead(true);
        verify(ctx).fireChannelWritabilityChanged();
    }

    @Test
    @DisplayName("排队期间的协议错误在排队请求回复之后写回")
    void testProtocolErrorAfterQueuedReplies() throws Exception {
        final ChannelConfig config = mock(ChannelConfig.class);
        final ChannelFuture future = mock(ChannelFuture.class);
        when(channel.config()).thenReturn(config);
        when(channel.isActive()).thenReturn(true);
        when(ctx.writeAndFlush(any())).thenReturn(future);
        when(channel.isWritable()).thenReturn(false);

        final RespCommandHandler handler = new RespCommandHandler(dispatcher);
        handler.channelRead0(ctx, request("ping"));
        handler.exceptionCaught(ctx, new RespProtocolException("invalid bulk length"));
        verify(ctx, never()).writeAndFlush(any());

        when(channel.isWritable()).thenReturn(true);
        handler.channelWritabilityChanged(ctx);

        final InOrder inOrder = inOrder(ctx);
        inOrder.verify(ctx).writeAndFlush(SimpleString.PONG);
        inOrder.verify(ctx).writeAndFlush(argThat(reply -> reply instanceof Errors
                && "ERR Protocol error: invalid bulk length".equals(((Errors) reply).getContent())));
        verify(future).addListener(ChannelFutureListener.CLOSE);
        verify(config, never()).setAutoRead(true);
    }

    private static RespArray request(final String... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            array[i] = new BulkString(KvBytes.fromString(parts[i]));
        }
        return new RespArray(array);
    }

    @Test
    void testNullDispatcher() {
        assertThrows(IllegalArgumentException.class, () -> new RespCommandHandler(null));
    }
}
