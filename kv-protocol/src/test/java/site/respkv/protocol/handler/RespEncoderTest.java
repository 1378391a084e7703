package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.MessageSizeEstimator;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.datastructure.KvBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("回复编码器测试")
public class RespEncoderTest {

    private static BulkString bulk(final String content) {
        return new BulkString(KvBytes.fromString(content));
    }

    private static String encode(final Resp resp) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(resp));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.ISO_8859_1);
        } finally {
            buf.release();
            channel.finish();
        }
    }

    @Test
    @DisplayName("状态回复")
    public void testEncodeStatus() {
        assertEquals("+PONG\r\n", encode(SimpleString.PONG));
        assertEquals("+OK\r\n", encode(SimpleString.OK));
    }

    @Test
    @DisplayName("错误回复")
    public void testEncodeError() {
        assertEquals("-ERR unknown command 'FOO'\r\n", encode(Errors.unknownCommand("FOO")));
        assertEquals("-ERR wrong number of arguments for 'get' command\r\n", encode(Errors.wrongArity("get")));
    }

    @Test
    @DisplayName("批量字符串与空值")
    public void testEncodeBulk() {
        assertEquals("$5\r\nhello\r\n", encode(bulk("hello")));
        assertEquals("$0\r\n\r\n", encode(bulk("")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
    }

    @Test
    @DisplayName("数组头后逐个编码元素")
    public void testEncodeArray() {
        assertEquals("*2\r\n+hello\r\n+world\r\n",
                encode(RespArray.valueOf(new SimpleString("hello"), new SimpleString("world"))));
        assertEquals("*2\r\n$1\r\na\r\n$-1\r\n",
                encode(RespArray.valueOf(bulk("a"), BulkString.NULL)));
        assertEquals("*0\r\n", encode(RespArray.EMPTY));
    }

    @Test
    @DisplayName("请求编码后再解码得到原参数")
    public void testRequestRoundTrip() {
        byte[] binary = {0x00, '\r', '\n', (byte) 0x80, '$', '*'};
        RespArray request = RespArray.valueOf(
                bulk("echo"),
                BulkString.wrapTrusted(binary),
                bulk(""),
                bulk("中文"));

        EmbeddedChannel encoder = new EmbeddedChannel(new RespEncoder());
        assertTrue(encoder.writeOutbound(request));
        ByteBuf wire = encoder.readOutbound();

        EmbeddedChannel decoder = new EmbeddedChannel(new RespRequestDecoder());
        assertTrue(decoder.writeInbound(wire));
        RespArray decoded = decoder.readInbound();

        assertEquals(request.size(), decoded.size());
        for (int i = 0; i < request.size(); i++) {
            assertEquals(((BulkString) request.getContent()[i]).getContent(),
                    ((BulkString) decoded.getContent()[i]).getContent());
        }

        encoder.finish();
        decoder.finish();
    }

    @Test
    @DisplayName("大小预估覆盖编码结果")
    public void testEstimateMessageSize() {
        BulkString bulk = bulk("0123456789");
        assertTrue(RespEncoder.estimateMessageSize(bulk) >= "$10\r\n0123456789\r\n".length());
        assertEquals(5, RespEncoder.estimateMessageSize(BulkString.NULL));
    }

    @Test
    @DisplayName("写缓冲估算按回复编码后的大小计算")
    public void testMessageSizeEstimator() {
        MessageSizeEstimator.Handle handle = RespMessageSizeEstimator.INSTANCE.newHandle();
        BulkString large = BulkString.wrapTrusted(new byte[60000]);

        assertTrue(handle.size(large) >= 60000);
        assertEquals(RespEncoder.estimateMessageSize(large), handle.size(large));
        assertEquals(16, handle.size(Unpooled.buffer(16).writeZero(16)));
    }
}
