package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespLimits;
import site.respkv.protocol.RespProtocolException;

import java.util.List;

/**
 * 请求解码器：把字节流还原为一个个 multibulk 请求。
 *
 * <p>请求格式为 "*N\r\n" 后跟 N 个 "$len\r\n&lt;len字节&gt;\r\n"。解码过程是一个显式状态机：
 * <pre>
 *   AWAIT_ARRAY_HEADER -> AWAIT_BULK_HEADER -> AWAIT_BULK_PAYLOAD -> (帧完成) -> AWAIT_ARRAY_HEADER
 * </pre>
 * 已解析的部分保存在解码器字段中，剩余字节由Netty的累积缓冲区保留，因此一个请求可以跨任意多次读取到达。
 * 每个完整请求输出一个由 {@link BulkString} 组成的 {@link RespArray}。
 *
 * <p>语法错误或超出 {@link RespLimits} 时抛出 {@link RespProtocolException}，之后解码器丢弃该连接上的所有输入。
 * 空数组（"*0"、"*-1"）不产生输出。
 *
 * <p>解码器有状态，每个连接必须使用独立实例。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespRequestDecoder extends ByteToMessageDecoder {

    /** 头部行（不含CRLF）的最大长度 */
    static final int MAX_HEADER_LINE = 64 * 1024;

    /** 头部行尚未完整到达 */
    private static final long INCOMPLETE = Long.MIN_VALUE;

    /** 十进制长度字段允许的最大位数 */
    private static final int MAX_NUMBER_DIGITS = 18;

    enum State {
        AWAIT_ARRAY_HEADER,
        AWAIT_BULK_HEADER,
        AWAIT_BULK_PAYLOAD,
        FAILED
    }

    private final RespLimits limits;

    private State state = State.AWAIT_ARRAY_HEADER;

    /** 当前请求已解析的参数 */
    private Resp[] arguments;

    private int argumentIndex;

    /** 当前批量字符串声明的长度 */
    private int bulkLength;

    public RespRequestDecoder() {
        this(RespLimits.defaults());
    }

    public RespRequestDecoder(final RespLimits limits) {
        limits.validate();
        this.limits = limits;
    }

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (state == State.FAILED) {
            in.skipBytes(in.readableBytes());
            return;
        }
        if (in.readableBytes() > limits.getMaxBufferSize()) {
            throw fail(in, "too big buffer");
        }

        while (true) {
            switch (state) {
                case AWAIT_ARRAY_HEADER: {
                    final long count = readHeader(in, (byte) '*', "invalid multibulk length");
                    if (count == INCOMPLETE) {
                        return;
                    }
                    if (count > limits.getMaxMultiBulkLength()) {
                        throw fail(in, "invalid multibulk length");
                    }
                    if (count <= 0) {
                        // 空请求，直接等待下一个
                        continue;
                    }
                    arguments = new Resp[(int) count];
                    argumentIndex = 0;
                    state = State.AWAIT_BULK_HEADER;
                    break;
                }
                case AWAIT_BULK_HEADER: {
                    final long length = readHeader(in, (byte) '$', "invalid bulk length");
                    if (length == INCOMPLETE) {
                        return;
                    }
                    if (length < 0 || length > limits.getMaxBulkLength()) {
                        throw fail(in, "invalid bulk length");
                    }
                    bulkLength = (int) length;
                    state = State.AWAIT_BULK_PAYLOAD;
                    break;
                }
                case AWAIT_BULK_PAYLOAD: {
                    if (in.readableBytes() < bulkLength + 2) {
                        return;
                    }
                    final byte[] payload = new byte[bulkLength];
                    in.readBytes(payload);
                    if (in.readByte() != '\r' || in.readByte() != '\n') {
                        throw fail(in, "expected CRLF after bulk payload");
                    }
                    // payload 由解码器独占，可以零拷贝包装
                    arguments[argumentIndex++] = BulkString.wrapTrusted(payload);
                    if (argumentIndex < arguments.length) {
                        state = State.AWAIT_BULK_HEADER;
                        break;
                    }
                    final RespArray request = new RespArray(arguments);
                    reset();
                    out.add(request);
                    return;
                }
                default:
                    throw new IllegalStateException("非法的解码状态: " + state);
            }
        }
    }

    /**
     * 读取一行形如 "&lt;prefix&gt;&lt;十进制数&gt;\r\n" 的头部。
     *
     * @return 解析出的数值；数据不完整时返回 {@link #INCOMPLETE} 且不移动读指针
     * @throws RespProtocolException 前缀错误、数字非法或行过长
     */
    private long readHeader(final ByteBuf in, final byte prefix, final String invalidMessage) {
        if (!in.isReadable()) {
            return INCOMPLETE;
        }
        final int startIndex = in.readerIndex();
        final byte first = in.getByte(startIndex);
        if (first != prefix) {
            throw fail(in, "expected '" + (char) prefix + "', got '" + (char) (first & 0xFF) + "'");
        }

        final int crIndex = in.indexOf(startIndex, in.writerIndex(), (byte) '\r');
        if (crIndex < 0 || crIndex + 1 >= in.writerIndex()) {
            if (in.readableBytes() > MAX_HEADER_LINE) {
                throw fail(in, "too big header line");
            }
            return INCOMPLETE;
        }
        if (in.getByte(crIndex + 1) != '\n') {
            throw fail(in, invalidMessage);
        }

        final long value = parseNumber(in, startIndex + 1, crIndex, invalidMessage);
        in.readerIndex(crIndex + 2);
        return value;
    }

    private long parseNumber(final ByteBuf in, final int from, final int to, final String invalidMessage) {
        int index = from;
        boolean negative = false;
        if (index < to && in.getByte(index) == '-') {
            negative = true;
            index++;
        }
        final int digits = to - index;
        if (digits == 0 || digits > MAX_NUMBER_DIGITS) {
            throw fail(in, invalidMessage);
        }
        long value = 0;
        for (; index < to; index++) {
            final byte b = in.getByte(index);
            if (b < '0' || b > '9') {
                throw fail(in, invalidMessage);
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    private RespProtocolException fail(final ByteBuf in, final String message) {
        state = State.FAILED;
        arguments = null;
        in.skipBytes(in.readableBytes());
        final RespProtocolException exception = new RespProtocolException(message);
        log.debug("请求解码失败: {}", exception.getMessage());
        return exception;
    }

    private void reset() {
        state = State.AWAIT_ARRAY_HEADER;
        arguments = null;
        argumentIndex = 0;
        bulkLength = 0;
    }

    State getState() {
        return state;
    }
}
