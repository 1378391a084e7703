package site.respkv.protocol;

import lombok.Builder;
import lombok.Data;

/**
 * 单个连接的请求解码限制。
 *
 * <p>超出任一限制均视为帧错误，连接随之关闭。
 *
 * @author respkv
 * @since 1.0.0
 */
@Data
@Builder
public class RespLimits {

    /** 单个请求数组的最大元素数 */
    @Builder.Default
    private int maxMultiBulkLength = 1024;

    /** 单个批量字符串的最大字节数 */
    @Builder.Default
    private int maxBulkLength = 65536;

    /** 连接上允许缓存的未读字节上限 */
    @Builder.Default
    private int maxBufferSize = 1024 * 1024;

    public static RespLimits defaults() {
        return RespLimits.builder().build();
    }

    /**
     * 验证限制参数的合法性
     *
     * @throws IllegalArgumentException 如果任一限制不为正数，或最大批量字符串放不进连接缓冲区
     */
    public void validate() {
        if (maxMultiBulkLength <= 0) {
            throw new IllegalArgumentException("maxMultiBulkLength必须大于0");
        }
        if (maxBulkLength <= 0) {
            throw new IllegalArgumentException("maxBulkLength必须大于0");
        }
        if (maxBufferSize <= 0) {
            throw new IllegalArgumentException("maxBufferSize必须大于0");
        }
        // 一个完整的批量字符串（负载加CRLF）必须能放进连接缓冲区
        if ((long) maxBulkLength + 2 > maxBufferSize) {
            throw new IllegalArgumentException("maxBulkLength + 2 不能超过maxBufferSize");
        }
    }
}
