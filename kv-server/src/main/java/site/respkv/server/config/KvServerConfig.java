package site.respkv.server.config;

import lombok.Builder;
import lombok.Data;
import site.respkv.protocol.RespLimits;

import java.util.Properties;

/**
 * 服务器配置类，统一管理网络、线程与协议限制参数。
 *
 * <p>采用Builder模式创建，所有参数都有默认值。也可以从 {@link Properties}
 * 读取（键名为 {@code respkv.<参数名>}），启动器用它支持 {@code -Drespkv.port=7000} 这样的覆盖。
 *
 * @author respkv
 * @since 1.0.0
 */
@Data
@Builder
public class KvServerConfig {

    /** 配置项前缀 */
    public static final String PROPERTY_PREFIX = "respkv.";

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     *
     * <p>默认监听所有网卡；仅本机访问时使用 127.0.0.1。
     */
    @Builder.Default
    private String host = "0.0.0.0";

    /**
     * 服务器监听端口，0 表示由系统分配（测试用）。
     */
    @Builder.Default
    private int port = 6379;

    /** TCP连接队列大小 */
    @Builder.Default
    private int backlogSize = 1024;

    /** 接收缓冲区大小（字节） */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /** 发送缓冲区大小（字节） */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    /**
     * 写缓冲低水位（字节）。待写出数据回落到此值以下时恢复读取该连接。
     */
    @Builder.Default
    private int writeBufferLowWaterMark = 32 * 1024;

    /**
     * 写缓冲高水位（字节）。待写出数据超过此值时暂停处理该连接的请求，直到客户端读走回复。
     */
    @Builder.Default
    private int writeBufferHighWaterMark = 64 * 1024;

    /**
     * 最大客户端连接数，0 表示不限制。
     */
    @Builder.Default
    private int maxConnections = 0;

    // ========== 线程配置 ==========

    /** Boss线程组大小（接受连接） */
    @Builder.Default
    private int bossThreadCount = 1;

    /** Worker线程组大小（处理I/O） */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 命令执行器线程数。
     *
     * <p>每个连接固定绑定其中一个线程，因此同一连接内的命令严格按到达顺序执行；
     * 存储本身是线程安全的，不同连接的命令可以并行。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 协议限制 ==========

    /** 单个请求的最大参数个数 */
    @Builder.Default
    private int maxMultiBulkLength = 1024;

    /** 单个参数的最大字节数 */
    @Builder.Default
    private int maxBulkLength = 65536;

    /** 每个连接缓存的未读字节上限 */
    @Builder.Default
    private int maxBufferSize = 1024 * 1024;

    // ========== 工厂方法 ==========

    public static KvServerConfig defaultConfig() {
        return KvServerConfig.builder().build();
    }

    /**
     * 从属性集合创建配置，缺失的项使用默认值。
     *
     * @param properties 属性集合，例如 {@code System.getProperties()}
     * @return 配置实例
     * @throws IllegalArgumentException 如果某个数值型配置项不是合法整数
     */
    public static KvServerConfig fromProperties(final Properties properties) {
        final KvServerConfig defaults = defaultConfig();
        return KvServerConfig.builder()
                .host(properties.getProperty(PROPERTY_PREFIX + "host", defaults.getHost()))
                .port(intProperty(properties, "port", defaults.getPort()))
                .backlogSize(intProperty(properties, "backlogSize", defaults.getBacklogSize()))
                .receiveBufferSize(intProperty(properties, "receiveBufferSize", defaults.getReceiveBufferSize()))
                .sendBufferSize(intProperty(properties, "sendBufferSize", defaults.getSendBufferSize()))
                .writeBufferLowWaterMark(intProperty(properties, "writeBufferLowWaterMark",
                        defaults.getWriteBufferLowWaterMark()))
                .writeBufferHighWaterMark(intProperty(properties, "writeBufferHighWaterMark",
                        defaults.getWriteBufferHighWaterMark()))
                .maxConnections(intProperty(properties, "maxConnections", defaults.getMaxConnections()))
                .bossThreadCount(intProperty(properties, "bossThreadCount", defaults.getBossThreadCount()))
                .workerThreadCount(intProperty(properties, "workerThreadCount", defaults.getWorkerThreadCount()))
                .commandExecutorThreadCount(intProperty(properties, "commandExecutorThreadCount",
                        defaults.getCommandExecutorThreadCount()))
                .maxMultiBulkLength(intProperty(properties, "maxMultiBulkLength", defaults.getMaxMultiBulkLength()))
                .maxBulkLength(intProperty(properties, "maxBulkLength", defaults.getMaxBulkLength()))
                .maxBufferSize(intProperty(properties, "maxBufferSize", defaults.getMaxBufferSize()))
                .build();
    }

    private static int intProperty(final Properties properties, final String name, final int defaultValue) {
        final String value = properties.getProperty(PROPERTY_PREFIX + name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("配置项 " + PROPERTY_PREFIX + name + " 不是合法整数: " + value, e);
        }
    }

    /**
     * @return 由本配置导出的连接级协议限制
     */
    public RespLimits toRespLimits() {
        return RespLimits.builder()
                .maxMultiBulkLength(maxMultiBulkLength)
                .maxBulkLength(maxBulkLength)
                .maxBufferSize(maxBufferSize)
                .build();
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }
        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }
        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
        if (writeBufferLowWaterMark <= 0 || writeBufferHighWaterMark < writeBufferLowWaterMark) {
            throw new IllegalArgumentException("写缓冲水位必须大于0，且高水位不能低于低水位");
        }
        if (maxConnections < 0) {
            throw new IllegalArgumentException("最大连接数不能为负数");
        }
        toRespLimits().validate();
    }
}
