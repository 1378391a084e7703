package site.respkv.server.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.protocol.RespLimits;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("服务器配置测试")
class KvServerConfigTest {

    @Test
    void testDefaults() {
        final KvServerConfig config = KvServerConfig.defaultConfig();
        assertEquals("0.0.0.0", config.getHost());
        assertEquals(6379, config.getPort());
        assertEquals(0, config.getMaxConnections());
        assertEquals(1024, config.getMaxMultiBulkLength());
        assertEquals(65536, config.getMaxBulkLength());
        assertEquals(1024 * 1024, config.getMaxBufferSize());
        assertEquals(32 * 1024, config.getWriteBufferLowWaterMark());
        assertEquals(64 * 1024, config.getWriteBufferHighWaterMark());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("从属性读取配置，缺失项使用默认值")
    void testFromProperties() {
        final Properties properties = new Properties();
        properties.setProperty("respkv.port", "7000");
        properties.setProperty("respkv.host", "127.0.0.1");
        properties.setProperty("respkv.maxConnections", " 10 ");
        properties.setProperty("respkv.maxBulkLength", "128");
        properties.setProperty("unrelated.port", "1");

        final KvServerConfig config = KvServerConfig.fromProperties(properties);

        assertEquals(7000, config.getPort());
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(10, config.getMaxConnections());
        assertEquals(128, config.getMaxBulkLength());
        assertEquals(1024, config.getBacklogSize());
    }

    @Test
    void testInvalidIntegerProperty() {
        final Properties properties = new Properties();
        properties.setProperty("respkv.port", "abc");
        final IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> KvServerConfig.fromProperties(properties));
        assertTrue(e.getMessage().contains("respkv.port"));
    }

    @Test
    void testToRespLimits() {
        final RespLimits limits = KvServerConfig.builder()
                .maxMultiBulkLength(8)
                .maxBulkLength(16)
                .maxBufferSize(32)
                .build()
                .toRespLimits();
        assertEquals(8, limits.getMaxMultiBulkLength());
        assertEquals(16, limits.getMaxBulkLength());
        assertEquals(32, limits.getMaxBufferSize());
    }

    @Test
    void testValidate() {
        assertThrows(IllegalArgumentException.class, () -> KvServerConfig.builder().port(70000).build().validate());
        assertThrows(IllegalArgumentException.class, () -> KvServerConfig.builder().host(" ").build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> KvServerConfig.builder().workerThreadCount(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> KvServerConfig.builder().maxConnections(-1).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> KvServerConfig.builder().maxBulkLength(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> KvServerConfig.builder().writeBufferLowWaterMark(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> KvServerConfig.builder()
                .writeBufferLowWaterMark(64 * 1024).writeBufferHighWaterMark(32 * 1024).build().validate());
        assertDoesNotThrow(() -> KvServerConfig.builder().port(0).build().validate());
    }

    @Test
    @DisplayName("批量字符串上限超过连接缓冲区时配置无效")
    void testBulkLengthExceedsBuffer() {
        final Properties properties = new Properties();
        properties.setProperty("respkv.maxBulkLength", "2000000");
        final KvServerConfig config = KvServerConfig.fromProperties(properties);
        assertThrows(IllegalArgumentException.class, config::validate);
    }
}
