package site.respkv;

import lombok.extern.slf4j.Slf4j;
import site.respkv.server.KvMiniServer;
import site.respkv.server.config.KvServerConfig;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 服务器启动入口。
 *
 * <p>配置取自系统属性，例如 {@code java -Drespkv.port=7000 -Drespkv.maxConnections=100 ...}。
 * 监听套接字意外关闭时以非零状态退出。
 */
@Slf4j
public class KvServerLauncher {

    public static void main(String[] args) throws Exception {
        final KvServerConfig config = KvServerConfig.fromProperties(System.getProperties());
        final KvMiniServer server = new KvMiniServer(config);
        final AtomicBoolean stopping = new AtomicBoolean(false);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            stopping.set(true);
            log.info("正在关闭服务器...");
            try {
                server.stop();
                log.info("服务器已安全关闭");
            } catch (Exception e) {
                log.error("关闭服务器时发生错误", e);
            }
        }, "kv-shutdown"));

        try {
            server.start();
        } catch (IllegalStateException e) {
            log.error("服务器启动失败: {}", e.getMessage());
            System.exit(1);
            return;
        }

        server.awaitTermination();
        if (!stopping.get()) {
            log.error("监听通道意外关闭，服务器退出");
            server.stop();
            System.exit(1);
        }
    }
}
