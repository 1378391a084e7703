package site.respkv.server;

import site.respkv.core.KvStore;

/**
 * 服务器生命周期接口。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface KvServer {

    /**
     * 绑定监听端口并开始接受连接。
     *
     * @throws IllegalStateException 如果服务器已在运行或绑定失败
     */
    void start();

    /**
     * 停止接受连接，关闭所有连接并释放线程资源。重复调用无副作用。
     */
    void stop();

    /**
     * 阻塞直到监听通道关闭（调用 {@link #stop()} 或监听套接字失效）。
     *
     * @throws InterruptedException 等待被中断
     */
    void awaitTermination() throws InterruptedException;

    /**
     * @return 所有连接共享的存储
     */
    KvStore getStore();
}
