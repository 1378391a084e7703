package site.respkv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.command.CommandDispatcher;
import site.respkv.core.KvStore;
import site.respkv.core.KvStoreImpl;
import site.respkv.protocol.RespLimits;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.protocol.handler.RespMessageSizeEstimator;
import site.respkv.protocol.handler.RespRequestDecoder;
import site.respkv.server.config.KvServerConfig;
import site.respkv.server.handler.ConnectionLimitHandler;
import site.respkv.server.handler.RespCommandHandler;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 基于Netty的服务器实现。
 *
 * <p>每个连接的管道：
 * <pre>
 *   RespEncoder -> ConnectionLimitHandler -> RespRequestDecoder -> [commandExecutor] RespCommandHandler
 * </pre>
 *
 * <ul>
 *   <li>根据操作系统自动选择 Epoll / KQueue / NIO
 *   <li>I/O在worker线程上进行，命令在独立的命令执行器上执行，单个连接的阻塞不影响其他连接
 *   <li>存储是唯一跨连接共享的可变状态
 *   <li>写缓冲超过高水位的连接暂停读取与处理，内存占用不随客户端未读的回复增长
 *   <li>监听套接字本身出错时关闭监听通道，{@link #awaitTermination()} 随之返回；单个连接的错误不影响监听
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
@Getter
public class KvMiniServer implements KvServer {

    private final KvServerConfig config;

    private final KvStore store;

    private final CommandDispatcher dispatcher;

    private final RespEncoder encoder = new RespEncoder();

    /** 当前活跃连接数 */
    private final AtomicInteger activeConnections = new AtomicInteger();

    private Class<? extends ServerChannel> serverChannelClass;

    /** 接收连接的事件循环组 */
    private EventLoopGroup bossGroup;

    /** 处理I/O的事件循环组 */
    private EventLoopGroup workerGroup;

    /** 命令执行线程池 */
    private EventExecutorGroup commandExecutor;

    private Channel serverChannel;

    public KvMiniServer(final KvServerConfig config) {
        this(config, new KvStoreImpl());
    }

    /**
     * @param config 服务器配置
     * @param store 共享存储
     * @throws IllegalArgumentException 如果配置无效
     */
    public KvMiniServer(final KvServerConfig config, final KvStore store) {
        config.validate();
        this.config = config;
        this.store = store;
        this.dispatcher = new CommandDispatcher(store);
    }

    @Override
    public synchronized void start() {
        if (serverChannel != null) {
            throw new IllegalStateException("服务器已经在运行");
        }
        initializeEventLoopGroups();
        initializeCommandExecutor();

        final RespLimits limits = config.toRespLimits();
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .handler(new ListenerFailureHandler())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(
                        config.getWriteBufferLowWaterMark(), config.getWriteBufferHighWaterMark()))
                .childOption(ChannelOption.MESSAGE_SIZE_ESTIMATOR, RespMessageSizeEstimator.INSTANCE)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(encoder);
                        pipeline.addLast(new ConnectionLimitHandler(activeConnections, config.getMaxConnections()));
                        pipeline.addLast(new RespRequestDecoder(limits));
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });

        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("server started at {}:{}", config.getHost(), getBoundPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("启动被中断", e);
        } catch (Exception e) {
            log.error("无法绑定 {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IllegalStateException("无法绑定 " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    /**
     * @return 实际监听的端口（配置端口为0时由系统分配），未启动时返回-1
     */
    public int getBoundPort() {
        final Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress)) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        final Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    @Override
    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
            log.info("server stopped, {} keys in store", store.size());
        } catch (InterruptedException e) {
            log.error("server stop interrupted", e);
            Thread.currentThread().interrupt();
        } finally {
            serverChannel = null;
            workerGroup = null;
            bossGroup = null;
            commandExecutor = null;
        }
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("kv-cmd"));
    }

    /**
     * 监听通道上的异常处理：accept失败说明监听套接字已不可用，关闭监听通道。
     */
    private static final class ListenerFailureHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
            if (cause instanceof IOException) {
                log.error("accept失败，关闭监听通道: {}", cause.getMessage(), cause);
                ctx.channel().close();
                return;
            }
            ctx.fireExceptionCaught(cause);
        }
    }
}
