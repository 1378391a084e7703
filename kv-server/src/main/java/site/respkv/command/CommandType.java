package site.respkv.command;

import lombok.Getter;
import site.respkv.command.impl.Echo;
import site.respkv.command.impl.Ping;
import site.respkv.command.impl.Quit;
import site.respkv.command.impl.server.TestProbe;
import site.respkv.command.impl.string.Get;
import site.respkv.command.impl.string.Set;
import site.respkv.core.KvStore;
import site.respkv.datastructure.KvBytes;

import java.util.HashMap;
import java.util.Map;

/**
 * 命令表，定义支持的全部命令及其参数个数。
 *
 * <p>参数个数（不含命令名）的约定：
 * <ul>
 *   <li>非负数 n：恰好 n 个参数
 *   <li>负数 -n：至少 n 个参数
 * </ul>
 *
 * <p>命令名匹配不区分大小写，参数本身原样传递。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    /** PING命令：测试服务器连接 */
    PING("ping", 0),
    /** ECHO命令：原样返回参数 */
    ECHO("echo", -1),
    /** SET命令：设置键值对 */
    SET("set", 2),
    /** GET命令：获取键值 */
    GET("get", 1),
    /** QUIT命令：回复OK后关闭连接 */
    QUIT("quit", 0, true),
    /** TEST命令：固定输出的诊断命令 */
    TEST("test", 0);

    /** 小写命令名 */
    private final String name;

    /** 小写命令名的字节表示，作为查找键 */
    private final KvBytes commandBytes;

    private final int arity;

    /** 回复写出后是否关闭连接 */
    private final boolean closesConnection;

    private static final Map<KvBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    CommandType(final String name, final int arity) {
        this(name, arity, false);
    }

    CommandType(final String name, final int arity, final boolean closesConnection) {
        this.name = name;
        this.commandBytes = KvBytes.fromString(name);
        this.arity = arity;
        this.closesConnection = closesConnection;
    }

    /**
     * 不区分大小写地查找命令。
     *
     * @param commandBytes 客户端发送的命令名
     * @return 对应的CommandType，不存在时返回null
     */
    public static CommandType findByBytes(final KvBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        return COMMAND_CACHE.get(commandBytes.toLowerCase());
    }

    /**
     * 检查参数个数是否符合声明。
     *
     * @param argumentCount 参数个数，不含命令名
     * @return 是否符合
     */
    public boolean acceptsArgumentCount(final int argumentCount) {
        return arity >= 0 ? argumentCount == arity : argumentCount >= -arity;
    }

    /**
     * 创建命令实例。
     *
     * @param store 共享存储
     * @return 命令实例
     */
    public Command createCommand(final KvStore store) {
        switch (this) {
            case PING:
                return new Ping();
            case ECHO:
                return new Echo();
            case SET:
                return new Set(store);
            case GET:
                return new Get(store);
            case QUIT:
                return new Quit();
            case TEST:
                return new TestProbe();
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
