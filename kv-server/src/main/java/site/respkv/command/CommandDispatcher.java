package site.respkv.command;

import lombok.extern.slf4j.Slf4j;
import site.respkv.core.KvStore;
import site.respkv.datastructure.KvBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

/**
 * 命令分发器：查找命令、校验参数个数、执行并产出回复。
 *
 * <p>处理流程：
 * <ul>
 *   <li>空请求或格式不对 - 错误回复
 *   <li>未知命令 - {@code ERR unknown command '<name>'}，命令名按收到的原样回显
 *   <li>参数个数不符 - {@code ERR wrong number of arguments for '<name>' command}，命令不会被执行
 *   <li>其余情况 - 创建命令实例并执行
 * </ul>
 * 所有命令错误都只产生错误回复，连接保持打开。
 *
 * <p>分发器本身无状态，可以被所有连接共享。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class CommandDispatcher {

    /** 空命令错误响应 */
    private static final Errors EMPTY_COMMAND_ERROR = new Errors("ERR empty command");

    /** 请求元素不是批量字符串 */
    private static final Errors INVALID_FORMAT_ERROR = new Errors("ERR Invalid command format");

    private final KvStore store;

    public CommandDispatcher(final KvStore store) {
        if (store == null) {
            throw new IllegalArgumentException("存储不能为null");
        }
        this.store = store;
    }

    /**
     * 分发一个请求。
     *
     * @param request 解码得到的请求数组
     * @return 分发结果，不会为null
     */
    public DispatchResult dispatch(final RespArray request) {
        final Resp[] array = request.getContent();
        if (array.length == 0) {
            return DispatchResult.reply(EMPTY_COMMAND_ERROR);
        }
        for (final Resp element : array) {
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                return DispatchResult.reply(INVALID_FORMAT_ERROR);
            }
        }

        final KvBytes name = ((BulkString) array[0]).getContent();
        final CommandType commandType = CommandType.findByBytes(name);
        if (commandType == null) {
            log.debug("未知命令: {}", name);
            return DispatchResult.reply(Errors.unknownCommand(name.getString()));
        }
        if (!commandType.acceptsArgumentCount(array.length - 1)) {
            return DispatchResult.reply(Errors.wrongArity(commandType.getName()));
        }

        final Command command = commandType.createCommand(store);
        command.setContext(array);
        final Resp reply = execute(command);
        if (command.isWriteCommand()) {
            log.debug("写命令 {} 已执行，当前键数量: {}", commandType, store.size());
        }
        return commandType.isClosesConnection()
                ? DispatchResult.replyThenClose(reply)
                : DispatchResult.reply(reply);
    }

    private Resp execute(final Command command) {
        try {
            return command.handle();
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", command.getType(), e);
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new Errors("ERR " + message);
        }
    }
}
