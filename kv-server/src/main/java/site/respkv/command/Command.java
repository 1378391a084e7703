package site.respkv.command;

import site.respkv.protocol.Resp;

/**
 * 命令接口，每次请求创建一个实例。
 *
 * <p>执行流程：
 * <ul>
 *   <li>分发器先按 {@link CommandType} 声明的参数个数校验请求
 *   <li>{@link #setContext(Resp[])} 绑定参数
 *   <li>{@link #handle()} 执行并返回回复
 * </ul>
 *
 * <p>因为参数个数已经校验过，实现类可以直接按下标取参数。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface Command {

    /**
     * @return 命令类型
     */
    CommandType getType();

    /**
     * 设置命令参数。
     *
     * @param array 完整的请求数组，下标0为命令名
     */
    void setContext(Resp[] array);

    /**
     * 执行命令并返回结果。
     *
     * @return RESP格式的回复
     */
    Resp handle();

    /**
     * @return 是否会修改存储
     */
    boolean isWriteCommand();
}
