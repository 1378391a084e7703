package site.respkv.core;

import site.respkv.datastructure.KvBytes;

/**
 * 键值存储接口，是所有连接之间唯一共享的可变状态。
 *
 * <p>实现必须保证：
 * <ul>
 *   <li>来自不同连接的并发读写没有数据竞争
 *   <li>读到的值总是某次已完成的 {@link #set} 写入的完整值，不会出现部分写入
 *   <li>对同一个键的并发写入以最后完成者为准
 * </ul>
 *
 * <p>调用方只能通过本接口访问数据，底层映射结构不对外暴露。
 *
 * @author respkv
 * @since 1.0.0
 */
public interface KvStore {

    /**
     * 获取键对应的值，不阻塞其他读者。
     *
     * @param key 键
     * @return 对应的值，键不存在时返回null
     */
    KvBytes get(KvBytes key);

    /**
     * 写入键值对，已存在的值被覆盖。
     *
     * @param key 键
     * @param value 值
     */
    void set(KvBytes key, KvBytes value);

    /**
     * @return 当前键的数量
     */
    int size();
}
