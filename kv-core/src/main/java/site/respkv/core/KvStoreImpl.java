package site.respkv.core;

import site.respkv.datastructure.KvBytes;

import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 {@link ConcurrentHashMap} 的键值存储实现。
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li><strong>读</strong>：无锁，读操作之间以及读写之间互不阻塞</li>
 *     <li><strong>写</strong>：按桶加锁，单个 {@code put} 是原子的</li>
 *     <li><strong>值</strong>：{@link KvBytes} 不可变，读者不会观察到写到一半的值</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
public class KvStoreImpl implements KvStore {

    private static final int DEFAULT_INITIAL_CAPACITY = 1024;

    private final ConcurrentHashMap<KvBytes, KvBytes> data;

    public KvStoreImpl() {
        this.data = new ConcurrentHashMap<>(DEFAULT_INITIAL_CAPACITY);
    }

    @Override
    public KvBytes get(final KvBytes key) {
        if (key == null) {
            throw new IllegalArgumentException("键不能为null");
        }
        return data.get(key);
    }

    @Override
    public void set(final KvBytes key, final KvBytes value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("键和值都不能为null");
        }
        data.put(key, value);
    }

    @Override
    public int size() {
        return data.size();
    }
}
