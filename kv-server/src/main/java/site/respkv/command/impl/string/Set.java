package site.respkv.command.impl.string;

import site.respkv.command.Command;
import site.respkv.command.CommandType;
import site.respkv.core.KvStore;
import site.respkv.datastructure.KvBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

public class Set implements Command {
    private KvBytes key;
    private KvBytes value;
    private final KvStore store;

    public Set(KvStore store) {
        this.store = store;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(Resp[] array) {
        key = ((BulkString) array[1]).getContent();
        value = ((BulkString) array[2]).getContent();
    }

    @Override
    public Resp handle() {
        store.set(key, value);
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return true;
    }
}
