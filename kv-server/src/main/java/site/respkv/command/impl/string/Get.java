package site.respkv.command.impl.string;

import site.respkv.command.Command;
import site.respkv.command.CommandType;
import site.respkv.core.KvStore;
import site.respkv.datastructure.KvBytes;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;

public class Get implements Command {
    private KvBytes key;
    private final KvStore store;

    public Get(KvStore store) {
        this.store = store;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(Resp[] array) {
        key = ((BulkString) array[1]).getContent();
    }

    @Override
    public Resp handle() {
        final KvBytes value = store.get(key);
        if (value == null) {
            return BulkString.NULL;
        }
        return new BulkString(value);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
