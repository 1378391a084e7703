package site.respkv.command.impl.server;

import site.respkv.command.Command;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.SimpleString;

/**
 * TEST诊断命令：返回由两个状态回复组成的数组 hello、world。
 */
public class TestProbe implements Command {

    private static final RespArray HELLO_WORLD =
            RespArray.valueOf(new SimpleString("hello"), new SimpleString("world"));

    @Override
    public CommandType getType() {
        return CommandType.TEST;
    }

    @Override
    public void setContext(Resp[] array) {
        // 无参数
    }

    @Override
    public Resp handle() {
        return HELLO_WORLD;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
