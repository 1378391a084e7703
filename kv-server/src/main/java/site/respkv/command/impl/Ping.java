package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

public class Ping implements Command {

    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(Resp[] array) {
        // 无参数
    }

    @Override
    public Resp handle() {
        return SimpleString.PONG;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
