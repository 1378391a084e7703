package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.SimpleString;

/**
 * QUIT：回复OK。关闭连接由 {@link CommandType#isClosesConnection()} 驱动，在回复写出之后进行。
 */
public class Quit implements Command {

    @Override
    public CommandType getType() {
        return CommandType.QUIT;
    }

    @Override
    public void setContext(Resp[] array) {
        // 无参数
    }

    @Override
    public Resp handle() {
        return SimpleString.OK;
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
