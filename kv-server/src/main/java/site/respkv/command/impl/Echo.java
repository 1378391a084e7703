package site.respkv.command.impl;

import site.respkv.command.Command;
import site.respkv.command.CommandType;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

import java.util.Arrays;

/**
 * ECHO：一个参数时原样返回该批量字符串，多个参数时按顺序返回批量字符串数组。
 */
public class Echo implements Command {

    private Resp[] arguments;

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public void setContext(Resp[] array) {
        this.arguments = Arrays.copyOfRange(array, 1, array.length);
    }

    @Override
    public Resp handle() {
        if (arguments.length == 1) {
            return arguments[0];
        }
        return new RespArray(arguments);
    }

    @Override
    public boolean isWriteCommand() {
        return false;
    }
}
