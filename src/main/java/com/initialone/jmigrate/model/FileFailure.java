package com.initialone.jmigrate.model;

/** 单文件失败记录，汇总到 MigrationReport，运行结束后统一报告。 */
public class FileFailure {

    public enum Kind {
        /** 内容无法按 UTF-8 解码 */
        ENCODING,
        /** 读写 / 建目录失败 */
        IO
    }

    public String source;
    public String destination;
    public Kind kind;
    public String message;

    public FileFailure() {}

    public FileFailure(String source, String destination, Kind kind, String message) {
        this.source = source;
        this.destination = destination;
        this.kind = kind;
        this.message = message;
    }

    @Override
    public String toString() {
        return "[" + kind + "] " + source + " : " + message;
    }
}
