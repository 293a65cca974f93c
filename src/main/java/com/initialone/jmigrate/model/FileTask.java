package com.initialone.jmigrate.model;

import java.nio.file.Path;
import java.util.Objects;

/** 一个待处理文件：source -> destination（均为绝对路径） */
public final class FileTask {

    private final Path source;
    private final Path destination;

    public FileTask(Path source, Path destination) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    public Path source() { return source; }

    public Path destination() { return destination; }

    /** 目标即源文件：只在内容变化时才回写 */
    public boolean inPlace() { return source.equals(destination); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileTask t)) return false;
        return source.equals(t.source) && destination.equals(t.destination);
    }

    @Override
    public int hashCode() { return Objects.hash(source, destination); }

    @Override
    public String toString() { return source + " -> " + destination; }
}
