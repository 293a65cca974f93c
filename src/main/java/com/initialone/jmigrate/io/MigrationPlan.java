package com.initialone.jmigrate.io;

import com.initialone.jmigrate.model.FileTask;

import java.nio.file.Path;
import java.util.List;

/**
 * TreeWalker 的解析结果。输入是单文件还是目录只在这里区分一次，
 * 下游统一按 FileTask 列表处理。
 */
public final class MigrationPlan {

    public enum InputKind { FILE, DIRECTORY }

    private final InputKind kind;
    private final Path input;
    private final Path output;
    private final boolean inplace;
    private final List<FileTask> tasks;

    MigrationPlan(InputKind kind, Path input, Path output, boolean inplace, List<FileTask> tasks) {
        this.kind = kind;
        this.input = input;
        this.output = output;
        this.inplace = inplace;
        this.tasks = List.copyOf(tasks);
    }

    public InputKind kind() { return kind; }

    public Path input() { return input; }

    public Path output() { return output; }

    public boolean inplace() { return inplace; }

    public List<FileTask> tasks() { return tasks; }

    @Override
    public String toString() {
        return "MigrationPlan{" + kind + " " + input + " -> " + output + ", tasks=" + tasks.size() + "}";
    }
}
