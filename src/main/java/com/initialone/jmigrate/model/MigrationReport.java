package com.initialone.jmigrate.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次迁移运行的汇总（--report 时序列化为 JSON）。
 * 并发模式下由 MigrationDriver 同步更新。
 */
public class MigrationReport {
    public String catalogue;
    public String input;
    public String output;
    public boolean inplace;
    public boolean dryRun;

    /** 处理过的文件数（含失败） */
    public int scanned;
    /** 实际写盘的文件数 */
    public int written;
    /** 内容有变化的文件数 */
    public int changed;
    /** in-place 且无变化、因此未触碰的文件数 */
    public int untouched;

    public List<String> changedFiles = new ArrayList<>();
    public List<FileFailure> failures = new ArrayList<>();

    public boolean hasFailures() { return !failures.isEmpty(); }
}
