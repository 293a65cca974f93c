package com.initialone.jmigrate.migrate;

import com.initialone.jmigrate.diff.DiffReporter;
import com.initialone.jmigrate.io.MigrationPlan;
import com.initialone.jmigrate.model.FileFailure;
import com.initialone.jmigrate.model.FileTask;
import com.initialone.jmigrate.model.MigrationReport;
import com.initialone.jmigrate.model.RewriteResult;
import com.initialone.jmigrate.rewrite.RewriteEngine;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.*;

/**
 * 逐文件执行：读 -> 重写 -> 写 -> 打印 diff。
 *
 * 写盘规则：
 * - destination == source（in-place）：只有内容变化才回写，未变化的文件完全不碰
 * - destination != source：总是写（保证输出树是完整镜像），但只对有变化的文件打印 diff
 *
 * 单文件失败（解码失败 / IO 失败）只记录，不影响其他文件，结束时汇总在 MigrationReport 里。
 */
public class MigrationDriver {

    private final RewriteEngine engine;
    private final PrintWriter out;
    private final PrintWriter err;

    private CommandLine.Help.Ansi ansi = CommandLine.Help.Ansi.OFF;
    private boolean dryRun;
    private int maxConcurrent = 1;

    public MigrationDriver(RewriteEngine engine, PrintWriter out, PrintWriter err) {
        this.engine = engine;
        this.out = out;
        this.err = err;
    }

    public MigrationDriver ansi(CommandLine.Help.Ansi ansi) {
        this.ansi = ansi == null ? CommandLine.Help.Ansi.OFF : ansi;
        return this;
    }

    /** 只统计与打印 diff，不写盘也不建目录 */
    public MigrationDriver dryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    public MigrationDriver maxConcurrent(int maxConcurrent) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        return this;
    }

    public MigrationReport run(MigrationPlan plan) {
        MigrationReport report = new MigrationReport();
        report.input = plan.input().toString();
        report.output = plan.output().toString();
        report.inplace = plan.inplace();
        report.dryRun = dryRun;

        List<FileTask> tasks = plan.tasks();
        out.println("[migrate] " + plan.kind().name().toLowerCase() + " input, files=" + tasks.size()
                + (plan.inplace() ? " (in-place)" : "") + (dryRun ? " (dry-run)" : ""));

        if (maxConcurrent <= 1 || tasks.size() <= 1) {
            for (FileTask t : tasks) process(t, report);
        } else {
            runParallel(tasks, report);
        }

        report.changedFiles.sort(Comparator.naturalOrder());
        report.failures.sort(Comparator.comparing(f -> f.source));

        out.printf("[migrate] DONE. changed=%d, written=%d, untouched=%d, errors=%d%s%n",
                report.changed, report.written, report.untouched, report.failures.size(),
                dryRun ? " (dry-run)" : "");
        out.flush();
        return report;
    }

    private void runParallel(List<FileTask> tasks, MigrationReport report) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxConcurrent, tasks.size()));
        try {
            List<Future<?>> futs = new ArrayList<>(tasks.size());
            for (FileTask t : tasks) {
                futs.add(pool.submit(() -> process(t, report)));
            }
            for (Future<?> f : futs) {
                try {
                    f.get();
                } catch (ExecutionException ee) {
                    // process() 已记录 IO/解码失败，能到这里的只有非预期的运行时异常
                    Throwable cause = ee.getCause();
                    if (cause instanceof RuntimeException re) throw re;
                    if (cause instanceof Error e) throw e;
                    throw new IllegalStateException(cause);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("[migrate] interrupted", ie);
                }
            }
        } finally {
            pool.shutdown();
        }
    }

    /** 单个 FileTask；先读和重写成功，才会写目标文件 */
    void process(FileTask task, MigrationReport report) {
        Path src = task.source();
        Path dest = task.destination();
        try {
            String content = Files.readString(src, StandardCharsets.UTF_8);
            RewriteResult r = engine.rewrite(content);

            boolean write = !task.inPlace() || r.changed();
            if (write && !dryRun) {
                Path parent = dest.getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(dest, r.rewrittenText(), StandardCharsets.UTF_8);
            }

            synchronized (report) {
                report.scanned++;
                if (write && !dryRun) report.written++;
                if (r.changed()) {
                    report.changed++;
                    report.changedFiles.add(dest.toString());
                } else if (task.inPlace()) {
                    report.untouched++;
                }
            }

            if (r.changed()) {
                List<String> diff = DiffReporter.diff(
                        r.originalText(), r.rewrittenText(), src.toString(), dest.toString());
                emit(dest, diff);
            }
        } catch (CharacterCodingException e) {
            fail(report, task, FileFailure.Kind.ENCODING, "not valid UTF-8 text (" + e + ")");
        } catch (IOException e) {
            fail(report, task, FileFailure.Kind.IO, e.toString());
        }
    }

    private void fail(MigrationReport report, FileTask task, FileFailure.Kind kind, String message) {
        synchronized (report) {
            report.scanned++;
            report.failures.add(new FileFailure(
                    task.source().toString(), task.destination().toString(), kind, message));
        }
        synchronized (err) {
            err.println("[migrate] file failed: " + task.source() + " : " + message);
            err.flush();
        }
    }

    /** 提示 + diff 作为一个整体输出，并发时不会与其他文件交错 */
    private void emit(Path dest, List<String> diff) {
        StringBuilder sb = new StringBuilder();
        sb.append("Updated ");
        sb.append(ansi.enabled() ? ansi.string("@|bold,magenta " + dest + "|@") : dest.toString());
        for (String line : diff) {
            sb.append(System.lineSeparator()).append(line);
        }
        synchronized (out) {
            out.println(sb);
            out.flush();
        }
    }
}
