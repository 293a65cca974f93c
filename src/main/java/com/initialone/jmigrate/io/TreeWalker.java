package com.initialone.jmigrate.io;

import com.initialone.jmigrate.migrate.ConfigurationException;
import com.initialone.jmigrate.model.FileTask;
import com.initialone.jmigrate.util.Tools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;

/**
 * 由 (input, output?, inplace) 解析出全部 (source, destination) 对。
 *
 * 单文件：
 *  - output 与 input 相同（in-place）       -> 写回自身
 *  - output 是已存在的目录                   -> output/<文件名>
 *  - output 带可识别扩展名                   -> output 本身
 *  - 其他                                    -> 视为目录：output/<文件名>
 * 目录：
 *  - 递归收集可识别扩展名的文件，目标为 output/<相对路径>
 * 这里只做解析不建目录，目标目录由 driver 在真正写盘时再建（dry-run 不建）
 */
public class TreeWalker {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".py");

    private final Set<String> extensions;

    public TreeWalker() {
        this(DEFAULT_EXTENSIONS);
    }

    public TreeWalker(Collection<String> extensions) {
        this.extensions = Tools.normalizeExtensions(extensions, DEFAULT_EXTENSIONS);
    }

    public Set<String> extensions() { return Collections.unmodifiableSet(extensions); }

    /**
     * 参数校验先于任何文件 I/O：缺 output 且非 in-place 直接抛 ConfigurationException。
     *
     * @param output inplace 为 true 时被忽略，可为 null
     */
    public MigrationPlan resolve(Path input, Path output, boolean inplace) throws IOException {
        if (input == null) {
            throw new ConfigurationException("input path is required");
        }
        if (output == null && !inplace) {
            throw new ConfigurationException("an output path is required unless --inplace is set");
        }
        Path in = Tools.absolute(input);
        Path out = inplace ? in : Tools.absolute(output);

        if (!Files.exists(in)) {
            throw new NoSuchFileException(in.toString(), null, "input not found");
        }

        if (Files.isDirectory(in)) {
            return new MigrationPlan(MigrationPlan.InputKind.DIRECTORY, in, out, inplace, forDirectory(in, out));
        }
        return new MigrationPlan(MigrationPlan.InputKind.FILE, in, out, inplace, List.of(forFile(in, out)));
    }

    private FileTask forFile(Path in, Path out) {
        if (out.equals(in)) {
            return new FileTask(in, in);
        }
        Path dest;
        if (Files.isDirectory(out)) {
            dest = out.resolve(in.getFileName());
        } else if (Tools.hasExtension(out, extensions)) {
            dest = out;
        } else {
            dest = out.resolve(in.getFileName());
        }
        return new FileTask(in, dest);
    }

    private List<FileTask> forDirectory(Path in, Path out) throws IOException {
        // output 嵌在 input 里面时，不要把上一次的输出再当成输入
        boolean skipOutputTree = !out.equals(in) && out.startsWith(in);

        List<Path> files = new ArrayList<>();
        try (var s = Files.walk(in)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> Tools.hasExtension(p, extensions))
                    .filter(p -> !(skipOutputTree && p.startsWith(out)))
                    .forEach(files::add);
        } catch (UncheckedIOException e) {
            // 遍历中途读不了的子目录
            throw e.getCause();
        }
        files.sort(Comparator.comparing(Path::toString));

        List<FileTask> tasks = new ArrayList<>(files.size());
        for (Path p : files) {
            tasks.add(new FileTask(p, out.resolve(in.relativize(p))));
        }
        return tasks;
    }
}
