package com.initialone.jmigrate.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jmigrate.io.MigrationPlan;
import com.initialone.jmigrate.io.TreeWalker;
import com.initialone.jmigrate.migrate.ConfigurationException;
import com.initialone.jmigrate.migrate.MigrationDriver;
import com.initialone.jmigrate.model.FileFailure;
import com.initialone.jmigrate.model.Migration;
import com.initialone.jmigrate.model.MigrationReport;
import com.initialone.jmigrate.model.RenameCatalogue;
import com.initialone.jmigrate.rewrite.RewriteEngine;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.*;
import java.util.List;

/**
 * 按迁移目录把旧标识符重写为 marker 前缀形式（纯文本、单词边界），并打印 unified diff。
 *
 * 用法：
 *  migrate --migration=7to8 src out          输出到镜像目录（所有文件都会写出）
 *  migrate --migration=7to8 src -i           原地改写（只改动有变化的文件）
 *  migrate --catalogue=my.json file.py out.py
 *
 * 退出码：0 成功；2 参数/输入错误（在任何文件 I/O 之前）；1 有文件处理失败。
 */
@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        description = "Rewrite renamed identifiers in a file or source tree and print unified diffs"
)
public class MigrateCmd implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    static class CatalogueSource {
        @CommandLine.Option(names = "--migration", converter = MigrationConverter.class,
                description = "Built-in migration id (case-insensitive): ${COMPLETION-CANDIDATES}",
                completionCandidates = MigrationIds.class)
        Migration migration;

        @CommandLine.Option(names = "--catalogue",
                description = "JSON catalogue file: {\"name\":..,\"marker\":..,\"names\":[..]}")
        Path catalogueFile;
    }

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    CatalogueSource source;

    @CommandLine.Parameters(index = "0", description = "Input folder or file")
    Path input;

    @CommandLine.Parameters(index = "1", arity = "0..1",
            description = "Output folder or file. Ignored when --inplace is set")
    Path output;

    @CommandLine.Option(names = {"-i", "--inplace"}, defaultValue = "false",
            description = "Overwrite the input folder or file, ignoring any output path")
    boolean inplace;

    @CommandLine.Option(names = "--dry-run", defaultValue = "false",
            description = "Print diffs and stats without writing files")
    boolean dryRun;

    @CommandLine.Option(names = "--extensions", split = ",", defaultValue = ".py",
            description = "Comma-separated file extensions to migrate in a folder (default: ${DEFAULT-VALUE})")
    List<String> exts;

    @CommandLine.Option(names = "--max-concurrent", defaultValue = "1",
            description = "Max concurrent file workers (default: ${DEFAULT-VALUE})")
    int maxConcurrent;

    @CommandLine.Option(names = "--report", description = "Write a JSON summary of the run to this path")
    Path reportFile;

    @CommandLine.Option(names = "--no-color", defaultValue = "false",
            description = "Disable highlighted output (also -Djmigrate.color=false)")
    boolean noColor;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        RenameCatalogue catalogue;
        MigrationPlan plan;
        try {
            catalogue = loadCatalogue();
            plan = new TreeWalker(exts).resolve(input, output, inplace);
        } catch (ConfigurationException | NoSuchFileException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), message(e), e);
        } catch (IOException e) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "[migrate] failed: " + e, e);
        }
        if (inplace && output != null) {
            out.println("[migrate] --inplace set, ignoring output " + output);
        }
        out.println("[migrate] catalogue: " + catalogue.name()
                + " marker=" + catalogue.marker() + " names=" + String.join(",", catalogue.legacyNames()));

        MigrationReport report = new MigrationDriver(RewriteEngine.forCatalogue(catalogue), out, err)
                .ansi(colorEnabled() ? spec.commandLine().getColorScheme().ansi() : CommandLine.Help.Ansi.OFF)
                .dryRun(dryRun)
                .maxConcurrent(maxConcurrent)
                .run(plan);
        report.catalogue = catalogue.name();

        if (reportFile != null) {
            writeReport(report, out);
        }

        if (report.hasFailures()) {
            err.println("[migrate] " + report.failures.size() + " file(s) failed:");
            for (FileFailure f : report.failures) err.println("  " + f);
            err.flush();
            throw new CommandLine.ExecutionException(spec.commandLine(),
                    "[migrate] " + report.failures.size() + " of " + report.scanned + " file(s) failed");
        }
    }

    private RenameCatalogue loadCatalogue() throws IOException {
        if (source.catalogueFile != null) {
            return RenameCatalogue.fromJson(source.catalogueFile);
        }
        return source.migration.catalogue();
    }

    private void writeReport(MigrationReport report, PrintWriter out) {
        try {
            Path p = reportFile.toAbsolutePath();
            if (p.getParent() != null) Files.createDirectories(p.getParent());
            ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            om.writeValue(p.toFile(), report);
            out.println("[migrate] report: " + p);
        } catch (IOException e) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "[migrate] cannot write report: " + e, e);
        }
    }

    private boolean colorEnabled() {
        return !noColor && Boolean.parseBoolean(System.getProperty("jmigrate.color", "true"));
    }

    private static String message(Exception e) {
        if (e instanceof NoSuchFileException nsf) {
            return "not found: " + nsf.getFile();
        }
        return e.getMessage();
    }

    static class MigrationConverter implements CommandLine.ITypeConverter<Migration> {
        @Override
        public Migration convert(String value) {
            try {
                return Migration.fromId(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    static class MigrationIds implements Iterable<String> {
        @Override
        public java.util.Iterator<String> iterator() {
            return java.util.Arrays.stream(Migration.values()).map(Migration::id).iterator();
        }
    }
}
