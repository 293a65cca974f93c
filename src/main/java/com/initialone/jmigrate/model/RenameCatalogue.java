package com.initialone.jmigrate.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jmigrate.migrate.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * 改名目录：一个 marker + 一组旧标识符。
 * 启动时构建一次，之后只读；显式传给 PatternCompiler，不放在全局状态里。
 *
 * 约束：
 * - marker 与每个 legacyName 都必须是合法标识符（字母/数字/下划线，不以数字开头）
 * - legacyName 不可重复，且至少一条
 */
public final class RenameCatalogue {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final String marker;
    private final List<RenameRule> rules;

    private RenameCatalogue(String name, String marker, List<RenameRule> rules) {
        this.name = name;
        this.marker = marker;
        this.rules = rules;
    }

    public static RenameCatalogue of(String name, String marker, Collection<String> legacyNames) {
        if (marker == null || !IDENTIFIER.matcher(marker).matches()) {
            throw new ConfigurationException("catalogue '" + name + "': marker is not an identifier: " + marker);
        }
        if (legacyNames == null || legacyNames.isEmpty()) {
            throw new ConfigurationException("catalogue '" + name + "': no names to migrate");
        }
        Set<String> seen = new LinkedHashSet<>();
        List<RenameRule> rules = new ArrayList<>(legacyNames.size());
        for (String n : legacyNames) {
            if (n == null || !IDENTIFIER.matcher(n).matches()) {
                throw new ConfigurationException("catalogue '" + name + "': not an identifier: " + n);
            }
            if (!seen.add(n)) {
                throw new ConfigurationException("catalogue '" + name + "': duplicate name: " + n);
            }
            rules.add(new RenameRule(marker, n));
        }
        return new RenameCatalogue(name, marker, List.copyOf(rules));
    }

    /** JSON 形如 {"name": "...", "marker": "d", "names": ["center", "x"]} */
    static class CatalogueFile {
        public String name;
        public String marker;
        public List<String> names = new ArrayList<>();
    }

    public static RenameCatalogue fromJson(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toAbsolutePath().toString(), null, "catalogue file not found");
        }
        CatalogueFile cf;
        try {
            cf = new ObjectMapper().readValue(file.toFile(), CatalogueFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("catalogue " + file + " is not valid: " + e.getOriginalMessage());
        }
        String n = (cf.name == null || cf.name.isBlank()) ? file.getFileName().toString() : cf.name;
        return of(n, cf.marker, cf.names);
    }

    public String name() { return name; }

    public String marker() { return marker; }

    public List<RenameRule> rules() { return rules; }

    public List<String> legacyNames() {
        List<String> out = new ArrayList<>(rules.size());
        for (RenameRule r : rules) out.add(r.legacyName());
        return out;
    }

    @Override
    public String toString() {
        return "RenameCatalogue{" + name + ", marker=" + marker + ", names=" + rules.size() + "}";
    }
}
