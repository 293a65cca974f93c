package com.initialone.jmigrate.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** 内置迁移目录，命令行上用 id 选择（大小写不敏感）。 */
public enum Migration {

    UPGRADE_7TO8("7to8", "d", List.of(
            "center",
            "mirror",
            "move",
            "movex",
            "movey",
            "rotate",
            "size_info",
            "x",
            "xmin",
            "xmax",
            "xsize",
            "y",
            "ymin",
            "ymax",
            "ysize"
    ));

    private final String id;
    private final String marker;
    private final List<String> legacyNames;

    Migration(String id, String marker, List<String> legacyNames) {
        this.id = id;
        this.marker = marker;
        this.legacyNames = legacyNames;
    }

    public String id() { return id; }

    public RenameCatalogue catalogue() {
        return RenameCatalogue.of(id, marker, legacyNames);
    }

    public static Migration fromId(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (Migration m : values()) {
            if (m.id.equals(key) || m.name().toLowerCase(Locale.ROOT).equals(key)) return m;
        }
        throw new IllegalArgumentException("unknown migration '" + id + "', expected one of: " + ids());
    }

    public static String ids() {
        return Arrays.stream(values()).map(Migration::id).collect(Collectors.joining(", "));
    }
}
