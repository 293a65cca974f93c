package com.initialone.jmigrate.util;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

public class Tools {

    /** ".PY" / "py" / " .py " 统一成 ".py"；空列表回退到 defaults */
    public static Set<String> normalizeExtensions(Collection<String> exts, Collection<String> defaults) {
        Collection<String> src = (exts == null || exts.isEmpty()) ? defaults : exts;
        return src.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .map(s -> s.startsWith(".") ? s : "." + s)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** 小写扩展名（含点），无扩展名返回 "" */
    public static String extOf(Path p) {
        Path name = p.getFileName();
        if (name == null) return "";
        String n = name.toString().toLowerCase(Locale.ROOT);
        int i = n.lastIndexOf('.');
        return (i >= 0 ? n.substring(i) : "");
    }

    public static boolean hasExtension(Path p, Set<String> allow) {
        return allow.contains(extOf(p));
    }

    /** 绝对 + 规范化，便于路径相等比较 */
    public static Path absolute(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
