package com.initialone.jmigrate.rewrite;

import com.initialone.jmigrate.model.RenameCatalogue;
import com.initialone.jmigrate.model.RenameRule;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 由 RenameCatalogue 构建两条单词边界正则：
 * <pre>
 *   qualified: \b(d\.center|d\.x|...)\b
 *   bare     : \b(center|x|...)\b
 * </pre>
 * 边界按 Unicode 语义判断（ñcenter 中的 center 不算独立标识符）。
 */
public final class PatternCompiler {

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private PatternCompiler() {}

    public static MatchPatterns compile(RenameCatalogue catalogue) {
        String marker = catalogue.marker();

        String qualified = catalogue.rules().stream()
                .map(r -> Pattern.quote(marker + "." + r.legacyName()))
                .collect(Collectors.joining("|"));
        String bare = catalogue.rules().stream()
                .map(RenameRule::legacyName)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));

        return new MatchPatterns(
                marker,
                Pattern.compile("\\b(" + qualified + ")\\b", FLAGS),
                Pattern.compile("\\b(" + bare + ")\\b", FLAGS)
        );
    }
}
