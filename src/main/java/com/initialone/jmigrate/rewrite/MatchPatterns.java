package com.initialone.jmigrate.rewrite;

import java.util.regex.Pattern;

/** PatternCompiler 的产物：限定形式与裸标识符两条规则，只读。 */
public final class MatchPatterns {

    private final String marker;
    private final Pattern qualified;
    private final Pattern bare;

    MatchPatterns(String marker, Pattern qualified, Pattern bare) {
        this.marker = marker;
        this.qualified = qualified;
        this.bare = bare;
    }

    public String marker() { return marker; }

    /** 匹配 marker.legacyName */
    public Pattern qualified() { return qualified; }

    /** 匹配 legacyName */
    public Pattern bare() { return bare; }
}
