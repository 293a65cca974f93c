package com.initialone.jmigrate.rewrite;

import com.initialone.jmigrate.model.RenameCatalogue;
import com.initialone.jmigrate.model.RewriteResult;

import java.util.regex.Matcher;

/**
 * 纯文本两遍替换，无 I/O、无可变状态，可被多个线程共享。
 *
 * 1) qualified 匹配 m 替换为 marker + m（d.center -> dd.center）
 * 2) 在第 1 步的结果上，bare 匹配 n 替换为 marker + n（dd.center -> dd.dcenter）
 *
 * 第 2 步会再次命中第 1 步产物里的旧名，所以 d.center 最终得到 dd.dcenter。
 * 这个双 marker 结果是既有行为，保持原样。
 */
public final class RewriteEngine {

    private final MatchPatterns patterns;
    private final String replacement;

    public RewriteEngine(MatchPatterns patterns) {
        this.patterns = patterns;
        this.replacement = Matcher.quoteReplacement(patterns.marker()) + "$1";
    }

    public static RewriteEngine forCatalogue(RenameCatalogue catalogue) {
        return new RewriteEngine(PatternCompiler.compile(catalogue));
    }

    public RewriteResult rewrite(String text) {
        String pass1 = patterns.qualified().matcher(text).replaceAll(replacement);
        String pass2 = patterns.bare().matcher(pass1).replaceAll(replacement);
        return new RewriteResult(text, pass2);
    }
}
