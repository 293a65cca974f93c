package com.initialone.jmigrate.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 按行生成 unified diff（---/+++ 头、@@ hunk、3 行上下文）。
 * 内容相同返回空列表；调用方一般在 changed == false 时直接跳过。
 */
public final class DiffReporter {

    public static final int CONTEXT = 3;

    private DiffReporter() {}

    public static List<String> diff(String original, String rewritten, String fromLabel, String toLabel) {
        if (original.equals(rewritten)) return List.of();

        List<String> a = lines(original);
        List<String> b = lines(rewritten);
        Patch<String> patch = DiffUtils.diff(a, b);
        // 只有行尾差异（如末尾换行）时 lines() 结果可能相同
        if (patch.getDeltas().isEmpty()) return List.of();

        return UnifiedDiffUtils.generateUnifiedDiff(fromLabel, toLabel, a, patch, CONTEXT);
    }

    /** \n、\r\n、\r 都算行分隔，末尾不产生空行 */
    static List<String> lines(String text) {
        return text.lines().collect(Collectors.toList());
    }
}
