package org.symproof.lang.parser;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 源码的规范形式：统一换行符、去掉公共缩进和首尾空行。
 * 哈希与解析都基于规范形式，因此缩进或换行风格不同的同一函数得到同一缓存键。
 */
public final class SourceText {

    private SourceText() {
    }

    public static String canonicalize(String source) {
        String normalized = source.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);

        // 公共缩进只看非空行
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (StringUtils.isNotBlank(line)) {
                indent = Math.min(indent, line.length() - StringUtils.stripStart(line, null).length());
            }
        }
        if (indent == Integer.MAX_VALUE) {
            return "\n";
        }

        List<String> dedented = new ArrayList<>(lines.length);
        for (String line : lines) {
            dedented.add(StringUtils.isBlank(line) ? "" : StringUtils.stripEnd(line.substring(indent), null));
        }
        // 去掉开头的空行，使第 1 行是第一行代码
        while (!dedented.isEmpty() && dedented.get(0).isEmpty()) {
            dedented.remove(0);
        }
        return StringUtils.stripEnd(String.join("\n", dedented), "\n") + "\n";
    }
}
