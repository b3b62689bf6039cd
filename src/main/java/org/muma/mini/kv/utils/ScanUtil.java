package org.muma.mini.kv.utils;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class ScanUtil {

    // 永远不匹配 (非法 pattern 使用)
    private static final Pattern MATCH_NOTHING = Pattern.compile("(?!)");

    private static final String REGEX_SPECIALS = "\\.[]{}()<>*+-=!?^$|";
    private static final String CLASS_SPECIALS = "\\[]^-&";

    /**
     * MATCH 只保存原始 glob，由 Store 在快照时编译
     */
    public static class ScanParams {
        public String matchPattern;
        public int count = 10; // Default
    }

    /**
     * 解析 [MATCH pattern] [COUNT count]
     *
     * @param args       命令参数 (不含命令名)
     * @param startIndex 可选参数开始的索引 (SCAN 是 1，SSCAN 是 2: key cursor ...)
     */
    public static ScanParams parse(List<String> args, int startIndex) {
        ScanParams params = new ScanParams();

        for (int i = startIndex; i < args.size(); i += 2) {
            if (i + 1 >= args.size()) {
                throw new IllegalArgumentException("syntax error");
            }
            String opt = args.get(i).toUpperCase();
            String val = args.get(i + 1);

            if ("MATCH".equals(opt)) {
                params.matchPattern = val;
            } else if ("COUNT".equals(opt)) {
                try {
                    params.count = Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("value is not an integer or out of range");
                }
                if (params.count < 1) {
                    throw new IllegalArgumentException("syntax error");
                }
            } else {
                throw new IllegalArgumentException("syntax error");
            }
        }
        return params;
    }

    /**
     * null 或 "*" 返回 null (匹配全部)
     */
    public static Pattern compileOrNull(String glob) {
        if (glob == null || "*".equals(glob)) {
            return null;
        }
        return compileGlob(glob);
    }

    public static boolean matches(Pattern regex, String item) {
        return regex == null || regex.matcher(item).matches();
    }

    /**
     * Glob -> 正则
     * 支持 * ? [abc] [^abc] [a-z] 以及 \ 转义。
     * 未闭合的 [ 使整个 pattern 不匹配任何内容。
     */
    public static Pattern compileGlob(String glob) {
        StringBuilder sb = new StringBuilder();
        int n = glob.length();
        int i = 0;
        while (i < n) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    sb.append(".*");
                    i++;
                    break;
                case '?':
                    sb.append('.');
                    i++;
                    break;
                case '\\':
                    if (i + 1 < n) {
                        appendLiteral(sb, glob.charAt(i + 1));
                        i += 2;
                    } else {
                        appendLiteral(sb, c);
                        i++;
                    }
                    break;
                case '[':
                    i = appendClass(sb, glob, i + 1);
                    if (i < 0) {
                        return MATCH_NOTHING;
                    }
                    break;
                default:
                    appendLiteral(sb, c);
                    i++;
            }
        }
        try {
            return Pattern.compile(sb.toString(), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            // 例如 [z-a] 这种反向区间
            return MATCH_NOTHING;
        }
    }

    /**
     * 从 '[' 之后开始翻译字符集合
     *
     * @return ']' 之后的位置；未闭合返回 -1
     */
    private static int appendClass(StringBuilder sb, String glob, int pos) {
        int n = glob.length();
        StringBuilder cls = new StringBuilder("[");
        int i = pos;
        if (i < n && glob.charAt(i) == '^') {
            cls.append('^');
            i++;
        }
        int members = 0;
        while (i < n) {
            char c = glob.charAt(i);
            if (c == ']') {
                if (members == 0) {
                    // 空集合
                    sb.append("(?!)");
                } else {
                    sb.append(cls).append(']');
                }
                return i + 1;
            }
            if (c == '\\' && i + 1 < n) {
                appendClassChar(cls, glob.charAt(i + 1));
                i += 2;
            } else if (c == '-' && members > 0 && i + 1 < n && glob.charAt(i + 1) != ']') {
                cls.append('-');
                i++;
                continue;
            } else {
                appendClassChar(cls, c);
                i++;
            }
            members++;
        }
        return -1;
    }

    private static void appendLiteral(StringBuilder sb, char c) {
        if (REGEX_SPECIALS.indexOf(c) >= 0) {
            sb.append('\\');
        }
        sb.append(c);
    }

    private static void appendClassChar(StringBuilder sb, char c) {
        if (CLASS_SPECIALS.indexOf(c) >= 0) {
            sb.append('\\');
        }
        sb.append(c);
    }
}
