package com.logscale.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 排版文档模型（Wadler / Prettier 风格）。
 *
 * <p>{@link Line} 在分组平铺时变为一个空格（soft 时为空），否则换行并缩进；
 * {@link HardLine} 总是换行，包含它的分组一定断行。</p>
 */
public sealed interface Doc {

    record Text(String text) implements Doc {
    }

    record Line(boolean soft) implements Doc {
    }

    record HardLine() implements Doc {
    }

    record Indent(Doc content) implements Doc {
    }

    /** forcedBreak 在构造时根据内容是否含硬换行计算 */
    record Group(Doc content, boolean forcedBreak) implements Doc {
    }

    record Concat(List<Doc> parts) implements Doc {
        public Concat {
            parts = List.copyOf(parts);
        }
    }

    Doc EMPTY = new Concat(List.of());

    static Doc text(String text) {
        return new Text(text);
    }

    static Doc line() {
        return new Line(false);
    }

    static Doc softline() {
        return new Line(true);
    }

    static Doc hardline() {
        return new HardLine();
    }

    static Doc indent(Doc... parts) {
        return new Indent(concat(parts));
    }

    static Doc group(Doc... parts) {
        Doc content = concat(parts);
        return new Group(content, containsHardLine(content));
    }

    static Doc concat(Doc... parts) {
        if (parts.length == 1) {
            return parts[0];
        }
        return new Concat(Arrays.asList(parts));
    }

    static Doc concat(List<Doc> parts) {
        return new Concat(parts);
    }

    /**
     * 用分隔文档连接各部分。
     */
    static Doc join(Doc separator, List<Doc> parts) {
        List<Doc> joined = new ArrayList<>();
        for (int index = 0; index < parts.size(); index++) {
            if (index > 0) {
                joined.add(separator);
            }
            joined.add(parts.get(index));
        }
        return new Concat(joined);
    }

    /**
     * 判断文档内部是否含有硬换行；已断行的子分组同样向外传播。
     */
    static boolean containsHardLine(Doc doc) {
        if (doc instanceof HardLine) {
            return true;
        }
        if (doc instanceof Indent indent) {
            return containsHardLine(indent.content());
        }
        if (doc instanceof Group group) {
            return group.forcedBreak();
        }
        if (doc instanceof Concat concat) {
            for (Doc part : concat.parts()) {
                if (containsHardLine(part)) {
                    return true;
                }
            }
        }
        return false;
    }
}
