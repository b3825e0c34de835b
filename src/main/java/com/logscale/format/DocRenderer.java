package com.logscale.format;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 把 {@link Doc} 渲染为文本。分组能在当前行剩余宽度内放下时平铺，否则断行。
 *
 * <p>渲染器无状态，可在线程间共享。输出中的行尾空格会被去除。</p>
 */
public class DocRenderer {
    private final int maxLineWidth;
    private final int indentWidth;

    private enum Mode {
        FLAT,
        BREAK
    }

    private record Command(int indent, Mode mode, Doc doc) {
    }

    public DocRenderer(int maxLineWidth, int indentWidth) {
        this.maxLineWidth = maxLineWidth;
        this.indentWidth = indentWidth;
    }

    public String render(Doc doc) {
        StringBuilder out = new StringBuilder();
        Deque<Command> stack = new ArrayDeque<>();
        stack.push(new Command(0, Mode.BREAK, doc));
        int column = 0;

        while (!stack.isEmpty()) {
            Command command = stack.pop();
            Doc current = command.doc();
            if (current instanceof Doc.Text text) {
                out.append(text.text());
                column += text.text().length();
            } else if (current instanceof Doc.Concat concat) {
                for (int index = concat.parts().size() - 1; index >= 0; index--) {
                    stack.push(new Command(command.indent(), command.mode(), concat.parts().get(index)));
                }
            } else if (current instanceof Doc.Indent indent) {
                stack.push(new Command(command.indent() + indentWidth, command.mode(), indent.content()));
            } else if (current instanceof Doc.Group group) {
                Mode mode = command.mode() == Mode.FLAT
                    || (!group.forcedBreak() && fits(group.content(), maxLineWidth - column, stack))
                    ? Mode.FLAT
                    : Mode.BREAK;
                stack.push(new Command(command.indent(), mode, group.content()));
            } else if (current instanceof Doc.Line line) {
                if (command.mode() == Mode.FLAT) {
                    if (!line.soft()) {
                        out.append(' ');
                        column++;
                    }
                } else {
                    column = newline(out, command.indent());
                }
            } else if (current instanceof Doc.HardLine) {
                column = newline(out, command.indent());
            }
        }
        trimTrailingSpaces(out);
        return out.toString();
    }

    /**
     * 判断内容平铺后，连同其后直到下一个断行点的内容，能否放进剩余宽度。
     */
    private boolean fits(Doc content, int remaining, Deque<Command> rest) {
        Deque<Command> pending = new ArrayDeque<>();
        pending.push(new Command(0, Mode.FLAT, content));
        Iterator<Command> restIterator = rest.iterator();
        int width = remaining;

        while (width >= 0) {
            if (pending.isEmpty()) {
                if (!restIterator.hasNext()) {
                    return true;
                }
                pending.push(restIterator.next());
            }
            Command command = pending.pop();
            Doc current = command.doc();
            if (current instanceof Doc.Text text) {
                width -= text.text().length();
            } else if (current instanceof Doc.Concat concat) {
                for (int index = concat.parts().size() - 1; index >= 0; index--) {
                    pending.push(new Command(command.indent(), command.mode(), concat.parts().get(index)));
                }
            } else if (current instanceof Doc.Indent indent) {
                pending.push(new Command(command.indent(), command.mode(), indent.content()));
            } else if (current instanceof Doc.Group group) {
                Mode mode = group.forcedBreak() ? Mode.BREAK : command.mode();
                pending.push(new Command(command.indent(), mode, group.content()));
            } else if (current instanceof Doc.Line line) {
                if (command.mode() == Mode.BREAK) {
                    return true;
                }
                if (!line.soft()) {
                    width--;
                }
            } else if (current instanceof Doc.HardLine) {
                return true;
            }
        }
        return false;
    }

    private static int newline(StringBuilder out, int indent) {
        trimTrailingSpaces(out);
        out.append('\n');
        out.append(" ".repeat(indent));
        return indent;
    }

    private static void trimTrailingSpaces(StringBuilder out) {
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == ' ') {
            end--;
        }
        out.setLength(end);
    }
}
