package com.erbformat.format.doc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Prints a {@link Doc} within a maximum line width. Each group is printed flat when everything up
 * to the next possible line break fits on the current line, and broken otherwise. The root is
 * printed in break mode. Trailing spaces are removed from every line that ends at an indenting
 * break.
 */
public final class DocRenderer {
    private enum Mode {
        FLAT,
        BREAK
    }

    private static final class Command {
        private final int indent;
        private final Mode mode;
        private final Doc doc;

        private Command(int indent, Mode mode, Doc doc) {
            this.indent = indent;
            this.mode = mode;
            this.doc = doc;
        }
    }

    private final int maxWidth;
    private final int indentWidth;

    public DocRenderer(int maxWidth, int indentWidth) {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        }
        this.maxWidth = maxWidth;
        this.indentWidth = indentWidth;
    }

    public String render(Doc doc) {
        StringBuilder out = new StringBuilder();
        Deque<Command> commands = new ArrayDeque<>();
        commands.push(new Command(0, Mode.BREAK, doc));
        int position = 0;

        while (!commands.isEmpty()) {
            Command command = commands.pop();
            Doc current = command.doc;
            if (current instanceof Text) {
                String value = ((Text) current).getValue();
                out.append(value);
                int lastBreak = value.lastIndexOf('\n');
                position = lastBreak < 0 ? position + value.length() : value.length() - lastBreak - 1;
            } else if (current instanceof Concat) {
                var parts = ((Concat) current).getParts();
                for (int i = parts.size() - 1; i >= 0; i--) {
                    commands.push(new Command(command.indent, command.mode, parts.get(i)));
                }
            } else if (current instanceof Indent) {
                commands.push(new Command(command.indent + indentWidth, command.mode, ((Indent) current).getContents()));
            } else if (current instanceof Group) {
                Group group = (Group) current;
                Mode mode;
                if (group.isBroken()) {
                    mode = Mode.BREAK;
                } else if (command.mode == Mode.FLAT) {
                    mode = Mode.FLAT;
                } else {
                    Command flat = new Command(command.indent, Mode.FLAT, group.getContents());
                    mode = fits(flat, commands, maxWidth - position) ? Mode.FLAT : Mode.BREAK;
                }
                commands.push(new Command(command.indent, mode, group.getContents()));
            } else {
                Breakable breakable = (Breakable) current;
                if (command.mode == Mode.FLAT && !breakable.isForced()) {
                    out.append(breakable.getSeparator());
                    position += breakable.getSeparator().length();
                } else if (breakable.getForce() == Breakable.Force.LITERAL) {
                    out.append('\n');
                    position = 0;
                } else {
                    trimTrailingSpaces(out);
                    out.append('\n').append(" ".repeat(command.indent));
                    position = command.indent;
                }
            }
        }
        trimTrailingSpaces(out);
        return out.toString();
    }

    /**
     * Whether {@code next}, followed by the pending commands, reaches a line break before running
     * out of {@code width}.
     */
    private static boolean fits(Command next, Deque<Command> rest, int width) {
        Deque<Command> queue = new ArrayDeque<>();
        queue.push(next);
        Iterator<Command> pending = rest.iterator();
        int remaining = width;

        while (remaining >= 0) {
            if (queue.isEmpty()) {
                if (!pending.hasNext()) {
                    return true;
                }
                queue.push(pending.next());
            }
            Command command = queue.pop();
            Doc current = command.doc;
            if (current instanceof Text) {
                String value = ((Text) current).getValue();
                int firstBreak = value.indexOf('\n');
                if (firstBreak >= 0) {
                    return remaining - firstBreak >= 0;
                }
                remaining -= value.length();
            } else if (current instanceof Concat) {
                var parts = ((Concat) current).getParts();
                for (int i = parts.size() - 1; i >= 0; i--) {
                    queue.push(new Command(command.indent, command.mode, parts.get(i)));
                }
            } else if (current instanceof Indent) {
                queue.push(new Command(command.indent, command.mode, ((Indent) current).getContents()));
            } else if (current instanceof Group) {
                Group group = (Group) current;
                Mode mode = group.isBroken() ? Mode.BREAK : command.mode;
                queue.push(new Command(command.indent, mode, group.getContents()));
            } else {
                Breakable breakable = (Breakable) current;
                if (command.mode == Mode.BREAK || breakable.isForced()) {
                    return true;
                }
                remaining -= breakable.getSeparator().length();
            }
        }
        return false;
    }

    private static void trimTrailingSpaces(StringBuilder out) {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        out.setLength(end);
    }
}
