package dev.runplan.backend;

/**
 * Wraps text for an 80 column console. Every line is indented by a tab, counted as 8 columns, and lines are
 * broken at the last space before column 72, or hard at column 72 if a line has no space.
 */
public final class TextWrapper {

    private static final int INDENT = 8;
    private static final int WIDTH = 72;
    private static final String BREAK = "\n\t";

    private TextWrapper() {}

    public static String wrap(String text) {
        if (text == null) {
            return "";
        }
        var out = new StringBuilder("\t");
        int column = INDENT;
        int lastSpace = -1;

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            out.append(ch);
            column++;
            if (ch == '\n') {
                out.append('\t');
                column = INDENT;
                lastSpace = -1;
            } else if (ch == ' ') {
                lastSpace = out.length() - 1;
            }

            if (column >= WIDTH) {
                if (lastSpace == -1) {
                    out.append(BREAK);
                    column = INDENT;
                } else {
                    int carried = out.length() - lastSpace - 1;
                    out.replace(lastSpace, lastSpace + 1, BREAK);
                    column = INDENT + carried;
                    lastSpace = -1;
                }
            }
        }
        return out.toString().stripTrailing();
    }
}
