package org.stackvm.assembler;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits assembly source into lines and lines into label, mnemonic and operand.
 * <p>
 * A {@code ;} starts a comment unless it appears inside a quoted string. A label is a
 * non-empty run of letters, digits and underscores followed by a colon that comes before
 * any quote; text after the colon is parsed as an instruction. A line whose colon does
 * not form a valid label is treated as an instruction as a whole.
 */
public final class LineParser {

    private LineParser() {}

    /**
     * Splits source text into numbered lines. Both {@code \n} and {@code \r\n} endings are accepted.
     * @param source The complete source text.
     * @return The lines, numbered from 1.
     */
    public static List<SourceLine> split(String source) {
        List<SourceLine> lines = new ArrayList<>();
        String[] raw = source.split("\r?\n", -1);
        for (int i = 0; i < raw.length; i++) {
            lines.add(new SourceLine(i + 1, raw[i]));
        }
        return lines;
    }

    /**
     * Parses one line.
     * @param line The source line.
     * @return The parsed parts. Blank and comment-only lines yield neither label nor mnemonic.
     */
    public static ParsedLine parse(SourceLine line) {
        String text = stripComment(line.content()).strip();
        String label = null;

        int colon = text.indexOf(':');
        int quote = text.indexOf('"');
        if (colon > 0 && (quote < 0 || colon < quote) && isLabelName(text.substring(0, colon))) {
            label = text.substring(0, colon);
            text = text.substring(colon + 1).strip();
        }

        if (text.isEmpty()) {
            return new ParsedLine(line, label, null, "");
        }
        int split = 0;
        while (split < text.length() && !Character.isWhitespace(text.charAt(split))) {
            split++;
        }
        String mnemonic = text.substring(0, split);
        String operand = text.substring(split).strip();
        return new ParsedLine(line, label, mnemonic, operand);
    }

    /**
     * Removes a trailing comment. A quote preceded by a backslash does not open or close a string.
     * @param text The raw line.
     * @return The text before the first {@code ;} outside quotes.
     */
    static String stripComment(String text) {
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                inQuotes = !inQuotes;
            } else if (c == ';' && !inQuotes) {
                return text.substring(0, i);
            }
        }
        return text;
    }

    static boolean isLabelName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
                return false;
            }
        }
        return true;
    }
}
