package com.mainframe.transpiler.lexer;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits raw source text into {@link SourceLine}s, honouring the column zones of the reference format.
 *
 * Fixed format:
 * - Columns 1-6: sequence number (kept, ignored)
 * - Column 7: indicator ({@code *} or {@code /} comment, {@code -} continuation, {@code D} debug)
 * - Columns 8 to the right margin: program text
 * - Columns past the margin: identification area (dropped)
 */
public class CobolLineReader {
    private static final Logger log = LoggerFactory.getLogger(CobolLineReader.class);

    private static final int INDICATOR_INDEX = 6;
    private static final int FIXED_CONTENT_COLUMN = 8;

    private final SourceFormat format;
    private final int rightMargin;

    public CobolLineReader(SourceFormat format, int rightMargin) {
        this.format = format;
        this.rightMargin = rightMargin;
    }

    public CobolLineReader() {
        this(SourceFormat.FIXED, SourceFormat.DEFAULT_FIXED_MARGIN);
    }

    public SourceFormat getFormat() {
        return format;
    }

    public int getRightMargin() {
        return rightMargin;
    }

    /**
     * Width of the program text area of a fixed-format line.
     */
    public int contentWidth() {
        return Math.max(0, rightMargin - (FIXED_CONTENT_COLUMN - 1));
    }

    public List<SourceLine> read(String source, String fileName) {
        List<SourceLine> lines = new ArrayList<>();
        String[] raw = source.split("\r?\n", -1);
        int count = raw.length;
        // A trailing newline yields an empty last element; it is not a source line.
        if (count > 0 && raw[count - 1].isEmpty()) {
            count--;
        }
        for (int i = 0; i < count; i++) {
            lines.add(format == SourceFormat.FIXED
                    ? parseFixedLine(raw[i], i + 1, fileName)
                    : parseFreeLine(raw[i], i + 1, fileName));
        }
        log.debug("Read {} lines from {}", lines.size(), fileName);
        return lines;
    }

    private SourceLine parseFixedLine(String raw, int number, String fileName) {
        String line = raw.replace('\t', ' ');

        if (line.length() <= INDICATOR_INDEX) {
            // Line without full column layout
            LineKind kind = line.isBlank() ? LineKind.BLANK : LineKind.CODE;
            return SourceLine.builder()
                    .fileName(fileName)
                    .number(number)
                    .kind(kind)
                    .indicator(' ')
                    .content(kind == LineKind.BLANK ? "" : line.strip())
                    .contentColumn(1)
                    .raw(raw)
                    .build();
        }

        char indicator = line.charAt(INDICATOR_INDEX);
        int end = Math.min(rightMargin, line.length());
        String content = end > FIXED_CONTENT_COLUMN - 1 ? line.substring(FIXED_CONTENT_COLUMN - 1, end) : "";

        LineKind kind = switch (indicator) {
            case '*', '/' -> LineKind.COMMENT;
            case '-' -> LineKind.CONTINUATION;
            case 'D', 'd' -> LineKind.DEBUG;
            default -> content.isBlank() ? LineKind.BLANK : LineKind.CODE;
        };

        return SourceLine.builder()
                .fileName(fileName)
                .number(number)
                .kind(kind)
                .indicator(indicator)
                .sequenceArea(line.substring(0, INDICATOR_INDEX))
                .content(content)
                .contentColumn(FIXED_CONTENT_COLUMN)
                .raw(raw)
                .build();
    }

    private SourceLine parseFreeLine(String raw, int number, String fileName) {
        String line = raw.replace('\t', ' ');
        if (rightMargin > 0 && line.length() > rightMargin) {
            line = line.substring(0, rightMargin);
        }

        LineKind kind;
        String content = line;
        if (line.isBlank()) {
            kind = LineKind.BLANK;
            content = "";
        } else if (line.stripLeading().startsWith("*>")) {
            kind = LineKind.COMMENT;
            content = line.stripLeading().substring(2);
        } else {
            kind = LineKind.CODE;
        }

        return SourceLine.builder()
                .fileName(fileName)
                .number(number)
                .kind(kind)
                .indicator(' ')
                .content(content)
                .contentColumn(1)
                .raw(raw)
                .build();
    }
}
