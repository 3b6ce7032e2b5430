package com.mainframe.transpiler.symbol;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Builder;
import lombok.Value;

/**
 * Represents a parsed COBOL PIC (PICTURE) clause.
 */
@Value
@Builder
public class PictureClause {
    /** Longest numeric item the runtime supports. */
    public static final int MAX_DIGITS = 31;

    String rawPicture;
    String expandedPicture;
    PictureCategory category;
    boolean signed;
    int integerDigits;
    int fractionDigits;

    /** Character positions the item occupies in DISPLAY usage. */
    int length;

    // Patterns for parsing PIC clauses
    private static final Pattern REPEAT_PATTERN = Pattern.compile("(.)\\((\\d+)\\)");
    private static final Pattern VALID_SYMBOLS = Pattern.compile("[9XAVSPZ*,.+\\-B0/$CRDB]+");

    /**
     * Parse a raw COBOL PIC clause string.
     *
     * @throws InvalidPictureException when the string is not a well-formed picture
     */
    public static PictureClause parse(String pic) {
        if (pic == null || pic.isBlank()) {
            throw new InvalidPictureException(String.valueOf(pic), "empty picture");
        }

        String normalized = pic.toUpperCase(Locale.ROOT).trim();
        String expanded = expandPicture(normalized);

        if (!VALID_SYMBOLS.matcher(expanded).matches()) {
            throw new InvalidPictureException(pic, "unknown picture symbol");
        }
        if (expanded.indexOf('S', 1) >= 0) {
            throw new InvalidPictureException(pic, "S must be the first symbol");
        }
        if (count(expanded, 'V') > 1 || count(expanded, 'V') + count(expanded, '.') > 1) {
            throw new InvalidPictureException(pic, "more than one decimal point");
        }
        String withoutCredit = expanded.replace("CR", "").replace("DB", "");
        if (withoutCredit.indexOf('C') >= 0 || withoutCredit.indexOf('R') >= 0
                || withoutCredit.indexOf('D') >= 0) {
            throw new InvalidPictureException(pic, "C, R and D may only appear as CR or DB");
        }

        PictureCategory category = categorize(expanded);
        boolean signed = expanded.startsWith("S");

        int intDigits = 0;
        int fracDigits = 0;
        if (category == PictureCategory.NUMERIC || category == PictureCategory.NUMERIC_EDITED) {
            String body = expanded.replaceFirst("^S", "");
            int decimalPos = body.indexOf('V');
            if (decimalPos < 0) {
                decimalPos = body.indexOf('.');
            }
            if (decimalPos >= 0) {
                intDigits = countDigits(body.substring(0, decimalPos), category);
                fracDigits = countDigits(body.substring(decimalPos + 1), category);
            } else {
                intDigits = countDigits(body, category);
            }
            if (intDigits + fracDigits == 0) {
                throw new InvalidPictureException(pic, "no digit positions");
            }
            if (intDigits + fracDigits > MAX_DIGITS) {
                throw new InvalidPictureException(pic, "more than " + MAX_DIGITS + " digits");
            }
            if (category == PictureCategory.NUMERIC_EDITED) {
                signed = body.contains("+") || body.contains("-") || body.contains("CR") || body.contains("DB");
            }
        } else if (signed) {
            throw new InvalidPictureException(pic, "S is only valid in a numeric picture");
        }

        return PictureClause.builder()
                .rawPicture(pic)
                .expandedPicture(expanded)
                .category(category)
                .signed(signed)
                .integerDigits(intDigits)
                .fractionDigits(fracDigits)
                .length(displayLength(expanded))
                .build();
    }

    private static PictureCategory categorize(String expanded) {
        boolean hasX = expanded.indexOf('X') >= 0;
        boolean hasA = expanded.indexOf('A') >= 0;
        boolean hasInsertion = expanded.matches(".*[B0/].*");

        if (hasX || hasA) {
            if (expanded.matches(".*[VSPZ*,.+\\-$].*")) {
                throw new InvalidPictureException(expanded, "numeric symbols mixed with X or A");
            }
            if (hasInsertion) {
                return PictureCategory.ALPHANUMERIC_EDITED;
            }
            return hasX || expanded.indexOf('9') >= 0 ? PictureCategory.ALPHANUMERIC : PictureCategory.ALPHABETIC;
        }
        if (expanded.matches("[9SVP]+")) {
            return PictureCategory.NUMERIC;
        }
        return PictureCategory.NUMERIC_EDITED;
    }

    /**
     * Expand repeat notation like X(10) to XXXXXXXXXX.
     */
    private static String expandPicture(String pic) {
        Matcher matcher = REPEAT_PATTERN.matcher(pic);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String ch = matcher.group(1);
            int count = Integer.parseInt(matcher.group(2));
            if (count == 0) {
                throw new InvalidPictureException(pic, "zero repetition count");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(ch.repeat(count)));
        }
        matcher.appendTail(sb);
        String result = sb.toString();
        if (result.indexOf('(') >= 0 || result.indexOf(')') >= 0) {
            throw new InvalidPictureException(pic, "unbalanced repetition");
        }
        return result;
    }

    private static int countDigits(String s, PictureCategory category) {
        if (category == PictureCategory.NUMERIC) {
            return (int) s.chars().filter(c -> c == '9' || c == 'P').count();
        }
        int digits = (int) s.chars().filter(c -> c == '9' || c == 'Z' || c == '*').count();
        // A floating insertion string of n symbols holds n - 1 digits
        for (char floating : new char[] {'+', '-', '$'}) {
            int n = count(s, floating);
            if (n > 1) {
                digits += n - 1;
            }
        }
        return digits;
    }

    private static int displayLength(String expanded) {
        return (int) expanded.chars().filter(c -> c != 'S' && c != 'V' && c != 'P').count();
    }

    private static int count(String s, char c) {
        return (int) s.chars().filter(ch -> ch == c).count();
    }

    public boolean isNumeric() {
        return category == PictureCategory.NUMERIC;
    }

    public boolean isEdited() {
        return category == PictureCategory.NUMERIC_EDITED || category == PictureCategory.ALPHANUMERIC_EDITED;
    }

    /**
     * Calculate byte length for this picture and usage type.
     */
    public int getByteLength(Usage usage, boolean separateSign) {
        if (!isNumeric()) {
            return length;
        }

        switch (usage) {
            case BINARY:
            case COMP_5:
                return getBinaryByteLength();
            case PACKED_DECIMAL:
                return (integerDigits + fractionDigits) / 2 + 1;
            case COMP_1:
                return 4;
            case COMP_2:
                return 8;
            default:
                return length + (separateSign ? 1 : 0);
        }
    }

    public int getBinaryByteLength() {
        int digits = integerDigits + fractionDigits;
        if (digits <= 4) return 2;
        if (digits <= 9) return 4;
        return 8;
    }
}
