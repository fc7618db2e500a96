package com.entity.linkage.similarity;

/**
 * American Soundex: the first letter followed by three digits.
 * Adjacent letters with the same code collapse into one digit,
 * including a letter that shares the first letter's code.
 */
public final class SoundexEncoder {

    /** Code returned for input that contains no letters. */
    public static final String EMPTY_CODE = "0000";

    //                                      ABCDEFGHIJKLMNOPQRSTUVWXYZ
    private static final String CODE_TABLE = "01230120022455012623010202";

    private SoundexEncoder() {
    }

    public static String encode(String value) {
        if (value == null) {
            return EMPTY_CODE;
        }
        StringBuilder code = new StringBuilder(4);
        char last = 0;
        for (int i = 0; i < value.length() && code.length() < 4; i++) {
            char c = Character.toUpperCase(value.charAt(i));
            if (c < 'A' || c > 'Z') {
                continue;
            }
            char digit = CODE_TABLE.charAt(c - 'A');
            if (code.length() == 0) {
                code.append(c);
            } else if (digit != '0' && digit != last) {
                code.append(digit);
            }
            // H and W do not separate letters with the same code
            if (c != 'H' && c != 'W') {
                last = digit;
            }
        }
        if (code.length() == 0) {
            return EMPTY_CODE;
        }
        while (code.length() < 4) {
            code.append('0');
        }
        return code.toString();
    }
}
