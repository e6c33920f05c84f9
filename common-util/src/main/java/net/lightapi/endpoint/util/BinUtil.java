package net.lightapi.endpoint.util;

import net.lightapi.endpoint.EndpointConstants;

import java.util.Locale;

/**
 * Formatting of small unsigned integers as fixed-width hex strings. The output never carries the
 * {@code 0x} prefix; callers that need it use {@link #toHexCode(int, int)}.
 */
public class BinUtil {

    private BinUtil() {
        // Private constructor for utility class
    }

    /**
     * Formats the low 8 bits of the value as two upper case hex digits.
     *
     * @param value the value, 10 becomes "0A"
     * @return two hex digits
     */
    public static String int8ToHex(int value) {
        return toHex(value, 8);
    }

    /**
     * Formats the low 16 bits of the value as four upper case hex digits.
     *
     * @param value the value, 6 becomes "0006"
     * @return four hex digits
     */
    public static String int16ToHex(int value) {
        return toHex(value, 16);
    }

    /**
     * Formats the low {@code bits} bits of the value, zero padded to {@code bits / 4} digits.
     *
     * @param value the value to format
     * @param bits width in bits, a positive multiple of 4 up to 32
     * @return upper case hex digits without prefix
     */
    public static String toHex(long value, int bits) {
        if (bits <= 0 || bits > 32 || bits % 4 != 0) {
            throw new IllegalArgumentException("Unsupported bit width " + bits);
        }
        long masked = value & ((1L << bits) - 1);
        int digits = bits / 4;
        String hex = Long.toHexString(masked).toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(digits);
        for (int i = hex.length(); i < digits; i++) {
            sb.append('0');
        }
        return sb.append(hex).toString();
    }

    /**
     * Same as {@link #toHex(long, int)} with the {@code 0x} prefix in front.
     */
    public static String toHexCode(int value, int bits) {
        return EndpointConstants.HEX_PREFIX + toHex(value, bits);
    }

    /**
     * Parses a hex string back into an integer. A leading {@code 0x} or {@code 0X} is accepted.
     *
     * @param hex hex digits, optionally prefixed
     * @return the parsed value
     * @throws NumberFormatException if the string is empty or not hex
     */
    public static int hexToInt(String hex) {
        if (hex == null) {
            throw new NumberFormatException("null hex string");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty()) {
            throw new NumberFormatException("Empty hex string " + hex);
        }
        return Integer.parseUnsignedInt(digits, 16);
    }
}
