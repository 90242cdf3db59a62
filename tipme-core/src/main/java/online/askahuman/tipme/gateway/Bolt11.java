package online.askahuman.tipme.gateway;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the amount a BOLT11 invoice carries in its human-readable part.
 *
 * <p>The prefix is {@code ln} + currency ({@code bc}, {@code tb}, {@code bcrt}, {@code tbs})
 * + optional amount with multiplier ({@code m}, {@code u}, {@code n}, {@code p}), followed by
 * the bech32 separator. Only the prefix is inspected; the signature is left to the node
 * that pays the invoice.</p>
 */
public final class Bolt11 {

    private static final Pattern HRP = Pattern.compile("^ln(bcrt|tbs|bc|tb)(\\d+)?([munp])?$");

    private static final long MSATS_PER_BTC = 100_000_000_000L;

    private Bolt11() {}

    /**
     * @param bolt11 the invoice, upper- or lowercase
     * @return the amount in millisatoshis, or empty for an amountless invoice
     * @throws IllegalArgumentException if the string is not a BOLT11 invoice or the amount is
     *                                  not a whole number of millisatoshis
     */
    public static OptionalLong amountMsats(String bolt11) {
        if (bolt11 == null || bolt11.isBlank()) {
            throw new IllegalArgumentException("BOLT11 invoice must not be empty");
        }
        String lower = bolt11.trim().toLowerCase();
        int separator = lower.lastIndexOf('1');
        if (separator < 1) {
            throw new IllegalArgumentException("BOLT11 invoice has no bech32 separator");
        }
        Matcher m = HRP.matcher(lower.substring(0, separator));
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a BOLT11 invoice prefix: " + lower.substring(0, separator));
        }
        String digits = m.group(2);
        String multiplier = m.group(3);
        if (digits == null) {
            if (multiplier != null) {
                throw new IllegalArgumentException("BOLT11 multiplier without amount");
            }
            return OptionalLong.empty();
        }
        if (digits.length() > 1 && digits.charAt(0) == '0') {
            throw new IllegalArgumentException("BOLT11 amount has leading zeros");
        }

        long amount;
        try {
            amount = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("BOLT11 amount out of range: " + digits, e);
        }
        try {
            if (multiplier == null) {
                return OptionalLong.of(Math.multiplyExact(amount, MSATS_PER_BTC));
            }
            switch (multiplier) {
                case "m":
                    return OptionalLong.of(Math.multiplyExact(amount, MSATS_PER_BTC / 1_000));
                case "u":
                    return OptionalLong.of(Math.multiplyExact(amount, MSATS_PER_BTC / 1_000_000));
                case "n":
                    return OptionalLong.of(Math.multiplyExact(amount, MSATS_PER_BTC / 1_000_000_000));
                default:
                    // pico-bitcoin: tenths of a millisatoshi
                    if (amount % 10 != 0) {
                        throw new IllegalArgumentException("BOLT11 amount is not a whole millisatoshi: " + digits + "p");
                    }
                    return OptionalLong.of(amount / 10);
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("BOLT11 amount out of range: " + digits, e);
        }
    }
}
