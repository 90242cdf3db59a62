package online.askahuman.tipme.lnurl;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Bech32 codec for LNURL strings (LUD-01).
 *
 * <p>Encoding regroups the UTF-8 bytes of a URL from 8-bit to 5-bit symbols, prefixes
 * the human-readable part {@code lnurl} and the separator {@code 1}, and appends a
 * 6-symbol bech32 checksum. Output is uppercase so it packs into the QR alphanumeric
 * mode. Decoding reverses every step and verifies the checksum.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class Bech32Utils {

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
    private static final String HRP = "lnurl";
    private static final int CHECKSUM_LENGTH = 6;
    private static final int[] CHARSET_REV = buildCharsetRev();

    private static int[] buildCharsetRev() {
        int[] rev = new int[128];
        Arrays.fill(rev, -1);
        for (int i = 0; i < CHARSET.length(); i++) {
            rev[CHARSET.charAt(i)] = i;
        }
        return rev;
    }

    private Bech32Utils() {}

    /**
     * Bech32-encode a URL as an LNURL.
     *
     * @param url the URL (any string; its UTF-8 bytes are encoded)
     * @return uppercase LNURL string starting with {@code LNURL1}
     * @throws IllegalArgumentException if {@code url} is null
     */
    public static String encodeLnurl(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL must not be null");
        }
        byte[] data5bit = convertBits(url.getBytes(StandardCharsets.UTF_8), 8, 5, true);

        byte[] checksumInput = concat(hrpExpand(HRP), data5bit, new byte[CHECKSUM_LENGTH]);
        long polymod = polymod(checksumInput) ^ 1L;

        StringBuilder sb = new StringBuilder(HRP).append('1');
        for (byte b : data5bit) {
            sb.append(CHARSET.charAt(b & 0x1f));
        }
        for (int i = 0; i < CHECKSUM_LENGTH; i++) {
            sb.append(CHARSET.charAt((int) ((polymod >> (5 * (5 - i))) & 0x1f)));
        }

        return sb.toString().toUpperCase();
    }

    /**
     * Decode an LNURL back to the URL it carries. Accepts upper- or lowercase input.
     *
     * @param lnurl the bech32 string (e.g. {@code LNURL1DP68GURN8...})
     * @return the decoded URL
     * @throws IllegalArgumentException if the input is null, has no separator, carries a
     *                                  prefix other than {@code lnurl}, contains a character
     *                                  outside the bech32 charset, fails the checksum, or
     *                                  leaves non-zero padding bits
     */
    public static String decodeLnurl(String lnurl) {
        if (lnurl == null || lnurl.isEmpty()) {
            throw new IllegalArgumentException("LNURL must not be null or empty");
        }
        String lower = lnurl.toLowerCase();
        int separator = lower.lastIndexOf('1');
        if (separator < 1) {
            throw new IllegalArgumentException("LNURL has no bech32 separator");
        }
        String hrp = lower.substring(0, separator);
        if (!HRP.equals(hrp)) {
            throw new IllegalArgumentException(
                    "Input is not a valid LNURL: expected prefix 'lnurl', got '" + hrp + "'");
        }

        String dataChars = lower.substring(separator + 1);
        if (dataChars.length() < CHECKSUM_LENGTH) {
            throw new IllegalArgumentException("LNURL data is shorter than its checksum");
        }

        byte[] all5bit = new byte[dataChars.length()];
        for (int i = 0; i < dataChars.length(); i++) {
            char c = dataChars.charAt(i);
            int val = c < 128 ? CHARSET_REV[c] : -1;
            if (val == -1) {
                throw new IllegalArgumentException(
                        "LNURL contains invalid bech32 character: '" + c + "'");
            }
            all5bit[i] = (byte) val;
        }

        if (polymod(concat(hrpExpand(HRP), all5bit, new byte[0])) != 1L) {
            throw new IllegalArgumentException(
                    "LNURL checksum verification failed (corrupted or tampered input)");
        }

        byte[] data5bit = Arrays.copyOf(all5bit, all5bit.length - CHECKSUM_LENGTH);
        return new String(convertBits(data5bit, 5, 8, false), StandardCharsets.UTF_8);
    }

    private static long polymod(byte[] values) {
        long chk = 1L;
        for (byte b : values) {
            int c0 = (int) (chk >> 25);
            chk = ((chk & 0x1ffffffL) << 5) ^ (b & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((c0 >> i) & 1) != 0) {
                    chk ^= GENERATOR[i];
                }
            }
        }
        return chk;
    }

    private static byte[] hrpExpand(String hrp) {
        byte[] result = new byte[hrp.length() * 2 + 1];
        for (int i = 0; i < hrp.length(); i++) {
            result[i] = (byte) (hrp.charAt(i) >> 5);
            result[i + hrp.length() + 1] = (byte) (hrp.charAt(i) & 0x1f);
        }
        result[hrp.length()] = 0;
        return result;
    }

    private static byte[] concat(byte[] a, byte[] b, byte[] c) {
        byte[] combined = new byte[a.length + b.length + c.length];
        System.arraycopy(a, 0, combined, 0, a.length);
        System.arraycopy(b, 0, combined, a.length, b.length);
        System.arraycopy(c, 0, combined, a.length + b.length, c.length);
        return combined;
    }

    private static byte[] convertBits(byte[] data, int fromBits, int toBits, boolean pad) {
        int acc = 0, bits = 0;
        int maxv = (1 << toBits) - 1;
        int outputSize = (data.length * fromBits + (pad ? toBits - 1 : 0)) / toBits;
        byte[] result = new byte[outputSize];
        int idx = 0;

        for (byte b : data) {
            int value = b & 0xff;
            if ((value >> fromBits) != 0) {
                throw new IllegalArgumentException(
                        "Value " + value + " does not fit in " + fromBits + " bits");
            }
            acc = ((acc << fromBits) | value) & 0xfffff;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                result[idx++] = (byte) ((acc >> bits) & maxv);
            }
        }

        if (pad) {
            if (bits > 0) {
                result[idx] = (byte) ((acc << (toBits - bits)) & maxv);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new IllegalArgumentException("LNURL has invalid padding in bit conversion");
        }

        return result;
    }
}
