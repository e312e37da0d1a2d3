package deskgate.core.model.upload;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Leading magic bytes expected for a MIME type.
 *
 * @param mimeType the declared type this signature applies to
 * @param magic the expected leading bytes
 */
public record FileSignature(String mimeType, byte[] magic) {

    public FileSignature {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
        Objects.requireNonNull(magic, "magic must not be null");
        if (magic.length == 0) {
            throw new IllegalArgumentException("signature for " + mimeType + " must not be empty");
        }
        magic = magic.clone();
    }

    /**
     * Parse a signature written as hex, with or without separators ({@code "FF D8 FF"}, {@code "ffd8ff"}).
     *
     * @param mimeType the MIME type
     * @param hex the hex bytes
     * @return the signature
     */
    public static FileSignature ofHex(String mimeType, String hex) {
        final var compact = hex.replaceAll("[\\s:,-]", "");
        return new FileSignature(mimeType, HexFormat.of().parseHex(compact));
    }

    @Override
    public byte[] magic() {
        return magic.clone();
    }

    /**
     * Render the signature as spaced upper-case hex for messages.
     *
     * @return e.g. {@code FF D8 FF}
     */
    public String toHex() {
        return HexFormat.ofDelimiter(" ").withUpperCase().formatHex(magic);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FileSignature other
                && mimeType.equals(other.mimeType)
                && java.util.Arrays.equals(magic, other.magic);
    }

    @Override
    public int hashCode() {
        return 31 * mimeType.hashCode() + java.util.Arrays.hashCode(magic);
    }

    @Override
    public String toString() {
        return "FileSignature[" + mimeType + "=" + toHex() + "]";
    }
}
