package strongbox.core.model.secret;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content of one secret revision: inline data or a reference to a backend.
 *
 * <p>Exactly one of {@code data} and {@code valueRef} is set. Inline data
 * keeps the insertion order of its keys.
 *
 * @param data     inline key/value content, or null
 * @param valueRef pointer to backend-held content, or null
 */
public record SecretContent(Map<String, String> data, ValueRef valueRef) {

    public SecretContent {
        if (data != null && valueRef != null) {
            throw new IllegalArgumentException("both valueRef and data cannot be set");
        }
        if (data == null && valueRef == null) {
            throw new IllegalArgumentException("either valueRef or data must be set");
        }
        if (data != null) {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public static SecretContent inline(Map<String, String> data) {
        return new SecretContent(data, null);
    }

    public static SecretContent reference(ValueRef valueRef) {
        return new SecretContent(null, valueRef);
    }

    public boolean isInline() {
        return data != null;
    }

    /**
     * SHA-256 over the inline data with keys in natural order.
     *
     * @return hex checksum, or null for referenced content
     */
    public String checksum() {
        if (data == null) {
            return null;
        }
        return checksumOf(data);
    }

    public static String checksumOf(Map<String, String> data) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (var entry : new TreeMap<>(data).entrySet()) {
            updateField(digest, entry.getKey());
            updateField(digest, entry.getValue());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    // Each field is length-prefixed so no key or value can run into the next one.
    private static void updateField(MessageDigest digest, String field) {
        final byte[] bytes = field == null ? new byte[0] : field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(field == null ? -1 : bytes.length).array());
        digest.update(bytes);
    }
}
