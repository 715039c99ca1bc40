package strongbox.core.model.secret;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Globally unique identifier of a secret.
 *
 * <p>The identifier is 20 lowercase base32hex characters. A URI may carry the
 * UUID of the model the secret originates from; such URIs refer to secrets
 * owned by another model.
 *
 * <p>String forms:
 * <ul>
 *   <li>{@code secret:9m4e2mr0ui3e8a215n4g}</li>
 *   <li>{@code secret://<model-uuid>/9m4e2mr0ui3e8a215n4g}</li>
 * </ul>
 *
 * @param id              the opaque secret identifier
 * @param sourceModelUuid UUID of the originating model, or null for a local secret
 */
public record SecretUri(String id, String sourceModelUuid) {

    public static final String SCHEME = "secret";

    private static final Pattern ID_PATTERN = Pattern.compile("^[0-9a-v]{20}$");
    private static final char[] BASE32_HEX = "0123456789abcdefghijklmnopqrstuv".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    public SecretUri {
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("secret URI ID \"" + id + "\" not valid");
        }
        if (sourceModelUuid != null && sourceModelUuid.isBlank()) {
            sourceModelUuid = null;
        }
    }

    /**
     * Create a URI with a freshly generated identifier.
     */
    public static SecretUri newUri() {
        final var bytes = new byte[12];
        RANDOM.nextBytes(bytes);
        return new SecretUri(encode(bytes), null);
    }

    public static SecretUri of(String id) {
        return new SecretUri(id, null);
    }

    /**
     * Parse a URI in either string form, or a bare identifier.
     *
     * @throws IllegalArgumentException if the string is not a secret URI
     */
    public static SecretUri parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("secret URI cannot be empty");
        }
        if (ID_PATTERN.matcher(value).matches()) {
            return new SecretUri(value, null);
        }
        if (value.startsWith(SCHEME + "://")) {
            final var rest = value.substring(SCHEME.length() + 3);
            final var slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                throw new IllegalArgumentException("secret URI \"" + value + "\" not valid");
            }
            return new SecretUri(rest.substring(slash + 1), rest.substring(0, slash));
        }
        if (value.startsWith(SCHEME + ":")) {
            return new SecretUri(value.substring(SCHEME.length() + 1), null);
        }
        throw new IllegalArgumentException("secret URI \"" + value + "\" not valid");
    }

    public SecretUri withSourceModel(String modelUuid) {
        return new SecretUri(id, modelUuid);
    }

    /**
     * Whether this URI refers to a secret owned by the given model.
     */
    public boolean isLocal(String modelUuid) {
        return sourceModelUuid == null || sourceModelUuid.equals(modelUuid);
    }

    /**
     * Key identifying one revision of this secret, {@code <id>/<revision>}.
     */
    public String revisionKey(int revision) {
        return id + "/" + revision;
    }

    @Override
    public String toString() {
        if (sourceModelUuid == null) {
            return SCHEME + ":" + id;
        }
        return SCHEME + "://" + sourceModelUuid + "/" + id;
    }

    private static String encode(byte[] bytes) {
        final var out = new StringBuilder(20);
        int buffer = 0;
        int bits = 0;
        for (byte b : bytes) {
            buffer = (buffer << 8) | (b & 0xff);
            bits += 8;
            while (bits >= 5) {
                out.append(BASE32_HEX[(buffer >> (bits - 5)) & 0x1f]);
                bits -= 5;
            }
        }
        if (bits > 0) {
            out.append(BASE32_HEX[(buffer << (5 - bits)) & 0x1f]);
        }
        return out.toString();
    }
}
