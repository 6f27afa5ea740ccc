package csstokens.syntax;

/**
 * Attached to a {@link HashToken}. An "id" hash may be rendered with identifier escaping,
 * an "unrestricted" hash only with hash-name escaping.
 */
public record HashExtra(boolean identifier) implements TokenExtra {

    public static final HashExtra ID = new HashExtra(true);
    public static final HashExtra UNRESTRICTED = new HashExtra(false);

    @Override
    public String toString() {
        return identifier ? "id" : "unrestricted";
    }
}
