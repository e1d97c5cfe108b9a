package vpnmanager.core.model.certificate;

/**
 * A 1-based page request whose values are always within bounds.
 *
 * <p>Use {@link #of(int, int, int, int)} to build one from untrusted input; it clamps
 * instead of failing.
 */
public record PageRequest(int page, int size) {

    public PageRequest {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (size < 1) {
            throw new IllegalArgumentException("size must be >= 1");
        }
    }

    /**
     * Builds a clamped page request.
     *
     * @param page requested page, values below 1 become 1
     * @param size requested size, values below 1 become {@code defaultSize}, values above max become max
     * @param defaultSize size used when the request carries no usable size
     * @param maxSize upper bound for the size
     */
    public static PageRequest of(int page, int size, int defaultSize, int maxSize) {
        final int clampedPage = Math.max(page, 1);
        final int effectiveSize = size < 1 ? defaultSize : size;
        final int clampedSize = Math.max(1, Math.min(effectiveSize, maxSize));
        return new PageRequest(clampedPage, clampedSize);
    }

    /**
     * Zero-based offset of the first item. Saturates instead of overflowing.
     */
    public long offset() {
        return (long) (page - 1) * size;
    }
}
