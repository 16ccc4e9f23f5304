package tech.footprint.scan_api.client;

/**
 * Status line and content type of an image URL, or the error that prevented reading them.
 */
public record ImageHead(
        Integer status,
        String contentType,
        String error
) {
    public static ImageHead of(int status, String contentType) {
        return new ImageHead(status, contentType, null);
    }

    public static ImageHead failed(String error) {
        return new ImageHead(null, null, error);
    }

    public boolean reachable() {
        return status != null;
    }
}
