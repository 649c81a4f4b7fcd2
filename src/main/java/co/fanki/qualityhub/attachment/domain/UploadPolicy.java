package co.fanki.qualityhub.attachment.domain;

import co.fanki.qualityhub.shared.DomainException;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Upload rules every storage backend applies: size limit, accepted MIME
 * types and the layout of stored paths.
 *
 * <p>Stored paths look like {@code <yyyy>/<MM>/<uuid><ext>}. Only the
 * extension of the client's filename is kept.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class UploadPolicy {

    static final Set<String> ALLOWED_MIME_TYPES = Set.of(
            "image/jpeg",
            "image/png",
            "image/gif",
            "image/webp",
            "application/pdf",
            "text/plain",
            "text/csv",
            "application/json",
            "application/xml",
            "application/zip",
            "video/mp4",
            "video/webm");

    private final long maxFileSize;

    /**
     * Creates a new UploadPolicy.
     *
     * @param theMaxFileSize the largest accepted file, in bytes
     */
    public UploadPolicy(final long theMaxFileSize) {
        this.maxFileSize = theMaxFileSize;
    }

    /**
     * Rejects files over the size limit or of a type not accepted.
     *
     * @param mimeType the declared MIME type
     * @param size the declared size, in bytes
     * @throws DomainException FILE_TOO_LARGE or FILE_TYPE_NOT_ALLOWED
     */
    public void check(final String mimeType, final long size) {
        if (size > maxFileSize) {
            throw new DomainException("File size exceeds maximum allowed size"
                    + " of " + maxFileSize + " bytes", "FILE_TOO_LARGE");
        }
        if (!isAllowed(mimeType)) {
            throw new DomainException("File type " + mimeType
                    + " is not allowed", "FILE_TYPE_NOT_ALLOWED");
        }
    }

    public long maxFileSize() {
        return maxFileSize;
    }

    /**
     * Builds a fresh stored path for an upload.
     *
     * @param originalFilename the client's filename, may be null
     * @param day the upload day, picks the year and month folders
     * @return the relative path, never null
     */
    static String pathFor(final String originalFilename, final LocalDate day) {
        return String.format("%04d/%02d/%s%s", day.getYear(),
                day.getMonthValue(), UUID.randomUUID(),
                extensionOf(originalFilename));
    }

    static boolean isAllowed(final String mimeType) {
        if (mimeType == null) {
            return false;
        }
        final int parameters = mimeType.indexOf(';');
        final String baseType = parameters >= 0
                ? mimeType.substring(0, parameters) : mimeType;
        return ALLOWED_MIME_TYPES.contains(
                baseType.trim().toLowerCase(Locale.ROOT));
    }

    static String extensionOf(final String filename) {
        if (filename == null) {
            return "";
        }
        final String name = filename.substring(Math.max(
                filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        final int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        final String extension = name.substring(dot).toLowerCase(Locale.ROOT);
        return extension.matches("\\.[a-z0-9]{1,10}") ? extension : "";
    }

}
