package co.fanki.qualityhub.attachment.domain;

/**
 * Outcome of storing an uploaded file.
 *
 * @param path location relative to the storage root
 * @param size the size in bytes
 * @param mimeType the content type
 * @param originalFilename the name the client uploaded the file with
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record StoredFile(
        String path,
        long size,
        String mimeType,
        String originalFilename
) {}
