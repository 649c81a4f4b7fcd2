package co.fanki.qualityhub.report.domain;

/**
 * A rendered report and the filename it is downloaded with.
 *
 * @param content the document bytes
 * @param filename the download filename
 * @param contentType the media type of the document
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReportExport(byte[] content, String filename,
        String contentType) {

    public static final String PDF = "application/pdf";

    public static final String XLSX =
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

}
