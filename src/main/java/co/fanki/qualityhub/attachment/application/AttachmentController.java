package co.fanki.qualityhub.attachment.application;

import co.fanki.qualityhub.attachment.application.AttachmentService.Download;
import co.fanki.qualityhub.attachment.domain.Attachment;
import co.fanki.qualityhub.attachment.domain.AttachmentEntityType;
import co.fanki.qualityhub.attachment.domain.StorageException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

/**
 * REST controller for files attached to test cases, results, runs and
 * requirements.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/attachments")
@Tag(name = "Attachments", description = "Files attached to project entities")
@SecurityRequirement(name = "bearerAuth")
public class AttachmentController {

    private static final String CAN_ATTACH = "hasAnyAuthority("
            + "'update_test_case', 'add_test_result', 'update_requirement')";

    private final AttachmentService attachmentService;

    /**
     * Creates a new AttachmentController.
     *
     * @param theAttachmentService the attachment service
     */
    public AttachmentController(final AttachmentService theAttachmentService) {
        this.attachmentService = theAttachmentService;
    }

    @Operation(summary = "Upload a file and attach it to an entity")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Uploaded"),
            @ApiResponse(responseCode = "400",
                    description = "Missing file, unknown entity type or "
                            + "file type not allowed"),
            @ApiResponse(responseCode = "413", description = "File too large")
    })
    @PostMapping(path = "/upload",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize(CAN_ATTACH)
    public ResponseEntity<AttachmentResponse> upload(
            @PathVariable("projectId") final String projectId,
            @RequestParam("file") final MultipartFile file,
            @RequestParam("entityType") final String entityType,
            @RequestParam("entityId") final String entityId) {
        final AttachmentEntityType type = AttachmentEntityType.fromValue(
                entityType);
        try (InputStream content = file.getInputStream()) {
            final Attachment attachment = attachmentService.upload(projectId,
                    type, entityId, file.getOriginalFilename(),
                    file.getContentType(), file.getSize(), content);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(AttachmentResponse.from(attachment));
        } catch (final IOException e) {
            throw new StorageException("Failed to read uploaded file", e);
        }
    }

    @Operation(summary = "List the project's attachments, newest first")
    @GetMapping
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<List<AttachmentResponse>> list(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(attachmentService.findByProject(projectId)
                .stream()
                .map(AttachmentResponse::from)
                .toList());
    }

    @Operation(summary = "List the attachments of one entity")
    @GetMapping("/by-entity")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<List<AttachmentResponse>> listByEntity(
            @PathVariable("projectId") final String projectId,
            @RequestParam("entityType") final String entityType,
            @RequestParam("entityId") final String entityId) {
        return ResponseEntity.ok(attachmentService.findByEntity(projectId,
                AttachmentEntityType.fromValue(entityType), entityId)
                .stream()
                .map(AttachmentResponse::from)
                .toList());
    }

    @Operation(summary = "Get an attachment")
    @GetMapping("/{attachmentId}")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<AttachmentResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("attachmentId") final String attachmentId) {
        return ResponseEntity.ok(AttachmentResponse.from(
                attachmentService.getById(projectId, attachmentId)));
    }

    @Operation(summary = "Download the attached file")
    @GetMapping("/{attachmentId}/download")
    @PreAuthorize("hasAuthority('view_project')")
    public ResponseEntity<byte[]> download(
            @PathVariable("projectId") final String projectId,
            @PathVariable("attachmentId") final String attachmentId) {
        final Download download = attachmentService.download(projectId,
                attachmentId);
        final Attachment attachment = download.attachment();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(attachment.mimeType()))
                .contentLength(download.content().length)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition
                        .attachment()
                        .filename(attachment.filename(),
                                StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(download.content());
    }

    @Operation(summary = "Rename an attachment")
    @PatchMapping("/{attachmentId}")
    @PreAuthorize(CAN_ATTACH)
    public ResponseEntity<AttachmentResponse> rename(
            @PathVariable("projectId") final String projectId,
            @PathVariable("attachmentId") final String attachmentId,
            @Valid @RequestBody final RenameAttachmentRequest request) {
        return ResponseEntity.ok(AttachmentResponse.from(
                attachmentService.rename(projectId, attachmentId,
                        request.filename())));
    }

    @Operation(summary = "Delete an attachment and its file")
    @DeleteMapping("/{attachmentId}")
    @PreAuthorize(CAN_ATTACH)
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("attachmentId") final String attachmentId) {
        attachmentService.delete(projectId, attachmentId);
        return ResponseEntity.noContent().build();
    }

    /** New download name of an attachment. */
    public record RenameAttachmentRequest(
            @NotBlank @Size(max = 255) String filename
    ) {}

    /** Attachment as returned by the API. */
    public record AttachmentResponse(
            String id,
            String projectId,
            AttachmentEntityType entityType,
            String entityId,
            String filename,
            long size,
            String mimeType,
            Instant createdAt
    ) {
        static AttachmentResponse from(final Attachment attachment) {
            return new AttachmentResponse(attachment.id(),
                    attachment.projectId(), attachment.entityType(),
                    attachment.entityId(), attachment.filename(),
                    attachment.size(), attachment.mimeType(),
                    attachment.createdAt());
        }
    }

}
