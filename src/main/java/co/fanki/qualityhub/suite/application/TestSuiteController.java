package co.fanki.qualityhub.suite.application;

import co.fanki.qualityhub.suite.domain.Section;
import co.fanki.qualityhub.suite.domain.TestSuite;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST controller for test suites and sections.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/suites")
@Tag(name = "Test Suites", description = "Suites and their section trees")
@SecurityRequirement(name = "bearerAuth")
public class TestSuiteController {

    private final TestSuiteService suiteService;

    /**
     * Creates a new TestSuiteController.
     *
     * @param theSuiteService the suite service
     */
    public TestSuiteController(final TestSuiteService theSuiteService) {
        this.suiteService = theSuiteService;
    }

    @Operation(summary = "Create a test suite")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Invalid input")
    })
    @PostMapping
    @PreAuthorize("hasAuthority('create_test_case')")
    public ResponseEntity<SuiteResponse> create(
            @PathVariable("projectId") final String projectId,
            @Valid @RequestBody final SuiteRequest request) {
        final TestSuite suite = suiteService.create(projectId, request.name(),
                request.description());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SuiteResponse.from(suite));
    }

    @Operation(summary = "List the project's test suites")
    @GetMapping
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<List<SuiteResponse>> list(
            @PathVariable("projectId") final String projectId) {
        return ResponseEntity.ok(suiteService.findByProject(projectId)
                .stream()
                .map(SuiteResponse::from)
                .toList());
    }

    @Operation(summary = "Get a test suite")
    @GetMapping("/{suiteId}")
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<SuiteResponse> get(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId) {
        return ResponseEntity.ok(SuiteResponse.from(
                suiteService.getById(projectId, suiteId)));
    }

    @Operation(summary = "Update a test suite")
    @PatchMapping("/{suiteId}")
    @PreAuthorize("hasAuthority('update_test_case')")
    public ResponseEntity<SuiteResponse> update(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId,
            @Valid @RequestBody final UpdateSuiteRequest request) {
        return ResponseEntity.ok(SuiteResponse.from(suiteService.update(
                projectId, suiteId, request.name(), request.description())));
    }

    @Operation(summary = "Delete a test suite and its sections")
    @DeleteMapping("/{suiteId}")
    @PreAuthorize("hasAuthority('delete_test_case')")
    public ResponseEntity<Void> delete(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId) {
        suiteService.delete(projectId, suiteId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Create a section")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404",
                    description = "Suite or parent section not found")
    })
    @PostMapping("/{suiteId}/sections")
    @PreAuthorize("hasAuthority('create_test_case')")
    public ResponseEntity<SectionResponse> createSection(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId,
            @Valid @RequestBody final SectionRequest request) {
        final Section section = suiteService.createSection(projectId, suiteId,
                request.parentId(), request.name(), request.position());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SectionResponse.from(section));
    }

    @Operation(summary = "List the sections of a suite")
    @GetMapping("/{suiteId}/sections")
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<List<SectionResponse>> sections(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId) {
        return ResponseEntity.ok(suiteService.sections(projectId, suiteId)
                .stream()
                .map(SectionResponse::from)
                .toList());
    }

    @Operation(summary = "Get a section")
    @GetMapping("/{suiteId}/sections/{sectionId}")
    @PreAuthorize("hasAuthority('view_test_case')")
    public ResponseEntity<SectionResponse> section(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId,
            @PathVariable("sectionId") final String sectionId) {
        return ResponseEntity.ok(SectionResponse.from(
                suiteService.getSection(projectId, suiteId, sectionId)));
    }

    @Operation(summary = "Update a section")
    @PatchMapping("/{suiteId}/sections/{sectionId}")
    @PreAuthorize("hasAuthority('update_test_case')")
    public ResponseEntity<SectionResponse> updateSection(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId,
            @PathVariable("sectionId") final String sectionId,
            @Valid @RequestBody final UpdateSectionRequest request) {
        return ResponseEntity.ok(SectionResponse.from(
                suiteService.updateSection(projectId, suiteId, sectionId,
                        request.parentId(), request.name(),
                        request.position())));
    }

    @Operation(summary = "Delete a section")
    @DeleteMapping("/{suiteId}/sections/{sectionId}")
    @PreAuthorize("hasAuthority('delete_test_case')")
    public ResponseEntity<Void> deleteSection(
            @PathVariable("projectId") final String projectId,
            @PathVariable("suiteId") final String suiteId,
            @PathVariable("sectionId") final String sectionId) {
        suiteService.deleteSection(projectId, suiteId, sectionId);
        return ResponseEntity.noContent().build();
    }

    /** Request to create a suite. */
    public record SuiteRequest(
            @NotBlank @Size(max = 255) String name,
            String description
    ) {}

    /** Partial update of a suite. */
    public record UpdateSuiteRequest(
            @Size(min = 1, max = 255) String name,
            String description
    ) {}

    /** Request to create a section. */
    public record SectionRequest(
            @NotBlank @Size(max = 255) String name,
            String parentId,
            @Min(0) Integer position
    ) {}

    /** Partial update of a section. */
    public record UpdateSectionRequest(
            @Size(min = 1, max = 255) String name,
            String parentId,
            @Min(0) Integer position
    ) {}

    /** Suite as returned by the API. */
    public record SuiteResponse(
            String id,
            String projectId,
            String name,
            String description,
            Instant createdAt
    ) {
        static SuiteResponse from(final TestSuite suite) {
            return new SuiteResponse(suite.id(), suite.projectId(),
                    suite.name(), suite.description(), suite.createdAt());
        }
    }

    /** Section as returned by the API. */
    public record SectionResponse(
            String id,
            String suiteId,
            String parentId,
            String name,
            int position,
            Instant createdAt
    ) {
        static SectionResponse from(final Section section) {
            return new SectionResponse(section.id(), section.suiteId(),
                    section.parentId(), section.name(), section.position(),
                    section.createdAt());
        }
    }

}
