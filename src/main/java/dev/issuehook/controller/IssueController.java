package dev.issuehook.controller;

import dev.issuehook.dto.response.IssueResponse;
import dev.issuehook.service.IssueQueryService;
import org.springframework.data.web.PagedModel;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/issues")
public class IssueController {
    private final IssueQueryService queryService;
    public IssueController(IssueQueryService queryService) { this.queryService = queryService; }

    @GetMapping("/{issueId}")
    public ResponseEntity<IssueResponse> getIssue(@PathVariable long issueId) {
        return queryService.findById(issueId).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<PagedModel<IssueResponse>> getIssuesByRepo(@RequestParam String repository,
                                                                     @RequestParam(defaultValue = "0") int page,
                                                                     @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(new PagedModel<>(queryService.findByRepository(repository, page, size)));
    }
}
