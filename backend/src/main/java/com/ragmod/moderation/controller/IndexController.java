package com.ragmod.moderation.controller;

import java.io.IOException;
import java.nio.file.Paths;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.ragmod.moderation.dto.IndexBuildRequest;
import com.ragmod.moderation.dto.IndexStatusResponse;
import com.ragmod.moderation.service.index.IndexLifecycleService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/index")
@RequiredArgsConstructor
@Tag(name = "Index", description = "Local vector index administration")
public class IndexController {

  private final IndexLifecycleService indexLifecycleService;

  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Index status")
  public ResponseEntity<IndexStatusResponse> status() {
    return ResponseEntity.ok(indexLifecycleService.status());
  }

  @PostMapping(value = "/reload", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Reload the persisted index",
      description =
          "Reads the index files from the index directory, optionally downloading them from S3"
              + " first, and swaps the result in for new requests")
  public ResponseEntity<IndexStatusResponse> reload(
      @Parameter(description = "Download index files from S3 before loading")
          @RequestParam(value = "from_artifacts", defaultValue = "false")
          boolean fromArtifacts)
      throws IOException {
    log.info("Index reload requested (from_artifacts={})", fromArtifacts);
    return ResponseEntity.ok(indexLifecycleService.reload(fromArtifacts));
  }

  @PostMapping(
      value = "/build",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Build a new index from a corpus",
      description =
          "Embeds every labeled record of a JSONL corpus in the background; the new index replaces"
              + " the current one when complete")
  public ResponseEntity<IndexStatusResponse> build(@Valid @RequestBody IndexBuildRequest request) {
    log.info("Index build requested from {}", request.getCorpusPath());
    indexLifecycleService.buildFromCorpusAsync(
        Paths.get(request.getCorpusPath()), request.isUpload());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(indexLifecycleService.status());
  }
}
