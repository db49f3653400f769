package com.jreinhal.docqa.controller;

import com.jreinhal.docqa.dto.AskRequest;
import com.jreinhal.docqa.dto.AskResponse;
import com.jreinhal.docqa.dto.QaResponse;
import com.jreinhal.docqa.dto.SessionIdsRequest;
import com.jreinhal.docqa.dto.SimilarityResponse;
import com.jreinhal.docqa.dto.UploadResult;
import com.jreinhal.docqa.service.DocumentIngestionService;
import com.jreinhal.docqa.service.DocumentQaService;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(value={"/api"})
public class DocumentQaController {
    private final DocumentIngestionService ingestionService;
    private final DocumentQaService qaService;

    public DocumentQaController(DocumentIngestionService ingestionService, DocumentQaService qaService) {
        this.ingestionService = ingestionService;
        this.qaService = qaService;
    }

    @PostMapping(value={"/upload"}, consumes={MediaType.MULTIPART_FORM_DATA_VALUE})
    public ResponseEntity<UploadResult> upload(@RequestPart("file") MultipartFile file, @RequestParam(required=false) String label) {
        return ResponseEntity.ok(this.ingestionService.ingest(file, label));
    }

    @PostMapping(value={"/upload/{sessionId}"}, consumes={MediaType.MULTIPART_FORM_DATA_VALUE})
    public ResponseEntity<?> attach(@PathVariable String sessionId, @RequestPart("file") MultipartFile file) {
        Optional<UploadResult> result = this.ingestionService.attach(sessionId, file);
        if (result.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Session not found or expired", "timestamp", Instant.now().toString()));
        }
        return ResponseEntity.ok(result.get());
    }

    @PostMapping(value={"/ask"})
    public AskResponse ask(@RequestBody AskRequest request) {
        return this.qaService.ask(request.question(), request.sessionIds());
    }

    @PostMapping(value={"/summarize"})
    public QaResponse summarize(@RequestBody SessionIdsRequest request) {
        return this.qaService.summarize(request.sessionIds());
    }

    @PostMapping(value={"/compare"})
    public QaResponse compare(@RequestBody SessionIdsRequest request) {
        return this.qaService.compare(request.sessionIds());
    }

    @PostMapping(value={"/similarity"})
    public SimilarityResponse similarity(@RequestBody SessionIdsRequest request) {
        return this.qaService.similarity(request.sessionIds());
    }
}
