package ch.so.arp.pdfrag.ingest;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import ch.so.arp.pdfrag.exception.ExtractionException;

/**
 * REST endpoint accepting PDF uploads. The file is read into memory and handed to
 * the {@link IngestionService}; nothing is written to disk.
 */
@RestController
@RequestMapping(path = "/api/upload", produces = MediaType.APPLICATION_JSON_VALUE)
public class DocumentController {

    private static final String UNNAMED = "unnamed.pdf";

    private final IngestionService ingestionService;

    public DocumentController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CompletableFuture<UploadResponse> upload(@RequestParam("file") MultipartFile file) {
        String filename = StringUtils.hasText(file.getOriginalFilename())
                ? StringUtils.getFilename(file.getOriginalFilename())
                : UNNAMED;
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ExtractionException(filename, "the upload could not be read", ex);
        }
        return ingestionService.ingestAsync(content, filename).thenApply(UploadResponse::from);
    }
}
