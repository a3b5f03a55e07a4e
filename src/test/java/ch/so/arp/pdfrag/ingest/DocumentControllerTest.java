package ch.so.arp.pdfrag.ingest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import ch.so.arp.pdfrag.exception.ExtractionException;
import ch.so.arp.pdfrag.web.RestExceptionHandler;

class DocumentControllerTest {

    private IngestionService ingestionService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ingestionService = mock(IngestionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DocumentController(ingestionService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void returnsIngestionSummary() throws Exception {
        byte[] content = new byte[] { 1, 2, 3 };
        when(ingestionService.ingestAsync(any(byte[].class), eq("plan.pdf"))).thenReturn(
                CompletableFuture.completedFuture(IngestionResult.processed("plan.pdf", "abc123", 4)));

        MvcResult result = mockMvc.perform(multipart("/api/upload")
                        .file(new MockMultipartFile("file", "plan.pdf", "application/pdf", content)))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Document 'plan.pdf' processed and stored successfully (4 chunks)."))
                .andExpect(jsonPath("$.filename").value("plan.pdf"))
                .andExpect(jsonPath("$.fingerprint").value("abc123"))
                .andExpect(jsonPath("$.chunkCount").value(4))
                .andExpect(jsonPath("$.outcome").value("PROCESSED"));
        verify(ingestionService).ingestAsync(content, "plan.pdf");
    }

    @Test
    void namesUploadsWithoutFilename() throws Exception {
        when(ingestionService.ingestAsync(any(byte[].class), eq("unnamed.pdf"))).thenReturn(
                CompletableFuture.completedFuture(IngestionResult.noContent("unnamed.pdf")));

        MvcResult result = mockMvc.perform(multipart("/api/upload")
                        .file(new MockMultipartFile("file", "", "application/pdf", new byte[] { 1 })))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("NO_CONTENT"));
    }

    @Test
    void mapsExtractionFailuresToUnprocessableEntity() throws Exception {
        when(ingestionService.ingestAsync(any(byte[].class), eq("broken.pdf"))).thenReturn(
                CompletableFuture.failedFuture(new ExtractionException("broken.pdf", "the content is not a valid PDF")));

        MvcResult result = mockMvc.perform(multipart("/api/upload")
                        .file(new MockMultipartFile("file", "broken.pdf", "application/pdf", new byte[] { 1 })))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DOCUMENT_001"))
                .andExpect(jsonPath("$.path").value("/api/upload"));
    }

    @Test
    void rejectsRequestsWithoutFile() throws Exception {
        mockMvc.perform(multipart("/api/upload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }
}
