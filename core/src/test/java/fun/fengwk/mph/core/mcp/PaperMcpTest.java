package fun.fengwk.mph.core.mcp;

import fun.fengwk.mph.core.service.acquire.PaperAcquisitionService;
import fun.fengwk.mph.core.service.acquire.model.AcquisitionRequest;
import fun.fengwk.mph.core.service.acquire.model.PaperDownloadRequest;
import fun.fengwk.mph.core.service.acquire.model.PaperDownloadResponse;
import fun.fengwk.mph.core.service.convert.PdfConversionService;
import fun.fengwk.mph.core.service.convert.model.ConversionOutcome;
import fun.fengwk.mph.core.service.convert.model.PdfConvertRequest;
import fun.fengwk.mph.core.service.crawl.PaperSearchService;
import fun.fengwk.mph.core.service.crawl.model.PaperSearchRequest;
import fun.fengwk.mph.core.service.crawl.model.PaperSearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
public class PaperMcpTest {

    @Mock
    private PaperSearchService paperSearchService;

    @Mock
    private PaperAcquisitionService paperAcquisitionService;

    @Mock
    private PdfConversionService pdfConversionService;

    @Mock
    private McpFormatter mcpFormatter;

    private PaperMcp paperMcp;

    @BeforeEach
    void setUp() {
        paperMcp = new PaperMcp(paperSearchService, paperAcquisitionService, pdfConversionService, mcpFormatter);
    }

    @Test
    public void testPaperSearch() {
        PaperSearchResponse response = PaperSearchResponse.builder().statusCode(200).records(List.of()).build();
        when(paperSearchService.search(any(PaperSearchRequest.class))).thenReturn(response);
        when(mcpFormatter.format("mph_paper_search_result.ftl", response)).thenReturn("No results.");

        String result = paperMcp.paperSearch("知识图谱", 5, "cited", false, List.of("title"), null);
        log.info("paper_search result:\n{}", result);

        assertThat(result).isEqualTo("No results.");
        ArgumentCaptor<PaperSearchRequest> request = ArgumentCaptor.forClass(PaperSearchRequest.class);
        verify(paperSearchService).search(request.capture());
        assertThat(request.getValue().getKeyword()).isEqualTo("知识图谱");
        assertThat(request.getValue().getMaxResults()).isEqualTo(5);
        assertThat(request.getValue().getSortOrder()).isEqualTo("cited");
        assertThat(request.getValue().getGetDetails()).isFalse();
        assertThat(request.getValue().getFields()).containsExactly("title");
    }

    @Test
    public void testPaperDownloadWrapsSingleItem() {
        PaperDownloadResponse response = PaperDownloadResponse.builder().statusCode(200).build();
        when(paperAcquisitionService.download(any(PaperDownloadRequest.class))).thenReturn(response);
        when(mcpFormatter.format("mph_paper_download_result.ftl", response)).thenReturn("ok");

        String result = paperMcp.paperDownload("Title", "10.1/x", null, List.of("scihub"), "/tmp/papers");

        assertThat(result).isEqualTo("ok");
        ArgumentCaptor<PaperDownloadRequest> request = ArgumentCaptor.forClass(PaperDownloadRequest.class);
        verify(paperAcquisitionService).download(request.capture());
        assertThat(request.getValue().getItems()).containsExactly(
            AcquisitionRequest.builder().title("Title").doi("10.1/x").build());
        assertThat(request.getValue().getSources()).containsExactly("scihub");
        assertThat(request.getValue().getDownloadDir()).isEqualTo("/tmp/papers");
        assertThat(request.getValue().getStopOnFailure()).isFalse();
    }

    @Test
    public void testPaperDownloadBatch() {
        List<AcquisitionRequest> items = List.of(
            AcquisitionRequest.builder().doi("10.1/a").build(),
            AcquisitionRequest.builder().title("B").build());
        PaperDownloadResponse response = PaperDownloadResponse.builder().statusCode(200).build();
        when(paperAcquisitionService.download(any(PaperDownloadRequest.class))).thenReturn(response);
        when(mcpFormatter.format("mph_paper_download_result.ftl", response)).thenReturn("ok");

        paperMcp.paperDownloadBatch(items, null, null, true);

        ArgumentCaptor<PaperDownloadRequest> request = ArgumentCaptor.forClass(PaperDownloadRequest.class);
        verify(paperAcquisitionService).download(request.capture());
        assertThat(request.getValue().getItems()).isEqualTo(items);
        assertThat(request.getValue().getStopOnFailure()).isTrue();
    }

    @Test
    public void testPdfConvert() {
        ConversionOutcome outcome = ConversionOutcome.builder().success(true).build();
        when(pdfConversionService.convert(any(PdfConvertRequest.class))).thenReturn(outcome);
        when(mcpFormatter.format("mph_pdf_convert_result.ftl", outcome)).thenReturn("Markdown: /tmp/a.md");

        String result = paperMcp.pdfConvert("/tmp/a.pdf", null, null);

        assertThat(result).isEqualTo("Markdown: /tmp/a.md");
        ArgumentCaptor<PdfConvertRequest> request = ArgumentCaptor.forClass(PdfConvertRequest.class);
        verify(pdfConversionService).convert(request.capture());
        assertThat(request.getValue().getPdfPath()).isEqualTo("/tmp/a.pdf");
    }

}
