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
import fun.fengwk.mph.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class PaperMcp {

    private final PaperSearchService paperSearchService;
    private final PaperAcquisitionService paperAcquisitionService;
    private final PdfConversionService pdfConversionService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "paper_search",
        description = """
            Search the CNKI literature portal and optionally crawl every result's detail page.
            Return format: numbered records with title, authors, source, dates, counters and, with details, \
            abstract, keywords, doi and organization; or 'No results.'; or an error message.
            A blocked session returns the records collected so far with a warning.""",
        resultConverter = StringToolCallResultConverter.class)
    public String paperSearch(
        @ToolParam(description = "search keyword") String keyword,
        @ToolParam(description = "max results, default 20", required = false) Integer maxResults,
        @ToolParam(description = "sort order: relevance/date/cited/download, default relevance", required = false)
        String sortOrder,
        @ToolParam(description = "whether to crawl detail pages, default true", required = false) Boolean getDetails,
        @ToolParam(description = """
            record fields to keep, default all: title, link, authors, source, pubDate, citeCount, downloadCount, \
            abstract, keywords, doi, organization, crawlTime""", required = false) List<String> fields,
        @ToolParam(description = "optional json file path the records are saved to", required = false)
        String outputPath
    ) {
        PaperSearchRequest request = PaperSearchRequest.builder()
            .keyword(keyword)
            .maxResults(maxResults)
            .sortOrder(sortOrder)
            .getDetails(getDetails)
            .fields(fields)
            .outputPath(outputPath)
            .build();
        PaperSearchResponse response = paperSearchService.search(request);
        return mcpFormatter.format("mph_paper_search_result.ftl", response);
    }

    @Tool(name = "paper_download",
        description = """
            Download the PDF of one paper, trying cnki, scihub, scihub_title, annas_archive and google_scholar in order.
            At least one of title and doi is required, cnki needs the detail page link.
            Return format: the saved file path and the attempted sources; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String paperDownload(
        @ToolParam(description = "paper title", required = false) String title,
        @ToolParam(description = "paper doi, e.g. 10.1038/nature12373", required = false) String doi,
        @ToolParam(description = "cnki detail page link", required = false) String link,
        @ToolParam(description = "sources in attempt order, default all applicable", required = false)
        List<String> sources,
        @ToolParam(description = "download directory, default the configured one", required = false)
        String downloadDir
    ) {
        PaperDownloadRequest request = PaperDownloadRequest.builder()
            .items(List.of(AcquisitionRequest.builder().title(title).doi(doi).link(link).build()))
            .sources(sources)
            .downloadDir(downloadDir)
            .stopOnFailure(false)
            .build();
        PaperDownloadResponse response = paperAcquisitionService.download(request);
        return mcpFormatter.format("mph_paper_download_result.ftl", response);
    }

    @Tool(name = "paper_download_batch",
        description = """
            Download the PDFs of several papers one after another with a randomized delay in between.
            Return format: per paper result with the saved file path or the failure reason; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String paperDownloadBatch(
        @ToolParam(description = "papers, each with title and/or doi and an optional cnki link")
        List<AcquisitionRequest> items,
        @ToolParam(description = "sources in attempt order, default all applicable", required = false)
        List<String> sources,
        @ToolParam(description = "download directory, default the configured one", required = false)
        String downloadDir,
        @ToolParam(description = "stop at the first failed paper, default false", required = false)
        Boolean stopOnFailure
    ) {
        PaperDownloadRequest request = PaperDownloadRequest.builder()
            .items(items)
            .sources(sources)
            .downloadDir(downloadDir)
            .stopOnFailure(stopOnFailure)
            .build();
        PaperDownloadResponse response = paperAcquisitionService.download(request);
        return mcpFormatter.format("mph_paper_download_result.ftl", response);
    }

    @Tool(name = "pdf_convert",
        description = """
            Convert a PDF to Markdown. The document is sampled and classified first, text layer documents use local \
            extraction, scanned or garbled ones use OCR when an OCR api key is configured.
            Return format: markdown file path, backend, classification and page/image counts; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String pdfConvert(
        @ToolParam(description = "absolute pdf file path") String pdfPath,
        @ToolParam(description = "output directory, default next to the pdf", required = false) String outputDir,
        @ToolParam(description = "output file name without extension, default the pdf name", required = false)
        String outputName
    ) {
        PdfConvertRequest request = PdfConvertRequest.builder()
            .pdfPath(pdfPath)
            .outputDir(outputDir)
            .outputName(outputName)
            .build();
        ConversionOutcome outcome = pdfConversionService.convert(request);
        return mcpFormatter.format("mph_pdf_convert_result.ftl", outcome);
    }

}
