package com.sparrowlogic.networktopology.controller;

import com.sparrowlogic.networktopology.ingest.SnapshotLoadException;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.service.MermaidDiagramService;
import com.sparrowlogic.networktopology.service.ReportService;
import com.sparrowlogic.networktopology.service.TopologyService;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;
import java.util.Map;

@Controller
public class DiagramController {

    private static final Logger log = LoggerFactory.getLogger(DiagramController.class);
    private static final List<Extension> MARKDOWN_EXTENSIONS = List.of(TablesExtension.create());

    private final TopologyService topologyService;
    private final MermaidDiagramService mermaidService;
    private final ReportService reportService;
    private final Parser markdownParser = Parser.builder().extensions(MARKDOWN_EXTENSIONS).build();
    // Resource tags end up in the report verbatim, so raw HTML in them must not reach the page.
    private final HtmlRenderer htmlRenderer = HtmlRenderer.builder()
            .extensions(MARKDOWN_EXTENSIONS)
            .escapeHtml(true)
            .sanitizeUrls(true)
            .build();

    public DiagramController(TopologyService topologyService, MermaidDiagramService mermaidService,
                             ReportService reportService) {
        this.topologyService = topologyService;
        this.mermaidService = mermaidService;
        this.reportService = reportService;
    }

    @GetMapping("/")
    public String showForm() {
        return "form";
    }

    @PostMapping("/generate")
    public String generateDiagram(@RequestParam(required = false) String dataDir, Model model) {
        try {
            var result = topologyService.analyze(dataDir);
            var diagram = mermaidService.generateDiagram(result.catalog());
            var markdown = reportService.generateReport(result);

            model.addAttribute("diagram", diagram);
            model.addAttribute("report", htmlRenderer.render(markdownParser.parse(markdown)));
            model.addAttribute("findings", result.findings());
            model.addAttribute("accountMode", ReportService.accountMode(result.catalog()));

            return "index";
        } catch (Exception e) {
            log.warn("Failed to analyse snapshot {}", dataDir, e);
            model.addAttribute("error", "Error loading network snapshot: " + e.getMessage());
            return "error";
        }
    }

    @GetMapping("/api/findings")
    @ResponseBody
    public List<Finding> findings(@RequestParam(required = false) String dataDir) {
        return topologyService.analyze(dataDir).findings();
    }

    @ExceptionHandler(SnapshotLoadException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    @ResponseBody
    public Map<String, String> snapshotNotFound(SnapshotLoadException e) {
        return Map.of("error", e.getMessage());
    }
}
