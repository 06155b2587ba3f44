package com.vidnyan.calltree.adapter.out.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.calltree.adapter.out.parser.CSourceParser;
import com.vidnyan.calltree.adapter.out.parser.RteClassifier;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisRequest;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisResult;
import com.vidnyan.calltree.application.service.CallTreeAnalysisService;
import com.vidnyan.calltree.config.CallTreeConfiguration;
import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonCallGraphExporterTest {

    private static final String SOURCE = """
            FUNC(void, APP_CODE) App_Main(void)
            {
                if (mode == 1) {
                    Rte_Write_Out(1);
                }
                App_Main();
                Missing_Helper();
            }
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new CallTreeConfiguration().objectMapper();
    private CallTreeProperties properties;
    private AnalysisResult result;

    @BeforeEach
    void setUp() {
        properties = new CallTreeProperties();
        CallTreeAnalysisService service =
                new CallTreeAnalysisService(new CSourceParser(RteClassifier.standard()), properties);
        result = service.analyze(AnalysisRequest.forSources(
                List.of(SourceFile.of(Path.of("app.c"), SOURCE))).withRoot("App_Main", 2, true));
    }

    @Test
    void write_ShouldDescribeFunctionsAndEdges() throws IOException {
        JsonNode json = render();

        JsonNode function = json.get("functions").get(0);
        assertEquals("App_Main", function.get("name").asText());
        assertEquals("AUTOSAR_FUNC", function.get("kind").asText());
        assertEquals("APP_CODE", function.get("memoryClass").asText());
        assertEquals(1, function.get("startLine").asInt());
        assertEquals(8, function.get("endLine").asInt());

        JsonNode rte = function.get("calls").get(0);
        assertEquals("Rte_Write_Out", rte.get("callee").asText());
        assertTrue(rte.get("rte").asBoolean());
        assertTrue(rte.get("conditional").asBoolean());
        assertEquals("mode == 1", rte.get("condition").asText());
    }

    @Test
    void write_ShouldListUnresolvedCalleesAndCycles() throws IOException {
        JsonNode json = render();

        assertEquals(List.of("Missing_Helper", "Rte_Write_Out"),
                objectMapper.convertValue(json.get("unresolved"), List.class));
        assertEquals("App_Main -> App_Main", json.get("cycles").get(0).get("path").asText());
        assertEquals(1, json.get("summary").get("cycles").asInt());
        assertEquals("COMPLETE", json.get("files").get(0).get("status").asText());
    }

    @Test
    void write_ShouldNestCallTree() throws IOException {
        JsonNode tree = render().get("callTree");

        assertEquals("App_Main", tree.get("name").asText());
        assertEquals(3, tree.get("children").size());
        JsonNode self = tree.get("children").get(1);
        assertEquals("App_Main", self.get("name").asText());
        assertTrue(self.get("recursive").asBoolean());
    }

    @Test
    void consume_WithOutputFile_ShouldWriteFile() throws IOException {
        Path target = tempDir.resolve("out/report.json");
        properties.setOutputFile(target.toString());
        JsonCallGraphExporter exporter = new JsonCallGraphExporter(objectMapper, properties);

        exporter.consume(result);

        JsonNode json = objectMapper.readTree(Files.readString(target));
        assertEquals(1, json.get("summary").get("functionsDefined").asInt());
    }

    @Test
    void consume_WithoutOutputFile_ShouldWriteNothing() throws IOException {
        JsonCallGraphExporter exporter = new JsonCallGraphExporter(objectMapper, properties);

        exporter.consume(result);

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void write_SummaryShouldCountFunctionKinds() throws IOException {
        JsonNode summary = render().get("summary");

        assertEquals(1, summary.get("autosarFunctions").asInt());
        assertEquals(0, summary.get("staticFunctions").asInt());
        assertEquals(2, summary.get("unresolvedCallees").asInt());
    }

    private JsonNode render() throws IOException {
        StringWriter out = new StringWriter();
        new JsonCallGraphExporter(objectMapper, properties).write(result, out);
        return objectMapper.readTree(out.toString());
    }
}
