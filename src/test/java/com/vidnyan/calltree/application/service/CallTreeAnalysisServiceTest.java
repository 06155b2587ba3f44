package com.vidnyan.calltree.application.service;

import com.vidnyan.calltree.adapter.out.parser.CSourceParser;
import com.vidnyan.calltree.adapter.out.parser.RteClassifier;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisRequest;
import com.vidnyan.calltree.application.port.in.AnalyzeCallTreeUseCase.AnalysisResult;
import com.vidnyan.calltree.application.port.out.SourceCodeParser;
import com.vidnyan.calltree.config.CallTreeProperties;
import com.vidnyan.calltree.domain.graph.Cycle;
import com.vidnyan.calltree.domain.model.FileScanResult;
import com.vidnyan.calltree.domain.model.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallTreeAnalysisServiceTest {

    private CallTreeProperties properties;
    private CallTreeAnalysisService service;

    @BeforeEach
    void setUp() {
        properties = new CallTreeProperties();
        properties.setWorkerThreads(4);
        service = new CallTreeAnalysisService(new CSourceParser(RteClassifier.standard()), properties);
    }

    @Test
    void analyze_ShouldMergeFilesIntoOneGraph() {
        List<SourceFile> sources = List.of(
                SourceFile.of(Path.of("a.c"), "void A(void) { B(); Rte_Read_In(); }\n"),
                SourceFile.of(Path.of("b.c"), "void B(void) { C(); }\n"),
                SourceFile.of(Path.of("c.c"), "void C(void) { }\n"));

        AnalysisResult result = service.analyze(AnalysisRequest.forSources(sources));

        assertEquals(List.of("B", "Rte_Read_In"), result.graph().getCallees("A"));
        assertTrue(result.graph().isDefined("C"));
        assertFalse(result.graph().isDefined("Rte_Read_In"));
        assertFalse(result.hasCycles());
        assertNull(result.callTree());
        assertEquals(3, result.stats().filesComplete());
        assertEquals(3, result.stats().functionsDefined());
        assertEquals(3, result.stats().callEdges());
        assertEquals(1, result.stats().rteEdges());
        assertEquals(1, result.stats().unresolvedCallees());
    }

    @Test
    void analyze_ShouldKeepInputOrderOfFileResults() {
        List<SourceFile> sources = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            sources.add(SourceFile.of(Path.of("f" + i + ".c"), "void F" + i + "(void) { G(); }\n"));
        }

        AnalysisResult result = service.analyze(AnalysisRequest.forSources(sources));

        for (int i = 0; i < 20; i++) {
            assertEquals(Path.of("f" + i + ".c"), result.files().get(i).path());
        }
        assertEquals(20, result.graph().getCallers("G").size());
    }

    @Test
    void analyze_CycleAcrossFiles_ShouldBeDetected() {
        List<SourceFile> sources = List.of(
                SourceFile.of(Path.of("ping.c"), "void Ping(void) { Pong(); }\n"),
                SourceFile.of(Path.of("pong.c"), "void Pong(void) { Ping(); }\n"));

        AnalysisResult result = service.analyze(AnalysisRequest.forSources(sources));

        assertEquals(List.of(new Cycle(List.of("Ping", "Pong"))), result.cycles());
        assertEquals(1, result.stats().cyclesFound());
    }

    @Test
    void analyze_RecursionFixture_ShouldFindEveryCycle() throws Exception {
        Path fixture = Path.of(getClass().getResource("/fixtures/traditional/recursion.c").toURI());

        AnalysisResult result = service.analyze(AnalysisRequest.forSources(List.of(SourceFile.onDisk(fixture))));

        assertEquals(List.of(
                new Cycle(List.of("Cycle_X", "Cycle_Y", "Cycle_Z")),
                new Cycle(List.of("Ping", "Pong")),
                new Cycle(List.of("Self_Recurse"))), result.cycles());
    }

    @Test
    void analyze_ShouldCountStaticAndAutosarFunctions() {
        List<SourceFile> sources = List.of(SourceFile.of(Path.of("mix.c"), """
                static void Local(void) { }
                STATIC FUNC(void, APP_CODE) Wrapped(void) { }
                void Plain(void);
                void Plain(void) { Local(); }
                """));

        AnalysisResult result = service.analyze(AnalysisRequest.forSources(sources));

        assertEquals(3, result.stats().functionsDefined());
        assertEquals(2, result.stats().staticFunctions());
        assertEquals(1, result.stats().autosarFunctions());
        assertEquals(1, result.stats().declarations());
        assertEquals(0, result.stats().unresolvedCallees());
    }

    @Test
    void analyze_WithRoot_ShouldBuildCallTree() {
        List<SourceFile> sources = List.of(SourceFile.of(Path.of("main.c"), """
                void Main(void) { Init(); Rte_Call_Op(); }
                void Init(void) { Hw(); }
                """));

        AnalysisResult result = service.analyze(
                AnalysisRequest.forSources(sources).withRoot("Main", 3, false));

        assertNotNull(result.callTree());
        assertEquals(List.of("Main", "Init", "Hw"),
                result.callTree().functionNames().stream().toList());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void analyze_UnknownRoot_ShouldReportError() {
        List<SourceFile> sources = List.of(SourceFile.of(Path.of("main.c"), "void Main(void) { }\n"));

        AnalysisResult result = service.analyze(
                AnalysisRequest.forSources(sources).withRoot("Nope", 3, true));

        assertNull(result.callTree());
        assertEquals(List.of("Function 'Nope' not found"), result.errors());
        assertTrue(result.graph().isDefined("Main"));
    }

    @Test
    void analyze_UnreadableFile_ShouldNotStopOtherFiles() {
        SourceFile broken = new SourceFile() {
            @Override
            public Path path() {
                return Path.of("broken.c");
            }

            @Override
            public String read() throws IOException {
                throw new IOException("Permission denied");
            }
        };
        List<SourceFile> sources = List.of(broken, SourceFile.of(Path.of("ok.c"), "void Ok(void) { }\n"));

        AnalysisResult result = service.analyze(AnalysisRequest.forSources(sources));

        assertEquals(FileScanResult.Status.FAILED, result.files().get(0).status());
        assertEquals(FileScanResult.Status.COMPLETE, result.files().get(1).status());
        assertEquals(1, result.stats().filesFailed());
        assertTrue(result.graph().isDefined("Ok"));
    }

    @Test
    void analyze_ParserCrash_ShouldMarkFileFailed() {
        SourceCodeParser crashing = source -> {
            if (source.path().toString().equals("bad.c")) {
                throw new IllegalStateException("boom");
            }
            return new CSourceParser(RteClassifier.standard()).parse(source);
        };
        CallTreeAnalysisService crashingService = new CallTreeAnalysisService(crashing, properties);
        List<SourceFile> sources = List.of(
                SourceFile.of(Path.of("bad.c"), "void Bad(void) { }\n"),
                SourceFile.of(Path.of("good.c"), "void Good(void) { }\n"));

        AnalysisResult result = crashingService.analyze(AnalysisRequest.forSources(sources));

        assertEquals(FileScanResult.Status.FAILED, result.files().get(0).status());
        assertTrue(result.files().get(0).diagnostics().get(0).contains("boom"));
        assertTrue(result.graph().isDefined("Good"));
    }

    @Test
    void analyze_StopRequested_ShouldSkipRemainingFiles() {
        List<SourceFile> sources = List.of(
                SourceFile.of(Path.of("a.c"), "void A(void) { }\n"),
                SourceFile.of(Path.of("b.c"), "void B(void) { }\n"));

        AnalysisResult result = service.analyze(
                AnalysisRequest.forSources(sources).withStopSignal(() -> true));

        assertEquals(2, result.stats().filesSkipped());
        assertEquals(0, result.graph().size());
    }

    @Test
    void analyze_NoSources_ShouldGiveEmptyResult() {
        AnalysisResult result = service.analyze(AnalysisRequest.forSources(List.of()));

        assertTrue(result.files().isEmpty());
        assertEquals(0, result.graph().size());
        assertFalse(result.hasCycles());
    }

    @Test
    void request_NegativeDepth_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisRequest.forSources(List.of()).withRoot("Main", -1, true));
    }

    @Test
    void request_BlankRoot_ShouldMeanNoTree() {
        assertNull(AnalysisRequest.forSources(List.of()).withRoot("  ", 3, true).rootFunction());
    }
}
