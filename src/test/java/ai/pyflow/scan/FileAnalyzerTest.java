package ai.pyflow.scan;

import static ai.pyflow.scan.AnalyzerTestSupport.path;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import ai.pyflow.graph.CollisionPolicy;
import ai.pyflow.graph.SequenceCounter;
import ai.pyflow.graph.SymbolTable;
import ai.pyflow.model.CallEdge;
import ai.pyflow.model.FileRecord;
import ai.pyflow.model.ImportRef;

public class FileAnalyzerTest {

    @Test
    void bareCallToFunctionInOtherFileProducesEdge() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "def helper():",
                        "    return 1")
                .add("b.py",
                        "def main():",
                        "    helper()");
        final List<FileRecord> records = support.analyzeAll();

        final FileRecord b = support.record(records, "b.py");
        assertEquals(1, b.callEdges().size(), "edges: " + b.callEdges());
        final CallEdge edge = b.callEdges().get(0);
        assertEquals(path("b.py"), edge.caller());
        assertEquals(path("a.py"), edge.callee());
        assertEquals("helper", edge.name());
        assertEquals(Set.of("main"), b.functions());
        assertTrue(support.record(records, "a.py").callEdges().isEmpty());
    }

    @Test
    void callsWithinSameFileAreNotEdges() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "def helper():",
                        "    return 1",
                        "",
                        "def main():",
                        "    helper()");
        final FileRecord a = support.record(support.analyzeAll(), "a.py");

        assertTrue(a.callEdges().isEmpty());
        assertEquals(0, a.unresolvedCalls());
    }

    @Test
    void attributeChainResolvesToDottedName() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("factory.py",
                        "class Factory:",
                        "    @staticmethod",
                        "    def make():",
                        "        return Factory()")
                .add("client.py",
                        "def build():",
                        "    return Factory.make()");
        final FileRecord client = support.record(support.analyzeAll(), "client.py");

        assertEquals(1, client.callEdges().size(), "edges: " + client.callEdges());
        assertEquals("Factory.make", client.callEdges().get(0).name());
        assertEquals(path("factory.py"), client.callEdges().get(0).callee());
    }

    @Test
    void methodCallThroughVariableStaysUnresolved() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "class Worker:",
                        "    def run(self):",
                        "        pass")
                .add("b.py",
                        "def go(worker):",
                        "    worker.run()");
        final FileRecord b = support.record(support.analyzeAll(), "b.py");

        assertTrue(b.callEdges().isEmpty(), "edges: " + b.callEdges());
        assertEquals(1, b.unresolvedCalls());
    }

    @Test
    void callOnConstructorResultOnlyResolvesTheConstructor() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "class Worker:",
                        "    def run(self):",
                        "        pass",
                        "",
                        "def run():",
                        "    pass")
                .add("b.py",
                        "def go():",
                        "    Worker().run()");
        final FileRecord b = support.record(support.analyzeAll(), "b.py");

        // ".run()" on a call result has no identifier base; it must not fall back to the top-level "run"
        assertEquals(List.of("Worker"), b.callEdges().stream().map(CallEdge::name).toList());
        assertEquals(1, b.unresolvedCalls());
    }

    @Test
    void computedCallShapesAreIgnored() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "def join():",
                        "    pass")
                .add("b.py",
                        "handlers = []",
                        "handlers[0]()",
                        "\",\".join([])",
                        "(lambda: 1)()");
        final FileRecord b = support.record(support.analyzeAll(), "b.py");

        assertTrue(b.callEdges().isEmpty(), "edges: " + b.callEdges());
        assertEquals(3, b.unresolvedCalls());
    }

    @Test
    void lookupIsExactAndCaseSensitive() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "def foo():",
                        "    pass")
                .add("b.py",
                        "import a",
                        "Foo()",
                        "FOO()",
                        "a.foo()");
        final FileRecord b = support.record(support.analyzeAll(), "b.py");

        assertTrue(b.callEdges().isEmpty(), "edges: " + b.callEdges());
        assertEquals(3, b.unresolvedCalls());
    }

    @Test
    void classStackKeepsOuterClassContextAfterNestedClass() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("shapes.py",
                        "class Outer:",
                        "    class Inner:",
                        "        def inner_method(self):",
                        "            pass",
                        "",
                        "    def after_inner(self):",
                        "        pass",
                        "",
                        "def top():",
                        "    def nested():",
                        "        pass",
                        "    return nested");
        final FileRecord rec = support.record(support.analyzeAll(), "shapes.py");

        assertEquals(Set.of("Inner", "Outer"), rec.classes());
        assertEquals(Set.of("top", "nested"), rec.functions());
    }

    @Test
    void asyncAndDecoratedFunctionsAreTopLevelFunctions() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("tasks.py",
                        "import functools",
                        "",
                        "@functools.lru_cache(maxsize=None)",
                        "def cached():",
                        "    return 1",
                        "",
                        "async def fetch():",
                        "    return await other()");
        final FileRecord rec = support.record(support.analyzeAll(), "tasks.py");

        assertEquals(Set.of("cached", "fetch"), rec.functions());
        assertTrue(rec.classes().isEmpty());
    }

    @Test
    void importFormsAreRecordedAsOpaqueModuleNames() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("imports.py",
                        "from __future__ import annotations",
                        "import os",
                        "import os.path as osp, json",
                        "from pkg.sub import mod, other as alias",
                        "from . import sibling",
                        "from ..parent import thing",
                        "from collections import *",
                        "from typing import (List,",
                        "                    Dict)");
        final FileRecord rec = support.record(support.analyzeAll(), "imports.py");

        assertEquals(List.of(
                        "__future__.annotations",
                        "os",
                        "os.path",
                        "json",
                        "pkg.sub.mod",
                        "pkg.sub.other",
                        "sibling",
                        "parent.thing",
                        "collections.*",
                        "typing.List",
                        "typing.Dict"),
                rec.imports().stream().map(ImportRef::moduleName).toList());
        assertTrue(rec.imports().stream().allMatch(i -> i.importer().equals(path("imports.py"))));
    }

    @Test
    void outputMarkersAreRecordedWhetherOrNotTheyResolve() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("app.py",
                        "import logging",
                        "logger = logging.getLogger(__name__)",
                        "",
                        "def main():",
                        "    print('hello')",
                        "    logging.info('started')",
                        "    logging.error('failed')",
                        "    logger.info('not a marker')");
        final FileRecord rec = support.record(support.analyzeAll(), "app.py");

        assertEquals(Set.of("print", "logging.info", "logging.error"), rec.outputs());
    }

    @Test
    void customOutputMarkersReplaceDefaults() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("app.py",
                        "def main():",
                        "    print('hello')",
                        "    log.write('x')",
                        "    self_logger.emit('y')");
        final FileRecord rec = support.record(
                support.analyzeAll(OutputMarkers.of(List.of("log.write", "self_logger.emit"))), "app.py");

        assertEquals(Set.of("log.write", "self_logger.emit"), rec.outputs());
    }

    @Test
    void sequenceContinuesAcrossFilesInVisitOrder() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("a.py",
                        "def helper():",
                        "    pass")
                .add("b.py",
                        "def main():",
                        "    helper()",
                        "    stage(helper())")
                .add("c.py",
                        "def stage(x):",
                        "    helper()");
        final List<FileRecord> records = support.analyzeAll();

        final FileRecord b = support.record(records, "b.py");
        final FileRecord c = support.record(records, "c.py");
        // outer call before its arguments
        assertEquals(List.of("helper", "stage", "helper"), b.callEdges().stream().map(CallEdge::name).toList());
        assertEquals(List.of(1, 2, 3), b.callEdges().stream().map(CallEdge::sequence).toList());
        assertEquals(List.of(4), c.callEdges().stream().map(CallEdge::sequence).toList());
    }

    @Test
    void lastDefinitionWinsByDefault() throws Exception {
        final var support = new AnalyzerTestSupport()
                .add("first.py", "def shared():", "    pass")
                .add("second.py", "def shared():", "    pass")
                .add("caller.py", "shared()");
        final FileRecord caller = support.record(support.analyzeAll(), "caller.py");

        assertEquals(1, caller.callEdges().size());
        assertEquals(path("second.py"), caller.callEdges().get(0).callee());
    }

    @Test
    void ambiguousPolicyLeavesCollidingCallsUnresolved() throws Exception {
        final var support = new AnalyzerTestSupport(CollisionPolicy.AMBIGUOUS)
                .add("first.py", "def shared():", "    pass")
                .add("second.py", "def shared():", "    pass", "def unique():", "    pass")
                .add("caller.py", "shared()", "unique()");
        final FileRecord caller = support.record(support.analyzeAll(), "caller.py");

        assertEquals(List.of("unique"), caller.callEdges().stream().map(CallEdge::name).toList());
        assertEquals(1, caller.unresolvedCalls());
    }

    @Test
    void analysisRequiresFrozenTable() throws Exception {
        final ParsedSource source = new PythonParser().parse(path("a.py"), "x = 1\n");
        final FileAnalyzer analyzer = new FileAnalyzer(OutputMarkers.defaults());
        final SymbolTable open = new SymbolTable(CollisionPolicy.LAST_WINS);

        assertThrows(IllegalStateException.class, () -> analyzer.analyze(source, open, new SequenceCounter()));
    }

    @Test
    void recordIsImmutable() throws Exception {
        final var support = new AnalyzerTestSupport().add("a.py", "class A:", "    pass");
        final FileRecord rec = support.record(support.analyzeAll(), "a.py");

        assertThrows(UnsupportedOperationException.class, () -> rec.classes().add("B"));
        assertThrows(UnsupportedOperationException.class, () -> rec.callEdges().clear());
    }
}
