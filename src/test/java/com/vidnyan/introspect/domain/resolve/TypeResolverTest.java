package com.vidnyan.introspect.domain.resolve;

import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.model.Callback;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceKey;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.resolve.Resolution.Fallback;
import com.vidnyan.introspect.domain.resolve.Resolution.Resolved;
import com.vidnyan.introspect.domain.resolve.Resolution.Step;
import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.PrimitiveType;
import com.vidnyan.introspect.domain.type.ScopedIdentifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vidnyan.introspect.domain.ModelFixtures.classOf;
import static com.vidnyan.introspect.domain.ModelFixtures.interfaceOf;
import static com.vidnyan.introspect.domain.ModelFixtures.namespace;
import static org.junit.jupiter.api.Assertions.*;

class TypeResolverTest {

    private Namespace gobject;
    private Namespace gio;
    private Namespace gpseq;
    private TypeResolver resolver;

    @BeforeEach
    void setUp() {
        gobject = namespace("GObject", "2.0", classOf("GObject", "Object").cType("GObject").build());
        gio = namespace("Gio", "2.0", List.of(new NamespaceKey("GObject", "2.0")), Set.of(),
                interfaceOf("Gio", "File").cType("GFile").build(),
                classOf("Gio", "Cancellable").build());

        Callback flatMap = new Callback("FlatMapFunc", "GpseqResultFlatMapFunc", List.of(), PrimitiveType.VOID);
        Callback map = new Callback("MapFunc", null, List.of(), PrimitiveType.VOID);
        Callback futureMap = new Callback("MapFunc", null, List.of(), PrimitiveType.VOID);
        Callback globalFlatMap = new Callback("FlatMapFunc", "GpseqFlatMapFunc", List.of(), PrimitiveType.VOID);
        gpseq = namespace("Gpseq", "1.0",
                interfaceOf("Gpseq", "Result").callbacks(List.of(flatMap, map)).build(),
                interfaceOf("Gpseq", "ResultFuture").callbacks(List.of(futureMap)).build())
                .withCallbacks(Map.of("FlatMapFunc", globalFlatMap));

        resolver = new TypeResolver(NamespaceRegistry.of(gobject, gio, gpseq));
    }

    @Test
    void builtinNames_ShouldResolveToPrimitives() {
        Resolution resolution = resolver.resolve("utf8", ResolutionContext.of(gio));

        assertEquals(PrimitiveType.STRING, resolution.type());
        assertEquals(Step.PRIMITIVE, ((Resolved) resolution).step());
    }

    @Test
    void qualifiedReference_ShouldResolveAcrossNamespaces() {
        Resolution resolution = resolver.resolve("GObject.Object", ResolutionContext.of(gio));

        assertEquals(new Identifier("GObject", "Object"), resolution.type());
        assertTrue(resolution.diagnostic().isEmpty());
    }

    @Test
    void containerQualifiedReference_ShouldResolveToScopedIdentifier() {
        Resolution resolution = resolver.resolve("Result.FlatMapFunc", ResolutionContext.of(gpseq));

        assertEquals(new ScopedIdentifier("Gpseq", "Result", "FlatMapFunc"), resolution.type());
    }

    @Test
    void compoundName_ShouldPreferScopedOverGlobal() {
        Resolution resolution = resolver.resolve("ResultFlatMapFunc", ResolutionContext.of(gpseq));

        assertEquals(new ScopedIdentifier("Gpseq", "Result", "FlatMapFunc"), resolution.type());
        assertEquals(DiagnosticKind.SCOPED_OVER_GLOBAL, resolution.diagnostic().orElseThrow().kind());
    }

    @Test
    void compoundName_ShouldUseLongestClassPrefix() {
        Resolution resolution = resolver.resolve("ResultFutureMapFunc", ResolutionContext.of(gpseq));

        assertEquals(new ScopedIdentifier("Gpseq", "ResultFuture", "MapFunc"), resolution.type());
        assertTrue(resolution.diagnostic().isEmpty());
    }

    @Test
    void exactName_ShouldResolveInCurrentNamespace() {
        Resolution resolution = resolver.resolve("File", ResolutionContext.of(gio));

        assertEquals(new Identifier("Gio", "File"), resolution.type());
        assertEquals(Step.EXACT, ((Resolved) resolution).step());
    }

    @Test
    void nativeTypeName_ShouldResolveThroughDependencies() {
        Resolution resolution = resolver.resolve("Unknown", "GObject", ResolutionContext.of(gio));

        assertEquals(new Identifier("GObject", "Object"), resolution.type());
        assertEquals(Step.NATIVE_TYPE_NAME, ((Resolved) resolution).step());
    }

    @Test
    void unqualifiedName_ShouldFallBackToGlobalSearch() {
        Resolution resolution = resolver.resolve("Object", ResolutionContext.of(gio));

        assertEquals(new Identifier("GObject", "Object"), resolution.type());
        assertEquals(Step.GLOBAL, ((Resolved) resolution).step());
    }

    @Test
    void unknownReference_ShouldFallBackToAnyWithDiagnostic() {
        Resolution resolution = resolver.resolve("Gdk.Pixbuf", "GdkPixbuf",
                ResolutionContext.of(gio).withContainer("File").withSubject("File.load"));

        Fallback fallback = assertInstanceOf(Fallback.class, resolution);
        assertEquals(AnyType.INSTANCE, fallback.type());
        assertEquals(DiagnosticKind.UNRESOLVED_REFERENCE, fallback.reason().kind());
        assertEquals("File.load", fallback.reason().subject());
        assertEquals("Gdk.Pixbuf", fallback.reason().getAttribute("reference", String.class));
        assertEquals("GdkPixbuf", fallback.reason().getAttribute("cType", String.class));
    }

    @Test
    void resolve_ShouldBeDeterministic() {
        ResolutionContext ctx = ResolutionContext.of(gpseq);

        assertEquals(resolver.resolve("ResultFlatMapFunc", ctx), resolver.resolve("ResultFlatMapFunc", ctx));
    }
}
