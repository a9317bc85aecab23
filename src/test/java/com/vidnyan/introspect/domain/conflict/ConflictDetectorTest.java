package com.vidnyan.introspect.domain.conflict;

import com.vidnyan.introspect.domain.diagnostic.DiagnosticKind;
import com.vidnyan.introspect.domain.diagnostic.DiagnosticSink;
import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.ClassMember.MemberKind;
import com.vidnyan.introspect.domain.model.Field;
import com.vidnyan.introspect.domain.model.FunctionKind;
import com.vidnyan.introspect.domain.model.FunctionMember;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceRegistry;
import com.vidnyan.introspect.domain.model.Parameter;
import com.vidnyan.introspect.domain.model.Property;
import com.vidnyan.introspect.domain.type.AnyType;
import com.vidnyan.introspect.domain.type.ArrayType;
import com.vidnyan.introspect.domain.type.ConflictMarker;
import com.vidnyan.introspect.domain.type.Identifier;
import com.vidnyan.introspect.domain.type.NeverType;
import com.vidnyan.introspect.domain.type.PrimitiveType;
import com.vidnyan.introspect.domain.type.TypeExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.vidnyan.introspect.domain.ModelFixtures.classOf;
import static com.vidnyan.introspect.domain.ModelFixtures.id;
import static com.vidnyan.introspect.domain.ModelFixtures.interfaceOf;
import static com.vidnyan.introspect.domain.ModelFixtures.method;
import static com.vidnyan.introspect.domain.ModelFixtures.namespace;
import static com.vidnyan.introspect.domain.ModelFixtures.vfunc;
import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private static final Identifier OBJECT = id("GObject", "Object");
    private static final Identifier BASE = id("Test", "Base");
    private static final Identifier WIDGET = id("Test", "Widget");
    private static final Identifier BUTTON = id("Test", "Button");

    private DiagnosticSink sink;
    private ConflictDetector detector;

    @BeforeEach
    void setUp() {
        sink = new DiagnosticSink();
        detector = ConflictDetector.withDefaults(sink);
    }

    private static NamespaceRegistry registry(BaseClass... classes) {
        return registry(Set.of(), classes);
    }

    private static NamespaceRegistry registry(Set<String> known, BaseClass... classes) {
        BaseClass[] all = new BaseClass[classes.length + 2];
        all[0] = classOf("Test", "Widget").build();
        all[1] = classOf("Test", "Button").superType(WIDGET).build();
        System.arraycopy(classes, 0, all, 2, classes.length);
        return NamespaceRegistry.of(
                namespace("GObject", "2.0", classOf("GObject", "Object")
                        .functions(List.of(method("connect", PrimitiveType.NUMBER,
                                Parameter.in("signal", PrimitiveType.STRING))))
                        .build()),
                namespace("Test", "1.0", List.of(), known, all));
    }

    private static BaseClass derived(BaseClass.BaseClassBuilder builder) {
        return builder.superType(BASE).build();
    }

    @Test
    void scenarioA_CovariantVirtualReturnOnInterface_ShouldBeVfuncSignatureConflict() {
        // Arrange
        BaseClass collection = interfaceOf("Test", "Collection")
                .functions(List.of(vfunc("vfunc_get_view", id("Test", "Collection"))))
                .build();
        BaseClass list = interfaceOf("Test", "List")
                .implementedInterfaces(List.<TypeExpression>of(id("Test", "Collection")))
                .functions(List.of(vfunc("vfunc_get_view", id("Test", "List"))))
                .build();
        NamespaceRegistry registry = registry(collection, list);

        // Act
        ClassAnnotation annotation = detector.annotate(registry, list);

        // Assert
        assertEquals(1, annotation.records().size());
        ConflictRecord record = annotation.records().get(0);
        assertEquals(ConflictKind.VFUNC_SIGNATURE_CONFLICT, record.kind());
        assertEquals(ConflictResolution.EMIT_OVERLOADS, record.resolution());
        assertEquals(id("Test", "Collection"), record.ancestor());
        assertTrue(annotation.annotated().functions().get(0).overloadTag());
        assertTrue(annotation.annotated().virtualSignatureConflict());
        assertTrue(detector.hasVirtualSignatureConflicts(registry, list));
        assertFalse(detector.hasVirtualSignatureConflicts(registry, collection));
    }

    @Test
    void scenarioB_FieldOverAncestorProperty_ShouldBeAccessorPropertyConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .properties(List.of(Property.of("x", PrimitiveType.STRING)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .fields(List.of(Field.of("x", PrimitiveType.STRING))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(1, annotation.records().size());
        assertEquals(ConflictKind.ACCESSOR_PROPERTY_CONFLICT, annotation.records().get(0).kind());
        assertEquals(ConflictResolution.WRAP_TYPE, annotation.records().get(0).resolution());
        assertEquals(new ConflictMarker(PrimitiveType.STRING, ConflictKind.ACCESSOR_PROPERTY_CONFLICT),
                annotation.annotated().fields().get(0).type());
    }

    @Test
    void scenarioD_FewerParameters_ShouldNotConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN,
                        Parameter.in("a", PrimitiveType.NUMBER), Parameter.in("b", PrimitiveType.NUMBER))))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.NUMBER)))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertFalse(annotation.hasConflicts());
        assertEquals(child, annotation.annotated());
    }

    @Test
    void moreParameters_ShouldConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.NUMBER))))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN,
                        Parameter.in("a", PrimitiveType.NUMBER), Parameter.in("b", PrimitiveType.NUMBER)))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, annotation.records().get(0).kind());
    }

    @Test
    void directFunctionConflict_ShouldKeepMemberAndAppendNeverOverload() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.NUMBER))))
                .build();
        FunctionMember own = method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.STRING));
        BaseClass child = derived(classOf("Test", "Derived").functions(List.of(own)));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        ConflictRecord record = annotation.records().get(0);
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, record.kind());
        assertEquals(ConflictResolution.KEEP_WITH_NEVER_OVERLOAD, record.resolution());
        assertEquals(BASE, record.ancestor());

        List<FunctionMember> functions = annotation.annotated().functions();
        assertEquals(2, functions.size());
        assertEquals(own, functions.get(0));
        FunctionMember overload = functions.get(1);
        assertTrue(overload.synthetic());
        assertEquals("f", overload.name());
        assertEquals(AnyType.INSTANCE, overload.returnType());
        assertEquals(ArrayType.of(NeverType.INSTANCE), overload.parameters().get(0).type());
        assertTrue(overload.parameters().get(0).varArgs());
        assertEquals("Conflicted with Test.Base.f", overload.warning());
    }

    @Test
    void conflictAlreadyRedeclaredByIntermediateAncestor_ShouldOmitMember() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.NUMBER))))
                .build();
        BaseClass middle = derived(classOf("Test", "Middle")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.STRING)))));
        BaseClass child = classOf("Test", "Derived")
                .superType(id("Test", "Middle"))
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.STRING))))
                .build();

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, middle, child), child);

        // Assert
        assertEquals(1, annotation.records().size());
        assertEquals(ConflictResolution.OMIT, annotation.records().get(0).resolution());
        assertTrue(annotation.annotated().functions().isEmpty());
        assertEquals(1, sink.ofKind(DiagnosticKind.OMITTED_MEMBER).size());
    }

    @Test
    void functionShadowingAncestorField_ShouldBeOmitted() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .fields(List.of(Field.of("name", PrimitiveType.STRING)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .functions(List.of(method("name", PrimitiveType.STRING))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(ConflictResolution.OMIT, annotation.records().get(0).resolution());
        assertEquals(MemberKind.FUNCTION, annotation.records().get(0).memberKind());
        assertTrue(annotation.annotated().functions().isEmpty());
    }

    @Test
    void fieldShadowingAncestorFunction_ShouldBeFunctionNameConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("size", PrimitiveType.NUMBER)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .fields(List.of(Field.of("size", PrimitiveType.NUMBER))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(1, annotation.records().size());
        ConflictRecord record = annotation.records().get(0);
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, record.kind());
        assertEquals(ConflictResolution.WRAP_TYPE, record.resolution());
        assertEquals(MemberKind.FIELD, record.memberKind());
        assertEquals(new ConflictMarker(PrimitiveType.NUMBER, ConflictKind.FUNCTION_NAME_CONFLICT),
                annotation.annotated().fields().get(0).type());
    }

    @Test
    void propertyOverAncestorFunction_ShouldBeFunctionNameConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("label", PrimitiveType.STRING)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .properties(List.of(Property.of("label", PrimitiveType.STRING))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, annotation.records().get(0).kind());
        assertInstanceOf(ConflictMarker.class, annotation.annotated().properties().get(0).type());
    }

    @Test
    void incompatibleProperty_ShouldBePropertyNameConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .properties(List.of(Property.of("child", WIDGET), Property.of("text", PrimitiveType.STRING)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .properties(List.of(Property.of("child", BUTTON), Property.of("text", PrimitiveType.NUMBER))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(1, annotation.records().size());
        assertEquals("text", annotation.records().get(0).member());
        assertEquals(ConflictKind.PROPERTY_NAME_CONFLICT, annotation.records().get(0).kind());
        assertEquals(BUTTON, annotation.annotated().properties().get(0).type());
    }

    @Test
    void incompatibleField_ShouldBeFieldNameConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .fields(List.of(Field.of("parent_instance", WIDGET)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .fields(List.of(Field.of("parent_instance", PrimitiveType.POINTER))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(ConflictKind.FIELD_NAME_CONFLICT, annotation.records().get(0).kind());
    }

    @Test
    void constructorAgainstRegularFunction_ShouldConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("new", BASE)))
                .build();
        FunctionMember ctor = FunctionMember.of("new", FunctionKind.CONSTRUCTOR, List.of(), id("Test", "Derived"));
        BaseClass child = derived(classOf("Test", "Derived").constructors(List.of(ctor)));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, annotation.records().get(0).kind());
        assertEquals(2, annotation.annotated().constructors().size());
        assertTrue(annotation.annotated().constructors().get(1).synthetic());
    }

    @Test
    void differentFunctionKinds_ShouldNotConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(FunctionMember.of("lookup", FunctionKind.STATIC,
                        List.of(Parameter.in("name", PrimitiveType.STRING)), BASE)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .functions(List.of(method("lookup", PrimitiveType.NUMBER))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertFalse(annotation.hasConflicts());
    }

    @Test
    void mismatchedOutputParameters_ShouldConflict() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("get_size", PrimitiveType.VOID,
                        Parameter.out("width", PrimitiveType.NUMBER), Parameter.out("height", PrimitiveType.NUMBER))))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .functions(List.of(method("get_size", PrimitiveType.VOID,
                        Parameter.out("width", PrimitiveType.NUMBER)))));

        // Act
        ClassAnnotation annotation = detector.annotate(registry(base, child), child);

        // Assert
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, annotation.records().get(0).kind());
    }

    /**
     * Parameters are compared in the same direction as return types: a narrower parameter
     * passes, a wider one (which would be a safe contravariant override) is flagged.
     */
    @Test
    void parameterComparison_ShouldBeCovariant() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("add", PrimitiveType.VOID, Parameter.in("child", WIDGET))))
                .build();
        BaseClass narrower = derived(classOf("Test", "Narrower")
                .functions(List.of(method("add", PrimitiveType.VOID, Parameter.in("child", BUTTON)))));
        BaseClass wider = derived(classOf("Test", "Wider")
                .functions(List.of(method("add", PrimitiveType.VOID, Parameter.in("child", OBJECT)))));
        NamespaceRegistry registry = registry(base, narrower, wider);

        // Act
        ClassAnnotation narrowed = detector.annotate(registry, narrower);
        ClassAnnotation widened = detector.annotate(registry, wider);

        // Assert
        assertFalse(narrowed.hasConflicts());
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, widened.records().get(0).kind());
    }

    @Test
    void reservedMethodBelowUniversalBase_ShouldBeForcedConflict() {
        // Arrange
        BaseClass emitter = classOf("Test", "Emitter")
                .superType(OBJECT)
                .functions(List.of(method("emit", PrimitiveType.VOID, Parameter.in("name", PrimitiveType.STRING))))
                .build();
        NamespaceRegistry registry = registry(emitter);

        // Act
        ClassAnnotation annotation = detector.annotate(registry, emitter);

        // Assert
        ConflictRecord record = annotation.records().get(0);
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, record.kind());
        assertTrue(record.isForced());
        assertEquals(ConflictResolution.KEEP_WITH_NEVER_OVERLOAD, record.resolution());

        BaseClass object = registry.findClass(OBJECT).orElseThrow();
        assertFalse(detector.annotate(registry, object).hasConflicts());
    }

    @Test
    void knownConflictNames_ShouldBeForced() {
        // Arrange
        BaseClass cls = classOf("Test", "Plain")
                .functions(List.of(method("get_data", AnyType.INSTANCE)))
                .properties(List.of(Property.of("data", PrimitiveType.STRING)))
                .build();
        NamespaceRegistry registry = registry(Set.of("get_data", "data"), cls);

        // Act
        ClassAnnotation annotation = detector.annotate(registry, cls);

        // Assert
        assertEquals(2, annotation.records().size());
        assertTrue(annotation.records().stream().allMatch(ConflictRecord::isForced));
        assertEquals(ConflictKind.PROPERTY_NAME_CONFLICT, annotation.records().stream()
                .filter(r -> r.memberKind() == MemberKind.PROPERTY).findFirst().orElseThrow().kind());
    }

    @Test
    void annotate_ShouldBePureAndIdempotent() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.NUMBER))))
                .properties(List.of(Property.of("x", PrimitiveType.STRING)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .functions(List.of(method("f", PrimitiveType.BOOLEAN, Parameter.in("a", PrimitiveType.STRING))))
                .fields(List.of(Field.of("x", PrimitiveType.STRING))));
        NamespaceRegistry registry = registry(base, child);
        BaseClass snapshot = child.toBuilder().build();

        // Act
        ClassAnnotation first = detector.annotate(registry, child);
        ClassAnnotation second = detector.annotate(registry, child);
        ClassAnnotation again = detector.annotate(registry, first.annotated());

        // Assert
        assertEquals(snapshot, child);
        assertEquals(first, second);
        assertEquals(first.records(), again.records());
        assertEquals(first.annotated(), again.annotated());
    }

    @Test
    void annotateNamespace_ShouldCollectRecordsAndDiagnostics() {
        // Arrange
        BaseClass base = classOf("Test", "Base")
                .properties(List.of(Property.of("x", PrimitiveType.STRING)))
                .build();
        BaseClass child = derived(classOf("Test", "Derived")
                .fields(List.of(Field.of("x", PrimitiveType.STRING))));
        NamespaceRegistry registry = registry(base, child);
        Namespace test = registry.find("Test").orElseThrow();

        // Act
        NamespaceAnnotation annotation = detector.annotateNamespace(registry, test);

        // Assert
        assertEquals(1, annotation.records().size());
        assertEquals(test.classes().keySet(), annotation.annotated().classes().keySet());
        assertEquals(1, sink.ofKind(DiagnosticKind.CONFLICT).size());
        assertEquals("Test.Base", sink.ofKind(DiagnosticKind.CONFLICT).get(0).getAttribute("ancestor", String.class));
    }

    @Test
    void severityOrder_ShouldPreferFunctionConflicts() {
        // Arrange
        ConflictKind vfunc = ConflictKind.VFUNC_SIGNATURE_CONFLICT;
        ConflictKind field = ConflictKind.FIELD_NAME_CONFLICT;

        // Act
        ConflictKind overFunction = ConflictKind.max(vfunc, ConflictKind.FUNCTION_NAME_CONFLICT);
        ConflictKind overAccessor = ConflictKind.max(field, ConflictKind.ACCESSOR_PROPERTY_CONFLICT);
        ConflictKind overProperty = ConflictKind.max(field, ConflictKind.PROPERTY_NAME_CONFLICT);

        // Assert
        assertEquals(ConflictKind.FUNCTION_NAME_CONFLICT, overFunction);
        assertEquals(ConflictKind.ACCESSOR_PROPERTY_CONFLICT, overAccessor);
        assertEquals(ConflictKind.FIELD_NAME_CONFLICT, overProperty);
    }
}
