package com.vidnyan.introspect.domain.model;

import com.vidnyan.introspect.domain.type.TypeExpression;
import lombok.Builder;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Function member: constructor, regular, static or virtual method.
 *
 * @param synthetic   true for members the conflict detector generated
 * @param warning     rendering hint attached by the detector, may be null
 * @param overloadTag true when the rendering stage must emit explicit per-signature overloads
 */
@With
@Builder(toBuilder = true)
public record FunctionMember(
    String name,
    FunctionKind kind,
    List<Parameter> parameters,
    TypeExpression returnType,
    boolean synthetic,
    String warning,
    boolean overloadTag
) implements ClassMember {

    public FunctionMember {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        kind = kind == null ? FunctionKind.REGULAR : kind;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static FunctionMember of(String name, FunctionKind kind, List<Parameter> parameters, TypeExpression returnType) {
        return new FunctionMember(name, kind, parameters, returnType, false, null, false);
    }

    /**
     * Parameters passed in by the caller (direction IN or INOUT).
     */
    public List<Parameter> inputParameters() {
        return parameters.stream()
                .filter(p -> p.direction() != Direction.OUT)
                .toList();
    }

    /**
     * Parameters returned to the caller (direction OUT or INOUT).
     */
    public List<Parameter> outputParameters() {
        return parameters.stream()
                .filter(p -> p.direction().isOutput())
                .toList();
    }

    public boolean isConstructor() {
        return kind == FunctionKind.CONSTRUCTOR;
    }

    public boolean isVirtual() {
        return kind == FunctionKind.VIRTUAL;
    }

    @Override
    public MemberKind memberKind() {
        return MemberKind.FUNCTION;
    }

    /**
     * Signature string, e.g. {@code get_view(a: number): Gee.List}.
     */
    public String signature() {
        String params = inputParameters().stream()
                .map(p -> p.name() + ": " + p.type().display())
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
        return name + "(" + params + "): " + returnType.display();
    }
}
