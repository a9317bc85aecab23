package com.vidnyan.introspect.adapter.out.patch;

import com.vidnyan.introspect.domain.model.BaseClass;
import com.vidnyan.introspect.domain.model.FunctionMember;
import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.Parameter;
import com.vidnyan.introspect.domain.patch.VersionedNamespacePatch;
import com.vidnyan.introspect.domain.type.ScopedIdentifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Points the {@code func} parameters of {@code Gpseq.Result.vfunc_flat_map} and
 * {@code vfunc_map} at the callbacks nested in {@code Result} instead of the global
 * {@code FlatMapFunc} and {@code MapFunc}.
 */
@Component
@Order(30)
public class GpseqScopedCallbackPatch extends VersionedNamespacePatch {

    private static final String CONTAINER = "Result";
    private static final String PARAMETER = "func";
    private static final Map<String, String> CALLBACK_BY_METHOD = Map.of(
            "vfunc_flat_map", "FlatMapFunc",
            "vfunc_map", "MapFunc");

    public GpseqScopedCallbackPatch() {
        super("Gpseq", Set.of("1.0"));
    }

    @Override
    public Namespace apply(Namespace namespace) {
        BaseClass result = requireClass(namespace, CONTAINER);
        List<FunctionMember> functions = result.functions().stream()
                .map(f -> retarget(namespace.name(), f))
                .toList();
        return namespace.withClass(result.withFunctions(functions));
    }

    private static FunctionMember retarget(String ns, FunctionMember function) {
        String callback = CALLBACK_BY_METHOD.get(function.name());
        if (callback == null) {
            return function;
        }
        ScopedIdentifier scoped = new ScopedIdentifier(ns, CONTAINER, callback);
        List<Parameter> parameters = function.parameters().stream()
                .map(p -> PARAMETER.equals(p.name()) ? p.withType(scoped) : p)
                .toList();
        return function.withParameters(parameters);
    }
}
