package com.vidnyan.introspect.domain.patch;

import com.vidnyan.introspect.domain.model.Namespace;
import com.vidnyan.introspect.domain.model.NamespaceKey;

/**
 * Hand-written correction for one library, applied after its symbol table is built and
 * before type resolution. Implementations return a new namespace and are idempotent.
 */
public interface NamespacePatch {

    /**
     * Name used in logs and diagnostics.
     */
    String name();

    boolean appliesTo(NamespaceKey key);

    /**
     * @throws PatchException when a targeted declaration is missing
     */
    Namespace apply(Namespace namespace);
}
