package org.declref.compiler.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds the export index of one module in the symbol table.
 */
public final class ModuleScope {

    private final ModuleId moduleId;
    private final String sourcePath;
    private final Map<String, Entity> exports;

    ModuleScope(ModuleId moduleId, String sourcePath, Map<String, Entity> exports) {
        this.moduleId = moduleId;
        this.sourcePath = sourcePath;
        this.exports = Collections.unmodifiableMap(new LinkedHashMap<>(exports));
    }

    public ModuleId moduleId() {
        return moduleId;
    }

    public String sourcePath() {
        return sourcePath;
    }

    /**
     * Export name (case preserved) to entity, in definition order.
     */
    public Map<String, Entity> exports() {
        return exports;
    }
}
