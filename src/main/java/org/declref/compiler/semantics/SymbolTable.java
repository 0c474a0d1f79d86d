package org.declref.compiler.semantics;

import org.declref.compiler.model.DeclarationId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-module export index of the analyzed package. Maps each (module, export name) pair
 * to exactly one {@link Entity}.
 *
 * <p>The table is assembled through {@link Builder} and is read-only afterwards, so a single
 * instance can serve concurrent resolutions without locking.</p>
 */
public class SymbolTable {

    private final Map<ModuleId, ModuleScope> modules;

    private SymbolTable(Map<ModuleId, ModuleScope> modules) {
        this.modules = Collections.unmodifiableMap(modules);
    }

    /**
     * Gets the module scope for the given module ID, or empty if not registered.
     */
    public Optional<ModuleScope> getModuleScope(ModuleId moduleId) {
        return Optional.ofNullable(modules.get(moduleId));
    }

    /**
     * Gets the module scope map (for multi-module iteration).
     */
    public Map<ModuleId, ModuleScope> getModules() {
        return modules;
    }

    /**
     * Looks up an export of a module. Names are matched exactly.
     *
     * @param moduleId The module to search.
     * @param name     The export name.
     * @return The bound entity, or empty if the module does not export {@code name}.
     */
    public Optional<Entity> lookupExport(ModuleId moduleId, String name) {
        ModuleScope scope = modules.get(moduleId);
        if (scope == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(scope.exports().get(name));
    }

    /**
     * Resolves the entry module of the working package.
     *
     * @param workingPackage The package under analysis.
     * @return The scope of its entry module.
     * @throws IllegalStateException if the entry module was never registered.
     */
    public ModuleScope rootModuleOf(WorkingPackage workingPackage) {
        return getModuleScope(workingPackage.entryModule())
                .orElseThrow(() -> new IllegalStateException(
                        "Entry module '" + workingPackage.entryModule() + "' of package '"
                                + workingPackage.name() + "' is not registered"));
    }

    /**
     * Returns the total number of exports across all modules.
     */
    public int exportCount() {
        int count = 0;
        for (ModuleScope scope : modules.values()) {
            count += scope.exports().size();
        }
        return count;
    }

    /**
     * Collects modules and their exports. Not thread-safe; call {@link #build()} once
     * construction is complete.
     */
    public static final class Builder {

        private final Map<ModuleId, String> sourcePaths = new LinkedHashMap<>();
        private final Map<ModuleId, Map<String, Entity>> exports = new LinkedHashMap<>();

        /**
         * Registers a module. Registering the same module twice keeps the first source path.
         *
         * @param moduleId   The module identity.
         * @param sourcePath The file path of the module source.
         */
        public Builder registerModule(ModuleId moduleId, String sourcePath) {
            sourcePaths.putIfAbsent(moduleId, sourcePath);
            exports.computeIfAbsent(moduleId, id -> new LinkedHashMap<>());
            return this;
        }

        /**
         * Defines an export backed by declarations of the module itself.
         *
         * @return The defined entity.
         */
        public LocalEntity defineLocal(ModuleId moduleId, String name, List<DeclarationId> declarations) {
            LocalEntity entity = new LocalEntity(new SymbolId(moduleId, name), declarations);
            define(entity);
            return entity;
        }

        /**
         * Defines an export that re-exports {@code target}.
         *
         * @return The defined entity.
         */
        public ImportedEntity defineImport(ModuleId moduleId, String name, String target) {
            ImportedEntity entity = new ImportedEntity(new SymbolId(moduleId, name), target);
            define(entity);
            return entity;
        }

        private void define(Entity entity) {
            ModuleId moduleId = entity.id().module();
            Map<String, Entity> moduleExports = exports.get(moduleId);
            if (moduleExports == null) {
                throw new IllegalArgumentException("Module '" + moduleId + "' is not registered");
            }
            if (moduleExports.putIfAbsent(entity.localName(), entity) != null) {
                throw new IllegalArgumentException(
                        "Export '" + entity.localName() + "' is already defined in module '" + moduleId + "'");
            }
        }

        public SymbolTable build() {
            Map<ModuleId, ModuleScope> modules = new LinkedHashMap<>();
            for (Map.Entry<ModuleId, Map<String, Entity>> entry : exports.entrySet()) {
                ModuleId id = entry.getKey();
                modules.put(id, new ModuleScope(id, sourcePaths.get(id), entry.getValue()));
            }
            return new SymbolTable(modules);
        }
    }
}
