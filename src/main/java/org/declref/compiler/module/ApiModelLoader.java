package org.declref.compiler.module;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.declref.compiler.model.DeclarationGraph;
import org.declref.compiler.model.DeclarationId;
import org.declref.compiler.model.DeclarationKind;
import org.declref.compiler.semantics.ModuleId;
import org.declref.compiler.semantics.SymbolId;
import org.declref.compiler.semantics.SymbolTable;
import org.declref.compiler.semantics.WorkingPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link ApiModel} from a HOCON description of a package's exports.
 *
 * <pre>
 * package = "widgets"
 * entry-module = "index"
 * modules {
 *   index {
 *     source = "src/index.ts"
 *     exports {
 *       Button = [ { kind = class, members = [ { name = onClick, kind = function } ] } ]
 *       Legacy { reexport = "other-pkg#Legacy" }
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>An export given as a list defines local declarations (one entry per overload or merged
 * declaration); an export given as an object with {@code reexport} defines a re-export.
 * Module keys are taken verbatim, so paths containing dots or slashes must be quoted.</p>
 */
public final class ApiModelLoader {

    private static final Logger log = LoggerFactory.getLogger(ApiModelLoader.class);

    private ApiModelLoader() {
    }

    /**
     * Loads a model file.
     *
     * @throws ApiModelException if the file is missing, unparsable or structurally invalid.
     */
    public static ApiModel load(File file) {
        if (!file.isFile()) {
            throw new ApiModelException("API model file not found: " + file.getAbsolutePath());
        }
        try {
            Config config = ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false))
                    .resolve();
            ApiModel model = fromConfig(config);
            log.info("Loaded API model of package '{}' from {}", model.workingPackage().name(), file);
            return model;
        } catch (ConfigException e) {
            throw new ApiModelException("Failed to read API model " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a model from HOCON text.
     */
    public static ApiModel parse(String text) {
        try {
            return fromConfig(ConfigFactory.parseString(text,
                    ConfigParseOptions.defaults().setSyntax(ConfigSyntax.CONF)).resolve());
        } catch (ConfigException e) {
            throw new ApiModelException("Failed to read API model: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a model from an already parsed configuration.
     *
     * @throws ApiModelException if a required key is missing, has the wrong type or names an invalid declaration.
     */
    public static ApiModel fromConfig(Config config) {
        try {
            return build(config);
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ApiModelException("Invalid API model (" + config.origin().description() + "): "
                    + e.getMessage(), e);
        }
    }

    private static ApiModel build(Config config) {
        String packageName = config.getString("package");
        ModuleId entryModule = new ModuleId(config.getString("entry-module"));

        SymbolTable.Builder symbols = new SymbolTable.Builder();
        DeclarationGraph.Builder graph = new DeclarationGraph.Builder();

        ConfigObject modules = config.getObject("modules");
        for (Map.Entry<String, ConfigValue> moduleEntry : modules.entrySet()) {
            ModuleId moduleId = new ModuleId(moduleEntry.getKey());
            Config module = asObject(moduleEntry.getValue(), "module '" + moduleId + "'").toConfig();
            String source = module.hasPath("source") ? module.getString("source") : moduleId.path();
            symbols.registerModule(moduleId, source);

            if (!module.hasPath("exports")) {
                continue;
            }
            for (Map.Entry<String, ConfigValue> exportEntry : module.getObject("exports").entrySet()) {
                defineExport(symbols, graph, moduleId, exportEntry.getKey(), exportEntry.getValue());
            }
        }

        SymbolTable table = symbols.build();
        if (table.getModuleScope(entryModule).isEmpty()) {
            throw new ApiModelException("Entry module '" + entryModule + "' is not declared under 'modules' ("
                    + config.origin().description() + ")");
        }
        DeclarationGraph declarations = graph.build();
        log.debug("Package '{}': {} modules, {} exports, {} declarations",
                packageName, table.getModules().size(), table.exportCount(), declarations.size());
        return new ApiModel(new WorkingPackage(packageName, entryModule), table, declarations);
    }

    private static void defineExport(SymbolTable.Builder symbols, DeclarationGraph.Builder graph,
                                     ModuleId moduleId, String name, ConfigValue value) {
        if (value.valueType() == ConfigValueType.OBJECT) {
            Config reexport = ((ConfigObject) value).toConfig();
            if (!reexport.hasPath("reexport")) {
                throw new ApiModelException("Export '" + name + "' must be a declaration list or define 'reexport' ("
                        + value.origin().description() + ")");
            }
            symbols.defineImport(moduleId, name, reexport.getString("reexport"));
            return;
        }
        if (value.valueType() != ConfigValueType.LIST) {
            throw new ApiModelException("Export '" + name + "' must be a declaration list or define 'reexport' ("
                    + value.origin().description() + ")");
        }

        ConfigList entries = (ConfigList) value;
        if (entries.isEmpty()) {
            throw new ApiModelException("Export '" + name + "' has no declarations ("
                    + value.origin().description() + ")");
        }
        SymbolId owner = new SymbolId(moduleId, name);
        List<DeclarationId> roots = new ArrayList<>();
        for (ConfigValue entry : entries) {
            Config declaration = asObject(entry, "declaration of '" + name + "'").toConfig();
            DeclarationId root = graph.addRoot(owner, name, kindOf(declaration));
            addMembers(graph, root, declaration);
            roots.add(root);
        }
        symbols.defineLocal(moduleId, name, roots);
    }

    private static void addMembers(DeclarationGraph.Builder graph, DeclarationId parent, Config declaration) {
        if (!declaration.hasPath("members")) {
            return;
        }
        for (ConfigObject memberObject : declaration.getObjectList("members")) {
            Config member = memberObject.toConfig();
            if (!member.hasPath("name")) {
                throw new ApiModelException("Member without 'name' (" + memberObject.origin().description() + ")");
            }
            DeclarationId child = graph.addChild(parent, member.getString("name"), kindOf(member));
            addMembers(graph, child, member);
        }
    }

    private static DeclarationKind kindOf(Config declaration) {
        String kind = declaration.getString("kind");
        return DeclarationKind.fromSelectorTag(kind)
                .orElseThrow(() -> new ApiModelException("Unknown declaration kind '" + kind + "' ("
                        + declaration.origin().description() + ")"));
    }

    private static ConfigObject asObject(ConfigValue value, String what) {
        if (value.valueType() != ConfigValueType.OBJECT) {
            throw new ApiModelException("Expected an object for " + what + " (" + value.origin().description() + ")");
        }
        return (ConfigObject) value;
    }
}
