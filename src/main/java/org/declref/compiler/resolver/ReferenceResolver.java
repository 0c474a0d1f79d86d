package org.declref.compiler.resolver;

import org.declref.compiler.model.DeclarationGraph;
import org.declref.compiler.model.DeclarationId;
import org.declref.compiler.model.DeclarationKind;
import org.declref.compiler.model.DeclarationNode;
import org.declref.compiler.reference.DeclarationReference;
import org.declref.compiler.reference.MemberReference;
import org.declref.compiler.reference.Selector;
import org.declref.compiler.reference.SelectorFamily;
import org.declref.compiler.semantics.Entity;
import org.declref.compiler.semantics.EntityKind;
import org.declref.compiler.semantics.ImportedEntity;
import org.declref.compiler.semantics.LocalEntity;
import org.declref.compiler.semantics.ModuleScope;
import org.declref.compiler.semantics.SymbolTable;
import org.declref.compiler.semantics.WorkingPackage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a declaration reference by walking the symbol table and declaration graph
 * of the working package.
 *
 * <p>The first member is looked up among the exports of the package's entry module; each
 * further member is looked up among the children of the previously selected declaration.
 * At every step the candidates are narrowed to exactly one declaration:</p>
 * <ul>
 *   <li>without a selector, a single candidate wins and several are ambiguous;</li>
 *   <li>with a system selector, candidates are filtered by declaration kind and exactly one must remain.</li>
 * </ul>
 *
 * <p>Resolution stops at the first failure. The resolver holds no mutable state, so one
 * instance may serve any number of threads.</p>
 */
public class ReferenceResolver {

    private final SymbolTable symbolTable;
    private final DeclarationGraph graph;
    private final WorkingPackage workingPackage;
    private final ModuleScope entryModule;

    /**
     * @throws IllegalStateException if the package's entry module is not in the symbol table.
     */
    public ReferenceResolver(SymbolTable symbolTable, DeclarationGraph graph, WorkingPackage workingPackage) {
        this.symbolTable = symbolTable;
        this.graph = graph;
        this.workingPackage = workingPackage;
        this.entryModule = symbolTable.rootModuleOf(workingPackage);
    }

    public Resolution resolve(DeclarationReference reference) {
        if (reference.packageName() != null && !reference.packageName().equals(workingPackage.name())) {
            return Resolution.failed(FailureKind.UNSUPPORTED_EXTERNAL_PACKAGE,
                    "External package references are not supported: \"" + reference.packageName()
                            + "\" is not the working package \"" + workingPackage.name() + "\"");
        }

        if (reference.importPath() != null) {
            return Resolution.failed(FailureKind.UNSUPPORTED_IMPORT_PATH,
                    "Import paths are not supported: \"" + reference.importPath() + "\"");
        }

        List<MemberReference> members = reference.memberReferences();
        if (members.isEmpty()) {
            return Resolution.failed(FailureKind.EMPTY_REFERENCE,
                    "The reference does not name a member; package references are not supported");
        }

        MemberReference rootMember = members.get(0);
        Optional<Resolution> rootNameFailure = checkIdentifier(rootMember, 0);
        if (rootNameFailure.isPresent()) {
            return rootNameFailure.get();
        }
        String exportName = rootMember.identifier();

        Optional<Entity> rootEntity = symbolTable.lookupExport(entryModule.moduleId(), exportName);
        if (rootEntity.isEmpty()) {
            return Resolution.failed(FailureKind.UNKNOWN_EXPORT,
                    "The package \"" + workingPackage.name() + "\" does not have an export \"" + exportName + "\"");
        }

        Entity entity = rootEntity.get();
        if (entity.kind() == EntityKind.IMPORTED) {
            return Resolution.failed(FailureKind.UNSUPPORTED_REEXPORT,
                    "Reexported declarations are not supported: \"" + exportName + "\" is reexported from \""
                            + ((ImportedEntity) entity).target() + "\"");
        }

        Resolution current = narrow(declarationsOf((LocalEntity) entity), rootMember.selector(), exportName);

        for (int i = 1; i < members.size(); i++) {
            if (!(current instanceof Resolution.Resolved resolved)) {
                return current;
            }
            MemberReference member = members.get(i);

            Optional<Resolution> nameFailure = checkIdentifier(member, i);
            if (nameFailure.isPresent()) {
                return nameFailure.get();
            }
            String memberName = member.identifier();

            List<DeclarationNode> children = graph.childrenNamed(resolved.declaration(), memberName);
            if (children.isEmpty()) {
                return Resolution.failed(FailureKind.NO_MATCHING_MEMBER,
                        "No member was found with name \"" + memberName + "\" in \""
                                + graph.qualifiedName(resolved.declaration()) + "\"");
            }

            current = narrow(children, member.selector(), memberName);
        }
        return current;
    }

    private Optional<Resolution> checkIdentifier(MemberReference member, int position) {
        if (member.symbolKey() != null) {
            return Optional.of(Resolution.failed(FailureKind.UNSUPPORTED_SYMBOL_SELECTOR,
                    "ECMAScript symbol selectors are not supported: \"[" + member.symbolKey() + "]\""));
        }
        if (member.identifier() == null || member.identifier().isEmpty()) {
            return Optional.of(Resolution.failed(FailureKind.MISSING_MEMBER_IDENTIFIER,
                    "The member identifier is missing in the "
                            + (position == 0 ? "root member reference" : "member reference at position " + position)));
        }
        return Optional.empty();
    }

    private List<DeclarationNode> declarationsOf(LocalEntity entity) {
        List<DeclarationNode> nodes = new ArrayList<>(entity.declarations().size());
        for (DeclarationId id : entity.declarations()) {
            nodes.add(graph.node(id));
        }
        return nodes;
    }

    /**
     * Reduces a non-empty candidate list to a single declaration.
     */
    private Resolution narrow(List<DeclarationNode> candidates, Selector selector, String name) {
        if (selector == null) {
            if (candidates.size() == 1) {
                return Resolution.resolved(candidates.get(0));
            }
            return Resolution.failed(FailureKind.AMBIGUOUS_REFERENCE,
                    "The reference is ambiguous because \"" + name + "\" has more than one declaration;"
                            + " you need to add a member reference selector");
        }

        if (selector.family() != SelectorFamily.SYSTEM) {
            return Resolution.failed(FailureKind.UNSUPPORTED_SELECTOR_FAMILY,
                    "The selector \"" + selector.text() + "\" is not a supported selector type");
        }

        Optional<DeclarationKind> kind = DeclarationKind.fromSelectorTag(selector.text());
        if (kind.isEmpty()) {
            return Resolution.failed(FailureKind.UNSUPPORTED_SELECTOR_VALUE,
                    "Unsupported system selector \"" + selector.text() + "\"");
        }

        List<DeclarationNode> matches = new ArrayList<>();
        for (DeclarationNode candidate : candidates) {
            if (candidate.kind() == kind.get()) {
                matches.add(candidate);
            }
        }
        if (matches.isEmpty()) {
            return Resolution.failed(FailureKind.NO_DECLARATION_FOR_SELECTOR,
                    "A declaration for \"" + name + "\" was not found that matches the selector \""
                            + selector.text() + "\"");
        }
        if (matches.size() > 1) {
            return Resolution.failed(FailureKind.AMBIGUOUS_SELECTOR_MATCH,
                    "More than one declaration \"" + name + "\" matches the selector \"" + selector.text() + "\"");
        }
        return Resolution.resolved(matches.get(0));
    }
}
