package org.declref.compiler.reference;

import java.util.List;

/**
 * A structured reference to a declaration, e.g. {@code widgets#Button.onClick}.
 *
 * @param packageName      The package qualifier, or {@code null} for the working package.
 * @param importPath       The path qualifier inside the package, or {@code null}.
 * @param memberReferences The member path, outermost first.
 */
public record DeclarationReference(String packageName, String importPath, List<MemberReference> memberReferences) {

    public DeclarationReference {
        memberReferences = List.copyOf(memberReferences);
    }

    /**
     * Creates an unqualified reference to a member path in the working package.
     */
    public static DeclarationReference of(MemberReference... members) {
        return new DeclarationReference(null, null, List.of(members));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (packageName != null) {
            sb.append(packageName);
        }
        if (importPath != null) {
            sb.append('/').append(importPath);
        }
        if (packageName != null || importPath != null) {
            sb.append('#');
        }
        for (int i = 0; i < memberReferences.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(memberReferences.get(i));
        }
        return sb.toString();
    }
}
