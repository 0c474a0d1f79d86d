package org.declref.compiler.resolver;

/**
 * Why a declaration reference could not be resolved.
 */
public enum FailureKind {
    /** The reference names a package other than the working package. */
    UNSUPPORTED_EXTERNAL_PACKAGE,
    /** The reference carries an import path qualifier. */
    UNSUPPORTED_IMPORT_PATH,
    /** The reference has no member path. */
    EMPTY_REFERENCE,
    /** The first member is not exported by the working package. */
    UNKNOWN_EXPORT,
    /** The first member is a re-export. */
    UNSUPPORTED_REEXPORT,
    /** A member is keyed by a symbol instead of a plain name. */
    UNSUPPORTED_SYMBOL_SELECTOR,
    /** A member has no identifier at all. */
    MISSING_MEMBER_IDENTIFIER,
    /** The current declaration has no child with the requested name. */
    NO_MATCHING_MEMBER,
    /** Several declarations share the name and no selector was given. */
    AMBIGUOUS_REFERENCE,
    /** The selector is not a system (declaration kind) selector. */
    UNSUPPORTED_SELECTOR_FAMILY,
    /** The system selector does not name a known declaration kind. */
    UNSUPPORTED_SELECTOR_VALUE,
    /** No declaration of the selected kind exists. */
    NO_DECLARATION_FOR_SELECTOR,
    /** Several declarations share both the name and the selected kind. */
    AMBIGUOUS_SELECTOR_MATCH
}
