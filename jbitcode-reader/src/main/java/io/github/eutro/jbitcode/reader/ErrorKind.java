package io.github.eutro.jbitcode.reader;

/**
 * The reasons a container can fail to decode.
 */
public enum ErrorKind {
    INVALID_SIGNATURE(Category.SIGNATURE, "invalid bitcode signature"),
    INVALID_WRAPPER_HEADER(Category.SIGNATURE, "invalid bitcode wrapper header"),

    MALFORMED_BLOCK(Category.STRUCTURAL, "malformed block"),
    INVALID_RECORD(Category.STRUCTURAL, "invalid record"),
    INVALID_TYPE_TABLE(Category.STRUCTURAL, "invalid type table"),
    INVALID_INSTRUCTION_WITH_NO_BB(Category.STRUCTURAL, "invalid instruction with no basic block"),

    INVALID_VALUE(Category.REFERENCE, "invalid value"),
    INVALID_TYPE(Category.REFERENCE, "invalid type"),
    INVALID_ID(Category.REFERENCE, "invalid id"),
    INVALID_CONSTANT_REFERENCE(Category.REFERENCE, "invalid constant reference"),
    EXPECTED_CONSTANT(Category.REFERENCE, "expected a constant"),
    INVALID_TYPE_FOR_VALUE(Category.REFERENCE, "invalid type for value"),
    TYPE_MISMATCH(Category.REFERENCE, "forward reference type mismatch"),
    INVALID_ALIASEE(Category.REFERENCE, "invalid aliasee"),
    INSUFFICIENT_FUNCTION_PROTOS(Category.REFERENCE, "insufficient function prototypes"),

    INVALID_MULTIPLE_BLOCKS(Category.DUPLICATE, "invalid multiple blocks"),
    DUPLICATE_DEFINITION(Category.DUPLICATE, "duplicate definition"),
    CONFLICTING_METADATA_KIND_RECORDS(Category.DUPLICATE, "conflicting metadata kind records"),

    UNRESOLVED_FORWARD_REFERENCE(Category.UNRESOLVED, "unresolved forward reference"),
    MALFORMED_GLOBAL_INITIALIZER_SET(Category.UNRESOLVED, "malformed global initializer set"),
    NEVER_RESOLVED_VALUE_IN_FUNCTION(Category.UNRESOLVED, "never resolved value found in function"),
    COULD_NOT_FIND_FUNCTION_IN_STREAM(Category.UNRESOLVED, "could not find function in stream"),
    ;

    /**
     * A coarse grouping of error kinds.
     */
    public enum Category {
        /**
         * The container does not start the way it should.
         */
        SIGNATURE,
        /**
         * Blocks or records are not shaped the way they should be.
         */
        STRUCTURAL,
        /**
         * A record refers to something that is out of range or of the wrong kind.
         */
        REFERENCE,
        /**
         * Something that may only be defined once was defined again.
         */
        DUPLICATE,
        /**
         * Something was still pending when its scope ended.
         */
        UNRESOLVED,
    }

    public final Category category;
    public final String description;

    ErrorKind(Category category, String description) {
        this.category = category;
        this.description = description;
    }
}
