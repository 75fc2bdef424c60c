package com.structgrep.core.tree;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of generic tree node variants.
 *
 * <p>Each kind fixes its {@link Category}, the {@link Shape} of its children and the categories
 * its children may have. Front ends must only produce trees that respect these contracts; the
 * matcher treats a violation as an {@link InvariantViolationException}, not as a mismatch.
 *
 * <p>Kinds with {@link Shape#SEQUENCE} or {@link Shape#UNORDERED} children are where ellipses may
 * stand for zero or more siblings. A few sequences are <em>lenient</em>: an empty pattern list of
 * that kind (for example no {@code throws} clause) matches any target list.
 */
public enum NodeKind {

    // ==================== Expressions ====================

    IDENTIFIER(Category.EXPRESSION, Shape.LEAF),
    INTEGER_LITERAL(Category.EXPRESSION, Shape.LEAF),
    FLOAT_LITERAL(Category.EXPRESSION, Shape.LEAF),
    STRING_LITERAL(Category.EXPRESSION, Shape.LEAF),
    CHAR_LITERAL(Category.EXPRESSION, Shape.LEAF),
    BOOLEAN_LITERAL(Category.EXPRESSION, Shape.LEAF),
    NULL_LITERAL(Category.EXPRESSION, Shape.LEAF),
    THIS(Category.EXPRESSION, Shape.LEAF),
    SUPER(Category.EXPRESSION, Shape.LEAF),
    /** Value is the operator, children are the two operands. */
    BINARY(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION),
    /** Value is the operator name, including its fixity. */
    UNARY(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION),
    /** Value is the assignment operator ({@code =}, {@code +=}, ...). */
    ASSIGN(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION),
    /** Callee expression followed by an {@link #ARGUMENTS} list. */
    CALL(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION, Category.LIST),
    /** Receiver expression followed by the member name as an {@link #IDENTIFIER}. */
    FIELD_ACCESS(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION),
    ARRAY_ACCESS(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION),
    /** Instantiated type, {@link #ARGUMENTS}, optional anonymous class {@link #MEMBERS}. */
    NEW_OBJECT(Category.EXPRESSION, Shape.FIXED, Category.TYPE, Category.LIST),
    /** Element type, dimension {@link #EXPRESSIONS}, optional {@link #ARRAY_INITIALIZER}. */
    NEW_ARRAY(Category.EXPRESSION, Shape.FIXED, Category.TYPE, Category.LIST, Category.EXPRESSION),
    ARRAY_INITIALIZER(Category.EXPRESSION, Shape.SEQUENCE, Category.EXPRESSION),
    CONDITIONAL(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION),
    CAST(Category.EXPRESSION, Shape.FIXED, Category.TYPE, Category.EXPRESSION),
    INSTANCE_OF(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION, Category.TYPE),
    /** {@link #PARAMETERS} followed by an expression or block body. */
    LAMBDA(Category.EXPRESSION, Shape.FIXED, Category.LIST, Category.EXPRESSION, Category.STATEMENT),
    /** Value is the referenced member name; the child is the scope expression or type. */
    METHOD_REFERENCE(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION, Category.TYPE),
    CLASS_LITERAL(Category.EXPRESSION, Shape.FIXED, Category.TYPE),
    SWITCH_EXPRESSION(Category.EXPRESSION, Shape.FIXED, Category.EXPRESSION, Category.LIST),
    OTHER_EXPRESSION(Category.EXPRESSION, Shape.FIXED, Category.values()),

    // ==================== Statements ====================

    EXPRESSION_STATEMENT(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION),
    /** {@link #MODIFIERS}, type, name {@link #IDENTIFIER}, optional initializer. */
    LOCAL_VARIABLE(Category.STATEMENT, Shape.FIXED, Category.LIST, Category.TYPE, Category.EXPRESSION),
    BLOCK(Category.STATEMENT, Shape.SEQUENCE, Category.STATEMENT, Category.DECLARATION),
    /** Condition, then-branch, optional else-branch. */
    IF(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION, Category.STATEMENT),
    WHILE(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION, Category.STATEMENT),
    DO_WHILE(Category.STATEMENT, Shape.FIXED, Category.STATEMENT, Category.EXPRESSION),
    /** Initialisation, condition and update {@link #EXPRESSIONS}, then the body. */
    FOR(Category.STATEMENT, Shape.FIXED, Category.LIST, Category.STATEMENT),
    /** Loop variable ({@link #LOCAL_VARIABLE}), iterable, body. */
    FOR_EACH(Category.STATEMENT, Shape.FIXED, Category.STATEMENT, Category.EXPRESSION),
    RETURN(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION),
    THROW(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION),
    /** Value is the optional label. */
    BREAK(Category.STATEMENT, Shape.LEAF),
    /** Value is the optional label. */
    CONTINUE(Category.STATEMENT, Shape.LEAF),
    /** Resources, block, {@link #CATCHES}, optional finally block. */
    TRY(Category.STATEMENT, Shape.FIXED, Category.LIST, Category.STATEMENT),
    CATCH(Category.STATEMENT, Shape.FIXED, Category.PARAMETER, Category.STATEMENT),
    SWITCH(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION, Category.LIST),
    /** Label {@link #EXPRESSIONS} (empty for {@code default}) and body {@link #STATEMENTS}. */
    SWITCH_CASE(Category.STATEMENT, Shape.FIXED, Category.LIST),
    SYNCHRONIZED(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION, Category.STATEMENT),
    /** Value is the label. */
    LABELED(Category.STATEMENT, Shape.FIXED, Category.STATEMENT),
    ASSERT(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION),
    YIELD(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION),
    /** Value is {@code this} or {@code super}; child is the {@link #ARGUMENTS} list. */
    CONSTRUCTOR_CALL(Category.STATEMENT, Shape.FIXED, Category.EXPRESSION, Category.LIST),
    EMPTY(Category.STATEMENT, Shape.LEAF),
    OTHER_STATEMENT(Category.STATEMENT, Shape.FIXED, Category.values()),

    // ==================== Types ====================

    /** Value is the (possibly qualified) name; children are type arguments. */
    TYPE_NAME(Category.TYPE, Shape.SEQUENCE, Category.TYPE),
    PRIMITIVE_TYPE(Category.TYPE, Shape.LEAF),
    VOID_TYPE(Category.TYPE, Shape.LEAF),
    VAR_TYPE(Category.TYPE, Shape.LEAF),
    /** Type of an implicitly typed lambda parameter. */
    INFERRED_TYPE(Category.TYPE, Shape.LEAF),
    ARRAY_TYPE(Category.TYPE, Shape.FIXED, Category.TYPE),
    /** Value is {@code ?}, {@code ? extends} or {@code ? super}. */
    WILDCARD_TYPE(Category.TYPE, Shape.FIXED, Category.TYPE),
    /** Value is the type variable name; children are its bounds. */
    TYPE_PARAMETER(Category.TYPE, Shape.SEQUENCE, Category.TYPE),
    OTHER_TYPE(Category.TYPE, Shape.FIXED, Category.values()),

    // ==================== Declarations ====================

    COMPILATION_UNIT(Category.DECLARATION, Shape.SEQUENCE, Category.DECLARATION),
    PACKAGE(Category.DECLARATION, Shape.LEAF),
    IMPORT(Category.DECLARATION, Shape.LEAF),
    /**
     * Value is the declaration keyword ({@code class}, {@code interface}, {@code enum},
     * {@code record}, {@code @interface}); children are {@link #MODIFIERS}, name,
     * {@link #TYPE_PARAMETERS}, {@link #SUPERTYPES}, {@link #MEMBERS}.
     */
    CLASS(Category.DECLARATION, Shape.FIXED, Category.LIST, Category.EXPRESSION),
    /**
     * {@link #MODIFIERS}, {@link #TYPE_PARAMETERS}, return type, name, {@link #PARAMETERS},
     * {@link #THROWS}, optional body.
     */
    METHOD(Category.DECLARATION, Shape.FIXED, Category.LIST, Category.TYPE, Category.EXPRESSION, Category.STATEMENT),
    /** Same as {@link #METHOD} without the return type. */
    CONSTRUCTOR(Category.DECLARATION, Shape.FIXED, Category.LIST, Category.EXPRESSION, Category.STATEMENT),
    /** {@link #MODIFIERS}, type, name, optional initializer. One node per declarator. */
    FIELD(Category.DECLARATION, Shape.FIXED, Category.LIST, Category.TYPE, Category.EXPRESSION),
    /** {@link #MODIFIERS}, name, {@link #ARGUMENTS}, optional {@link #MEMBERS}. */
    ENUM_CONSTANT(Category.DECLARATION, Shape.FIXED, Category.LIST, Category.EXPRESSION),
    /** Value is {@code static} for static initializers. */
    INITIALIZER(Category.DECLARATION, Shape.FIXED, Category.STATEMENT),
    OTHER_DECLARATION(Category.DECLARATION, Shape.FIXED, Category.values()),

    // ==================== Parameters, arguments, attributes ====================

    /** Value is {@code ...} for a varargs parameter. {@link #MODIFIERS}, type, name. */
    PARAMETER(Category.PARAMETER, Shape.FIXED, Category.LIST, Category.TYPE, Category.EXPRESSION),
    ARGUMENT(Category.ARGUMENT, Shape.FIXED, Category.EXPRESSION),
    /** Named annotation value; value is the key. */
    ANNOTATION_VALUE(Category.ARGUMENT, Shape.FIXED, Category.EXPRESSION),
    MODIFIER(Category.ATTRIBUTE, Shape.LEAF),
    /** Value is the annotation name; children are its arguments. */
    ANNOTATION(Category.ATTRIBUTE, Shape.SEQUENCE, Category.ARGUMENT),

    // ==================== Lists ====================

    ARGUMENTS(Category.LIST, Shape.SEQUENCE, Flags.VARIADIC, Category.ARGUMENT),
    PARAMETERS(Category.LIST, Shape.SEQUENCE, Flags.VARIADIC, Category.PARAMETER),
    MODIFIERS(Category.LIST, Shape.UNORDERED, Flags.LENIENT, Category.ATTRIBUTE),
    TYPE_PARAMETERS(Category.LIST, Shape.SEQUENCE, Flags.LENIENT, Category.TYPE),
    SUPERTYPES(Category.LIST, Shape.UNORDERED, Flags.LENIENT, Category.TYPE),
    THROWS(Category.LIST, Shape.UNORDERED, Flags.LENIENT, Category.TYPE),
    MEMBERS(Category.LIST, Shape.SEQUENCE, Category.DECLARATION, Category.PARAMETER),
    EXPRESSIONS(Category.LIST, Shape.SEQUENCE, Category.EXPRESSION, Category.STATEMENT),
    /** Statement sequence outside a block; also the root of multi-statement patterns. */
    STATEMENTS(Category.LIST, Shape.SEQUENCE, Category.STATEMENT, Category.DECLARATION),
    CATCHES(Category.LIST, Shape.SEQUENCE, Category.STATEMENT),
    SWITCH_CASES(Category.LIST, Shape.SEQUENCE, Category.STATEMENT),

    // ==================== Pattern markers ====================

    /** Value is the metavariable name, e.g. {@code $X}. */
    METAVARIABLE(Category.PATTERN, Shape.LEAF),
    /** Value is the metavariable name, e.g. {@code $...ARGS}. */
    VARIADIC_METAVARIABLE(Category.PATTERN, Shape.LEAF),
    ELLIPSIS(Category.PATTERN, Shape.LEAF),
    /** Single child: the sub-pattern searched at this node or any descendant. */
    DEEP_ELLIPSIS(Category.PATTERN, Shape.FIXED, Category.values()),
    /** Matches any string literal. */
    STRING_ELLIPSIS(Category.PATTERN, Shape.LEAF);

    /**
     * How the children of a kind are matched.
     */
    public enum Shape {
        /** No children. */
        LEAF,
        /** Positional children; counts must agree. */
        FIXED,
        /** Ordered siblings; ellipses may absorb runs. */
        SEQUENCE,
        /** Siblings whose order carries no meaning; matched by pairing. */
        UNORDERED
    }

    private static final class Flags {
        static final int VARIADIC = 1;
        static final int LENIENT = 2;
    }

    private final Category category;
    private final Shape shape;
    private final Set<Category> childCategories;
    private final boolean variadicAllowed;
    private final boolean lenientWhenEmpty;

    NodeKind(Category category, Shape shape, Category... childCategories) {
        this(category, shape, 0, childCategories);
    }

    NodeKind(Category category, Shape shape, int flags, Category... childCategories) {
        this.category = category;
        this.shape = shape;
        this.childCategories = childCategories.length == 0
            ? EnumSet.noneOf(Category.class)
            : EnumSet.of(childCategories[0], childCategories);
        this.variadicAllowed = (flags & Flags.VARIADIC) != 0;
        this.lenientWhenEmpty = (flags & Flags.LENIENT) != 0;
    }

    public Category category() {
        return category;
    }

    public Shape shape() {
        return shape;
    }

    public boolean isLeaf() {
        return shape == Shape.LEAF;
    }

    public boolean isMarker() {
        return category == Category.PATTERN;
    }

    /**
     * Returns true if a {@code $...NAME} metavariable may appear among the children.
     */
    public boolean allowsVariadic() {
        return variadicAllowed;
    }

    /**
     * Returns true if an empty pattern list of this kind matches any target list.
     */
    public boolean isLenientWhenEmpty() {
        return lenientWhenEmpty;
    }

    /**
     * Returns true if a node of the given category may appear as a child of this kind in a
     * well-formed tree.
     *
     * @param childCategory category of the child node
     * @return true if the shape contract allows it
     */
    public boolean accepts(Category childCategory) {
        return childCategories.contains(childCategory);
    }
}
