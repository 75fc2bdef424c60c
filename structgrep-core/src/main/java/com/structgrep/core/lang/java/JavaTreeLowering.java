package com.structgrep.core.lang.java;

import com.github.javaparser.Range;
import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MarkerAnnotationExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.IntersectionType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.TypeParameter;
import com.github.javaparser.ast.type.UnionType;
import com.github.javaparser.ast.type.UnknownType;
import com.github.javaparser.ast.type.VarType;
import com.github.javaparser.ast.type.VoidType;
import com.github.javaparser.ast.type.WildcardType;
import com.structgrep.core.location.LineIndex;
import com.structgrep.core.tree.Category;
import com.structgrep.core.tree.Node;
import com.structgrep.core.tree.NodeKind;
import com.structgrep.core.tree.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers a JavaParser AST into the generic tree.
 *
 * <p>One instance lowers one parsed text; spans are computed against that exact text. The
 * lowering is total: constructs without a dedicated kind become {@code OTHER_*} nodes whose
 * children are the lowered sub-constructs, so every file JavaParser accepts can be searched.
 *
 * <p>Conventions:
 * <ul>
 *   <li>Parentheses are transparent: {@code (a)} lowers to the node for {@code a}.</li>
 *   <li>Comments never enter the tree.</li>
 *   <li>Declarations with several declarators ({@code int a, b;}) become one node per
 *       declarator.</li>
 *   <li>A call {@code a.b(x)} lowers to {@code CALL(FIELD_ACCESS(a, b), ARGUMENTS(x))}.</li>
 *   <li>Empty lists get a zero-width span, at the closing parenthesis where there is one.</li>
 * </ul>
 */
final class JavaTreeLowering {

    private final String source;
    private final LineIndex lines;

    JavaTreeLowering(String source) {
        this.source = source;
        this.lines = new LineIndex(source);
    }

    // ==================== Spans ====================

    private Span span(com.github.javaparser.ast.Node node) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return Span.empty(0);
        }
        Range r = range.get();
        int start = lines.offset(r.begin.line, r.begin.column);
        int end = Math.min(lines.offset(r.end.line, r.end.column) + 1, source.length());
        return new Span(start, Math.max(start, end));
    }

    private String text(com.github.javaparser.ast.Node node) {
        Span span = span(node);
        return source.substring(span.start(), span.end());
    }

    /**
     * Span of a parenthesised list: covering its elements, or zero-width at the closing
     * parenthesis found after {@code searchFrom}.
     */
    private Span parenthesisedSpan(List<Node> elements, int searchFrom) {
        if (!elements.isEmpty()) {
            return covering(elements);
        }
        int open = source.indexOf('(', searchFrom);
        if (open < 0) {
            return Span.empty(searchFrom);
        }
        int close = source.indexOf(')', open);
        return Span.empty(close < 0 ? open + 1 : close);
    }

    private static Span listSpan(List<Node> elements, int emptyAt) {
        return elements.isEmpty() ? Span.empty(emptyAt) : covering(elements);
    }

    private static Span covering(List<Node> elements) {
        return Span.covering(elements.get(0).span(), elements.get(elements.size() - 1).span());
    }

    // ==================== Declarations ====================

    Node lowerCompilationUnit(CompilationUnit unit) {
        List<Node> children = new ArrayList<>();
        unit.getPackageDeclaration().ifPresent(pkg ->
            children.add(Node.leaf(NodeKind.PACKAGE, pkg.getNameAsString(), span(pkg))));
        for (ImportDeclaration imp : unit.getImports()) {
            String name = (imp.isStatic() ? "static " : "") + imp.getNameAsString() + (imp.isAsterisk() ? ".*" : "");
            children.add(Node.leaf(NodeKind.IMPORT, name, span(imp)));
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            children.addAll(lowerMember(type));
        }
        return Node.of(NodeKind.COMPILATION_UNIT, new Span(0, source.length()), children);
    }

    /**
     * Lowers a class member; fields with several declarators yield several nodes.
     */
    List<Node> lowerMember(BodyDeclaration<?> member) {
        if (member instanceof ClassOrInterfaceDeclaration decl) {
            List<Node> supertypes = new ArrayList<>();
            decl.getExtendedTypes().forEach(t -> supertypes.add(lowerType(t)));
            decl.getImplementedTypes().forEach(t -> supertypes.add(lowerType(t)));
            return List.of(classNode(decl.isInterface() ? "interface" : "class", decl, decl.getTypeParameters(),
                supertypes, lowerMembers(decl.getMembers(), List.of())));
        }
        if (member instanceof EnumDeclaration decl) {
            List<Node> members = new ArrayList<>();
            decl.getEntries().forEach(entry -> members.addAll(lowerMember(entry)));
            return List.of(classNode("enum", decl, new NodeList<>(), lowerTypes(decl.getImplementedTypes()),
                lowerMembers(decl.getMembers(), members)));
        }
        if (member instanceof RecordDeclaration decl) {
            List<Node> components = new ArrayList<>();
            decl.getParameters().forEach(p -> components.add(lowerParameter(p)));
            return List.of(classNode("record", decl, decl.getTypeParameters(), lowerTypes(decl.getImplementedTypes()),
                lowerMembers(decl.getMembers(), components)));
        }
        if (member instanceof AnnotationDeclaration decl) {
            return List.of(classNode("@interface", decl, new NodeList<>(), List.of(),
                lowerMembers(decl.getMembers(), List.of())));
        }
        if (member instanceof MethodDeclaration method) {
            List<Node> children = new ArrayList<>();
            children.add(lowerModifiers(method.getModifiers(), method.getAnnotations(), span(method).start()));
            children.add(lowerTypeParameters(method.getTypeParameters(), span(method).start()));
            children.add(lowerType(method.getType()));
            children.add(identifier(method.getName()));
            children.add(lowerParameters(method.getParameters(), span(method.getName()).end()));
            children.add(lowerThrows(method.getThrownExceptions(), method));
            method.getBody().ifPresent(body -> children.add(lowerBlock(body)));
            return List.of(Node.of(NodeKind.METHOD, span(method), children));
        }
        if (member instanceof ConstructorDeclaration constructor) {
            List<Node> children = new ArrayList<>();
            children.add(lowerModifiers(constructor.getModifiers(), constructor.getAnnotations(), span(constructor).start()));
            children.add(lowerTypeParameters(constructor.getTypeParameters(), span(constructor).start()));
            children.add(identifier(constructor.getName()));
            children.add(lowerParameters(constructor.getParameters(), span(constructor.getName()).end()));
            children.add(lowerThrows(constructor.getThrownExceptions(), constructor));
            children.add(lowerBlock(constructor.getBody()));
            return List.of(Node.of(NodeKind.CONSTRUCTOR, span(constructor), children));
        }
        if (member instanceof CompactConstructorDeclaration constructor) {
            int at = span(constructor.getName()).end();
            List<Node> children = new ArrayList<>();
            children.add(lowerModifiers(constructor.getModifiers(), constructor.getAnnotations(), span(constructor).start()));
            children.add(lowerTypeParameters(constructor.getTypeParameters(), span(constructor).start()));
            children.add(identifier(constructor.getName()));
            children.add(Node.of(NodeKind.PARAMETERS, Span.empty(at), List.of()));
            children.add(lowerThrows(constructor.getThrownExceptions(), constructor));
            children.add(lowerBlock(constructor.getBody()));
            return List.of(Node.of(NodeKind.CONSTRUCTOR, span(constructor), children));
        }
        if (member instanceof FieldDeclaration field) {
            List<Node> fields = new ArrayList<>();
            for (VariableDeclarator variable : field.getVariables()) {
                List<Node> children = new ArrayList<>();
                children.add(lowerModifiers(field.getModifiers(), field.getAnnotations(), span(field).start()));
                children.add(lowerType(variable.getType()));
                children.add(identifier(variable.getName()));
                variable.getInitializer().ifPresent(init -> children.add(lowerExpression(init)));
                fields.add(Node.of(NodeKind.FIELD, span(field), children));
            }
            return fields;
        }
        if (member instanceof InitializerDeclaration initializer) {
            return List.of(Node.of(NodeKind.INITIALIZER, initializer.isStatic() ? "static" : "", span(initializer),
                List.of(lowerBlock(initializer.getBody()))));
        }
        if (member instanceof EnumConstantDeclaration constant) {
            List<Node> children = new ArrayList<>();
            children.add(lowerModifiers(new NodeList<>(), constant.getAnnotations(), span(constant).start()));
            children.add(identifier(constant.getName()));
            children.add(lowerArguments(constant.getArguments(), span(constant.getName()).end()));
            if (constant.getClassBody().isNonEmpty()) {
                children.add(lowerMembers(constant.getClassBody(), List.of()));
            }
            return List.of(Node.of(NodeKind.ENUM_CONSTANT, span(constant), children));
        }
        return List.of(Node.of(NodeKind.OTHER_DECLARATION, member.getClass().getSimpleName(), span(member),
            lowerGeneric(member)));
    }

    private Node classNode(String keyword, TypeDeclaration<?> decl, NodeList<TypeParameter> typeParameters,
                           List<Node> supertypes, Node members) {
        int start = span(decl).start();
        List<Node> children = List.of(
            lowerModifiers(decl.getModifiers(), decl.getAnnotations(), start),
            identifier(decl.getName()),
            lowerTypeParameters(typeParameters, span(decl.getName()).end()),
            Node.of(NodeKind.SUPERTYPES, listSpan(supertypes, span(decl.getName()).end()), supertypes),
            members);
        return Node.of(NodeKind.CLASS, keyword, span(decl), children);
    }

    private Node lowerMembers(NodeList<BodyDeclaration<?>> members, List<Node> leading) {
        List<Node> children = new ArrayList<>(leading);
        for (BodyDeclaration<?> member : members) {
            children.addAll(lowerMember(member));
        }
        int emptyAt = members.getParentNode().map(parent -> span(parent).end() - 1).orElse(0);
        return Node.of(NodeKind.MEMBERS, listSpan(children, Math.max(emptyAt, 0)), children);
    }

    private Node lowerModifiers(NodeList<Modifier> modifiers, NodeList<AnnotationExpr> annotations, int emptyAt) {
        List<Node> children = new ArrayList<>();
        annotations.forEach(annotation -> children.add(lowerAnnotation(annotation)));
        modifiers.forEach(modifier ->
            children.add(Node.leaf(NodeKind.MODIFIER, modifier.getKeyword().asString(), span(modifier))));
        children.sort((a, b) -> a.span().compareTo(b.span()));
        return Node.of(NodeKind.MODIFIERS, listSpan(children, emptyAt), children);
    }

    private Node lowerAnnotation(AnnotationExpr annotation) {
        List<Node> arguments = new ArrayList<>();
        if (annotation instanceof SingleMemberAnnotationExpr single) {
            Node value = lowerExpression(single.getMemberValue());
            arguments.add(Node.of(NodeKind.ARGUMENT, value.span(), List.of(value)));
        } else if (annotation instanceof NormalAnnotationExpr normal) {
            for (MemberValuePair pair : normal.getPairs()) {
                arguments.add(Node.of(NodeKind.ANNOTATION_VALUE, pair.getNameAsString(), span(pair),
                    List.of(lowerExpression(pair.getValue()))));
            }
        }
        return Node.of(NodeKind.ANNOTATION, annotation.getNameAsString(), span(annotation), arguments);
    }

    private Node lowerTypeParameters(NodeList<TypeParameter> typeParameters, int emptyAt) {
        List<Node> children = new ArrayList<>();
        typeParameters.forEach(tp -> children.add(lowerType(tp)));
        return Node.of(NodeKind.TYPE_PARAMETERS, listSpan(children, emptyAt), children);
    }

    private Node lowerParameters(NodeList<Parameter> parameters, int searchFrom) {
        List<Node> children = new ArrayList<>();
        parameters.forEach(p -> children.add(lowerParameter(p)));
        return Node.of(NodeKind.PARAMETERS, parenthesisedSpan(children, searchFrom), children);
    }

    private Node lowerParameter(Parameter parameter) {
        List<Node> children = List.of(
            lowerModifiers(parameter.getModifiers(), parameter.getAnnotations(), span(parameter).start()),
            lowerType(parameter.getType()),
            identifier(parameter.getName()));
        return Node.of(NodeKind.PARAMETER, parameter.isVarArgs() ? "..." : "", span(parameter), children);
    }

    private Node lowerThrows(NodeList<? extends Type> thrown, com.github.javaparser.ast.Node owner) {
        List<Node> children = lowerTypes(thrown);
        return Node.of(NodeKind.THROWS, listSpan(children, span(owner).start()), children);
    }

    private Node identifier(SimpleName name) {
        return Node.leaf(NodeKind.IDENTIFIER, name.getIdentifier(), span(name));
    }

    // ==================== Types ====================

    private List<Node> lowerTypes(NodeList<? extends Type> types) {
        List<Node> lowered = new ArrayList<>();
        types.forEach(t -> lowered.add(lowerType(t)));
        return lowered;
    }

    Node lowerType(Type type) {
        Span span = span(type);
        if (type instanceof ClassOrInterfaceType named) {
            List<Node> arguments = named.getTypeArguments().map(this::lowerTypes).orElse(List.of());
            return Node.of(NodeKind.TYPE_NAME, named.getNameWithScope(), span, arguments);
        }
        if (type instanceof PrimitiveType primitive) {
            return Node.leaf(NodeKind.PRIMITIVE_TYPE, primitive.asString(), span);
        }
        if (type instanceof VoidType) {
            return Node.leaf(NodeKind.VOID_TYPE, "void", span);
        }
        if (type instanceof VarType) {
            return Node.leaf(NodeKind.VAR_TYPE, "var", span);
        }
        if (type instanceof UnknownType) {
            return Node.leaf(NodeKind.INFERRED_TYPE, "", span);
        }
        if (type instanceof ArrayType array) {
            return Node.of(NodeKind.ARRAY_TYPE, span, List.of(lowerType(array.getComponentType())));
        }
        if (type instanceof WildcardType wildcard) {
            if (wildcard.getExtendedType().isPresent()) {
                return Node.of(NodeKind.WILDCARD_TYPE, "? extends", span, List.of(lowerType(wildcard.getExtendedType().get())));
            }
            if (wildcard.getSuperType().isPresent()) {
                return Node.of(NodeKind.WILDCARD_TYPE, "? super", span, List.of(lowerType(wildcard.getSuperType().get())));
            }
            return Node.of(NodeKind.WILDCARD_TYPE, "?", span, List.of());
        }
        if (type instanceof TypeParameter parameter) {
            return Node.of(NodeKind.TYPE_PARAMETER, parameter.getNameAsString(), span, lowerTypes(parameter.getTypeBound()));
        }
        if (type instanceof UnionType union) {
            return Node.of(NodeKind.OTHER_TYPE, "|", span, lowerTypes(union.getElements()));
        }
        if (type instanceof IntersectionType intersection) {
            return Node.of(NodeKind.OTHER_TYPE, "&", span, lowerTypes(intersection.getElements()));
        }
        return Node.of(NodeKind.OTHER_TYPE, type.getClass().getSimpleName(), span, lowerGeneric(type));
    }

    // ==================== Statements ====================

    Node lowerBlock(BlockStmt block) {
        return Node.of(NodeKind.BLOCK, span(block), lowerStatementList(block.getStatements()));
    }

    private List<Node> lowerStatementList(NodeList<Statement> statements) {
        List<Node> lowered = new ArrayList<>();
        statements.forEach(statement -> lowered.addAll(lowerStatement(statement)));
        return lowered;
    }

    /**
     * Lowers a statement; local declarations with several declarators yield several nodes.
     */
    List<Node> lowerStatement(Statement statement) {
        if (statement instanceof ExpressionStmt expressionStmt) {
            if (expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
                return lowerLocalVariables(declaration, span(statement));
            }
            return List.of(Node.of(NodeKind.EXPRESSION_STATEMENT, span(statement),
                List.of(lowerExpression(expressionStmt.getExpression()))));
        }
        if (statement instanceof LocalClassDeclarationStmt local) {
            return lowerMember(local.getClassDeclaration());
        }
        if (statement instanceof LocalRecordDeclarationStmt local) {
            return lowerMember(local.getRecordDeclaration());
        }
        return List.of(lowerSingleStatement(statement));
    }

    private Node lowerSingleStatement(Statement statement) {
        Span span = span(statement);
        if (statement instanceof BlockStmt block) {
            return lowerBlock(block);
        }
        if (statement instanceof IfStmt ifStmt) {
            List<Node> children = new ArrayList<>();
            children.add(lowerExpression(ifStmt.getCondition()));
            children.add(asOneStatement(ifStmt.getThenStmt()));
            ifStmt.getElseStmt().ifPresent(elseStmt -> children.add(asOneStatement(elseStmt)));
            return Node.of(NodeKind.IF, span, children);
        }
        if (statement instanceof WhileStmt whileStmt) {
            return Node.of(NodeKind.WHILE, span,
                List.of(lowerExpression(whileStmt.getCondition()), asOneStatement(whileStmt.getBody())));
        }
        if (statement instanceof DoStmt doStmt) {
            return Node.of(NodeKind.DO_WHILE, span,
                List.of(asOneStatement(doStmt.getBody()), lowerExpression(doStmt.getCondition())));
        }
        if (statement instanceof ForStmt forStmt) {
            int at = span.start();
            List<Node> compare = forStmt.getCompare().map(c -> List.of(lowerExpression(c))).orElse(List.of());
            List<Node> update = lowerExpressionsOrDeclarations(forStmt.getUpdate());
            List<Node> init = lowerExpressionsOrDeclarations(forStmt.getInitialization());
            return Node.of(NodeKind.FOR, span, List.of(
                Node.of(NodeKind.EXPRESSIONS, listSpan(init, at), init),
                Node.of(NodeKind.EXPRESSIONS, listSpan(compare, at), compare),
                Node.of(NodeKind.EXPRESSIONS, listSpan(update, at), update),
                asOneStatement(forStmt.getBody())));
        }
        if (statement instanceof ForEachStmt forEach) {
            Node variable = lowerLocalVariables(forEach.getVariable(), span(forEach.getVariable())).get(0);
            return Node.of(NodeKind.FOR_EACH, span,
                List.of(variable, lowerExpression(forEach.getIterable()), asOneStatement(forEach.getBody())));
        }
        if (statement instanceof ReturnStmt returnStmt) {
            List<Node> children = returnStmt.getExpression().map(e -> List.of(lowerExpression(e))).orElse(List.of());
            return Node.of(NodeKind.RETURN, span, children);
        }
        if (statement instanceof ThrowStmt throwStmt) {
            return Node.of(NodeKind.THROW, span, List.of(lowerExpression(throwStmt.getExpression())));
        }
        if (statement instanceof BreakStmt breakStmt) {
            return Node.leaf(NodeKind.BREAK, breakStmt.getLabel().map(SimpleName::getIdentifier).orElse(""), span);
        }
        if (statement instanceof ContinueStmt continueStmt) {
            return Node.leaf(NodeKind.CONTINUE, continueStmt.getLabel().map(SimpleName::getIdentifier).orElse(""), span);
        }
        if (statement instanceof TryStmt tryStmt) {
            return lowerTry(tryStmt, span);
        }
        if (statement instanceof SwitchStmt switchStmt) {
            return Node.of(NodeKind.SWITCH, span, List.of(
                lowerExpression(switchStmt.getSelector()),
                lowerSwitchEntries(switchStmt.getEntries(), span)));
        }
        if (statement instanceof SynchronizedStmt sync) {
            return Node.of(NodeKind.SYNCHRONIZED, span,
                List.of(lowerExpression(sync.getExpression()), lowerBlock(sync.getBody())));
        }
        if (statement instanceof LabeledStmt labeled) {
            return Node.of(NodeKind.LABELED, labeled.getLabel().getIdentifier(), span,
                List.of(asOneStatement(labeled.getStatement())));
        }
        if (statement instanceof AssertStmt assertStmt) {
            List<Node> children = new ArrayList<>();
            children.add(lowerExpression(assertStmt.getCheck()));
            assertStmt.getMessage().ifPresent(message -> children.add(lowerExpression(message)));
            return Node.of(NodeKind.ASSERT, span, children);
        }
        if (statement instanceof YieldStmt yield) {
            return Node.of(NodeKind.YIELD, span, List.of(lowerExpression(yield.getExpression())));
        }
        if (statement instanceof ExplicitConstructorInvocationStmt call) {
            List<Node> children = new ArrayList<>();
            call.getExpression().ifPresent(e -> children.add(lowerExpression(e)));
            children.add(lowerArguments(call.getArguments(), span.start()));
            return Node.of(NodeKind.CONSTRUCTOR_CALL, call.isThis() ? "this" : "super", span, children);
        }
        if (statement instanceof EmptyStmt) {
            return Node.leaf(NodeKind.EMPTY, "", span);
        }
        return Node.of(NodeKind.OTHER_STATEMENT, statement.getClass().getSimpleName(), span, lowerGeneric(statement));
    }

    private Node asOneStatement(Statement statement) {
        List<Node> lowered = lowerStatement(statement);
        if (lowered.size() == 1 && lowered.get(0).category() == Category.STATEMENT) {
            return lowered.get(0);
        }
        return Node.of(NodeKind.BLOCK, span(statement), lowered);
    }

    private Node lowerTry(TryStmt tryStmt, Span span) {
        List<Node> resources = lowerExpressionsOrDeclarations(tryStmt.getResources());
        List<Node> catches = new ArrayList<>();
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            catches.add(Node.of(NodeKind.CATCH, span(clause),
                List.of(lowerParameter(clause.getParameter()), lowerBlock(clause.getBody()))));
        }
        Node block = lowerBlock(tryStmt.getTryBlock());
        List<Node> children = new ArrayList<>();
        children.add(Node.of(NodeKind.EXPRESSIONS, listSpan(resources, span.start()), resources));
        children.add(block);
        children.add(Node.of(NodeKind.CATCHES, listSpan(catches, block.span().end()), catches));
        tryStmt.getFinallyBlock().ifPresent(finallyBlock -> children.add(lowerBlock(finallyBlock)));
        return Node.of(NodeKind.TRY, span, children);
    }

    private Node lowerSwitchEntries(NodeList<SwitchEntry> entries, Span owner) {
        List<Node> cases = new ArrayList<>();
        for (SwitchEntry entry : entries) {
            Span entrySpan = span(entry);
            List<Node> labels = new ArrayList<>();
            entry.getLabels().forEach(label -> labels.add(lowerExpression(label)));
            List<Node> body = lowerStatementList(entry.getStatements());
            String arrow = entry.getType() == SwitchEntry.Type.STATEMENT_GROUP ? ":" : "->";
            cases.add(Node.of(NodeKind.SWITCH_CASE, arrow, entrySpan, List.of(
                Node.of(NodeKind.EXPRESSIONS, listSpan(labels, entrySpan.start()), labels),
                Node.of(NodeKind.STATEMENTS, listSpan(body, entrySpan.end()), body))));
        }
        return Node.of(NodeKind.SWITCH_CASES, listSpan(cases, owner.end() - 1), cases);
    }

    private List<Node> lowerLocalVariables(VariableDeclarationExpr declaration, Span span) {
        List<Node> locals = new ArrayList<>();
        for (VariableDeclarator variable : declaration.getVariables()) {
            List<Node> children = new ArrayList<>();
            children.add(lowerModifiers(declaration.getModifiers(), declaration.getAnnotations(), span.start()));
            children.add(lowerType(variable.getType()));
            children.add(identifier(variable.getName()));
            variable.getInitializer().ifPresent(init -> children.add(lowerExpression(init)));
            locals.add(Node.of(NodeKind.LOCAL_VARIABLE, span, children));
        }
        return locals;
    }

    private List<Node> lowerExpressionsOrDeclarations(NodeList<Expression> expressions) {
        List<Node> lowered = new ArrayList<>();
        for (Expression expression : expressions) {
            if (expression instanceof VariableDeclarationExpr declaration) {
                lowered.addAll(lowerLocalVariables(declaration, span(declaration)));
            } else {
                lowered.add(lowerExpression(expression));
            }
        }
        return lowered;
    }

    // ==================== Expressions ====================

    Node lowerExpression(Expression expression) {
        Span span = span(expression);
        if (expression instanceof EnclosedExpr enclosed) {
            return lowerExpression(enclosed.getInner());
        }
        if (expression instanceof NameExpr name) {
            return Node.leaf(NodeKind.IDENTIFIER, name.getNameAsString(), span);
        }
        if (expression instanceof IntegerLiteralExpr || expression instanceof LongLiteralExpr) {
            return Node.leaf(NodeKind.INTEGER_LITERAL, ((LiteralStringValueExpr) expression).getValue(), span);
        }
        if (expression instanceof DoubleLiteralExpr number) {
            return Node.leaf(NodeKind.FLOAT_LITERAL, number.getValue(), span);
        }
        if (expression instanceof TextBlockLiteralExpr) {
            return Node.leaf(NodeKind.STRING_LITERAL, text(expression), span);
        }
        if (expression instanceof StringLiteralExpr string) {
            return Node.leaf(NodeKind.STRING_LITERAL, "\"" + string.getValue() + "\"", span);
        }
        if (expression instanceof CharLiteralExpr character) {
            return Node.leaf(NodeKind.CHAR_LITERAL, "'" + character.getValue() + "'", span);
        }
        if (expression instanceof BooleanLiteralExpr bool) {
            return Node.leaf(NodeKind.BOOLEAN_LITERAL, String.valueOf(bool.getValue()), span);
        }
        if (expression instanceof NullLiteralExpr) {
            return Node.leaf(NodeKind.NULL_LITERAL, "null", span);
        }
        if (expression instanceof ThisExpr thisExpr) {
            return Node.leaf(NodeKind.THIS, thisExpr.getTypeName().map(Name::asString).orElse(""), span);
        }
        if (expression instanceof SuperExpr superExpr) {
            return Node.leaf(NodeKind.SUPER, superExpr.getTypeName().map(Name::asString).orElse(""), span);
        }
        if (expression instanceof BinaryExpr binary) {
            return Node.of(NodeKind.BINARY, binary.getOperator().asString(), span,
                List.of(lowerExpression(binary.getLeft()), lowerExpression(binary.getRight())));
        }
        if (expression instanceof UnaryExpr unary) {
            return Node.of(NodeKind.UNARY, unary.getOperator().name(), span,
                List.of(lowerExpression(unary.getExpression())));
        }
        if (expression instanceof AssignExpr assign) {
            return Node.of(NodeKind.ASSIGN, assign.getOperator().asString(), span,
                List.of(lowerExpression(assign.getTarget()), lowerExpression(assign.getValue())));
        }
        if (expression instanceof MethodCallExpr call) {
            Node name = identifier(call.getName());
            Node callee = call.getScope()
                .map(scope -> {
                    Node receiver = lowerExpression(scope);
                    return Node.of(NodeKind.FIELD_ACCESS, Span.covering(receiver.span(), name.span()), List.of(receiver, name));
                })
                .orElse(name);
            return Node.of(NodeKind.CALL, span, List.of(callee, lowerArguments(call.getArguments(), name.span().end())));
        }
        if (expression instanceof FieldAccessExpr access) {
            return Node.of(NodeKind.FIELD_ACCESS, span,
                List.of(lowerExpression(access.getScope()), identifier(access.getName())));
        }
        if (expression instanceof ArrayAccessExpr access) {
            return Node.of(NodeKind.ARRAY_ACCESS, span,
                List.of(lowerExpression(access.getName()), lowerExpression(access.getIndex())));
        }
        if (expression instanceof ObjectCreationExpr creation) {
            Node type = lowerType(creation.getType());
            List<Node> children = new ArrayList<>();
            children.add(type);
            children.add(lowerArguments(creation.getArguments(), type.span().end()));
            creation.getAnonymousClassBody().ifPresent(body -> children.add(lowerMembers(body, List.of())));
            return Node.of(NodeKind.NEW_OBJECT, span, children);
        }
        if (expression instanceof ArrayCreationExpr creation) {
            Node type = lowerType(creation.getElementType());
            List<Node> dimensions = new ArrayList<>();
            for (ArrayCreationLevel level : creation.getLevels()) {
                type = Node.of(NodeKind.ARRAY_TYPE, Span.covering(type.span(), span(level)), List.of(type));
                level.getDimension().ifPresent(d -> dimensions.add(lowerExpression(d)));
            }
            List<Node> children = new ArrayList<>();
            children.add(type);
            children.add(Node.of(NodeKind.EXPRESSIONS, listSpan(dimensions, type.span().end()), dimensions));
            creation.getInitializer().ifPresent(init -> children.add(lowerExpression(init)));
            return Node.of(NodeKind.NEW_ARRAY, span, children);
        }
        if (expression instanceof ArrayInitializerExpr initializer) {
            List<Node> values = new ArrayList<>();
            initializer.getValues().forEach(v -> values.add(lowerExpression(v)));
            return Node.of(NodeKind.ARRAY_INITIALIZER, span, values);
        }
        if (expression instanceof ConditionalExpr conditional) {
            return Node.of(NodeKind.CONDITIONAL, span, List.of(
                lowerExpression(conditional.getCondition()),
                lowerExpression(conditional.getThenExpr()),
                lowerExpression(conditional.getElseExpr())));
        }
        if (expression instanceof CastExpr cast) {
            return Node.of(NodeKind.CAST, span, List.of(lowerType(cast.getType()), lowerExpression(cast.getExpression())));
        }
        if (expression instanceof InstanceOfExpr instanceOf) {
            return Node.of(NodeKind.INSTANCE_OF, span,
                List.of(lowerExpression(instanceOf.getExpression()), lowerType(instanceOf.getType())));
        }
        if (expression instanceof LambdaExpr lambda) {
            List<Node> parameters = new ArrayList<>();
            lambda.getParameters().forEach(p -> parameters.add(lowerParameter(p)));
            Node body = lambda.getExpressionBody()
                .map(this::lowerExpression)
                .orElseGet(() -> asOneStatement(lambda.getBody()));
            return Node.of(NodeKind.LAMBDA, span, List.of(
                Node.of(NodeKind.PARAMETERS, parenthesisedSpan(parameters, span.start()), parameters), body));
        }
        if (expression instanceof MethodReferenceExpr reference) {
            Node scope = reference.getScope() instanceof TypeExpr typeExpr
                ? lowerType(typeExpr.getType())
                : lowerExpression(reference.getScope());
            return Node.of(NodeKind.METHOD_REFERENCE, reference.getIdentifier(), span, List.of(scope));
        }
        if (expression instanceof TypeExpr typeExpr) {
            // a type in expression position outside a method reference
            return Node.of(NodeKind.OTHER_EXPRESSION, "type", span, List.of(lowerType(typeExpr.getType())));
        }
        if (expression instanceof ClassExpr classExpr) {
            return Node.of(NodeKind.CLASS_LITERAL, span, List.of(lowerType(classExpr.getType())));
        }
        if (expression instanceof SwitchExpr switchExpr) {
            return Node.of(NodeKind.SWITCH_EXPRESSION, span, List.of(
                lowerExpression(switchExpr.getSelector()),
                lowerSwitchEntries(switchExpr.getEntries(), span)));
        }
        if (expression instanceof MarkerAnnotationExpr
            || expression instanceof SingleMemberAnnotationExpr
            || expression instanceof NormalAnnotationExpr) {
            return Node.of(NodeKind.OTHER_EXPRESSION, "annotation", span, List.of(lowerAnnotation((AnnotationExpr) expression)));
        }
        if (expression instanceof VariableDeclarationExpr declaration) {
            return Node.of(NodeKind.OTHER_EXPRESSION, "declaration", span, lowerLocalVariables(declaration, span));
        }
        return Node.of(NodeKind.OTHER_EXPRESSION, expression.getClass().getSimpleName(), span, lowerGeneric(expression));
    }

    private Node lowerArguments(NodeList<Expression> arguments, int searchFrom) {
        List<Node> children = new ArrayList<>();
        for (Expression argument : arguments) {
            Node value = lowerExpression(argument);
            children.add(Node.of(NodeKind.ARGUMENT, value.span(), List.of(value)));
        }
        return Node.of(NodeKind.ARGUMENTS, parenthesisedSpan(children, searchFrom), children);
    }

    // ==================== Fallback ====================

    /**
     * Lowers the sub-constructs of a node that has no dedicated kind.
     */
    private List<Node> lowerGeneric(com.github.javaparser.ast.Node node) {
        List<Node> children = new ArrayList<>();
        for (com.github.javaparser.ast.Node child : node.getChildNodes()) {
            if (child instanceof Comment) {
                continue;
            }
            if (child instanceof Expression expression) {
                children.add(lowerExpression(expression));
            } else if (child instanceof Statement statement) {
                children.addAll(lowerStatement(statement));
            } else if (child instanceof Type type) {
                children.add(lowerType(type));
            } else if (child instanceof BodyDeclaration<?> member) {
                children.addAll(lowerMember(member));
            } else if (child instanceof Parameter parameter) {
                children.add(lowerParameter(parameter));
            } else if (child instanceof SimpleName name) {
                children.add(identifier(name));
            } else if (child instanceof Name name) {
                children.add(Node.leaf(NodeKind.IDENTIFIER, name.asString(), span(name)));
            } else if (child instanceof Modifier modifier) {
                children.add(Node.leaf(NodeKind.MODIFIER, modifier.getKeyword().asString(), span(modifier)));
            } else {
                children.addAll(lowerGeneric(child));
            }
        }
        return children;
    }
}
