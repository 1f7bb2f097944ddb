package com.cellparser;

import com.cellparser.ast.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the free references of a cell body: the names it reads that are
 * neither declared inside the cell nor recognized globals. These are the
 * names of other cells the cell depends on.
 *
 * <p>Resolution runs in three walks over the body. The first records the
 * names each scope declares, the second looks every identifier up through its
 * enclosing scopes, and the third rejects assignments to names the cell does
 * not declare.</p>
 */
public final class ReferenceFinder {

    private final Set<String> globals;
    private final Map<Node, Set<String>> locals = new IdentityHashMap<>();
    private final List<CellName> references = new ArrayList<>();

    private ReferenceFinder(Set<String> globals) {
        this.globals = globals;
    }

    /**
     * Returns the references of {@code cell} in source order. A name read
     * twice is listed twice. Identifiers under {@code viewof} or
     * {@code mutable} are reported as the enclosing view or mutable node.
     *
     * @throws IllegalReferenceException if the cell uses {@code arguments}
     *         outside a function or assigns to a name it does not declare
     */
    public static List<CellName> findReferences(Cell cell, Set<String> globals) {
        ReferenceFinder finder = new ReferenceFinder(globals);
        AstWalker.walk(cell, finder::declare);
        AstWalker.walk(cell, finder::resolve);
        AstWalker.walk(cell, finder::checkAssignment);
        return finder.references;
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private void declare(Node node, List<Node> ancestors) {
        if (node instanceof VariableDeclaration declaration) {
            boolean var = declaration.kind().equals("var");
            Node scope = null;
            for (int i = ancestors.size() - 1; i >= 0 && scope == null; i--) {
                Node candidate = ancestors.get(i);
                if (var ? isScope(candidate) : isBlockScope(candidate)) {
                    scope = candidate;
                }
            }
            for (VariableDeclarator declarator : declaration.declarations()) {
                declarePattern(scope, declarator.id());
            }
        } else if (node instanceof FunctionDeclaration function) {
            for (int i = ancestors.size() - 2; i >= 0; i--) {
                if (isScope(ancestors.get(i))) {
                    declareLocal(ancestors.get(i), function.id().name());
                    break;
                }
            }
            declareFunction(function, function.id(), function.params(), true);
        } else if (node instanceof FunctionExpression function) {
            declareFunction(function, function.id(), function.params(), true);
        } else if (node instanceof ArrowFunctionExpression arrow) {
            declareFunction(arrow, null, arrow.params(), false);
        } else if (node instanceof ClassDeclaration declaration) {
            for (int i = ancestors.size() - 2; i >= 0; i--) {
                if (isBlockScope(ancestors.get(i))) {
                    declareLocal(ancestors.get(i), declaration.id().name());
                    break;
                }
            }
            declareLocal(declaration, declaration.id().name());
        } else if (node instanceof ClassExpression expression) {
            if (expression.id() != null) {
                declareLocal(expression, expression.id().name());
            }
        } else if (node instanceof CatchClause clause) {
            if (clause.param() != null) {
                declarePattern(clause, clause.param());
            }
        }
    }

    private void declareFunction(Node function, Identifier id, List<Pattern> params, boolean hasArguments) {
        for (Pattern param : params) {
            declarePattern(function, param);
        }
        if (id != null) {
            declareLocal(function, id.name());
        }
        if (hasArguments) {
            declareLocal(function, "arguments");
        }
    }

    private void declarePattern(Node scope, Node pattern) {
        List<Identifier> names = new ArrayList<>();
        Parser.collectBindingIdentifiers(pattern, names);
        for (Identifier name : names) {
            declareLocal(scope, name.name());
        }
    }

    private void declareLocal(Node scope, String name) {
        locals.computeIfAbsent(scope, k -> new HashSet<>()).add(name);
    }

    private boolean hasLocal(Node scope, String name) {
        Set<String> names = locals.get(scope);
        return names != null && names.contains(name);
    }

    private static boolean isScope(Node node) {
        return node instanceof FunctionExpression
            || node instanceof FunctionDeclaration
            || node instanceof ArrowFunctionExpression
            || node instanceof Cell;
    }

    private static boolean isBlockScope(Node node) {
        return node instanceof BlockStatement
            || node instanceof ForStatement
            || node instanceof ForInStatement
            || node instanceof ForOfStatement
            || isScope(node);
    }

    // ========================================================================
    // References
    // ========================================================================

    private void resolve(Node node, List<Node> ancestors) {
        if (!(node instanceof Identifier identifier)) {
            return;
        }
        String name = identifier.name();
        if (name.equals("undefined")) {
            return;
        }
        CellName reference = identifier;
        for (int i = ancestors.size() - 2; i >= 0; i--) {
            Node ancestor = ancestors.get(i);
            if (hasLocal(ancestor, name)) {
                return;
            }
            if (ancestor instanceof ViewExpression view) {
                reference = view;
                name = "viewof " + view.id().name();
            } else if (ancestor instanceof MutableExpression mutable) {
                reference = mutable;
                name = "mutable " + mutable.id().name();
            }
        }
        if (globals.contains(name)) {
            return;
        }
        if (name.equals("arguments")) {
            throw new IllegalReferenceException("arguments is not allowed", reference);
        }
        references.add(reference);
    }

    // ========================================================================
    // Assignments
    // ========================================================================

    private void checkAssignment(Node node, List<Node> ancestors) {
        if (node instanceof AssignmentExpression assignment) {
            checkTarget(assignment.left(), ancestors);
        } else if (node instanceof AssignmentPattern pattern) {
            checkTarget(pattern.left(), ancestors);
        } else if (node instanceof UpdateExpression update) {
            checkTarget(update.argument(), ancestors);
        } else if (node instanceof ForOfStatement statement) {
            checkTarget(statement.left(), ancestors);
        } else if (node instanceof ForInStatement statement) {
            checkTarget(statement.left(), ancestors);
        }
    }

    // Declarations, member expressions and mutable names are always assignable
    private void checkTarget(Node target, List<Node> ancestors) {
        if (target instanceof Identifier identifier) {
            for (Node ancestor : ancestors) {
                if (hasLocal(ancestor, identifier.name())) {
                    return;
                }
            }
            throw new IllegalReferenceException("Assignment to constant variable " + identifier.name(), identifier);
        } else if (target instanceof ArrayPattern array) {
            for (Pattern element : array.elements()) {
                if (element != null) {
                    checkTarget(element, ancestors);
                }
            }
        } else if (target instanceof ObjectPattern object) {
            for (Node property : object.properties()) {
                checkTarget(property, ancestors);
            }
        } else if (target instanceof Property property) {
            checkTarget(property.value(), ancestors);
        } else if (target instanceof RestElement rest) {
            checkTarget(rest.argument(), ancestors);
        }
    }
}
