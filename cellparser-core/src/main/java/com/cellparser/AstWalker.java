package com.cellparser;

import com.cellparser.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Depth-first traversal of an AST that hands each node to a visitor together
 * with its ancestors.
 *
 * <p>Nodes are visited after their children. Non-computed property keys,
 * non-computed member properties, labels and meta properties are names, not
 * references, and are not visited.</p>
 */
public final class AstWalker {

    @FunctionalInterface
    public interface Visitor {
        /**
         * @param ancestors the path from the root to {@code node}, with {@code node} last
         */
        void visit(Node node, List<Node> ancestors);
    }

    private AstWalker() {
    }

    public static void walk(Node root, Visitor visitor) {
        walk(root, new ArrayList<>(), visitor);
    }

    private static void walk(Node node, List<Node> ancestors, Visitor visitor) {
        ancestors.add(node);
        for (Node child : children(node)) {
            walk(child, ancestors, visitor);
        }
        visitor.visit(node, Collections.unmodifiableList(ancestors));
        ancestors.remove(ancestors.size() - 1);
    }

    /**
     * The visited children of a node, in source order.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        if (node instanceof Cell cell) {
            add(children, cell.body());
        } else if (node instanceof CellModule module) {
            children.addAll(module.cells());
        } else if (node instanceof Program program) {
            children.addAll(program.body());
        } else if (node instanceof ExpressionStatement statement) {
            add(children, statement.expression());
        } else if (node instanceof BlockStatement block) {
            children.addAll(block.body());
        } else if (node instanceof VariableDeclaration declaration) {
            children.addAll(declaration.declarations());
        } else if (node instanceof VariableDeclarator declarator) {
            add(children, declarator.id(), declarator.init());
        } else if (node instanceof FunctionDeclaration function) {
            add(children, function.id());
            children.addAll(function.params());
            add(children, function.body());
        } else if (node instanceof FunctionExpression function) {
            add(children, function.id());
            children.addAll(function.params());
            add(children, function.body());
        } else if (node instanceof ArrowFunctionExpression arrow) {
            children.addAll(arrow.params());
            add(children, arrow.body());
        } else if (node instanceof ClassDeclaration declaration) {
            add(children, declaration.id(), declaration.superClass(), declaration.body());
        } else if (node instanceof ClassExpression expression) {
            add(children, expression.id(), expression.superClass(), expression.body());
        } else if (node instanceof ClassBody body) {
            children.addAll(body.body());
        } else if (node instanceof MethodDefinition method) {
            if (method.computed()) {
                add(children, method.key());
            }
            add(children, method.value());
        } else if (node instanceof IfStatement statement) {
            add(children, statement.test(), statement.consequent(), statement.alternate());
        } else if (node instanceof ForStatement statement) {
            add(children, statement.init(), statement.test(), statement.update(), statement.body());
        } else if (node instanceof ForInStatement statement) {
            add(children, statement.left(), statement.right(), statement.body());
        } else if (node instanceof ForOfStatement statement) {
            add(children, statement.left(), statement.right(), statement.body());
        } else if (node instanceof WhileStatement statement) {
            add(children, statement.test(), statement.body());
        } else if (node instanceof DoWhileStatement statement) {
            add(children, statement.body(), statement.test());
        } else if (node instanceof ReturnStatement statement) {
            add(children, statement.argument());
        } else if (node instanceof ThrowStatement statement) {
            add(children, statement.argument());
        } else if (node instanceof LabeledStatement statement) {
            add(children, statement.body());
        } else if (node instanceof SwitchStatement statement) {
            add(children, statement.discriminant());
            children.addAll(statement.cases());
        } else if (node instanceof SwitchCase switchCase) {
            add(children, switchCase.test());
            children.addAll(switchCase.consequent());
        } else if (node instanceof TryStatement statement) {
            add(children, statement.block(), statement.handler(), statement.finalizer());
        } else if (node instanceof CatchClause clause) {
            add(children, clause.param(), clause.body());
        } else if (node instanceof WithStatement statement) {
            add(children, statement.object(), statement.body());
        } else if (node instanceof ImportDeclaration declaration) {
            add(children, declaration.source());
        } else if (node instanceof ArrayExpression array) {
            addAll(children, array.elements());
        } else if (node instanceof ArrayPattern array) {
            addAll(children, array.elements());
        } else if (node instanceof ObjectExpression object) {
            children.addAll(object.properties());
        } else if (node instanceof ObjectPattern object) {
            children.addAll(object.properties());
        } else if (node instanceof Property property) {
            if (property.computed()) {
                add(children, property.key());
            }
            add(children, property.value());
        } else if (node instanceof SpreadElement spread) {
            add(children, spread.argument());
        } else if (node instanceof RestElement rest) {
            add(children, rest.argument());
        } else if (node instanceof AssignmentPattern pattern) {
            add(children, pattern.left(), pattern.right());
        } else if (node instanceof AssignmentExpression assignment) {
            add(children, assignment.left(), assignment.right());
        } else if (node instanceof BinaryExpression binary) {
            add(children, binary.left(), binary.right());
        } else if (node instanceof LogicalExpression logical) {
            add(children, logical.left(), logical.right());
        } else if (node instanceof UnaryExpression unary) {
            add(children, unary.argument());
        } else if (node instanceof UpdateExpression update) {
            add(children, update.argument());
        } else if (node instanceof ConditionalExpression conditional) {
            add(children, conditional.test(), conditional.consequent(), conditional.alternate());
        } else if (node instanceof SequenceExpression sequence) {
            children.addAll(sequence.expressions());
        } else if (node instanceof CallExpression call) {
            add(children, call.callee());
            children.addAll(call.arguments());
        } else if (node instanceof NewExpression expression) {
            add(children, expression.callee());
            children.addAll(expression.arguments());
        } else if (node instanceof MemberExpression member) {
            add(children, member.object());
            if (member.computed()) {
                add(children, member.property());
            }
        } else if (node instanceof ChainExpression chain) {
            add(children, chain.expression());
        } else if (node instanceof TemplateLiteral template) {
            children.addAll(template.expressions());
        } else if (node instanceof TaggedTemplateExpression tagged) {
            add(children, tagged.tag(), tagged.quasi());
        } else if (node instanceof AwaitExpression await) {
            add(children, await.argument());
        } else if (node instanceof YieldExpression yieldExpression) {
            add(children, yieldExpression.argument());
        } else if (node instanceof ImportExpression expression) {
            add(children, expression.source());
        } else if (node instanceof ViewExpression view) {
            add(children, view.id());
        } else if (node instanceof MutableExpression mutable) {
            add(children, mutable.id());
        }
        return children;
    }

    private static void add(List<Node> children, Node... nodes) {
        for (Node node : nodes) {
            if (node != null) {
                children.add(node);
            }
        }
    }

    // Array holes are null
    private static void addAll(List<Node> children, List<? extends Node> nodes) {
        for (Node node : nodes) {
            if (node != null) {
                children.add(node);
            }
        }
    }
}
