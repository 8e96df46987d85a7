package org.monkeylang.runtime;

import org.monkeylang.compiler.frontend.parser.ast.AstVisitor;
import org.monkeylang.compiler.frontend.parser.ast.BooleanLiteral;
import org.monkeylang.compiler.frontend.parser.ast.CallExpression;
import org.monkeylang.compiler.frontend.parser.ast.ExpressionStatement;
import org.monkeylang.compiler.frontend.parser.ast.Identifier;
import org.monkeylang.compiler.frontend.parser.ast.InfixExpression;
import org.monkeylang.compiler.frontend.parser.ast.IntegerLiteral;
import org.monkeylang.compiler.frontend.parser.ast.LetStatement;
import org.monkeylang.compiler.frontend.parser.ast.Node;
import org.monkeylang.compiler.frontend.parser.ast.PrefixExpression;
import org.monkeylang.compiler.frontend.parser.ast.Program;
import org.monkeylang.compiler.frontend.parser.ast.ReturnStatement;
import org.monkeylang.compiler.frontend.parser.ast.Statement;
import org.monkeylang.runtime.model.BooleanValue;
import org.monkeylang.runtime.model.IntegerValue;
import org.monkeylang.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Tree-walking evaluator. Reduces an AST to a runtime {@link Value} by direct recursion.
 *
 * <p>Evaluation is a pure function of the tree: the evaluator holds no state, so one instance
 * can be shared freely. Node variants without evaluation semantics yet (identifiers, operators,
 * calls, {@code let} and {@code return}) produce no value instead of failing;
 * an empty result means "nothing to report", not an error.
 */
public class Evaluator implements AstVisitor<Optional<Value>> {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Evaluates a node.
     * @param node The node to evaluate. {@code null} (a node the parser could not build) is allowed.
     * @return The resulting value, or empty if the node has no evaluable form.
     */
    public Optional<Value> eval(Node node) {
        if (node == null) {
            return Optional.empty();
        }
        return node.accept(this);
    }

    /**
     * Evaluates the statements in order. The result is the value of the last statement,
     * even when that statement produces no value.
     */
    @Override
    public Optional<Value> visitProgram(Program program) {
        Optional<Value> result = Optional.empty();
        for (Statement statement : program.statements()) {
            result = eval(statement);
        }
        return result;
    }

    @Override
    public Optional<Value> visitExpressionStatement(ExpressionStatement statement) {
        return eval(statement.expression());
    }

    @Override
    public Optional<Value> visitIntegerLiteral(IntegerLiteral literal) {
        return Optional.of(new IntegerValue(literal.value()));
    }

    @Override
    public Optional<Value> visitBooleanLiteral(BooleanLiteral literal) {
        return Optional.of(BooleanValue.of(literal.value()));
    }

    // --- Not evaluated yet ---

    @Override
    public Optional<Value> visitLetStatement(LetStatement statement) {
        return unsupported(statement);
    }

    @Override
    public Optional<Value> visitReturnStatement(ReturnStatement statement) {
        return unsupported(statement);
    }

    @Override
    public Optional<Value> visitIdentifier(Identifier identifier) {
        return unsupported(identifier);
    }

    @Override
    public Optional<Value> visitPrefixExpression(PrefixExpression expression) {
        return unsupported(expression);
    }

    @Override
    public Optional<Value> visitInfixExpression(InfixExpression expression) {
        return unsupported(expression);
    }

    @Override
    public Optional<Value> visitCallExpression(CallExpression expression) {
        return unsupported(expression);
    }

    private Optional<Value> unsupported(Node node) {
        LOG.trace("No evaluation rule for {} '{}'", node.getClass().getSimpleName(), node);
        return Optional.empty();
    }
}
