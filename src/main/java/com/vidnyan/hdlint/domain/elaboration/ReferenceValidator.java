package com.vidnyan.hdlint.domain.elaboration;

import com.vidnyan.hdlint.domain.elaboration.ElaborationException.ErrorKind;
import com.vidnyan.hdlint.domain.model.*;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that every name used by a process resolves in the enclosing architecture scope.
 * Unresolved names are elaboration errors, not rule findings.
 */
final class ReferenceValidator {

    /**
     * Predefined and standard-package functions a design may call without declaring them.
     * Any other call must name a signal or constant, i.e. be an indexed name.
     */
    static final Set<String> KNOWN_FUNCTIONS = Set.of(
            "rising_edge", "falling_edge",
            "to_integer", "to_unsigned", "to_signed", "unsigned", "signed",
            "std_logic_vector", "std_ulogic_vector", "std_logic", "std_ulogic", "integer", "natural",
            "to_stdlogicvector", "to_stdulogicvector", "to_bitvector", "to_bit", "to_x01", "is_x",
            "resize", "shift_left", "shift_right", "rotate_left", "rotate_right",
            "conv_integer", "conv_std_logic_vector", "minimum", "maximum");

    private final Scope scope;
    private final ProcessStatement process;

    ReferenceValidator(Scope scope, ProcessStatement process) {
        this.scope = scope;
        this.process = process;
    }

    void validate() {
        for (String signal : process.sensitivity()) {
            if (!scope.isSignal(signal)) {
                throw new ElaborationException(ErrorKind.UNRESOLVED_REFERENCE,
                        "Sensitivity list of process '" + process.label() + "' names undeclared signal '"
                                + signal + "'",
                        process.location());
            }
        }
        validateStatements(process.body());
    }

    private void validateStatements(List<SequentialStatement> statements) {
        for (SequentialStatement statement : statements) {
            switch (statement.kind()) {
                case ASSIGNMENT -> {
                    Assignment assignment = (Assignment) statement;
                    if (!scope.isSignal(assignment.targetSignal())) {
                        throw new ElaborationException(ErrorKind.UNRESOLVED_REFERENCE,
                                "Process '" + process.label() + "' assigns '" + assignment.targetSignal()
                                        + "', which is not a declared signal or port",
                                assignment.location());
                    }
                    assignment.targetIndices().forEach(i -> validateExpression(i, assignment.location()));
                    validateExpression(assignment.value(), assignment.location());
                }
                case IF -> {
                    IfStatement ifStatement = (IfStatement) statement;
                    for (Branch branch : ifStatement.branches()) {
                        validateExpression(branch.condition(), ifStatement.location());
                        validateStatements(branch.body());
                    }
                    ifStatement.elseBody().ifPresent(this::validateStatements);
                }
                case CASE -> {
                    CaseStatement caseStatement = (CaseStatement) statement;
                    validateExpression(caseStatement.selector(), caseStatement.location());
                    for (CaseAlternative alternative : caseStatement.alternatives()) {
                        validateStatements(alternative.body());
                    }
                    caseStatement.othersBody().ifPresent(this::validateStatements);
                }
                case NULL -> { }
            }
        }
    }

    private void validateExpression(Expression expression, Location location) {
        validate(scope, expression, location, "Process '" + process.label() + "'");
    }

    /**
     * Validate a port map actual in the instantiating architecture.
     */
    static void validateActual(Scope scope, Expression actual, Instantiation instantiation) {
        validate(scope, actual, instantiation.location(), "Port map of instance '" + instantiation.label() + "'");
    }

    private static void validate(Scope scope, Expression expression, Location location, String owner) {
        switch (expression.kind()) {
            case NAME -> {
                String name = ((Expression.Name) expression).identifier();
                if (!scope.isDeclared(name)) {
                    throw unresolved(owner, name, location);
                }
            }
            case CALL -> {
                Expression.Call call = (Expression.Call) expression;
                if (!scope.isDeclared(call.name())
                        && !KNOWN_FUNCTIONS.contains(call.name().toLowerCase(Locale.ROOT))) {
                    throw unresolved(owner, call.name(), location);
                }
                call.arguments().forEach(a -> validate(scope, a, location, owner));
            }
            case ATTRIBUTE -> {
                String prefix = ((Expression.Attribute) expression).prefix();
                if (!scope.isSignal(prefix)) {
                    throw unresolved(owner, prefix, location);
                }
            }
            case UNARY -> validate(scope, ((Expression.Unary) expression).operand(), location, owner);
            case BINARY -> {
                Expression.Binary binary = (Expression.Binary) expression;
                validate(scope, binary.left(), location, owner);
                validate(scope, binary.right(), location, owner);
            }
            case AGGREGATE -> ((Expression.Aggregate) expression).elements()
                    .forEach(e -> validate(scope, e, location, owner));
            case LITERAL -> { }
        }
    }

    private static ElaborationException unresolved(String owner, String name, Location location) {
        return new ElaborationException(ErrorKind.UNRESOLVED_REFERENCE,
                owner + " refers to undeclared name '" + name + "'", location);
    }
}
