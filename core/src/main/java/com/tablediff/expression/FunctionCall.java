package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a call to a SQL function shared by all supported
 * dialects, such as {@code COALESCE}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    /**
     * Creates a function call.
     *
     * @param functionName the function name, written as is
     * @param arguments the arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public String toSQL(SQLDialect dialect) {
        return functionName + "(" +
               arguments.stream().map(arg -> arg.toSQL(dialect)).collect(Collectors.joining(", ")) +
               ")";
    }

    @Override
    public String toString() {
        return functionName + arguments;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }

    public static FunctionCall coalesce(Expression... arguments) {
        return new FunctionCall("COALESCE", List.of(arguments));
    }
}
