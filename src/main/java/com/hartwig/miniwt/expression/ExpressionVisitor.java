package com.hartwig.miniwt.expression;

public interface ExpressionVisitor<T> {
    T visitLiteral(Literal literal);

    T visitVariableRef(VariableRef variableRef);

    T visitMemberRef(MemberRef memberRef);

    T visitFunctionCall(FunctionCall functionCall);

    T visitInterpolation(Interpolation interpolation);

    T visitArrayLiteral(ArrayLiteral arrayLiteral);

    T visitOperation(Operation operation);
}
