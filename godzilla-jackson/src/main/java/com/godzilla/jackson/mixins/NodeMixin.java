package com.godzilla.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.godzilla.ast.*;

/**
 * Polymorphic type handling for the AST: the {@code type} property selects the
 * record to decode into. This annotation is the node kind registry; a new kind
 * needs one entry here.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = File.class, name = "File"),
    @JsonSubTypes.Type(value = Program.class, name = "Program"),
    // statements
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),
    // declarations
    @JsonSubTypes.Type(value = VariableDeclaration.class, name = "VariableDeclaration"),
    @JsonSubTypes.Type(value = VariableDeclarator.class, name = "VariableDeclarator"),
    // expressions
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),
    @JsonSubTypes.Type(value = MemberExpression.class, name = "MemberExpression"),
    // literals
    @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
    @JsonSubTypes.Type(value = NumericLiteral.class, name = "NumericLiteral"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = NullLiteral.class, name = "NullLiteral")
})
public abstract class NodeMixin {
}
