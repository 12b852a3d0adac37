package com.godzilla.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.godzilla.ast.*;
import com.godzilla.jackson.mixins.NodeMixin;

/**
 * Jackson module that configures serialization/deserialization for the AST records.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin ({@code type} property)
 * - Null handling for AST fields that are written even when absent
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.godzilla", "godzilla-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling on the root and every category
        // (mixin inheritance from interfaces may not work consistently across Java versions)
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Declaration.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Literal.class, NodeMixin.class);

        // VariableDeclarator.init is written as null rather than dropped
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
    }

    // ==================== Serialization Mixins ====================

    private abstract static class VariableDeclaratorMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }
}
