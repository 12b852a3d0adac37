package com.godzilla.jackson;

import com.godzilla.ast.*;
import com.godzilla.json.AstJsonDeserializer;
import com.godzilla.json.AstJsonException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static com.godzilla.jackson.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class JacksonDeserializerTest {

    private final AstJsonDeserializer deserializer = new JacksonAstJsonProvider().getDeserializer();

    @Test
    void decodesBabelDocumentIgnoringUnmodelledProperties() {
        File file = deserializer.deserializeFile(read(CONSOLE_LOG));

        assertEquals("module", file.program().sourceType());
        assertEquals(1, file.program().body().size());

        ExpressionStatement stmt = assertInstanceOf(ExpressionStatement.class, file.program().body().get(0));
        CallExpression call = assertInstanceOf(CallExpression.class, stmt.expression());
        MemberExpression callee = assertInstanceOf(MemberExpression.class, call.callee());
        assertFalse(callee.computed());
        assertEquals("console", assertInstanceOf(Identifier.class, callee.object()).name());
        assertEquals("log", assertInstanceOf(Identifier.class, callee.property()).name());

        StringLiteral arg = assertInstanceOf(StringLiteral.class, call.arguments().get(0));
        assertEquals("hi", arg.value());
        assertEquals(new Extra("hi", "\"hi\""), arg.extra());
    }

    @Test
    void decodesSpanAndLocation() {
        File file = deserializer.deserializeFile(read(CONSOLE_LOG));
        ExpressionStatement stmt = (ExpressionStatement) file.program().body().get(0);
        MemberExpression callee = (MemberExpression) ((CallExpression) stmt.expression()).callee();
        Node property = callee.property();

        assertEquals(8, property.start());
        assertEquals(11, property.end());
        assertEquals(new SourceLocation.Position(1, 8), property.loc().start());
        assertEquals(new SourceLocation.Position(1, 11), property.loc().end());
        assertEquals(new Attr("Identifier", 8, 11, property.loc()), property.attr());
    }

    @Test
    void absentFieldsTakeZeroValues() {
        File file = deserializer.deserializeFile(fileWith("""
            {
              "type": "VariableDeclaration",
              "declarations": [
                { "type": "VariableDeclarator", "id": { "type": "Identifier", "name": "x" } }
              ],
              "kind": "var"
            }
            """));

        assertEquals(0, file.start());
        assertNull(file.loc());
        VariableDeclaration decl = (VariableDeclaration) file.program().body().get(0);
        assertNull(decl.declarations().get(0).init());
        assertEquals("varx", file.toSource());

        CallExpression call = deserializer.deserialize("""
            { "type": "CallExpression", "callee": { "type": "Identifier", "name": "f" } }
            """, CallExpression.class);
        assertTrue(call.arguments().isEmpty());

        MemberExpression member = deserializer.deserialize("""
            { "type": "MemberExpression",
              "object": { "type": "Identifier", "name": "a" },
              "property": { "type": "Identifier", "name": "b" } }
            """, MemberExpression.class);
        assertFalse(member.computed());
    }

    @Test
    void decodesDeclarationWithNumericInit() {
        File file = deserializer.deserializeFile(read(LET_X));

        VariableDeclaration decl = assertInstanceOf(VariableDeclaration.class, file.program().body().get(0));
        assertInstanceOf(Declaration.class, decl);
        assertEquals("let", decl.kind());
        VariableDeclarator declarator = decl.declarations().get(0);
        assertEquals("x", declarator.id().name());
        NumericLiteral init = assertInstanceOf(NumericLiteral.class, declarator.init());
        assertEquals(1.0, init.value());
        assertEquals("1", init.extra().raw());
    }

    @Test
    void decodesOtherLiterals() {
        CallExpression call = deserializer.deserialize("""
            { "type": "CallExpression",
              "callee": { "type": "Identifier", "name": "f" },
              "arguments": [
                { "type": "BooleanLiteral", "value": true },
                { "type": "NullLiteral" },
                { "type": "NumericLiteral", "value": 0.5, "extra": { "rawValue": 0.5, "raw": ".5" } }
              ] }
            """, CallExpression.class);

        assertEquals(new BooleanLiteral(0, 0, null, true), call.arguments().get(0));
        assertEquals(new NullLiteral(0, 0, null), call.arguments().get(1));
        assertEquals("f(true, null, .5)", call.toSource());
    }

    @Test
    void preservesStatementOrder() {
        String a = "{ \"type\": \"ExpressionStatement\", \"expression\": { \"type\": \"Identifier\", \"name\": \"a\" } }";
        String b = "{ \"type\": \"ExpressionStatement\", \"expression\": { \"type\": \"Identifier\", \"name\": \"b\" } }";
        File file = deserializer.deserializeFile(fileWith(b + ", " + a + ", " + b));
        assertEquals("bab", file.toSource());
    }

    @Test
    void readsFromStream() {
        byte[] bytes = read(CONSOLE_LOG).getBytes(StandardCharsets.UTF_8);
        File file = deserializer.deserializeFile(new ByteArrayInputStream(bytes));
        assertEquals(deserializer.deserializeFile(read(CONSOLE_LOG)), file);
    }

    // ==================== Failures ====================

    @Test
    void unknownNestedTagFailsWithTagAndPath() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(fileWith("""
            {
              "type": "ExpressionStatement",
              "expression": { "type": "AwaitExpression", "argument": null }
            }
            """)));

        assertEquals("AwaitExpression", e.getNodeType());
        assertTrue(e.getMessage().contains("Unknown node type 'AwaitExpression'"), e.getMessage());
        assertTrue(e.getPath().contains("body[0]"), e.getPath());
        assertTrue(e.getPath().endsWith("expression"), e.getPath());
        assertTrue(e.getLine() > 0);
    }

    @Test
    void unknownRootTagFails() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> deserializer.deserializeFile("{ \"type\": \"Script\", \"program\": null }"));
        assertEquals("Script", e.getNodeType());
        assertEquals("", e.getPath());
    }

    @Test
    void unknownTagFailsTheSameWayEveryTime() {
        String json = fileWith("{ \"type\": \"ThrowStatement\" }");
        AstJsonException first = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(json));
        AstJsonException second = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(json));
        assertEquals(first.getMessage(), second.getMessage());
        assertEquals("ThrowStatement", second.getNodeType());
    }

    @Test
    void missingTypeFails() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(fileWith("""
            { "type": "ExpressionStatement", "expression": { "name": "a" } }
            """)));
        assertTrue(e.getMessage().startsWith("Missing node type"), e.getMessage());
        assertEquals("ExpressionStatement", e.getNodeType());
        assertTrue(e.getPath().endsWith("expression"), e.getPath());
    }

    @Test
    void missingRootTypeFails() {
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("""
            { "program": { "type": "Program", "body": [] } }
            """));
    }

    @Test
    void missingProgramFails() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> deserializer.deserializeFile("{ \"type\": \"File\", \"start\": 0, \"end\": 0 }"));
        assertEquals("File", e.getNodeType());
        assertTrue(e.getMessage().contains("File requires a program"), e.getMessage());
    }

    @Test
    void missingMandatoryChildFails() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> deserializer.deserializeFile(fileWith("{ \"type\": \"ExpressionStatement\" }")));
        assertEquals("ExpressionStatement", e.getNodeType());
        assertTrue(e.getPath().contains("body[0]"), e.getPath());
    }

    @Test
    void registeredTagInWrongPositionFails() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("""
            { "type": "File", "program": { "type": "Identifier", "name": "x" } }
            """));
        assertEquals("Identifier", e.getNodeType());
        assertTrue(e.getMessage().contains("not allowed where Program is expected"), e.getMessage());
    }

    @Test
    void statementPositionRejectsBareExpression() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> deserializer.deserializeFile(fileWith("{ \"type\": \"Identifier\", \"name\": \"x\" }")));
        assertEquals("Identifier", e.getNodeType());
    }

    @Test
    void bodyMustBeAnArray() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("""
            { "type": "File", "program": { "type": "Program", "body": {} } }
            """));
        assertTrue(e.getMessage().startsWith("Malformed document"), e.getMessage());
        assertEquals("Program", e.getNodeType());
        assertEquals("program.body", e.getPath());
    }

    @Test
    void wrongScalarTypeFails() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserialize("""
            { "type": "MemberExpression",
              "object": { "type": "Identifier", "name": "a" },
              "property": { "type": "Identifier", "name": "b" },
              "computed": "sometimes" }
            """, MemberExpression.class));
        assertEquals("MemberExpression", e.getNodeType());
        assertEquals("computed", e.getPath());
    }

    @Test
    void scalarsOfWrongJsonTypeFail() {
        assertRejected("{ \"type\": \"Identifier\", \"name\": 5 }", Identifier.class, "name");
        assertRejected("{ \"type\": \"Identifier\", \"name\": true }", Identifier.class, "name");
        assertRejected("{ \"type\": \"Identifier\", \"start\": \"10\", \"name\": \"a\" }", Identifier.class, "start");
        assertRejected("{ \"type\": \"Identifier\", \"start\": 1.7, \"name\": \"a\" }", Identifier.class, "start");
        assertRejected("{ \"type\": \"StringLiteral\", \"value\": 7 }", StringLiteral.class, "value");
        assertRejected("{ \"type\": \"VariableDeclaration\", \"declarations\": [], \"kind\": 1 }",
            VariableDeclaration.class, "kind");
        assertRejected("""
            { "type": "MemberExpression",
              "object": { "type": "Identifier", "name": "a" },
              "property": { "type": "Identifier", "name": "b" },
              "computed": 1 }
            """, MemberExpression.class, "computed");
    }

    @Test
    void integralNumbersStillDecodeAsDoubles() {
        NumericLiteral literal = deserializer.deserialize(
            "{ \"type\": \"NumericLiteral\", \"value\": 42, \"extra\": { \"rawValue\": 42, \"raw\": \"42\" } }",
            NumericLiteral.class);
        assertEquals(42.0, literal.value());
        assertEquals(42, literal.extra().rawValue());
    }

    @Test
    void nullListElementFailsWithMessage() {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("""
            { "type": "File", "program": { "type": "Program", "body": [ null ] } }
            """));
        assertEquals("Program", e.getNodeType());
        assertTrue(e.getMessage().contains("Program body contains a null statement"), e.getMessage());

        AstJsonException args = assertThrows(AstJsonException.class, () -> deserializer.deserialize("""
            { "type": "CallExpression", "callee": { "type": "Identifier", "name": "f" }, "arguments": [ null ] }
            """, CallExpression.class));
        assertEquals("CallExpression", args.getNodeType());
        assertTrue(args.getMessage().contains("null expression"), args.getMessage());
    }

    private void assertRejected(String json, Class<? extends Node> type, String field) {
        AstJsonException e = assertThrows(AstJsonException.class, () -> deserializer.deserialize(json, type), json);
        assertEquals(type.getSimpleName(), e.getNodeType(), json);
        assertEquals(field, e.getPath(), json);
    }

    @Test
    void nonObjectDocumentsFail() {
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("[]"));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("\"File\""));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(""));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile("null"));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile((String) null));
    }

    @Test
    void truncatedOrTrailingContentFails() {
        String json = read(CONSOLE_LOG);
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(json.substring(0, json.length() / 2)));
        assertThrows(AstJsonException.class, () -> deserializer.deserializeFile(json + " {}"));
    }
}
