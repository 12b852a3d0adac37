package com.godzilla.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Babel-shaped documents shared by the tests.
 */
public final class Fixtures {

    /** {@code console.log("hi")} as Babel emits it, including properties the AST does not model. */
    public static final String CONSOLE_LOG = "fixtures/console-log.json";

    /** {@code let x = 1;} */
    public static final String LET_X = "fixtures/let-x.json";

    /** A program with no statements. */
    public static final String EMPTY_PROGRAM = """
        {
          "type": "File",
          "start": 0,
          "end": 0,
          "program": {
            "type": "Program",
            "start": 0,
            "end": 0,
            "sourceType": "script",
            "body": []
          }
        }
        """;

    /** {@code a.b.c} */
    public static final String MEMBER_CHAIN = """
        {
          "type": "File",
          "program": {
            "type": "Program",
            "sourceType": "script",
            "body": [
              {
                "type": "ExpressionStatement",
                "expression": {
                  "type": "MemberExpression",
                  "object": {
                    "type": "MemberExpression",
                    "object": { "type": "Identifier", "name": "a" },
                    "property": { "type": "Identifier", "name": "b" },
                    "computed": false
                  },
                  "property": { "type": "Identifier", "name": "c" },
                  "computed": false
                }
              }
            ]
          }
        }
        """;

    private Fixtures() {
    }

    public static String read(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Wraps a single statement document in a File/Program envelope.
     */
    public static String fileWith(String statementJson) {
        return """
            {
              "type": "File",
              "program": {
                "type": "Program",
                "sourceType": "script",
                "body": [ %s ]
              }
            }
            """.formatted(statementJson);
    }
}
