package io.zmanim;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zmanim.ast.Expr;
import io.zmanim.display.Display;
import io.zmanim.functions.FunctionLibrary;
import io.zmanim.functions.OpinionBases;
import io.zmanim.functions.Validator;
import io.zmanim.parser.Parser;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance.json on the test classpath. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;

  @BeforeAll
  static void loadCases() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance.json")) {
      assertNotNull(in, "conformance.json missing from the test classpath");
      CASES = MAPPER.readTree(in);
    }
  }

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String canonical = tc.get("canonical").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Expr expr = Parser.parse(input);
                assertEquals(canonical, Display.render(expr), "render(parse(" + input + "))");

                // Roundtrip test
                Expr again = Parser.parse(canonical);
                assertEquals(canonical, Display.render(again), "roundtrip: " + canonical);
                assertEquals(Parser.parse(input), Parser.parse(input), "parse is deterministic");
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> parseErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse_errors")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String kind = tc.get("kind").asText();
      String message = tc.get("message").asText();
      int start = tc.get("start").asInt();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                ZmanimException e =
                    assertThrows(
                        ZmanimException.class,
                        () -> Parser.parse(input),
                        "expected error for: " + input);
                assertEquals(kind, e.kind().value());
                assertEquals(message, e.getMessage());
                assertEquals(start, e.span().orElseThrow().start());
                assertTrue(e.displayRich().startsWith("error: " + message));
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> validationErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("validation_errors")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String kind = tc.get("kind").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Expr expr = Parser.parse(input);
                ZmanimException e =
                    assertThrows(
                        ZmanimException.class,
                        () ->
                            Validator.validate(
                                expr, FunctionLibrary.standard(), OpinionBases.defaults()),
                        "expected validation error for: " + input);
                assertEquals(kind, e.kind().value(), e.getMessage());
                assertTrue(e.span().isPresent(), "validation errors carry a span");
              }));
    }
    return tests.stream();
  }
}
