package io.github.simbo1905.drops;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.drops.TypeSpec.*;
import static org.assertj.core.api.Assertions.*;

class SpecReaderTest extends DropsTestBase {

    @Test
    void kindNameIsShorthandForPrimitive() {
        assertThat(SpecReader.read("integer")).isEqualTo(integer());
        assertThat(SpecReader.read("date_time")).isEqualTo(primitive(Kind.DATE_TIME));
    }

    @Test
    void primitiveWithConstraints() {
        Object doc = Map.of("primitive", "integer", "constraints", List.of(List.of("gt", 0), "even"));

        assertThat(SpecReader.read(doc)).isEqualTo(integer(
            Constraint.check(StandardPredicates.GT, 0),
            Constraint.check(StandardPredicates.EVEN)));
    }

    @Test
    void andGroupsAndKindArguments() {
        Object doc = Map.of("primitive", "any", "constraints",
            List.of(Map.of("and", List.of(List.of("type", "string"), "filled"))));

        assertThat(SpecReader.read(doc)).isEqualTo(any(Constraint.all(
            Constraint.check(StandardPredicates.TYPE, Kind.STRING),
            Constraint.check(StandardPredicates.FILLED))));
    }

    @Test
    void mapKeysReadPathsAsSymbols() {
        Object doc = Map.of("map", List.of(
            Map.of("path", "name", "type", "string"),
            Map.of("path", List.of("address", "zip"), "presence", "optional", "type", "string")));

        assertThat(SpecReader.read(doc)).isEqualTo(map(
            required(NAME, string()),
            optional(List.of(Symbol.of("address"), Symbol.of("zip")), string())));
    }

    @Test
    void listAndUnionForms() {
        Object doc = Map.of("list", Map.of("union", List.of("string", "integer", "boolean")),
            "constraints", List.of(List.of("maxSize", 3)));

        assertThat(SpecReader.read(doc)).isEqualTo(list(union(string(), integer(), bool()),
            Constraint.check(StandardPredicates.MAX_SIZE, 3)));
    }

    @Test
    void nullListMemberMeansAnyList() {
        Map<String, Object> doc = new HashMap<>();
        doc.put("list", null);

        assertThat(SpecReader.read(doc)).isEqualTo(list());
    }

    @Test
    void refineLayersConstraints() {
        Object doc = Map.of("refine", "integer", "constraints", List.of(List.of("in", 1, 2, 3)));

        assertThat(SpecReader.read(doc)).isEqualTo(refine(integer(), Constraint.check(StandardPredicates.IN, 1, 2, 3)));
    }

    @Test
    void unknownTagIsFatal() {
        assertThatThrownBy(() -> SpecReader.read(Map.of("tuple", List.of("string"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown spec tag: tuple");
    }

    @Test
    void multipleFormsAreFatal() {
        assertThatThrownBy(() -> SpecReader.read(Map.of("list", "integer", "map", List.of())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("multiple forms");
    }

    @Test
    void missingFormIsFatal() {
        assertThatThrownBy(() -> SpecReader.read(Map.of("constraints", List.of())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no form tag");
    }

    @Test
    void unknownKindIsFatal() {
        assertThatThrownBy(() -> SpecReader.read("decimal"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown primitive kind: decimal");
    }

    @Test
    void malformedMembersAreFatal() {
        assertThatThrownBy(() -> SpecReader.read(42)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpecReader.read(Map.of("union", List.of("string"))))
            .hasMessageContaining("at least two");
        assertThatThrownBy(() -> SpecReader.read(Map.of("map", List.of(Map.of("path", "a")))))
            .hasMessageContaining("requires a type");
        assertThatThrownBy(() -> SpecReader.read(Map.of("map", List.of(Map.of("path", "a", "type", "string", "presence", "maybe")))))
            .hasMessageContaining("presence");
        assertThatThrownBy(() -> SpecReader.read(Map.of("primitive", "integer", "constraints", List.of(7))))
            .hasMessageContaining("Malformed constraint");
    }

    @Test
    void documentsCompileEndToEnd() {
        Object doc = Map.of("map", List.of(
            Map.of("path", "name", "type", Map.of("primitive", "string", "constraints", List.of("filled"))),
            Map.of("path", "age", "presence", "optional",
                "type", Map.of("primitive", "integer", "constraints", List.of(List.of("gteq", 0))))));

        Schema schema = Drops.compileDocument(doc, CompileOptions.DEFAULT.withAtomize(true));

        assertThat(schema.isValid(Map.of("name", "Jane", "age", 30))).isTrue();
        assertThat(schema.errors(Map.of("name", "", "age", -1)))
            .containsExactly(
                new ValidationError("/name", "must be filled"),
                new ValidationError("/age", "must be greater than or equal to 0"));
    }

    @Test
    void unknownPredicateInDocumentFailsAtCompile() {
        Object doc = Map.of("primitive", "string", "constraints", List.of("uppercase"));
        assertThatThrownBy(() -> Drops.compileDocument(doc, CompileOptions.DEFAULT))
            .isInstanceOf(UnknownPredicateException.class);
    }
}
