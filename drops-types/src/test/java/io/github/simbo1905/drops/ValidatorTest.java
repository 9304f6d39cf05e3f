package io.github.simbo1905.drops;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.drops.TypeSpec.*;
import static org.assertj.core.api.Assertions.*;

class ValidatorTest extends DropsTestBase {

    private static Schema schema(TypeSpec spec) {
        return Drops.compile(spec);
    }

    @Test
    void primitiveReturnsInputOnSuccess() {
        assertThat(schema(string()).validate("hi")).isEqualTo(Result.ok("hi"));
    }

    @Test
    void primitiveFailureCarriesInputPredicateAndArgs() {
        assertThat(schema(integer(Constraint.check(StandardPredicates.GT, 0))).validate(-1))
            .isEqualTo(Result.err(new Failure.ConstraintFailure(-1, StandardPredicates.GT, List.of(0, -1))));
        assertThat(schema(integer()).validate(null)).isEqualTo(kindFailure(null, Kind.INTEGER));
    }

    @Test
    void listKeepsEveryElementResultInOrder() {
        Result result = schema(list(integer())).validate(List.of(1, "x", 3));

        assertThat(result).isEqualTo(Result.err(new Aggregate(Aggregate.Shape.LIST, List.of(
            Result.ok(1),
            kindFailure("x", Kind.INTEGER),
            Result.ok(3)))));
    }

    @Test
    void validListIsOkAggregate() {
        assertThat(schema(list(integer())).validate(List.of(1, 2)))
            .isEqualTo(Result.ok(new Aggregate(Aggregate.Shape.LIST, List.of(Result.ok(1), Result.ok(2)))));
    }

    @Test
    void nonListFailsWithoutDescending() {
        assertThat(schema(list(integer())).validate("abc")).isEqualTo(kindFailure("abc", Kind.LIST));
    }

    @Test
    void listRefinementIsCheckedBeforeMembers() {
        Result result = schema(list(integer(), Constraint.check(StandardPredicates.MIN_SIZE, 2))).validate(List.of("x"));
        assertThat(result).isEqualTo(Result.err(new Failure.ConstraintFailure(
            List.of("x"), StandardPredicates.MIN_SIZE, List.of(2, List.of("x")))));
    }

    @Test
    void emptyContainersAreValid() {
        assertThat(schema(list(integer())).validate(List.of()))
            .isEqualTo(Result.ok(new Aggregate(Aggregate.Shape.LIST, List.of())));
        assertThat(schema(map()).validate(Map.of()))
            .isEqualTo(Result.ok(new Aggregate(Aggregate.Shape.MAP, List.of())));
    }

    @Test
    void requiredPresentAndOptionalAbsentIsOk() {
        Schema s = schema(map(required(A, integer()), optional(B, integer())));

        assertThat(s.validate(Map.of(A, 1))).isEqualTo(Result.ok(new Aggregate(Aggregate.Shape.MAP, List.of(
            Result.ok(new MapKeys.KeyValue(List.of(A), 1))))));
    }

    @Test
    void missingRequiredKeyIsReportedAloneAndOptionalIsNot() {
        Schema s = schema(map(required(A, integer()), optional(B, integer())));

        assertThat(s.validate(Map.of())).isEqualTo(Result.err(new Aggregate(Aggregate.Shape.MAP, List.of(
            Result.err(new Failure.MissingKey(List.of(A)))))));
    }

    @Test
    void keyFailuresAreNestedUnderTheirPath() {
        Schema s = schema(map(required(A, integer()), required(B, string())));

        assertThat(s.validate(Map.of(A, "one", B, "two"))).isEqualTo(Result.err(new Aggregate(Aggregate.Shape.MAP, List.of(
            Result.err(new Failure.KeyFailure(List.of(A), kindFailure("one", Kind.INTEGER).failure())),
            Result.ok(new MapKeys.KeyValue(List.of(B), "two"))))));
    }

    @Test
    void nestedPathLookupTreatsPartialPathsAsAbsent() {
        Schema s = schema(map(required(List.of(A, B), integer())));

        assertThat(s.isValid(Map.of(A, Map.of(B, 1)))).isTrue();
        assertThat(s.validate(Map.of(A, "not a map"))).isEqualTo(Result.err(new Aggregate(Aggregate.Shape.MAP, List.of(
            Result.err(new Failure.MissingKey(List.of(A, B)))))));
    }

    @Test
    void nullValueCountsAsPresent() {
        Map<Object, Object> input = new HashMap<>();
        input.put(A, null);

        Schema s = schema(map(required(A, primitive(Kind.NIL))));

        assertThat(s.validate(input)).isEqualTo(Result.ok(new Aggregate(Aggregate.Shape.MAP, List.of(
            Result.ok(new MapKeys.KeyValue(List.of(A), null))))));
    }

    @Test
    void nonMapFailsWithoutCheckingKeys() {
        assertThat(schema(map(required(A, integer()))).validate(List.of()))
            .isEqualTo(kindFailure(List.of(), Kind.MAP));
    }

    @Test
    void undeclaredKeysAreIgnored() {
        assertThat(schema(map(required(A, integer()))).isValid(Map.of(A, 1, B, "extra"))).isTrue();
    }

    @Test
    void nestedMapsAndListsComposeResults() {
        Schema s = schema(map(required(A, list(map(required(NAME, string()))))));

        Result result = s.validate(Map.of(A, List.of(Map.of(NAME, "x"), Map.of())));

        Result inner = Result.err(new Aggregate(Aggregate.Shape.LIST, List.of(
            Result.ok(new Aggregate(Aggregate.Shape.MAP, List.of(Result.ok(new MapKeys.KeyValue(List.of(NAME), "x"))))),
            Result.err(new Aggregate(Aggregate.Shape.MAP, List.of(Result.err(new Failure.MissingKey(List.of(NAME)))))))));
        assertThat(result).isEqualTo(Result.err(new Aggregate(Aggregate.Shape.MAP, List.of(
            Result.err(new Failure.KeyFailure(List.of(A), ((Result.Err) inner).failure()))))));
    }

    @Test
    void handBuiltContainerWithoutKindCheckStillRejectsWrongShape() {
        Validator validator = new Validator(StandardPredicates.registry());
        TypeNode node = new TypeNode.ListType(new TypeNode.PrimitiveType(Kind.ANY, List.of()), List.of());

        assertThat(validator.validate(node, 42)).isEqualTo(kindFailure(42, Kind.LIST));
    }

    @Test
    void handBuiltTreeWithUnknownPredicateFailsFastOnFirstUse() {
        Validator validator = new Validator(StandardPredicates.registry());
        TypeNode node = new TypeNode.PrimitiveType(Kind.ANY, List.of(Constraint.check("mystery")));

        assertThatThrownBy(() -> validator.validate(node, 1)).isInstanceOf(UnknownPredicateException.class);
    }

    @Test
    void validationIsRepeatable() {
        Schema s = schema(map(required(A, list(integer()))));
        Map<Object, Object> input = Map.of(A, List.of(1, "two"));
        assertThat(s.validate(input)).isEqualTo(s.validate(input));
    }
}
