package com.hcltech.lineage.common.errorsor;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ErrorsOrTest {

    @Nested
    class ConstructionAndPredicates {
        @Test
        void liftCreatesValue() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(42);
            assertTrue(eo.isValue());
            assertFalse(eo.isError());
            assertEquals(Optional.of(42), eo.getValue());
            assertTrue(eo.getErrors().isEmpty());
        }

        @Test
        void errorCreatesError() {
            ErrorsOr<String> eo = ErrorsOr.error("boom");
            assertTrue(eo.isError());
            assertFalse(eo.isValue());
            assertEquals(List.of("boom"), eo.getErrors());
            assertEquals(Optional.empty(), eo.getValue());
        }

        @Test
        void errorsKeepsEveryMessageInOrder() {
            ErrorsOr<Double> eo = ErrorsOr.errors(List.of("a", "b", "c"));
            assertEquals(List.of("a", "b", "c"), eo.getErrors());
        }

        @Test
        void errorsRejectsEmptyList() {
            assertThrows(IllegalArgumentException.class, () -> ErrorsOr.errors(List.of()));
        }

        @Test
        void errorFromExceptionNamesTheExceptionType() {
            ErrorsOr<String> eo = ErrorsOr.error("Failed: {0}: {1}", new IllegalStateException("bad state"));
            assertEquals(List.of("Failed: IllegalStateException: bad state"), eo.getErrors());
        }
    }

    @Nested
    class Extractors {
        @Test
        void valueOrThrowOnValue() {
            assertEquals("ok", ErrorsOr.lift("ok").valueOrThrow());
        }

        @Test
        void valueOrThrowOnErrorThrows() {
            ErrorsOr<String> eo = ErrorsOr.error("nope");
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::valueOrThrow);
            assertTrue(ex.getMessage().contains("nope"));
        }

        @Test
        void errorsOrThrowOnError() {
            ErrorsOr<Integer> eo = ErrorsOr.errors(List.of("x", "y"));
            assertEquals(List.of("x", "y"), eo.errorsOrThrow());
        }

        @Test
        void errorsOrThrowOnValueThrows() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(7);
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::errorsOrThrow);
            assertTrue(ex.getMessage().contains("7"));
        }

        @Test
        void foldPicksTheMatchingBranch() {
            assertEquals("v3", ErrorsOr.lift(3).fold(v -> "v" + v, e -> "e" + e.size()));
            assertEquals("e2", ErrorsOr.<Integer>errors(List.of("a", "b")).fold(v -> "v" + v, e -> "e" + e.size()));
        }
    }

    @Nested
    class FunctionalHelpers {
        @Test
        void flatMapChains() {
            assertEquals(10, ErrorsOr.lift(5).flatMap(n -> ErrorsOr.lift(n * 2)).valueOrThrow());
            assertEquals(List.of("oops 5"), ErrorsOr.lift(5).flatMap(n -> ErrorsOr.error("oops " + n)).getErrors());
        }

        @Test
        void flatMapPassesThroughError() {
            ErrorsOr<Integer> start = ErrorsOr.errors(List.of("bad", "worse"));
            assertEquals(List.of("bad", "worse"), start.flatMap(n -> ErrorsOr.lift(n + 1)).getErrors());
        }

        @Test
        void flatMapDoesNotCallFunctionOnError() {
            ErrorsOr<Integer> start = ErrorsOr.error("first");
            ErrorsOr<Integer> out = start.flatMap(n -> { throw new AssertionError("must not be called"); });
            assertEquals(List.of("first"), out.getErrors());
        }

        @Test
        void ifValueAndIfErrorOnlyFireOnTheirSide() {
            List<String> seen = new ArrayList<>();
            ErrorsOr.lift("v").ifValue(seen::add);
            ErrorsOr.lift("v").ifError(e -> seen.add("unexpected"));
            ErrorsOr.<String>error("e").ifError(seen::addAll);
            ErrorsOr.<String>error("e").ifValue(v -> seen.add("unexpected"));
            assertEquals(List.of("v", "e"), seen);
        }

        @Test
        void tryingCapturesExceptions() {
            assertEquals(3, ErrorsOr.trying(() -> 3).valueOrThrow());
            ErrorsOr<Integer> failed = ErrorsOr.trying(() -> Integer.parseInt("x"));
            assertEquals(1, failed.getErrors().size());
            assertTrue(failed.getErrors().get(0).startsWith("Evaluation error: NumberFormatException"));
        }
    }
}
