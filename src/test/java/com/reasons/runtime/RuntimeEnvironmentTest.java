package com.reasons.runtime;

import com.reasons.exception.EvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuntimeEnvironment.
 */
class RuntimeEnvironmentTest {

    @Test
    @DisplayName("Should normalize numbers given to the builder")
    void shouldNormalizeNumbers() {
        RuntimeEnvironment environment = RuntimeEnvironment.builder()
                .variable("count", 3)
                .variable("nested", Map.of("n", 2L))
                .build();

        assertEquals(3.0, environment.get("count"));
        assertEquals(Map.of("n", 2.0), environment.get("nested"));
    }

    @Test
    @DisplayName("Should shadow and restore variables across scopes")
    void shouldScopeVariables() {
        RuntimeEnvironment environment = RuntimeEnvironment.builder().variable("a", 1).build();

        environment.pushScope();
        environment.define("a", 2.0);
        environment.define("b", 3.0);
        assertEquals(2.0, environment.get("a"));
        assertEquals(Map.of("a", 2.0, "b", 3.0), environment.snapshot());
        assertEquals(2, environment.scopeDepth());

        environment.popScope();
        assertEquals(1.0, environment.get("a"));
        assertFalse(environment.isDefined("b"));
        assertThrows(IllegalStateException.class, environment::popScope);
    }

    @Test
    @DisplayName("Should assign to the defining scope or the global scope")
    void shouldAssign() {
        RuntimeEnvironment environment = RuntimeEnvironment.builder().variable("a", 1).build();

        environment.pushScope();
        environment.assign("a", 5.0);
        environment.assign("fresh", 6.0);
        environment.popScope();

        assertEquals(5.0, environment.get("a"));
        assertEquals(6.0, environment.get("fresh"));
    }

    @Test
    @DisplayName("Should register functions and check their arity")
    void shouldRegisterFunctions() {
        RuntimeEnvironment environment = RuntimeEnvironment.builder()
                .function(new RuntimeFunction("twice", 1, 1, args -> Values.toNumber(args.get(0), "twice") * 2))
                .build();

        RuntimeFunction twice = environment.function("twice").orElseThrow();
        assertEquals(8.0, twice.invoke(List.<Object>of(4.0)));
        EvaluationException error = assertThrows(EvaluationException.class, () -> twice.invoke(List.of()));
        assertEquals("Function 'twice' expects 1 argument(s), got 0", error.getMessage());
        assertTrue(environment.function("len").isPresent());
        assertThrows(IllegalArgumentException.class, () -> new RuntimeFunction("bad", 2, 1, args -> null));
    }
}
