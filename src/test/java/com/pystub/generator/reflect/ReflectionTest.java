package com.pystub.generator.reflect;

import org.junit.jupiter.api.Test;

import java.lang.reflect.GenericSignatureFormatError;
import java.lang.reflect.MalformedParameterizedTypeException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Reflection.
 */
class ReflectionTest {

    @Test
    void testGuardReturnsLookupResult() {
        assertThat(Reflection.guard("java.lang.String", () -> "value")).isEqualTo("value");
    }

    @Test
    void testGuardWrapsBrokenGenericSignature() {
        assertThatThrownBy(() -> Reflection.guard("com.example.Broken", () -> {
            throw new GenericSignatureFormatError("bad signature");
        }))
                .isInstanceOf(TypeLoadException.class)
                .hasCauseInstanceOf(GenericSignatureFormatError.class)
                .extracting(e -> ((TypeLoadException) e).getTypeName())
                .isEqualTo("com.example.Broken");
    }

    @Test
    void testGuardWrapsMissingTypes() {
        assertThatThrownBy(() -> Reflection.guard("com.example.Missing", () -> {
            throw new NoClassDefFoundError("com/example/Dependency");
        })).isInstanceOf(TypeLoadException.class);
        assertThatThrownBy(() -> Reflection.guard("com.example.Missing", () -> {
            throw new TypeNotPresentException("com.example.Dependency", null);
        })).isInstanceOf(TypeLoadException.class);
        assertThatThrownBy(() -> Reflection.guard("com.example.Missing", () -> {
            throw new MalformedParameterizedTypeException();
        })).isInstanceOf(TypeLoadException.class);
    }

    @Test
    void testGuardLetsOtherExceptionsThrough() {
        assertThatThrownBy(() -> Reflection.guard("com.example.Foo", () -> {
            throw new IllegalStateException("unrelated");
        })).isExactlyInstanceOf(IllegalStateException.class);
    }
}
