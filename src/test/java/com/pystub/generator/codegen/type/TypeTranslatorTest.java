package com.pystub.generator.codegen.type;

import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.model.type.TypeVar;
import com.pystub.generator.fixtures.Apple;
import com.pystub.generator.fixtures.Box;
import com.pystub.generator.fixtures.Callback;
import com.pystub.generator.fixtures.Foo;
import com.pystub.generator.fixtures.Fruit;
import com.pystub.generator.fixtures.Outer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.lang.reflect.Type;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeTranslator.
 */
class TypeTranslatorTest {

    private static final String FIXTURES = "com.pystub.generator.fixtures.";

    private final TypeTranslator translator = new TypeTranslator();

    @SuppressWarnings("unused")
    private interface Samples {
        List<String> strings();

        Map<String, ? extends Number> numbersByName();

        BiFunction<Fruit, Apple, Foo> combiner();

        Class<?> anyClass();

        <E extends Enum<E>> E enumValue();
    }

    @ParameterizedTest
    @CsvSource({
            "int, int",
            "long, int",
            "boolean, bool",
            "double, float",
            "char, str",
            "void, None",
            "java.lang.Integer, int",
            "java.lang.String, str",
            "java.lang.Object, java.lang.Object"
    })
    void testTranslatePlainTypes(String javaName, String expected) throws Exception {
        assertThat(translator.translate(classFor(javaName)).toString()).isEqualTo(expected);
    }

    @Test
    void testTranslateArgumentTypesAreWidened() {
        assertThat(argument(int.class)).isEqualTo("typing.Union[int, java.jint, java.lang.Integer]");
        assertThat(argument(Boolean.class)).isEqualTo("typing.Union[bool, java.jboolean, java.lang.Boolean]");
        assertThat(argument(String.class)).isEqualTo("typing.Union[str, java.lang.String]");
        assertThat(argument(Object.class))
                .isEqualTo("typing.Union[java.lang.Object, int, bool, float, str]");
        assertThat(argument(Fruit.class)).isEqualTo(FIXTURES + "Fruit");
    }

    @Test
    void testTranslateArrays() {
        assertThat(translator.translate(int[].class).toString()).isEqualTo("java.chaquopy.JavaArrayJInt");
        assertThat(translator.translate(char[].class).toString()).isEqualTo("java.chaquopy.JavaArrayJChar");
        assertThat(translator.translate(String[].class).toString())
                .isEqualTo("java.chaquopy.JavaArray[java.lang.String]");
        assertThat(translator.translate(int[][].class).toString())
                .isEqualTo("java.chaquopy.JavaArray[java.chaquopy.JavaArrayJInt]");
    }

    @Test
    void testArrayElementArgumentIsRejected() {
        assertThatThrownBy(() -> translator.translate(int.class, List.of(), true, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("int");
    }

    @Test
    void testTranslateParameterizedTypes() throws Exception {
        assertThat(translator.translate(returnType("strings")).toString()).isEqualTo("java.util.List[str]");
        assertThat(translator.translate(returnType("numbersByName")).toString())
                .isEqualTo("java.util.Map[str, java.lang.Number]");
        assertThat(translator.translate(returnType("anyClass")).toString())
                .isEqualTo("typing.Type[java.lang.Object]");
    }

    @Test
    void testUnscopedTypeVariableUsesRawFirstBound() throws Exception {
        assertThat(translator.translate(returnType("enumValue")).toString()).isEqualTo("java.lang.Enum");
    }

    @Test
    void testFunctionalArgumentAcceptsCallable() throws Exception {
        Type combiner = returnType("combiner");
        String fruit = FIXTURES + "Fruit";
        String apple = FIXTURES + "Apple";
        String foo = FIXTURES + "Foo";

        assertThat(translator.translate(combiner).toString())
                .isEqualTo("java.util.function.BiFunction[" + fruit + ", " + apple + ", " + foo + "]");
        assertThat(translator.translate(combiner, List.of(), true, false).toString())
                .isEqualTo("typing.Union[java.util.function.BiFunction[" + fruit + ", " + apple + ", " + foo
                        + "], typing.Callable[[" + fruit + ", " + apple + "], " + foo + "]]");
    }

    @Test
    void testCallableOfRawInterface() {
        assertThat(translator.callableOf(Callback.class, null).map(TypeExpr::toString))
                .contains("typing.Callable[[str], None]");
        assertThat(translator.callableOf(Function.class, null).map(TypeExpr::toString))
                .contains("typing.Callable[[java.lang.Object], java.lang.Object]");
        assertThat(translator.callableOf(List.class, null)).isEmpty();
    }

    @Test
    void testFunctionalMethodIgnoresObjectMethods() {
        assertThat(TypeTranslator.functionalMethod(Comparator.class))
                .hasValueSatisfying(m -> assertThat(m.getName()).isEqualTo("compare"));
        assertThat(TypeTranslator.functionalMethod(Fruit.class)).isEmpty();
    }

    @Test
    void testTypeVariables() {
        TypeVar boxT = translator.toTypeVar(Box.class.getTypeParameters()[0], "Box");
        assertThat(boxT.getPythonName()).isEqualTo("_Box__T");
        assertThat(boxT.getBound()).isEqualTo(TypeExpr.of("java.lang.Number"));
        assertThat(translator.translate(Box.class.getTypeParameters()[0], List.of(boxT)).toString())
                .isEqualTo("_Box__T");

        TypeVar outerT = translator.toTypeVar(Outer.class.getTypeParameters()[0], "Outer");
        assertThat(outerT.getBound()).isNull();
    }

    private String argument(Class<?> cls) {
        return translator.translate(cls, List.of(), true, false).toString();
    }

    private static Type returnType(String method) throws NoSuchMethodException {
        return Samples.class.getMethod(method).getGenericReturnType();
    }

    private static Class<?> classFor(String javaName) throws ClassNotFoundException {
        return switch (javaName) {
            case "int" -> int.class;
            case "long" -> long.class;
            case "boolean" -> boolean.class;
            case "double" -> double.class;
            case "char" -> char.class;
            case "void" -> void.class;
            default -> Class.forName(javaName);
        };
    }
}
