package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.JsonNode;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstantiatorTest extends ClassSchemaTestBase {

    private static Object convert(Definition definition, String json) {
        return new RootSchema(definition).instantiate(json(json), new FakeHost());
    }

    private static ConversionException.Reason failure(Definition definition, String json) {
        try {
            convert(definition, json);
        } catch (ConversionException e) {
            return e.reason();
        }
        throw new AssertionError("expected conversion of " + json + " to fail");
    }

    @Test
    void numericStrictness() {
        assertThat(convert(new JInteger(), "1")).isEqualTo(1L);
        assertThat(convert(new JNumber(), "1")).isEqualTo(1.0d);
        assertThat(failure(new JInteger(), "1.5")).isEqualTo(ConversionException.Reason.EXPECTED_INTEGER_GOT_FLOAT);
        assertThat(failure(new JInteger(), "1.0")).isEqualTo(ConversionException.Reason.EXPECTED_INTEGER_GOT_FLOAT);
        assertThat(failure(new JInteger(), "\"1\"")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
    }

    @Test
    void integerWidthsAreEnforced() {
        assertThat(convert(new JInteger(IntegerWidth.UINT8), "255")).isEqualTo(255L);
        assertThat(failure(new JInteger(IntegerWidth.UINT8), "256")).isEqualTo(ConversionException.Reason.INTEGER_OUT_OF_RANGE);
        assertThat(failure(new JInteger(IntegerWidth.UINT8), "-1")).isEqualTo(ConversionException.Reason.INTEGER_OUT_OF_RANGE);
        assertThat(failure(new JInteger(IntegerWidth.INT32), "2147483648")).isEqualTo(ConversionException.Reason.INTEGER_OUT_OF_RANGE);
        assertThat(failure(new JInteger(IntegerWidth.INT64), "9223372036854775808"))
            .isEqualTo(ConversionException.Reason.INTEGER_OUT_OF_RANGE);
    }

    @Test
    void unsignedSixtyFourBitValues() {
        assertThat(convert(new JInteger(IntegerWidth.UINT64), "18446744073709551615")).isEqualTo(-1L);
        assertThat(convert(new JInteger(), "18446744073709551615")).isEqualTo(new BigInteger("18446744073709551615"));
        assertThat(convert(new JInteger(), "-9223372036854775808")).isEqualTo(Long.MIN_VALUE);
        assertThat(failure(new JInteger(), "18446744073709551616")).isEqualTo(ConversionException.Reason.INTEGER_OUT_OF_RANGE);
    }

    @Test
    void float32Narrows() {
        assertThat(convert(new JNumber(FloatWidth.FLOAT32), "0.1")).isEqualTo((double) 0.1f);
        assertThat(convert(new JNumber(FloatWidth.FLOAT64), "0.1")).isEqualTo(0.1d);
    }

    @Test
    void scalarMismatches() {
        assertThat(convert(new JNull(), "null")).isNull();
        assertThat(convert(new JBoolean(), "true")).isEqualTo(true);
        assertThat(convert(new JString(), "\"x\"")).isEqualTo("x");
        assertThat(failure(new JNull(), "0")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
        assertThat(failure(new JBoolean(), "\"true\"")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
        assertThat(failure(new JString(), "3")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
        assertThat(failure(new JNumber(), "null")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
    }

    @Test
    void closedObjectRequiresExactPropertySet() {
        JObject pair = JObject.builder().property("a", new JInteger()).property("b", new JInteger()).build();

        assertThat(convert(pair, """
            {"b": 2, "a": 1}
            """)).isEqualTo(Map.of("a", 1L, "b", 2L));
        assertThat(failure(pair, """
            {"a": 1}
            """)).isEqualTo(ConversionException.Reason.PROPERTY_COUNT_MISMATCH);
        assertThat(failure(pair, """
            {"a": 1, "b": 2, "c": 3}
            """)).isEqualTo(ConversionException.Reason.PROPERTY_COUNT_MISMATCH);
        assertThat(failure(pair, """
            {"a": 1, "c": 3}
            """)).isEqualTo(ConversionException.Reason.MISSING_PROPERTY);
    }

    @Test
    void dictionaryUsesGenericMapping() {
        Object result = convert(JObject.dictionary(), """
            {"n": 1, "f": 1.5, "s": "x", "b": false, "z": null, "o": {"k": [1, 2]}}
            """);

        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) result;
        assertThat(map).isInstanceOf(LinkedHashMap.class);
        assertThat(map.keySet()).containsExactly("n", "f", "s", "b", "z", "o");
        assertThat(map.get("n")).isEqualTo(1L);
        assertThat(map.get("f")).isEqualTo(1.5d);
        assertThat(map.get("z")).isNull();
        @SuppressWarnings("unchecked")
        Map<String, Object> nested = (Map<String, Object>) map.get("o");
        assertThat(nested.get("k")).isEqualTo(new TypedArray(ElementType.of(ValueKind.INT), List.of(1L, 2L)));
    }

    @Test
    void untypedArrayIsTypedOnlyWhenHomogeneous() {
        assertThat(convert(JArray.untyped(), "[1, 2, 3]"))
            .isEqualTo(new TypedArray(ElementType.of(ValueKind.INT), List.of(1L, 2L, 3L)));
        assertThat(convert(JArray.untyped(), "[\"a\", \"b\"]"))
            .isEqualTo(new TypedArray(ElementType.of(ValueKind.STRING), List.of("a", "b")));

        Object mixed = convert(JArray.untyped(), "[1, \"a\", null]");
        assertThat(mixed).isInstanceOf(List.class);
        assertThat(mixed).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly(1L, "a", null);

        Object empty = convert(JArray.untyped(), "[]");
        assertThat(empty).isInstanceOf(List.class);
        assertThat(empty).asInstanceOf(InstanceOfAssertFactories.LIST).isEmpty();

        assertThat(convert(JArray.untyped(), "[null, null]")).isInstanceOf(List.class);
    }

    @Test
    void typedArrayCarriesElementType() {
        Object result = convert(new JArray(new JNumber()), "[1, 2.5]");

        assertThat(result).isEqualTo(new TypedArray(ElementType.of(ValueKind.FLOAT), List.of(1.0d, 2.5d)));
    }

    @Test
    void typedArrayElementFailureReportsIndex() {
        assertThatThrownBy(() -> convert(new JArray(new JInteger()), "[1, 2, 3.5]"))
            .isInstanceOfSatisfying(ConversionException.class, e -> {
                assertThat(e.reason()).isEqualTo(ConversionException.Reason.EXPECTED_INTEGER_GOT_FLOAT);
                assertThat(e.path()).isEqualTo("$[2]");
            });
    }

    @Test
    void tupleArity() {
        JTuple triple = new JTuple(List.of(new JInteger(), new JString(), new JBoolean()));

        assertThat(convert(triple, "[1, \"a\", true]")).isEqualTo(List.of(1L, "a", true));
        assertThat(failure(triple, "[1, \"a\"]")).isEqualTo(ConversionException.Reason.TUPLE_ARITY_MISMATCH);
        assertThat(failure(triple, "[1, 2, true]")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
    }

    @Test
    void enumVariants() {
        Map<String, Long> variants = new LinkedHashMap<>();
        variants.put("MALE", 0L);
        variants.put("FEMALE", 1L);
        JEnum gender = new JEnum("Person.Gender", variants);

        assertThat(convert(gender, "\"FEMALE\"")).isEqualTo(1L);
        assertThatThrownBy(() -> convert(gender, "\"OTHER\""))
            .isInstanceOfSatisfying(ConversionException.class, e -> {
                assertThat(e.reason()).isEqualTo(ConversionException.Reason.UNKNOWN_VARIANT);
                assertThat(e.getMessage()).contains("MALE, FEMALE").contains("OTHER");
            });
        assertThat(failure(gender, "1")).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
    }

    @Test
    void compositesWrapTheirSourceDefinition() {
        CompositeValue vector = (CompositeValue) convert(new JBuiltin(BuiltinType.VECTOR2), """
            {"x": 1, "y": 2.5}
            """);
        assertThat(vector.type()).isEqualTo(BuiltinType.VECTOR2);
        assertThat(vector.fields()).containsEntry("x", 1.0d).containsEntry("y", 2.5d);

        CompositeValue rid = (CompositeValue) convert(new JBuiltin(BuiltinType.RID), "42");
        assertThat(rid.longValue()).isEqualTo(42L);

        CompositeValue bytes = (CompositeValue) convert(new JBuiltin(BuiltinType.PACKED_BYTE_ARRAY), "[0, 255]");
        assertThat(bytes.elements()).containsExactly(0L, 255L);
        assertThat(failure(new JBuiltin(BuiltinType.PACKED_BYTE_ARRAY), "[256]"))
            .isEqualTo(ConversionException.Reason.INTEGER_OUT_OF_RANGE);
    }

    @Test
    void nestedCompositesConvertRecursively() {
        CompositeValue transform = (CompositeValue) convert(new JBuiltin(BuiltinType.TRANSFORM3D), """
            {
              "basis": {"rows": [{"x": 1, "y": 0, "z": 0}, {"x": 0, "y": 1, "z": 0}, {"x": 0, "y": 0, "z": 1}]},
              "origin": {"x": 0, "y": 0, "z": 0}
            }
            """);

        CompositeValue basis = (CompositeValue) transform.field("basis");
        @SuppressWarnings("unchecked")
        List<Object> rows = (List<Object>) basis.field("rows");
        assertThat(rows).hasSize(3);
        assertThat(((CompositeValue) rows.get(1)).field("y")).isEqualTo(1.0d);
        assertThat(failure(new JBuiltin(BuiltinType.BASIS), """
            {"rows": [{"x": 1, "y": 0, "z": 0}]}
            """)).isEqualTo(ConversionException.Reason.TUPLE_ARITY_MISMATCH);
    }

    @Test
    void classPathsAppearInErrors() {
        FakeHost host = new FakeHost()
            .defineClass("Pet", PropertyDescriptor.of("name", ValueKind.STRING))
            .defineClass("Owner", PropertyDescriptor.typedArray("pets", "Pet"));
        RootSchema schema = RootSchema.generate(ClassSource.named("Owner"), host);

        assertThatThrownBy(() -> schema.instantiate(json("""
            {"pets": [{"name": "Rex"}, {"name": 5}]}
            """), host))
            .isInstanceOfSatisfying(ConversionException.class, e -> {
                assertThat(e.reason()).isEqualTo(ConversionException.Reason.TYPE_MISMATCH);
                assertThat(e.path()).isEqualTo("$.pets[1].name");
            });
    }

    @Test
    void depthLimit() {
        JArray nested = new JArray(new JArray(new JInteger()));
        RootSchema schema = new RootSchema(nested);
        SchemaOptions shallow = SchemaOptions.DEFAULT.withMaxInstantiationDepth(3);

        assertThat(schema.instantiate(json("[[1]]"), new FakeHost(), shallow)).isInstanceOf(TypedArray.class);
        assertThatThrownBy(() -> new RootSchema(new JArray(nested)).instantiate(json("[[[1]]]"), new FakeHost(), shallow))
            .isInstanceOfSatisfying(ConversionException.class, e ->
                assertThat(e.reason()).isEqualTo(ConversionException.Reason.DEPTH_EXCEEDED));
    }

    @Test
    void classEntryPointHonoursInstantiationDepth() {
        JClass box = new JClass(ClassSource.named("Box"),
            Map.of("items", new JArray(new JArray(new JInteger()))));
        JsonNode payload = json("""
            {"items": [[1]]}
            """);

        assertThat(box.instantiate(Map.of(), payload, new FakeHost())).isInstanceOf(FakeHost.FakeObject.class);
        assertThatThrownBy(() -> box.instantiate(Map.of(), payload, new FakeHost(),
                SchemaOptions.DEFAULT.withMaxInstantiationDepth(2)))
            .isInstanceOfSatisfying(ConversionException.class, e ->
                assertThat(e.reason()).isEqualTo(ConversionException.Reason.DEPTH_EXCEEDED));
    }

    @Test
    void danglingReferenceIsReported() {
        JObject holder = JObject.builder().property("ghost", new JRef("Ghost")).build();

        assertThatThrownBy(() -> convert(holder, """
            {"ghost": {}}
            """))
            .isInstanceOfSatisfying(DanglingReferenceException.class, e -> assertThat(e.name()).isEqualTo("Ghost"));
    }

    @Test
    void hostConstructionFailureIsWrapped() {
        FakeHost host = personHost().refuseConstruction("Person");
        RootSchema schema = RootSchema.generate(ClassSource.named("Person"), host);

        assertThatThrownBy(() -> schema.instantiate(json("""
            {"name": "x", "age": 1}
            """), host))
            .isInstanceOf(HostException.class)
            .hasMessageContaining("Person");
    }

    @Test
    void classInstantiateEntryPoint() {
        FakeHost host = personHost();
        JClass person = (JClass) RootSchema.generate(ClassSource.named("Person"), host).base();

        Object handle = person.instantiate(Map.of(), json("""
            {"age": 7, "name": "Kim"}
            """), host);

        assertThat(((FakeHost.FakeObject) handle).values).containsExactly(Map.entry("age", 7L), Map.entry("name", "Kim"));
    }
}
