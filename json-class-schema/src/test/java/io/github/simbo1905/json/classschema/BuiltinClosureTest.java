package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltinClosureTest extends ClassSchemaTestBase {

    private static Set<BuiltinType> transitiveDependencies(BuiltinType type) {
        Set<BuiltinType> result = new LinkedHashSet<>();
        for (BuiltinType dependency : type.dependencies()) {
            result.add(dependency);
            result.addAll(transitiveDependencies(dependency));
        }
        return result;
    }

    @ParameterizedTest
    @EnumSource(BuiltinType.class)
    void catalogDependenciesMatchSourceDefinitions(BuiltinType type) {
        Set<BuiltinType> reached = new LinkedHashSet<>();
        BuiltinClosure.collect(type.sourceDefinition(), reached);

        assertThat(reached).containsExactlyInAnyOrderElementsOf(transitiveDependencies(type));
        assertThat(reached).doesNotContain(type);
    }

    @ParameterizedTest
    @EnumSource(BuiltinType.class)
    void catalogNamesRoundTrip(BuiltinType type) {
        assertThat(BuiltinType.bySchemaName(type.schemaName())).contains(type);
        assertThat(type.kind().builtin()).contains(type);
    }

    @Test
    void closureFollowsDependenciesInFirstSeenOrder() {
        RootSchema schema = new RootSchema(JObject.builder()
            .property("transform", new JBuiltin(BuiltinType.TRANSFORM3D))
            .property("tint", new JBuiltin(BuiltinType.COLOR))
            .build());

        assertThat(BuiltinClosure.of(schema).keySet()).containsExactly("Transform3D", "Basis", "Vector3", "Color");
    }

    @Test
    void explicitDefsAreWalkedBeforeBase() {
        RootSchema schema = new RootSchema(JObject.builder()
            .property("at", new JBuiltin(BuiltinType.VECTOR2))
            .property("item", new JRef("Item"))
            .build())
            .withDefinition("Item", JObject.builder().property("box", new JBuiltin(BuiltinType.AABB)).build());

        assertThat(BuiltinClosure.of(schema).keySet()).containsExactly("Aabb", "Vector3", "Vector2");
    }

    @Test
    void referencesAreNotFollowed() {
        Set<BuiltinType> reached = new LinkedHashSet<>();
        BuiltinClosure.collect(new JArray(new JRef("Elsewhere")), reached);

        assertThat(reached).isEmpty();
    }

    @Test
    void explicitDefinitionWinsOverCatalogEntry() {
        JObject custom = JObject.builder().property("v", new JString()).description("custom").build();
        RootSchema schema = new RootSchema(JObject.builder()
            .property("rect", new JBuiltin(BuiltinType.RECT2))
            .build())
            .withDefinition("Vector2", custom);

        assertThat(BuiltinClosure.of(schema).keySet()).containsExactly("Rect2");
        JsonNode defs = schema.toJsonNode().get("$defs");
        List<String> names = new ArrayList<>();
        defs.fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("Vector2", "Rect2");
        assertThat(defs.get("Vector2").get("description").asText()).isEqualTo("custom");
    }

    @Test
    void everyCatalogTypeCompilesAsAProperty() {
        FakeHost host = new FakeHost();
        List<PropertyDescriptor> descriptors = new ArrayList<>();
        for (BuiltinType type : BuiltinType.values()) {
            descriptors.add(PropertyDescriptor.of(type.schemaName().toLowerCase(), type.kind()));
        }
        host.defineClass("Everything", descriptors.toArray(new PropertyDescriptor[0]));

        CompiledClassSchema compiled = CompiledClassSchema.compile(RootSchema.generate(ClassSource.named("Everything"), host));

        JsonNode defs = compiled.document().get("$defs");
        for (BuiltinType type : BuiltinType.values()) {
            assertThat(defs.has(type.schemaName())).as(type.schemaName()).isTrue();
        }
    }
}
