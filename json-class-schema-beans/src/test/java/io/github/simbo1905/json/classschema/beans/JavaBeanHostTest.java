package io.github.simbo1905.json.classschema.beans;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.simbo1905.json.classschema.BuiltinType;
import io.github.simbo1905.json.classschema.ClassSource;
import io.github.simbo1905.json.classschema.CompiledClassSchema;
import io.github.simbo1905.json.classschema.CompositeValue;
import io.github.simbo1905.json.classschema.HostException;
import io.github.simbo1905.json.classschema.PropertyDescriptor;
import io.github.simbo1905.json.classschema.PropertyHint;
import io.github.simbo1905.json.classschema.PropertyUsage;
import io.github.simbo1905.json.classschema.ResolutionException;
import io.github.simbo1905.json.classschema.SchemaLibrary;
import io.github.simbo1905.json.classschema.ValueKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaBeanHostTest extends BeanHostTestBase {

    @Test
    void describesDeclaredInstanceFields() {
        JavaBeanHost host = new JavaBeanHost();

        List<PropertyDescriptor> properties = host.propertyList(host.sourceOf(Models.Person.class));

        assertThat(properties).extracting(PropertyDescriptor::name).containsExactly("name", "age", "gender");
        assertThat(properties.get(0).kind()).isEqualTo(ValueKind.STRING);
        assertThat(properties.get(1).kind()).isEqualTo(ValueKind.INT);
        PropertyDescriptor gender = properties.get(2);
        assertThat(gender.kind()).isEqualTo(ValueKind.INT);
        assertThat(gender.hasUsage(PropertyUsage.CLASS_IS_ENUM)).isTrue();
        assertThat(gender.className()).isEqualTo("Person.Gender");
    }

    @Test
    void collectionFieldsCarryElementSpelling() {
        JavaBeanHost host = new JavaBeanHost();

        Map<String, PropertyDescriptor> byName = new LinkedHashMap<>();
        host.propertyList(host.sourceOf(Models.Team.class)).forEach(d -> byName.put(d.name(), d));

        assertThat(byName.get("lead").kind()).isEqualTo(ValueKind.OBJECT);
        assertThat(byName.get("lead").className()).isEqualTo("Person");
        assertThat(byName.get("members").hint()).isEqualTo(PropertyHint.ARRAY_TYPE);
        assertThat(byName.get("members").hintString()).isEqualTo("Person");
        assertThat(byName.get("tags").hintString()).isEqualTo("String");
        assertThat(byName.get("scores").hintString()).isEqualTo("int");
        assertThat(byName.get("roles").hintString()).isEqualTo("Models.Role");
        assertThat(byName.get("meta").kind()).isEqualTo(ValueKind.DICTIONARY);
        assertThat(byName.get("extras").hint()).isEqualTo(PropertyHint.NONE);
        assertThat(host.findClass("Person")).contains(ClassSource.named("Person"));
    }

    @Test
    void enumVariantsUseOrdinals() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Person.class);

        assertThat(host.enumVariants(ClassSource.named("Person"), "Gender"))
            .containsExactly(Map.entry("MALE", 0L), Map.entry("FEMALE", 1L));
        assertThat(host.enumVariants(ClassSource.named("Person"), "Mood")).isEmpty();
    }

    @Test
    void personSchemaAndInstance() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Person.class);
        SchemaLibrary library = new SchemaLibrary(host);

        CompiledClassSchema compiled = library.generateNamed("Person");
        JsonNode document = compiled.document();

        assertThat(document.get("description").asText()).isEqualTo("Somebody");
        assertThat(document.at("/$defs/Person.Gender")).isEqualTo(json("""
            {"type": "string", "enum": ["MALE", "FEMALE"]}
            """));
        assertThat(document.get("required")).isEqualTo(json("""
            ["name", "age", "gender"]
            """));

        Models.Person person = (Models.Person) compiled.instantiate("""
            {"name": "John Doe", "age": 43, "gender": "MALE"}
            """, host);

        assertThat(person.name).isEqualTo("John Doe");
        assertThat(person.age).isEqualTo(43);
        assertThat(person.gender).isEqualTo(Models.Person.Gender.MALE);
    }

    @Test
    void teamRoundTrip() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Team.class);
        SchemaLibrary library = new SchemaLibrary(host);

        Models.Team team = (Models.Team) library.instantiate(host.sourceOf(Models.Team.class), """
            {
              "lead": {"name": "Ada", "age": 36, "gender": "FEMALE"},
              "members": [
                {"name": "Bob", "age": 30, "gender": "MALE"},
                {"name": "Cy", "age": 25, "gender": "MALE"}
              ],
              "tags": ["core", "infra"],
              "scores": [3, 5, 8],
              "roles": ["LEAD", "MEMBER"],
              "meta": {"floor": 2, "remote": true},
              "extras": [1, "two", null]
            }
            """);

        assertThat(team.lead.name).isEqualTo("Ada");
        assertThat(team.lead.gender).isEqualTo(Models.Person.Gender.FEMALE);
        assertThat(team.members).extracting(p -> p.name).containsExactly("Bob", "Cy");
        assertThat(team.tags).containsExactly("core", "infra");
        assertThat(team.scores).containsExactly(3, 5, 8);
        assertThat(team.roles).containsExactly(Models.Role.LEAD, Models.Role.MEMBER);
        assertThat(team.meta).containsEntry("floor", 2L).containsEntry("remote", true);
        assertThat(team.extras).hasSize(3);
    }

    @Test
    void fieldDescriptionsReachTheSchema() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Team.class);

        JsonNode document = new SchemaLibrary(host).generateNamed("Team").document();

        assertThat(document.at("/properties/extras/description").asText()).isEqualTo("Free-form extras");
    }

    @Test
    void recursiveTree() {
        JavaBeanHost host = new JavaBeanHost().register(Models.TreeNode.class);
        CompiledClassSchema compiled = new SchemaLibrary(host).generateNamed("TreeNode");

        assertThat(compiled.document().at("/properties/children/items/$ref").asText()).isEqualTo("#/$defs/TreeNode");

        Models.TreeNode root = (Models.TreeNode) compiled.instantiate("""
            {"label": "root", "children": [{"label": "leaf", "children": []}]}
            """, host);

        assertThat(root.children).hasSize(1);
        assertThat(root.children.get(0).label).isEqualTo("leaf");
        assertThat(root.children.get(0).children).isEmpty();
    }

    @Test
    void compositeFields() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Sprite.class);
        CompiledClassSchema compiled = new SchemaLibrary(host).generateNamed("Sprite");

        assertThat(compiled.document().at("/properties/position/$ref").asText()).isEqualTo("#/$defs/Vector2");
        assertThat(compiled.document().at("/properties/palette/items/$ref").asText()).isEqualTo("#/$defs/Color");

        Models.Sprite sprite = (Models.Sprite) compiled.instantiate("""
            {
              "position": {"x": 1.5, "y": -2},
              "palette": [{"r": 1, "g": 0, "b": 0, "a": 1}],
              "id": 9
            }
            """, host);

        assertThat(sprite.position.type()).isEqualTo(BuiltinType.VECTOR2);
        assertThat(sprite.position.field("y")).isEqualTo(-2.0d);
        assertThat(sprite.palette).hasSize(1);
        CompositeValue red = sprite.palette.get(0);
        assertThat(red.field("r")).isEqualTo(1.0d);
        assertThat(sprite.id).isEqualTo(9L);
    }

    @Test
    void unsupportedFieldTypeFailsGeneration() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Unsupported.class);

        assertThatThrownBy(() -> new SchemaLibrary(host).generateNamed("Unsupported"))
            .isInstanceOfSatisfying(ResolutionException.class, e ->
                assertThat(e.reason()).isEqualTo(ResolutionException.Reason.UNSUPPORTED_KIND));
    }

    @Test
    void integerOutOfFieldRangeIsHostFailure() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Person.class);
        CompiledClassSchema compiled = new SchemaLibrary(host).generateNamed("Person");

        assertThatThrownBy(() -> compiled.instantiate("""
            {"name": "Old", "age": 3000000000, "gender": "MALE"}
            """, host))
            .isInstanceOf(HostException.class)
            .hasMessageContaining("Person.age");
    }

    @Test
    void missingNoArgConstructor() {
        JavaBeanHost host = new JavaBeanHost().register(Models.NoDefaultConstructor.class);
        CompiledClassSchema compiled = new SchemaLibrary(host).generateNamed("NoDefaultConstructor");

        assertThatThrownBy(() -> compiled.instantiate("{\"id\": \"x\"}", host))
            .isInstanceOf(HostException.class)
            .hasMessageContaining("no-arg constructor");
    }

    @Test
    void simpleNameClashIsRejected() {
        JavaBeanHost host = new JavaBeanHost().register(Models.Person.class);

        assertThatThrownBy(() -> host.register(Clash.Person.class)).isInstanceOf(IllegalArgumentException.class);
    }

    static final class Clash {
        static class Person {
            String id;
        }
    }
}
