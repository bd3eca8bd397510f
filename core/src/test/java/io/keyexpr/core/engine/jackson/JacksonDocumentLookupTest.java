package io.keyexpr.core.engine.jackson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keyexpr.core.error.KeyResultException;
import io.keyexpr.core.model.FieldPath;
import io.keyexpr.core.model.LookupResult;
import io.keyexpr.core.spi.DocumentLookup;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link JacksonDocumentLookup}: path walking and scalar rendering. */
@DisplayName("JacksonDocumentLookup")
class JacksonDocumentLookupTest {

    private final JacksonDocumentLookup lookup = new JacksonDocumentLookup();

    private LookupResult lookup(String json, String path) {
        return lookup.lookup(json.getBytes(StandardCharsets.UTF_8), FieldPath.parse(path));
    }

    private String scalar(String json) {
        LookupResult result = lookup("{\"v\": " + json + "}", "v");
        assertThat(result).isInstanceOf(LookupResult.Scalar.class);
        return ((LookupResult.Scalar) result).value();
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        void absent() {
            assertThat(lookup("{\"a\": 1}", "b")).isEqualTo(LookupResult.ABSENT);
            assertThat(lookup("{\"a\": {\"b\": 1}}", "a.c")).isEqualTo(LookupResult.ABSENT);
        }

        @Test
        @DisplayName("arrays and scalars are not walked into")
        void nonObjectIntermediate() {
            assertThat(lookup("{\"a\": [{\"b\": 1}]}", "a.b")).isEqualTo(LookupResult.ABSENT);
            assertThat(lookup("{\"a\": \"text\"}", "a.b")).isEqualTo(LookupResult.ABSENT);
            assertThat(lookup("[1, 2]", "a")).isEqualTo(LookupResult.ABSENT);
        }

        @Test
        void nullValue() {
            assertThat(lookup("{\"a\": null}", "a")).isEqualTo(LookupResult.NULL);
        }

        @Test
        void containers() {
            assertThat(lookup("{\"a\": []}", "a")).isEqualTo(LookupResult.ARRAY);
            assertThat(lookup("{\"a\": {}}", "a")).isEqualTo(LookupResult.OBJECT);
        }

        @Test
        void nestedScalar() {
            assertThat(lookup("{\"nested1\":{\"nested2\":{\"nested3\":\"x\"}}}", "nested1.nested2.nested3"))
                    .isEqualTo(LookupResult.scalar("x"));
        }

        @Test
        void emptyDocumentIsAbsent() {
            assertThat(lookup.lookup(new byte[0], FieldPath.of("a"))).isEqualTo(LookupResult.ABSENT);
        }

        @Test
        void malformedDocument() {
            assertThatThrownBy(() -> lookup("{\"a\": ", "a"))
                    .isInstanceOf(KeyResultException.class)
                    .hasMessage("key generation for document failed, document is not valid JSON")
                    .hasCauseInstanceOf(java.io.IOException.class);
        }
    }

    @Nested
    @DisplayName("Scalar rendering")
    class Rendering {

        @Test
        void strings() {
            assertThat(scalar("\"value\"")).isEqualTo("value");
            assertThat(scalar("\"\"")).isEmpty();
        }

        @Test
        void booleans() {
            assertThat(scalar("true")).isEqualTo("true");
            assertThat(scalar("false")).isEqualTo("false");
        }

        @Test
        void integers() {
            assertThat(scalar("10")).isEqualTo("10");
            assertThat(scalar("-42")).isEqualTo("-42");
            assertThat(scalar("123456789012345678901234567890")).isEqualTo("123456789012345678901234567890");
        }

        @Test
        @DisplayName("floating point is fixed-point without trailing zeros")
        void floatingPoint() {
            assertThat(scalar("3.1415")).isEqualTo("3.1415");
            assertThat(scalar("2.50")).isEqualTo("2.5");
            assertThat(scalar("100.0")).isEqualTo("100");
            assertThat(scalar("1e3")).isEqualTo("1000");
            assertThat(scalar("1.5e-7")).isEqualTo("0.00000015");
            assertThat(scalar("0.0")).isEqualTo("0");
        }

        @Test
        @DisplayName("floats too wide for a key fail without being expanded")
        void extremeExponents() {
            assertThatThrownBy(() -> scalar("1e2000000000"))
                    .isInstanceOf(KeyResultException.class)
                    .hasMessage("key generation for document failed, generated key is larger than 250 bytes");
            assertThatThrownBy(() -> scalar("1e-2000000000"))
                    .isInstanceOf(KeyResultException.class)
                    .hasMessageEndingWith("generated key is larger than 250 bytes");
        }

        @Test
        @DisplayName("the widest floats that still fit are rendered")
        void exponentsAtTheLimit() {
            assertThat(scalar("1e249")).hasSize(250).startsWith("1").endsWith("0");
            assertThat(scalar("1e-249")).hasSize(251).startsWith("0.").endsWith("1");
        }
    }

    @Nested
    @DisplayName("Bound to one document")
    class ForDocument {

        private final byte[] document = "{\"a\": 1, \"b\": {\"c\": \"x\"}}".getBytes(StandardCharsets.UTF_8);

        @Test
        void resolvesLikeTheUnboundLookup() {
            DocumentLookup bound = lookup.forDocument(document);

            assertThat(bound.lookup(document, FieldPath.of("a"))).isEqualTo(LookupResult.scalar("1"));
            assertThat(bound.lookup(document, FieldPath.of("b", "c"))).isEqualTo(LookupResult.scalar("x"));
            assertThat(bound.lookup(document, FieldPath.of("z"))).isEqualTo(LookupResult.ABSENT);
        }

        @Test
        @DisplayName("the document is only parsed when a field is looked up")
        void parsesLazily() {
            byte[] invalid = "{not json".getBytes(StandardCharsets.UTF_8);

            DocumentLookup bound = lookup.forDocument(invalid);

            assertThatThrownBy(() -> bound.lookup(invalid, FieldPath.of("a")))
                    .isInstanceOf(KeyResultException.class)
                    .hasMessageEndingWith("document is not valid JSON");
        }

        @Test
        @DisplayName("a different document is read on its own")
        void otherDocument() {
            DocumentLookup bound = lookup.forDocument(document);
            byte[] other = "{\"a\": 2}".getBytes(StandardCharsets.UTF_8);

            assertThat(bound.lookup(other, FieldPath.of("a"))).isEqualTo(LookupResult.scalar("2"));
        }
    }
}
