package com.purchasingpower.codesearch.knowledge.extract;

import com.purchasingpower.codesearch.core.Symbol;
import com.purchasingpower.codesearch.core.SymbolKind;
import com.purchasingpower.codesearch.exception.SourceParseException;
import com.purchasingpower.codesearch.knowledge.ExtractedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Java Source Extractor Tests")
class JavaSourceExtractorTest {

    private static final String SOURCE = """
        package com.example.orders;

        import java.util.List;
        import java.util.concurrent.*;

        /**
         * Places orders.
         */
        public class OrderService {

            private final Validator validator = new Validator();

            public OrderService() {
                init();
            }

            /**
             * Place one order.
             *
             * @param order the order
             */
            public Receipt place(Order order) {
                validator.check(order);
                return new Receipt(order.getId());
            }

            private void init() {
            }
        }

        interface Validator {
            void check(Order order);
        }
        """;

    private JavaSourceExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new JavaSourceExtractor();
    }

    private static Symbol named(ExtractedFile file, String name) {
        return file.getSymbols().stream()
            .filter(symbol -> symbol.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No symbol named " + name));
    }

    @Test
    @DisplayName("Should extract imports, types and methods in line order")
    void extract_ShouldFindSymbols() {
        // When
        ExtractedFile file = extractor.extract("src/OrderService.java", SOURCE);

        // Then
        assertThat(file.getSymbols())
            .extracting(Symbol::getName)
            .containsExactly("java.util.List", "java.util.concurrent.*", "OrderService", "place", "init",
                "Validator", "check");
        assertThat(named(file, "java.util.List").getKind()).isEqualTo(SymbolKind.IMPORT);
        assertThat(named(file, "Validator").getDefinition()).isEqualTo("interface Validator");
    }

    @Test
    @DisplayName("Should attach Javadoc, declarations and calls")
    void extract_ShouldDescribeDefinitions() {
        // When
        ExtractedFile file = extractor.extract("src/OrderService.java", SOURCE);

        // Then
        Symbol service = named(file, "OrderService");
        assertEquals(SymbolKind.CLASS, service.getKind());
        assertEquals(9, service.getLineNumber());
        assertEquals("public class OrderService", service.getDefinition());
        assertEquals("Places orders.", service.getDocstring());
        assertThat(service.getDependencies()).contains("Validator", "init", "check", "Receipt", "getId");

        Symbol place = named(file, "place");
        assertEquals(SymbolKind.FUNCTION, place.getKind());
        assertEquals(22, place.getLineNumber());
        assertEquals("public Receipt place(Order order)", place.getDefinition());
        assertEquals("Place one order.", place.getDocstring());
        assertThat(place.getDependencies()).containsExactlyInAnyOrder("check", "Receipt", "getId");
    }

    @Test
    @DisplayName("Should raise a parse error for invalid Java")
    void extract_ShouldRejectInvalidSource() {
        assertThatThrownBy(() -> extractor.extract("src/Broken.java", "public class Broken {\n  void x( {\n}\n"))
            .isInstanceOf(SourceParseException.class)
            .hasMessageStartingWith("src/Broken.java:");
    }
}
