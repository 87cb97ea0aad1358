package me.golemcore.recommender.adapter.outbound.storage;

import me.golemcore.recommender.domain.RecommenderConstants;
import me.golemcore.recommender.domain.model.Product;
import me.golemcore.recommender.infrastructure.config.AutoConfiguration;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileCatalogAdapterTest {

    @TempDir
    Path tempDir;

    private FileCatalogAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        RecommenderProperties properties = new RecommenderProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new FileCatalogAdapter(new JsonDocumentStore(storage, AutoConfiguration.objectMapper()));

        Files.writeString(tempDir.resolve(RecommenderConstants.CATALOG_DIR).resolve(RecommenderConstants.PRODUCTS_FILE),
                """
                        [
                          {"id": 1, "name": "Laptop", "category": "Electronics", "brand": "Apple", "price": 999.99,
                           "availability": true},
                          {"id": 2, "name": "Sneakers", "category": "Clothing", "brand": "Nike", "price": 80,
                           "style": "casual"},
                          {"id": 3, "name": "Retired", "category": "Toys", "brand": "Lego", "price": 20,
                           "availability": false}
                        ]
                        """);
    }

    @Test
    void shouldListOnlyAvailableProducts() {
        List<Product> available = adapter.findAvailable();

        assertEquals(List.of(1L, 2L), available.stream().map(Product::getId).toList());
        assertNull(available.get(0).getStyle());
        assertEquals("casual", available.get(1).getStyle());
        assertTrue(available.get(1).isAvailability());
    }

    @Test
    void shouldLookUpAvailableProductsById() {
        assertEquals(List.of(2L), adapter.findByIds(List.of(2L, 3L, 99L)).stream().map(Product::getId).toList());
        assertTrue(adapter.findByIds(List.of()).isEmpty());
    }

    @Test
    void shouldTreatMissingCatalogAsEmpty() throws IOException {
        Files.delete(tempDir.resolve(RecommenderConstants.CATALOG_DIR).resolve(RecommenderConstants.PRODUCTS_FILE));

        assertTrue(adapter.findAvailable().isEmpty());
    }
}
