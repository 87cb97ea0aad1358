package me.golemcore.recommender.domain.service;

import me.golemcore.recommender.domain.RecommenderConstants;
import me.golemcore.recommender.domain.model.CandidateScore;
import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.domain.model.InteractionType;
import me.golemcore.recommender.domain.model.Product;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.port.outbound.CatalogQueryPort;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import me.golemcore.recommender.testsupport.InMemoryRecommenderData;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PopularityScorerTest {

    private static final long USER = 99L;

    @Test
    void shouldNormalizeInteractionCounts() {
        assertEquals(0.0, PopularityScorer.normalize(0));
        assertEquals(0.5, PopularityScorer.normalize(5));
        assertEquals(1.0, PopularityScorer.normalize(10));
        assertEquals(1.0, PopularityScorer.normalize(250));
    }

    @Test
    void shouldRankAvailableUntouchedProductsByInteractionCount() {
        InMemoryRecommenderData data = new InMemoryRecommenderData()
                .product(1L, "Electronics", "Apple", 999.99)
                .product(2L, "Books", "Penguin", 10)
                .product(3L, "Toys", "Lego", 50)
                .product(4L, "Books", "Penguin", 12)
                .product(Product.builder().id(5L).category("Toys").price(5).availability(false).build());
        for (long user = 1; user <= 12; user++) {
            data.interaction(user, 1L, InteractionType.VIEW);
            data.interaction(user, 5L, InteractionType.PURCHASE);
        }
        for (long user = 1; user <= 3; user++) {
            data.interaction(user, 2L, InteractionType.LIKE);
            data.interaction(user, 4L, InteractionType.LIKE);
        }
        data.interaction(USER, 2L, InteractionType.VIEW);

        List<CandidateScore> candidates = new PopularityScorer(data.interactions(), data.catalog()).score(USER, 10);

        assertEquals(List.of(1L, 4L, 3L), candidates.stream().map(CandidateScore::productId).toList());
        assertEquals(1.0, candidates.get(0).score());
        assertEquals(0.3, candidates.get(1).score(), 1e-9);
        assertEquals(0.0, candidates.get(2).score());
        assertEquals(RecommendationAlgorithm.POPULARITY, candidates.get(0).algorithm());
        assertEquals(RecommenderConstants.REASON_POPULARITY, candidates.get(0).reason());
    }

    @Test
    void shouldCountAllCandidatesWithOneAggregateRead() {
        InteractionQueryPort interactions = mock(InteractionQueryPort.class);
        CatalogQueryPort catalog = mock(CatalogQueryPort.class);
        when(interactions.findByUser(USER)).thenReturn(List.of(Interaction.builder()
                .id(1L).userId(USER).productId(2L).type(InteractionType.VIEW).build()));
        when(catalog.findAvailable()).thenReturn(List.of(
                Product.builder().id(1L).build(),
                Product.builder().id(2L).build(),
                Product.builder().id(3L).build()));
        when(interactions.findByProducts(List.of(1L, 3L))).thenReturn(Map.of(3L, List.of(
                Interaction.builder().id(2L).userId(5L).productId(3L).type(InteractionType.LIKE).build(),
                Interaction.builder().id(3L).userId(6L).productId(3L).type(InteractionType.VIEW).build())));

        List<CandidateScore> candidates = new PopularityScorer(interactions, catalog).score(USER, 10);

        assertEquals(List.of(3L, 1L), candidates.stream().map(CandidateScore::productId).toList());
        assertEquals(0.2, candidates.get(0).score(), 1e-9);
        verify(interactions, times(1)).findByProducts(List.of(1L, 3L));
        verify(interactions, never()).findByProduct(anyLong());
    }
}
