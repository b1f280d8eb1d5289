package com.psl.search.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CategoryRouterTest {

    private final RoutingProperties properties = new RoutingProperties();
    private final CategoryRouter router = new CategoryRouter(new CategoryCatalog(properties), properties);

    @ParameterizedTest(name = "[{index}] {0}")
    @CsvSource(delimiter = '|', value = {
        "machine learning                                          | ai_cs               | FAST",
        "cancer immunotherapy                                      | medicine_biology    | FAST",
        "quantum computing                                         | engineering_physics | FAST",
        "crop yield in drought                                     | agriculture_animal  | FAST",
        "history of philosophy                                     | humanities_social   | FAST",
        "inflation and unemployment                                | economics_business  | FAST",
        "medieval poetry                                           | general             | FAST",
        "how do transformers work                                  | ai_cs               | EXPAND",
        "effects of fertilizer on soil?                            | agriculture_animal  | EXPAND",
        "a novel framework for robotics                            | engineering_physics | EXPAND",
        "graph neural networks for molecule property prediction tasks | ai_cs            | EXPAND",
        "animal learning                                           | agriculture_animal  | FAST"
    })
    void routesQueryToCategoryAndMode(String query, String category, SearchMode mode) {
        RoutePlan plan = router.route(query, null, null);

        assertEquals(category, plan.getCategoryId());
        assertEquals(mode, plan.getMode());
        assertThat(plan.isCategoryInferred()).isTrue();
        assertThat(plan.isModeInferred()).isTrue();
    }

    @Test
    void explicitCategoryAndModeWin() {
        RoutePlan plan = router.route("machine learning", "medicine_biology", SearchMode.EXPAND);

        assertEquals("medicine_biology", plan.getCategoryId());
        assertEquals(SearchMode.EXPAND, plan.getMode());
        assertEquals(List.of("pubmed", "europe_pmc", "crossref"), plan.getProviders());
        assertFalse(plan.isCategoryInferred());
        assertFalse(plan.isModeInferred());
    }

    @Test
    void providerHierarchyAndLimitsFollowCategory() {
        assertEquals(List.of("arxiv", "semantic_scholar", "openalex"), router.route("deep learning", null, null).getProviders());
        assertEquals(200, router.route("livestock breeding", null, null).getMaxResults());
        assertEquals(100, router.route("quantum", null, null).getMaxResults());
    }

    @Test
    void unknownExplicitCategoryIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> router.route("x", "astrology", null));
    }

    @Test
    void leadWordMustBeFirstWord() {
        assertEquals(SearchMode.EXPAND, router.inferMode("Explain attention"));
        assertEquals(SearchMode.FAST, router.inferMode("attention explain"));
        assertEquals(SearchMode.FAST, router.inferMode(""));
    }

    @Test
    void overridesReplaceProviderHierarchy() {
        RoutingProperties custom = new RoutingProperties();
        RoutingProperties.CategoryOverride override = new RoutingProperties.CategoryOverride();
        override.setProviders(List.of("openalex", "crossref", "semantic_scholar"));
        override.setMaxResults(50);
        custom.setCategories(Map.of("ai_cs", override));
        CategoryRouter customRouter = new CategoryRouter(new CategoryCatalog(custom), custom);

        RoutePlan plan = customRouter.route("machine learning", null, null);

        assertEquals(List.of("openalex", "crossref", "semantic_scholar"), plan.getProviders());
        assertEquals(50, plan.getMaxResults());
    }

    @Test
    void suggestionDescribesRoute() {
        RouteSuggestion suggestion = router.suggest("what is reinforcement learning?");

        assertEquals("expand", suggestion.getSuggestedMode());
        assertEquals("ai_cs", suggestion.getDetectedCategory());
        assertEquals("AI & Computer Science", suggestion.getCategoryName());
        assertEquals(List.of("arxiv", "semantic_scholar", "openalex"), suggestion.getSourceHierarchy());
    }
}
