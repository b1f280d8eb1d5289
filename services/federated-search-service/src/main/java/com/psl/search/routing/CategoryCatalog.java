package com.psl.search.routing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Known search categories in declaration order. Declaration order is the tie-break for category inference.
 */
@Component
public class CategoryCatalog {
    public static final String GENERAL = "general";

    private final Map<String, SearchCategory> categories;

    public CategoryCatalog(RoutingProperties properties) {
        Map<String, SearchCategory> resolved = new LinkedHashMap<>();
        for (SearchCategory category : defaults()) {
            RoutingProperties.CategoryOverride override = properties.getCategories().get(category.getId());
            resolved.put(
                category.getId(),
                override == null ? category : category.withOverrides(override.getProviders(), override.getMaxResults())
            );
        }
        this.categories = Collections.unmodifiableMap(resolved);
    }

    public Optional<SearchCategory> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(categories.get(id.trim()));
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    public Collection<SearchCategory> all() {
        return categories.values();
    }

    public SearchCategory require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("unknown category: " + id));
    }

    static List<SearchCategory> defaults() {
        List<SearchCategory> list = new ArrayList<>();
        list.add(new SearchCategory(
            "ai_cs",
            "AI & Computer Science",
            "Machine learning, AI, computer vision, NLP",
            List.of("arxiv", "semantic_scholar", "openalex"),
            List.of("machine learning", "deep learning", "AI", "neural network", "computer vision", "NLP",
                "algorithm", "artificial intelligence", "data science", "reinforcement learning", "convolutional",
                "transformer", "GPT", "BERT", "large language model"),
            100
        ));
        list.add(new SearchCategory(
            "medicine_biology",
            "Medicine & Biology",
            "Clinical research, biomedical, healthcare",
            List.of("pubmed", "europe_pmc", "crossref"),
            List.of("cancer", "disease", "clinical", "medical", "patient", "treatment", "diagnosis", "therapy",
                "drug", "vaccine", "genomics", "biotechnology", "molecular biology", "protein", "DNA", "RNA",
                "gene", "mutation", "clinical trial"),
            100
        ));
        list.add(new SearchCategory(
            "engineering_physics",
            "Engineering & Physics",
            "Applied sciences, engineering, physics",
            List.of("arxiv", "openalex", "crossref"),
            List.of("engineering", "physics", "quantum", "materials", "mechanics", "system", "design", "circuit",
                "semiconductor", "thermodynamics", "fluid", "dynamics", "control systems", "robotics", "aerospace",
                "mechanical", "electrical"),
            100
        ));
        list.add(new SearchCategory(
            "agriculture_animal",
            "Agriculture & Animal Science",
            "Farming, animal science, food security",
            List.of("openalex", "core", "crossref"),
            List.of("agriculture", "farming", "livestock", "crop", "animal", "soil", "food", "pesticide",
                "fertilizer", "breeding", "veterinary", "nutrition", "sustainable", "yield", "pest", "disease",
                "climate", "water"),
            200
        ));
        list.add(new SearchCategory(
            "humanities_social",
            "Humanities & Social Sciences",
            "Psychology, sociology, education, humanities",
            List.of("eric", "openalex", "core"),
            List.of("psychology", "sociology", "education", "social", "culture", "history", "philosophy",
                "anthropology", "economics", "political", "policy", "behavior", "learning", "teaching",
                "curriculum", "pedagogy"),
            100
        ));
        list.add(new SearchCategory(
            "economics_business",
            "Economics & Business",
            "Economics, finance, business management",
            List.of("openalex", "core", "crossref"),
            List.of("economics", "business", "finance", "market", "trade", "management", "investment",
                "corporate", "entrepreneurship", "strategy", "financial", "economic", "GDP", "inflation",
                "unemployment", "policy"),
            200
        ));
        list.add(new SearchCategory(
            GENERAL,
            "General (All Fields)",
            "Cross-disciplinary and general research",
            List.of("semantic_scholar", "openalex", "crossref"),
            List.of(),
            100
        ));
        return list;
    }
}
