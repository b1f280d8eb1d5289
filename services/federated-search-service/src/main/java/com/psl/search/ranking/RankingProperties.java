package com.psl.search.ranking;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.ranking")
public class RankingProperties {
    private double semanticWeight = 0.7;
    private double keywordWeight = 0.3;
    private double localMinScore = 0.4;
    private double externalMinScore = 0.0;

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public void setSemanticWeight(double semanticWeight) {
        this.semanticWeight = semanticWeight;
    }

    public double getKeywordWeight() {
        return keywordWeight;
    }

    public void setKeywordWeight(double keywordWeight) {
        this.keywordWeight = keywordWeight;
    }

    public double getLocalMinScore() {
        return localMinScore;
    }

    public void setLocalMinScore(double localMinScore) {
        this.localMinScore = localMinScore;
    }

    public double getExternalMinScore() {
        return externalMinScore;
    }

    public void setExternalMinScore(double externalMinScore) {
        this.externalMinScore = externalMinScore;
    }
}
