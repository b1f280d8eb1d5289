package com.psl.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
