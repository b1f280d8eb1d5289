package com.psl.search.store;

import java.util.List;

public final class VectorLiteral {
    private VectorLiteral() {
    }

    /**
     * pgvector text form, e.g. {@code [0.1,0.2,0.3]}.
     */
    public static String of(List<Double> vector) {
        StringBuilder builder = new StringBuilder(vector.size() * 10 + 2);
        builder.append('[');
        for (int i = 0; i < vector.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(vector.get(i).floatValue());
        }
        return builder.append(']').toString();
    }
}
