/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query;

import org.opensearch.core.xcontent.ToXContentFragment;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A single filter condition. Conditions of a request are combined conjunctively.
 *
 * <p>Serialized as a {@code [column, operator, value]} triple where value is a list for {@code IN}.</p>
 */
public record QueryCondition(String column, ConditionOperator operator, Object value) implements ToXContentFragment {

    public QueryCondition {
        Objects.requireNonNull(column, "column cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        if (operator == ConditionOperator.IN && value instanceof Collection<?> == false) {
            throw new IllegalArgumentException("IN condition on [" + column + "] requires a collection of values");
        }
    }

    public static QueryCondition in(String column, Collection<?> values) {
        return new QueryCondition(column, ConditionOperator.IN, List.copyOf(values));
    }

    public static QueryCondition equalTo(String column, Object value) {
        return new QueryCondition(column, ConditionOperator.EQUALS, value);
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startArray();
        builder.value(column);
        builder.value(operator.getSymbol());
        builder.value(value);
        builder.endArray();
        return builder;
    }
}
