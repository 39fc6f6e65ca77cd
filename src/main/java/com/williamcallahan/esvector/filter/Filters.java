package com.williamcallahan.esvector.filter;

import com.williamcallahan.esvector.filter.FilterExpression.Binary;
import com.williamcallahan.esvector.filter.FilterExpression.Constant;
import com.williamcallahan.esvector.filter.FilterExpression.Convert;
import com.williamcallahan.esvector.filter.FilterExpression.Entry;
import com.williamcallahan.esvector.filter.FilterExpression.Member;
import com.williamcallahan.esvector.filter.FilterExpression.MethodCall;
import com.williamcallahan.esvector.filter.FilterExpression.Not;
import com.williamcallahan.esvector.filter.FilterExpression.Operator;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Static factory methods for filter expressions.
 *
 * <pre>{@code
 * FilterExpression filter = Filters.and(
 *         Filters.eq("category", "shoes"),
 *         Filters.contains("tags", "sale"));
 * }</pre>
 */
public final class Filters {

    private static final String CONTAINS = "contains";

    private Filters() {}

    public static FilterExpression member(String name) {
        return new Member(name);
    }

    public static FilterExpression entry(String key) {
        return new Entry(key);
    }

    public static FilterExpression constant(Object value) {
        return new Constant(value);
    }

    public static FilterExpression cast(FilterExpression operand, Class<?> targetType) {
        return new Convert(operand, targetType);
    }

    public static FilterExpression eq(String property, Object value) {
        return compare(Operator.EQUAL, member(property), constant(value));
    }

    public static FilterExpression ne(String property, Object value) {
        return compare(Operator.NOT_EQUAL, member(property), constant(value));
    }

    public static FilterExpression lt(String property, Object value) {
        return compare(Operator.LESS_THAN, member(property), constant(value));
    }

    public static FilterExpression le(String property, Object value) {
        return compare(Operator.LESS_THAN_OR_EQUAL, member(property), constant(value));
    }

    public static FilterExpression gt(String property, Object value) {
        return compare(Operator.GREATER_THAN, member(property), constant(value));
    }

    public static FilterExpression ge(String property, Object value) {
        return compare(Operator.GREATER_THAN_OR_EQUAL, member(property), constant(value));
    }

    public static FilterExpression compare(Operator operator, FilterExpression left, FilterExpression right) {
        return new Binary(operator, left, right);
    }

    public static FilterExpression add(FilterExpression left, FilterExpression right) {
        return new Binary(Operator.ADD, left, right);
    }

    /**
     * Combines expressions with logical AND, folding from the left.
     *
     * @param first first operand
     * @param rest further operands
     * @return conjunction
     */
    public static FilterExpression and(FilterExpression first, FilterExpression... rest) {
        return fold(Operator.AND, first, rest);
    }

    /**
     * Combines expressions with logical OR, folding from the left.
     *
     * @param first first operand
     * @param rest further operands
     * @return disjunction
     */
    public static FilterExpression or(FilterExpression first, FilterExpression... rest) {
        return fold(Operator.OR, first, rest);
    }

    public static FilterExpression not(FilterExpression operand) {
        return new Not(operand);
    }

    /** Tests whether an array or collection property contains a literal value. */
    public static FilterExpression contains(String arrayProperty, Object value) {
        return call(CONTAINS, member(arrayProperty), constant(value));
    }

    /** Tests whether a property's value is one of the literal values. */
    public static FilterExpression in(String property, Collection<?> values) {
        return call(CONTAINS, constant(values), member(property));
    }

    public static FilterExpression call(String method, FilterExpression target, FilterExpression... arguments) {
        return new MethodCall(method, target, Arrays.asList(arguments));
    }

    private static FilterExpression fold(Operator operator, FilterExpression first, FilterExpression[] rest) {
        FilterExpression combined = first;
        for (FilterExpression next : List.of(rest)) {
            combined = new Binary(operator, combined, next);
        }
        return combined;
    }
}
