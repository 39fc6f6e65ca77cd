package com.williamcallahan.esvector.filter;

import java.util.List;
import java.util.Objects;

/**
 * Expression tree over one record, translated into an Elasticsearch query by {@link FilterTranslator}.
 *
 * <p>Build trees with {@link Filters}. The tree is a plain value: translating the same tree against the
 * same model always yields the same query.</p>
 */
public sealed interface FilterExpression {

    /** Operators of {@link Binary} nodes. Arithmetic operators are representable but never translated. */
    enum Operator {
        EQUAL,
        NOT_EQUAL,
        LESS_THAN,
        LESS_THAN_OR_EQUAL,
        GREATER_THAN,
        GREATER_THAN_OR_EQUAL,
        AND,
        OR,
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE
    }

    /**
     * Access to a typed record member by model name.
     *
     * @param name model name of the property
     */
    record Member(String name) implements FilterExpression {
        public Member {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Indexer access on a dynamic record, {@code record.get(key)}.
     *
     * @param key model name of the property
     */
    record Entry(String key) implements FilterExpression {
        public Entry {
            Objects.requireNonNull(key, "key");
        }
    }

    /**
     * A literal value; may be {@code null}, a scalar, an array, or a collection.
     *
     * @param value literal
     */
    record Constant(Object value) implements FilterExpression {}

    /**
     * A cast of the operand to the target type.
     *
     * @param operand converted expression
     * @param targetType cast target
     */
    record Convert(FilterExpression operand, Class<?> targetType) implements FilterExpression {
        public Convert {
            Objects.requireNonNull(operand, "operand");
            Objects.requireNonNull(targetType, "targetType");
        }
    }

    /**
     * A binary comparison, logical, or arithmetic node.
     *
     * @param operator operator
     * @param left left operand
     * @param right right operand
     */
    record Binary(Operator operator, FilterExpression left, FilterExpression right) implements FilterExpression {
        public Binary {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /**
     * Logical negation.
     *
     * @param operand negated expression
     */
    record Not(FilterExpression operand) implements FilterExpression {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }
    }

    /**
     * A method invocation; only {@code contains} is translatable.
     *
     * @param method method name
     * @param target receiver, or {@code null} for a static-style call such as {@code contains(list, item)}
     * @param arguments call arguments
     */
    record MethodCall(String method, FilterExpression target, List<FilterExpression> arguments)
            implements FilterExpression {
        public MethodCall {
            Objects.requireNonNull(method, "method");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }
}
