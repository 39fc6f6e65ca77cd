package com.williamcallahan.esvector.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.primitives.Primitives;
import com.williamcallahan.esvector.domain.errors.TypeMismatchException;
import com.williamcallahan.esvector.domain.errors.UnsupportedExpressionException;
import com.williamcallahan.esvector.filter.FilterExpression.Binary;
import com.williamcallahan.esvector.filter.FilterExpression.Constant;
import com.williamcallahan.esvector.filter.FilterExpression.Convert;
import com.williamcallahan.esvector.filter.FilterExpression.Entry;
import com.williamcallahan.esvector.filter.FilterExpression.Member;
import com.williamcallahan.esvector.filter.FilterExpression.MethodCall;
import com.williamcallahan.esvector.filter.FilterExpression.Not;
import com.williamcallahan.esvector.filter.FilterExpression.Operator;
import com.williamcallahan.esvector.mapping.KeyCodec;
import com.williamcallahan.esvector.model.CollectionModel;
import com.williamcallahan.esvector.model.KeyPropertyModel;
import com.williamcallahan.esvector.model.PropertyModel;
import com.williamcallahan.esvector.model.VectorPropertyModel;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles {@link FilterExpression} trees into Elasticsearch query DSL.
 *
 * <p>Every property reference must resolve against the collection model; the key is queried
 * through {@code _id} and vector properties are never filterable. Constants are converted with the
 * storage mapper so they match the stored representation.</p>
 */
public final class FilterTranslator {

    private static final String ID_FIELD = "_id";
    private static final String CONTAINS = "contains";

    private final ObjectMapper objectMapper;

    public FilterTranslator(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Translates a filter into a query.
     *
     * @param filter filter expression, or {@code null} for no filter
     * @param model collection model that property references resolve against
     * @return query, or empty when the filter matches every document
     */
    public Optional<ObjectNode> translate(FilterExpression filter, CollectionModel model) {
        Objects.requireNonNull(model, "model");
        if (filter == null) {
            return Optional.empty();
        }
        if (filter instanceof Constant constant && Boolean.TRUE.equals(constant.value())) {
            return Optional.empty();
        }
        return Optional.of(query(filter, model));
    }

    private ObjectNode query(FilterExpression expression, CollectionModel model) {
        if (expression instanceof Binary binary) {
            return binary(binary, model);
        }
        if (expression instanceof Not not) {
            return mustNot(query(not.operand(), model));
        }
        if (expression instanceof MethodCall call) {
            return methodCall(call, model);
        }
        if (expression instanceof Constant constant && constant.value() instanceof Boolean flag) {
            return flag ? matchAll() : mustNot(matchAll());
        }
        Optional<BoundProperty> bound = bindProperty(expression, model);
        if (bound.isPresent()) {
            return booleanTest(bound.get());
        }
        throw unsupportedNode(expression);
    }

    private ObjectNode binary(Binary binary, CollectionModel model) {
        return switch (binary.operator()) {
            case AND -> bool("must", query(binary.left(), model), query(binary.right(), model));
            case OR -> {
                ObjectNode disjunction = bool("should", query(binary.left(), model), query(binary.right(), model));
                ((ObjectNode) disjunction.get("bool")).put("minimum_should_match", 1);
                yield disjunction;
            }
            case EQUAL, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL ->
                    comparison(binary, model);
            default -> throw new UnsupportedExpressionException(
                    "Binary operator " + binary.operator() + " is not supported in filters");
        };
    }

    private ObjectNode comparison(Binary binary, CollectionModel model) {
        Optional<BoundProperty> leftProperty = bindProperty(binary.left(), model);
        Optional<Literal> rightLiteral = literal(binary.right());
        if (leftProperty.isPresent() && rightLiteral.isPresent()) {
            return compare(binary.operator(), leftProperty.get(), rightLiteral.get().value());
        }
        Optional<BoundProperty> rightProperty = bindProperty(binary.right(), model);
        Optional<Literal> leftLiteral = literal(binary.left());
        if (rightProperty.isPresent() && leftLiteral.isPresent()) {
            return compare(flip(binary.operator()), rightProperty.get(), leftLiteral.get().value());
        }
        throw new UnsupportedExpressionException("Comparison " + binary.operator()
                + " must compare exactly one property with one constant, got "
                + nodeKind(binary.left()) + " and " + nodeKind(binary.right()));
    }

    private ObjectNode compare(Operator operator, BoundProperty bound, Object value) {
        if (operator == Operator.EQUAL || operator == Operator.NOT_EQUAL) {
            ObjectNode equality = value == null ? isNull(bound) : term(bound, value);
            if (operator == Operator.EQUAL) {
                return equality;
            }
            return value == null ? exists(bound.field()) : mustNot(equality);
        }
        if (bound.isKey()) {
            throw new UnsupportedExpressionException("Range comparison on key property '"
                    + bound.property().modelName() + "' is not supported");
        }
        if (value == null) {
            throw new UnsupportedExpressionException("Range comparison on property '"
                    + bound.property().modelName() + "' requires a non-null constant");
        }
        String rangeBound = switch (operator) {
            case LESS_THAN -> "lt";
            case LESS_THAN_OR_EQUAL -> "lte";
            case GREATER_THAN -> "gt";
            case GREATER_THAN_OR_EQUAL -> "gte";
            default -> throw new IllegalStateException("Not a range operator: " + operator);
        };
        ObjectNode range = objectMapper.createObjectNode();
        range.putObject("range").putObject(bound.field()).set(rangeBound, toJson(bound, value));
        return range;
    }

    private ObjectNode methodCall(MethodCall call, CollectionModel model) {
        if (!CONTAINS.equals(call.method())) {
            throw new UnsupportedExpressionException(
                    "Method '" + call.method() + "' is not supported in filters; only contains is translatable");
        }
        FilterExpression collection;
        FilterExpression item;
        if (call.target() != null && call.arguments().size() == 1) {
            collection = call.target();
            item = call.arguments().get(0);
        } else if (call.target() == null && call.arguments().size() == 2) {
            collection = call.arguments().get(0);
            item = call.arguments().get(1);
        } else {
            throw new UnsupportedExpressionException(
                    "contains expects a collection and one item, got " + call.arguments().size() + " arguments");
        }

        Optional<BoundProperty> arrayProperty = bindProperty(collection, model);
        Optional<Literal> itemLiteral = literal(item);
        if (arrayProperty.isPresent() && itemLiteral.isPresent()) {
            BoundProperty bound = arrayProperty.get();
            Class<?> rawType = bound.property().rawType();
            if (!rawType.isArray() && !Collection.class.isAssignableFrom(rawType)) {
                throw new UnsupportedExpressionException("contains on property '" + bound.property().modelName()
                        + "' requires an array or collection property, got " + rawType.getSimpleName());
            }
            if (itemLiteral.get().value() == null) {
                throw new UnsupportedExpressionException("contains on property '" + bound.property().modelName()
                        + "' requires a non-null constant");
            }
            return terms(bound, List.of(itemLiteral.get().value()));
        }

        Optional<Literal> collectionLiteral = literal(collection);
        Optional<BoundProperty> itemProperty = bindProperty(item, model);
        if (collectionLiteral.isPresent() && itemProperty.isPresent()) {
            return terms(itemProperty.get(), elements(collectionLiteral.get().value()));
        }
        throw new UnsupportedExpressionException("contains supports a property with a constant item or a constant "
                + "collection with a property item, got " + nodeKind(collection) + " and " + nodeKind(item));
    }

    private ObjectNode booleanTest(BoundProperty bound) {
        if (Primitives.wrap(bound.property().rawType()) != Boolean.class) {
            throw new UnsupportedExpressionException("Property '" + bound.property().modelName()
                    + "' is not boolean and cannot be used as a condition on its own");
        }
        return term(bound, Boolean.TRUE);
    }

    private Optional<BoundProperty> bindProperty(FilterExpression expression, CollectionModel model) {
        if (expression instanceof Member member) {
            return Optional.of(resolve(member.name(), model));
        }
        if (expression instanceof Entry entry) {
            return Optional.of(resolve(entry.key(), model));
        }
        if (expression instanceof Convert convert) {
            Optional<BoundProperty> bound = bindProperty(convert.operand(), model);
            bound.ifPresent(property -> checkCast(property.property(), convert.targetType()));
            return bound;
        }
        return Optional.empty();
    }

    private static BoundProperty resolve(String name, CollectionModel model) {
        PropertyModel property = model.property(name);
        if (property instanceof VectorPropertyModel) {
            throw new UnsupportedExpressionException("Vector property '" + name + "' cannot be used in a filter");
        }
        boolean key = property instanceof KeyPropertyModel;
        return new BoundProperty(property, key ? ID_FIELD : property.storageName(), key);
    }

    private static void checkCast(PropertyModel property, Class<?> targetType) {
        Class<?> sourceType = Primitives.wrap(property.rawType());
        Class<?> wrappedTarget = Primitives.wrap(targetType);
        boolean compatible = wrappedTarget.isAssignableFrom(sourceType)
                || sourceType.isAssignableFrom(wrappedTarget)
                || (Number.class.isAssignableFrom(sourceType) && Number.class.isAssignableFrom(wrappedTarget));
        if (!compatible) {
            throw new TypeMismatchException("Property '" + property.modelName() + "' of type "
                    + sourceType.getSimpleName() + " cannot be cast to " + targetType.getSimpleName());
        }
    }

    private static Optional<Literal> literal(FilterExpression expression) {
        if (expression instanceof Constant constant) {
            return Optional.of(new Literal(constant.value()));
        }
        if (expression instanceof Convert convert) {
            return literal(convert.operand());
        }
        return Optional.empty();
    }

    private static List<Object> elements(Object collection) {
        if (collection instanceof Collection<?> values) {
            return new ArrayList<>(values);
        }
        if (collection != null && collection.getClass().isArray()) {
            int length = Array.getLength(collection);
            List<Object> values = new ArrayList<>(length);
            for (int index = 0; index < length; index++) {
                values.add(Array.get(collection, index));
            }
            return values;
        }
        throw new UnsupportedExpressionException("contains requires a constant array or collection, got "
                + (collection == null ? "null" : collection.getClass().getSimpleName()));
    }

    private static Operator flip(Operator operator) {
        return switch (operator) {
            case LESS_THAN -> Operator.GREATER_THAN;
            case LESS_THAN_OR_EQUAL -> Operator.GREATER_THAN_OR_EQUAL;
            case GREATER_THAN -> Operator.LESS_THAN;
            case GREATER_THAN_OR_EQUAL -> Operator.LESS_THAN_OR_EQUAL;
            default -> operator;
        };
    }

    private ObjectNode term(BoundProperty bound, Object value) {
        ObjectNode term = objectMapper.createObjectNode();
        term.putObject("term").set(bound.field(), toJson(bound, value));
        return term;
    }

    private ObjectNode terms(BoundProperty bound, List<Object> values) {
        ObjectNode terms = objectMapper.createObjectNode();
        ArrayNode array = terms.putObject("terms").putArray(bound.field());
        for (Object value : values) {
            array.add(toJson(bound, value));
        }
        return terms;
    }

    private ObjectNode isNull(BoundProperty bound) {
        if (bound.isKey()) {
            throw new UnsupportedExpressionException(
                    "Key property '" + bound.property().modelName() + "' cannot be compared with null");
        }
        return mustNot(exists(bound.field()));
    }

    private ObjectNode exists(String field) {
        ObjectNode exists = objectMapper.createObjectNode();
        exists.putObject("exists").put("field", field);
        return exists;
    }

    private ObjectNode matchAll() {
        ObjectNode matchAll = objectMapper.createObjectNode();
        matchAll.putObject("match_all");
        return matchAll;
    }

    private ObjectNode mustNot(ObjectNode negated) {
        return bool("must_not", negated);
    }

    private ObjectNode bool(String occurrence, ObjectNode... clauses) {
        ObjectNode query = objectMapper.createObjectNode();
        ArrayNode array = query.putObject("bool").putArray(occurrence);
        for (ObjectNode clause : clauses) {
            array.add(clause);
        }
        return query;
    }

    private JsonNode toJson(BoundProperty bound, Object value) {
        if (bound.isKey()) {
            return TextNode.valueOf(KeyCodec.toStorageId(keyValue(bound.property(), value)));
        }
        return objectMapper.valueToTree(value);
    }

    private static Object keyValue(PropertyModel keyProperty, Object value) {
        Class<?> keyType = Primitives.wrap(keyProperty.rawType());
        if (keyType.isInstance(value)) {
            return value;
        }
        if (keyType == Long.class && isIntegral(value)) {
            return Long.valueOf(((Number) value).longValue());
        }
        throw new TypeMismatchException("Key property '" + keyProperty.modelName() + "' of type "
                + keyType.getSimpleName() + " cannot be compared with "
                + (value == null ? "null" : value.getClass().getSimpleName() + " value " + value));
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    private static UnsupportedExpressionException unsupportedNode(FilterExpression expression) {
        return new UnsupportedExpressionException(
                "Filter node " + nodeKind(expression) + " is not supported: " + expression);
    }

    private static String nodeKind(FilterExpression expression) {
        return expression == null ? "null" : expression.getClass().getSimpleName();
    }

    private record BoundProperty(PropertyModel property, String field, boolean isKey) {}

    private record Literal(Object value) {}
}
