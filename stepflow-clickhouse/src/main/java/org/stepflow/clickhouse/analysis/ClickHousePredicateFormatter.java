package org.stepflow.clickhouse.analysis;

import org.stepflow.analysis.filter.Predicate;
import org.stepflow.analysis.filter.PredicateVisitor;
import org.stepflow.collection.FieldType;
import org.stepflow.sql.QueryParameters;

import java.util.List;
import java.util.stream.Collectors;

import static org.stepflow.util.ValidationUtil.checkTableColumn;

/**
 * Renders predicates with ClickHouse {@code {name:Type}} placeholders and binds their values.
 */
public class ClickHousePredicateFormatter
        implements PredicateVisitor<String, QueryParameters> {
    private static final ClickHousePredicateFormatter INSTANCE = new ClickHousePredicateFormatter();

    public static String formatPredicates(List<Predicate> predicates, QueryParameters parameters) {
        if (predicates.isEmpty()) {
            return "";
        }
        return predicates.stream()
                .map(predicate -> predicate.accept(INSTANCE, parameters))
                .collect(Collectors.joining(" AND ", " AND ", ""));
    }

    public static String placeholder(String name, FieldType type) {
        return "{" + name + ":" + toClickHouseType(type) + "}";
    }

    public static String toClickHouseType(FieldType type) {
        if (type.isArray()) {
            return "Array(" + toClickHouseType(type.getArrayElementType()) + ")";
        }
        switch (type) {
            case STRING:
                return "String";
            case INTEGER:
                return "Int32";
            case LONG:
                return "Int64";
            case DOUBLE:
                return "Float64";
            case BOOLEAN:
                return "Bool";
            case DATE:
                return "Date";
            case TIMESTAMP:
                return "DateTime('UTC')";
            default:
                throw new IllegalArgumentException("Unsupported parameter type: " + type);
        }
    }

    private static String column(Predicate node) {
        return checkTableColumn(node.getField().getColumn(), '`');
    }

    @Override
    public String visitComparison(Predicate.Comparison node, QueryParameters parameters) {
        String name = parameters.bind(node.getParameter(), FieldType.STRING, node.getValue());
        return column(node) + (node.isNegated() ? " != " : " = ") + placeholder(name, FieldType.STRING);
    }

    @Override
    public String visitLike(Predicate.Like node, QueryParameters parameters) {
        String name = parameters.bind(node.getParameter(), FieldType.STRING, node.getPattern());
        return column(node) + (node.isNegated() ? " NOT LIKE " : " LIKE ") + placeholder(name, FieldType.STRING);
    }

    @Override
    public String visitInList(Predicate.InList node, QueryParameters parameters) {
        String name = parameters.bind(node.getParameter(), FieldType.ARRAY_STRING, node.getValues());
        return column(node) + (node.isNegated() ? " NOT IN " : " IN ") + placeholder(name, FieldType.ARRAY_STRING);
    }

    @Override
    public String visitIsNull(Predicate.IsNull node, QueryParameters parameters) {
        return column(node) + (node.isNegated() ? " IS NOT NULL" : " IS NULL");
    }
}
