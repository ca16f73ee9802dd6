package com.geico.poc.streamcatalog.sql;

import com.geico.poc.streamcatalog.catalog.ColumnMetadata;
import com.geico.poc.streamcatalog.catalog.SchemaScopedObject;
import com.geico.poc.streamcatalog.catalog.SinkMetadata;
import com.geico.poc.streamcatalog.catalog.SourceMetadata;
import com.geico.poc.streamcatalog.catalog.TableMetadata;
import com.geico.poc.streamcatalog.catalog.ViewMetadata;
import com.geico.poc.streamcatalog.error.InvalidDefinitionException;
import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlWith;
import org.apache.calcite.sql.SqlWithItem;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.validate.SqlConformanceEnum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses a view query with Calcite and works out which relations it reads and how many
 * columns it returns.
 *
 * This is not a validator: column references are not checked and expression types are only
 * guessed for literals, casts and plain column references. {@code SELECT *} and
 * {@code t.*} expand to the visible columns of the relations in scope.
 */
@Component
public class ViewQueryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ViewQueryAnalyzer.class);

    public static final String ANONYMOUS_COLUMN = "?column?";
    public static final String UNKNOWN_TYPE = "unknown";

    private static final SqlParser.Config PARSER_CONFIG = SqlParser.config()
            .withCaseSensitive(false)
            .withUnquotedCasing(Casing.TO_LOWER)
            .withQuotedCasing(Casing.UNCHANGED)
            .withConformance(SqlConformanceEnum.LENIENT);

    public ViewAnalysis analyze(String sql, RelationResolver resolver) {
        SqlNode query;
        try {
            query = SqlParser.create(sql, PARSER_CONFIG).parseQuery();
        } catch (SqlParseException e) {
            throw new InvalidDefinitionException("Failed to parse view query: " + e.getMessage(), e);
        }
        Analysis analysis = new Analysis(resolver);
        List<ViewMetadata.Field> columns = analysis.query(query, Collections.<String, List<ViewMetadata.Field>>emptyMap());
        ViewAnalysis result = new ViewAnalysis(new ArrayList<>(analysis.dependencies), columns);
        log.debug("Analyzed view query [{}]: {}", sql, result);
        return result;
    }

    /**
     * Columns a relation exposes to queries. Hidden columns are not selectable.
     */
    public static List<ViewMetadata.Field> visibleColumns(SchemaScopedObject relation) {
        if (relation instanceof ViewMetadata) {
            return ((ViewMetadata) relation).getColumns();
        }
        List<ColumnMetadata> columns;
        if (relation instanceof TableMetadata) {
            columns = ((TableMetadata) relation).getColumns();
        } else if (relation instanceof SourceMetadata) {
            columns = ((SourceMetadata) relation).getColumns();
        } else if (relation instanceof SinkMetadata) {
            columns = ((SinkMetadata) relation).getColumns();
        } else {
            throw new InvalidDefinitionException(relation.kind().name().toLowerCase(Locale.ROOT)
                    + " \"" + relation.getName() + "\" cannot be queried");
        }
        List<ViewMetadata.Field> fields = new ArrayList<>();
        for (ColumnMetadata column : columns) {
            if (!column.isHidden()) {
                fields.add(new ViewMetadata.Field(column.getName(), column.getDataType()));
            }
        }
        return fields;
    }

    /**
     * State of one analysis run.
     */
    private static class Analysis {
        private final RelationResolver resolver;
        private final Set<Long> dependencies = new LinkedHashSet<>();

        Analysis(RelationResolver resolver) {
            this.resolver = resolver;
        }

        List<ViewMetadata.Field> query(SqlNode node, Map<String, List<ViewMetadata.Field>> ctes) {
            if (node instanceof SqlOrderBy) {
                SqlOrderBy orderBy = (SqlOrderBy) node;
                expressions(orderBy.orderList, ctes);
                return query(orderBy.query, ctes);
            }
            if (node instanceof SqlWith) {
                SqlWith with = (SqlWith) node;
                Map<String, List<ViewMetadata.Field>> scoped = new HashMap<>(ctes);
                for (SqlNode item : with.withList) {
                    SqlWithItem withItem = (SqlWithItem) item;
                    List<ViewMetadata.Field> columns = query(withItem.query, scoped);
                    scoped.put(withItem.name.getSimple(), rename(columns, withItem.columnList));
                }
                return query(with.body, scoped);
            }
            if (node instanceof SqlSelect) {
                return select((SqlSelect) node, ctes);
            }
            if (node.isA(SqlKind.SET_QUERY)) {
                SqlCall setOp = (SqlCall) node;
                List<ViewMetadata.Field> first = query(setOp.operand(0), ctes);
                for (int i = 1; i < setOp.operandCount(); i++) {
                    List<ViewMetadata.Field> other = query(setOp.operand(i), ctes);
                    if (other.size() != first.size()) {
                        throw new InvalidDefinitionException("Each " + node.getKind()
                                + " query must have the same number of columns: " + first.size() + " vs " + other.size());
                    }
                }
                return first;
            }
            if (node.getKind() == SqlKind.VALUES) {
                return values((SqlCall) node, ctes);
            }
            throw new InvalidDefinitionException("Unsupported view query of kind " + node.getKind());
        }

        private List<ViewMetadata.Field> select(SqlSelect select, Map<String, List<ViewMetadata.Field>> ctes) {
            Map<String, List<ViewMetadata.Field>> scope = new LinkedHashMap<>();
            if (select.getFrom() != null) {
                fromItem(select.getFrom(), scope, ctes);
            }

            List<ViewMetadata.Field> output = new ArrayList<>();
            for (SqlNode item : select.getSelectList()) {
                if (item instanceof SqlIdentifier && ((SqlIdentifier) item).isStar()) {
                    output.addAll(expandStar((SqlIdentifier) item, scope));
                    continue;
                }
                expressions(item, ctes);
                output.add(new ViewMetadata.Field(outputName(item), inferType(item, scope)));
            }

            expressions(select.getWhere(), ctes);
            expressions(select.getGroup(), ctes);
            expressions(select.getHaving(), ctes);
            return output;
        }

        private void fromItem(SqlNode node, Map<String, List<ViewMetadata.Field>> scope,
                              Map<String, List<ViewMetadata.Field>> ctes) {
            if (node instanceof SqlJoin) {
                SqlJoin join = (SqlJoin) node;
                fromItem(join.getLeft(), scope, ctes);
                fromItem(join.getRight(), scope, ctes);
                expressions(join.getCondition(), ctes);
                return;
            }
            if (node.getKind() == SqlKind.AS) {
                SqlCall as = (SqlCall) node;
                List<ViewMetadata.Field> columns = relationColumns(as.operand(0), ctes);
                if (as.operandCount() > 2) {
                    List<SqlNode> aliases = as.getOperandList().subList(2, as.operandCount());
                    columns = rename(columns, new SqlNodeList(aliases, as.getParserPosition()));
                }
                scope.put(((SqlIdentifier) as.operand(1)).getSimple(), columns);
                return;
            }
            List<ViewMetadata.Field> columns = relationColumns(node, ctes);
            String key = node instanceof SqlIdentifier ? lastName((SqlIdentifier) node) : "$" + scope.size();
            scope.put(key, columns);
        }

        private List<ViewMetadata.Field> relationColumns(SqlNode node, Map<String, List<ViewMetadata.Field>> ctes) {
            if (node instanceof SqlIdentifier) {
                SqlIdentifier identifier = (SqlIdentifier) node;
                if (identifier.isSimple() && ctes.containsKey(identifier.getSimple())) {
                    return ctes.get(identifier.getSimple());
                }
                SchemaScopedObject relation = resolver.resolve(identifier.names);
                dependencies.add(relation.getId());
                return visibleColumns(relation);
            }
            if (node.getKind() == SqlKind.LATERAL) {
                return relationColumns(((SqlCall) node).operand(0), ctes);
            }
            return query(node, ctes);
        }

        private List<ViewMetadata.Field> values(SqlCall values, Map<String, List<ViewMetadata.Field>> ctes) {
            List<ViewMetadata.Field> output = null;
            for (SqlNode row : values.getOperandList()) {
                List<SqlNode> items = row instanceof SqlCall && row.getKind() == SqlKind.ROW
                        ? ((SqlCall) row).getOperandList()
                        : Collections.singletonList(row);
                if (output == null) {
                    output = new ArrayList<>();
                    for (int i = 0; i < items.size(); i++) {
                        output.add(new ViewMetadata.Field("column" + (i + 1),
                                inferType(items.get(i), Collections.<String, List<ViewMetadata.Field>>emptyMap())));
                    }
                } else if (items.size() != output.size()) {
                    throw new InvalidDefinitionException("VALUES lists must all be the same length");
                }
                for (SqlNode item : items) {
                    expressions(item, ctes);
                }
            }
            return output != null ? output : new ArrayList<ViewMetadata.Field>();
        }

        // Walks expressions only to find subqueries
        private void expressions(SqlNode node, Map<String, List<ViewMetadata.Field>> ctes) {
            if (node == null) {
                return;
            }
            if (node instanceof SqlSelect || node instanceof SqlOrderBy || node instanceof SqlWith
                    || node.isA(SqlKind.SET_QUERY)) {
                query(node, ctes);
                return;
            }
            if (node instanceof SqlNodeList) {
                for (SqlNode child : (SqlNodeList) node) {
                    expressions(child, ctes);
                }
                return;
            }
            if (node instanceof SqlCall) {
                for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                    expressions(operand, ctes);
                }
            }
        }

        private List<ViewMetadata.Field> expandStar(SqlIdentifier star, Map<String, List<ViewMetadata.Field>> scope) {
            if (star.names.size() == 1) {
                if (scope.isEmpty()) {
                    throw new InvalidDefinitionException("SELECT * with no tables specified is not valid");
                }
                List<ViewMetadata.Field> all = new ArrayList<>();
                for (List<ViewMetadata.Field> columns : scope.values()) {
                    all.addAll(columns);
                }
                return all;
            }
            String qualifier = star.names.get(star.names.size() - 2);
            List<ViewMetadata.Field> columns = scope.get(qualifier);
            if (columns == null) {
                throw new InvalidDefinitionException("Missing FROM-clause entry for \"" + qualifier + "\"");
            }
            return columns;
        }
    }

    private static List<ViewMetadata.Field> rename(List<ViewMetadata.Field> columns, SqlNodeList names) {
        if (names == null || names.size() == 0) {
            return columns;
        }
        if (names.size() > columns.size()) {
            throw new InvalidDefinitionException("Too many column aliases: " + names.size()
                    + " given for " + columns.size() + " columns");
        }
        List<ViewMetadata.Field> renamed = new ArrayList<>(columns);
        for (int i = 0; i < names.size(); i++) {
            String name = ((SqlIdentifier) names.get(i)).getSimple();
            renamed.set(i, new ViewMetadata.Field(name, columns.get(i).getDataType()));
        }
        return renamed;
    }

    private static String outputName(SqlNode item) {
        if (item.getKind() == SqlKind.AS) {
            return ((SqlIdentifier) ((SqlCall) item).operand(1)).getSimple();
        }
        if (item instanceof SqlIdentifier) {
            return lastName((SqlIdentifier) item);
        }
        return ANONYMOUS_COLUMN;
    }

    private static String inferType(SqlNode item, Map<String, List<ViewMetadata.Field>> scope) {
        if (item.getKind() == SqlKind.AS) {
            return inferType(((SqlCall) item).operand(0), scope);
        }
        if (item instanceof SqlNumericLiteral) {
            return ((SqlNumericLiteral) item).isInteger() ? "integer" : "numeric";
        }
        if (item instanceof SqlLiteral) {
            switch (((SqlLiteral) item).getTypeName()) {
                case CHAR:
                    return "varchar";
                case BOOLEAN:
                    return "boolean";
                default:
                    return UNKNOWN_TYPE;
            }
        }
        if (item.getKind() == SqlKind.CAST && item instanceof SqlBasicCall) {
            return ((SqlBasicCall) item).operand(1).toString().toLowerCase(Locale.ROOT);
        }
        if (item instanceof SqlIdentifier) {
            SqlIdentifier identifier = (SqlIdentifier) item;
            String column = lastName(identifier);
            if (identifier.names.size() >= 2) {
                return findType(scope.get(identifier.names.get(identifier.names.size() - 2)), column);
            }
            for (List<ViewMetadata.Field> columns : scope.values()) {
                String type = findType(columns, column);
                if (!UNKNOWN_TYPE.equals(type)) {
                    return type;
                }
            }
        }
        return UNKNOWN_TYPE;
    }

    private static String findType(List<ViewMetadata.Field> columns, String name) {
        if (columns != null) {
            for (ViewMetadata.Field field : columns) {
                if (field.getName().equalsIgnoreCase(name)) {
                    return field.getDataType();
                }
            }
        }
        return UNKNOWN_TYPE;
    }

    private static String lastName(SqlIdentifier identifier) {
        return identifier.names.get(identifier.names.size() - 1);
    }
}
