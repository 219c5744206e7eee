package io.kiln.core.expander;

import io.kiln.core.function.FunctionDefinition;
import io.kiln.core.modifier.InvalidModifierException;
import io.kiln.core.modifier.NodeExpander;
import io.kiln.core.node.InputType;
import io.kiln.core.node.Node;
import io.kiln.core.node.NodeCallable;
import io.kiln.core.table.Series;
import io.kiln.core.table.Table;
import io.kiln.core.validation.FunctionValidators;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Exposes columns of a table-producing node as nodes of their own.
///
/// Emits the incoming node, followed by one {@link Series} node per requested
/// column. Each column node depends only on the table node.
///
/// Columns are given as distinct arguments, each a bare name or an
/// {@link OutputSpec} carrying its own documentation:
/// {@snippet :
/// ExtractColumns.of("price", OutputSpec.of("volume", "Units traded")).fillWith(0);
/// }
///
/// Whether a column exists is only known when the graph runs. With a fill
/// value, the table node's output is replaced by a copy carrying every missing
/// requested column, so consumers of the whole table see the same columns as
/// the column nodes. Without one, the incoming node is emitted unchanged and a
/// column node fails with {@link MissingOutputException} when invoked.
public final class ExtractColumns implements NodeExpander {

    private static final Logger logger = Logger.getLogger(ExtractColumns.class.getName());

    private final List<ColumnRef> columns;
    private final Object fillWith;

    private ExtractColumns(List<ColumnRef> columns, Object fillWith) {
        this.columns = columns;
        this.fillWith = fillWith;
    }

    /// @param columns column names or {@link OutputSpec}s, at least one
    /// @return new extractor without a fill value, never null
    /// @throws InvalidModifierException if no column is given, or a collection is
    ///         passed where distinct arguments are expected
    public static ExtractColumns of(Object... columns) {
        if (columns == null || columns.length == 0) {
            throw new InvalidModifierException("extract_columns needs at least one column");
        }
        List<ColumnRef> refs = new ArrayList<>(columns.length);
        for (Object column : columns) {
            if (column instanceof Collection<?> || (column != null && column.getClass().isArray())) {
                throw new InvalidModifierException(
                        "extract_columns takes columns as distinct arguments, not a collection: "
                                + column);
            }
            if (column instanceof String name && !name.isBlank()) {
                refs.add(new ColumnRef(name, null));
            } else if (column instanceof OutputSpec spec) {
                refs.add(new ColumnRef(spec.name(), spec.documentation()));
            } else {
                throw new InvalidModifierException(
                        "extract_columns column must be a name or (name, documentation) pair: "
                                + column);
            }
        }
        return new ExtractColumns(List.copyOf(refs), null);
    }

    /// Returns a copy that synthesizes missing columns from `value`.
    ///
    /// @param value the fill value; null means no fill
    /// @return new extractor, never null
    public ExtractColumns fillWith(Object value) {
        return new ExtractColumns(columns, value);
    }

    public Optional<Object> getFillWith() {
        return Optional.ofNullable(fillWith);
    }

    @Override
    public void validate(FunctionDefinition fn) {
        FunctionValidators.ensureReturnType(fn, Table.class, "extract_columns");
    }

    @Override
    public List<Node> expandNode(Node node, Map<String, Object> config, FunctionDefinition fn) {
        List<Node> nodes = new ArrayList<>(columns.size() + 1);
        nodes.add(fillWith == null ? node : node.toBuilder().callable(backfilling(node)).build());
        String source = node.getName();
        for (ColumnRef column : columns) {
            nodes.add(
                    Node.builder()
                            .name(column.name())
                            .type(Series.class)
                            .documentation(
                                    column.documentation() != null
                                            ? column.documentation()
                                            : node.getDocumentation())
                            .input(source, InputType.required(node.getType()))
                            .tags(node.getTags())
                            .callable(kwargs -> extract(sourceTable(kwargs, source), column.name()).value())
                            .build());
        }
        logger.fine(() -> "Extracted " + columns.size() + " column node(s) from '" + source + "'");
        return nodes;
    }

    @Override
    public boolean derivesOutputs() {
        return true;
    }

    /// Returns the table with every missing requested column synthesized from
    /// the fill value.
    ///
    /// @param table the upstream table, not null
    /// @return `table` itself if nothing is missing, an updated copy otherwise
    /// @throws MissingOutputException if a column is absent and there is no fill value
    public Table backfill(Table table) {
        Table current = table;
        for (ColumnRef column : columns) {
            current = extract(current, column.name()).source();
        }
        return current;
    }

    /// Extracts one column, synthesizing it from the fill value when absent.
    ///
    /// The input table is never modified: a synthesized column is carried by
    /// an updated copy in {@link Extraction#source()}.
    ///
    /// @param table the upstream table, not null
    /// @param column the column to extract, not null
    /// @return the column and the table as seen after extraction, never null
    /// @throws MissingOutputException if the column is absent and there is no fill value
    public Extraction<Series, Table> extract(Table table, String column) {
        Optional<Series> present = table.column(column);
        if (present.isPresent()) {
            return new Extraction<>(present.get(), table, false);
        }
        if (fillWith == null) {
            throw new MissingOutputException(
                    "No such column: " + column + " (available: " + table.columnNames() + ")");
        }
        Series filled = Series.filled(fillWith, table.rowCount());
        return new Extraction<>(filled, table.withColumn(column, filled), true);
    }

    private NodeCallable backfilling(Node node) {
        NodeCallable callable = node.getCallable();
        return kwargs -> {
            Object output = callable.call(kwargs);
            return output instanceof Table table ? backfill(table) : output;
        };
    }

    private static Table sourceTable(Map<String, Object> kwargs, String source) {
        Object value = kwargs.get(source);
        if (value instanceof Table table) {
            return table;
        }
        throw new IllegalArgumentException(
                "Expected a Table for input '" + source + "', found "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    private record ColumnRef(String name, String documentation) {}
}
