package com.e2eq.relations.model;

import com.e2eq.relations.naming.NamingConventions;
import lombok.Builder;

/**
 * Descriptor of a record-kind: records sharing a table and schema.
 *
 * <p>Descriptors are created once at startup and live for the process lifetime. They are compared
 * by identity, each instance owns its own relation graph in the mapping store. A kind declares its
 * relations either by overriding {@link #declareRelations(RelationDeclarations)}:</p>
 * <pre>{@code
 * public class PersonKind extends RecordKind {
 *     public PersonKind() { super("Person"); }
 *
 *     @Override
 *     public void declareRelations(RelationDeclarations relations) {
 *         relations.hasMany("Pet");
 *         relations.belongsTo("Household");
 *     }
 * }
 * }</pre>
 * or by supplying a {@link RelationDeclarer} to the builder.
 *
 * <p>A subclass of another kind is a separate kind. Its convention defaults are derived from its
 * own name, parent relations are reused only through
 * {@link RelationDeclarations#inheritFrom(RecordKind)}.</p>
 */
public class RecordKind {
    public static final String DEFAULT_ID_COLUMN = "id";

    private final String name;
    private final String idColumn;
    private final boolean timestampsEnabled;
    private final Class<?> recordType;
    private final RelationDeclarer relations;

    private volatile String tableName;
    private volatile boolean tableNameResolved;

    public RecordKind(String name) {
        this(name, null, null, null, null, null);
    }

    public RecordKind(String name, RelationDeclarer relations) {
        this(name, null, null, null, null, relations);
    }

    /**
     * @param name record-kind name, required
     * @param tableName explicit table, defaults to the name
     * @param idColumn primary key column, defaults to {@value #DEFAULT_ID_COLUMN}
     * @param timestampsEnabled whether writes are touched, defaults to true
     * @param recordType java type of the records, may be null
     * @param relations relation declarations, may be null
     */
    @Builder
    protected RecordKind(String name, String tableName, String idColumn, Boolean timestampsEnabled,
                         Class<?> recordType, RelationDeclarer relations) {
        this.name = NamingConventions.requireValidName("record-kind", name);
        this.idColumn = idColumn == null ? DEFAULT_ID_COLUMN : NamingConventions.requireValidName("id column", idColumn);
        this.timestampsEnabled = timestampsEnabled == null || timestampsEnabled;
        this.recordType = recordType;
        this.relations = relations;
        if (tableName != null) {
            this.tableName = NamingConventions.requireValidName("table", tableName);
        }
    }

    public String getName() {
        return name;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public boolean isTimestampsEnabled() {
        return timestampsEnabled;
    }

    public Class<?> getRecordType() {
        return recordType;
    }

    /**
     * The table of this kind, resolved on first read and stable afterwards.
     */
    public String getTableName() {
        String t = tableName;
        if (t == null || !tableNameResolved) {
            synchronized (this) {
                if (tableName == null) {
                    tableName = NamingConventions.tableNameOf(name);
                }
                tableNameResolved = true;
                t = tableName;
            }
        }
        return t;
    }

    /**
     * Overrides the table name. Must happen before the table name is first read.
     *
     * @throws IllegalStateException if a different table name was already resolved
     */
    public synchronized void setTableName(String tableName) {
        NamingConventions.requireValidName("table", tableName);
        if (tableNameResolved && !tableName.equals(this.tableName)) {
            throw new IllegalStateException("Table name of record-kind " + name + " already resolved as "
                    + this.tableName + ", can not change it to " + tableName);
        }
        this.tableName = tableName;
    }

    /**
     * Hook invoked once by the mapping store the first time this kind's relation graph is requested.
     * The default delegates to the {@link RelationDeclarer} given at construction, if any.
     */
    public void declareRelations(RelationDeclarations relations) {
        if (this.relations != null) {
            this.relations.declare(relations);
        }
    }

    @Override
    public String toString() {
        return "RecordKind[" + name + "]";
    }
}
