package dev.pekelund.docflow.records;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tabular CRUD contract over a tenant's tables. Mutations are addressed by stable record id; implementations
 * that address rows positionally resolve the id to a position immediately before each mutating call.
 */
public interface RecordStore {

    void createTable(String tenantId, TableName table);

    void dropTable(String tenantId, TableName table);

    boolean tableExists(String tenantId, TableName table);

    /**
     * @return all rows in table order
     */
    List<TableRow> readAll(String tenantId, TableName table);

    /**
     * Looks a single row up by record id. Stores that can address a row directly override the table scan.
     */
    default Optional<TableRow> find(String tenantId, TableName table, String recordId) {
        return readAll(tenantId, table).stream().filter(row -> row.recordId().equals(recordId)).findFirst();
    }

    /**
     * @return rows whose cell under {@code header} equals {@code value}, in table order
     */
    default List<TableRow> findByCell(String tenantId, TableName table, String header, String value) {
        return readAll(tenantId, table).stream().filter(row -> value.equals(row.get(header))).toList();
    }

    default int count(String tenantId, TableName table) {
        return readAll(tenantId, table).size();
    }

    /**
     * Appends a row at the end of the table and returns it with its generated record id.
     */
    TableRow append(String tenantId, TableName table, Map<String, String> cells);

    /**
     * Overwrites the given cells of an existing row, leaving other cells untouched.
     *
     * @throws dev.pekelund.docflow.error.RecordConflictException when no row with the id exists
     */
    void update(String tenantId, TableName table, String recordId, Map<String, String> cells);

    /**
     * Deletes the row with the given id. Deleting a row that no longer exists is not an error.
     */
    void delete(String tenantId, TableName table, String recordId);
}
