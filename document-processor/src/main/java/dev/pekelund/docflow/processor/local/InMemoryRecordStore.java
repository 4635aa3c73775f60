package dev.pekelund.docflow.processor.local;

import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.error.RecordConflictException;
import dev.pekelund.docflow.records.RecordStore;
import dev.pekelund.docflow.records.TableName;
import dev.pekelund.docflow.records.TableRow;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Positional record store kept in memory. Rows live in lists in table order, so every mutation first resolves
 * the record id to its current index.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, Map<TableName, List<StoredRow>>> tenants = new HashMap<>();

    @Override
    public synchronized void createTable(String tenantId, TableName table) {
        tenants.computeIfAbsent(tenantId, ignored -> new HashMap<>()).putIfAbsent(table, new ArrayList<>());
    }

    @Override
    public synchronized void dropTable(String tenantId, TableName table) {
        Map<TableName, List<StoredRow>> tables = tenants.get(tenantId);
        if (tables != null) {
            tables.remove(table);
        }
    }

    @Override
    public synchronized boolean tableExists(String tenantId, TableName table) {
        Map<TableName, List<StoredRow>> tables = tenants.get(tenantId);
        return tables != null && tables.containsKey(table);
    }

    @Override
    public synchronized List<TableRow> readAll(String tenantId, TableName table) {
        List<StoredRow> rows = rowsOrEmpty(tenantId, table);
        List<TableRow> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            StoredRow row = rows.get(i);
            result.add(new TableRow(row.recordId, i + 1, row.cells));
        }
        return result;
    }

    @Override
    public synchronized TableRow append(String tenantId, TableName table, Map<String, String> cells) {
        List<StoredRow> rows = rows(tenantId, table);
        StoredRow row = new StoredRow(UUID.randomUUID().toString(), new LinkedHashMap<>(cells));
        rows.add(row);
        return new TableRow(row.recordId, rows.size(), row.cells);
    }

    @Override
    public synchronized void update(String tenantId, TableName table, String recordId, Map<String, String> cells) {
        List<StoredRow> rows = rows(tenantId, table);
        int index = indexOf(rows, recordId);
        if (index < 0) {
            throw new RecordConflictException(recordId, "Record " + recordId + " no longer exists in " + table);
        }
        rows.get(index).cells.putAll(cells);
    }

    @Override
    public synchronized void delete(String tenantId, TableName table, String recordId) {
        List<StoredRow> rows = rowsOrEmpty(tenantId, table);
        int index = indexOf(rows, recordId);
        if (index >= 0) {
            rows.remove(index);
        }
    }

    private List<StoredRow> rows(String tenantId, TableName table) {
        Map<TableName, List<StoredRow>> tables = tenants.get(tenantId);
        List<StoredRow> rows = tables != null ? tables.get(table) : null;
        if (rows == null) {
            throw new DocumentFlowException(ErrorCode.SYSTEM_ERROR,
                "Table " + table + " does not exist for tenant " + tenantId);
        }
        return rows;
    }

    private List<StoredRow> rowsOrEmpty(String tenantId, TableName table) {
        Map<TableName, List<StoredRow>> tables = tenants.get(tenantId);
        List<StoredRow> rows = tables != null ? tables.get(table) : null;
        return rows != null ? rows : new ArrayList<>();
    }

    private static int indexOf(List<StoredRow> rows, String recordId) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).recordId.equals(recordId)) {
                return i;
            }
        }
        return -1;
    }

    private static final class StoredRow {

        private final String recordId;
        private final Map<String, String> cells;

        private StoredRow(String recordId, Map<String, String> cells) {
            this.recordId = recordId;
            this.cells = cells;
        }
    }
}
