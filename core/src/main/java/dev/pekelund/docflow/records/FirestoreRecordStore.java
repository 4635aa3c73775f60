package dev.pekelund.docflow.records;

import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.AggregateQuerySnapshot;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldPath;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.SetOptions;
import com.google.cloud.firestore.WriteBatch;
import dev.pekelund.docflow.error.DocumentFlowException;
import dev.pekelund.docflow.error.ErrorCode;
import dev.pekelund.docflow.error.RecordConflictException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Firestore backed record store. Each tenant owns a document under the root collection; every table is a
 * sub-collection of row documents ({@code position}, {@code cells}) plus a metadata document under
 * {@code tables/<table>} holding the header list and the next position counter.
 */
public class FirestoreRecordStore implements RecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreRecordStore.class);

    static final String FIELD_POSITION = "position";
    static final String FIELD_CELLS = "cells";
    static final String FIELD_UPDATED_AT = "updatedAt";
    static final String FIELD_HEADERS = "headers";
    static final String FIELD_NEXT_POSITION = "nextPosition";
    private static final String TABLES_COLLECTION = "tables";
    private static final int MAX_BATCH_SIZE = 400;

    private final Firestore firestore;
    private final String rootCollection;

    public FirestoreRecordStore(Firestore firestore, String rootCollection) {
        Assert.notNull(firestore, "firestore must not be null");
        Assert.isTrue(StringUtils.hasText(rootCollection), "rootCollection must not be empty");
        this.firestore = firestore;
        this.rootCollection = rootCollection;
    }

    @Override
    public void createTable(String tenantId, TableName table) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(FIELD_HEADERS, table.headers());
        metadata.put(FIELD_NEXT_POSITION, 0L);
        metadata.put(FIELD_UPDATED_AT, FieldValue.serverTimestamp());
        await(metadata(tenantId, table).set(metadata), "create table " + describe(tenantId, table));
        LOGGER.info("Created table {} with {} headers", describe(tenantId, table), table.headers().size());
    }

    @Override
    public void dropTable(String tenantId, TableName table) {
        QuerySnapshot snapshot = await(rows(tenantId, table).get(), "list rows of " + describe(tenantId, table));
        List<QueryDocumentSnapshot> documents = snapshot.getDocuments();
        for (int start = 0; start < documents.size(); start += MAX_BATCH_SIZE) {
            WriteBatch batch = firestore.batch();
            for (QueryDocumentSnapshot document : documents.subList(start,
                Math.min(start + MAX_BATCH_SIZE, documents.size()))) {
                batch.delete(document.getReference());
            }
            await(batch.commit(), "delete rows of " + describe(tenantId, table));
        }
        await(metadata(tenantId, table).delete(), "drop table " + describe(tenantId, table));
        LOGGER.info("Dropped table {} ({} rows)", describe(tenantId, table), documents.size());
    }

    @Override
    public boolean tableExists(String tenantId, TableName table) {
        return await(metadata(tenantId, table).get(), "read table " + describe(tenantId, table)).exists();
    }

    @Override
    public List<TableRow> readAll(String tenantId, TableName table) {
        QuerySnapshot snapshot = await(rows(tenantId, table).orderBy(FIELD_POSITION).get(),
            "read " + describe(tenantId, table));
        List<TableRow> result = new ArrayList<>();
        int position = 1;
        for (QueryDocumentSnapshot document : snapshot.getDocuments()) {
            result.add(new TableRow(document.getId(), position++, toCells(document.get(FIELD_CELLS))));
        }
        return result;
    }

    /**
     * Reads the row document directly. The position reported is the row's append counter, not its rank in the
     * current table order.
     */
    @Override
    public Optional<TableRow> find(String tenantId, TableName table, String recordId) {
        DocumentSnapshot snapshot = await(rows(tenantId, table).document(recordId).get(), "read record " + recordId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(toRow(snapshot));
    }

    @Override
    public List<TableRow> findByCell(String tenantId, TableName table, String header, String value) {
        QuerySnapshot snapshot = await(rows(tenantId, table).whereEqualTo(FieldPath.of(FIELD_CELLS, header), value)
            .get(), "query " + describe(tenantId, table) + " by " + header);
        return snapshot.getDocuments().stream()
            .map(FirestoreRecordStore::toRow)
            .sorted(Comparator.comparingInt(TableRow::position))
            .toList();
    }

    @Override
    public int count(String tenantId, TableName table) {
        AggregateQuerySnapshot snapshot = await(rows(tenantId, table).count().get(),
            "count " + describe(tenantId, table));
        return Math.toIntExact(snapshot.getCount());
    }

    @Override
    public TableRow append(String tenantId, TableName table, Map<String, String> cells) {
        DocumentReference metadata = metadata(tenantId, table);
        CollectionReference rows = rows(tenantId, table);
        String recordId = UUID.randomUUID().toString();
        Map<String, String> values = new LinkedHashMap<>(cells);
        long position = await(firestore.runTransaction(transaction -> {
            DocumentSnapshot tableSnapshot = transaction.get(metadata).get();
            if (!tableSnapshot.exists()) {
                throw new DocumentFlowException(ErrorCode.SYSTEM_ERROR,
                    "Table " + describe(tenantId, table) + " does not exist");
            }
            Long next = tableSnapshot.getLong(FIELD_NEXT_POSITION);
            long assigned = next != null ? next : 0L;
            transaction.update(metadata, FIELD_NEXT_POSITION, assigned + 1);
            Map<String, Object> row = new HashMap<>();
            row.put(FIELD_POSITION, assigned);
            row.put(FIELD_CELLS, values);
            row.put(FIELD_UPDATED_AT, FieldValue.serverTimestamp());
            transaction.set(rows.document(recordId), row);
            return assigned;
        }), "append to " + describe(tenantId, table));
        LOGGER.debug("Appended record {} to {} at position {}", recordId, describe(tenantId, table), position);
        return new TableRow(recordId, (int) position + 1, values);
    }

    @Override
    public void update(String tenantId, TableName table, String recordId, Map<String, String> cells) {
        DocumentReference document = rows(tenantId, table).document(recordId);
        DocumentSnapshot snapshot = await(document.get(), "read record " + recordId);
        if (!snapshot.exists()) {
            throw new RecordConflictException(recordId,
                "Record " + recordId + " no longer exists in " + describe(tenantId, table));
        }
        Map<String, Object> update = new HashMap<>();
        update.put(FIELD_CELLS, new LinkedHashMap<>(cells));
        update.put(FIELD_UPDATED_AT, FieldValue.serverTimestamp());
        await(document.set(update, SetOptions.merge()), "update record " + recordId);
    }

    @Override
    public void delete(String tenantId, TableName table, String recordId) {
        await(rows(tenantId, table).document(recordId).delete(), "delete record " + recordId);
    }

    private static TableRow toRow(DocumentSnapshot snapshot) {
        Long position = snapshot.getLong(FIELD_POSITION);
        return new TableRow(snapshot.getId(), position != null ? Math.toIntExact(position) + 1 : 0,
            toCells(snapshot.get(FIELD_CELLS)));
    }

    static Map<String, String> toCells(Object raw) {
        Map<String, String> cells = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                if (key != null) {
                    cells.put(key.toString(), value != null ? value.toString() : "");
                }
            });
        }
        return cells;
    }

    private CollectionReference rows(String tenantId, TableName table) {
        return firestore.collection(rootCollection).document(tenantId).collection(table.collectionName());
    }

    private DocumentReference metadata(String tenantId, TableName table) {
        return firestore.collection(rootCollection).document(tenantId).collection(TABLES_COLLECTION)
            .document(table.collectionName());
    }

    private String describe(String tenantId, TableName table) {
        return rootCollection + "/" + tenantId + "/" + table.collectionName();
    }

    private <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw DocumentFlowException.systemError("Interrupted during Firestore call: " + action, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof DocumentFlowException flowException) {
                throw flowException;
            }
            LOGGER.error("Firestore call failed: {}", action, ex);
            throw DocumentFlowException.systemError("Firestore call failed: " + action, ex);
        }
    }
}
