package com.telcobright.partman.db.repository;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import com.telcobright.partman.core.enums.FailureAction;
import com.telcobright.partman.core.enums.FailureStatus;
import com.telcobright.partman.core.exception.FailureStoreException;
import com.telcobright.partman.db.entity.PartitionFailure;
import org.bson.BsonType;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link PartitionFailureRepository} over the MongoDB collection {@code partition_failures}.
 * Resolved records expire through a TTL index on {@code resolvedAt}.
 */
public class MongoPartitionFailureRepository implements PartitionFailureRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoPartitionFailureRepository.class);

    public static final String COLLECTION_NAME = "partition_failures";
    public static final long RESOLVED_TTL_DAYS = 90;

    private final MongoCollection<Document> collection;
    private final Clock clock;

    public MongoPartitionFailureRepository(MongoDatabase database) {
        this(database, Clock.systemUTC());
    }

    public MongoPartitionFailureRepository(MongoDatabase database, Clock clock) {
        this.collection = database.getCollection(COLLECTION_NAME);
        this.clock = clock;
    }

    @Override
    public void ensureIndexes() throws FailureStoreException {
        try {
            collection.createIndex(Indexes.ascending("tableName", "partitionName"),
                new IndexOptions().unique(true).name("uk_table_partition"));
            collection.createIndex(Indexes.ascending("status", "lastRetryAt"),
                new IndexOptions().name("idx_status_last_retry"));
            collection.createIndex(Indexes.ascending("partitionDate"),
                new IndexOptions().name("idx_partition_date"));
            collection.createIndex(Indexes.ascending("tableName"),
                new IndexOptions().name("idx_table_name"));
            collection.createIndex(Indexes.ascending("resolvedAt"),
                new IndexOptions()
                    .name("ttl_resolved_at")
                    .expireAfter(RESOLVED_TTL_DAYS, TimeUnit.DAYS)
                    .partialFilterExpression(Filters.type("resolvedAt", BsonType.DATE_TIME)));
            logger.info("Indexes ensured on {}", COLLECTION_NAME);
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to create indexes on " + COLLECTION_NAME, e);
        }
    }

    @Override
    public Optional<PartitionFailure> findById(String id) throws FailureStoreException {
        if (!ObjectId.isValid(id)) {
            return Optional.empty();
        }
        return findOne(Filters.eq("_id", new ObjectId(id)));
    }

    @Override
    public Optional<PartitionFailure> findByTableAndPartition(String tableName, String partitionName)
            throws FailureStoreException {
        return findOne(Filters.and(Filters.eq("tableName", tableName), Filters.eq("partitionName", partitionName)));
    }

    @Override
    public Optional<PartitionFailure> insertIfAbsent(PartitionFailure failure) throws FailureStoreException {
        Instant now = clock.instant();
        failure.setCreatedAt(now);
        failure.setUpdatedAt(now);
        Document document = toDocument(failure);
        try {
            collection.insertOne(document);
            failure.setId(document.getObjectId("_id").toHexString());
            return Optional.of(failure);
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                return Optional.empty();
            }
            throw new FailureStoreException("Failed to insert failure record " + failure, e);
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to insert failure record " + failure, e);
        }
    }

    @Override
    public PartitionFailure save(PartitionFailure failure) throws FailureStoreException {
        if (failure.getId() == null) {
            throw new IllegalArgumentException("Failure record has no id: " + failure);
        }
        failure.setUpdatedAt(clock.instant());
        try {
            collection.replaceOne(Filters.eq("_id", new ObjectId(failure.getId())), toDocument(failure));
            return failure;
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to save failure record " + failure, e);
        }
    }

    @Override
    public List<PartitionFailure> findByStatus(FailureStatus status) throws FailureStoreException {
        Bson filter = status != null ? Filters.eq("status", status.name()) : new Document();
        return findMany(filter);
    }

    @Override
    public List<PartitionFailure> findByTable(String tableName) throws FailureStoreException {
        return findMany(Filters.eq("tableName", tableName));
    }

    @Override
    public List<PartitionFailure> findRetryCandidates(Instant retriedBefore) throws FailureStoreException {
        Bson filter = Filters.and(
            Filters.in("status", FailureStatus.PENDING.name(), FailureStatus.RETRYING.name()),
            Filters.or(
                Filters.eq("lastRetryAt", null),
                Filters.lt("lastRetryAt", Date.from(retriedBefore))));
        return findMany(filter);
    }

    @Override
    public long countByStatus(FailureStatus status) throws FailureStoreException {
        try {
            return collection.countDocuments(Filters.eq("status", status.name()));
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to count failure records", e);
        }
    }

    @Override
    public long count() throws FailureStoreException {
        try {
            return collection.countDocuments();
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to count failure records", e);
        }
    }

    @Override
    public long deleteResolvedBefore(Instant cutoff) throws FailureStoreException {
        try {
            return collection.deleteMany(Filters.and(
                Filters.eq("status", FailureStatus.RESOLVED.name()),
                Filters.lt("resolvedAt", Date.from(cutoff)))).getDeletedCount();
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to purge resolved failure records", e);
        }
    }

    private Optional<PartitionFailure> findOne(Bson filter) throws FailureStoreException {
        try {
            Document document = collection.find(filter).first();
            return Optional.ofNullable(document).map(MongoPartitionFailureRepository::fromDocument);
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to read failure record", e);
        }
    }

    private List<PartitionFailure> findMany(Bson filter) throws FailureStoreException {
        List<PartitionFailure> failures = new ArrayList<>();
        try {
            for (Document document : collection.find(filter).sort(Sorts.descending("createdAt"))) {
                failures.add(fromDocument(document));
            }
        } catch (MongoException e) {
            throw new FailureStoreException("Failed to read failure records", e);
        }
        return failures;
    }

    static Document toDocument(PartitionFailure failure) {
        Document error = new Document()
            .append("message", failure.getErrorMessage())
            .append("code", failure.getErrorCode())
            .append("stack", failure.getErrorStack());

        Document document = new Document();
        if (failure.getId() != null) {
            document.append("_id", new ObjectId(failure.getId()));
        }
        return document
            .append("tableName", failure.getTableName())
            .append("partitionName", failure.getPartitionName())
            .append("partitionDate", toDate(failure.getPartitionDate()))
            .append("action", failure.getAction().name())
            .append("status", failure.getStatus().name())
            .append("retryCount", failure.getRetryCount())
            .append("maxRetry", failure.getMaxRetry())
            .append("error", error)
            .append("lastRetryAt", toDate(failure.getLastRetryAt()))
            .append("resolvedAt", toDate(failure.getResolvedAt()))
            .append("createdAt", toDate(failure.getCreatedAt()))
            .append("updatedAt", toDate(failure.getUpdatedAt()));
    }

    static PartitionFailure fromDocument(Document document) {
        PartitionFailure failure = new PartitionFailure();
        failure.setId(document.getObjectId("_id").toHexString());
        failure.setTableName(document.getString("tableName"));
        failure.setPartitionName(document.getString("partitionName"));
        Date partitionDate = document.getDate("partitionDate");
        failure.setPartitionDate(partitionDate != null
            ? LocalDate.ofInstant(partitionDate.toInstant(), ZoneOffset.UTC) : null);
        failure.setAction(FailureAction.valueOf(document.getString("action")));
        failure.setStatus(FailureStatus.valueOf(document.getString("status")));
        failure.setRetryCount(document.getInteger("retryCount", 0));
        failure.setMaxRetry(document.getInteger("maxRetry", failure.getAction().getDefaultMaxRetry()));
        Document error = document.get("error", Document.class);
        if (error != null) {
            failure.setErrorMessage(error.getString("message"));
            failure.setErrorCode(error.getString("code"));
            failure.setErrorStack(error.getString("stack"));
        }
        failure.setLastRetryAt(toInstant(document.getDate("lastRetryAt")));
        failure.setResolvedAt(toInstant(document.getDate("resolvedAt")));
        failure.setCreatedAt(toInstant(document.getDate("createdAt")));
        failure.setUpdatedAt(toInstant(document.getDate("updatedAt")));
        return failure;
    }

    private static Date toDate(LocalDate date) {
        return date != null ? Date.from(date.atStartOfDay(ZoneOffset.UTC).toInstant()) : null;
    }

    private static Date toDate(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
