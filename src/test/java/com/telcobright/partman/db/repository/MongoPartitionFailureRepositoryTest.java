package com.telcobright.partman.db.repository;

import com.telcobright.partman.core.enums.FailureAction;
import com.telcobright.partman.core.enums.FailureStatus;
import com.telcobright.partman.db.entity.PartitionFailure;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MongoPartitionFailureRepository document mapping")
class MongoPartitionFailureRepositoryTest {

    @Test
    @DisplayName("Should nest error details and store the partition day at UTC midnight")
    void testDocumentLayout() {
        // Given
        PartitionFailure failure = new PartitionFailure();
        failure.setTableName("event_logs");
        failure.setPartitionName("p_20250618");
        failure.setPartitionDate(LocalDate.of(2025, 6, 18));
        failure.setAction(FailureAction.TRUNCATE);
        failure.setStatus(FailureStatus.RETRYING);
        failure.setErrorMessage("Lock wait timeout exceeded");
        failure.setErrorCode("1205");

        // When
        Document document = MongoPartitionFailureRepository.toDocument(failure);

        // Then
        assertThat(document.containsKey("_id")).isFalse();
        assertThat(document.getString("action")).isEqualTo("TRUNCATE");
        assertThat(document.getString("status")).isEqualTo("RETRYING");
        assertThat(document.getDate("partitionDate")).isEqualTo(Date.from(Instant.parse("2025-06-18T00:00:00Z")));
        assertThat(document.get("error", Document.class).getString("code")).isEqualTo("1205");
        assertThat(document.get("resolvedAt")).isNull();
    }

    @Test
    @DisplayName("Should fall back to the action's retry ceiling when maxRetry is absent")
    void testMissingMaxRetry() {
        Document document = new Document("_id", new ObjectId())
            .append("tableName", "event_logs")
            .append("partitionName", "p_20250101")
            .append("action", "DROP")
            .append("status", "PENDING");

        PartitionFailure failure = MongoPartitionFailureRepository.fromDocument(document);

        assertThat(failure.getMaxRetry()).isEqualTo(5);
        assertThat(failure.getRetryCount()).isZero();
        assertThat(failure.getPartitionDate()).isNull();
        assertThat(failure.getErrorMessage()).isNull();
    }
}
