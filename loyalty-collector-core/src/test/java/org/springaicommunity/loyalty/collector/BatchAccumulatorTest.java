package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link BatchAccumulator}.
 */
@DisplayName("BatchAccumulator Tests")
class BatchAccumulatorTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final List<Batch> sealed = new ArrayList<>();

	private BatchAccumulator accumulator(int maxBatchSize) {
		return new BatchAccumulator(maxBatchSize, new FixedBatchStrategy<>(), sealed::add,
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private List<JsonNode> records(int count) {
		List<JsonNode> records = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			records.add(objectMapper.createObjectNode().put("id", i));
		}
		return records;
	}

	@Nested
	@DisplayName("Sealing Tests")
	class SealingTest {

		@Test
		@DisplayName("Ten records with size four should produce batches of 4, 4 and 2")
		void shouldProduceFullBatchesAndRemainder() {
			BatchAccumulator accumulator = accumulator(4);

			accumulator.addAll(records(10));
			accumulator.finish();

			assertThat(sealed).extracting(Batch::size).containsExactly(4, 4, 2);
			assertThat(sealed).extracting(Batch::batchNumber).containsExactly(1, 2, 3);
			assertThat(accumulator.batchesSealed()).isEqualTo(3);
			assertThat(accumulator.recordsAccepted()).isEqualTo(10);
		}

		@Test
		@DisplayName("Should seal a batch as soon as it is full")
		void shouldSealWhenFull() {
			BatchAccumulator accumulator = accumulator(3);

			accumulator.addAll(records(3));

			assertThat(sealed).hasSize(1);
		}

		@Test
		@DisplayName("Should preserve arrival order across batches")
		void shouldPreserveOrder() {
			BatchAccumulator accumulator = accumulator(4);

			accumulator.addAll(records(10));
			accumulator.finish();

			List<Integer> ids = new ArrayList<>();
			sealed.forEach(batch -> batch.records().forEach(r -> ids.add(r.payload().get("id").asInt())));
			assertThat(ids).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
		}

		@Test
		@DisplayName("All records of a batch should share the sealing timestamp")
		void shouldStampRecordsAtSealTime() {
			BatchAccumulator accumulator = accumulator(2);

			accumulator.addAll(records(2));

			Batch batch = sealed.get(0);
			assertThat(batch.ingestedAt()).isEqualTo(NOW.getEpochSecond());
			assertThat(batch.records()).extracting(IngestedRecord::ingestedAt)
				.containsOnly(NOW.getEpochSecond());
		}

	}

	@Nested
	@DisplayName("Finish Tests")
	class FinishTest {

		@Test
		@DisplayName("Empty input should produce no batch")
		void emptyInputShouldProduceNoBatch() {
			BatchAccumulator accumulator = accumulator(4);

			accumulator.finish();

			assertThat(sealed).isEmpty();
			assertThat(accumulator.batchesSealed()).isZero();
		}

		@Test
		@DisplayName("Finish after an exact multiple should not emit an empty batch")
		void finishAfterExactMultipleShouldNotEmitEmptyBatch() {
			BatchAccumulator accumulator = accumulator(5);

			accumulator.addAll(records(10));
			accumulator.finish();

			assertThat(sealed).extracting(Batch::size).containsExactly(5, 5);
		}

		@Test
		@DisplayName("Finish should be idempotent and close the accumulator")
		void finishShouldBeIdempotent() {
			BatchAccumulator accumulator = accumulator(4);
			accumulator.addAll(records(1));

			accumulator.finish();
			accumulator.finish();

			assertThat(sealed).hasSize(1);
			assertThatIllegalStateException().isThrownBy(() -> accumulator.add(records(1).get(0)));
		}

		@Test
		@DisplayName("Should reject a non-positive batch size")
		void shouldRejectNonPositiveBatchSize() {
			assertThatIllegalArgumentException().isThrownBy(() -> accumulator(0));
		}

	}

}
