package org.springaicommunity.loyalty.collector;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One source entity as it will be written to the destination store.
 *
 * @param payload the raw record, kept as-is
 * @param ingestedAt ingestion time in Unix seconds, shared by every record of a batch
 */
public record IngestedRecord(JsonNode payload, long ingestedAt) {
}
