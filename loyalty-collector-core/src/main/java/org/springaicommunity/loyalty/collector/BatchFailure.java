package org.springaicommunity.loyalty.collector;

/**
 * A batch that could not be uploaded.
 *
 * @param batchNumber the failed batch
 * @param recordCount number of records the batch held
 * @param error the terminal error
 */
public record BatchFailure(int batchNumber, int recordCount, Throwable error) {

	public String errorMessage() {
		return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
	}

}
