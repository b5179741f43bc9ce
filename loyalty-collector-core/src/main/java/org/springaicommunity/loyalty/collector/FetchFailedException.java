package org.springaicommunity.loyalty.collector;

/**
 * The fetch path failed, so the cursor chain could not be followed to its end.
 *
 * <p>
 * Everything read before the failure was still batched and uploaded; the outcome of those
 * uploads is available from {@link #getPartialResult()}.
 */
public class FetchFailedException extends CollectorException {

	private final PipelineResult partialResult;

	public FetchFailedException(String message, PipelineResult partialResult, Throwable cause) {
		super(message, cause);
		this.partialResult = partialResult;
	}

	public PipelineResult getPartialResult() {
		return partialResult;
	}

}
