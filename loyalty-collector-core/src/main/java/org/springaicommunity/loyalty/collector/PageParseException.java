package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.Nullable;

/**
 * The source returned a page that cannot be interpreted. Never retried: without a valid
 * cursor the pagination chain cannot continue.
 */
public class PageParseException extends CollectorException {

	public PageParseException(String message) {
		super(message);
	}

	public PageParseException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
