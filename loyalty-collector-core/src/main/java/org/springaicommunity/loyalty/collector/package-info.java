/**
 * Loyalty Collector core package.
 *
 * <p>
 * Rate-limited extraction of paginated loyalty customer profiles and concurrent batched
 * upload into an analytics store. This package is null-marked, meaning all reference
 * types are non-null by default unless explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.loyalty.collector;

import org.jspecify.annotations.NullMarked;
