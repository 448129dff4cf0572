/**
 * Exception hierarchy rooted at {@link com.phillippitts.callscribe.exception.CallScribeException}.
 *
 * <p>All exceptions are unchecked. Per-segment failures ({@code TranscriptionException},
 * {@code SegmentDecodeException}) are counted and isolated by the capture pipeline,
 * {@code SummarizationException} triggers the extractive fallback, and
 * {@code DeliveryException} only escapes the dispatcher for required targets.
 */
package com.phillippitts.callscribe.exception;
