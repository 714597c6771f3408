/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.mindscribe.exception.MindScribeException} and
 * carry a {@link com.phillippitts.mindscribe.domain.SessionErrorCode}, so the session controller can
 * turn any failure into a structured terminal event without inspecting exception types.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mindscribe.exception.DeviceUnavailableException} - no input
 *       device could be opened, or the device disappeared mid-recording</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.RecordingTooShortException} - stop arrived
 *       before the minimum recording length</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.SegmentSizeExceededException} - the split
 *       fallback cannot satisfy the provider ceiling</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.ProviderException} - one failed provider call,
 *       classified by {@link com.phillippitts.mindscribe.exception.ProviderErrorKind}</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.AllProvidersExhaustedException} - every
 *       provider used up its retry budget for a segment</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.PostProcessException} - cleanup pass failed
 *       (non-fatal)</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.SessionAlreadyActiveException} - rejected
 *       start command</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.AudioCompressionException} - encoder failure,
 *       recovered by splitting</li>
 *   <li>{@link com.phillippitts.mindscribe.exception.TranscriptionCancelledException} - pipeline
 *       abandoned because its session was cancelled</li>
 * </ul>
 *
 * @see com.phillippitts.mindscribe.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mindscribe.exception;
