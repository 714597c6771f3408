/**
 * Immutable domain models shared by capture, chunking, transcription and the session controller.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.mindscribe.domain.AudioBuffer} - finished recording with per-block
 *       amplitude</li>
 *   <li>{@link com.phillippitts.mindscribe.domain.AudioSegment} - size-bounded, indexed slice sent as
 *       one upload</li>
 *   <li>{@link com.phillippitts.mindscribe.domain.ProviderAttempt} - one provider call, for
 *       diagnostics</li>
 *   <li>{@link com.phillippitts.mindscribe.domain.TranscriptResult} - merged transcript with
 *       per-segment provider attribution</li>
 *   <li>{@link com.phillippitts.mindscribe.domain.SessionSnapshot} - copy of controller state read
 *       by observers</li>
 * </ul>
 */
package com.phillippitts.mindscribe.domain;
