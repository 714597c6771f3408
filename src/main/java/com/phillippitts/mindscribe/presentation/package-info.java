/**
 * Presentation layer (REST controllers and exception handling).
 *
 * <p>Presentation depends on the service layer, never the other way around. Controllers are thin
 * adapters that translate HTTP calls into {@link com.phillippitts.mindscribe.domain.SessionCommand}s.
 *
 * @see com.phillippitts.mindscribe.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mindscribe.presentation;
