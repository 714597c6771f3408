package com.phillippitts.mindscribe.service.session.event;

import com.phillippitts.mindscribe.domain.SessionCommand;
import com.phillippitts.mindscribe.domain.SessionErrorCode;

import java.time.Instant;
import java.util.UUID;

/**
 * A command was refused without changing state (e.g. start while another session is active).
 *
 * @param command         the refused command
 * @param errorCode       why it was refused
 * @param activeSessionId session that was live at the time, if any
 * @param at              when the command was refused
 */
public record SessionCommandRejectedEvent(
        SessionCommand command,
        SessionErrorCode errorCode,
        UUID activeSessionId,
        Instant at
) {}
